package org.neuralchilli.stepgraph.domain;

import java.util.Optional;

/**
 * Result of validating a graph: valid, or the first defect found.
 */
public sealed interface ValidationResult {

    boolean isValid();

    Optional<String> defect();

    record Valid() implements ValidationResult {
        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public Optional<String> defect() {
            return Optional.empty();
        }
    }

    record Defect(String message) implements ValidationResult {
        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Optional<String> defect() {
            return Optional.of(message);
        }
    }

    static ValidationResult valid() {
        return new Valid();
    }

    static ValidationResult defect(String message) {
        return new Defect(message);
    }

    /**
     * Throw a structural error if this result is a defect.
     */
    default void orThrow() {
        defect().ifPresent(message -> {
            throw new GraphStructureException(message);
        });
    }
}

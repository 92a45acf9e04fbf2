package org.neuralchilli.stepgraph.config;

import java.util.Optional;

/**
 * Result of loading a graph file.
 * Either the graph was parsed and registered, or the file is reported with the reason it was rejected.
 */
public sealed interface LoadResult {

    /**
     * True if the graph was registered
     */
    boolean isSuccess();

    /**
     * The loaded graph name, or the file name if loading failed
     */
    String name();

    /**
     * Why the file was rejected, empty on success
     */
    Optional<String> error();

    /**
     * Graph parsed and registered under its name
     */
    record Success(String name) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    /**
     * File rejected, with the parse or validation message
     */
    record Failure(String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    /**
     * Create a success result
     */
    static LoadResult success(String name) {
        return new Success(name);
    }

    /**
     * Create a failure result from the exception that rejected the file.
     * Exceptions without a message are reported by type.
     */
    static LoadResult failure(String name, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new Failure(name, message);
    }
}

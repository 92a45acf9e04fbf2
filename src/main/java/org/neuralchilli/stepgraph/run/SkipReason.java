package org.neuralchilli.stepgraph.run;

/**
 * Why a step was skipped, declared from least to most severe.
 */
public enum SkipReason {
    /**
     * An upstream step was skipped for a non-failure reason
     */
    UPSTREAM_SKIPPED,

    /**
     * An optional output this step consumes was not emitted
     */
    OUTPUT_NOT_EMITTED,

    /**
     * The run was cancelled before the step finished
     */
    CANCELLED,

    /**
     * The run was aborted by an unrecoverable error
     */
    RUN_ABORTED,

    /**
     * An upstream step failed
     */
    UPSTREAM_FAILURE;

    /**
     * The reason a downstream step inherits from a step skipped for this reason.
     */
    public SkipReason propagated() {
        return switch (this) {
            case UPSTREAM_FAILURE, CANCELLED, RUN_ABORTED -> this;
            case UPSTREAM_SKIPPED, OUTPUT_NOT_EMITTED -> UPSTREAM_SKIPPED;
        };
    }

    /**
     * Whether a step skipped for this reason should be retried by a from-failure re-execution.
     */
    public boolean isFailureLike() {
        return this == UPSTREAM_FAILURE || this == CANCELLED || this == RUN_ABORTED;
    }

    public static SkipReason mostSevere(SkipReason a, SkipReason b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}

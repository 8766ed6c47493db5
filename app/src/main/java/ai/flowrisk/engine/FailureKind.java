package ai.flowrisk.engine;

import ai.flowrisk.cfg.BuildErrorKind;

/** Why a function or file produced no report. */
public enum FailureKind {
    PARSE_FAILURE,
    MALFORMED_INPUT,
    BREAK_OUTSIDE_BREAKABLE,
    CONTINUE_OUTSIDE_LOOP,
    UNRESOLVED_LABEL,
    INVARIANT_VIOLATION,
    CANCELLED,
    TIMEOUT,
    INTERNAL_ERROR;

    public static FailureKind of(BuildErrorKind kind) {
        return switch (kind) {
            case MALFORMED_INPUT -> MALFORMED_INPUT;
            case BREAK_OUTSIDE_BREAKABLE -> BREAK_OUTSIDE_BREAKABLE;
            case CONTINUE_OUTSIDE_LOOP -> CONTINUE_OUTSIDE_LOOP;
            case UNRESOLVED_LABEL -> UNRESOLVED_LABEL;
            case INVARIANT_VIOLATION -> INVARIANT_VIOLATION;
            case CANCELLED -> CANCELLED;
        };
    }
}

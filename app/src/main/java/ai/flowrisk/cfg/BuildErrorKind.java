package ai.flowrisk.cfg;

public enum BuildErrorKind {
    /** Language mismatch, unresolvable body handle, or a body containing parse errors. */
    MALFORMED_INPUT,
    BREAK_OUTSIDE_BREAKABLE,
    CONTINUE_OUTSIDE_LOOP,
    UNRESOLVED_LABEL,
    /** The finished graph failed validation. Indicates a builder defect rather than bad input. */
    INVARIANT_VIOLATION,
    CANCELLED
}

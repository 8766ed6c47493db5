package ai.flowrisk.profile;

public enum LoopKind {
    FOR,
    WHILE,
    FOREACH,
    /** Body runs before the condition is evaluated. */
    DO_WHILE,
    /** No header condition; the loop is left only by a jump. */
    INFINITE;

    public boolean bodyFirst() {
        return this == DO_WHILE;
    }
}

package ai.flowrisk.analyzer.cfg;

public enum NodeKind {
    ENTRY,
    BASIC,
    BRANCH,
    LOOP_HEADER,
    JOIN,
    EXIT,
    NON_STRUCTURED_EXIT
}

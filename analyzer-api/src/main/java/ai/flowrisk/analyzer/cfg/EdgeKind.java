package ai.flowrisk.analyzer.cfg;

/** Edge labels. The declaration order is the tie-breaker when edges between the same nodes are sorted. */
public enum EdgeKind {
    UNCONDITIONAL,
    TRUE,
    FALSE,
    CASE_MATCH,
    EXCEPTION
}

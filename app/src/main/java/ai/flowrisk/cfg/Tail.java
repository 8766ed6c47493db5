package ai.flowrisk.cfg;

import ai.flowrisk.analyzer.cfg.EdgeKind;
import org.jetbrains.annotations.Nullable;

/**
 * A position control can flow out of: a node plus the kind of the edge that will leave it. The builder cursor is
 * always a Tail; {@link #DEAD} marks an unreachable position.
 */
record Tail(int node, EdgeKind kind, @Nullable Integer caseIndex) {
    static final Tail DEAD = new Tail(CfgArena.DEAD, EdgeKind.UNCONDITIONAL, null);

    static Tail of(int node, EdgeKind kind) {
        return node < 0 ? DEAD : new Tail(node, kind, null);
    }

    static Tail of(int node) {
        return of(node, EdgeKind.UNCONDITIONAL);
    }

    static Tail caseMatch(int node, int caseIndex) {
        return node < 0 ? DEAD : new Tail(node, EdgeKind.CASE_MATCH, caseIndex);
    }

    boolean live() {
        return node >= 0;
    }
}

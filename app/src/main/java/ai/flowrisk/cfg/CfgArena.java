package ai.flowrisk.cfg;

import ai.flowrisk.analyzer.cfg.Cfg;
import ai.flowrisk.analyzer.cfg.CfgEdge;
import ai.flowrisk.analyzer.cfg.CfgNode;
import ai.flowrisk.analyzer.cfg.NodeKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable node/edge storage for one build. Nodes are addressed by dense int ids in creation order; the entry node is
 * created first and the exit node second so they always get ids 0 and 1.
 */
final class CfgArena {
    static final int DEAD = -1;

    private final List<NodeKind> kinds = new ArrayList<>();
    private final List<Integer> lines = new ArrayList<>();
    private final Set<CfgEdge> edges = new LinkedHashSet<>();
    private int[] inDegree = new int[16];

    CfgArena() {
        add(NodeKind.ENTRY, 0);
        add(NodeKind.EXIT, 0);
    }

    int add(NodeKind kind, int line) {
        int id = kinds.size();
        kinds.add(kind);
        lines.add(line);
        if (id >= inDegree.length) {
            inDegree = Arrays.copyOf(inDegree, inDegree.length * 2);
        }
        return id;
    }

    /** Adds an edge leaving {@code from}; a no-op when either end is unreachable. */
    void connect(Tail from, int to) {
        if (!from.live() || to < 0) {
            return;
        }
        var edge = new CfgEdge(from.node(), to, from.kind(), from.caseIndex());
        if (edges.add(edge)) {
            inDegree[to]++;
        }
    }

    int size() {
        return kinds.size();
    }

    NodeKind kind(int id) {
        return kinds.get(id);
    }

    int inDegree(int id) {
        return id < 0 ? 0 : inDegree[id];
    }

    /**
     * Removes nodes other than entry and exit that have no incoming edge (repeating until none is left), renumbers the
     * survivors densely in creation order and returns the frozen graph.
     */
    Frozen freeze() {
        int n = kinds.size();
        var alive = new boolean[n];
        Arrays.fill(alive, true);
        var degree = Arrays.copyOf(inDegree, n);
        var remaining = new ArrayList<>(edges);
        int pruned = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int id = 2; id < n; id++) {
                if (alive[id] && degree[id] == 0) {
                    alive[id] = false;
                    pruned++;
                    changed = true;
                    for (var e : remaining) {
                        if (e.from() == id && alive[e.to()]) {
                            degree[e.to()]--;
                        }
                    }
                }
            }
            if (changed) {
                remaining.removeIf(e -> !alive[e.from()] || !alive[e.to()]);
            }
        }

        var newId = new int[n];
        var nodes = new ArrayList<CfgNode>();
        for (int id = 0; id < n; id++) {
            if (alive[id]) {
                newId[id] = nodes.size();
                nodes.add(new CfgNode(nodes.size(), kinds.get(id), lines.get(id)));
            } else {
                newId[id] = DEAD;
            }
        }
        var frozenEdges = new ArrayList<CfgEdge>(remaining.size());
        for (var e : remaining) {
            frozenEdges.add(new CfgEdge(newId[e.from()], newId[e.to()], e.kind(), e.caseIndex()));
        }
        return new Frozen(new Cfg(nodes, frozenEdges, Cfg.ENTRY_ID, Cfg.EXIT_ID), pruned);
    }

    record Frozen(Cfg cfg, int prunedNodes) {}
}

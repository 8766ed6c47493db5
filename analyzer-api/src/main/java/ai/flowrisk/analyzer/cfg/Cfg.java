package ai.flowrisk.analyzer.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A frozen control-flow graph for one function. Node ids are dense and equal to their list index, the entry node is
 * always 0 and the exit node is always 1. Edges are kept sorted by (from, to, kind, caseIndex) so two graphs built
 * from the same input compare and serialize identically.
 */
public record Cfg(List<CfgNode> nodes, List<CfgEdge> edges, int entry, int exit) {
    public static final int ENTRY_ID = 0;
    public static final int EXIT_ID = 1;

    public Cfg {
        nodes = List.copyOf(nodes);
        var sorted = new ArrayList<>(edges);
        Collections.sort(sorted);
        edges = List.copyOf(sorted);
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() != i) {
                throw new IllegalArgumentException("Node ids must be dense; found id %d at index %d"
                        .formatted(nodes.get(i).id(), i));
            }
        }
        if (entry < 0 || entry >= nodes.size() || exit < 0 || exit >= nodes.size()) {
            throw new IllegalArgumentException("entry/exit out of range: " + entry + "/" + exit);
        }
        for (var e : edges) {
            if (e.from() < 0 || e.from() >= nodes.size() || e.to() < 0 || e.to() >= nodes.size()) {
                throw new IllegalArgumentException("Edge references unknown node: " + e);
            }
        }
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public CfgNode node(int id) {
        return nodes.get(id);
    }

    public List<CfgEdge> outgoing(int id) {
        return edges.stream().filter(e -> e.from() == id).toList();
    }

    public List<CfgEdge> incoming(int id) {
        return edges.stream().filter(e -> e.to() == id).toList();
    }

    public long countNodes(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).count();
    }
}

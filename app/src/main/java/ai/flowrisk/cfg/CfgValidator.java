package ai.flowrisk.cfg;

import ai.flowrisk.analyzer.cfg.Cfg;
import ai.flowrisk.analyzer.cfg.NodeKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/** Structural checks every finished flow graph must pass. */
public final class CfgValidator {
    private CfgValidator() {}

    /** Returns a description of each violated invariant; empty when the graph is well formed. */
    public static List<String> violations(Cfg cfg) {
        var problems = new ArrayList<String>();
        int n = cfg.nodeCount();
        long entries = cfg.countNodes(NodeKind.ENTRY);
        long exits = cfg.countNodes(NodeKind.EXIT);
        if (entries != 1) {
            problems.add("expected exactly one entry node, found " + entries);
        }
        if (exits != 1) {
            problems.add("expected exactly one exit node, found " + exits);
        }
        if (cfg.node(cfg.entry()).kind() != NodeKind.ENTRY) {
            problems.add("entry id " + cfg.entry() + " is not an ENTRY node");
        }
        if (cfg.node(cfg.exit()).kind() != NodeKind.EXIT) {
            problems.add("exit id " + cfg.exit() + " is not an EXIT node");
        }

        var inDegree = new int[n];
        var successors = new ArrayList<List<Integer>>(n);
        var predecessors = new ArrayList<List<Integer>>(n);
        for (int i = 0; i < n; i++) {
            successors.add(new ArrayList<>());
            predecessors.add(new ArrayList<>());
        }
        for (var e : cfg.edges()) {
            inDegree[e.to()]++;
            successors.get(e.from()).add(e.to());
            predecessors.get(e.to()).add(e.from());
        }
        if (inDegree[cfg.entry()] != 0) {
            problems.add("entry node has " + inDegree[cfg.entry()] + " incoming edges");
        }
        for (int i = 0; i < n; i++) {
            if (i != cfg.entry() && inDegree[i] == 0) {
                problems.add("node " + i + " (" + cfg.node(i).kind() + ") has no incoming edge");
            }
        }

        var forward = reach(cfg.entry(), successors, n);
        var backward = reach(cfg.exit(), predecessors, n);
        for (int i = 0; i < n; i++) {
            if (!forward[i]) {
                problems.add("node " + i + " is not reachable from entry");
            }
            if (!backward[i]) {
                problems.add("exit is not reachable from node " + i);
            }
        }
        return problems;
    }

    public static boolean isValid(Cfg cfg) {
        return violations(cfg).isEmpty();
    }

    private static boolean[] reach(int start, List<List<Integer>> adjacency, int n) {
        var seen = new boolean[n];
        var stack = new ArrayDeque<Integer>();
        stack.push(start);
        while (!stack.isEmpty()) {
            int id = stack.pop();
            if (seen[id]) continue;
            seen[id] = true;
            for (int next : adjacency.get(id)) {
                if (!seen[next]) {
                    stack.push(next);
                }
            }
        }
        return seen;
    }
}

package ai.flowrisk.cfg;

import ai.flowrisk.analyzer.CallSite;
import java.util.ArrayList;
import java.util.List;

/** Counters filled during the same traversal that builds the graph. */
final class MetricAccumulator {
    private int decisionPoints;
    private int depth;
    private int maxDepth;
    private int nonStructuredExits;
    private final List<CallSite> callSites = new ArrayList<>();

    void decisionPoint() {
        decisionPoints++;
    }

    void enterNesting() {
        depth++;
        maxDepth = Math.max(maxDepth, depth);
    }

    void leaveNesting() {
        depth--;
    }

    void nonStructuredExit() {
        nonStructuredExits++;
    }

    void call(CallSite site) {
        callSites.add(site);
    }

    int decisionPoints() {
        return decisionPoints;
    }

    int maxDepth() {
        return maxDepth;
    }

    int nonStructuredExits() {
        return nonStructuredExits;
    }

    List<CallSite> callSites() {
        return List.copyOf(callSites);
    }
}

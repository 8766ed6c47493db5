package ai.flowrisk.cfg;

import ai.flowrisk.analyzer.CallSite;
import ai.flowrisk.analyzer.cfg.Cfg;
import java.util.List;

/**
 * Output of one successful build: the frozen graph plus the counters gathered while building it.
 *
 * @param decisionPoints branch and arm count, including logical operators and ternaries
 * @param maxDepth deepest nesting of if/loop/switch/try
 */
public record BuildResult(
        Cfg cfg,
        int decisionPoints,
        int maxDepth,
        int nonStructuredExits,
        List<CallSite> callSites,
        List<BuildDiagnostic> diagnostics) {

    public BuildResult {
        callSites = List.copyOf(callSites);
        diagnostics = List.copyOf(diagnostics);
    }

    public int cyclomaticComplexity() {
        return 1 + decisionPoints;
    }

    public long diagnosticCount(BuildDiagnostic.Kind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).count();
    }
}

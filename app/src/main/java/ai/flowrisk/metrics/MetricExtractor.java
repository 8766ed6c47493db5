package ai.flowrisk.metrics;

import ai.flowrisk.analyzer.FunctionNode;
import ai.flowrisk.analyzer.RawMetrics;
import ai.flowrisk.cfg.BuildResult;

/** Turns the counters of a finished build into {@link RawMetrics}. Does not walk the tree again. */
public final class MetricExtractor {
    private MetricExtractor() {}

    public static RawMetrics extract(FunctionNode function, BuildResult result) {
        return new RawMetrics(
                result.cyclomaticComplexity(),
                result.maxDepth(),
                result.callSites().size(),
                result.nonStructuredExits(),
                function.span().lineCount());
    }
}

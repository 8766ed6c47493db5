package ai.flowrisk.config;

import ai.flowrisk.risk.RiskThresholds;
import ai.flowrisk.risk.ScoringWeights;

/**
 * Settings of one analysis run.
 *
 * @param workerThreads size of the build pool; 1 runs every build on the calling thread
 * @param buildTimeoutMillis per-function build budget; 0 disables the timeout
 * @param includeCfg whether reports carry the frozen flow graph of each function
 */
public record AnalysisConfig(
        ScoringWeights weights,
        RiskThresholds thresholds,
        int workerThreads,
        long buildTimeoutMillis,
        boolean includeCfg) {

    public static final long DEFAULT_BUILD_TIMEOUT_MILLIS = 10_000;

    public AnalysisConfig {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
        if (buildTimeoutMillis < 0) {
            throw new IllegalArgumentException("buildTimeoutMillis must be >= 0, got " + buildTimeoutMillis);
        }
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
                ScoringWeights.DEFAULT,
                RiskThresholds.DEFAULT,
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                DEFAULT_BUILD_TIMEOUT_MILLIS,
                false);
    }

    public AnalysisConfig withWorkerThreads(int workerThreads) {
        return new AnalysisConfig(weights, thresholds, workerThreads, buildTimeoutMillis, includeCfg);
    }

    public AnalysisConfig withBuildTimeoutMillis(long buildTimeoutMillis) {
        return new AnalysisConfig(weights, thresholds, workerThreads, buildTimeoutMillis, includeCfg);
    }

    public AnalysisConfig withIncludeCfg(boolean includeCfg) {
        return new AnalysisConfig(weights, thresholds, workerThreads, buildTimeoutMillis, includeCfg);
    }
}

package ai.flowrisk.risk;

import ai.flowrisk.analyzer.RawMetrics;

/**
 * Combines raw metrics into one score. Each metric is log-scaled as {@code ln(v + 1)} so that a single very large
 * value cannot dominate, multiplied by its weight and summed. Pure and stateless.
 */
public final class RiskScorer {
    private RiskScorer() {}

    public static ScoredFunction score(RawMetrics metrics, ScoringWeights weights, RiskThresholds thresholds) {
        var components = new RiskComponents(
                component(metrics.cc(), weights.cc()),
                component(metrics.nd(), weights.nd()),
                component(metrics.fo(), weights.fo()),
                component(metrics.ns(), weights.ns()));
        double score = components.total();
        return new ScoredFunction(metrics, components, score, thresholds.band(score));
    }

    public static ScoredFunction score(RawMetrics metrics) {
        return score(metrics, ScoringWeights.DEFAULT, RiskThresholds.DEFAULT);
    }

    private static double component(int value, double weight) {
        return Math.log(value + 1.0) * weight;
    }
}

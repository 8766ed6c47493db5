package ai.flowrisk.risk;

import ai.flowrisk.analyzer.RawMetrics;

public record ScoredFunction(RawMetrics metrics, RiskComponents components, double score, RiskBand band) {}

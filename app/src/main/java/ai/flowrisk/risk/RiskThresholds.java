package ai.flowrisk.risk;

/** Lower bounds of the MODERATE, HIGH and CRITICAL bands. */
public record RiskThresholds(double moderate, double high, double critical) {
    public static final RiskThresholds DEFAULT = new RiskThresholds(3.0, 6.0, 9.0);

    public RiskThresholds {
        if (!(moderate > 0 && moderate < high && high < critical) || !Double.isFinite(critical)) {
            throw new IllegalArgumentException(
                    "thresholds must be positive and strictly ascending, got %s/%s/%s".formatted(moderate, high, critical));
        }
    }

    public RiskBand band(double score) {
        if (score < moderate) {
            return RiskBand.LOW;
        }
        if (score < high) {
            return RiskBand.MODERATE;
        }
        if (score < critical) {
            return RiskBand.HIGH;
        }
        return RiskBand.CRITICAL;
    }
}

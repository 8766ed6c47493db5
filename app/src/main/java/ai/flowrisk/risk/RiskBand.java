package ai.flowrisk.risk;

public enum RiskBand {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL
}

package ai.flowrisk.risk;

/** Weighted contribution of each metric to the score. */
public record RiskComponents(double cc, double nd, double fo, double ns) {
    public double total() {
        return cc + nd + fo + ns;
    }
}

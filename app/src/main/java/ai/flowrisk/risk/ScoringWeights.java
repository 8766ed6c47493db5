package ai.flowrisk.risk;

/** Multipliers applied to the log-scaled metrics. LOC is reported but never weighted. */
public record ScoringWeights(double cc, double nd, double fo, double ns) {
    public static final ScoringWeights DEFAULT = new ScoringWeights(1.0, 0.8, 0.6, 0.7);

    public ScoringWeights {
        check("cc", cc);
        check("nd", nd);
        check("fo", fo);
        check("ns", ns);
    }

    private static void check(String name, double weight) {
        if (!Double.isFinite(weight) || weight < 0) {
            throw new IllegalArgumentException("weight " + name + " must be a finite non-negative number, got " + weight);
        }
    }
}

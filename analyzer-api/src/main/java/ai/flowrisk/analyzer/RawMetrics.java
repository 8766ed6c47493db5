package ai.flowrisk.analyzer;

/**
 * Per-function complexity measurements.
 *
 * @param cc cyclomatic complexity, always at least 1
 * @param nd maximum nesting depth of control constructs
 * @param fo fan-out, the number of call sites
 * @param ns non-structured exits
 * @param loc physical lines spanned by the function
 */
public record RawMetrics(int cc, int nd, int fo, int ns, int loc) {
    public RawMetrics {
        if (cc < 1) {
            throw new IllegalArgumentException("cc must be >= 1, got " + cc);
        }
        if (nd < 0 || fo < 0 || ns < 0) {
            throw new IllegalArgumentException("nd, fo and ns must be >= 0, got nd=%d fo=%d ns=%d".formatted(nd, fo, ns));
        }
        if (loc < 1) {
            throw new IllegalArgumentException("loc must be >= 1, got " + loc);
        }
    }
}

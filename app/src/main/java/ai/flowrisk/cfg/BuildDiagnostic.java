package ai.flowrisk.cfg;

/** A non-fatal observation made while building a flow graph. */
public record BuildDiagnostic(Kind kind, String message, int line) {
    public enum Kind {
        /** A label on a statement that is neither a loop nor a switch. */
        DISCARDED_LABEL,
        /** Statements following an unconditional jump; counted for metrics but given no nodes. */
        UNREACHABLE_CODE,
        /** Exceptional flow is approximated by edges from every statement of a try block. */
        EXCEPTION_APPROXIMATION,
        UNSUPPORTED_CONSTRUCT,
        /** Join nodes that ended with no incoming edge were removed. */
        PRUNED_NODES
    }

    @Override
    public String toString() {
        return kind + "@" + line + ": " + message;
    }
}

package ai.flowrisk.cfg;

/** Building the flow graph of one function failed. Never fatal for the rest of a run. */
public class CfgBuildException extends Exception {
    private final BuildErrorKind kind;
    private final int line;

    public CfgBuildException(BuildErrorKind kind, String message, int line) {
        super(message);
        this.kind = kind;
        this.line = line;
    }

    public CfgBuildException(BuildErrorKind kind, String message) {
        this(kind, message, 0);
    }

    public BuildErrorKind getKind() {
        return kind;
    }

    /** 1-based line of the offending construct, or 0 when the error is not tied to one. */
    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return "CfgBuildException[" + kind + (line > 0 ? " at line " + line : "") + "]: " + getMessage();
    }
}

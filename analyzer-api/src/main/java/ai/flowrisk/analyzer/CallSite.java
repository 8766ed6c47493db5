package ai.flowrisk.analyzer;

/**
 * One call expression inside a function body. {@code target} is the callee text exactly as written, or
 * {@code <anonymous>} when the callee is a function literal invoked in place.
 */
public record CallSite(String target, int line, int startByte) {}

package ai.flowrisk.analyzer;

/**
 * Addresses the body node of a function inside the parsed tree of its file. The handle carries no reference to the
 * tree itself so it can outlive a parse and be resolved against a cached tree later.
 */
public record BodyHandle(int startByte, int endByte, String nodeType) {}

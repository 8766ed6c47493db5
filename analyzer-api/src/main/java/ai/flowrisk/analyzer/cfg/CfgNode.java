package ai.flowrisk.analyzer.cfg;

/**
 * A node of a frozen flow graph. {@code line} is the 1-based source line the node was created for, or 0 for the
 * synthetic entry and exit nodes.
 */
public record CfgNode(int id, NodeKind kind, int line) {}

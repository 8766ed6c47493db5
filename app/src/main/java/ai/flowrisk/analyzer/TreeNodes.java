package ai.flowrisk.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Traversal helpers shared by discovery and the flow graph builder. */
public final class TreeNodes {
    private TreeNodes() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** 1-based line of the node's first byte. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based line of the node's last byte. */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    public static SourceSpan span(TSNode node) {
        return new SourceSpan(node.getStartByte(), node.getEndByte(), startLine(node), endLine(node));
    }

    public static boolean sameNode(@Nullable TSNode a, @Nullable TSNode b) {
        if (!isPresent(a) || !isPresent(b)) {
            return false;
        }
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    public static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /** All children (named or not) bound to {@code fieldName}, in source order. Some grammars repeat a field. */
    public static List<TSNode> childrenForField(TSNode node, String fieldName) {
        var result = new ArrayList<TSNode>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (fieldName.equals(node.getFieldNameForChild(i))) {
                var child = node.getChild(i);
                if (isPresent(child)) {
                    result.add(child);
                }
            }
        }
        return result;
    }

    /** Named children paired with the field name they are bound to, or null when unbound. */
    public static List<FieldedChild> namedChildrenWithFields(TSNode node) {
        var result = new ArrayList<FieldedChild>();
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child) && child.isNamed()) {
                result.add(new FieldedChild(node.getFieldNameForChild(i), child));
            }
        }
        return result;
    }

    public record FieldedChild(@Nullable String field, TSNode node) {}

    /**
     * Finds the node with exactly the given byte range and type, descending only into children that enclose the
     * range.
     */
    public static @Nullable TSNode findByRange(TSNode root, int startByte, int endByte, String type) {
        TSNode current = root;
        while (isPresent(current)) {
            if (current.getStartByte() == startByte && current.getEndByte() == endByte && type.equals(current.getType())) {
                return current;
            }
            TSNode next = null;
            for (int i = 0; i < current.getChildCount(); i++) {
                var child = current.getChild(i);
                if (isPresent(child) && child.getStartByte() <= startByte && endByte <= child.getEndByte()) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return null;
            }
            current = next;
        }
        return null;
    }

    /** Recursively finds all nodes matching the given predicate. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        findAllNodesRecursiveInternal(rootNode, predicate, results);
        return results;
    }

    private static void findAllNodesRecursiveInternal(
            @Nullable TSNode node, Predicate<TSNode> predicate, List<TSNode> results) {
        if (!isPresent(node)) {
            return;
        }
        if (predicate.test(node)) {
            results.add(node);
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            findAllNodesRecursiveInternal(node.getChild(i), predicate, results);
        }
    }

    /** Extracts trimmed node text. */
    public static String text(@Nullable TSNode node, SourceContent sourceContent) {
        if (!isPresent(node)) {
            return "";
        }
        return sourceContent.substringFrom(node).trim();
    }
}

package ai.flowrisk.discover;

import ai.flowrisk.analyzer.FunctionNode;
import ai.flowrisk.parse.ParsedTree;
import java.util.List;

/** Enumerates the functions of one parsed file. */
public interface FunctionDiscovery {
    /**
     * Returns every function with a body, nested ones included, ordered by start byte. Ids are
     * {@code (fileIndex, position in that order)}.
     */
    List<FunctionNode> discover(int fileIndex, ParsedTree tree);
}

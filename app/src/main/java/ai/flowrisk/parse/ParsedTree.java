package ai.flowrisk.parse;

import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.SourceContent;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * An immutable parse result. The tree is only read after parsing, so one instance is shared by every function of the
 * file across worker threads.
 */
public record ParsedTree(Language language, String contentHash, SourceContent source, TSTree tree) {
    public TSNode root() {
        return tree.getRootNode();
    }
}

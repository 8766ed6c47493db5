package ai.flowrisk.parse;

import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.SourceContent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRust;
import org.treesitter.TreeSitterTypescript;

/**
 * Parses with the bundled tree-sitter grammars. A {@link TSParser} is not thread-safe, so each call creates its own;
 * the resulting tree is safe to read concurrently.
 */
public final class TreeSitterSourceParser implements SourceParser {
    private static final Logger logger = LogManager.getLogger(TreeSitterSourceParser.class);

    @Override
    public ParsedTree parse(String contentHash, Language language, SourceContent source) throws ParseFailureException {
        var parser = new TSParser();
        try {
            parser.setLanguage(grammar(language));
            var tree = parser.parseString(null, source.text());
            if (tree == null || tree.getRootNode().isNull()) {
                throw new ParseFailureException(language, "Parser returned no tree");
            }
            logger.trace("Parsed {} bytes of {} ({})", source.byteLength(), language, contentHash);
            return new ParsedTree(language, contentHash, source, tree);
        } catch (RuntimeException e) {
            throw new ParseFailureException(language, "Failed to parse " + language + " source: " + e.getMessage(), e);
        }
    }

    static TSLanguage grammar(Language language) {
        return switch (language) {
            case JAVA -> new TreeSitterJava();
            case JAVASCRIPT -> new TreeSitterJavascript();
            case TYPESCRIPT -> new TreeSitterTypescript();
            case PYTHON -> new TreeSitterPython();
            case GO -> new TreeSitterGo();
            case RUST -> new TreeSitterRust();
        };
    }
}

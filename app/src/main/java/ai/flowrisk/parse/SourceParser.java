package ai.flowrisk.parse;

import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.SourceContent;

/** Turns source text into a syntax tree. Implementations must be callable from several threads at once. */
@FunctionalInterface
public interface SourceParser {
    ParsedTree parse(String contentHash, Language language, SourceContent source) throws ParseFailureException;
}

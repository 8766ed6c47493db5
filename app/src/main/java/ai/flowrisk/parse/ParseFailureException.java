package ai.flowrisk.parse;

import ai.flowrisk.analyzer.Language;

/** The parser could not produce a tree for a file. */
public class ParseFailureException extends Exception {
    private final Language language;

    public ParseFailureException(Language language, String message) {
        super(message);
        this.language = language;
    }

    public ParseFailureException(Language language, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
    }

    public Language getLanguage() {
        return language;
    }
}

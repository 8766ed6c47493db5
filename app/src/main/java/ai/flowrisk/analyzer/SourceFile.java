package ai.flowrisk.analyzer;

import java.nio.file.Path;

/** A source file queued for analysis. {@code path} is used for reporting and ordering only. */
public record SourceFile(Path path, Language language, String text) {

    public static SourceFile of(String path, Language language, String text) {
        return new SourceFile(Path.of(path), language, text);
    }
}

package ai.flowrisk.analyzer;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** The source languages the analyzer understands. Each value owns the file extensions mapped to it. */
public enum Language {
    JAVA("Java", List.of("java")),
    JAVASCRIPT("JavaScript", List.of("js", "mjs", "cjs", "jsx")),
    TYPESCRIPT("TypeScript", List.of("ts", "mts", "cts")),
    PYTHON("Python", List.of("py")),
    GO("Go", List.of("go")),
    RUST("Rust", List.of("rs"));

    private final String displayName;
    private final List<String> extensions;

    Language(String displayName, List<String> extensions) {
        this.displayName = displayName;
        this.extensions = extensions;
    }

    public String displayName() {
        return displayName;
    }

    public List<String> extensions() {
        return extensions;
    }

    public static Optional<Language> fromExtension(String extension) {
        var ext = extension.toLowerCase(Locale.ROOT);
        for (var language : values()) {
            if (language.extensions.contains(ext)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the language of a file from its extension. Declaration files ({@code .d.ts}) carry no function
     * bodies and are not claimed by any language.
     */
    public static Optional<Language> fromPath(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        var name = fileName.toString();
        if (name.endsWith(".d.ts")) {
            return Optional.empty();
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(name.substring(dot + 1));
    }

    @Override
    public String toString() {
        return displayName;
    }
}

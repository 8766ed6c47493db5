package ai.flowrisk.config;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** A configuration file could not be read or holds invalid values. */
public class ConfigException extends Exception {
    private final @Nullable Path source;

    public ConfigException(@Nullable Path source, String message) {
        super(source == null ? message : source + ": " + message);
        this.source = source;
    }

    public ConfigException(@Nullable Path source, String message, Throwable cause) {
        super(source == null ? message : source + ": " + message, cause);
        this.source = source;
    }

    public @Nullable Path getSource() {
        return source;
    }
}

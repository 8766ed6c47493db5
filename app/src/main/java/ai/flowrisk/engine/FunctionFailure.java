package ai.flowrisk.engine;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * A function (or, with a null {@code functionName} and {@link FailureKind#PARSE_FAILURE}, a whole file) that could not
 * be analyzed.
 */
public record FunctionFailure(Path path, @Nullable String functionName, int line, FailureKind kind, String message) {}

package ai.flowrisk.discover;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Reads suppression markers. A function is suppressed when the line directly above its first line is a line comment
 * of the form {@code // flowrisk-ignore} or {@code // flowrisk-ignore: reason} (with the language's comment prefix).
 */
public final class SuppressionExtractor {
    public static final String MARKER = "flowrisk-ignore";

    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    private final List<String> lines;

    public SuppressionExtractor(String source) {
        this.lines = LINE_SPLITTER.splitToList(source);
    }

    /**
     * @param startLine 1-based first line of the declaration
     * @return null when not suppressed, the empty string for a marker without reason, otherwise the reason
     */
    public @Nullable String reasonFor(int startLine, String commentPrefix) {
        if (startLine <= 1 || startLine - 1 > lines.size()) {
            return null;
        }
        var previous = CharMatcher.whitespace().trimFrom(lines.get(startLine - 2));
        if (!previous.startsWith(commentPrefix)) {
            return null;
        }
        var comment = CharMatcher.whitespace().trimLeadingFrom(previous.substring(commentPrefix.length()));
        if (!comment.startsWith(MARKER)) {
            return null;
        }
        var rest = comment.substring(MARKER.length());
        if (rest.isEmpty()) {
            return "";
        }
        if (rest.charAt(0) == ':') {
            return CharMatcher.whitespace().trimFrom(rest.substring(1));
        }
        // "flowrisk-ignored" or "flowrisk-ignore-next" are not markers
        return CharMatcher.whitespace().matches(rest.charAt(0)) ? "" : null;
    }
}

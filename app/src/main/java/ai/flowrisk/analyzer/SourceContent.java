package ai.flowrisk.analyzer;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. tree-sitter reports UTF-8 byte offsets, so every node-text lookup
 * goes through here instead of indexing the Java string directly.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
    }

    /** Creates a SourceContent for the given text, dropping a leading byte order mark. */
    public static SourceContent of(String src) {
        var stripped = !src.isEmpty() && src.charAt(0) == BOM ? src.substring(1) : src;
        return new SourceContent(stripped, stripped.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extracts the text between UTF-8 byte offsets [startByte, endByte).
     *
     * <p>Invalid ranges yield the empty string and a warning; an end past the buffer is truncated.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte >= utf8Bytes.length) {
            if (startByte > utf8Bytes.length) {
                log.warn("Start byte offset {} exceeds source byte length {}", startByte, utf8Bytes.length);
            }
            return "";
        }
        if (endByte > utf8Bytes.length) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, utf8Bytes.length);
            endByte = utf8Bytes.length;
        }
        int len = endByte - startByte;
        if (len == 0) return "";
        return new String(utf8Bytes, startByte, len, StandardCharsets.UTF_8);
    }

    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public String text() {
        return text;
    }

    public byte[] utf8Bytes() {
        return utf8Bytes;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + ']';
    }
}

package ai.flowrisk.analyzer;

/**
 * Location of a syntax element. Bytes are UTF-8 offsets into the file with an exclusive end; lines are 1-based and
 * inclusive.
 */
public record SourceSpan(int startByte, int endByte, int startLine, int endLine) {
    public SourceSpan {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid byte range [%d, %d)".formatted(startByte, endByte));
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range %d..%d".formatted(startLine, endLine));
        }
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean contains(SourceSpan other) {
        return startByte <= other.startByte && other.endByte <= endByte;
    }
}

package ai.flowrisk.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SourceContent byte slicing")
class SourceContentTest {

    @Test
    @DisplayName("Leading BOM is dropped before offsets are computed")
    void bomStripped() {
        var content = SourceContent.of("\uFEFFdef f(): pass");

        assertEquals("def f(): pass", content.text());
        assertArrayEquals("def f(): pass".getBytes(StandardCharsets.UTF_8), content.utf8Bytes());
        // offsets match what tree-sitter reports for the stripped text
        assertEquals("f", content.substringFromBytes(4, 5));
    }

    @Test
    @DisplayName("Multi-byte characters are sliced by byte offset")
    void multiByte() {
        // "naïve" is 6 bytes: n a ï(2) v e
        var content = SourceContent.of("naïve = 1");

        assertEquals(10, content.byteLength());
        assertEquals("naïve", content.substringFromBytes(0, 6));
        assertEquals("ïv", content.substringFromBytes(2, 5));
        assertEquals("😀", SourceContent.of("x = \"😀\"").substringFromBytes(5, 9));
    }

    @Test
    @DisplayName("Invalid ranges yield the empty string")
    void invalidRanges() {
        var content = SourceContent.of("return x;");

        assertEquals("", content.substringFromBytes(-1, 3));
        assertEquals("", content.substringFromBytes(4, 2));
        assertEquals("", content.substringFromBytes(3, 3));
        assertEquals("", content.substringFromBytes(content.byteLength(), content.byteLength() + 4));
        assertEquals("", content.substringFromBytes(50, 60));
    }

    @Test
    @DisplayName("An end past the buffer is truncated")
    void endTruncated() {
        var content = SourceContent.of("break;");

        assertEquals("reak;", content.substringFromBytes(1, 99));
    }

    @Test
    @DisplayName("Empty source")
    void empty() {
        var content = SourceContent.of("");

        assertEquals(0, content.byteLength());
        assertEquals("", content.substringFromBytes(0, 4));
    }
}

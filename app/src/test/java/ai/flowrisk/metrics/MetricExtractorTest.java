package ai.flowrisk.metrics;

import static org.junit.jupiter.api.Assertions.*;

import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.RawMetrics;
import ai.flowrisk.testutil.InlineSource;
import org.junit.jupiter.api.Test;

class MetricExtractorTest {

    @Test
    void extract_combinesBuildCountersWithSpan() throws Exception {
        var source = InlineSource.of(
                Language.PYTHON,
                """
                def walk(tree):
                    for node in tree:
                        if node.leaf:
                            emit(node)
                        elif node.skip:
                            continue
                        else:
                            walk(node.children)
                    return None
                """);
        var function = source.function("walk");

        var metrics = MetricExtractor.extract(function, source.build("walk"));

        assertEquals(new RawMetrics(4, 2, 2, 1, 9), metrics);
    }

    @Test
    void emptyFunction_hasMinimalMetrics() throws Exception {
        var source = InlineSource.of(Language.GO, "package main\n\nfunc noop() {}\n");
        var function = source.function("noop");

        var metrics = MetricExtractor.extract(function, source.build("noop"));

        assertEquals(new RawMetrics(1, 0, 0, 0, 1), metrics);
    }

    @Test
    void rawMetrics_rejectsImpossibleValues() {
        assertThrows(IllegalArgumentException.class, () -> new RawMetrics(0, 0, 0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RawMetrics(1, -1, 0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RawMetrics(1, 0, 0, 0, 0));
    }
}

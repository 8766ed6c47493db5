package ai.flowrisk.config;

import static org.junit.jupiter.api.Assertions.*;

import ai.flowrisk.risk.RiskThresholds;
import ai.flowrisk.risk.ScoringWeights;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @Test
    void emptyObject_yieldsDefaults() throws Exception {
        assertEquals(AnalysisConfig.defaults(), ConfigLoader.parse("{}"));
        assertEquals(AnalysisConfig.defaults(), ConfigLoader.parse("  "));
    }

    @Test
    void partialOverride_keepsOtherDefaults() throws Exception {
        var config = ConfigLoader.parse(
                """
                {
                  "weights": {"cc": 2.5},
                  "thresholds": {"critical": 12},
                  "workerThreads": 2,
                  "includeCfg": true
                }
                """);

        assertEquals(new ScoringWeights(2.5, 0.8, 0.6, 0.7), config.weights());
        assertEquals(new RiskThresholds(3.0, 6.0, 12.0), config.thresholds());
        assertEquals(2, config.workerThreads());
        assertEquals(AnalysisConfig.DEFAULT_BUILD_TIMEOUT_MILLIS, config.buildTimeoutMillis());
        assertTrue(config.includeCfg());
    }

    @Test
    void unknownField_isRejected() {
        var e = assertThrows(ConfigException.class, () -> ConfigLoader.parse("{\"weigths\": {}}"));
        assertTrue(e.getMessage().contains("malformed configuration"), e.getMessage());
    }

    @Test
    void descendingThresholds_areRejected() {
        var e = assertThrows(
                ConfigException.class,
                () -> ConfigLoader.parse("{\"thresholds\": {\"moderate\": 6, \"high\": 3}}"));
        assertTrue(e.getMessage().contains("strictly ascending"), e.getMessage());
    }

    @Test
    void outOfRangeValues_areAllReported() {
        var e = assertThrows(
                ConfigException.class,
                () -> ConfigLoader.parse("{\"weights\": {\"nd\": 11, \"fo\": -1}, \"workerThreads\": 0}"));
        var message = e.getMessage();
        assertTrue(message.contains("weight nd"), message);
        assertTrue(message.contains("weight fo"), message);
        assertTrue(message.contains("workerThreads"), message);
    }

    @Test
    void discover_readsProjectFile(@TempDir Path root) throws Exception {
        assertTrue(ConfigLoader.discover(root).isEmpty());

        Files.writeString(root.resolve(ConfigLoader.CONFIG_FILE_NAME), "{\"buildTimeoutMillis\": 0}");
        var config = ConfigLoader.discover(root).orElseThrow();

        assertEquals(0, config.buildTimeoutMillis());
    }

    @Test
    void load_reportsSourcePath(@TempDir Path root) throws IOException {
        var file = root.resolve("broken.json");
        Files.writeString(file, "{\"workerThreads\": ");

        var e = assertThrows(ConfigException.class, () -> ConfigLoader.load(file));
        assertEquals(file, e.getSource());
        assertTrue(e.getMessage().startsWith(file.toString()), e.getMessage());
    }

    @Test
    void missingFile_isConfigException(@TempDir Path root) {
        var e = assertThrows(ConfigException.class, () -> ConfigLoader.load(root.resolve("absent.json")));
        assertInstanceOf(IOException.class, e.getCause());
    }
}

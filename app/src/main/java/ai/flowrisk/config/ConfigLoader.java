package ai.flowrisk.config;

import ai.flowrisk.risk.RiskThresholds;
import ai.flowrisk.risk.ScoringWeights;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Reads {@link AnalysisConfig} from JSON. Every key is optional and falls back to {@link AnalysisConfig#defaults()};
 * unknown keys are rejected.
 *
 * <pre>{@code
 * {
 *   "weights": {"cc": 1.0, "nd": 0.8, "fo": 0.6, "ns": 0.7},
 *   "thresholds": {"moderate": 3.0, "high": 6.0, "critical": 9.0},
 *   "workerThreads": 4,
 *   "buildTimeoutMillis": 10000,
 *   "includeCfg": false
 * }
 * }</pre>
 */
public final class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE_NAME = ".flowrisk.json";
    static final double MAX_WEIGHT = 10.0;

    private static final ObjectMapper objectMapper =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ConfigLoader() {}

    record WeightsDto(@Nullable Double cc, @Nullable Double nd, @Nullable Double fo, @Nullable Double ns) {}

    record ThresholdsDto(@Nullable Double moderate, @Nullable Double high, @Nullable Double critical) {}

    record ConfigDto(
            @Nullable WeightsDto weights,
            @Nullable ThresholdsDto thresholds,
            @Nullable Integer workerThreads,
            @Nullable Long buildTimeoutMillis,
            @Nullable Boolean includeCfg) {}

    public static AnalysisConfig load(Path file) throws ConfigException {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigException(file, "cannot read configuration", e);
        }
        var config = parse(file, json);
        logger.debug("Loaded configuration from {}: {}", file, config);
        return config;
    }

    public static AnalysisConfig parse(String json) throws ConfigException {
        return parse(null, json);
    }

    /** Loads {@value #CONFIG_FILE_NAME} from the project root if present. */
    public static Optional<AnalysisConfig> discover(Path projectRoot) throws ConfigException {
        var file = projectRoot.resolve(CONFIG_FILE_NAME);
        if (!Files.isRegularFile(file)) {
            logger.debug("No {} in {}, using defaults", CONFIG_FILE_NAME, projectRoot);
            return Optional.empty();
        }
        return Optional.of(load(file));
    }

    private static AnalysisConfig parse(@Nullable Path source, String json) throws ConfigException {
        ConfigDto dto;
        try {
            dto = json.isBlank() ? null : objectMapper.readValue(json, ConfigDto.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException(source, "malformed configuration: " + e.getOriginalMessage(), e);
        }
        return merge(source, dto);
    }

    private static AnalysisConfig merge(@Nullable Path source, @Nullable ConfigDto dto) throws ConfigException {
        var defaults = AnalysisConfig.defaults();
        if (dto == null) {
            return defaults;
        }
        var problems = new ArrayList<String>();

        var dw = defaults.weights();
        var w = dto.weights();
        double cc = weight("cc", w == null ? null : w.cc(), dw.cc(), problems);
        double nd = weight("nd", w == null ? null : w.nd(), dw.nd(), problems);
        double fo = weight("fo", w == null ? null : w.fo(), dw.fo(), problems);
        double ns = weight("ns", w == null ? null : w.ns(), dw.ns(), problems);

        var dt = defaults.thresholds();
        var t = dto.thresholds();
        double moderate = orDefault(t == null ? null : t.moderate(), dt.moderate());
        double high = orDefault(t == null ? null : t.high(), dt.high());
        double critical = orDefault(t == null ? null : t.critical(), dt.critical());
        if (!(moderate > 0 && moderate < high && high < critical) || !Double.isFinite(critical)) {
            problems.add("thresholds must be positive and strictly ascending, got %s/%s/%s"
                    .formatted(moderate, high, critical));
        }

        int workers = dto.workerThreads() == null ? defaults.workerThreads() : dto.workerThreads();
        if (workers < 1) {
            problems.add("workerThreads must be >= 1, got " + workers);
        }
        long timeout = dto.buildTimeoutMillis() == null ? defaults.buildTimeoutMillis() : dto.buildTimeoutMillis();
        if (timeout < 0) {
            problems.add("buildTimeoutMillis must be >= 0, got " + timeout);
        }
        boolean includeCfg = dto.includeCfg() == null ? defaults.includeCfg() : dto.includeCfg();

        if (!problems.isEmpty()) {
            throw new ConfigException(source, String.join("; ", problems));
        }
        return new AnalysisConfig(
                new ScoringWeights(cc, nd, fo, ns),
                new RiskThresholds(moderate, high, critical),
                workers,
                timeout,
                includeCfg);
    }

    private static double weight(String name, @Nullable Double value, double fallback, List<String> problems) {
        if (value == null) {
            return fallback;
        }
        if (!(value >= 0 && value <= MAX_WEIGHT)) {
            problems.add("weight %s must be within [0, %s], got %s".formatted(name, MAX_WEIGHT, value));
            return fallback;
        }
        return value;
    }

    private static double orDefault(@Nullable Double value, double fallback) {
        return value == null ? fallback : value;
    }
}

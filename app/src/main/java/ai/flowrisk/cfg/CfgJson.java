package ai.flowrisk.cfg;

import ai.flowrisk.analyzer.cfg.Cfg;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.UncheckedIOException;

/**
 * JSON form of a frozen {@link Cfg}: {@code {"nodes":[...],"edges":[...],"entry":0,"exit":1}}. Nodes are in id order
 * and edges in their natural order, so equal graphs produce identical text.
 */
public final class CfgJson {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.INDENT_OUTPUT);

    private CfgJson() {}

    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }

    public static String toJson(Cfg cfg) {
        try {
            return OBJECT_MAPPER.writeValueAsString(cfg);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize flow graph", e);
        }
    }

    /**
     * Reads a graph written by {@link #toJson(Cfg)}. The graph is validated by the {@link Cfg} constructor.
     *
     * @throws JsonProcessingException when the text is not a well-formed graph
     */
    public static Cfg fromJson(String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(json, Cfg.class);
    }
}

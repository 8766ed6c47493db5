package ai.flowrisk.cfg;

import static org.junit.jupiter.api.Assertions.*;

import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.cfg.Cfg;
import ai.flowrisk.analyzer.cfg.CfgEdge;
import ai.flowrisk.analyzer.cfg.CfgNode;
import ai.flowrisk.analyzer.cfg.EdgeKind;
import ai.flowrisk.analyzer.cfg.NodeKind;
import ai.flowrisk.testutil.InlineSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import org.junit.jupiter.api.Test;

class CfgJsonTest {

    @Test
    void toJson_omitsCaseIndexOnPlainEdges() {
        var cfg = new Cfg(
                List.of(new CfgNode(0, NodeKind.ENTRY, 0), new CfgNode(1, NodeKind.EXIT, 0)),
                List.of(CfgEdge.of(0, 1, EdgeKind.UNCONDITIONAL)),
                0,
                1);

        var json = CfgJson.toJson(cfg);

        assertTrue(json.contains("\"entry\":0"), json);
        assertTrue(json.contains("\"exit\":1"), json);
        assertFalse(json.contains("caseIndex"), json);
    }

    @Test
    void fromJson_readsBackBuiltGraph() throws Exception {
        var result = InlineSource.build(
                Language.JAVA,
                """
                class A {
                    int f(int k) {
                        switch (k) {
                            case 1: return 10;
                            case 2: return 20;
                            default: break;
                        }
                        try {
                            g();
                        } catch (Exception e) {
                            return -1;
                        }
                        return 0;
                    }
                }
                """,
                "f");

        var json = CfgJson.toJson(result.cfg());
        var read = CfgJson.fromJson(json);

        assertEquals(result.cfg(), read);
        assertEquals(json, CfgJson.toJson(read));
    }

    @Test
    void fromJson_rejectsEdgeToUnknownNode() {
        var json = """
                {"nodes":[{"id":0,"kind":"ENTRY","line":0},{"id":1,"kind":"EXIT","line":0}],
                 "edges":[{"from":0,"to":7,"kind":"UNCONDITIONAL"}],"entry":0,"exit":1}
                """;

        assertThrows(JsonProcessingException.class, () -> CfgJson.fromJson(json));
    }
}

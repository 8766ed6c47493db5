package ai.flowrisk.cfg;

import static org.junit.jupiter.api.Assertions.*;

import ai.flowrisk.analyzer.cfg.Cfg;
import ai.flowrisk.analyzer.cfg.CfgEdge;
import ai.flowrisk.analyzer.cfg.CfgNode;
import ai.flowrisk.analyzer.cfg.EdgeKind;
import ai.flowrisk.analyzer.cfg.NodeKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CfgValidatorTest {

    private static List<CfgNode> nodes(NodeKind... kinds) {
        var result = new ArrayList<CfgNode>();
        for (int i = 0; i < kinds.length; i++) {
            result.add(new CfgNode(i, kinds[i], i == 0 || i == 1 ? 0 : i));
        }
        return result;
    }

    @Test
    void diamond_isValid() {
        var cfg = new Cfg(
                nodes(NodeKind.ENTRY, NodeKind.EXIT, NodeKind.BRANCH, NodeKind.BASIC, NodeKind.BASIC, NodeKind.JOIN),
                List.of(
                        CfgEdge.of(0, 2, EdgeKind.UNCONDITIONAL),
                        CfgEdge.of(2, 3, EdgeKind.TRUE),
                        CfgEdge.of(2, 4, EdgeKind.FALSE),
                        CfgEdge.of(3, 5, EdgeKind.UNCONDITIONAL),
                        CfgEdge.of(4, 5, EdgeKind.UNCONDITIONAL),
                        CfgEdge.of(5, 1, EdgeKind.UNCONDITIONAL)),
                0,
                1);

        assertTrue(CfgValidator.isValid(cfg), () -> CfgValidator.violations(cfg).toString());
    }

    @Test
    void orphanNode_isReported() {
        var cfg = new Cfg(
                nodes(NodeKind.ENTRY, NodeKind.EXIT, NodeKind.JOIN),
                List.of(CfgEdge.of(0, 1, EdgeKind.UNCONDITIONAL), CfgEdge.of(2, 1, EdgeKind.UNCONDITIONAL)),
                0,
                1);

        var problems = CfgValidator.violations(cfg);
        assertTrue(problems.stream().anyMatch(p -> p.contains("no incoming edge")), problems.toString());
        assertTrue(problems.stream().anyMatch(p -> p.contains("not reachable from entry")), problems.toString());
    }

    @Test
    void deadEndCycle_cannotReachExit() {
        var cfg = new Cfg(
                nodes(NodeKind.ENTRY, NodeKind.EXIT, NodeKind.LOOP_HEADER, NodeKind.BASIC),
                List.of(
                        CfgEdge.of(0, 1, EdgeKind.UNCONDITIONAL),
                        CfgEdge.of(0, 2, EdgeKind.UNCONDITIONAL),
                        CfgEdge.of(2, 3, EdgeKind.TRUE),
                        CfgEdge.of(3, 2, EdgeKind.UNCONDITIONAL)),
                0,
                1);

        var problems = CfgValidator.violations(cfg);
        assertEquals(2, problems.size(), problems.toString());
        assertTrue(problems.contains("exit is not reachable from node 2"));
        assertTrue(problems.contains("exit is not reachable from node 3"));
    }

    @Test
    void edgeIntoEntry_isReported() {
        var cfg = new Cfg(
                nodes(NodeKind.ENTRY, NodeKind.EXIT, NodeKind.BASIC),
                List.of(
                        CfgEdge.of(0, 2, EdgeKind.UNCONDITIONAL),
                        CfgEdge.of(2, 0, EdgeKind.UNCONDITIONAL),
                        CfgEdge.of(2, 1, EdgeKind.UNCONDITIONAL)),
                0,
                1);

        assertEquals(List.of("entry node has 1 incoming edges"), CfgValidator.violations(cfg));
    }

    @Test
    void secondExitNode_isReported() {
        var cfg = new Cfg(
                nodes(NodeKind.ENTRY, NodeKind.EXIT, NodeKind.EXIT),
                List.of(CfgEdge.of(0, 1, EdgeKind.UNCONDITIONAL), CfgEdge.of(0, 2, EdgeKind.UNCONDITIONAL)),
                0,
                1);

        var problems = CfgValidator.violations(cfg);
        assertTrue(problems.contains("expected exactly one exit node, found 2"), problems.toString());
    }

    @Test
    void caseIndex_requiredExactlyOnCaseEdges() {
        assertThrows(IllegalArgumentException.class, () -> new CfgEdge(0, 1, EdgeKind.TRUE, 0));
        assertThrows(IllegalArgumentException.class, () -> new CfgEdge(0, 1, EdgeKind.CASE_MATCH, null));
    }
}

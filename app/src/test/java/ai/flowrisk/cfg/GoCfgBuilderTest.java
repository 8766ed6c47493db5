package ai.flowrisk.cfg;

import static ai.flowrisk.testutil.InlineSource.edges;
import static ai.flowrisk.testutil.InlineSource.nodesOf;
import static ai.flowrisk.testutil.InlineSource.target;
import static org.junit.jupiter.api.Assertions.*;

import ai.flowrisk.analyzer.Language;
import ai.flowrisk.analyzer.cfg.EdgeKind;
import ai.flowrisk.analyzer.cfg.NodeKind;
import ai.flowrisk.testutil.InlineSource;
import org.junit.jupiter.api.Test;

class GoCfgBuilderTest {

    private static BuildResult go(String functions, String name) throws CfgBuildException {
        return InlineSource.build(Language.GO, "package main\n\n" + functions, name);
    }

    @Test
    void tagelessSwitch_defaultAddsNoDecision() throws Exception {
        var result = go(
                """
                func classify(n int) string {
                	switch {
                	case n < 0:
                		return "neg"
                	case n == 0:
                		return "zero"
                	default:
                		return "pos"
                	}
                }
                """,
                "classify");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(1, result.maxDepth());
        assertEquals(3, result.nonStructuredExits());
        assertEquals(3, edges(result.cfg(), EdgeKind.CASE_MATCH).size());
    }

    @Test
    void rangeLoopWithContinue() throws Exception {
        var result = go(
                """
                func sum(xs []int) int {
                	total := 0
                	for _, x := range xs {
                		if x < 0 {
                			continue
                		}
                		total += x
                	}
                	return total
                }
                """,
                "sum");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(2, result.maxDepth());
        assertEquals(1, result.nonStructuredExits());

        var cfg = result.cfg();
        int header = nodesOf(cfg, NodeKind.LOOP_HEADER).get(0);
        int branch = nodesOf(cfg, NodeKind.BRANCH).get(0);
        assertEquals(header, target(cfg, branch, EdgeKind.TRUE));
    }

    @Test
    void bareFor_isInfiniteAndStillReachesExit() throws Exception {
        var result = go(
                """
                func spin(ch chan int) {
                	for {
                		v := <-ch
                		if v == 0 {
                			return
                		}
                	}
                }
                """,
                "spin");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(1, result.nonStructuredExits());
        var cfg = result.cfg();
        int header = nodesOf(cfg, NodeKind.LOOP_HEADER).get(0);
        assertEquals(cfg.exit(), target(cfg, header, EdgeKind.FALSE));
        assertEquals(1, result.diagnosticCount(BuildDiagnostic.Kind.PRUNED_NODES));
        assertTrue(CfgValidator.isValid(cfg));
    }

    @Test
    void panicCall_endsThePath() throws Exception {
        var result = go(
                """
                func must(err error) {
                	if err != nil {
                		panic(err)
                	}
                }
                """,
                "must");

        assertEquals(2, result.cyclomaticComplexity());
        assertEquals(1, result.nonStructuredExits());
        assertEquals(1, result.callSites().size());

        var cfg = result.cfg();
        assertEquals(1, cfg.countNodes(NodeKind.NON_STRUCTURED_EXIT));
        int branch = nodesOf(cfg, NodeKind.BRANCH).get(0);
        int call = target(cfg, branch, EdgeKind.TRUE);
        int exitNode = target(cfg, call, EdgeKind.UNCONDITIONAL);
        assertEquals(NodeKind.NON_STRUCTURED_EXIT, cfg.node(exitNode).kind());
    }

    @Test
    void labeledBreak_leavesOuterLoop() throws Exception {
        var result = go(
                """
                func hasZero(grid [][]int) bool {
                	found := false
                outer:
                	for _, row := range grid {
                		for _, v := range row {
                			if v == 0 {
                				found = true
                				break outer
                			}
                		}
                	}
                	return found
                }
                """,
                "hasZero");

        var cfg = result.cfg();
        var headers = nodesOf(cfg, NodeKind.LOOP_HEADER);
        int outerJoin = target(cfg, headers.get(0), EdgeKind.FALSE);
        int branch = nodesOf(cfg, NodeKind.BRANCH).get(0);
        int assignment = target(cfg, branch, EdgeKind.TRUE);
        assertEquals(outerJoin, target(cfg, assignment, EdgeKind.UNCONDITIONAL));
        assertEquals(1, result.nonStructuredExits());
    }

    @Test
    void breakInsideSelect_leavesOnlyTheSelect() throws Exception {
        var result = go(
                """
                func pump(in chan int, quit chan bool) {
                	for {
                		select {
                		case v := <-in:
                			use(v)
                		case <-quit:
                			break
                		}
                	}
                }
                """,
                "pump");

        var cfg = result.cfg();
        int header = nodesOf(cfg, NodeKind.LOOP_HEADER).get(0);
        // the break ends the select, not the loop, so the loop never exits normally
        assertEquals(cfg.exit(), target(cfg, header, EdgeKind.FALSE));
        assertEquals(4, result.cyclomaticComplexity());
    }

    @Test
    void methodDeclaration_isDiscovered() throws Exception {
        var source = InlineSource.of(
                Language.GO,
                """
                package main

                type Stack struct{ items []int }

                func (s *Stack) Pop() (int, bool) {
                	if len(s.items) == 0 {
                		return 0, false
                	}
                	v := s.items[len(s.items)-1]
                	s.items = s.items[:len(s.items)-1]
                	return v, true
                }
                """);

        var pop = source.build("Pop");
        assertEquals(2, pop.cyclomaticComplexity());
        assertEquals(1, pop.nonStructuredExits());
        assertEquals(3, pop.callSites().size());
    }

    @Test
    void goroutineLiteral_isItsOwnFunction() throws Exception {
        var source = InlineSource.of(
                Language.GO,
                """
                package main

                func run(a, b bool) {
                	go func() {
                		if a && b {
                			foo()
                		}
                		bar()
                	}()
                }
                """);

        var run = source.build("run");
        assertEquals(1, run.cyclomaticComplexity());
        assertEquals(1, run.callSites().size());
        assertEquals("<anonymous>", run.callSites().get(0).target());

        assertEquals(2, source.functions().size());
        var literal = source.build(source.functions().get(1));
        assertEquals(3, literal.cyclomaticComplexity());
        assertEquals(1, literal.maxDepth());
        assertEquals(2, literal.callSites().size());
    }

    @Test
    void gotoStatement_isUnmodeled() throws Exception {
        var result = go(
                """
                func retry() {
                	n := 0
                again:
                	n++
                	if n < 3 {
                		goto again
                	}
                }
                """,
                "retry");

        assertEquals(1, result.diagnosticCount(BuildDiagnostic.Kind.UNSUPPORTED_CONSTRUCT));
        assertEquals(1, result.diagnosticCount(BuildDiagnostic.Kind.DISCARDED_LABEL));
        assertEquals(2, result.cyclomaticComplexity());
    }
}

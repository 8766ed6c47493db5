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

class PythonCfgBuilderTest {

    @Test
    void elifChain_countsEachCondition() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def grade(score):
                    if score >= 90:
                        return "A"
                    elif score >= 80:
                        return "B"
                    else:
                        return "C"
                """,
                "grade");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(1, result.maxDepth());
        assertEquals(3, result.nonStructuredExits());
        var branches = nodesOf(result.cfg(), NodeKind.BRANCH);
        assertEquals(branches.get(1), target(result.cfg(), branches.get(0), EdgeKind.FALSE));
    }

    @Test
    void forElse_elseRunsOnExhaustion() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def find(items, target):
                    for item in items:
                        if item == target:
                            break
                    else:
                        return None
                    return target
                """,
                "find");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(2, result.nonStructuredExits());

        var cfg = result.cfg();
        int header = nodesOf(cfg, NodeKind.LOOP_HEADER).get(0);
        int exhausted = target(cfg, header, EdgeKind.FALSE);
        assertEquals(NodeKind.NON_STRUCTURED_EXIT, cfg.node(exhausted).kind());
        assertTrue(CfgValidator.isValid(cfg));
    }

    @Test
    void booleanOperatorsAndConditionalExpression() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def check(a, b, c):
                    if a and b or c:
                        x = 1 if a else 2
                        return x
                    return 0
                """,
                "check");

        assertEquals(5, result.cyclomaticComplexity());
        assertEquals(1, result.nonStructuredExits());
    }

    @Test
    void matchStatement_wildcardIsDefault() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def http(status):
                    match status:
                        case 200:
                            return "ok"
                        case 404:
                            return "missing"
                        case _:
                            return "other"
                """,
                "http");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(1, result.maxDepth());
        assertEquals(3, edges(result.cfg(), EdgeKind.CASE_MATCH).size());
        int dispatch = nodesOf(result.cfg(), NodeKind.BRANCH).get(0);
        assertTrue(result.cfg().outgoing(dispatch).stream().noneMatch(e -> e.kind() == EdgeKind.FALSE));
    }

    @Test
    void matchGuard_isReportedAsUnsupported() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def sign(n):
                    match n:
                        case 0:
                            return 0
                        case x if x < 0:
                            return -1
                    return 1
                """,
                "sign");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(1, result.diagnosticCount(BuildDiagnostic.Kind.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void breakInsideMatch_leavesEnclosingLoop() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def consume(events):
                    for e in events:
                        match e:
                            case "stop":
                                break
                            case _:
                                handle(e)
                    finish()
                """,
                "consume");

        var cfg = result.cfg();
        int header = nodesOf(cfg, NodeKind.LOOP_HEADER).get(0);
        int loopJoin = target(cfg, header, EdgeKind.FALSE);
        int dispatch = nodesOf(cfg, NodeKind.BRANCH).get(0);
        var stopArm = cfg.outgoing(dispatch).stream()
                .filter(e -> e.kind() == EdgeKind.CASE_MATCH && e.caseIndex() == 0)
                .findFirst()
                .orElseThrow();
        assertEquals(loopJoin, stopArm.to());
    }

    @Test
    void tryExceptElse_twoHandlers() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def load(path):
                    try:
                        data = read(path)
                    except IOError:
                        data = None
                    except ValueError as err:
                        log(err)
                        data = None
                    else:
                        validate(data)
                    return data
                """,
                "load");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(1, result.maxDepth());
        assertEquals(2, edges(result.cfg(), EdgeKind.EXCEPTION).size());
        assertEquals(3, result.callSites().size());
        assertTrue(CfgValidator.isValid(result.cfg()));
    }

    @Test
    void comprehensionFilter_isUnmodeled() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def positives(xs):
                    return [x for x in xs if x > 0]
                """,
                "positives");

        assertEquals(1, result.cyclomaticComplexity());
        assertEquals(0, result.nonStructuredExits());
        assertEquals(1, result.diagnosticCount(BuildDiagnostic.Kind.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void nestedDef_isOpaque() throws Exception {
        var source = InlineSource.of(
                Language.PYTHON,
                """
                def outer(xs):
                    def helper(x):
                        if x:
                            return x
                        return 0
                    return [helper(x) for x in xs]
                """);

        var outer = source.build("outer");
        assertEquals(1, outer.cyclomaticComplexity());
        assertEquals(1, outer.callSites().size());
        assertEquals(2, source.build("helper").cyclomaticComplexity());
    }

    @Test
    void lambda_isMeasuredSeparately() throws Exception {
        var source = InlineSource.of(
                Language.PYTHON,
                """
                def oldest(people):
                    return max(people, key=lambda p: p.age if p.age else 0)
                """);

        var oldest = source.build("oldest");
        assertEquals(1, oldest.cyclomaticComplexity());
        assertEquals(1, oldest.callSites().size());

        assertEquals(2, source.functions().size());
        var lambda = source.build(source.functions().get(1));
        assertEquals(2, lambda.cyclomaticComplexity());
        assertEquals(0, lambda.nonStructuredExits());
    }

    @Test
    void raiseInWhileLoop_countsAsExit() throws Exception {
        var result = InlineSource.build(
                Language.PYTHON,
                """
                def wait(conn):
                    while not conn.ready():
                        if conn.closed:
                            raise RuntimeError("closed")
                        conn.poll()
                """,
                "wait");

        assertEquals(3, result.cyclomaticComplexity());
        assertEquals(2, result.maxDepth());
        assertEquals(1, result.nonStructuredExits());
        assertEquals(3, result.callSites().size());
    }
}

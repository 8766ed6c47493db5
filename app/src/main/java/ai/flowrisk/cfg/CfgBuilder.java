package ai.flowrisk.cfg;

import static ai.flowrisk.profile.ConstructCategory.*;

import ai.flowrisk.analyzer.CallSite;
import ai.flowrisk.analyzer.FunctionNode;
import ai.flowrisk.analyzer.SourceContent;
import ai.flowrisk.analyzer.TreeNodes;
import ai.flowrisk.analyzer.cfg.Cfg;
import ai.flowrisk.analyzer.cfg.EdgeKind;
import ai.flowrisk.analyzer.cfg.NodeKind;
import ai.flowrisk.parse.ParsedTree;
import ai.flowrisk.profile.LanguageProfile;
import ai.flowrisk.profile.LoopKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Builds the control-flow graph of one function body and accumulates its metric counters in the same traversal.
 *
 * <p>There is one builder for every language. All grammar knowledge comes from the {@link LanguageProfile}; the
 * builder itself only knows the generic construct categories.
 *
 * <p>The cursor is a {@link Tail}: the node control currently flows out of and the kind of the next edge. After an
 * unconditional jump the cursor is {@link Tail#DEAD}. Statements visited while dead still contribute to the metrics but
 * create no nodes or edges.
 *
 * <p>Instances hold per-build state and are used once; call {@link #build(FunctionNode, LanguageProfile, ParsedTree)}.
 */
public final class CfgBuilder {
    private static final Logger logger = LogManager.getLogger(CfgBuilder.class);

    private static final String CONSEQUENCE = "consequence";
    private static final String ALTERNATIVE = "alternative";
    private static final String BODY = "body";
    private static final String ANONYMOUS_CALLEE = "<anonymous>";

    private final FunctionNode function;
    private final LanguageProfile profile;
    private final SourceContent source;
    private final CfgArena arena = new CfgArena();
    private final MetricAccumulator metrics = new MetricAccumulator();
    private final List<BuildDiagnostic> diagnostics = new ArrayList<>();
    private final List<BreakableContext> breakables = new ArrayList<>();
    private final List<FinallyFrame> finallyFrames = new ArrayList<>();

    private Tail cursor = Tail.of(Cfg.ENTRY_ID);
    private @Nullable String pendingLabel;
    private @Nullable TSNode finalReturn;
    private boolean deadRegionReported;
    private Effects effects = new Effects();

    private CfgBuilder(FunctionNode function, LanguageProfile profile, SourceContent source) {
        this.function = function;
        this.profile = profile;
        this.source = source;
    }

    /**
     * Builds the graph for {@code function}, whose body must be part of {@code tree}.
     *
     * @throws CfgBuildException when the input is malformed, a jump has no valid target, the result fails validation,
     *     or the current thread is interrupted
     */
    public static BuildResult build(FunctionNode function, LanguageProfile profile, ParsedTree tree)
            throws CfgBuildException {
        if (profile.language() != function.language() || tree.language() != function.language()) {
            throw new CfgBuildException(
                    BuildErrorKind.MALFORMED_INPUT,
                    "Language mismatch: function %s, profile %s, tree %s"
                            .formatted(function.language(), profile.language(), tree.language()),
                    function.span().startLine());
        }
        var handle = function.body();
        var body = TreeNodes.findByRange(tree.root(), handle.startByte(), handle.endByte(), handle.nodeType());
        if (body == null) {
            throw new CfgBuildException(
                    BuildErrorKind.MALFORMED_INPUT,
                    "Body %s [%d, %d) not found in tree".formatted(handle.nodeType(), handle.startByte(), handle.endByte()),
                    function.span().startLine());
        }
        if (body.hasError()) {
            throw new CfgBuildException(
                    BuildErrorKind.MALFORMED_INPUT,
                    "Body of " + function.displayName() + " contains syntax errors",
                    function.span().startLine());
        }
        return new CfgBuilder(function, profile, tree.source()).run(body);
    }

    private BuildResult run(TSNode body) throws CfgBuildException {
        finalReturn = findFinalReturn(body);
        visit(body);
        arena.connect(cursor, Cfg.EXIT_ID);

        var frozen = arena.freeze();
        if (frozen.prunedNodes() > 0) {
            diagnostics.add(new BuildDiagnostic(
                    BuildDiagnostic.Kind.PRUNED_NODES,
                    frozen.prunedNodes() + " unreachable node(s) removed",
                    function.span().startLine()));
        }
        var cfg = frozen.cfg();
        var violations = CfgValidator.violations(cfg);
        if (!violations.isEmpty()) {
            logger.error(
                    "Invalid flow graph for {} {} at lines {}-{}: {}",
                    function.language(),
                    function.displayName(),
                    function.span().startLine(),
                    function.span().endLine(),
                    violations);
            throw new CfgBuildException(
                    BuildErrorKind.INVARIANT_VIOLATION,
                    String.join("; ", violations),
                    function.span().startLine());
        }
        logger.debug(
                "Built flow graph for {} {}: {} nodes, {} edges, {} decision points",
                function.language(),
                function.displayName(),
                cfg.nodeCount(),
                cfg.edgeCount(),
                metrics.decisionPoints());
        return new BuildResult(
                cfg,
                metrics.decisionPoints(),
                metrics.maxDepth(),
                metrics.nonStructuredExits(),
                metrics.callSites(),
                diagnostics);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Dispatch

    private void visit(TSNode node) throws CfgBuildException {
        checkCancelled(node);
        var type = node.getType();
        if (profile.is(COMMENT, type)) {
            return;
        }
        var category = profile.structuralCategory(type);
        if (category.isEmpty()) {
            visitSimple(node);
            return;
        }
        switch (category.get()) {
            case BLOCK -> visitStatements(statements(node));
            case IF -> visitIf(node);
            case LOOP -> visitLoop(node);
            case SWITCH -> visitSwitch(node);
            case TRY -> visitTry(node);
            case RETURN -> visitReturn(node);
            case THROW -> visitThrow(node);
            case BREAK -> visitBreak(node);
            case CONTINUE -> visitContinue(node);
            case LABELED_STATEMENT -> visitLabeled(node);
            case NESTED_FUNCTION -> emit(NodeKind.BASIC, node);
            default -> visitSimple(node);
        }
    }

    private void visitStatements(List<TSNode> statements) throws CfgBuildException {
        for (var statement : statements) {
            if (cursor.live()) {
                deadRegionReported = false;
            } else if (!deadRegionReported) {
                deadRegionReported = true;
                diagnostic(BuildDiagnostic.Kind.UNREACHABLE_CODE, "unreachable code", statement);
            }
            visit(statement);
        }
    }

    /**
     * A statement without control flow of its own. Constructs embedded in its expressions are hoisted (built first,
     * in source order); then the statement becomes one basic node.
     */
    private void visitSimple(TSNode node) throws CfgBuildException {
        var wrapped = soleStructuralChild(node);
        if (wrapped != null) {
            visit(wrapped);
            return;
        }
        var elseBlock = TreeNodes.field(node, ALTERNATIVE);
        if (elseBlock != null && profile.is(BLOCK, elseBlock)) {
            visitLetElse(node, elseBlock);
            return;
        }
        var fx = collect(List.of(node));
        emit(NodeKind.BASIC, node);
        applyEffects(fx, true, node);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Expression scanning

    /** Side effects found while scanning expressions that need graph wiring once the owning node exists. */
    private static final class Effects {
        boolean terminates;
        int conditionalExits;
    }

    private Effects collect(List<TSNode> nodes) throws CfgBuildException {
        var saved = effects;
        effects = new Effects();
        for (var n : nodes) {
            scan(n);
        }
        var result = effects;
        effects = saved;
        return result;
    }

    private void scan(TSNode node) throws CfgBuildException {
        checkCancelled(node);
        var type = node.getType();
        if (profile.is(COMMENT, type) || profile.is(NESTED_FUNCTION, type)) {
            return;
        }
        if (profile.structuralCategory(type).isPresent()) {
            visit(node);
            return;
        }
        if (profile.is(CALL, type)) {
            recordCall(node);
        }
        if (profile.is(LOGICAL_OP, type) && profile.isLogicalOperator(TreeNodes.text(TreeNodes.field(node, "operator"), source))) {
            metrics.decisionPoint();
        }
        if (profile.is(TERNARY, type)) {
            metrics.decisionPoint();
        }
        if (profile.is(UNMODELED, type)) {
            diagnostic(BuildDiagnostic.Kind.UNSUPPORTED_CONSTRUCT, type + " is not modeled", node);
        }
        for (var child : TreeNodes.namedChildren(node)) {
            scan(child);
        }
        if (profile.is(CONDITIONAL_EXIT, type)) {
            metrics.nonStructuredExit();
            effects.conditionalExits++;
        }
    }

    private void recordCall(TSNode call) {
        String callee = null;
        for (var fieldName : profile.calleeFields()) {
            var calleeNode = TreeNodes.field(call, fieldName);
            if (calleeNode != null) {
                callee = isFunctionLiteral(calleeNode) ? ANONYMOUS_CALLEE : TreeNodes.text(calleeNode, source);
                break;
            }
        }
        if (callee == null) {
            var children = TreeNodes.namedChildren(call);
            callee = children.isEmpty() ? call.getType() : TreeNodes.text(children.get(0), source);
        }
        var bareCallee = callee;
        var receiverField = profile.receiverField();
        if (receiverField.isPresent()) {
            var receiver = TreeNodes.field(call, receiverField.get());
            if (receiver != null) {
                callee = TreeNodes.text(receiver, source) + "." + callee;
            }
        }
        metrics.call(new CallSite(callee, TreeNodes.startLine(call), call.getStartByte()));
        if (profile.isPanicCallee(lastSegment(bareCallee))) {
            metrics.nonStructuredExit();
            effects.terminates = true;
        }
    }

    /** {@code go func() {...}()} and {@code (function () {...})()}: the callee is a function defined in place. */
    private boolean isFunctionLiteral(TSNode callee) {
        var node = callee;
        while (node.getType().startsWith("parenthesized")) {
            var inner = statements(node);
            if (inner.size() != 1) {
                return false;
            }
            node = inner.get(0);
        }
        return profile.is(FUNCTION, node);
    }

    private static String lastSegment(String callee) {
        int cut = Math.max(callee.lastIndexOf("::"), callee.lastIndexOf('.'));
        if (cut < 0) {
            return callee;
        }
        return callee.substring(callee.charAt(cut) == ':' ? cut + 2 : cut + 1);
    }

    /**
     * Wires exits found while scanning. Conditional exits leave from the node just created; a terminating call ends
     * the path when {@code allowTermination} is set.
     */
    private void applyEffects(Effects fx, boolean allowTermination, TSNode node) {
        if (!cursor.live()) {
            return;
        }
        for (int i = 0; i < fx.conditionalExits; i++) {
            int exit = arena.add(NodeKind.NON_STRUCTURED_EXIT, TreeNodes.startLine(node));
            arena.connect(cursor, exit);
            arena.connect(Tail.of(exit), Cfg.EXIT_ID);
        }
        if (fx.terminates && allowTermination) {
            int exit = emit(NodeKind.NON_STRUCTURED_EXIT, node);
            arena.connect(Tail.of(exit), Cfg.EXIT_ID);
            cursor = Tail.DEAD;
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // If / else

    private void visitIf(TSNode node) throws CfgBuildException {
        metrics.enterNesting();
        var tails = new ArrayList<Tail>();
        var falseTail = buildConditional(node, tails);
        tails.add(falseTail);
        metrics.leaveNesting();
        merge(tails, TreeNodes.endLine(node));
    }

    /**
     * Builds one condition of an if/else-if chain and recurses into its alternatives. Each further condition hangs
     * off the previous FALSE edge without adding nesting depth. Returns the FALSE tail left open by the chain.
     */
    private Tail buildConditional(TSNode node, List<Tail> tails) throws CfgBuildException {
        var header = childrenExcludingFields(node, Set.of(CONSEQUENCE, ALTERNATIVE));
        var fx = collect(header);
        int branch = emit(NodeKind.BRANCH, node);
        applyEffects(fx, false, node);
        metrics.decisionPoint();

        cursor = Tail.of(branch, EdgeKind.TRUE);
        var consequence = TreeNodes.field(node, CONSEQUENCE);
        if (consequence != null) {
            visit(consequence);
        }
        tails.add(cursor);

        var falseTail = Tail.of(branch, EdgeKind.FALSE);
        for (var alternative : TreeNodes.childrenForField(node, ALTERNATIVE)) {
            cursor = falseTail;
            var target = unwrapClause(alternative);
            if (target == null) {
                tails.add(cursor);
                falseTail = Tail.DEAD;
            } else if (profile.is(IF, target) || profile.is(ELSE_IF, target)) {
                falseTail = buildConditional(target, tails);
            } else {
                visit(target);
                tails.add(cursor);
                falseTail = Tail.DEAD;
            }
        }
        return falseTail;
    }

    /** {@code let PATTERN = VALUE else { ... };}: the else block runs when the pattern does not match. */
    private void visitLetElse(TSNode node, TSNode elseBlock) throws CfgBuildException {
        metrics.enterNesting();
        var fx = collect(childrenExcludingFields(node, Set.of(ALTERNATIVE)));
        int branch = emit(NodeKind.BRANCH, node);
        applyEffects(fx, false, node);
        metrics.decisionPoint();

        cursor = Tail.of(branch, EdgeKind.FALSE);
        visit(elseBlock);
        metrics.leaveNesting();
        var matched = Tail.of(branch, EdgeKind.TRUE);
        if (cursor.live()) {
            merge(List.of(matched, cursor), TreeNodes.endLine(node));
        } else {
            cursor = matched;
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Loops

    private void visitLoop(TSNode node) throws CfgBuildException {
        var loopKind = profile.loopKind(node.getType()).orElse(LoopKind.WHILE);
        var label = takeLabel(node);
        var body = TreeNodes.field(node, BODY);
        TSNode loopElse = null;
        for (var alternative : TreeNodes.childrenForField(node, ALTERNATIVE)) {
            if (profile.is(LOOP_ELSE, alternative)) {
                loopElse = alternative;
            }
        }
        var header = new ArrayList<TSNode>();
        for (var child : childrenExcludingFields(node, Set.of(BODY, ALTERNATIVE))) {
            if (!profile.is(INLINE_LABEL, child) && !"empty_statement".equals(child.getType())) {
                header.add(child);
            }
        }
        boolean infinite = loopKind == LoopKind.INFINITE || (loopKind == LoopKind.FOR && header.isEmpty());

        metrics.enterNesting();
        metrics.decisionPoint();
        if (loopKind.bodyFirst()) {
            buildBodyFirstLoop(node, body, header, label);
        } else {
            var fx = collect(header);
            int loopHeader = emit(NodeKind.LOOP_HEADER, node);
            applyEffects(fx, false, node);
            int join = loopHeader >= 0 ? arena.add(NodeKind.JOIN, TreeNodes.endLine(node)) : CfgArena.DEAD;

            breakables.add(BreakableContext.loop(join, loopHeader, label));
            cursor = Tail.of(loopHeader, EdgeKind.TRUE);
            if (body != null) {
                visit(body);
            }
            arena.connect(cursor, loopHeader);
            breakables.remove(breakables.size() - 1);

            if (!infinite) {
                cursor = Tail.of(loopHeader, EdgeKind.FALSE);
                if (loopElse != null) {
                    var elseBody = unwrapClause(loopElse);
                    if (elseBody != null) {
                        visit(elseBody);
                    }
                }
                arena.connect(cursor, join);
            }
            if (join >= 0 && arena.inDegree(join) == 0) {
                // never left normally; keep the loop connected to exit for abnormal termination
                arena.connect(Tail.of(loopHeader, EdgeKind.FALSE), Cfg.EXIT_ID);
            }
            cursor = arena.inDegree(join) > 0 ? Tail.of(join) : Tail.DEAD;
        }
        metrics.leaveNesting();
    }

    /** do/while: the body runs first, the header decides whether to repeat it. */
    private void buildBodyFirstLoop(TSNode node, @Nullable TSNode body, List<TSNode> header, @Nullable String label)
            throws CfgBuildException {
        int bodyEntry = emit(NodeKind.JOIN, node);
        int loopHeader = bodyEntry >= 0 ? arena.add(NodeKind.LOOP_HEADER, TreeNodes.endLine(node)) : CfgArena.DEAD;
        int join = loopHeader >= 0 ? arena.add(NodeKind.JOIN, TreeNodes.endLine(node)) : CfgArena.DEAD;

        breakables.add(BreakableContext.loop(join, loopHeader, label));
        if (body != null) {
            visit(body);
        }
        var fx = collect(header);
        arena.connect(cursor, loopHeader);
        breakables.remove(breakables.size() - 1);

        if (arena.inDegree(loopHeader) > 0) {
            cursor = Tail.of(loopHeader);
            applyEffects(fx, false, node);
            arena.connect(Tail.of(loopHeader, EdgeKind.TRUE), bodyEntry);
            arena.connect(Tail.of(loopHeader, EdgeKind.FALSE), join);
        }
        cursor = arena.inDegree(join) > 0 ? Tail.of(join) : Tail.DEAD;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Switch / match

    private void visitSwitch(TSNode node) throws CfgBuildException {
        boolean breakable = profile.breakableSwitch();
        var label = breakable ? pendingLabel : null;
        pendingLabel = null;

        var container = TreeNodes.field(node, BODY);
        if (container == null) {
            container = node;
        }
        var arms = new ArrayList<TSNode>();
        for (var child : TreeNodes.namedChildren(container)) {
            if (profile.is(CASE, child) || profile.is(DEFAULT_CASE, child)) {
                arms.add(child);
            }
        }
        var header = new ArrayList<TSNode>();
        for (var child : statements(node)) {
            if (!TreeNodes.sameNode(child, container) && !profile.is(CASE, child) && !profile.is(DEFAULT_CASE, child)) {
                header.add(child);
            }
        }

        metrics.enterNesting();
        var fx = collect(header);
        int dispatch = emit(NodeKind.BRANCH, node);
        applyEffects(fx, false, node);
        int join = dispatch >= 0 ? arena.add(NodeKind.JOIN, TreeNodes.endLine(node)) : CfgArena.DEAD;
        if (breakable) {
            breakables.add(BreakableContext.switchContext(join, label));
        }

        boolean hasDefault = false;
        for (int i = 0; i < arms.size(); i++) {
            var arm = splitArm(arms.get(i));
            if (arm.isDefault()) {
                hasDefault = true;
            } else {
                metrics.decisionPoint();
            }
            if (arm.guarded()) {
                diagnostic(BuildDiagnostic.Kind.UNSUPPORTED_CONSTRUCT, "case guard is not modeled", arms.get(i));
            }
            cursor = Tail.caseMatch(dispatch, i);
            collect(arm.header());
            visitStatements(arm.body());
            arena.connect(cursor, join);
        }

        if (breakable) {
            breakables.remove(breakables.size() - 1);
        }
        if (!hasDefault) {
            arena.connect(Tail.of(dispatch, EdgeKind.FALSE), join);
        }
        cursor = arena.inDegree(join) > 0 ? Tail.of(join) : Tail.DEAD;
        metrics.leaveNesting();
    }

    private record Arm(List<TSNode> header, List<TSNode> body, boolean isDefault, boolean guarded) {}

    private Arm splitArm(TSNode arm) {
        var header = new ArrayList<TSNode>();
        var body = new ArrayList<TSNode>();
        boolean guarded = false;
        for (var child : TreeNodes.namedChildrenWithFields(arm)) {
            var n = child.node();
            var field = child.field();
            if (profile.is(COMMENT, n)) {
                continue;
            }
            if ((field != null && profile.caseHeaderFields().contains(field)) || profile.is(CASE_LABEL, n)) {
                header.add(n);
            } else if (field != null && profile.guardFields().contains(field)) {
                guarded = true;
            } else {
                body.add(n);
            }
        }
        boolean isDefault = profile.is(DEFAULT_CASE, arm);
        for (var h : header) {
            if (profile.isDefaultLabel(TreeNodes.text(h, source))) {
                isDefault = true;
            }
            for (var guardField : profile.guardFields()) {
                if (TreeNodes.field(h, guardField) != null) {
                    guarded = true;
                }
            }
        }
        return new Arm(header, body, isDefault, guarded);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Try / catch / finally

    /** Jumps that must run an enclosing finally block before reaching their target. */
    private static final class FinallyFrame {
        final int breakableDepth;
        final List<PendingJump> jumps = new ArrayList<>();

        FinallyFrame(int breakableDepth) {
            this.breakableDepth = breakableDepth;
        }
    }

    private record PendingJump(Tail from, JumpTarget target) {}

    /** Where a jump goes: a breakable context by stack index, or out of the function. */
    private record JumpTarget(int contextIndex, boolean isContinue) {
        static final JumpTarget EXIT = new JumpTarget(-1, false);

        boolean isExit() {
            return contextIndex < 0;
        }
    }

    private void visitTry(TSNode node) throws CfgBuildException {
        var body = TreeNodes.field(node, BODY);
        var catches = new ArrayList<TSNode>();
        TSNode finallyClause = null;
        TSNode tryElse = null;
        var header = new ArrayList<TSNode>();
        for (var child : statements(node)) {
            if (TreeNodes.sameNode(child, body)) {
                continue;
            }
            if (profile.is(CATCH, child)) {
                catches.add(child);
            } else if (profile.is(FINALLY, child)) {
                finallyClause = child;
            } else if (profile.is(TRY_ELSE, child)) {
                tryElse = child;
            } else {
                header.add(child);
            }
        }

        metrics.enterNesting();
        if (!catches.isEmpty()) {
            diagnostic(
                    BuildDiagnostic.Kind.EXCEPTION_APPROXIMATION,
                    "exception edges approximated from every statement of the try block",
                    node);
        }
        var fx = collect(header);
        applyEffects(fx, false, node);

        var origin = cursor;
        var frame = finallyClause != null ? new FinallyFrame(breakables.size()) : null;
        if (frame != null) {
            finallyFrames.add(frame);
        }

        int firstNode = arena.size();
        if (body != null) {
            visit(body);
        }
        var exceptionSources = new ArrayList<Integer>();
        for (int id = firstNode; id < arena.size(); id++) {
            if (arena.kind(id) != NodeKind.JOIN) {
                exceptionSources.add(id);
            }
        }
        if (exceptionSources.isEmpty() && origin.live()) {
            exceptionSources.add(origin.node());
        }

        if (tryElse != null) {
            var elseBody = unwrapClause(tryElse);
            if (elseBody != null) {
                visit(elseBody);
            }
        }
        var tails = new ArrayList<Tail>();
        tails.add(cursor);

        for (var catchClause : catches) {
            metrics.decisionPoint();
            int handler = CfgArena.DEAD;
            if (!exceptionSources.isEmpty()) {
                handler = arena.add(NodeKind.BASIC, TreeNodes.startLine(catchClause));
                for (int src : exceptionSources) {
                    arena.connect(Tail.of(src, EdgeKind.EXCEPTION), handler);
                }
            }
            cursor = Tail.of(handler);
            visitClauseBody(catchClause);
            tails.add(cursor);
        }

        if (frame == null) {
            metrics.leaveNesting();
            merge(tails, TreeNodes.endLine(node));
            return;
        }

        finallyFrames.remove(finallyFrames.size() - 1);
        var liveTails = tails.stream().filter(Tail::live).toList();
        boolean propagates = catches.isEmpty() && !exceptionSources.isEmpty();
        if (liveTails.isEmpty() && frame.jumps.isEmpty() && !propagates) {
            cursor = Tail.DEAD;
            visitClauseBody(finallyClause);
            metrics.leaveNesting();
            return;
        }

        int finallyEntry = arena.add(NodeKind.JOIN, TreeNodes.startLine(finallyClause));
        for (var tail : liveTails) {
            arena.connect(tail, finallyEntry);
        }
        for (var jump : frame.jumps) {
            arena.connect(jump.from(), finallyEntry);
        }
        if (propagates) {
            for (int src : exceptionSources) {
                arena.connect(Tail.of(src, EdgeKind.EXCEPTION), finallyEntry);
            }
        }
        cursor = Tail.of(finallyEntry);
        visitClauseBody(finallyClause);
        var finallyTail = cursor;

        if (finallyTail.live()) {
            var targets = new LinkedHashSet<JumpTarget>();
            for (var jump : frame.jumps) {
                targets.add(jump.target());
            }
            for (var target : targets) {
                cursor = finallyTail;
                route(target, finallyClause);
            }
            if (propagates) {
                int rethrow = arena.add(NodeKind.NON_STRUCTURED_EXIT, TreeNodes.endLine(finallyClause));
                arena.connect(finallyTail, rethrow);
                arena.connect(Tail.of(rethrow), Cfg.EXIT_ID);
            }
            cursor = liveTails.isEmpty() ? Tail.DEAD : finallyTail;
        }
        metrics.leaveNesting();
    }

    private void visitClauseBody(TSNode clause) throws CfgBuildException {
        var body = TreeNodes.field(clause, BODY);
        if (body != null) {
            visit(body);
            return;
        }
        var parts = new ArrayList<TSNode>();
        for (var child : statements(clause)) {
            if (profile.structuralCategory(child.getType()).isPresent()) {
                parts.add(child);
            } else {
                // catch parameters and exception types
                collect(List.of(child));
            }
        }
        visitStatements(parts);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Jumps

    private void visitReturn(TSNode node) throws CfgBuildException {
        var fx = collect(statements(node));
        applyEffects(fx, false, node);
        if (finalReturn != null && TreeNodes.sameNode(node, finalReturn) && finallyFrames.isEmpty()) {
            arena.connect(cursor, Cfg.EXIT_ID);
            cursor = Tail.DEAD;
            return;
        }
        metrics.nonStructuredExit();
        route(JumpTarget.EXIT, node);
    }

    private void visitThrow(TSNode node) throws CfgBuildException {
        var fx = collect(statements(node));
        applyEffects(fx, false, node);
        metrics.nonStructuredExit();
        int exit = emit(NodeKind.NON_STRUCTURED_EXIT, node);
        arena.connect(Tail.of(exit), Cfg.EXIT_ID);
        cursor = Tail.DEAD;
    }

    private void visitBreak(TSNode node) throws CfgBuildException {
        var label = labelOf(node);
        collect(nonLabelChildren(node));
        metrics.nonStructuredExit();
        int index;
        if (label != null) {
            index = findLabeled(label, node);
        } else if (breakables.isEmpty()) {
            throw new CfgBuildException(
                    BuildErrorKind.BREAK_OUTSIDE_BREAKABLE, "break outside loop or switch", TreeNodes.startLine(node));
        } else {
            index = breakables.size() - 1;
        }
        route(new JumpTarget(index, false), node);
    }

    private void visitContinue(TSNode node) throws CfgBuildException {
        var label = labelOf(node);
        metrics.nonStructuredExit();
        int index = -1;
        if (label != null) {
            index = findLabeled(label, node);
            if (!breakables.get(index).acceptsContinue()) {
                throw new CfgBuildException(
                        BuildErrorKind.CONTINUE_OUTSIDE_LOOP,
                        "continue targets non-loop label " + label,
                        TreeNodes.startLine(node));
            }
        } else {
            for (int i = breakables.size() - 1; i >= 0; i--) {
                if (breakables.get(i).acceptsContinue()) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                throw new CfgBuildException(
                        BuildErrorKind.CONTINUE_OUTSIDE_LOOP, "continue outside loop", TreeNodes.startLine(node));
            }
        }
        route(new JumpTarget(index, true), node);
    }

    private int findLabeled(String label, TSNode node) throws CfgBuildException {
        for (int i = breakables.size() - 1; i >= 0; i--) {
            if (label.equals(breakables.get(i).label())) {
                return i;
            }
        }
        throw new CfgBuildException(
                BuildErrorKind.UNRESOLVED_LABEL, "no enclosing loop or switch labeled " + label, TreeNodes.startLine(node));
    }

    /**
     * Sends control from the cursor to {@code target}. A jump that leaves a try block with a finally clause is parked
     * on that frame and re-routed from the end of the finally block. The cursor is dead afterwards.
     */
    private void route(JumpTarget target, TSNode node) {
        if (!cursor.live()) {
            return;
        }
        if (!finallyFrames.isEmpty()) {
            var frame = finallyFrames.get(finallyFrames.size() - 1);
            if (target.isExit() || target.contextIndex() < frame.breakableDepth) {
                frame.jumps.add(new PendingJump(cursor, target));
                cursor = Tail.DEAD;
                return;
            }
        }
        if (target.isExit()) {
            int exit = emit(NodeKind.NON_STRUCTURED_EXIT, node);
            arena.connect(Tail.of(exit), Cfg.EXIT_ID);
        } else {
            var context = breakables.get(target.contextIndex());
            arena.connect(cursor, target.isContinue() ? context.continueTarget() : context.breakTarget());
        }
        cursor = Tail.DEAD;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Labels

    private void visitLabeled(TSNode node) throws CfgBuildException {
        TSNode labelNode = TreeNodes.field(node, "label");
        TSNode body = TreeNodes.field(node, BODY);
        for (var child : statements(node)) {
            if (labelNode == null && profile.is(LABEL_NAME, child)) {
                labelNode = child;
            } else if (body == null && !TreeNodes.sameNode(child, labelNode)) {
                body = child;
            }
        }
        if (body == null) {
            return;
        }
        if (labelNode != null
                && (profile.is(LOOP, body) || (profile.is(SWITCH, body) && profile.breakableSwitch()))) {
            pendingLabel = TreeNodes.text(labelNode, source);
        } else {
            diagnostic(
                    BuildDiagnostic.Kind.DISCARDED_LABEL,
                    "label " + TreeNodes.text(labelNode, source) + " is not on a loop or switch",
                    node);
        }
        visit(body);
    }

    private @Nullable String takeLabel(TSNode loop) {
        var label = pendingLabel;
        pendingLabel = null;
        if (label != null) {
            return label;
        }
        for (var child : TreeNodes.namedChildren(loop)) {
            if (profile.is(INLINE_LABEL, child)) {
                return TreeNodes.text(child, source);
            }
        }
        return null;
    }

    private @Nullable String labelOf(TSNode jump) {
        var labelNode = TreeNodes.field(jump, "label");
        if (labelNode == null) {
            for (var child : TreeNodes.namedChildren(jump)) {
                if (profile.is(LABEL_NAME, child)) {
                    labelNode = child;
                    break;
                }
            }
        }
        return labelNode == null ? null : TreeNodes.text(labelNode, source);
    }

    private List<TSNode> nonLabelChildren(TSNode jump) {
        var result = new ArrayList<TSNode>();
        for (var child : statements(jump)) {
            if (!profile.is(LABEL_NAME, child)) {
                result.add(child);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Helpers

    private int emit(NodeKind kind, TSNode node) {
        if (!cursor.live()) {
            return CfgArena.DEAD;
        }
        int id = arena.add(kind, TreeNodes.startLine(node));
        arena.connect(cursor, id);
        cursor = Tail.of(id);
        return id;
    }

    private void merge(List<Tail> tails, int line) {
        var live = tails.stream().filter(Tail::live).toList();
        if (live.isEmpty()) {
            cursor = Tail.DEAD;
            return;
        }
        int join = arena.add(NodeKind.JOIN, line);
        for (var tail : live) {
            arena.connect(tail, join);
        }
        cursor = Tail.of(join);
    }

    /** Named, non-comment children. */
    private List<TSNode> statements(TSNode node) {
        var result = new ArrayList<TSNode>();
        for (var child : TreeNodes.namedChildren(node)) {
            if (!profile.is(COMMENT, child)) {
                result.add(child);
            }
        }
        return result;
    }

    private List<TSNode> childrenExcludingFields(TSNode node, Set<String> excluded) {
        var result = new ArrayList<TSNode>();
        for (var child : TreeNodes.namedChildrenWithFields(node)) {
            if ((child.field() == null || !excluded.contains(child.field())) && !profile.is(COMMENT, child.node())) {
                result.add(child.node());
            }
        }
        return result;
    }

    /** Unwraps an else-style clause to the statement it carries; other nodes are returned as-is. */
    private @Nullable TSNode unwrapClause(TSNode clause) {
        if (!profile.is(ELSE_CLAUSE, clause) && !profile.is(LOOP_ELSE, clause) && !profile.is(TRY_ELSE, clause)) {
            return clause;
        }
        var body = TreeNodes.field(clause, BODY);
        if (body != null) {
            return body;
        }
        var children = statements(clause);
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /** For wrapper statements such as {@code expression_statement} around a single control construct. */
    private @Nullable TSNode soleStructuralChild(TSNode node) {
        var type = node.getType();
        if (profile.is(CALL, type)
                || profile.is(LOGICAL_OP, type)
                || profile.is(TERNARY, type)
                || profile.is(CONDITIONAL_EXIT, type)
                || profile.is(UNMODELED, type)) {
            return null;
        }
        var children = statements(node);
        if (children.size() != 1) {
            return null;
        }
        var only = children.get(0);
        var category = profile.structuralCategory(only.getType());
        if (category.isEmpty() || category.get() == NESTED_FUNCTION || category.get() == BLOCK) {
            return null;
        }
        return only;
    }

    /** The lexically last top-level statement of the body when it is a return. */
    private @Nullable TSNode findFinalReturn(TSNode body) {
        var current = body;
        while (profile.is(BLOCK, current)) {
            var children = statements(current);
            if (children.isEmpty()) {
                return null;
            }
            current = children.get(children.size() - 1);
        }
        if (profile.is(RETURN, current)) {
            return current;
        }
        var children = statements(current);
        if (children.size() == 1 && profile.is(RETURN, children.get(0))) {
            return children.get(0);
        }
        return null;
    }

    private void diagnostic(BuildDiagnostic.Kind kind, String message, TSNode node) {
        diagnostics.add(new BuildDiagnostic(kind, message, TreeNodes.startLine(node)));
    }

    private void checkCancelled(TSNode node) throws CfgBuildException {
        if (Thread.currentThread().isInterrupted()) {
            throw new CfgBuildException(
                    BuildErrorKind.CANCELLED,
                    "Build of " + function.displayName() + " cancelled",
                    TreeNodes.startLine(node));
        }
    }
}

package sanalysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import syntax.AstNode;
import syntax.BreakNode;
import syntax.CatchHandler;
import syntax.ContinueNode;
import syntax.FunctionDefNode;
import syntax.IfNode;
import syntax.Language;
import syntax.LoopNode;
import syntax.RaiseNode;
import syntax.SequenceNode;
import syntax.SourceUnit;
import syntax.SwitchCase;
import syntax.SwitchNode;
import syntax.TryCatchNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the block graph of a single function from its statement tree.
 * <p>
 * Each statement is placed into the currently open block; a construct that
 * transfers control closes it and returns the block where execution
 * continues, or {@link #NONE} when control never falls out of it. Calls to
 * other functions stay call sites: nothing is inlined across functions.
 * The result is raw and still contains empty forwarding blocks; run it
 * through {@link GraphNormalizer} before rendering.
 */
public class CfgBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CfgBuilder.class);

    static final int NONE = -1;
    static final String EXIT_TEXT = "END";
    static final String LATCH_TEXT = "(end of iteration)";

    public ControlFlowGraph build(SourceUnit unit) throws StructuralException {
        return build(unit.getFunction(), unit.getLanguage());
    }

    public ControlFlowGraph build(FunctionDefNode function, Language language) throws StructuralException {
        Construction construction = new Construction(new ControlFlowGraph(function.getSignature(), language));
        ControlFlowGraph cfg = construction.run(function);
        logger.debug("Built raw graph for {}: {} blocks, {} edges",
                function.getSignature(), cfg.size(), cfg.getEdges().size());
        return cfg;
    }

    /** State of one build; the builder itself stays reusable. */
    private static final class Construction {
        private final ControlFlowGraph graph;
        private final Map<Integer, List<HandlerTarget>> guards = new TreeMap<>();

        Construction(ControlFlowGraph graph) {
            this.graph = graph;
        }

        ControlFlowGraph run(FunctionDefNode function) throws StructuralException {
            int entry = graph.addBlock(BlockShape.ENTRY, function.getText());
            int exit = graph.addBlock(BlockShape.EXIT, EXIT_TEXT);
            ConstructionContext ctx = ConstructionContext.forFunction(exit);

            int first = newBlock(ctx);
            graph.addEdge(entry, first, EdgeLabel.unconditional());
            int end = buildSequence(function.getBody(), first, ctx);
            if (end != NONE) {
                // falling off the end of the body returns implicitly
                graph.addEdge(end, exit, EdgeLabel.unconditional());
            }
            addExceptionEdges();
            return graph;
        }

        private int newBlock(ConstructionContext ctx) {
            return newBlock(BlockShape.LINEAR, null, ctx);
        }

        private int newBlock(BlockShape shape, String description, ConstructionContext ctx) {
            int index = graph.addBlock(shape, description);
            if (ctx.isGuarded()) {
                guards.put(index, ctx.getHandlers());
            }
            return index;
        }

        private void append(int block, AstNode node) {
            graph.getBlock(block).addNode(node);
        }

        private int buildSequence(SequenceNode sequence, int current, ConstructionContext ctx)
                throws StructuralException {
            boolean terminated = false;
            for (AstNode child : sequence.getChildren()) {
                if (current == NONE) {
                    if (!terminated) {
                        graph.addWarning(AnalysisWarning.deadCode(child.getBeginLine(),
                                "statement can never execute: " + firstLine(child.getText())));
                        terminated = true;
                    }
                    // keep building so that structural errors in dead code still surface
                    current = newBlock(ctx);
                }
                current = buildStatement(child, current, ctx);
            }
            return terminated ? NONE : current;
        }

        private int buildStatement(AstNode node, int current, ConstructionContext ctx) throws StructuralException {
            switch (node.getKind()) {
                case SEQUENCE:
                    return buildLabeledSequence((SequenceNode) node, current, ctx);
                case ASSIGN:
                case EXPR_STATEMENT:
                case FUNCTION_DEF:
                    append(current, node);
                    return current;
                case CALL:
                    return buildSingle(node, current, ctx, BlockShape.CALL_SITE);
                case YIELD:
                    return buildSingle(node, current, ctx, BlockShape.SUSPEND);
                case IF:
                    return buildIf((IfNode) node, current, ctx);
                case LOOP:
                    return buildLoop((LoopNode) node, current, ctx);
                case SWITCH:
                    return buildSwitch((SwitchNode) node, current, ctx);
                case TRY_CATCH:
                    return buildTry((TryCatchNode) node, current, ctx);
                case RETURN:
                    append(current, node);
                    graph.addEdge(current, ctx.getExitBlock(), EdgeLabel.returning());
                    return NONE;
                case BREAK:
                    return buildBreak((BreakNode) node, current, ctx);
                case CONTINUE:
                    return buildContinue((ContinueNode) node, current, ctx);
                case RAISE:
                    append(current, node);
                    if (!ctx.isGuarded()) {
                        graph.addEdge(current, ctx.getExitBlock(),
                                EdgeLabel.exceptionRaised(((RaiseNode) node).getExceptionKind()));
                    }
                    // inside a try the handler edges are added once the whole body is placed
                    return NONE;
                default:
                    throw new StructuralException(node, "unsupported statement kind");
            }
        }

        /** Call sites and suspension points get a block of their own. */
        private int buildSingle(AstNode node, int current, ConstructionContext ctx, BlockShape shape) {
            int site = current;
            if (!graph.getBlock(current).isEmpty()) {
                site = newBlock(ctx);
                graph.addEdge(current, site, EdgeLabel.unconditional());
            }
            graph.getBlock(site).setShape(shape);
            append(site, node);
            int next = newBlock(ctx);
            graph.addEdge(site, next, EdgeLabel.unconditional());
            return next;
        }

        private int buildLabeledSequence(SequenceNode sequence, int current, ConstructionContext ctx)
                throws StructuralException {
            if (sequence.getLabel() == null) {
                return buildSequence(sequence, current, ctx);
            }
            int after = newBlock(ctx);
            int end = buildSequence(sequence, current, ctx.withLabeledBlock(sequence.getLabel(), after));
            if (end != NONE) {
                graph.addEdge(end, after, EdgeLabel.unconditional());
            }
            return after;
        }

        /**
         * Block that will hold a branch condition. Under a try, statements already
         * in the current block stay in a block of their own so they keep their
         * handler edges; conditions are never guarded.
         */
        private int decisionBlock(int current, ConstructionContext ctx) {
            int decision = current;
            if (ctx.isGuarded() && !graph.getBlock(current).isEmpty()) {
                decision = newBlock(ctx);
                graph.addEdge(current, decision, EdgeLabel.unconditional());
            }
            graph.getBlock(decision).setShape(BlockShape.DECISION);
            return decision;
        }

        private int buildIf(IfNode ifNode, int block, ConstructionContext ctx) throws StructuralException {
            // 1. The condition closes the current block
            int current = decisionBlock(block, ctx);
            append(current, ifNode);

            // 2. True edge first, then false
            int thenStart = newBlock(ctx);
            graph.addEdge(current, thenStart, EdgeLabel.branchTrue());
            int join = newBlock(ctx);
            int elseStart = NONE;
            if (ifNode.hasElse()) {
                elseStart = newBlock(ctx);
                graph.addEdge(current, elseStart, EdgeLabel.branchFalse());
            } else {
                graph.addEdge(current, join, EdgeLabel.branchFalse());
            }

            // 3. Both branches meet again; a join nobody reaches is pruned later
            int thenEnd = buildSequence(ifNode.getThenBody(), thenStart, ctx);
            if (thenEnd != NONE) {
                graph.addEdge(thenEnd, join, EdgeLabel.unconditional());
            }
            if (elseStart != NONE) {
                int elseEnd = buildSequence(ifNode.getElseBody(), elseStart, ctx);
                if (elseEnd != NONE) {
                    graph.addEdge(elseEnd, join, EdgeLabel.unconditional());
                }
            }
            return join;
        }

        private int buildLoop(LoopNode loop, int current, ConstructionContext ctx) throws StructuralException {
            int header = newBlock(BlockShape.LOOP_HEADER, null, ctx);
            append(header, loop);
            int latch = newBlock(BlockShape.LOOP_LATCH, LATCH_TEXT, ctx);
            for (AstNode update : loop.getUpdate()) {
                append(latch, update);
            }
            int after = newBlock(ctx);
            ConstructionContext inner = ctx.withLoop(loop.getLabel(), latch, after);

            int bodyStart;
            if (loop.getLoopKind() == LoopNode.LoopKind.DO_WHILE) {
                // body runs once before the condition is tested
                bodyStart = newBlock(ctx);
                graph.addEdge(current, bodyStart, EdgeLabel.unconditional());
                graph.addEdge(header, bodyStart, EdgeLabel.unconditional());
                graph.addEdge(header, after, EdgeLabel.loopExit());
            } else {
                graph.addEdge(current, header, EdgeLabel.unconditional());
                bodyStart = newBlock(ctx);
                graph.addEdge(header, bodyStart, EdgeLabel.unconditional());
                if (loop.getElseBody() != null) {
                    // the else clause runs only on normal loop termination, break skips it
                    int elseStart = newBlock(ctx);
                    graph.addEdge(header, elseStart, EdgeLabel.loopExit());
                    int elseEnd = buildSequence(loop.getElseBody(), elseStart, ctx);
                    if (elseEnd != NONE) {
                        graph.addEdge(elseEnd, after, EdgeLabel.unconditional());
                    }
                } else {
                    graph.addEdge(header, after, EdgeLabel.loopExit());
                }
            }

            int bodyEnd = buildSequence(loop.getBody(), bodyStart, inner);
            if (bodyEnd != NONE) {
                graph.addEdge(bodyEnd, latch, EdgeLabel.unconditional());
            }
            graph.addEdge(latch, header, EdgeLabel.loopContinue());
            return after;
        }

        private int buildSwitch(SwitchNode switchNode, int block, ConstructionContext ctx)
                throws StructuralException {
            int after = newBlock(ctx);
            ConstructionContext inner = ctx.withSwitch(switchNode.getLabel(), after);
            if (!switchNode.hasValueCase()) {
                // nothing to decide: the header is a plain statement and the default body runs in line
                append(block, switchNode);
                int end = block;
                for (SwitchCase switchCase : switchNode.getCases()) {
                    end = buildSequence(switchCase.getBody(), end, inner);
                    if (end == NONE) {
                        break;
                    }
                }
                if (end != NONE) {
                    graph.addEdge(end, after, EdgeLabel.unconditional());
                }
                return after;
            }

            int current = decisionBlock(block, ctx);
            append(current, switchNode);

            List<SwitchCase> cases = switchNode.getCases();
            List<Integer> starts = new ArrayList<>();
            Set<EdgeLabel> seen = new HashSet<>();
            for (SwitchCase switchCase : cases) {
                int start = newBlock(ctx);
                starts.add(start);
                EdgeLabel label = switchCase.isDefault()
                        ? EdgeLabel.caseDefault()
                        : EdgeLabel.caseMatch(switchCase.getValue());
                // a repeated pattern can never match; its body is left for pruning
                if (seen.add(label)) {
                    graph.addEdge(current, start, label);
                }
            }
            if (!switchNode.hasDefault()) {
                graph.addEdge(current, after, EdgeLabel.caseDefault());
            }

            int pending = NONE;
            for (int i = 0; i < cases.size(); i++) {
                int start = starts.get(i);
                if (pending != NONE) {
                    graph.addEdge(pending, start, EdgeLabel.unconditional());
                    pending = NONE;
                }
                int end = buildSequence(cases.get(i).getBody(), start, inner);
                if (end == NONE) {
                    continue;
                }
                if (switchNode.isFallThrough() && i < cases.size() - 1) {
                    pending = end;
                } else {
                    graph.addEdge(end, after, EdgeLabel.unconditional());
                }
            }
            return after;
        }

        private int buildTry(TryCatchNode tryNode, int current, ConstructionContext ctx) throws StructuralException {
            // 1. Handler entries exist before the guarded body so guarded blocks can point at them
            List<HandlerTarget> targets = new ArrayList<>();
            for (CatchHandler handler : tryNode.getHandlers()) {
                targets.add(new HandlerTarget(newBlock(ctx), handler.getExceptionKind()));
            }
            ConstructionContext guarded = targets.isEmpty() ? ctx : ctx.withHandlers(targets);

            // 2. Guarded body, then the else clause on normal completion
            int bodyStart = newBlock(guarded);
            graph.addEdge(current, bodyStart, EdgeLabel.unconditional());
            int join = newBlock(ctx);
            int bodyEnd = buildSequence(tryNode.getBody(), bodyStart, guarded);
            if (bodyEnd != NONE && tryNode.getElseBody() != null) {
                int elseStart = newBlock(ctx);
                graph.addEdge(bodyEnd, elseStart, EdgeLabel.unconditional());
                bodyEnd = buildSequence(tryNode.getElseBody(), elseStart, ctx);
            }
            if (bodyEnd != NONE) {
                graph.addEdge(bodyEnd, join, EdgeLabel.unconditional());
            }

            // 3. Handlers run under the enclosing context
            List<CatchHandler> handlers = tryNode.getHandlers();
            for (int i = 0; i < handlers.size(); i++) {
                int handlerEnd = buildSequence(handlers.get(i).getBody(), targets.get(i).block, ctx);
                if (handlerEnd != NONE) {
                    graph.addEdge(handlerEnd, join, EdgeLabel.unconditional());
                }
            }

            // 4. Finally is joined from the normal path and every completing handler
            if (tryNode.getFinallyBody() != null) {
                return buildSequence(tryNode.getFinallyBody(), join, ctx);
            }
            return join;
        }

        private int buildBreak(BreakNode node, int current, ConstructionContext ctx) throws StructuralException {
            ConstructionContext.JumpFrame frame = ctx.breakFrame(node.getLabel()).orElseThrow(() ->
                    new StructuralException(node, node.getLabel() == null
                            ? "'break' outside loop"
                            : "undefined label '" + node.getLabel() + "'"));
            append(current, node);
            graph.addEdge(current, frame.breakTarget, frame.breakLabel());
            return NONE;
        }

        private int buildContinue(ContinueNode node, int current, ConstructionContext ctx)
                throws StructuralException {
            ConstructionContext.JumpFrame frame = ctx.continueFrame(node.getLabel()).orElseThrow(() ->
                    new StructuralException(node, node.getLabel() == null
                            ? "'continue' not properly in loop"
                            : "undefined label '" + node.getLabel() + "'"));
            append(current, node);
            graph.addEdge(current, frame.continueTarget, EdgeLabel.loopContinue());
            return NONE;
        }

        /**
         * Every non-empty straight-line block placed under a try may raise into
         * each of its handlers. A block left with two or more successors becomes
         * an exception guard.
         */
        private void addExceptionEdges() {
            for (Map.Entry<Integer, List<HandlerTarget>> entry : guards.entrySet()) {
                Block block = graph.getBlock(entry.getKey());
                BlockShape shape = block.getShape();
                if (block.isEmpty() || !(shape == BlockShape.LINEAR
                        || shape == BlockShape.CALL_SITE || shape == BlockShape.SUSPEND)) {
                    continue;
                }
                for (HandlerTarget handler : entry.getValue()) {
                    graph.addEdge(block.getIndex(), handler.block, EdgeLabel.exceptionRaised(handler.exceptionKind));
                }
                if (graph.outgoing(block.getIndex()).size() >= 2) {
                    block.setShape(BlockShape.EXCEPTION_GUARD);
                }
            }
        }

        private static String firstLine(String text) {
            int newline = text.indexOf('\n');
            return newline < 0 ? text : text.substring(0, newline);
        }
    }
}

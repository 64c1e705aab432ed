package sanalysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural rules of a normalized graph. A violation means the
 * builder or normalizer is wrong, not the input, so it is reported as an
 * {@link IllegalStateException}.
 */
public class GraphValidator {

    public void validate(ControlFlowGraph cfg) {
        List<String> problems = check(cfg);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid control flow graph for " + cfg.getSignature() + ": "
                    + String.join("; ", problems));
        }
    }

    /** All violations found, empty when the graph is well formed. */
    public List<String> check(ControlFlowGraph cfg) {
        List<String> problems = new ArrayList<>();
        int entries = 0;
        int exits = 0;
        for (Block block : cfg.getBlocks()) {
            if (block.getShape() == BlockShape.ENTRY) entries++;
            if (block.getShape() == BlockShape.EXIT) exits++;
        }
        if (entries != 1) problems.add("expected one Entry block, found " + entries);
        if (exits != 1) problems.add("expected one Exit block, found " + exits);
        if (!problems.isEmpty()) {
            return problems;
        }

        for (Edge edge : cfg.getEdges()) {
            if (edge.getFrom() < 0 || edge.getFrom() >= cfg.size() || edge.getTo() < 0 || edge.getTo() >= cfg.size()) {
                problems.add("edge " + edge + " points outside the block array");
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }

        if (!cfg.incoming(cfg.getEntryIndex()).isEmpty()) {
            problems.add("Entry block has incoming edges");
        }
        if (!cfg.outgoing(cfg.getExitIndex()).isEmpty()) {
            problems.add("Exit block has outgoing edges");
        }
        checkReachability(cfg, problems);
        for (Block block : cfg.getBlocks()) {
            checkSuccessors(cfg, block, problems);
        }
        return problems;
    }

    private void checkReachability(ControlFlowGraph cfg, List<String> problems) {
        Set<Integer> reached = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(cfg.getEntryIndex());
        reached.add(cfg.getEntryIndex());
        while (!stack.isEmpty()) {
            for (Edge edge : cfg.outgoing(stack.pop())) {
                if (reached.add(edge.getTo())) {
                    stack.push(edge.getTo());
                }
            }
        }
        for (Block block : cfg.getBlocks()) {
            if (block.getShape() != BlockShape.EXIT && !reached.contains(block.getIndex())) {
                problems.add("block " + block.getIndex() + " is unreachable from Entry");
            }
        }
    }

    private void checkSuccessors(ControlFlowGraph cfg, Block block, List<String> problems) {
        List<Edge> out = cfg.outgoing(block.getIndex());
        String where = "block " + block.getIndex() + " (" + block.getShape().getDisplayName() + ")";
        switch (block.getShape()) {
            case EXIT:
                return;
            case ENTRY:
            case LINEAR:
            case CALL_SITE:
            case SUSPEND:
                if (out.size() != 1) {
                    problems.add(where + " must have exactly one successor, has " + out.size());
                }
                return;
            case LOOP_LATCH:
                if (out.size() != 1 || out.get(0).getLabel().getKind() != EdgeLabel.Kind.LOOP_CONTINUE
                        || cfg.getBlock(out.get(0).getTo()).getShape() != BlockShape.LOOP_HEADER) {
                    problems.add(where + " must have a single LoopContinue edge to its header");
                }
                return;
            case LOOP_HEADER:
                checkLoopHeader(cfg, block, out, where, problems);
                return;
            case DECISION:
                checkDecision(out, where, problems);
                return;
            case EXCEPTION_GUARD:
                int raised = count(out, EdgeLabel.Kind.EXCEPTION_RAISED);
                if (out.size() < 2 || raised == 0 || out.size() - raised > 1) {
                    problems.add(where + " must have exception edges and at most one normal successor");
                }
                return;
            default:
                problems.add(where + " has an unknown shape");
        }
    }

    private void checkLoopHeader(ControlFlowGraph cfg, Block block, List<Edge> out, String where,
                                 List<String> problems) {
        if (out.size() != 2 || count(out, EdgeLabel.Kind.LOOP_EXIT) != 1
                || count(out, EdgeLabel.Kind.UNCONDITIONAL) != 1) {
            problems.add(where + " must have one body edge and one LoopExit edge");
        }
        int backEdges = 0;
        for (Edge edge : cfg.incoming(block.getIndex())) {
            if (edge.getLabel().getKind() == EdgeLabel.Kind.LOOP_CONTINUE) {
                backEdges++;
            }
        }
        if (backEdges > 1) {
            problems.add(where + " has " + backEdges + " LoopContinue back-edges");
        }
    }

    private void checkDecision(List<Edge> out, String where, List<String> problems) {
        if (out.size() < 2) {
            problems.add(where + " must have at least two successors");
            return;
        }
        int cases = count(out, EdgeLabel.Kind.CASE_MATCH);
        if (cases == 0) {
            if (out.size() != 2 || count(out, EdgeLabel.Kind.BRANCH_TRUE) != 1
                    || count(out, EdgeLabel.Kind.BRANCH_FALSE) != 1) {
                problems.add(where + " must have one BranchTrue and one BranchFalse edge");
            }
            return;
        }
        if (cases != out.size()) {
            problems.add(where + " mixes case edges with other labels");
        }
        Set<String> values = new HashSet<>();
        int defaults = 0;
        for (Edge edge : out) {
            if (edge.getLabel().isDefaultCase()) {
                defaults++;
            } else if (!values.add(edge.getLabel().getValue())) {
                problems.add(where + " has duplicate case " + edge.getLabel().getValue());
            }
        }
        if (defaults != 1) {
            problems.add(where + " must have exactly one default case edge");
        }
    }

    private static int count(List<Edge> edges, EdgeLabel.Kind kind) {
        int n = 0;
        for (Edge edge : edges) {
            if (edge.getLabel().getKind() == kind) {
                n++;
            }
        }
        return n;
    }
}

package sanalysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import syntax.AstNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a raw graph into its canonical form: empty forwarding blocks are
 * removed, unreachable blocks pruned, straight-line chains merged and
 * blocks renumbered in reverse postorder so that index and rank coincide.
 * The result is checked by {@link GraphValidator}.
 */
public class GraphNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(GraphNormalizer.class);

    private final boolean coalesce;
    private final GraphValidator validator = new GraphValidator();

    public GraphNormalizer() {
        this(true);
    }

    /** @param coalesce whether single-successor linear chains are merged into one block */
    public GraphNormalizer(boolean coalesce) {
        this.coalesce = coalesce;
    }

    public ControlFlowGraph normalize(ControlFlowGraph raw) {
        Working work = new Working(raw);
        work.removeEmptyForwarders();
        work.pruneUnreachable();
        if (coalesce) {
            work.coalesceChains();
        }
        ControlFlowGraph result = work.renumber();
        validator.validate(result);
        logger.debug("Normalized {}: {} -> {} blocks", raw.getSignature(), raw.size(), result.size());
        return result;
    }

    /** Mutable copy of the raw graph; the input graph is never modified. */
    private static final class Working {
        private final ControlFlowGraph raw;
        private final int entry;
        private final int exit;
        private final BlockShape[] shapes;
        private final List<List<AstNode>> nodes = new ArrayList<>();
        private final boolean[] alive;
        private List<Edge> edges;
        private final List<AnalysisWarning> warnings;

        Working(ControlFlowGraph raw) {
            this.raw = raw;
            this.entry = raw.getEntryIndex();
            this.exit = raw.getExitIndex();
            int n = raw.size();
            this.shapes = new BlockShape[n];
            this.alive = new boolean[n];
            for (Block block : raw.getBlocks()) {
                shapes[block.getIndex()] = block.getShape();
                nodes.add(new ArrayList<>(block.getNodes()));
                alive[block.getIndex()] = true;
            }
            this.edges = new ArrayList<>(raw.getEdges());
            this.warnings = new ArrayList<>(raw.getWarnings());
        }

        private List<Edge> outgoing(int block) {
            List<Edge> out = new ArrayList<>();
            for (Edge edge : edges) {
                if (edge.getFrom() == block) {
                    out.add(edge);
                }
            }
            return out;
        }

        private int incomingCount(int block) {
            int count = 0;
            for (Edge edge : edges) {
                if (edge.getTo() == block) {
                    count++;
                }
            }
            return count;
        }

        void removeEmptyForwarders() {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int i = 0; i < shapes.length; i++) {
                    if (!alive[i] || shapes[i] != BlockShape.LINEAR || !nodes.get(i).isEmpty()) {
                        continue;
                    }
                    List<Edge> out = outgoing(i);
                    if (out.size() != 1 || out.get(0).getLabel().getKind() != EdgeLabel.Kind.UNCONDITIONAL
                            || out.get(0).getTo() == i) {
                        continue;
                    }
                    int target = out.get(0).getTo();
                    List<Edge> rewritten = new ArrayList<>(edges.size());
                    for (Edge edge : edges) {
                        if (edge.getFrom() == i) {
                            continue;
                        }
                        rewritten.add(edge.getTo() == i ? edge.withTo(target) : edge);
                    }
                    edges = rewritten;
                    alive[i] = false;
                    changed = true;
                }
            }
        }

        void pruneUnreachable() {
            Set<Integer> reached = new HashSet<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(entry);
            reached.add(entry);
            while (!stack.isEmpty()) {
                int block = stack.pop();
                for (Edge edge : outgoing(block)) {
                    if (reached.add(edge.getTo())) {
                        stack.push(edge.getTo());
                    }
                }
            }

            for (int i = 0; i < shapes.length; i++) {
                if (!alive[i] || reached.contains(i) || i == exit) {
                    continue;
                }
                alive[i] = false;
                List<AstNode> dropped = nodes.get(i);
                if (!dropped.isEmpty()) {
                    AstNode first = dropped.get(0);
                    warnings.add(AnalysisWarning.unreachableBlock(first.getBeginLine(),
                            "block can never be reached: " + first.getText().split("\n", 2)[0]));
                }
            }
            List<Edge> kept = new ArrayList<>();
            for (Edge edge : edges) {
                if (alive[edge.getFrom()] && alive[edge.getTo()]) {
                    kept.add(edge);
                }
            }
            edges = kept;
        }

        /** A block with handler edges must not absorb statements placed before its try. */
        private boolean raises(int block) {
            for (Edge edge : outgoing(block)) {
                if (edge.getLabel().getKind() == EdgeLabel.Kind.EXCEPTION_RAISED) {
                    return true;
                }
            }
            return false;
        }

        void coalesceChains() {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int i = 0; i < shapes.length; i++) {
                    if (!alive[i] || shapes[i] != BlockShape.LINEAR) {
                        continue;
                    }
                    List<Edge> out = outgoing(i);
                    if (out.size() != 1 || out.get(0).getLabel().getKind() != EdgeLabel.Kind.UNCONDITIONAL) {
                        continue;
                    }
                    int next = out.get(0).getTo();
                    if (next == i || !alive[next] || shapes[next] != BlockShape.LINEAR || incomingCount(next) != 1
                            || raises(next)) {
                        continue;
                    }
                    nodes.get(i).addAll(nodes.get(next));
                    List<Edge> rewritten = new ArrayList<>(edges.size());
                    for (Edge edge : edges) {
                        if (edge.getFrom() == i) {
                            continue;
                        }
                        rewritten.add(edge.getFrom() == next ? edge.withFrom(i) : edge);
                    }
                    edges = rewritten;
                    alive[next] = false;
                    changed = true;
                }
            }
        }

        /**
         * Reverse postorder from Entry, visiting successors in reverse insertion
         * order so the first-inserted successor gets the smaller rank. Exit is
         * always ranked last.
         */
        private List<Integer> rankOrder() {
            List<Integer> postorder = new ArrayList<>();
            Set<Integer> visited = new HashSet<>();
            Deque<int[]> stack = new ArrayDeque<>();
            visited.add(entry);
            visited.add(exit);
            stack.push(new int[]{entry, 0});
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Edge> out = outgoing(frame[0]);
                if (frame[1] < out.size()) {
                    int successor = out.get(out.size() - 1 - frame[1]).getTo();
                    frame[1]++;
                    if (visited.add(successor)) {
                        stack.push(new int[]{successor, 0});
                    }
                } else {
                    stack.pop();
                    postorder.add(frame[0]);
                }
            }
            Collections.reverse(postorder);
            postorder.add(exit);
            return postorder;
        }

        ControlFlowGraph renumber() {
            List<Integer> order = rankOrder();
            int[] rankOf = new int[shapes.length];
            for (int r = 0; r < order.size(); r++) {
                rankOf[order.get(r)] = r;
            }

            ControlFlowGraph result = new ControlFlowGraph(raw.getSignature(), raw.getLanguage());
            for (int old : order) {
                result.addBlock(shapes[old], raw.getBlock(old).getDescription(), nodes.get(old));
            }
            List<Edge> renumbered = new ArrayList<>();
            for (Edge edge : edges) {
                renumbered.add(new Edge(rankOf[edge.getFrom()], rankOf[edge.getTo()], edge.getLabel()));
            }
            // stable: per-block successor order stays the insertion order
            renumbered.sort((a, b) -> Integer.compare(a.getFrom(), b.getFrom()));
            result.addEdges(renumbered);
            result.addWarnings(warnings);
            return result;
        }
    }
}

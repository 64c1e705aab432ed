package rendering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.Block;
import sanalysis.BlockShape;
import sanalysis.ControlFlowGraph;
import sanalysis.Edge;
import sanalysis.EdgeLabel;
import syntax.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders a normalized graph as text, one line per block:
 * <pre>[rank] Shape: statement text -> successor description</pre>
 * The Exit block gets no line of its own; edges into it read {@code exit}.
 * Output is a pure function of the graph and the bindings.
 */
public class PathRenderer {
    private static final Logger logger = LoggerFactory.getLogger(PathRenderer.class);

    static final String ARROW = " → ";
    static final String LINE_BREAK = "\\n";

    private final boolean includeHeader;
    private final boolean includeTestCases;

    public PathRenderer() {
        this(true, true);
    }

    public PathRenderer(boolean includeHeader, boolean includeTestCases) {
        this.includeHeader = includeHeader;
        this.includeTestCases = includeTestCases;
    }

    public RenderedPath render(ControlFlowGraph cfg) {
        return render(cfg, Collections.emptyList());
    }

    public RenderedPath render(ControlFlowGraph cfg, List<TestCaseBinding> testCases) {
        List<String> testLines = new ArrayList<>();
        if (includeTestCases) {
            for (TestCaseBinding binding : testCases) {
                testLines.add("Test case " + binding.getLabel() + ": " + escape(binding.getInput()));
            }
        }
        String header = includeHeader
                ? "G describes a control flow graph of Function `" + cfg.getSignature() + "`"
                : null;

        List<String> lines = new ArrayList<>();
        for (Block block : cfg.getBlocks()) {
            if (block.getShape() == BlockShape.EXIT) {
                continue;
            }
            lines.add("[" + block.getIndex() + "] " + block.getShape().getDisplayName() + ": "
                    + blockText(block) + " -> " + successors(cfg, block));
        }
        logger.debug("Rendered {} lines for {}", lines.size(), cfg.getSignature());
        return new RenderedPath(cfg.getSignature(), testLines, header, lines);
    }

    static String escape(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n").replace("\n", LINE_BREAK);
    }

    private static String blockText(Block block) {
        if (block.isEmpty()) {
            return escape(block.getDescription());
        }
        List<String> parts = new ArrayList<>();
        for (AstNode node : block.getNodes()) {
            parts.add(escape(node.getText()));
        }
        return String.join(LINE_BREAK, parts);
    }

    private static String successors(ControlFlowGraph cfg, Block block) {
        List<Edge> out = cfg.outgoing(block.getIndex());
        if (out.isEmpty()) {
            return "exit";
        }
        List<String> phrases = new ArrayList<>();
        for (Edge edge : out) {
            phrases.add(describe(cfg, block, edge));
        }
        return String.join("; ", phrases);
    }

    private static String describe(ControlFlowGraph cfg, Block block, Edge edge) {
        boolean toExit = edge.getTo() == cfg.getExitIndex();
        String target = toExit ? "exit" : "block " + edge.getTo();
        boolean backward = !toExit && edge.getTo() <= edge.getFrom();
        EdgeLabel label = edge.getLabel();
        switch (label.getKind()) {
            case UNCONDITIONAL:
                if (backward) {
                    return "return to " + target;
                }
                if (block.getShape() == BlockShape.LOOP_HEADER) {
                    return "each iteration" + ARROW + target;
                }
                if (block.getShape() == BlockShape.CALL_SITE) {
                    return "after call returns" + ARROW + target;
                }
                return target;
            case BRANCH_TRUE:
                return "if condition holds" + ARROW + target;
            case BRANCH_FALSE:
                return "otherwise" + ARROW + target;
            case CASE_MATCH:
                return label.isDefaultCase()
                        ? "if no case matches" + ARROW + target
                        : "if case " + escape(label.getValue()) + " matches" + ARROW + target;
            case EXCEPTION_RAISED:
                String kind = "*".equals(label.getValue()) ? "any exception" : label.getValue();
                return "if " + kind + " is raised" + ARROW + target;
            case LOOP_CONTINUE:
                return backward ? "return to " + target : "continue" + ARROW + target;
            case LOOP_EXIT:
                return block.getShape() == BlockShape.LOOP_HEADER
                        ? "when loop ends" + ARROW + target
                        : "break" + ARROW + target;
            case RETURN:
                return "return" + ARROW + target;
            case CALL_ENTER:
                return "call enters " + target;
            case CALL_RETURN:
                return "after call returns" + ARROW + target;
            default:
                return target;
        }
    }
}

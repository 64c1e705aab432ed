package sanalysis;

import syntax.AstNode;
import syntax.Language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Graph of {@link Block}s for one function. Blocks sit in a flat array and
 * edges refer to them by index, so the structure never holds object cycles.
 * Edges keep their insertion order, which fixes the order of each block's
 * successors.
 */
public class ControlFlowGraph {
    private final String signature;
    private final Language language;
    private final List<Block> blocks = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<AnalysisWarning> warnings = new ArrayList<>();
    private int entryIndex = -1;
    private int exitIndex = -1;

    public ControlFlowGraph(String signature, Language language) {
        this.signature = signature;
        this.language = language;
    }

    int addBlock(BlockShape shape, String description) {
        Block block = new Block(blocks.size(), shape, description);
        blocks.add(block);
        if (shape == BlockShape.ENTRY) {
            entryIndex = block.getIndex();
        } else if (shape == BlockShape.EXIT) {
            exitIndex = block.getIndex();
        }
        return block.getIndex();
    }

    int addBlock(BlockShape shape, String description, List<AstNode> nodes) {
        int index = addBlock(shape, description);
        blocks.get(index).addNodes(nodes);
        return index;
    }

    void addEdge(int from, int to, EdgeLabel label) {
        edges.add(new Edge(from, to, label));
    }

    void addEdges(List<Edge> more) {
        edges.addAll(more);
    }

    void addWarning(AnalysisWarning warning) {
        warnings.add(warning);
    }

    void addWarnings(List<AnalysisWarning> more) {
        warnings.addAll(more);
    }

    public String getSignature() {
        return signature;
    }

    public Language getLanguage() {
        return language;
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public Block getBlock(int index) {
        return blocks.get(index);
    }

    public int size() {
        return blocks.size();
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public int getEntryIndex() {
        return entryIndex;
    }

    public int getExitIndex() {
        return exitIndex;
    }

    public List<AnalysisWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** Outgoing edges of a block, in insertion order. */
    public List<Edge> outgoing(int index) {
        List<Edge> out = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getFrom() == index) {
                out.add(edge);
            }
        }
        return out;
    }

    public List<Edge> incoming(int index) {
        List<Edge> in = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getTo() == index) {
                in.add(edge);
            }
        }
        return in;
    }

    /** Multi-line dump of blocks and edges, for debug logging. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Blocks of ").append(signature).append(':').append(System.lineSeparator());
        for (Block block : blocks) {
            sb.append("  ").append(block.getIndex()).append(": ").append(block.getShape().getDisplayName());
            for (AstNode node : block.getNodes()) {
                sb.append(" | ").append(node.getText().replace("\n", " "));
            }
            sb.append(System.lineSeparator());
        }
        sb.append("Edges:").append(System.lineSeparator());
        for (Edge edge : edges) {
            sb.append("  ").append(edge).append(System.lineSeparator());
        }
        return sb.toString();
    }
}

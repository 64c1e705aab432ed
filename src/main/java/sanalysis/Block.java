package sanalysis;

import syntax.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line run of statements with a single entry. Blocks live in the
 * flat array of a {@link ControlFlowGraph} and are referenced by index only.
 */
public class Block {
    private final int index;
    private BlockShape shape;
    private final List<AstNode> nodes = new ArrayList<>();
    private final String description;

    Block(int index, BlockShape shape, String description) {
        this.index = index;
        this.shape = shape;
        this.description = description == null ? "" : description;
    }

    /** Position in the graph's block array; equals the rank once the graph is normalized. */
    public int getIndex() {
        return index;
    }

    public BlockShape getShape() {
        return shape;
    }

    void setShape(BlockShape shape) {
        this.shape = shape;
    }

    public List<AstNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    void addNode(AstNode node) {
        nodes.add(node);
    }

    void addNodes(List<AstNode> more) {
        nodes.addAll(more);
    }

    /** Text shown for blocks that hold no statements (Entry, Exit, an empty latch). */
    public String getDescription() {
        return description;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** First source line covered by the block, or 0. */
    public int getFirstLine() {
        return nodes.isEmpty() ? 0 : nodes.get(0).getBeginLine();
    }

    @Override
    public String toString() {
        return "Block" + index + "(" + shape.getDisplayName() + ", " + nodes.size() + " nodes)";
    }
}

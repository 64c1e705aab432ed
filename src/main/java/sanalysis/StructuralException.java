package sanalysis;

import syntax.AstNode;
import syntax.CfgAnalysisException;

/**
 * The statement tree has a shape the builder cannot place, such as a
 * {@code break} outside any loop. Points at a front-end or grammar gap.
 */
public class StructuralException extends CfgAnalysisException {
    private final transient AstNode node;
    private final String reason;

    public StructuralException(AstNode node, String reason) {
        super(node.getBeginLine(), reason + " (" + node.getKind() + " at line " + node.getBeginLine() + ")");
        this.node = node;
        this.reason = reason;
    }

    public AstNode getNode() {
        return node;
    }

    public String getReason() {
        return reason;
    }
}

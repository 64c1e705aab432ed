package syntax;

/**
 * Two-way branch. An {@code elif}/{@code else if} chain is an else sequence
 * holding a single nested IfNode.
 */
public class IfNode extends AstNode {
    private final String condition;
    private final SequenceNode thenBody;
    private final SequenceNode elseBody;

    public IfNode(int beginLine, int endLine, String text, String condition,
                  SequenceNode thenBody, SequenceNode elseBody) {
        super(beginLine, endLine, text);
        this.condition = condition;
        this.thenBody = thenBody;
        this.elseBody = elseBody;
    }

    public String getCondition() {
        return condition;
    }

    public SequenceNode getThenBody() {
        return thenBody;
    }

    /** @return the else sequence, or null when the statement has no else part */
    public SequenceNode getElseBody() {
        return elseBody;
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public Kind getKind() {
        return Kind.IF;
    }
}

package syntax;

public class BreakNode extends AstNode {
    private final String label;

    public BreakNode(int line, String text, String label) {
        super(line, line, text);
        this.label = label;
    }

    /** @return target label, or null for the innermost loop or switch */
    public String getLabel() {
        return label;
    }

    @Override
    public Kind getKind() {
        return Kind.BREAK;
    }
}

package syntax;

public class ContinueNode extends AstNode {
    private final String label;

    public ContinueNode(int line, String text, String label) {
        super(line, line, text);
        this.label = label;
    }

    /** @return target label, or null for the innermost loop */
    public String getLabel() {
        return label;
    }

    @Override
    public Kind getKind() {
        return Kind.CONTINUE;
    }
}

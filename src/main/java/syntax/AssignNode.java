package syntax;

public class AssignNode extends AstNode {
    private final String target;

    public AssignNode(int beginLine, int endLine, String text, String target) {
        super(beginLine, endLine, text);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGN;
    }
}

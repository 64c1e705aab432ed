package syntax;

public class ReturnNode extends AstNode {

    public ReturnNode(int beginLine, int endLine, String text) {
        super(beginLine, endLine, text);
    }

    @Override
    public Kind getKind() {
        return Kind.RETURN;
    }
}

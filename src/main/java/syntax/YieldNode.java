package syntax;

public class YieldNode extends AstNode {

    public YieldNode(int beginLine, int endLine, String text) {
        super(beginLine, endLine, text);
    }

    @Override
    public Kind getKind() {
        return Kind.YIELD;
    }
}

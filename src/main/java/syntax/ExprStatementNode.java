package syntax;

/** Opaque statement: anything the front end keeps without classifying further. */
public class ExprStatementNode extends AstNode {

    public ExprStatementNode(int beginLine, int endLine, String text) {
        super(beginLine, endLine, text);
    }

    @Override
    public Kind getKind() {
        return Kind.EXPR_STATEMENT;
    }
}

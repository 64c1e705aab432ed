package syntax;

/**
 * Statement-level call to a function defined in the same source text,
 * recursion included. The callee's graph is never inlined.
 */
public class CallNode extends AstNode {
    private final String callee;

    public CallNode(int beginLine, int endLine, String text, String callee) {
        super(beginLine, endLine, text);
        this.callee = callee;
    }

    public String getCallee() {
        return callee;
    }

    @Override
    public Kind getKind() {
        return Kind.CALL;
    }
}

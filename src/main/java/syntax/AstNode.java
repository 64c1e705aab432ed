package syntax;

/**
 * Base of the statement tree shared by both front ends.
 *
 * The set of variants is closed: the CFG builder switches over {@link Kind}
 * and rejects anything it does not know. Every node carries the source lines it
 * came from and its text exactly as written (for compound statements, only the
 * header, e.g. {@code if x > 0:} or {@code while (i < n)}).
 */
public abstract class AstNode {

    public enum Kind {
        SEQUENCE,
        IF,
        LOOP,
        RETURN,
        BREAK,
        CONTINUE,
        CALL,
        TRY_CATCH,
        RAISE,
        YIELD,
        ASSIGN,
        EXPR_STATEMENT,
        FUNCTION_DEF,
        SWITCH
    }

    private final int beginLine;
    private final int endLine;
    private final String text;

    protected AstNode(int beginLine, int endLine, String text) {
        this.beginLine = beginLine;
        this.endLine = endLine;
        this.text = text == null ? "" : text;
    }

    public abstract Kind getKind();

    public int getBeginLine() {
        return beginLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return getKind() + "@" + beginLine + "[" + text + "]";
    }
}

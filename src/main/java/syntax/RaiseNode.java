package syntax;

public class RaiseNode extends AstNode {
    private final String exceptionKind;

    public RaiseNode(int beginLine, int endLine, String text, String exceptionKind) {
        super(beginLine, endLine, text);
        this.exceptionKind = exceptionKind;
    }

    public String getExceptionKind() {
        return exceptionKind;
    }

    @Override
    public Kind getKind() {
        return Kind.RAISE;
    }
}

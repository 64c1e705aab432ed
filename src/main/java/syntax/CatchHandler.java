package syntax;

/** One {@code except}/{@code catch} clause of a {@link TryCatchNode}. */
public class CatchHandler {
    public static final String WILDCARD = "*";

    private final int line;
    private final String text;
    private final String exceptionKind;
    private final SequenceNode body;

    public CatchHandler(int line, String text, String exceptionKind, SequenceNode body) {
        this.line = line;
        this.text = text;
        this.exceptionKind = exceptionKind == null || exceptionKind.isEmpty() ? WILDCARD : exceptionKind;
        this.body = body;
    }

    public int getLine() {
        return line;
    }

    public String getText() {
        return text;
    }

    /** @return caught type(s) as written, or {@link #WILDCARD} for a bare {@code except:} */
    public String getExceptionKind() {
        return exceptionKind;
    }

    public boolean isWildcard() {
        return WILDCARD.equals(exceptionKind);
    }

    public SequenceNode getBody() {
        return body;
    }
}

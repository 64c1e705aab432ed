package syntax;

public class SwitchCase {
    private final int line;
    private final String value;
    private final boolean defaultCase;
    private final SequenceNode body;

    public SwitchCase(int line, String value, boolean defaultCase, SequenceNode body) {
        this.line = line;
        this.value = value;
        this.defaultCase = defaultCase;
        this.body = body;
    }

    public int getLine() {
        return line;
    }

    /** Case label(s) as written; {@code default} for the default case. */
    public String getValue() {
        return value;
    }

    public boolean isDefault() {
        return defaultCase;
    }

    public SequenceNode getBody() {
        return body;
    }
}

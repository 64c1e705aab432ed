package syntax;

/**
 * Checked failure of one analysis. The caller decides whether to retry with
 * another strategy or skip the unit; nothing is retried internally.
 */
public abstract class CfgAnalysisException extends Exception {
    private final int line;

    protected CfgAnalysisException(int line, String message) {
        super(message);
        this.line = line;
    }

    protected CfgAnalysisException(int line, String message, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /** @return 1-based source line the failure refers to, or 0 when unknown */
    public int getLine() {
        return line;
    }
}

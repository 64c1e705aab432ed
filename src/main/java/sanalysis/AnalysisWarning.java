package sanalysis;

/** Advisory finding attached to a successful analysis. */
public final class AnalysisWarning {

    public enum Kind {
        DEAD_CODE("DeadCodeWarning"),
        UNREACHABLE_BLOCK("UnreachableBlockWarning");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final Kind kind;
    private final int line;
    private final String message;

    public AnalysisWarning(Kind kind, int line, String message) {
        this.kind = kind;
        this.line = line;
        this.message = message;
    }

    public static AnalysisWarning deadCode(int line, String message) {
        return new AnalysisWarning(Kind.DEAD_CODE, line, message);
    }

    public static AnalysisWarning unreachableBlock(int line, String message) {
        return new AnalysisWarning(Kind.UNREACHABLE_BLOCK, line, message);
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + "{line=" + line + ", message=" + message + "}";
    }
}

package frontend;

/**
 * One logical Python line: physical lines joined by open brackets or a
 * trailing backslash, with comments removed.
 */
public class LogicalLine {
    private final int indent;
    private final String text;
    private final int beginLine;
    private final int endLine;

    public LogicalLine(int indent, String text, int beginLine, int endLine) {
        this.indent = indent;
        this.text = text;
        this.beginLine = beginLine;
        this.endLine = endLine;
    }

    public int getIndent() {
        return indent;
    }

    public String getText() {
        return text;
    }

    public int getBeginLine() {
        return beginLine;
    }

    public int getEndLine() {
        return endLine;
    }

    @Override
    public String toString() {
        return beginLine + ":" + indent + ":" + text;
    }
}

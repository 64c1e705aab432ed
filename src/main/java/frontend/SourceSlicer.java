package frontend;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the original text of JavaParser nodes from their ranges, so block
 * texts show the tokens exactly as the author wrote them instead of the pretty
 * printer's output. Columns are 1-based with a tab counting as one column
 * (JavaParser's default tab size).
 */
class SourceSlicer {
    private final String source;
    private final List<Integer> lineStarts = new ArrayList<>();

    SourceSlicer(String source) {
        this.source = source;
        lineStarts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                lineStarts.add(i + 1);
            } else if (c == '\n') {
                lineStarts.add(i + 1);
            }
        }
    }

    int offset(Position position) {
        int line = Math.max(1, Math.min(position.line, lineStarts.size()));
        int offset = lineStarts.get(line - 1) + Math.max(0, position.column - 1);
        return Math.min(offset, source.length());
    }

    /** Whole text of the node, trimmed. */
    String text(Node node) {
        Range range = range(node);
        int end = Math.min(offset(range.end) + 1, source.length());
        return source.substring(offset(range.begin), end).trim();
    }

    /** Text from the start of {@code node} up to (excluding) the start of {@code until}. */
    String textBefore(Node node, Node until) {
        return source.substring(offset(range(node).begin), offset(range(until).begin)).trim();
    }

    /** Text from the start of {@code from} up to (excluding) the first {@code stop} char after {@code after}. */
    String textUntil(Node from, Node after, char stop) {
        int start = offset(range(from).begin);
        int searchFrom = Math.min(offset(range(after).end) + 1, source.length());
        int end = source.indexOf(stop, searchFrom);
        if (end < 0) {
            end = Math.min(offset(range(from).end) + 1, source.length());
        }
        return source.substring(start, end).trim();
    }

    /** Text following {@code node} up to the end of {@code enclosing}. */
    String textAfter(Node node, Node enclosing) {
        int start = Math.min(offset(range(node).end) + 1, source.length());
        int end = Math.min(offset(range(enclosing).end) + 1, source.length());
        return start < end ? source.substring(start, end).trim() : "";
    }

    static int beginLine(Node node) {
        return node.getRange().map(r -> r.begin.line).orElse(0);
    }

    static int endLine(Node node) {
        return node.getRange().map(r -> r.end.line).orElse(0);
    }

    private static Range range(Node node) {
        return node.getRange().orElseThrow(() -> new IllegalArgumentException("Node has no range: " + node));
    }
}

package frontend;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Python source into {@link LogicalLine}s.
 *
 * Blank and comment-only lines are skipped. Indentation is measured in columns,
 * a tab advancing to the next multiple of the configured tab size.
 */
public class PythonLineReader {
    private final int tabSize;

    public PythonLineReader(int tabSize) {
        if (tabSize <= 0) {
            throw new IllegalArgumentException("tabSize must be positive: " + tabSize);
        }
        this.tabSize = tabSize;
    }

    public List<LogicalLine> read(String source) throws ParseException {
        List<LogicalLine> result = new ArrayList<>();
        String src = source.replace("\r\n", "\n").replace('\r', '\n');
        int n = src.length();
        int pos = 0;
        int line = 1;

        while (pos < n) {
            // Indentation of the physical line.
            int indent = 0;
            while (pos < n && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t' || src.charAt(pos) == '\f')) {
                char c = src.charAt(pos);
                if (c == ' ') {
                    indent++;
                } else if (c == '\t') {
                    indent = (indent / tabSize + 1) * tabSize;
                } else {
                    indent = 0;
                }
                pos++;
            }
            if (pos >= n) {
                break;
            }
            char first = src.charAt(pos);
            if (first == '\n') {
                pos++;
                line++;
                continue;
            }
            if (first == '#') {
                pos = skipToEol(src, pos);
                continue;
            }

            int beginLine = line;
            int depth = 0;
            StringBuilder text = new StringBuilder();
            boolean done = false;
            while (pos < n && !done) {
                char c = src.charAt(pos);
                if (c == '#') {
                    pos = skipToEol(src, pos);
                } else if (c == '\'' || c == '"') {
                    int end = PythonText.skipString(src, pos);
                    if (end < 0) {
                        throw new ParseException(line, "unterminated string literal");
                    }
                    String literal = src.substring(pos, end);
                    text.append(literal);
                    line += countNewlines(literal);
                    pos = end;
                } else if (c == '(' || c == '[' || c == '{') {
                    depth++;
                    text.append(c);
                    pos++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth--;
                    if (depth < 0) {
                        throw new ParseException(line, "unmatched '" + c + "'");
                    }
                    text.append(c);
                    pos++;
                } else if (c == '\\' && pos + 1 < n && src.charAt(pos + 1) == '\n') {
                    text.append("\\\n");
                    pos += 2;
                    line++;
                } else if (c == '\n') {
                    pos++;
                    if (depth > 0) {
                        text.append('\n');
                        line++;
                    } else {
                        done = true;
                    }
                } else {
                    text.append(c);
                    pos++;
                }
            }
            if (depth > 0) {
                throw new ParseException(beginLine, "'(' was never closed");
            }
            String trimmed = stripTrailing(text.toString());
            if (!trimmed.isEmpty()) {
                result.add(new LogicalLine(indent, trimmed, beginLine, line));
            }
            if (done) {
                line++;
            }
        }
        return result;
    }

    private static int skipToEol(String src, int pos) {
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
        return pos;
    }

    private static int countNewlines(String s) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}

package frontend;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracket- and string-aware scanning over a single logical Python line.
 */
final class PythonText {

    private PythonText() {
    }

    /**
     * @param pos index of the opening quote
     * @return index just past the closing quote, or -1 if the literal is unterminated
     */
    static int skipString(String s, int pos) {
        char quote = s.charAt(pos);
        boolean triple = pos + 2 < s.length() && s.charAt(pos + 1) == quote && s.charAt(pos + 2) == quote;
        int i = pos + (triple ? 3 : 1);
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (triple) {
                if (c == quote && i + 2 < s.length() && s.charAt(i + 1) == quote && s.charAt(i + 2) == quote) {
                    return i + 3;
                }
            } else {
                if (c == quote) {
                    return i + 1;
                }
                if (c == '\n') {
                    return -1;
                }
            }
            i++;
        }
        return -1;
    }

    /** First occurrence of {@code target} outside brackets and string literals, or -1. */
    static int indexOfTopLevel(String s, char target, int from) {
        int depth = 0;
        int i = from;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipString(s, i);
                if (end < 0) {
                    return -1;
                }
                i = end;
                continue;
            }
            if (depth == 0 && c == target) {
                return i;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
            i++;
        }
        return -1;
    }

    static List<String> splitTopLevel(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int idx = indexOfTopLevel(s, separator, 0);
        while (idx >= 0) {
            parts.add(s.substring(start, idx));
            start = idx + 1;
            idx = indexOfTopLevel(s, separator, start);
        }
        parts.add(s.substring(start));
        return parts;
    }

    /**
     * The colon ending a compound statement header. Colons of top-level lambdas
     * and the walrus operator are skipped.
     */
    static int headerColon(String s) {
        int depth = 0;
        int pendingLambdas = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipString(s, i);
                if (end < 0) {
                    return -1;
                }
                i = end;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0 && Character.isJavaIdentifierStart(c)) {
                int end = i;
                while (end < s.length() && Character.isJavaIdentifierPart(s.charAt(end))) {
                    end++;
                }
                if (s.substring(i, end).equals("lambda")) {
                    pendingLambdas++;
                }
                i = end;
                continue;
            } else if (depth == 0 && c == ':') {
                if (i + 1 < s.length() && s.charAt(i + 1) == '=') {
                    i += 2;
                    continue;
                }
                if (pendingLambdas > 0) {
                    pendingLambdas--;
                } else {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Index of the {@code =} of a top-level (possibly augmented) assignment, or -1.
     * Comparison operators and keyword arguments are not assignments.
     */
    static int assignmentIndex(String s) {
        int from = 0;
        while (true) {
            int idx = indexOfTopLevel(s, '=', from);
            if (idx < 0) {
                return -1;
            }
            char next = idx + 1 < s.length() ? s.charAt(idx + 1) : ' ';
            char prev = idx > 0 ? s.charAt(idx - 1) : ' ';
            if (next == '=') {
                from = idx + 2;
                continue;
            }
            if (prev == '!' || prev == ':' || prev == '=') {
                from = idx + 1;
                continue;
            }
            if (prev == '<' || prev == '>') {
                boolean shift = idx > 1 && s.charAt(idx - 2) == prev;
                if (!shift) {
                    from = idx + 1;
                    continue;
                }
            }
            return idx;
        }
    }

    /** Assignment target with any augmented operator removed. */
    static String assignmentTarget(String s, int eqIndex) {
        String target = s.substring(0, eqIndex).trim();
        while (!target.isEmpty() && "+-*/%&|^@<>".indexOf(target.charAt(target.length() - 1)) >= 0) {
            target = target.substring(0, target.length() - 1).trim();
        }
        return target;
    }

    /** @return index of the bracket closing the one at {@code openIndex}, or -1 */
    static int matchingClose(String s, int openIndex) {
        int depth = 0;
        int i = openIndex;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipString(s, i);
                if (end < 0) {
                    return -1;
                }
                i = end;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /** Leading identifier of the text, or the empty string. */
    static String leadingWord(String s) {
        int end = 0;
        while (end < s.length() && Character.isJavaIdentifierPart(s.charAt(end))) {
            end++;
        }
        return s.substring(0, end);
    }

    /** True when the text starts with {@code keyword} as a whole word. */
    static boolean startsWithKeyword(String s, String keyword) {
        if (!s.startsWith(keyword)) {
            return false;
        }
        return s.length() == keyword.length() || !Character.isJavaIdentifierPart(s.charAt(keyword.length()));
    }
}

package frontend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import syntax.AssignNode;
import syntax.AstNode;
import syntax.BreakNode;
import syntax.CallNode;
import syntax.CatchHandler;
import syntax.ContinueNode;
import syntax.ExprStatementNode;
import syntax.FunctionDefNode;
import syntax.IfNode;
import syntax.Language;
import syntax.LoopNode;
import syntax.RaiseNode;
import syntax.ReturnNode;
import syntax.SequenceNode;
import syntax.SourceUnit;
import syntax.SwitchCase;
import syntax.SwitchNode;
import syntax.TryCatchNode;
import syntax.YieldNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Front end for Python source.
 *
 * Works at statement granularity: logical lines from {@link PythonLineReader}
 * are grouped into suites by indentation, and each simple statement is classified
 * from its text. Expressions (comprehensions, lambdas, conditional expressions)
 * stay opaque.
 */
public class PythonFrontEnd implements FrontEnd {
    private static final Logger logger = LoggerFactory.getLogger(PythonFrontEnd.class);

    private static final Pattern DEF_HEADER = Pattern.compile("^(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern CALL_HEAD = Pattern.compile("^(?:await\\s+)?(?:(?:self|cls)\\.)?([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern RAISE_KIND = Pattern.compile("^([A-Za-z_][\\w.]*)\\s*(?:\\(|$)");
    private static final Pattern AS_CLAUSE = Pattern.compile("\\s+as\\s+[A-Za-z_]\\w*$");
    private static final Pattern DOCSTRING = Pattern.compile("^[rRuUbBfF]{0,2}(\"|')");

    private final int tabSize;
    private final boolean skipDocstrings;

    public PythonFrontEnd() {
        this(8, false);
    }

    public PythonFrontEnd(int tabSize, boolean skipDocstrings) {
        this.tabSize = tabSize;
        this.skipDocstrings = skipDocstrings;
    }

    @Override
    public Language getLanguage() {
        return Language.PYTHON;
    }

    @Override
    public SourceUnit parse(String sourceText, String functionName) throws ParseException {
        List<LogicalLine> lines = new PythonLineReader(tabSize).read(sourceText);
        Set<String> known = collectFunctionNames(lines);

        Parser parser = new Parser(lines, known);
        parser.parseModule();
        List<FunctionDefNode> functions = parser.functions;
        functions.sort(Comparator.comparingInt(FunctionDefNode::getBeginLine));

        if (functions.isEmpty()) {
            throw new ParseException(0, "no function definition found");
        }
        FunctionDefNode selected = null;
        if (functionName == null) {
            selected = functions.get(0);
        } else {
            for (FunctionDefNode fn : functions) {
                if (fn.getName().equals(functionName)) {
                    selected = fn;
                    break;
                }
            }
            if (selected == null) {
                throw new ParseException(0, "function '" + functionName + "' not found in source");
            }
        }
        if (skipDocstrings) {
            selected = withoutDocstring(selected);
        }
        logger.debug("Parsed Python function {} with {} top-level statements; analysed functions: {}",
                selected.getSignature(), selected.getBody().getChildren().size(), known);
        return new SourceUnit(Language.PYTHON, sourceText, selected, known);
    }

    private static Set<String> collectFunctionNames(List<LogicalLine> lines) {
        Set<String> names = new LinkedHashSet<>();
        for (LogicalLine line : lines) {
            Matcher m = DEF_HEADER.matcher(line.getText().trim());
            if (m.find()) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    private static FunctionDefNode withoutDocstring(FunctionDefNode fn) {
        List<AstNode> children = fn.getBody().getChildren();
        if (children.isEmpty() || children.get(0).getKind() != AstNode.Kind.EXPR_STATEMENT
                || !DOCSTRING.matcher(children.get(0).getText()).find()) {
            return fn;
        }
        logger.debug("Skipping docstring of {} at line {}", fn.getName(), children.get(0).getBeginLine());
        List<AstNode> rest = new ArrayList<>(children.subList(1, children.size()));
        SequenceNode body = new SequenceNode(fn.getBody().getBeginLine(), fn.getBody().getEndLine(), rest);
        return new FunctionDefNode(fn.getBeginLine(), fn.getEndLine(), fn.getText(), fn.getName(),
                fn.getParameters(), body);
    }

    /** Header of a compound statement together with its parsed body. */
    private static class Suite {
        final String header;
        final String condition;
        final SequenceNode body;

        Suite(String header, String condition, SequenceNode body) {
            this.header = header;
            this.condition = condition;
            this.body = body;
        }
    }

    /** Single-use parser over one list of logical lines. */
    private static class Parser {
        private final List<LogicalLine> lines;
        private final Set<String> known;
        private final List<FunctionDefNode> functions = new ArrayList<>();
        private int pos = 0;

        Parser(List<LogicalLine> lines, Set<String> known) {
            this.lines = lines;
            this.known = known;
        }

        List<AstNode> parseModule() throws ParseException {
            if (lines.isEmpty()) {
                return Collections.emptyList();
            }
            List<AstNode> nodes = parseBlock(lines.get(0).getIndent());
            if (pos < lines.size()) {
                throw new ParseException(lines.get(pos).getBeginLine(),
                        "unindent does not match any outer indentation level");
            }
            return nodes;
        }

        private List<AstNode> parseBlock(int indent) throws ParseException {
            List<AstNode> nodes = new ArrayList<>();
            while (pos < lines.size()) {
                LogicalLine line = lines.get(pos);
                if (line.getIndent() < indent) {
                    break;
                }
                if (line.getIndent() > indent) {
                    boolean afterDedent = pos > 0 && lines.get(pos - 1).getIndent() > line.getIndent();
                    throw new ParseException(line.getBeginLine(), afterDedent
                            ? "unindent does not match any outer indentation level"
                            : "unexpected indent");
                }
                nodes.addAll(parseStatement(line));
            }
            return nodes;
        }

        private List<AstNode> parseStatement(LogicalLine line) throws ParseException {
            String text = line.getText().trim();
            String head = PythonText.startsWithKeyword(text, "async") ? text.substring(5).trim() : text;
            String word = PythonText.leadingWord(head);
            switch (word) {
                case "if":
                    return Collections.singletonList(parseIf(line, "if"));
                case "for":
                case "while":
                    return Collections.singletonList(parseLoop(line, word));
                case "try":
                    return Collections.singletonList(parseTry(line));
                case "with":
                    return parseWith(line);
                case "def":
                    return Collections.singletonList(parseDef(line));
                case "class":
                    return Collections.singletonList(parseClass(line));
                case "elif":
                case "else":
                case "except":
                case "finally":
                    throw new ParseException(line.getBeginLine(),
                            "invalid syntax: '" + word + "' without a matching statement");
                case "match":
                    if (isMatchStatement(line, head)) {
                        return Collections.singletonList(parseMatch(line));
                    }
                    break;
                default:
                    break;
            }
            pos++;
            return parseSimpleStatements(text, line.getBeginLine(), line.getEndLine());
        }

        private Suite suite(LogicalLine line, String keyword) throws ParseException {
            String text = line.getText().trim();
            int colon = PythonText.headerColon(text);
            if (colon < 0) {
                throw new ParseException(line.getBeginLine(), "expected ':' after '" + keyword + "'");
            }
            int keywordEnd = text.indexOf(keyword) + keyword.length();
            String condition = keywordEnd <= colon ? text.substring(keywordEnd, colon).trim() : "";
            String inline = text.substring(colon + 1).trim();
            pos++;

            List<AstNode> body;
            if (!inline.isEmpty()) {
                body = parseSimpleStatements(inline, line.getBeginLine(), line.getEndLine());
            } else {
                if (pos >= lines.size() || lines.get(pos).getIndent() <= line.getIndent()) {
                    throw new ParseException(line.getEndLine(), "expected an indented block after '"
                            + keyword + "' statement on line " + line.getBeginLine());
                }
                body = parseBlock(lines.get(pos).getIndent());
            }
            int endLine = lines.get(pos - 1).getEndLine();
            SequenceNode sequence = body.isEmpty()
                    ? new SequenceNode(line.getBeginLine(), endLine, body)
                    : SequenceNode.of(body);
            return new Suite(text.substring(0, colon + 1), condition, sequence);
        }

        private boolean atClause(int indent, String keyword) {
            if (pos >= lines.size()) {
                return false;
            }
            LogicalLine next = lines.get(pos);
            return next.getIndent() == indent && PythonText.startsWithKeyword(next.getText().trim(), keyword);
        }

        private int lastConsumedLine() {
            return lines.get(pos - 1).getEndLine();
        }

        private IfNode parseIf(LogicalLine line, String keyword) throws ParseException {
            Suite then = suite(line, keyword);
            SequenceNode elseBody = null;
            if (atClause(line.getIndent(), "elif")) {
                IfNode nested = parseIf(lines.get(pos), "elif");
                elseBody = SequenceNode.of(Collections.singletonList(nested));
            } else if (atClause(line.getIndent(), "else")) {
                elseBody = suite(lines.get(pos), "else").body;
            }
            return new IfNode(line.getBeginLine(), lastConsumedLine(), then.header, then.condition,
                    then.body, elseBody);
        }

        private LoopNode parseLoop(LogicalLine line, String keyword) throws ParseException {
            Suite loop = suite(line, keyword);
            SequenceNode elseBody = null;
            if (atClause(line.getIndent(), "else")) {
                elseBody = suite(lines.get(pos), "else").body;
            }
            LoopNode.LoopKind kind = keyword.equals("for") ? LoopNode.LoopKind.FOR : LoopNode.LoopKind.WHILE;
            return new LoopNode(line.getBeginLine(), lastConsumedLine(), loop.header, kind, loop.body,
                    null, elseBody, null);
        }

        private AstNode parseTry(LogicalLine line) throws ParseException {
            Suite guarded = suite(line, "try");
            List<CatchHandler> handlers = new ArrayList<>();
            while (atClause(line.getIndent(), "except")) {
                LogicalLine clause = lines.get(pos);
                Suite handler = suite(clause, "except");
                handlers.add(new CatchHandler(clause.getBeginLine(), handler.header,
                        exceptionKind(handler.condition), handler.body));
            }
            SequenceNode elseBody = null;
            SequenceNode finallyBody = null;
            if (!handlers.isEmpty() && atClause(line.getIndent(), "else")) {
                elseBody = suite(lines.get(pos), "else").body;
            }
            if (atClause(line.getIndent(), "finally")) {
                finallyBody = suite(lines.get(pos), "finally").body;
            }
            if (handlers.isEmpty() && finallyBody == null) {
                throw new ParseException(line.getBeginLine(), "expected 'except' or 'finally' block");
            }
            return new TryCatchNode(line.getBeginLine(), lastConsumedLine(), guarded.header,
                    guarded.body, handlers, elseBody, finallyBody);
        }

        private String exceptionKind(String clause) {
            if (clause.isEmpty()) {
                return CatchHandler.WILDCARD;
            }
            String kind = clause.startsWith("*") ? clause.substring(1).trim() : clause;
            kind = AS_CLAUSE.matcher(kind).replaceFirst("").trim();
            if (kind.startsWith("(") && PythonText.matchingClose(kind, 0) == kind.length() - 1) {
                List<String> parts = new ArrayList<>();
                for (String part : PythonText.splitTopLevel(kind.substring(1, kind.length() - 1), ',')) {
                    if (!part.trim().isEmpty()) {
                        parts.add(part.trim());
                    }
                }
                kind = String.join(" | ", parts);
            }
            return kind;
        }

        private List<AstNode> parseWith(LogicalLine line) throws ParseException {
            Suite with = suite(line, "with");
            List<AstNode> nodes = new ArrayList<>();
            nodes.add(new ExprStatementNode(line.getBeginLine(), line.getEndLine(), with.header));
            nodes.addAll(with.body.getChildren());
            return nodes;
        }

        private FunctionDefNode parseDef(LogicalLine line) throws ParseException {
            String text = line.getText().trim();
            Matcher m = DEF_HEADER.matcher(text);
            if (!m.find()) {
                throw new ParseException(line.getBeginLine(), "invalid function definition");
            }
            int open = m.end() - 1;
            int close = PythonText.matchingClose(text, open);
            if (close < 0) {
                throw new ParseException(line.getBeginLine(), "invalid function definition");
            }
            List<String> params = parameters(text.substring(open + 1, close));
            Suite def = suite(line, "def");
            FunctionDefNode fn = new FunctionDefNode(line.getBeginLine(), lastConsumedLine(), def.header,
                    m.group(1), params, def.body);
            functions.add(fn);
            return fn;
        }

        private List<String> parameters(String list) {
            List<String> params = new ArrayList<>();
            for (String raw : PythonText.splitTopLevel(list, ',')) {
                String p = raw.trim();
                int colon = PythonText.indexOfTopLevel(p, ':', 0);
                if (colon >= 0) {
                    p = p.substring(0, colon);
                }
                int eq = PythonText.indexOfTopLevel(p, '=', 0);
                if (eq >= 0) {
                    p = p.substring(0, eq);
                }
                p = p.trim();
                if (!p.isEmpty() && !p.equals("*") && !p.equals("/")) {
                    params.add(p);
                }
            }
            return params;
        }

        private AstNode parseClass(LogicalLine line) throws ParseException {
            Suite cls = suite(line, "class");
            return new ExprStatementNode(line.getBeginLine(), lastConsumedLine(), cls.header);
        }

        private boolean isMatchStatement(LogicalLine line, String head) {
            if (head.length() <= 5 || !(Character.isWhitespace(head.charAt(5)) || head.charAt(5) == '(')) {
                return false;
            }
            int colon = PythonText.headerColon(head);
            return colon == head.length() - 1
                    && pos + 1 < lines.size()
                    && lines.get(pos + 1).getIndent() > line.getIndent();
        }

        private SwitchNode parseMatch(LogicalLine line) throws ParseException {
            String text = line.getText().trim();
            int colon = PythonText.headerColon(text);
            String selector = text.substring(text.indexOf("match") + 5, colon).trim();
            pos++;
            int caseIndent = lines.get(pos).getIndent();
            List<SwitchCase> cases = new ArrayList<>();
            while (pos < lines.size() && lines.get(pos).getIndent() == caseIndent) {
                LogicalLine clause = lines.get(pos);
                if (!PythonText.startsWithKeyword(clause.getText().trim(), "case")) {
                    throw new ParseException(clause.getBeginLine(), "expected 'case' in match statement");
                }
                Suite c = suite(clause, "case");
                cases.add(new SwitchCase(clause.getBeginLine(), c.condition, c.condition.equals("_"), c.body));
            }
            return new SwitchNode(line.getBeginLine(), lastConsumedLine(), text.substring(0, colon + 1),
                    selector, cases, false);
        }

        private List<AstNode> parseSimpleStatements(String text, int beginLine, int endLine) {
            List<AstNode> nodes = new ArrayList<>();
            for (String part : PythonText.splitTopLevel(text, ';')) {
                String s = part.trim();
                if (!s.isEmpty()) {
                    nodes.add(classify(s, beginLine, endLine));
                }
            }
            return nodes;
        }

        private AstNode classify(String s, int beginLine, int endLine) {
            String word = PythonText.leadingWord(s);
            switch (word) {
                case "return":
                    return new ReturnNode(beginLine, endLine, s);
                case "break":
                    return new BreakNode(beginLine, s, null);
                case "continue":
                    return new ContinueNode(beginLine, s, null);
                case "raise":
                    return new RaiseNode(beginLine, endLine, s, raiseKind(s));
                case "yield":
                    return new YieldNode(beginLine, endLine, s);
                case "pass":
                case "import":
                case "from":
                case "global":
                case "nonlocal":
                case "del":
                case "assert":
                    return new ExprStatementNode(beginLine, endLine, s);
                default:
                    break;
            }
            int eq = PythonText.assignmentIndex(s);
            if (eq >= 0) {
                String value = s.substring(eq + 1).trim();
                if (PythonText.startsWithKeyword(value, "yield")) {
                    return new YieldNode(beginLine, endLine, s);
                }
                String callee = knownCallee(value);
                if (callee != null) {
                    return new CallNode(beginLine, endLine, s, callee);
                }
                return new AssignNode(beginLine, endLine, s, PythonText.assignmentTarget(s, eq));
            }
            String callee = knownCallee(s);
            if (callee != null) {
                return new CallNode(beginLine, endLine, s, callee);
            }
            return new ExprStatementNode(beginLine, endLine, s);
        }

        private String raiseKind(String s) {
            String expr = s.substring("raise".length()).trim();
            if (expr.isEmpty()) {
                return "exception";
            }
            int from = expr.indexOf(" from ");
            if (from >= 0) {
                expr = expr.substring(0, from).trim();
            }
            Matcher m = RAISE_KIND.matcher(expr);
            return m.find() ? m.group(1) : expr;
        }

        /** Name of the analysed function the whole expression calls, or null. */
        private String knownCallee(String expr) {
            String e = expr.trim();
            Matcher m = CALL_HEAD.matcher(e);
            if (!m.find() || !known.contains(m.group(1))) {
                return null;
            }
            int close = PythonText.matchingClose(e, m.end() - 1);
            return close == e.length() - 1 ? m.group(1) : null;
        }
    }
}

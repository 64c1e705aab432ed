package frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.*;
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Front end for Java source, built on JavaParser.
 *
 * Accepts a full compilation unit or a bare method declaration. Statement
 * texts are sliced from the input by node ranges.
 */
public class JavaFrontEnd implements FrontEnd {
    private static final Logger logger = LoggerFactory.getLogger(JavaFrontEnd.class);

    @Override
    public Language getLanguage() {
        return Language.JAVA;
    }

    @Override
    public SourceUnit parse(String sourceText, String functionName) throws ParseException {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

        List<MethodDeclaration> methods;
        ParseResult<CompilationUnit> unit = parser.parse(sourceText);
        if (unit.isSuccessful() && unit.getResult().isPresent()) {
            methods = unit.getResult().get().findAll(MethodDeclaration.class);
        } else {
            ParseResult<BodyDeclaration<?>> member = parser.parseBodyDeclaration(sourceText);
            if (member.isSuccessful() && member.getResult().isPresent()
                    && member.getResult().get().isMethodDeclaration()) {
                logger.debug("Source is not a compilation unit; parsed it as a single method declaration");
                methods = member.getResult().get().findAll(MethodDeclaration.class);
            } else {
                throw toParseException(unit.getProblems());
            }
        }

        Set<String> known = new LinkedHashSet<>();
        for (MethodDeclaration m : methods) {
            known.add(m.getNameAsString());
        }
        MethodDeclaration selected = select(methods, functionName);

        Converter converter = new Converter(new SourceSlicer(sourceText), known);
        FunctionDefNode fn = converter.convertMethod(selected);
        logger.debug("Parsed Java method {} with {} top-level statements; analysed methods: {}",
                fn.getSignature(), fn.getBody().getChildren().size(), known);
        return new SourceUnit(Language.JAVA, sourceText, fn, known);
    }

    private static MethodDeclaration select(List<MethodDeclaration> methods, String name) throws ParseException {
        for (MethodDeclaration m : methods) {
            if (m.getBody().isPresent() && (name == null || m.getNameAsString().equals(name))) {
                return m;
            }
        }
        if (name == null) {
            throw new ParseException(0, "no method with a body found");
        }
        throw new ParseException(0, "method '" + name + "' not found in source");
    }

    private static ParseException toParseException(List<Problem> problems) {
        if (problems.isEmpty()) {
            return new ParseException(0, "unparsable Java source");
        }
        Problem first = problems.get(0);
        int line = first.getLocation()
                .flatMap(TokenRange::toRange)
                .map(r -> r.begin.line)
                .orElse(0);
        return new ParseException(line, first.getMessage());
    }

    /** Converts JavaParser statements into the shared statement tree. */
    private static class Converter {
        private final SourceSlicer slicer;
        private final Set<String> known;

        Converter(SourceSlicer slicer, Set<String> known) {
            this.slicer = slicer;
            this.known = known;
        }

        FunctionDefNode convertMethod(MethodDeclaration method) {
            BlockStmt body = method.getBody().orElseThrow(IllegalStateException::new);
            Node headerStart = method.getModifiers().isNonEmpty()
                    ? method.getModifiers().get(0)
                    : method.getType();
            String header = slicer.textBefore(headerStart, body).replaceAll("\\s+", " ");
            List<String> params = method.getParameters().stream()
                    .map(p -> p.getNameAsString())
                    .collect(Collectors.toList());
            SequenceNode sequence = new SequenceNode(SourceSlicer.beginLine(body), SourceSlicer.endLine(body),
                    convertAll(body.getStatements()));
            return new FunctionDefNode(SourceSlicer.beginLine(method), SourceSlicer.endLine(method), header,
                    method.getNameAsString(), params, sequence);
        }

        private List<AstNode> convertAll(List<Statement> statements) {
            List<AstNode> nodes = new ArrayList<>();
            for (Statement stmt : statements) {
                nodes.addAll(convert(stmt, null));
            }
            return nodes;
        }

        private SequenceNode sequence(Statement stmt) {
            List<AstNode> nodes = convert(stmt, null);
            return new SequenceNode(SourceSlicer.beginLine(stmt), SourceSlicer.endLine(stmt), nodes);
        }

        private List<AstNode> convert(Statement stmt, String label) {
            int begin = SourceSlicer.beginLine(stmt);
            int end = SourceSlicer.endLine(stmt);
            if (stmt.isBlockStmt()) {
                return convertAll(stmt.asBlockStmt().getStatements());
            } else if (stmt.isEmptyStmt()) {
                return Collections.emptyList();
            } else if (stmt.isLabeledStmt()) {
                LabeledStmt labeled = stmt.asLabeledStmt();
                return convertLabeled(labeled.getStatement(), labeled.getLabel().asString());
            } else if (stmt.isIfStmt()) {
                return single(convertIf(stmt.asIfStmt()));
            } else if (stmt.isWhileStmt()) {
                WhileStmt whileStmt = stmt.asWhileStmt();
                return single(new LoopNode(begin, end, slicer.textBefore(whileStmt, whileStmt.getBody()),
                        LoopNode.LoopKind.WHILE, sequence(whileStmt.getBody()), null, null, label));
            } else if (stmt.isForStmt()) {
                return single(convertFor(stmt.asForStmt(), label));
            } else if (stmt.isForEachStmt()) {
                ForEachStmt forEach = stmt.asForEachStmt();
                return single(new LoopNode(begin, end, slicer.textBefore(forEach, forEach.getBody()),
                        LoopNode.LoopKind.FOR, sequence(forEach.getBody()), null, null, label));
            } else if (stmt.isDoStmt()) {
                DoStmt doStmt = stmt.asDoStmt();
                return single(new LoopNode(begin, end, slicer.textAfter(doStmt.getBody(), doStmt),
                        LoopNode.LoopKind.DO_WHILE, sequence(doStmt.getBody()), null, null, label));
            } else if (stmt.isSwitchStmt()) {
                return single(convertSwitch(stmt.asSwitchStmt(), label));
            } else if (stmt.isTryStmt()) {
                return single(convertTry(stmt.asTryStmt()));
            } else if (stmt.isReturnStmt()) {
                return single(new ReturnNode(begin, end, slicer.text(stmt)));
            } else if (stmt.isBreakStmt()) {
                Optional<String> target = stmt.asBreakStmt().getLabel().map(n -> n.asString());
                return single(new BreakNode(begin, slicer.text(stmt), target.orElse(null)));
            } else if (stmt.isContinueStmt()) {
                Optional<String> target = stmt.asContinueStmt().getLabel().map(n -> n.asString());
                return single(new ContinueNode(begin, slicer.text(stmt), target.orElse(null)));
            } else if (stmt.isThrowStmt()) {
                Expression thrown = stmt.asThrowStmt().getExpression();
                String kind = thrown instanceof ObjectCreationExpr
                        ? ((ObjectCreationExpr) thrown).getType().getNameAsString()
                        : slicer.text(thrown);
                return single(new RaiseNode(begin, end, slicer.text(stmt), kind));
            } else if (stmt.isSynchronizedStmt()) {
                SynchronizedStmt sync = stmt.asSynchronizedStmt();
                List<AstNode> nodes = new ArrayList<>();
                nodes.add(new ExprStatementNode(begin, begin, slicer.textBefore(sync, sync.getBody())));
                nodes.addAll(convertAll(sync.getBody().getStatements()));
                return nodes;
            } else if (stmt.isExpressionStmt()) {
                return single(convertExpression(stmt.asExpressionStmt(), begin, end));
            } else {
                return single(new ExprStatementNode(begin, end, slicer.text(stmt)));
            }
        }

        /** Loops and switches carry their label; any other statement is wrapped in a labeled sequence. */
        private List<AstNode> convertLabeled(Statement inner, String label) {
            if (inner.isWhileStmt() || inner.isForStmt() || inner.isForEachStmt() || inner.isDoStmt()
                    || inner.isSwitchStmt()) {
                return convert(inner, label);
            }
            return single(new SequenceNode(SourceSlicer.beginLine(inner), SourceSlicer.endLine(inner),
                    convert(inner, null), label));
        }

        private static List<AstNode> single(AstNode node) {
            List<AstNode> nodes = new ArrayList<>(1);
            nodes.add(node);
            return nodes;
        }

        private IfNode convertIf(IfStmt ifStmt) {
            SequenceNode elseBody = ifStmt.getElseStmt().map(this::sequence).orElse(null);
            return new IfNode(SourceSlicer.beginLine(ifStmt), SourceSlicer.endLine(ifStmt),
                    slicer.textBefore(ifStmt, ifStmt.getThenStmt()), slicer.text(ifStmt.getCondition()),
                    sequence(ifStmt.getThenStmt()), elseBody);
        }

        private LoopNode convertFor(ForStmt forStmt, String label) {
            List<AstNode> update = new ArrayList<>();
            for (Expression expr : forStmt.getUpdate()) {
                update.add(new ExprStatementNode(SourceSlicer.beginLine(expr), SourceSlicer.endLine(expr),
                        slicer.text(expr)));
            }
            return new LoopNode(SourceSlicer.beginLine(forStmt), SourceSlicer.endLine(forStmt),
                    slicer.textBefore(forStmt, forStmt.getBody()), LoopNode.LoopKind.FOR,
                    sequence(forStmt.getBody()), update, null, label);
        }

        private AstNode convertSwitch(SwitchStmt switchStmt, String label) {
            List<SwitchCase> cases = new ArrayList<>();
            boolean arrows = false;
            for (SwitchEntry entry : switchStmt.getEntries()) {
                boolean isDefault = entry.getLabels().isEmpty();
                String value = isDefault ? "default" : entry.getLabels().stream()
                        .map(slicer::text)
                        .collect(Collectors.joining(", "));
                arrows |= entry.getType() != SwitchEntry.Type.STATEMENT_GROUP;
                cases.add(new SwitchCase(SourceSlicer.beginLine(entry), value, isDefault,
                        SequenceNode.of(convertAll(entry.getStatements()))));
            }
            String header = slicer.textUntil(switchStmt, switchStmt.getSelector(), '{');
            if (cases.isEmpty()) {
                return new ExprStatementNode(SourceSlicer.beginLine(switchStmt), SourceSlicer.endLine(switchStmt),
                        header);
            }
            return new SwitchNode(SourceSlicer.beginLine(switchStmt), SourceSlicer.endLine(switchStmt), header,
                    slicer.text(switchStmt.getSelector()), cases, !arrows, label);
        }

        private TryCatchNode convertTry(TryStmt tryStmt) {
            List<AstNode> guarded = new ArrayList<>();
            for (Expression resource : tryStmt.getResources()) {
                guarded.add(convertResource(resource));
            }
            guarded.addAll(convertAll(tryStmt.getTryBlock().getStatements()));

            List<CatchHandler> handlers = new ArrayList<>();
            for (CatchClause clause : tryStmt.getCatchClauses()) {
                handlers.add(new CatchHandler(SourceSlicer.beginLine(clause),
                        slicer.textBefore(clause, clause.getBody()),
                        slicer.text(clause.getParameter().getType()),
                        sequence(clause.getBody())));
            }
            SequenceNode finallyBody = tryStmt.getFinallyBlock().map(this::sequence).orElse(null);
            return new TryCatchNode(SourceSlicer.beginLine(tryStmt), SourceSlicer.endLine(tryStmt),
                    slicer.textBefore(tryStmt, tryStmt.getTryBlock()),
                    new SequenceNode(SourceSlicer.beginLine(tryStmt.getTryBlock()),
                            SourceSlicer.endLine(tryStmt.getTryBlock()), guarded),
                    handlers, null, finallyBody);
        }

        private AstNode convertResource(Expression resource) {
            int begin = SourceSlicer.beginLine(resource);
            int end = SourceSlicer.endLine(resource);
            if (resource.isVariableDeclarationExpr()) {
                return new AssignNode(begin, end, slicer.text(resource),
                        targets(resource.asVariableDeclarationExpr().getVariables()));
            }
            return new ExprStatementNode(begin, end, slicer.text(resource));
        }

        private AstNode convertExpression(ExpressionStmt stmt, int begin, int end) {
            Expression expr = stmt.getExpression();
            String text = slicer.text(stmt);
            String callee = knownCallee(expr);
            if (callee != null) {
                return new CallNode(begin, end, text, callee);
            }
            if (expr.isAssignExpr()) {
                AssignExpr assign = expr.asAssignExpr();
                callee = knownCallee(assign.getValue());
                if (callee != null) {
                    return new CallNode(begin, end, text, callee);
                }
                return new AssignNode(begin, end, text, slicer.text(assign.getTarget()));
            }
            if (expr.isVariableDeclarationExpr()) {
                VariableDeclarationExpr declaration = expr.asVariableDeclarationExpr();
                NodeList<VariableDeclarator> variables = declaration.getVariables();
                if (variables.size() == 1 && variables.get(0).getInitializer().isPresent()) {
                    callee = knownCallee(variables.get(0).getInitializer().get());
                    if (callee != null) {
                        return new CallNode(begin, end, text, callee);
                    }
                }
                return new AssignNode(begin, end, text, targets(variables));
            }
            if (expr.isUnaryExpr()) {
                // only ++ and -- are valid as statements
                UnaryExpr unary = expr.asUnaryExpr();
                return new AssignNode(begin, end, text, slicer.text(unary.getExpression()));
            }
            return new ExprStatementNode(begin, end, text);
        }

        private static String targets(NodeList<VariableDeclarator> variables) {
            return variables.stream()
                    .map(VariableDeclarator::getNameAsString)
                    .collect(Collectors.joining(", "));
        }

        /** Callee name when the expression is an unqualified or {@code this.} call to an analysed method. */
        private String knownCallee(Expression expr) {
            if (!expr.isMethodCallExpr()) {
                return null;
            }
            MethodCallExpr call = expr.asMethodCallExpr();
            boolean local = call.getScope().map(Expression::isThisExpr).orElse(true);
            return local && known.contains(call.getNameAsString()) ? call.getNameAsString() : null;
        }
    }
}

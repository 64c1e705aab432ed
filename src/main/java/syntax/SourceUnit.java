package syntax;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One function or method body to analyze, as produced by a front end.
 * Immutable after parse.
 */
public class SourceUnit {
    private final Language language;
    private final String sourceText;
    private final FunctionDefNode function;
    private final Set<String> knownFunctions;

    public SourceUnit(Language language, String sourceText, FunctionDefNode function, Set<String> knownFunctions) {
        this.language = language;
        this.sourceText = sourceText;
        this.function = function;
        this.knownFunctions = Collections.unmodifiableSet(new LinkedHashSet<>(knownFunctions));
    }

    public Language getLanguage() {
        return language;
    }

    public String getSourceText() {
        return sourceText;
    }

    public FunctionDefNode getFunction() {
        return function;
    }

    /** Top-level statements of the analyzed body, in source order. */
    public List<AstNode> getStatements() {
        return function.getBody().getChildren();
    }

    /** Names of every function or method defined in the same source text. */
    public Set<String> getKnownFunctions() {
        return knownFunctions;
    }
}

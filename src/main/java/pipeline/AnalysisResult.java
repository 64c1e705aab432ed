package pipeline;

import frontend.ParseException;
import rendering.RenderedPath;
import sanalysis.AnalysisWarning;
import sanalysis.ControlFlowGraph;
import sanalysis.StructuralException;
import syntax.CfgAnalysisException;
import syntax.Language;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one analysis. A rendered result carries the graph, the path and
 * any warnings; a failed one carries the typed failure instead.
 */
public final class AnalysisResult {

    public enum Status {
        RENDERED,
        PARSE_FAILED,
        STRUCTURAL_FAILED
    }

    private final Status status;
    private final Language language;
    private final ControlFlowGraph graph;
    private final RenderedPath path;
    private final List<AnalysisWarning> warnings;
    private final CfgAnalysisException failure;

    private AnalysisResult(Status status, Language language, ControlFlowGraph graph, RenderedPath path,
                           List<AnalysisWarning> warnings, CfgAnalysisException failure) {
        this.status = status;
        this.language = language;
        this.graph = graph;
        this.path = path;
        this.warnings = warnings;
        this.failure = failure;
    }

    static AnalysisResult rendered(ControlFlowGraph graph, RenderedPath path) {
        return new AnalysisResult(Status.RENDERED, graph.getLanguage(), graph, path, graph.getWarnings(), null);
    }

    static AnalysisResult parseFailed(Language language, ParseException failure) {
        return new AnalysisResult(Status.PARSE_FAILED, language, null, null, Collections.emptyList(), failure);
    }

    static AnalysisResult structuralFailed(Language language, StructuralException failure) {
        return new AnalysisResult(Status.STRUCTURAL_FAILED, language, null, null, Collections.emptyList(), failure);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isRendered() {
        return status == Status.RENDERED;
    }

    public Language getLanguage() {
        return language;
    }

    /** Normalized graph, or null when the analysis failed. */
    public ControlFlowGraph getGraph() {
        return graph;
    }

    /** Rendered path, or null when the analysis failed. */
    public RenderedPath getPath() {
        return path;
    }

    public List<AnalysisWarning> getWarnings() {
        return warnings;
    }

    /** Parse or structural failure, or null on success. */
    public CfgAnalysisException getFailure() {
        return failure;
    }
}

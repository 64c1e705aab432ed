package pipeline;

import frontend.FrontEnd;
import frontend.FrontEnds;
import frontend.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rendering.PathRenderer;
import rendering.RenderedPath;
import rendering.TestCaseBinding;
import sanalysis.AnalysisWarning;
import sanalysis.CfgBuilder;
import sanalysis.ControlFlowGraph;
import sanalysis.GraphNormalizer;
import sanalysis.StructuralException;
import syntax.Language;
import syntax.SourceUnit;

import java.util.Collections;
import java.util.List;

/**
 * Runs parse, build, normalize and render for one function. Holds only
 * configuration, so one instance can serve concurrent analyses.
 */
public class CfgPipeline {
    private static final Logger logger = LoggerFactory.getLogger(CfgPipeline.class);

    private final PipelineConfig config;
    private final CfgBuilder builder = new CfgBuilder();
    private final GraphNormalizer normalizer;
    private final PathRenderer renderer;

    public CfgPipeline() {
        this(PipelineConfig.load());
    }

    public CfgPipeline(PipelineConfig config) {
        this.config = config;
        this.normalizer = new GraphNormalizer(config.isCoalesce());
        this.renderer = new PathRenderer(config.isIncludeHeader(), config.isIncludeTestCases());
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public AnalysisResult analyze(Language language, String sourceText) {
        return analyze(language, sourceText, null, Collections.emptyList());
    }

    /**
     * @param functionName function or method to analyse, or null for the first one in the text
     * @param testCases    inputs echoed in front of the rendered path
     */
    public AnalysisResult analyze(Language language, String sourceText, String functionName,
                                  List<TestCaseBinding> testCases) {
        FrontEnd frontEnd = FrontEnds.forLanguage(language, config.getPythonTabSize(), config.isSkipDocstrings());
        long start = System.nanoTime();

        SourceUnit unit;
        try {
            unit = frontEnd.parse(sourceText, functionName);
        } catch (ParseException e) {
            logger.warn("Parse failed for {} source: {}", language, e.toString());
            return AnalysisResult.parseFailed(language, e);
        }

        ControlFlowGraph raw;
        try {
            raw = builder.build(unit);
        } catch (StructuralException e) {
            logger.error("Cannot build graph for {}: {}", unit.getFunction().getSignature(), e.getMessage());
            return AnalysisResult.structuralFailed(language, e);
        }

        ControlFlowGraph graph = normalizer.normalize(raw);
        for (AnalysisWarning warning : graph.getWarnings()) {
            logger.warn("{}: {}", graph.getSignature(), warning);
        }
        RenderedPath path = renderer.render(graph, testCases);
        logger.info("Analysed {} ({}): {} blocks, {} edges in {} ms", graph.getSignature(), language,
                graph.size(), graph.getEdges().size(), (System.nanoTime() - start) / 1_000_000);
        return AnalysisResult.rendered(graph, path);
    }
}

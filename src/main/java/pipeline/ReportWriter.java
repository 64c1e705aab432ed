package pipeline;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.AnalysisWarning;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Serializes an {@link AnalysisResult} as a JSON report. */
public class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public JsonObject toJson(AnalysisResult result) {
        JsonObject report = new JsonObject();
        report.addProperty("status", result.getStatus().name());
        report.addProperty("language", result.getLanguage().name().toLowerCase(Locale.ROOT));
        if (result.isRendered()) {
            report.addProperty("signature", result.getGraph().getSignature());
            report.addProperty("blocks", result.getGraph().size());
            report.addProperty("edges", result.getGraph().getEdges().size());
            if (result.getPath().getHeader() != null) {
                report.addProperty("header", result.getPath().getHeader());
            }
            report.add("testCases", strings(result.getPath().getTestCaseLines()));
            report.add("lines", strings(result.getPath().getLines()));
        } else {
            JsonObject failure = new JsonObject();
            failure.addProperty("line", result.getFailure().getLine());
            failure.addProperty("message", result.getFailure().getMessage());
            report.add("failure", failure);
        }
        JsonArray warnings = new JsonArray();
        for (AnalysisWarning warning : result.getWarnings()) {
            JsonObject w = new JsonObject();
            w.addProperty("kind", warning.getKind().getDisplayName());
            w.addProperty("line", warning.getLine());
            w.addProperty("message", warning.getMessage());
            warnings.add(w);
        }
        report.add("warnings", warnings);
        return report;
    }

    public String toJsonString(AnalysisResult result) {
        return gson.toJson(toJson(result));
    }

    public void write(AnalysisResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(toJson(result), writer);
        }
        logger.info("Report written to: {}", file);
    }

    private static JsonArray strings(Iterable<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}

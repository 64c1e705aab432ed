package pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rendering.DotExporter;
import rendering.TestCaseBinding;
import syntax.Language;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * CfgPathTool &lt;source-file&gt; [--lang python|java] [--function name]
 *             [--test input]... [--dot file] [--json file]
 * </pre>
 * Prints the rendered path to standard output.
 */
public class CfgPathTool {
    private static final Logger logger = LoggerFactory.getLogger(CfgPathTool.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_STRUCTURAL_ERROR = 2;
    static final int EXIT_USAGE = 64;
    static final int EXIT_IO = 74;

    static final String USAGE = "usage: CfgPathTool <source-file> [--lang python|java] [--function name]"
            + " [--test input]... [--dot file] [--json file]";

    /** Parsed command line. */
    static final class Options {
        Path source;
        Language language;
        String function;
        final List<String> tests = new ArrayList<>();
        Path dot;
        Path json;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--lang":
                        options.language = Language.fromTag(value(args, ++i, arg));
                        break;
                    case "--function":
                        options.function = value(args, ++i, arg);
                        break;
                    case "--test":
                        options.tests.add(value(args, ++i, arg));
                        break;
                    case "--dot":
                        options.dot = Paths.get(value(args, ++i, arg));
                        break;
                    case "--json":
                        options.json = Paths.get(value(args, ++i, arg));
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (options.source != null) {
                            throw new IllegalArgumentException("More than one source file given");
                        }
                        options.source = Paths.get(arg);
                }
            }
            if (options.source == null) {
                throw new IllegalArgumentException("No source file given");
            }
            if (options.language == null) {
                options.language = Language.fromTag(options.source.getFileName().toString());
            }
            return options;
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[i];
        }
    }

    private final CfgPipeline pipeline;

    public CfgPathTool(CfgPipeline pipeline) {
        this.pipeline = pipeline;
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String text;
        try {
            text = new String(Files.readAllBytes(options.source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + options.source + ": " + e.getMessage());
            return EXIT_IO;
        }

        List<TestCaseBinding> bindings = new ArrayList<>();
        for (int i = 0; i < options.tests.size(); i++) {
            bindings.add(TestCaseBinding.numbered(i + 1, options.tests.get(i)));
        }
        AnalysisResult result = pipeline.analyze(options.language, text, options.function, bindings);

        try {
            if (options.json != null) {
                new ReportWriter().write(result, options.json);
            }
            if (result.isRendered() && options.dot != null) {
                new DotExporter().export(result.getGraph(), options.dot);
            }
        } catch (IOException e) {
            err.println("Cannot write output: " + e.getMessage());
            return EXIT_IO;
        }

        switch (result.getStatus()) {
            case RENDERED:
                out.println(result.getPath().toText());
                return EXIT_OK;
            case PARSE_FAILED:
                err.println(options.source + ":" + result.getFailure().getLine() + ": "
                        + result.getFailure().getMessage());
                return EXIT_PARSE_ERROR;
            default:
                err.println(options.source + ":" + result.getFailure().getLine() + ": internal structure error: "
                        + result.getFailure().getMessage());
                return EXIT_STRUCTURAL_ERROR;
        }
    }

    /** Rendered paths contain non-ASCII arrows, so console output is always UTF-8. */
    static PrintStream utf8(OutputStream stream) {
        return new PrintStream(stream, true, StandardCharsets.UTF_8);
    }

    public static void main(String[] args) {
        PipelineConfig config = PipelineConfig.load();
        logger.debug("Using {}", config);
        int code = new CfgPathTool(new CfgPipeline(config)).run(args,
                utf8(new FileOutputStream(FileDescriptor.out)), utf8(new FileOutputStream(FileDescriptor.err)));
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }
}

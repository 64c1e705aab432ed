package pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of the analysis pipeline. Defaults come from the classpath
 * resource {@code cfgpath.properties}; a JVM system property with the same
 * key wins over the file.
 */
public class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String RESOURCE = "cfgpath.properties";

    public static final String INCLUDE_HEADER = "render.includeHeader";
    public static final String INCLUDE_TEST_CASES = "render.includeTestCases";
    public static final String COALESCE = "normalize.coalesce";
    public static final String PYTHON_TAB_SIZE = "python.tabSize";
    public static final String PYTHON_SKIP_DOCSTRINGS = "python.skipDocstrings";

    private final boolean includeHeader;
    private final boolean includeTestCases;
    private final boolean coalesce;
    private final int pythonTabSize;
    private final boolean skipDocstrings;

    public PipelineConfig(boolean includeHeader, boolean includeTestCases, boolean coalesce,
                          int pythonTabSize, boolean skipDocstrings) {
        if (pythonTabSize < 1) {
            throw new IllegalArgumentException(PYTHON_TAB_SIZE + " must be positive: " + pythonTabSize);
        }
        this.includeHeader = includeHeader;
        this.includeTestCases = includeTestCases;
        this.coalesce = coalesce;
        this.pythonTabSize = pythonTabSize;
        this.skipDocstrings = skipDocstrings;
    }

    /** Built-in defaults, ignoring any resource file or system property. */
    public static PipelineConfig defaults() {
        return new PipelineConfig(true, true, true, 8, false);
    }

    /** Loads {@link #RESOURCE} from the classpath and applies system property overrides. */
    public static PipelineConfig load() {
        Properties props = new Properties();
        try (InputStream in = PipelineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("No {} on the classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + RESOURCE, e);
        }
        return fromProperties(props, System.getProperties());
    }

    static PipelineConfig fromProperties(Properties file, Properties overrides) {
        PipelineConfig d = defaults();
        return new PipelineConfig(
                bool(INCLUDE_HEADER, file, overrides, d.includeHeader),
                bool(INCLUDE_TEST_CASES, file, overrides, d.includeTestCases),
                bool(COALESCE, file, overrides, d.coalesce),
                integer(PYTHON_TAB_SIZE, file, overrides, d.pythonTabSize),
                bool(PYTHON_SKIP_DOCSTRINGS, file, overrides, d.skipDocstrings));
    }

    private static String lookup(String key, Properties file, Properties overrides) {
        String value = overrides.getProperty(key);
        if (value == null) {
            value = file.getProperty(key);
        }
        return value == null ? null : value.trim();
    }

    private static boolean bool(String key, Properties file, Properties overrides, boolean fallback) {
        String value = lookup(key, file, overrides);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException("Expected true or false for " + key + ": " + value);
        }
        return Boolean.parseBoolean(value);
    }

    private static int integer(String key, Properties file, Properties overrides, int fallback) {
        String value = lookup(key, file, overrides);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer for " + key + ": " + value, e);
        }
    }

    public boolean isIncludeHeader() {
        return includeHeader;
    }

    public boolean isIncludeTestCases() {
        return includeTestCases;
    }

    public boolean isCoalesce() {
        return coalesce;
    }

    public int getPythonTabSize() {
        return pythonTabSize;
    }

    public boolean isSkipDocstrings() {
        return skipDocstrings;
    }

    @Override
    public String toString() {
        return "PipelineConfig{includeHeader=" + includeHeader + ", includeTestCases=" + includeTestCases
                + ", coalesce=" + coalesce + ", pythonTabSize=" + pythonTabSize
                + ", skipDocstrings=" + skipDocstrings + "}";
    }
}

package pipeline;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertTrue(config.isIncludeHeader());
        assertTrue(config.isIncludeTestCases());
        assertTrue(config.isCoalesce());
        assertEquals(8, config.getPythonTabSize());
        assertFalse(config.isSkipDocstrings());
    }

    @Test
    void testLoadReadsBundledResource() {
        PipelineConfig config = PipelineConfig.load();

        assertEquals(8, config.getPythonTabSize());
        assertTrue(config.isCoalesce());
    }

    @Test
    void testOverridesWinOverFile() {
        Properties file = new Properties();
        file.setProperty(PipelineConfig.INCLUDE_HEADER, "false");
        file.setProperty(PipelineConfig.PYTHON_TAB_SIZE, "4");
        Properties overrides = new Properties();
        overrides.setProperty(PipelineConfig.PYTHON_TAB_SIZE, " 2 ");
        overrides.setProperty(PipelineConfig.PYTHON_SKIP_DOCSTRINGS, "TRUE");

        PipelineConfig config = PipelineConfig.fromProperties(file, overrides);

        assertFalse(config.isIncludeHeader());
        assertEquals(2, config.getPythonTabSize());
        assertTrue(config.isSkipDocstrings());
        assertTrue(config.isIncludeTestCases());
    }

    @Test
    void testInvalidBoolean() {
        Properties file = new Properties();
        file.setProperty(PipelineConfig.COALESCE, "yes");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.fromProperties(file, new Properties()));
        assertTrue(e.getMessage().contains(PipelineConfig.COALESCE));
    }

    @Test
    void testInvalidTabSize() {
        Properties file = new Properties();
        file.setProperty(PipelineConfig.PYTHON_TAB_SIZE, "eight");

        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(file, new Properties()));
        assertThrows(IllegalArgumentException.class, () -> new PipelineConfig(true, true, true, 0, false));
    }
}

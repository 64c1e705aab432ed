package rendering;

import frontend.PythonFrontEnd;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sanalysis.CfgBuilder;
import sanalysis.ControlFlowGraph;
import sanalysis.GraphNormalizer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DotExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void testExportWritesDigraph() throws Exception {
        String source =
                "def sign(x):\n" +
                "    if x > 0:\n" +
                "        return 1\n" +
                "    return \"neg\"\n";
        ControlFlowGraph cfg = new GraphNormalizer().normalize(new CfgBuilder().build(new PythonFrontEnd().parse(source)));
        Path out = tempDir.resolve("dot/sign.dot");

        new DotExporter().export(cfg, out);

        assertTrue(Files.exists(out));
        String dot = new String(Files.readAllBytes(out), StandardCharsets.UTF_8);
        assertTrue(dot.startsWith("digraph CFG {"));
        assertTrue(dot.contains("\"b0\" -> \"b1\";"));
        assertTrue(dot.contains("[label=\"BranchTrue\"]"), dot);
        assertTrue(dot.contains("return \\\"neg\\\""), dot);
        assertTrue(dot.trim().endsWith("}"));
    }
}

package rendering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.Block;
import sanalysis.ControlFlowGraph;
import sanalysis.Edge;
import sanalysis.EdgeLabel;
import syntax.AstNode;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Writes a graph in Graphviz DOT format. */
public class DotExporter {
    private static final Logger logger = LoggerFactory.getLogger(DotExporter.class);

    public String toDot(ControlFlowGraph cfg) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph CFG {\n");
        sb.append("  label=\"").append(quote(cfg.getSignature())).append("\";\n");
        sb.append("  node [shape=box];\n");
        for (Block block : cfg.getBlocks()) {
            sb.append(String.format("  \"b%d\" [label=\"[%d] %s\\n%s\"];%n", block.getIndex(), block.getIndex(),
                    block.getShape().getDisplayName(), quote(text(block))));
        }
        for (Edge edge : cfg.getEdges()) {
            EdgeLabel label = edge.getLabel();
            if (label.getKind() == EdgeLabel.Kind.UNCONDITIONAL) {
                sb.append(String.format("  \"b%d\" -> \"b%d\";%n", edge.getFrom(), edge.getTo()));
            } else {
                sb.append(String.format("  \"b%d\" -> \"b%d\" [label=\"%s\"];%n", edge.getFrom(), edge.getTo(),
                        quote(label.toString())));
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    public void export(ControlFlowGraph cfg, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            writer.print(toDot(cfg));
        }
        logger.info("CFG exported to: {}", file);
    }

    private static String text(Block block) {
        if (block.isEmpty()) {
            return block.getDescription();
        }
        List<String> parts = new ArrayList<>();
        for (AstNode node : block.getNodes()) {
            parts.add(node.getText());
        }
        return String.join("\n", parts);
    }

    private static String quote(String s) {
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\r\n", "\n")
                .replace("\n", "\\l");
    }
}

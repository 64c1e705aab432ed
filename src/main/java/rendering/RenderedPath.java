package rendering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line-oriented textual form of a control flow graph: optional test-case
 * lines, an optional header and one line per block in rank order.
 */
public final class RenderedPath {
    private final String signature;
    private final List<String> testCaseLines;
    private final String header;
    private final List<String> blockLines;

    RenderedPath(String signature, List<String> testCaseLines, String header, List<String> blockLines) {
        this.signature = signature;
        this.testCaseLines = Collections.unmodifiableList(new ArrayList<>(testCaseLines));
        this.header = header;
        this.blockLines = Collections.unmodifiableList(new ArrayList<>(blockLines));
    }

    public String getSignature() {
        return signature;
    }

    public List<String> getTestCaseLines() {
        return testCaseLines;
    }

    /** Header line, or null when headers are switched off. */
    public String getHeader() {
        return header;
    }

    /** One entry per rendered block, in rank order. */
    public List<String> getLines() {
        return blockLines;
    }

    public String toText() {
        List<String> all = new ArrayList<>(testCaseLines);
        if (header != null) {
            all.add(header);
        }
        all.addAll(blockLines);
        return String.join("\n", all);
    }

    @Override
    public String toString() {
        return toText();
    }
}

package syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multi-way branch: Java {@code switch} statements and Python {@code match}.
 * Cases keep source order. When {@link #isFallThrough()} holds, a case body
 * that is not terminated continues into the next case (classic Java
 * {@code case X:} groups); otherwise it leaves the switch (arrow cases, Python).
 */
public class SwitchNode extends AstNode {
    private final String selector;
    private final List<SwitchCase> cases;
    private final boolean fallThrough;
    private final String label;

    public SwitchNode(int beginLine, int endLine, String text, String selector, List<SwitchCase> cases,
                      boolean fallThrough) {
        this(beginLine, endLine, text, selector, cases, fallThrough, null);
    }

    public SwitchNode(int beginLine, int endLine, String text, String selector, List<SwitchCase> cases,
                      boolean fallThrough, String label) {
        super(beginLine, endLine, text);
        this.selector = selector;
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
        this.fallThrough = fallThrough;
        this.label = label;
    }

    public String getSelector() {
        return selector;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    public boolean isFallThrough() {
        return fallThrough;
    }

    /** @return the Java statement label, or null */
    public String getLabel() {
        return label;
    }

    /** True when at least one case tests a value, so the switch really branches. */
    public boolean hasValueCase() {
        for (SwitchCase c : cases) {
            if (!c.isDefault()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasDefault() {
        for (SwitchCase c : cases) {
            if (c.isDefault()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Kind getKind() {
        return Kind.SWITCH;
    }
}

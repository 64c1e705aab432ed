package syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statements run in order. A labeled sequence (Java {@code out: { ... }}) can be
 * left early with {@code break out}.
 */
public class SequenceNode extends AstNode {
    private final List<AstNode> children;
    private final String label;

    public SequenceNode(int beginLine, int endLine, List<AstNode> children) {
        this(beginLine, endLine, children, null);
    }

    public SequenceNode(int beginLine, int endLine, List<AstNode> children, String label) {
        super(beginLine, endLine, "");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.label = label;
    }

    /** A sequence spanning exactly the lines of its children. */
    public static SequenceNode of(List<AstNode> children) {
        if (children.isEmpty()) {
            return new SequenceNode(0, 0, children);
        }
        return new SequenceNode(children.get(0).getBeginLine(),
                children.get(children.size() - 1).getEndLine(), children);
    }

    public List<AstNode> getChildren() {
        return children;
    }

    /** @return the statement label, or null */
    public String getLabel() {
        return label;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public Kind getKind() {
        return Kind.SEQUENCE;
    }
}

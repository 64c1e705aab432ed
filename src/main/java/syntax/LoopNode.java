package syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LoopNode extends AstNode {

    public enum LoopKind {
        FOR,
        WHILE,
        DO_WHILE
    }

    private final LoopKind loopKind;
    private final SequenceNode body;
    private final List<AstNode> update;
    private final SequenceNode elseBody;
    private final String label;

    public LoopNode(int beginLine, int endLine, String text, LoopKind loopKind, SequenceNode body,
                    List<AstNode> update, SequenceNode elseBody, String label) {
        super(beginLine, endLine, text);
        this.loopKind = loopKind;
        this.body = body;
        this.update = update == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(update));
        this.elseBody = elseBody;
        this.label = label;
    }

    public LoopKind getLoopKind() {
        return loopKind;
    }

    public SequenceNode getBody() {
        return body;
    }

    /** Update expressions of a classic Java {@code for}; they run once per iteration. */
    public List<AstNode> getUpdate() {
        return update;
    }

    /** Python {@code for/while ... else}: runs when the loop ends without {@code break}. */
    public SequenceNode getElseBody() {
        return elseBody;
    }

    public String getLabel() {
        return label;
    }

    /** Copy of this loop carrying a statement label ({@code outer: for (...)}). */
    public LoopNode withLabel(String newLabel) {
        return new LoopNode(getBeginLine(), getEndLine(), getText(), loopKind, body, update, elseBody, newLabel);
    }

    @Override
    public Kind getKind() {
        return Kind.LOOP;
    }
}

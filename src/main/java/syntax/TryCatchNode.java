package syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TryCatchNode extends AstNode {
    private final SequenceNode body;
    private final List<CatchHandler> handlers;
    private final SequenceNode elseBody;
    private final SequenceNode finallyBody;

    public TryCatchNode(int beginLine, int endLine, String text, SequenceNode body,
                        List<CatchHandler> handlers, SequenceNode elseBody, SequenceNode finallyBody) {
        super(beginLine, endLine, text);
        this.body = body;
        this.handlers = Collections.unmodifiableList(new ArrayList<>(handlers));
        this.elseBody = elseBody;
        this.finallyBody = finallyBody;
    }

    public SequenceNode getBody() {
        return body;
    }

    public List<CatchHandler> getHandlers() {
        return handlers;
    }

    /** Python {@code try ... else}; null when absent. */
    public SequenceNode getElseBody() {
        return elseBody;
    }

    /** null when absent. */
    public SequenceNode getFinallyBody() {
        return finallyBody;
    }

    @Override
    public Kind getKind() {
        return Kind.TRY_CATCH;
    }
}

package syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FunctionDefNode extends AstNode {
    private final String name;
    private final List<String> parameters;
    private final SequenceNode body;

    public FunctionDefNode(int beginLine, int endLine, String text, String name,
                           List<String> parameters, SequenceNode body) {
        super(beginLine, endLine, text);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public SequenceNode getBody() {
        return body;
    }

    /** @return {@code name(p1, p2)} */
    public String getSignature() {
        return name + "(" + String.join(", ", parameters) + ")";
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION_DEF;
    }
}

package rendering;

import java.util.Objects;

/** Sample input attached to a rendered path, printed as {@code Test case <label>: <input>}. */
public final class TestCaseBinding {
    private final String label;
    private final String input;

    public TestCaseBinding(String label, String input) {
        this.label = label;
        this.input = Objects.requireNonNull(input, "input");
    }

    /** Binding labelled by its 1-based position. */
    public static TestCaseBinding numbered(int position, String input) {
        return new TestCaseBinding(String.valueOf(position), input);
    }

    public String getLabel() {
        return label;
    }

    public String getInput() {
        return input;
    }
}

package sanalysis;

import java.util.Locale;
import java.util.Objects;

/**
 * Transfer condition of an {@link Edge}. {@code CASE_MATCH} carries the case
 * value (null for the default outcome), {@code EXCEPTION_RAISED} the exception kind.
 */
public final class EdgeLabel {

    public enum Kind {
        UNCONDITIONAL,
        BRANCH_TRUE,
        BRANCH_FALSE,
        CASE_MATCH,
        EXCEPTION_RAISED,
        LOOP_CONTINUE,
        LOOP_EXIT,
        RETURN,
        CALL_ENTER,
        CALL_RETURN
    }

    private static final EdgeLabel UNCONDITIONAL = new EdgeLabel(Kind.UNCONDITIONAL, null);
    private static final EdgeLabel BRANCH_TRUE = new EdgeLabel(Kind.BRANCH_TRUE, null);
    private static final EdgeLabel BRANCH_FALSE = new EdgeLabel(Kind.BRANCH_FALSE, null);
    private static final EdgeLabel CASE_DEFAULT = new EdgeLabel(Kind.CASE_MATCH, null);
    private static final EdgeLabel LOOP_CONTINUE = new EdgeLabel(Kind.LOOP_CONTINUE, null);
    private static final EdgeLabel LOOP_EXIT = new EdgeLabel(Kind.LOOP_EXIT, null);
    private static final EdgeLabel RETURN = new EdgeLabel(Kind.RETURN, null);
    private static final EdgeLabel CALL_ENTER = new EdgeLabel(Kind.CALL_ENTER, null);
    private static final EdgeLabel CALL_RETURN = new EdgeLabel(Kind.CALL_RETURN, null);

    private final Kind kind;
    private final String value;

    private EdgeLabel(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static EdgeLabel unconditional() {
        return UNCONDITIONAL;
    }

    public static EdgeLabel branchTrue() {
        return BRANCH_TRUE;
    }

    public static EdgeLabel branchFalse() {
        return BRANCH_FALSE;
    }

    public static EdgeLabel caseMatch(String value) {
        return new EdgeLabel(Kind.CASE_MATCH, Objects.requireNonNull(value, "value"));
    }

    public static EdgeLabel caseDefault() {
        return CASE_DEFAULT;
    }

    public static EdgeLabel exceptionRaised(String exceptionKind) {
        return new EdgeLabel(Kind.EXCEPTION_RAISED, Objects.requireNonNull(exceptionKind, "exceptionKind"));
    }

    public static EdgeLabel loopContinue() {
        return LOOP_CONTINUE;
    }

    public static EdgeLabel loopExit() {
        return LOOP_EXIT;
    }

    public static EdgeLabel returning() {
        return RETURN;
    }

    public static EdgeLabel callEnter() {
        return CALL_ENTER;
    }

    public static EdgeLabel callReturn() {
        return CALL_RETURN;
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public boolean isDefaultCase() {
        return kind == Kind.CASE_MATCH && value == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EdgeLabel)) return false;
        EdgeLabel other = (EdgeLabel) obj;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case CASE_MATCH:
                return "CaseMatch(" + (value == null ? "default" : value) + ")";
            case EXCEPTION_RAISED:
                return "ExceptionRaised(" + value + ")";
            default:
                StringBuilder name = new StringBuilder();
                for (String part : kind.name().toLowerCase(Locale.ROOT).split("_")) {
                    name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
                }
                return name.toString();
        }
    }
}

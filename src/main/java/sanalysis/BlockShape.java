package sanalysis;

/** Control-shape of a {@link Block}. */
public enum BlockShape {
    ENTRY("Entry"),
    EXIT("Exit"),
    LINEAR("Linear"),
    DECISION("Decision"),
    LOOP_HEADER("LoopHeader"),
    LOOP_LATCH("LoopLatch"),
    EXCEPTION_GUARD("ExceptionGuard"),
    CALL_SITE("CallSite"),
    SUSPEND("Suspend");

    private final String displayName;

    BlockShape(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Shapes allowed more than one outgoing edge. */
    public boolean isBranching() {
        return this == DECISION || this == LOOP_HEADER || this == EXCEPTION_GUARD;
    }
}

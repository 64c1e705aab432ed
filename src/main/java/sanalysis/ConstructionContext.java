package sanalysis;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable view of where abrupt transfers go while a statement is being
 * placed: the Exit block, the innermost exception handlers and the chain of
 * enclosing loops and switches. Nested constructs derive a new context
 * instead of mutating a shared stack.
 */
final class ConstructionContext {

    /** One enclosing loop, switch or labeled block. */
    static final class JumpFrame {
        final String label;
        final boolean loop;
        /** Labeled blocks are only left by a {@code break} naming them. */
        final boolean labelOnly;
        final int continueTarget;
        final int breakTarget;
        final JumpFrame outer;

        private JumpFrame(String label, boolean loop, boolean labelOnly, int continueTarget, int breakTarget,
                          JumpFrame outer) {
            this.label = label;
            this.loop = loop;
            this.labelOnly = labelOnly;
            this.continueTarget = continueTarget;
            this.breakTarget = breakTarget;
            this.outer = outer;
        }

        /** Break out of a loop is a LoopExit; out of a switch it is plain flow. */
        EdgeLabel breakLabel() {
            return loop ? EdgeLabel.loopExit() : EdgeLabel.unconditional();
        }
    }

    private final int exitBlock;
    private final List<HandlerTarget> handlers;
    private final JumpFrame frames;

    private ConstructionContext(int exitBlock, List<HandlerTarget> handlers, JumpFrame frames) {
        this.exitBlock = exitBlock;
        this.handlers = handlers;
        this.frames = frames;
    }

    static ConstructionContext forFunction(int exitBlock) {
        return new ConstructionContext(exitBlock, Collections.emptyList(), null);
    }

    ConstructionContext withLoop(String label, int latch, int continuation) {
        return new ConstructionContext(exitBlock, handlers,
                new JumpFrame(label, true, false, latch, continuation, frames));
    }

    ConstructionContext withSwitch(String label, int continuation) {
        return new ConstructionContext(exitBlock, handlers,
                new JumpFrame(label, false, false, -1, continuation, frames));
    }

    ConstructionContext withLabeledBlock(String label, int continuation) {
        return new ConstructionContext(exitBlock, handlers,
                new JumpFrame(label, false, true, -1, continuation, frames));
    }

    ConstructionContext withHandlers(List<HandlerTarget> newHandlers) {
        return new ConstructionContext(exitBlock, Collections.unmodifiableList(newHandlers), frames);
    }

    int getExitBlock() {
        return exitBlock;
    }

    List<HandlerTarget> getHandlers() {
        return handlers;
    }

    boolean isGuarded() {
        return !handlers.isEmpty();
    }

    Optional<JumpFrame> breakFrame(String label) {
        for (JumpFrame f = frames; f != null; f = f.outer) {
            if (label == null ? !f.labelOnly : label.equals(f.label)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    Optional<JumpFrame> continueFrame(String label) {
        for (JumpFrame f = frames; f != null; f = f.outer) {
            if (f.loop && (label == null || label.equals(f.label))) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}

package com.pathtree.engine.tree;

import java.util.Objects;

/**
 * Raised when a tree does not have the shape an operation requires.
 */
public final class TreeShapeException extends RuntimeException {

    public enum Reason {
        LEVEL_OUT_OF_RANGE,
        NON_UNIFORM_DEPTH,
        INSUFFICIENT_LEVELS,
        RAGGED_MULTI_ROW,
        RAGGED_COLUMNS,
        MISSING_KEY
    }

    private final Reason reason;

    public TreeShapeException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}

package com.chinesecheckers.core;

import java.util.Objects;

/**
 * What happened during one turn. {@code move} is only present for {@link Kind#MOVED}.
 */
public record TurnResult(Kind kind, Color color, Move move, int ply) {

    public TurnResult {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(color, "color");
        if ((kind == Kind.MOVED) != (move != null)) {
            throw new IllegalArgumentException("A move is present exactly when the turn kind is MOVED");
        }
    }

    public enum Kind {
        MOVED,
        PASSED,
        SKIPPED_NO_MOVES,
        RESIGNED
    }
}

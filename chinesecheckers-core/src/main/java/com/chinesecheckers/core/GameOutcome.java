package com.chinesecheckers.core;

import java.util.Objects;

/**
 * Final report of a game. {@code winner} is {@code null} for stalemates and ply-limit stops.
 */
public record GameOutcome(Kind kind, Color winner, int plies) {

    public GameOutcome {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.WINNER || kind == Kind.RESIGNATION) != (winner != null)) {
            throw new IllegalArgumentException("Outcome " + kind + " does not match winner " + winner);
        }
    }

    public boolean hasWinner() {
        return winner != null;
    }

    public String describe() {
        return switch (kind) {
            case WINNER -> winner + " wins after " + plies + " plies";
            case RESIGNATION -> winner + " wins after every other color resigned (" + plies + " plies)";
            case STALEMATE -> "Stalemate after " + plies + " plies: no color can move";
            case PLY_LIMIT -> "Stopped at the limit of " + plies + " plies without a winner";
        };
    }

    public enum Kind {
        WINNER,
        RESIGNATION,
        STALEMATE,
        PLY_LIMIT
    }
}

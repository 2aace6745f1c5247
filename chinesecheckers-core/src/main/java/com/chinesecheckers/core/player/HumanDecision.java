package com.chinesecheckers.core.player;

import com.chinesecheckers.core.Move;
import java.util.Objects;

/**
 * What a seat decided to do with its turn: play a move, pass or resign.
 */
public record HumanDecision(Kind kind, Move move) {

    public HumanDecision {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.PLAY) != (move != null)) {
            throw new IllegalArgumentException("A move is required exactly when the decision is PLAY");
        }
    }

    public static HumanDecision play(Move move) {
        return new HumanDecision(Kind.PLAY, Objects.requireNonNull(move, "move"));
    }

    public static HumanDecision pass() {
        return new HumanDecision(Kind.PASS, null);
    }

    public static HumanDecision resign() {
        return new HumanDecision(Kind.RESIGN, null);
    }

    public enum Kind {
        PLAY,
        PASS,
        RESIGN
    }
}

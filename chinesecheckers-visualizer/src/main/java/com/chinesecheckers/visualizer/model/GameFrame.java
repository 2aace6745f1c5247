package com.chinesecheckers.visualizer.model;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameOutcome;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.TurnResult;
import com.chinesecheckers.core.ai.SearchResult;
import java.util.Objects;

/**
 * Snapshot of a single position within a simulated Chinese Checkers match. {@code turn} is {@code null} for the
 * starting position, {@code search} for turns not decided by a minimax seat and {@code outcome} while the game
 * is still running.
 */
public record GameFrame(
        GameState state,
        TurnResult turn,
        SearchResult search,
        GameOutcome outcome,
        int ply) {

    public GameFrame {
        Objects.requireNonNull(state, "state");
        if (ply < 0) {
            throw new IllegalArgumentException("ply must not be negative");
        }
    }

    public static GameFrame initial(GameState state) {
        Objects.requireNonNull(state, "state");
        return new GameFrame(state, null, null, null, 0);
    }

    public boolean hasLastMove() {
        return turn != null && turn.move() != null;
    }

    public Move lastMove() {
        return hasLastMove() ? turn.move() : null;
    }

    /**
     * Returns the color that played the last turn, or {@code null} for the starting position.
     */
    public Color mover() {
        return turn == null ? null : turn.color();
    }

    public boolean isFinal() {
        return outcome != null;
    }

    public long visitedNodes() {
        return search == null ? 0L : search.visitedNodes();
    }
}

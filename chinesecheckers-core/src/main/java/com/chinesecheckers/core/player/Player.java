package com.chinesecheckers.core.player;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.InvalidMoveException;
import com.chinesecheckers.core.Move;
import java.util.List;

/**
 * A seat at the table. Players receive a private copy of the state and never mutate the game directly.
 */
public interface Player {

    /**
     * Picks a move for {@code color}.
     *
     * @throws com.chinesecheckers.core.NoLegalMoveException if {@code color} has no legal move
     * @throws IllegalStateException if an interactive seat passes or resigns instead of moving
     */
    Move chooseMove(GameState state, Color color);

    /**
     * Decides how to use the turn. Computer players always play; {@code legalMoves} is never empty.
     */
    default HumanDecision decide(GameState state, Color color, List<Move> legalMoves) {
        return HumanDecision.play(chooseMove(state, color));
    }

    /**
     * Called when the move returned by {@link #decide} was refused. The default treats the refusal as a
     * defect and rethrows it; interactive players report it and are asked again.
     */
    default void moveRejected(Move move, InvalidMoveException reason) {
        throw reason;
    }

    /**
     * Short label used in logs and renderers.
     */
    String describe();
}

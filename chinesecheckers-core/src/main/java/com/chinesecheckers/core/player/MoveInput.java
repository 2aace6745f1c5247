package com.chinesecheckers.core.player;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import java.util.List;

/**
 * Source of decisions for a human seat, such as a console or a graphical board.
 */
public interface MoveInput {

    HumanDecision nextDecision(GameState state, Color color, List<Move> legalMoves);

    default void rejected(Move move, String reason) {
    }
}

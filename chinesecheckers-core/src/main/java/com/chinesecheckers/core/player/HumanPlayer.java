package com.chinesecheckers.core.player;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.InvalidMoveException;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.NoLegalMoveException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Seat driven by a {@link MoveInput}. Refused moves are reported back to the input and the seat is asked
 * again. Only {@link #decide} may pass or resign; {@link #chooseMove} needs a move.
 */
public final class HumanPlayer implements Player {

    private final MoveInput input;
    private final MoveGenerator generator;

    public HumanPlayer(MoveInput input, MoveGenerator generator) {
        this.input = Objects.requireNonNull(input, "input");
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    @Override
    public Move chooseMove(GameState state, Color color) {
        List<Move> legalMoves = generator.legalMoves(state, color);
        if (legalMoves.isEmpty()) {
            throw new NoLegalMoveException(color);
        }
        HumanDecision decision = decide(state, color, legalMoves);
        if (decision.kind() != HumanDecision.Kind.PLAY) {
            throw new IllegalStateException("A move is required from " + color + " but the input chose to "
                    + decision.kind().name().toLowerCase(Locale.ROOT));
        }
        return decision.move();
    }

    @Override
    public HumanDecision decide(GameState state, Color color, List<Move> legalMoves) {
        return Objects.requireNonNull(input.nextDecision(state, color, legalMoves), "decision");
    }

    @Override
    public void moveRejected(Move move, InvalidMoveException reason) {
        input.rejected(move, reason.getMessage());
    }

    @Override
    public String describe() {
        return "human";
    }
}

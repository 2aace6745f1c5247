package com.chinesecheckers.core.player;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.Evaluator;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.NoLegalMoveException;
import com.chinesecheckers.core.ai.state.SearchState;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * One-ply player: plays every legal move of the given side on a search buffer and keeps the first move with the
 * highest evaluation. Like the minimax search it accepts any side still in play, not only the side to move.
 */
public final class GreedyPlayer implements Player {

    private static final Logger LOGGER = Logger.getLogger(GreedyPlayer.class.getName());

    private final MoveGenerator generator;
    private final Evaluator evaluator;

    public GreedyPlayer(MoveGenerator generator, Evaluator evaluator) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public Move chooseMove(GameState state, Color color) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(color, "color");
        SearchState root = SearchState.of(state, color);
        List<Move> moves = generator.legalMoves(root, color);
        Move best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Move move : moves) {
            root.push(move);
            double score = evaluator.score(root, color);
            root.pop();
            if (best == null || score > bestScore) {
                best = move;
                bestScore = score;
            }
        }
        if (best == null) {
            throw new NoLegalMoveException(color);
        }
        Move chosen = best;
        double chosenScore = bestScore;
        LOGGER.fine(() -> String.format("Greedy %s picked %s (score=%.1f of %d moves)", color, chosen,
                chosenScore, moves.size()));
        return chosen;
    }

    @Override
    public String describe() {
        return "greedy";
    }
}

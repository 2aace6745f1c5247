package com.chinesecheckers.core.ai;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.Evaluator;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.ai.state.SearchState;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Depth-limited alpha-beta over a {@link SearchState}, scoring every leaf from the perspective of one root
 * color. Plies of the root color maximize and plies of every other color minimize. A kernel keeps node and
 * cutoff counters and is therefore confined to a single thread.
 */
public final class MinimaxKernel {

    private static final Comparator<ScoredMove> BEST_FIRST =
            Comparator.comparingDouble(ScoredMove::score).reversed();

    private final MoveGenerator generator;
    private final Evaluator evaluator;
    private final Color rootColor;
    private final int branchLimit;

    private long visitedNodes;
    private long cutoffs;

    public MinimaxKernel(MoveGenerator generator, Evaluator evaluator, Color rootColor, int branchLimit) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.rootColor = Objects.requireNonNull(rootColor, "rootColor");
        if (branchLimit < 0) {
            throw new IllegalArgumentException("branchLimit must not be negative");
        }
        this.branchLimit = branchLimit;
    }

    public long visitedNodes() {
        return visitedNodes;
    }

    public long cutoffs() {
        return cutoffs;
    }

    /**
     * Returns the legal moves of the side to move, best first for that side according to the evaluator.
     * Equal scores keep generation order. Truncated to the branch limit when one is set.
     */
    public List<ScoredMove> orderedMoves(SearchState state) {
        Color mover = state.sideToMove();
        List<Move> moves = generator.legalMoves(state, mover);
        List<ScoredMove> scored = new ArrayList<>(moves.size());
        for (Move move : moves) {
            state.push(move);
            scored.add(new ScoredMove(move, evaluator.score(state, mover)));
            state.pop();
        }
        scored.sort(BEST_FIRST);
        if (branchLimit > 0 && scored.size() > branchLimit) {
            return new ArrayList<>(scored.subList(0, branchLimit));
        }
        return scored;
    }

    /**
     * Returns the minimax value of the current position of {@code state} searched {@code depth} plies deep.
     * The state is restored before returning.
     */
    public double search(SearchState state, int depth, double alpha, double beta) {
        visitedNodes++;
        if (depth <= 0 || state.winner() != null) {
            return evaluator.score(state, rootColor);
        }

        List<ScoredMove> moves = orderedMoves(state);
        if (moves.isEmpty()) {
            if (!generator.anyActiveColorCanMove(state)) {
                return evaluator.score(state, rootColor);
            }
            state.pass();
            double value = search(state, depth - 1, alpha, beta);
            state.pop();
            return value;
        }

        boolean maximizing = state.sideToMove() == rootColor;
        double best = maximizing ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        for (ScoredMove candidate : moves) {
            state.push(candidate.move());
            double value = search(state, depth - 1, alpha, beta);
            state.pop();
            if (maximizing) {
                best = Math.max(best, value);
                alpha = Math.max(alpha, value);
            } else {
                best = Math.min(best, value);
                beta = Math.min(beta, value);
            }
            if (alpha >= beta) {
                cutoffs++;
                break;
            }
        }
        return best;
    }

    /**
     * Searches every root move of {@code state}, whose side to move must be the root color, and returns the
     * first move reaching the highest value. Depth zero or less yields the best one-ply move.
     *
     * @return the best move with its value, or {@code null} if the root color has no legal move
     */
    public ScoredMove searchRoot(SearchState state, int depth) {
        if (state.sideToMove() != rootColor) {
            throw new IllegalStateException("Root color " + rootColor + " is not to move");
        }
        visitedNodes++;
        List<ScoredMove> moves = orderedMoves(state);
        if (moves.isEmpty()) {
            return null;
        }
        if (depth <= 0) {
            return moves.get(0);
        }
        ScoredMove best = null;
        double alpha = Double.NEGATIVE_INFINITY;
        for (ScoredMove candidate : moves) {
            state.push(candidate.move());
            double value = search(state, depth - 1, alpha, Double.POSITIVE_INFINITY);
            state.pop();
            if (best == null || value > best.score()) {
                best = new ScoredMove(candidate.move(), value);
            }
            alpha = Math.max(alpha, value);
        }
        return best;
    }

    /**
     * A move paired with the value it was given.
     */
    public record ScoredMove(Move move, double score) {
    }
}

package com.chinesecheckers.core.ai;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.Evaluator;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.NoLegalMoveException;
import com.chinesecheckers.core.ai.MinimaxKernel.ScoredMove;
import com.chinesecheckers.core.ai.parallel.ParallelMinimaxSearch;
import com.chinesecheckers.core.ai.state.SearchState;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Depth-limited minimax searcher with alpha-beta pruning. With more than two colors in play the search is
 * paranoid: every other color is assumed to play against the searching color. Requests in
 * {@link SearchConstraints.SearchMode#PAR} mode are delegated to a {@link ParallelMinimaxSearch} created on
 * first use.
 */
public final class MinimaxSearch implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(MinimaxSearch.class.getName());

    private final MoveGenerator generator;
    private final Evaluator evaluator;
    private ParallelMinimaxSearch parallelSearcher;

    public MinimaxSearch(MoveGenerator generator, Evaluator evaluator) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public MoveGenerator getGenerator() {
        return generator;
    }

    public Evaluator getEvaluator() {
        return evaluator;
    }

    public Move chooseMove(GameState state, Color color, int depth) {
        return search(state, color, SearchConstraints.ofDepth(Math.max(0, depth))).move();
    }

    @Override
    public SearchResult search(GameState state, Color color, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(constraints, "constraints");

        if (constraints.mode() == SearchConstraints.SearchMode.PAR) {
            return parallelSearcher().search(state, color, constraints);
        }

        long searchStart = System.nanoTime();
        SearchState searchState = SearchState.of(state, color);
        MinimaxKernel kernel = new MinimaxKernel(generator, evaluator, color, constraints.branchLimit());
        ScoredMove best = kernel.searchRoot(searchState, constraints.depthLimit());
        if (best == null) {
            throw new NoLegalMoveException(color);
        }
        if (searchState.ply() != 0) {
            throw new IllegalStateException("Search left " + searchState.ply() + " unpopped plies");
        }
        long elapsedNanos = System.nanoTime() - searchStart;

        SearchResult result = new SearchResult(best.move(), best.score(), constraints.depthLimit(),
                kernel.visitedNodes(), kernel.cutoffs(), elapsedNanos);
        LOGGER.info(() -> String.format("Minimax explored %d nodes (depth=%d, cutoffs=%d, mode=%s) for %s: %s",
                result.visitedNodes(), result.depthEvaluated(), result.cutoffs(), constraints.mode(), color,
                result.move()));
        return result;
    }

    /**
     * Releases the worker pool of the parallel delegate, if one was created.
     */
    public synchronized void shutdown() {
        if (parallelSearcher != null) {
            parallelSearcher.shutdown();
            parallelSearcher = null;
        }
    }

    private synchronized ParallelMinimaxSearch parallelSearcher() {
        if (parallelSearcher == null) {
            parallelSearcher = new ParallelMinimaxSearch(generator, evaluator);
        }
        return parallelSearcher;
    }
}

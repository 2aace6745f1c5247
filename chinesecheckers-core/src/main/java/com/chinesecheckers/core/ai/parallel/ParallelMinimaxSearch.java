package com.chinesecheckers.core.ai.parallel;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.Evaluator;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.NoLegalMoveException;
import com.chinesecheckers.core.ai.MinimaxKernel;
import com.chinesecheckers.core.ai.MinimaxKernel.ScoredMove;
import com.chinesecheckers.core.ai.SearchConstraints;
import com.chinesecheckers.core.ai.SearchResult;
import com.chinesecheckers.core.ai.Searcher;
import com.chinesecheckers.core.ai.state.SearchState;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;
import java.util.logging.Logger;

/**
 * Parallel minimax searcher splitting the root across a {@link ForkJoinPool}. Each root move is searched by
 * its own task on a private copy of the search buffer with a full window, so no bound is shared between
 * tasks. The highest value wins and ties go to the move that comes first in the root ordering, which makes
 * the choice identical to the sequential search.
 */
public final class ParallelMinimaxSearch implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(ParallelMinimaxSearch.class.getName());

    private final MoveGenerator generator;
    private final Evaluator evaluator;
    private final ForkJoinPool pool;

    public ParallelMinimaxSearch(MoveGenerator generator, Evaluator evaluator) {
        this(generator, evaluator, Runtime.getRuntime().availableProcessors());
    }

    public ParallelMinimaxSearch(MoveGenerator generator, Evaluator evaluator, int parallelism) {
        this(generator, evaluator, createPool(parallelism));
    }

    public ParallelMinimaxSearch(MoveGenerator generator, Evaluator evaluator, ForkJoinPool pool) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    private static ForkJoinPool createPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        return new ForkJoinPool(parallelism);
    }

    /**
     * Shuts down the underlying {@link ForkJoinPool}.
     */
    public void shutdown() {
        pool.shutdown();
    }

    @Override
    public SearchResult search(GameState state, Color color, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(constraints, "constraints");

        long searchStart = System.nanoTime();
        SearchState root = SearchState.of(state, color);
        RootTask rootTask = new RootTask(root, color, constraints);
        RootOutcome outcome = pool.invoke(rootTask);
        if (outcome.best == null) {
            throw new NoLegalMoveException(color);
        }
        long elapsedNanos = System.nanoTime() - searchStart;

        SearchResult result = new SearchResult(outcome.best.move(), outcome.best.score(),
                constraints.depthLimit(), outcome.visitedNodes, outcome.cutoffs, elapsedNanos);
        LOGGER.info(() -> String.format("Parallel minimax explored %d nodes (depth=%d, cutoffs=%d, tasks=%d) for %s: %s",
                result.visitedNodes(), result.depthEvaluated(), result.cutoffs(), outcome.tasks, color,
                result.move()));
        return result;
    }

    private final class RootTask extends RecursiveTask<RootOutcome> {

        private final SearchState state;
        private final Color color;
        private final SearchConstraints constraints;

        RootTask(SearchState state, Color color, SearchConstraints constraints) {
            this.state = state;
            this.color = color;
            this.constraints = constraints;
        }

        @Override
        protected RootOutcome compute() {
            MinimaxKernel kernel = new MinimaxKernel(generator, evaluator, color, constraints.branchLimit());
            int depth = constraints.depthLimit();
            if (depth <= 1) {
                ScoredMove best = kernel.searchRoot(state, depth);
                return new RootOutcome(best, kernel.visitedNodes(), kernel.cutoffs(), 0);
            }

            List<ScoredMove> moves = kernel.orderedMoves(state);
            List<BranchTask> branches = new ArrayList<>(moves.size());
            for (ScoredMove candidate : moves) {
                SearchState branchState = state.copy();
                branchState.push(candidate.move());
                BranchTask task = new BranchTask(branchState, color, depth - 1, constraints.branchLimit());
                branches.add(task);
                task.fork();
            }

            ScoredMove best = null;
            long visited = kernel.visitedNodes() + 1;
            long cutoffs = kernel.cutoffs();
            for (int i = 0; i < branches.size(); i++) {
                BranchTask task = branches.get(i);
                double value = task.join();
                visited += task.visitedNodes;
                cutoffs += task.cutoffs;
                if (best == null || value > best.score()) {
                    best = new ScoredMove(moves.get(i).move(), value);
                }
            }
            return new RootOutcome(best, visited, cutoffs, branches.size());
        }
    }

    private final class BranchTask extends RecursiveTask<Double> {

        private final SearchState state;
        private final Color color;
        private final int depth;
        private final int branchLimit;
        private long visitedNodes;
        private long cutoffs;

        BranchTask(SearchState state, Color color, int depth, int branchLimit) {
            this.state = state;
            this.color = color;
            this.depth = depth;
            this.branchLimit = branchLimit;
        }

        @Override
        protected Double compute() {
            MinimaxKernel kernel = new MinimaxKernel(generator, evaluator, color, branchLimit);
            double value = kernel.search(state, depth, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
            visitedNodes = kernel.visitedNodes();
            cutoffs = kernel.cutoffs();
            return value;
        }
    }

    private static final class RootOutcome {
        private final ScoredMove best;
        private final long visitedNodes;
        private final long cutoffs;
        private final int tasks;

        RootOutcome(ScoredMove best, long visitedNodes, long cutoffs, int tasks) {
            this.best = best;
            this.visitedNodes = visitedNodes;
            this.cutoffs = cutoffs;
            this.tasks = tasks;
        }
    }
}

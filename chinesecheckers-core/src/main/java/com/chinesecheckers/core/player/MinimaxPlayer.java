package com.chinesecheckers.core.player;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.ai.SearchConstraints;
import com.chinesecheckers.core.ai.SearchResult;
import com.chinesecheckers.core.ai.Searcher;
import java.util.Objects;

/**
 * Seat delegating to a {@link Searcher}. The result of the latest search is kept for renderers.
 */
public final class MinimaxPlayer implements Player {

    private final Searcher searcher;
    private final SearchConstraints constraints;
    private volatile SearchResult lastResult;

    public MinimaxPlayer(Searcher searcher, SearchConstraints constraints) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    @Override
    public Move chooseMove(GameState state, Color color) {
        SearchResult result = searcher.search(state, color, constraints);
        lastResult = result;
        return result.move();
    }

    public SearchConstraints getConstraints() {
        return constraints;
    }

    /**
     * Returns the result of the most recent search, or {@code null} before the first one.
     */
    public SearchResult lastResult() {
        return lastResult;
    }

    @Override
    public String describe() {
        return "minimax(depth=" + constraints.depthLimit() + ")";
    }
}

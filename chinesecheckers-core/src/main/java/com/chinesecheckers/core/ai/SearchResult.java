package com.chinesecheckers.core.ai;

import com.chinesecheckers.core.Move;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 */
public record SearchResult(Move move, double score, int depthEvaluated, long visitedNodes, long cutoffs,
        long elapsedNanos) {

    public SearchResult {
        Objects.requireNonNull(move, "move");
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}

package com.chinesecheckers.core.ai;

import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations. A depth of zero asks for the
 * greedy one-ply choice; a branch limit of zero keeps every move at every node.
 */
public record SearchConstraints(int depthLimit, int branchLimit, SearchMode mode) {

    public SearchConstraints {
        Objects.requireNonNull(mode, "mode");
        if (depthLimit < 0) {
            throw new IllegalArgumentException("depthLimit must not be negative");
        }
        if (branchLimit < 0) {
            throw new IllegalArgumentException("branchLimit must not be negative");
        }
    }

    public static SearchConstraints ofDepth(int depthLimit) {
        return new SearchConstraints(depthLimit, 0, SearchMode.SEQ);
    }

    /**
     * Execution strategy hint for {@link Searcher} implementations.
     */
    public enum SearchMode {
        SEQ,
        PAR
    }
}

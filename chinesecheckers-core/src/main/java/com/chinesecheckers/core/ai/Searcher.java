package com.chinesecheckers.core.ai;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Searches for the best move of {@code color} in the provided {@link GameState} under the supplied
     * {@link SearchConstraints}. The state is never modified.
     *
     * @param state the starting state to analyse
     * @param color the color whose move is searched; scores are from its perspective
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     * @throws com.chinesecheckers.core.NoLegalMoveException if {@code color} cannot move
     */
    SearchResult search(GameState state, Color color, SearchConstraints constraints);
}

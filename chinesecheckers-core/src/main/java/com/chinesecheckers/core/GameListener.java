package com.chinesecheckers.core;

/**
 * Observer of a game driven by {@link TurnController}. Every callback receives a private copy of the state.
 * Exceptions thrown by listeners are logged and otherwise ignored.
 */
public interface GameListener {

    default void onTurnStarted(GameState state, Color color) {
    }

    default void onMoveApplied(GameState state, Color color, Move move) {
    }

    /**
     * Called for voluntary passes and for turns skipped because the color could not move.
     */
    default void onTurnSkipped(GameState state, TurnResult result) {
    }

    default void onColorResigned(GameState state, Color color) {
    }

    default void onGameOver(GameState state, GameOutcome outcome) {
    }
}

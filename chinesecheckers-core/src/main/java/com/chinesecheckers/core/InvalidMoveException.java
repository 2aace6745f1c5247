package com.chinesecheckers.core;

/**
 * Thrown when a move is rejected before any state is changed.
 */
public class InvalidMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient Move move;

    public InvalidMoveException(Move move, String message) {
        super(message);
        this.move = move;
    }

    public Move getMove() {
        return move;
    }
}

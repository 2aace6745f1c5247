package com.chinesecheckers.core;

/**
 * Signals that a color has no legal move with any of its pegs.
 */
public class NoLegalMoveException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final Color color;

    public NoLegalMoveException(Color color) {
        super("No legal moves available for " + color);
        this.color = color;
    }

    public Color getColor() {
        return color;
    }
}

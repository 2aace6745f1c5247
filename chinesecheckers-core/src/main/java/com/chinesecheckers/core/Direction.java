package com.chinesecheckers.core;

/**
 * The six hex directions in axial coordinates. Negative {@code r} points towards the top of the board.
 */
public enum Direction {
    EAST(1, 0),
    NORTH_EAST(1, -1),
    NORTH_WEST(0, -1),
    WEST(-1, 0),
    SOUTH_WEST(-1, 1),
    SOUTH_EAST(0, 1);

    private static final Direction[] VALUES = values();

    private final int dq;
    private final int dr;

    Direction(int dq, int dr) {
        this.dq = dq;
        this.dr = dr;
    }

    public int dq() {
        return dq;
    }

    public int dr() {
        return dr;
    }

    public Direction opposite() {
        return VALUES[(ordinal() + 3) % VALUES.length];
    }

    /**
     * Returns the direction {@code d} for which {@code to == from + steps * d}, or {@code null} if the two
     * cells are not aligned at exactly that distance.
     */
    public static Direction between(Cell from, Cell to, int steps) {
        int deltaQ = to.q() - from.q();
        int deltaR = to.r() - from.r();
        for (Direction direction : VALUES) {
            if (direction.dq * steps == deltaQ && direction.dr * steps == deltaR) {
                return direction;
            }
        }
        return null;
    }
}

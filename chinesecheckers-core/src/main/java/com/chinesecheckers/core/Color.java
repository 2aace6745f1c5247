package com.chinesecheckers.core;

/**
 * Player colors in clockwise order around the star, starting at the top point. Each color starts in its
 * home triangle and must fill the triangle of its {@link #opposite()} color.
 */
public enum Color {
    RED('R', 1, -1),
    YELLOW('Y', 0, 1),
    GREEN('G', 2, -1),
    CYAN('C', 1, 1),
    BLUE('B', 0, -1),
    MAGENTA('M', 2, 1);

    private static final Color[] VALUES = values();

    private final char symbol;
    private final int axis;
    private final int sign;

    Color(char symbol, int axis, int sign) {
        this.symbol = symbol;
        this.axis = axis;
        this.sign = sign;
    }

    public char symbol() {
        return symbol;
    }

    public Color opposite() {
        return VALUES[(ordinal() + 3) % VALUES.length];
    }

    /**
     * Signed cube coordinate along this color's home axis: 8 at the home tip, greater than 4 inside the home
     * triangle, less than -4 inside the target triangle and -8 at the target tip.
     */
    public int axisValue(Cell cell) {
        return sign * cube(cell, axis);
    }

    /**
     * Distance of the cell from the straight line joining this color's home and target tips.
     */
    public int lateralOffset(Cell cell) {
        return Math.abs(cube(cell, (axis + 1) % 3) - cube(cell, (axis + 2) % 3));
    }

    public static Color fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Color color : VALUES) {
            if (color.symbol == upper) {
                return color;
            }
        }
        throw new IllegalArgumentException("Unknown color symbol: " + symbol);
    }

    private static int cube(Cell cell, int axis) {
        switch (axis) {
            case 0:
                return cell.q();
            case 1:
                return cell.r();
            default:
                return cell.s();
        }
    }
}

package com.chinesecheckers.core;

/**
 * Immutable axial hex coordinate. The implied third cube coordinate is {@code s = -q - r}.
 */
public record Cell(int q, int r) {

    public int s() {
        return -q - r;
    }

    public Cell neighbor(Direction direction) {
        return new Cell(q + direction.dq(), r + direction.dr());
    }

    /**
     * Hex distance in single steps, ignoring occupancy and board bounds.
     */
    public int distanceTo(Cell other) {
        int dq = Math.abs(q - other.q);
        int dr = Math.abs(r - other.r);
        int ds = Math.abs(s() - other.s());
        return Math.max(dq, Math.max(dr, ds));
    }

    /**
     * Parses the {@code q,r} notation produced by {@link #toString()}, with or without parentheses.
     */
    public static Cell parse(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        String[] parts = trimmed.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected a cell as q,r but got: " + text);
        }
        return new Cell(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
    }

    @Override
    public String toString() {
        return "(" + q + "," + r + ")";
    }
}

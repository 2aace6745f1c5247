package com.chinesecheckers.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable topology of the standard six-pointed star board. Cells are indexed row by row from the top point
 * so that search code can work with plain arrays; the adjacency table is precomputed per direction.
 */
public final class Board {

    public static final int CELL_COUNT = 121;
    public static final int CENTER_CELL_COUNT = 61;
    public static final int TRIANGLE_SIZE = 10;
    public static final int PEGS_PER_COLOR = TRIANGLE_SIZE;

    private static final int CENTER_RADIUS = 4;
    private static final int EXTENT = 2 * CENTER_RADIUS;
    private static final int GRID_SIZE = 2 * EXTENT + 1;
    private static final Direction[] DIRECTIONS = Direction.values();

    private static final Board STANDARD = new Board();

    private final List<Cell> cells;
    private final int[][] indexGrid;
    private final int[][] neighbors;
    private final Color[] regions;
    private final Map<Color, int[]> triangleIndices;
    private final Map<Color, Set<Cell>> triangles;

    private Board() {
        List<Cell> collected = new ArrayList<>();
        int[][] grid = new int[GRID_SIZE][GRID_SIZE];
        for (int r = -EXTENT; r <= EXTENT; r++) {
            for (int q = -EXTENT; q <= EXTENT; q++) {
                grid[q + EXTENT][r + EXTENT] = -1;
                if (onStar(q, r)) {
                    grid[q + EXTENT][r + EXTENT] = collected.size();
                    collected.add(new Cell(q, r));
                }
            }
        }
        this.cells = Collections.unmodifiableList(collected);
        this.indexGrid = grid;

        int count = collected.size();
        int[][] adjacency = new int[count][DIRECTIONS.length];
        Color[] regionByIndex = new Color[count];
        Map<Color, List<Integer>> members = new EnumMap<>(Color.class);
        for (Color color : Color.values()) {
            members.put(color, new ArrayList<>());
        }
        for (int index = 0; index < count; index++) {
            Cell cell = collected.get(index);
            for (Direction direction : DIRECTIONS) {
                adjacency[index][direction.ordinal()] = lookup(cell.q() + direction.dq(), cell.r() + direction.dr());
            }
            for (Color color : Color.values()) {
                if (color.axisValue(cell) > CENTER_RADIUS) {
                    if (regionByIndex[index] != null) {
                        throw new IllegalStateException("Cell " + cell + " belongs to two triangles");
                    }
                    regionByIndex[index] = color;
                    members.get(color).add(index);
                }
            }
        }
        this.neighbors = adjacency;
        this.regions = regionByIndex;

        Map<Color, int[]> indices = new EnumMap<>(Color.class);
        Map<Color, Set<Cell>> cellSets = new EnumMap<>(Color.class);
        for (Color color : Color.values()) {
            List<Integer> list = members.get(color);
            int[] array = list.stream().mapToInt(Integer::intValue).toArray();
            Set<Cell> set = new LinkedHashSet<>();
            for (int index : array) {
                set.add(collected.get(index));
            }
            indices.put(color, array);
            cellSets.put(color, Collections.unmodifiableSet(set));
        }
        this.triangleIndices = indices;
        this.triangles = cellSets;

        validate();
    }

    /**
     * Returns the shared standard board.
     */
    public static Board standard() {
        return STANDARD;
    }

    public int cellCount() {
        return cells.size();
    }

    public List<Cell> cells() {
        return cells;
    }

    public boolean isValidCell(int q, int r) {
        return lookup(q, r) >= 0;
    }

    public boolean isValidCell(Cell cell) {
        return cell != null && isValidCell(cell.q(), cell.r());
    }

    /**
     * Returns the index of the cell, failing for coordinates outside the star.
     */
    public int indexOf(Cell cell) {
        int index = lookup(cell.q(), cell.r());
        if (index < 0) {
            throw new IllegalArgumentException("Cell " + cell + " is not on the board");
        }
        return index;
    }

    public Cell cellAt(int index) {
        return cells.get(index);
    }

    /**
     * Returns the index of the neighbor in the given direction, or {@code -1} at the board edge.
     */
    public int neighbor(int index, Direction direction) {
        return neighbors[index][direction.ordinal()];
    }

    public Set<Cell> neighbors(Cell cell) {
        int index = indexOf(cell);
        Set<Cell> result = new LinkedHashSet<>();
        for (Direction direction : DIRECTIONS) {
            int neighbor = neighbors[index][direction.ordinal()];
            if (neighbor >= 0) {
                result.add(cells.get(neighbor));
            }
        }
        return result;
    }

    /**
     * Returns the color whose home triangle contains the cell at {@code index}, or {@code null} for the center.
     */
    public Color regionAt(int index) {
        return regions[index];
    }

    public Color regionOf(Cell cell) {
        return regions[indexOf(cell)];
    }

    public boolean isCenter(Cell cell) {
        return regionOf(cell) == null;
    }

    public Set<Cell> homeRegion(Color color) {
        return triangles.get(color);
    }

    public Set<Cell> targetRegion(Color color) {
        return triangles.get(color.opposite());
    }

    public int[] homeIndices(Color color) {
        return triangleIndices.get(color).clone();
    }

    public boolean isInTarget(int index, Color color) {
        return regions[index] == color.opposite();
    }

    public boolean isInHome(int index, Color color) {
        return regions[index] == color;
    }

    private int lookup(int q, int r) {
        if (q < -EXTENT || q > EXTENT || r < -EXTENT || r > EXTENT) {
            return -1;
        }
        return indexGrid[q + EXTENT][r + EXTENT];
    }

    private void validate() {
        if (cells.size() != CELL_COUNT) {
            throw new IllegalStateException("Star board has " + cells.size() + " cells instead of " + CELL_COUNT);
        }
        int center = 0;
        for (Color region : regions) {
            if (region == null) {
                center++;
            }
        }
        if (center != CENTER_CELL_COUNT) {
            throw new IllegalStateException("Center hexagon has " + center + " cells instead of " + CENTER_CELL_COUNT);
        }
        for (Color color : Color.values()) {
            int size = triangleIndices.get(color).length;
            if (size != TRIANGLE_SIZE) {
                throw new IllegalStateException("Triangle of " + color + " has " + size + " cells");
            }
        }
        for (int index = 0; index < neighbors.length; index++) {
            for (Direction direction : DIRECTIONS) {
                int neighbor = neighbors[index][direction.ordinal()];
                if (neighbor >= 0 && neighbors[neighbor][direction.opposite().ordinal()] != index) {
                    throw new IllegalStateException("Adjacency is not symmetric between " + cells.get(index)
                            + " and " + cells.get(neighbor));
                }
            }
        }
    }

    private static boolean onStar(int q, int r) {
        int s = -q - r;
        boolean upward = q >= -CENTER_RADIUS && r >= -CENTER_RADIUS && s >= -CENTER_RADIUS;
        boolean downward = q <= CENTER_RADIUS && r <= CENTER_RADIUS && s <= CENTER_RADIUS;
        return upward || downward;
    }
}

package com.chinesecheckers.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single turn for one peg: the origin, the final destination and the intermediate landing cells of a jump
 * chain. Single steps and single jumps have no intermediate cells.
 */
public record Move(Cell origin, Cell destination, List<Cell> hops) {

    public Move {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
        hops = hops == null ? List.of() : List.copyOf(hops);
        if (origin.equals(destination)) {
            throw new IllegalArgumentException("Move must leave its origin: " + origin);
        }
    }

    public static Move of(Cell origin, Cell destination) {
        return new Move(origin, destination, List.of());
    }

    /**
     * Returns {@code true} for a move to an adjacent cell.
     */
    public boolean isStep() {
        return hops.isEmpty() && origin.distanceTo(destination) == 1;
    }

    public boolean isJump() {
        return !isStep();
    }

    /**
     * Returns every cell the peg touches, origin and destination included.
     */
    public List<Cell> path() {
        List<Cell> path = new ArrayList<>(hops.size() + 2);
        path.add(origin);
        path.addAll(hops);
        path.add(destination);
        return Collections.unmodifiableList(path);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Cell cell : path()) {
            if (builder.length() > 0) {
                builder.append("->");
            }
            builder.append(cell);
        }
        return builder.toString();
    }
}

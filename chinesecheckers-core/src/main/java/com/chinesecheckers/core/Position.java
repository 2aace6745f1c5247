package com.chinesecheckers.core;

import java.util.List;

/**
 * Read-only view of peg placement shared by {@link GameState} and the search buffers. Turns belong to sides,
 * each named after its lead color; see {@link Teams}.
 */
public interface Position {

    Board board();

    /**
     * Returns the color of the peg on the cell with the given board index, or {@code null} if it is empty.
     */
    Color colorAt(int index);

    Color sideToMove();

    Teams teams();

    /**
     * Sides that have pegs on the board, in turn order. Resigned sides stay listed.
     */
    List<Color> participants();

    /**
     * Sides still taking turns, in turn order.
     */
    List<Color> activeColors();

    default Color colorAt(Cell cell) {
        return colorAt(board().indexOf(cell));
    }

    default boolean isEmpty(Cell cell) {
        return colorAt(cell) == null;
    }

    /**
     * Returns the side moving the peg on the cell with the given index, or {@code null} if it is empty.
     */
    default Color sideAt(int index) {
        Color peg = colorAt(index);
        return peg == null ? null : teams().sideOf(peg);
    }

    /**
     * Returns {@code true} if every peg of every color the side controls rests in the target triangle of its
     * own color.
     */
    default boolean hasWon(Color side) {
        Board board = board();
        Teams teams = teams();
        int pegs = 0;
        for (int index = 0; index < board.cellCount(); index++) {
            Color peg = colorAt(index);
            if (peg != null && teams.sideOf(peg) == side) {
                if (!board.isInTarget(index, peg)) {
                    return false;
                }
                pegs++;
            }
        }
        return pegs > 0;
    }

    /**
     * Returns the first participant in turn order that has won, or {@code null}.
     */
    default Color winner() {
        for (Color side : participants()) {
            if (hasWon(side)) {
                return side;
            }
        }
        return null;
    }
}

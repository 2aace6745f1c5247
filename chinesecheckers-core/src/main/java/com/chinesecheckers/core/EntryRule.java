package com.chinesecheckers.core;

/**
 * Restriction on where a move may end.
 */
public enum EntryRule {

    /** Any empty cell reached by a step or jump chain is a legal destination. */
    UNRESTRICTED,

    /**
     * A move may only end in the center hexagon, the mover's home triangle or its target triangle. Jump chains
     * may still pass through other triangles.
     */
    NO_FOREIGN_TRIANGLES;

    public boolean canEnd(Board board, int index, Color mover) {
        if (this == UNRESTRICTED) {
            return true;
        }
        Color region = board.regionAt(index);
        return region == null || region == mover || region == mover.opposite();
    }
}

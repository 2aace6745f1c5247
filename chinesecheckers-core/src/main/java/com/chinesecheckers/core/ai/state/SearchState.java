package com.chinesecheckers.core.ai.state;

import com.chinesecheckers.core.Board;
import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.Position;
import com.chinesecheckers.core.Teams;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mutable search buffer that lets tree explorations play and undo moves without copying the board per node.
 * Every {@link #push(Move)} or {@link #pass()} must be undone by a matching {@link #pop()} before a sibling is
 * explored. Moves are trusted to be legal; they come from the move generator.
 */
public final class SearchState implements Position {

    private static final int INITIAL_PLY_CAPACITY = 64;
    private static final int PASS = -1;

    private final Board board;
    private final Color[] occupancy;
    private final Teams teams;
    private final List<Color> active;

    private int[] fromStack;
    private int[] toStack;
    private Color[] sideStack;
    private Color sideToMove;
    private int ply;

    private SearchState(Board board, Color[] occupancy, Teams teams, List<Color> active, Color sideToMove,
            int capacity) {
        this.board = board;
        this.occupancy = occupancy;
        this.teams = teams;
        this.active = active;
        this.sideToMove = sideToMove;
        this.fromStack = new int[capacity];
        this.toStack = new int[capacity];
        this.sideStack = new Color[capacity];
    }

    /**
     * Mirrors the given state with {@code rootSide} to move.
     */
    public static SearchState of(GameState state, Color rootSide) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(rootSide, "rootSide");
        if (!state.activeColors().contains(rootSide)) {
            throw new IllegalArgumentException(rootSide + " is not in play");
        }
        return new SearchState(state.board(), state.occupancySnapshot(), state.teams(),
                List.copyOf(state.activeColors()), rootSide, INITIAL_PLY_CAPACITY);
    }

    /**
     * Returns an independent buffer rooted at the current position of this one.
     */
    public SearchState copy() {
        return new SearchState(board, occupancy.clone(), teams, active, sideToMove, INITIAL_PLY_CAPACITY);
    }

    @Override
    public Board board() {
        return board;
    }

    @Override
    public Color colorAt(int index) {
        return occupancy[index];
    }

    @Override
    public Color sideToMove() {
        return sideToMove;
    }

    @Override
    public Teams teams() {
        return teams;
    }

    @Override
    public List<Color> participants() {
        return teams.sides();
    }

    @Override
    public List<Color> activeColors() {
        return active;
    }

    public int ply() {
        return ply;
    }

    public void push(Move move) {
        int from = board.indexOf(move.origin());
        int to = board.indexOf(move.destination());
        if (occupancy[from] == null || teams.sideOf(occupancy[from]) != sideToMove || occupancy[to] != null) {
            throw new IllegalStateException("Cannot push " + move + " for " + sideToMove);
        }
        record(from, to);
        occupancy[to] = occupancy[from];
        occupancy[from] = null;
        sideToMove = nextAfter(sideToMove);
    }

    /**
     * Hands the turn to the next side in play without moving.
     */
    public void pass() {
        record(PASS, PASS);
        sideToMove = nextAfter(sideToMove);
    }

    public void pop() {
        if (ply == 0) {
            throw new IllegalStateException("Cannot pop root state");
        }
        ply--;
        int from = fromStack[ply];
        int to = toStack[ply];
        if (from != PASS) {
            occupancy[from] = occupancy[to];
            occupancy[to] = null;
        }
        sideToMove = sideStack[ply];
    }

    private void record(int from, int to) {
        if (ply == fromStack.length) {
            int capacity = fromStack.length * 2;
            fromStack = Arrays.copyOf(fromStack, capacity);
            toStack = Arrays.copyOf(toStack, capacity);
            sideStack = Arrays.copyOf(sideStack, capacity);
        }
        fromStack[ply] = from;
        toStack[ply] = to;
        sideStack[ply] = sideToMove;
        ply++;
    }

    private Color nextAfter(Color color) {
        int start = active.indexOf(color);
        return active.get((start + 1) % active.size());
    }
}

package com.chinesecheckers.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates legal moves: single steps to empty neighbors and every prefix of every jump chain. Jump chains
 * are explored breadth first so each landing cell is reached once, by its shortest chain. The moving peg's
 * origin counts as empty for the rest of its chain and can never be landed on again.
 */
public final class MoveGenerator {

    private static final Direction[] DIRECTIONS = Direction.values();

    private final Board board;
    private final EntryRule entryRule;

    public MoveGenerator(Board board) {
        this(board, EntryRule.UNRESTRICTED);
    }

    public MoveGenerator(Board board, EntryRule entryRule) {
        this.board = Objects.requireNonNull(board, "board");
        this.entryRule = Objects.requireNonNull(entryRule, "entryRule");
    }

    public Board getBoard() {
        return board;
    }

    public EntryRule getEntryRule() {
        return entryRule;
    }

    /**
     * Returns all legal moves of the peg on {@code origin}; empty if the cell holds no peg or the peg is
     * blocked.
     */
    public List<Move> legalMoves(Position position, Cell origin) {
        List<Move> moves = new ArrayList<>();
        generate(position, board.indexOf(origin), moves);
        return moves;
    }

    /**
     * Returns the union of the legal moves of every peg the side controls, whatever its color.
     */
    public List<Move> legalMoves(Position position, Color side) {
        List<Move> moves = new ArrayList<>();
        for (int index = 0; index < board.cellCount(); index++) {
            if (position.sideAt(index) == side) {
                generate(position, index, moves);
            }
        }
        return moves;
    }

    public boolean hasLegalMove(Position position, Color side) {
        List<Move> scratch = new ArrayList<>();
        for (int index = 0; index < board.cellCount(); index++) {
            if (position.sideAt(index) == side) {
                generate(position, index, scratch);
                if (!scratch.isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if any side still in play can move.
     */
    public boolean anyActiveColorCanMove(Position position) {
        for (Color side : position.activeColors()) {
            if (hasLegalMove(position, side)) {
                return true;
            }
        }
        return false;
    }

    public boolean isLegal(Position position, Move move) {
        if (!board.isValidCell(move.origin())) {
            return false;
        }
        return legalMoves(position, move.origin()).contains(move);
    }

    /**
     * Finds the legal move of the peg on {@code origin} that ends on {@code destination}, or {@code null}.
     */
    public Move findMove(Position position, Cell origin, Cell destination) {
        if (!board.isValidCell(origin) || !board.isValidCell(destination)) {
            return null;
        }
        for (Move move : legalMoves(position, origin)) {
            if (move.destination().equals(destination)) {
                return move;
            }
        }
        return null;
    }

    /**
     * Appends the legal moves of the peg on {@code originIndex} to {@code out}. The entry rule is applied to the
     * peg's own color.
     */
    public void generate(Position position, int originIndex, List<Move> out) {
        Color mover = position.colorAt(originIndex);
        if (mover == null) {
            return;
        }
        Cell origin = board.cellAt(originIndex);

        for (Direction direction : DIRECTIONS) {
            int step = board.neighbor(originIndex, direction);
            if (step >= 0 && position.colorAt(step) == null && entryRule.canEnd(board, step, mover)) {
                out.add(Move.of(origin, board.cellAt(step)));
            }
        }

        int cellCount = board.cellCount();
        int[] parent = new int[cellCount];
        Arrays.fill(parent, -1);
        boolean[] visited = new boolean[cellCount];
        int[] queue = new int[cellCount];
        int head = 0;
        int tail = 0;
        visited[originIndex] = true;
        queue[tail++] = originIndex;

        while (head < tail) {
            int current = queue[head++];
            for (Direction direction : DIRECTIONS) {
                int over = board.neighbor(current, direction);
                if (over < 0 || !isOccupied(position, over, originIndex)) {
                    continue;
                }
                int landing = board.neighbor(over, direction);
                if (landing < 0 || visited[landing] || isOccupied(position, landing, originIndex)) {
                    continue;
                }
                visited[landing] = true;
                parent[landing] = current;
                queue[tail++] = landing;
                if (entryRule.canEnd(board, landing, mover)) {
                    out.add(buildJump(origin, originIndex, landing, parent));
                }
            }
        }
    }

    private static boolean isOccupied(Position position, int index, int originIndex) {
        return index != originIndex && position.colorAt(index) != null;
    }

    private Move buildJump(Cell origin, int originIndex, int landing, int[] parent) {
        List<Cell> hops = new ArrayList<>();
        int cursor = parent[landing];
        while (cursor != originIndex) {
            hops.add(board.cellAt(cursor));
            cursor = parent[cursor];
        }
        Collections.reverse(hops);
        return new Move(origin, board.cellAt(landing), hops);
    }
}

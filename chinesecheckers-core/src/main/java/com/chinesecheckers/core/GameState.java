package com.chinesecheckers.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable state of a Chinese Checkers match: peg placement, the sides taking part, whose turn it is and how
 * many turns have been played. The state only changes through {@link #applyMove(Move)}, {@link #passTurn()}
 * and {@link #resign(Color)}; moves are fully validated before anything is mutated.
 */
public final class GameState implements Position {

    private final Board board;
    private final Color[] occupancy;
    private final Teams teams;
    private final List<Color> participants;
    private final List<Color> active;
    private final Map<Color, Integer> pegCounts;
    private Color sideToMove;
    private int turnNumber;

    private GameState(Board board, Color[] occupancy, Teams teams, List<Color> active,
            Map<Color, Integer> pegCounts, Color sideToMove, int turnNumber) {
        this.board = board;
        this.occupancy = occupancy;
        this.teams = teams;
        this.participants = teams.sides();
        this.active = active;
        this.pegCounts = pegCounts;
        this.sideToMove = sideToMove;
        this.turnNumber = turnNumber;
    }

    /**
     * Creates the starting position with one side per listed color.
     */
    public static GameState initial(Board board, List<Color> colors) {
        return initial(board, Teams.solo(colors));
    }

    /**
     * Creates the starting position: every color fills its home triangle and the first side moves.
     */
    public static GameState initial(Board board, Teams teams) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(teams, "teams");
        Color[] occupancy = new Color[board.cellCount()];
        for (Color color : teams.colors()) {
            for (int index : board.homeIndices(color)) {
                occupancy[index] = color;
            }
        }
        return create(board, occupancy, teams, teams.sides().get(0));
    }

    /**
     * Creates an arbitrary position with one side per color in {@code turnOrder}.
     */
    public static GameState fromPlacements(Board board, Map<Cell, Color> placements, List<Color> turnOrder,
            Color sideToMove) {
        return fromPlacements(board, placements, Teams.solo(turnOrder), sideToMove);
    }

    /**
     * Creates an arbitrary position. Colors on the board may have any number of pegs, which is useful for
     * analysing endgames and for tests.
     */
    public static GameState fromPlacements(Board board, Map<Cell, Color> placements, Teams teams,
            Color sideToMove) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(placements, "placements");
        Objects.requireNonNull(teams, "teams");
        if (!teams.sides().contains(sideToMove)) {
            throw new IllegalArgumentException("Side to move " + sideToMove + " is not in the turn order");
        }
        Color[] occupancy = new Color[board.cellCount()];
        for (Map.Entry<Cell, Color> entry : placements.entrySet()) {
            Color color = Objects.requireNonNull(entry.getValue(), "placement color");
            if (teams.sideOf(color) == null) {
                throw new IllegalArgumentException("Peg of " + color + " placed but the color is not playing");
            }
            occupancy[board.indexOf(entry.getKey())] = color;
        }
        return create(board, occupancy, teams, sideToMove);
    }

    private static GameState create(Board board, Color[] occupancy, Teams teams, Color sideToMove) {
        Map<Color, Integer> counts = new EnumMap<>(Color.class);
        for (Color color : teams.colors()) {
            counts.put(color, 0);
        }
        for (Color color : occupancy) {
            if (color != null) {
                counts.merge(color, 1, Integer::sum);
            }
        }
        return new GameState(board, occupancy, teams, new ArrayList<>(teams.sides()),
                Collections.unmodifiableMap(counts), sideToMove, 0);
    }

    /**
     * Returns an independent deep copy of this state.
     */
    public GameState copy() {
        return new GameState(board, occupancy.clone(), teams, new ArrayList<>(active), pegCounts, sideToMove,
                turnNumber);
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
        return participants;
    }

    @Override
    public List<Color> activeColors() {
        return Collections.unmodifiableList(active);
    }

    /**
     * Returns the number of turns played so far, passes included.
     */
    public int getTurnNumber() {
        return turnNumber;
    }

    /**
     * Returns the cells holding pegs of {@code color}, a single color rather than a whole side.
     */
    public List<Cell> piecesOf(Color color) {
        List<Cell> pieces = new ArrayList<>(Board.PEGS_PER_COLOR);
        for (int index = 0; index < occupancy.length; index++) {
            if (occupancy[index] == color) {
                pieces.add(board.cellAt(index));
            }
        }
        return pieces;
    }

    /**
     * Returns a copy of the raw occupancy array indexed by board cell index.
     */
    public Color[] occupancySnapshot() {
        return occupancy.clone();
    }

    public boolean isGameOver() {
        return winner() != null || active.size() < 2;
    }

    /**
     * Moves a peg of the side to move and hands the turn to the next active side.
     *
     * @throws InvalidMoveException if the origin is not the mover's peg, the destination is occupied or any
     *                              leg of the path is not a step or a jump over a peg onto an empty cell
     */
    public void applyMove(Move move) {
        Objects.requireNonNull(move, "move");
        validate(move);
        int from = board.indexOf(move.origin());
        int to = board.indexOf(move.destination());
        occupancy[to] = occupancy[from];
        occupancy[from] = null;
        advance();
    }

    /**
     * Hands the turn to the next active side without moving.
     */
    public void passTurn() {
        advance();
    }

    /**
     * Removes the side from the turn rotation. Its pegs stay on the board as obstacles.
     */
    public void resign(Color color) {
        if (!active.contains(color)) {
            throw new IllegalArgumentException(color + " is not in play");
        }
        if (color == sideToMove) {
            Color next = nextAfter(color);
            active.remove(color);
            sideToMove = next;
            turnNumber++;
        } else {
            active.remove(color);
        }
    }

    /**
     * Verifies that every color still has the number of pegs it started with and that the side to move is in
     * play.
     *
     * @throws IllegalStateException on any violation
     */
    public void checkInvariants() {
        Map<Color, Integer> counts = new EnumMap<>(Color.class);
        for (Color color : occupancy) {
            if (color != null) {
                counts.merge(color, 1, Integer::sum);
            }
        }
        for (Color color : teams.colors()) {
            int expected = pegCounts.get(color);
            int actual = counts.getOrDefault(color, 0);
            if (expected != actual) {
                throw new IllegalStateException(color + " has " + actual + " pegs instead of " + expected);
            }
        }
        if (!active.isEmpty() && !active.contains(sideToMove)) {
            throw new IllegalStateException("Side to move " + sideToMove + " is not in play");
        }
    }

    private void advance() {
        sideToMove = nextAfter(sideToMove);
        turnNumber++;
    }

    private Color nextAfter(Color color) {
        int start = participants.indexOf(color);
        for (int offset = 1; offset <= participants.size(); offset++) {
            Color candidate = participants.get((start + offset) % participants.size());
            if (active.contains(candidate)) {
                return candidate;
            }
        }
        return color;
    }

    private void validate(Move move) {
        if (!board.isValidCell(move.origin()) || !board.isValidCell(move.destination())) {
            throw new InvalidMoveException(move, "Move leaves the board: " + move);
        }
        for (Cell hop : move.hops()) {
            if (!board.isValidCell(hop)) {
                throw new InvalidMoveException(move, "Hop " + hop + " is not on the board");
            }
        }
        int from = board.indexOf(move.origin());
        if (occupancy[from] == null) {
            throw new InvalidMoveException(move, "No peg on " + move.origin());
        }
        if (teams.sideOf(occupancy[from]) != sideToMove) {
            throw new InvalidMoveException(move, "Peg on " + move.origin() + " belongs to " + occupancy[from]
                    + " but " + sideToMove + " is to move");
        }
        if (occupancy[board.indexOf(move.destination())] != null) {
            throw new InvalidMoveException(move, "Destination " + move.destination() + " is occupied");
        }
        if (move.isStep()) {
            return;
        }
        List<Cell> path = move.path();
        for (int leg = 1; leg < path.size(); leg++) {
            Cell start = path.get(leg - 1);
            Cell end = path.get(leg);
            Direction direction = Direction.between(start, end, 2);
            if (direction == null) {
                throw new InvalidMoveException(move, "Leg " + start + "->" + end + " is neither a step nor a jump");
            }
            Cell middle = start.neighbor(direction);
            if (!board.isValidCell(middle)) {
                throw new InvalidMoveException(move, "Jump " + start + "->" + end + " crosses the board edge");
            }
            int over = board.indexOf(middle);
            if (over == from || occupancy[over] == null) {
                throw new InvalidMoveException(move, "No peg to jump over between " + start + " and " + end);
            }
            int landing = board.indexOf(end);
            if (landing != from && occupancy[landing] != null) {
                throw new InvalidMoveException(move, "Landing cell " + end + " is occupied");
            }
            if (path.subList(0, leg).contains(end)) {
                throw new InvalidMoveException(move, "Jump chain revisits " + end);
            }
        }
    }
}

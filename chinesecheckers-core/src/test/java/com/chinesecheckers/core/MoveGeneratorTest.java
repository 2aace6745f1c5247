package com.chinesecheckers.core;

import static com.chinesecheckers.core.TestPositions.BOARD;
import static com.chinesecheckers.core.TestPositions.placements;
import static com.chinesecheckers.core.TestPositions.twoPlayer;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MoveGeneratorTest {

    private final MoveGenerator generator = new MoveGenerator(BOARD);

    @Test
    void lonePegStepsToEverySixNeighbors() {
        GameState state = twoPlayer(placements(new Cell(0, 0), Color.RED, new Cell(-4, 8), Color.CYAN), Color.RED);

        List<Move> moves = generator.legalMoves(state, new Cell(0, 0));

        assertEquals(6, moves.size());
        for (Move move : moves) {
            assertTrue(move.isStep(), move.toString());
        }
    }

    @Test
    void chainedJumpYieldsEveryPrefix() {
        GameState state = twoPlayer(placements(
                new Cell(0, 0), Color.RED,
                new Cell(1, 0), Color.CYAN,
                new Cell(3, 0), Color.CYAN), Color.RED);

        List<Move> moves = generator.legalMoves(state, new Cell(0, 0));

        assertTrue(moves.contains(Move.of(new Cell(0, 0), new Cell(2, 0))));
        assertTrue(moves.contains(new Move(new Cell(0, 0), new Cell(4, 0), List.of(new Cell(2, 0)))));
        assertEquals(7, moves.size(), "five steps plus the single and the double jump");
    }

    @Test
    void jumpChainsNeverRevisitCellsOrReturnToOrigin() {
        Cell origin = new Cell(0, 0);
        GameState state = twoPlayer(placements(
                origin, Color.RED,
                new Cell(1, 0), Color.CYAN,
                new Cell(2, -1), Color.CYAN,
                new Cell(1, -2), Color.CYAN,
                new Cell(0, -1), Color.CYAN), Color.RED);

        List<Move> moves = generator.legalMoves(state, origin);

        Set<Cell> destinations = new HashSet<>();
        for (Move move : moves) {
            assertTrue(destinations.add(move.destination()), "duplicate destination " + move.destination());
            List<Cell> path = move.path();
            assertEquals(path.size(), new HashSet<>(path).size(), "path revisits a cell: " + move);
            assertFalse(move.destination().equals(origin));
        }
        assertTrue(destinations.containsAll(Set.of(new Cell(2, 0), new Cell(0, -2), new Cell(2, -2))));
        assertTrue(moves.contains(new Move(origin, new Cell(2, -2), List.of(new Cell(2, 0)))));
    }

    @Test
    void everyGeneratedMoveIsAcceptedByTheState() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.GREEN, Color.BLUE));
        for (int ply = 0; ply < 12; ply++) {
            Color mover = state.sideToMove();
            List<Move> moves = generator.legalMoves(state, mover);
            assertFalse(moves.isEmpty());
            for (Move move : moves) {
                state.copy().applyMove(move);
            }
            state.applyMove(moves.get(moves.size() / 2));
            state.checkInvariants();
        }
    }

    @Test
    void sideMovesEveryPegItControls() {
        GameState state = TestPositions.pairs(placements(
                new Cell(0, 0), Color.RED,
                new Cell(0, 3), Color.YELLOW,
                new Cell(-4, 8), Color.CYAN), Color.RED);

        List<Move> moves = generator.legalMoves(state, Color.RED);

        Set<Cell> origins = new HashSet<>();
        for (Move move : moves) {
            origins.add(move.origin());
        }
        assertEquals(Set.of(new Cell(0, 0), new Cell(0, 3)), origins);
        assertEquals(12, moves.size());
        assertTrue(generator.legalMoves(state, Color.YELLOW).isEmpty(), "YELLOW does not lead a side");
        assertTrue(generator.hasLegalMove(state, Color.CYAN));
    }

    @Test
    void blockedPegHasNoMoves() {
        GameState state = TestPositions.redBlocked(Color.RED);

        assertTrue(generator.legalMoves(state, Color.RED).isEmpty());
        assertFalse(generator.hasLegalMove(state, Color.RED));
        assertTrue(generator.hasLegalMove(state, Color.CYAN));
        assertTrue(generator.anyActiveColorCanMove(state));
    }

    @Test
    void restrictedEntryForbidsEndingInForeignTrianglesButAllowsPassage() {
        Cell origin = new Cell(3, -1);
        Cell yellowCell = new Cell(5, -1);
        Cell landing = new Cell(3, 1);
        GameState state = twoPlayer(placements(
                origin, Color.RED,
                new Cell(4, -1), Color.CYAN,
                new Cell(4, 0), Color.CYAN), Color.RED);
        assertEquals(Color.YELLOW, BOARD.regionOf(yellowCell));

        List<Move> unrestricted = generator.legalMoves(state, origin);
        List<Move> restricted = new MoveGenerator(BOARD, EntryRule.NO_FOREIGN_TRIANGLES).legalMoves(state, origin);

        assertTrue(unrestricted.contains(Move.of(origin, yellowCell)));
        for (Move move : restricted) {
            Color region = BOARD.regionOf(move.destination());
            assertTrue(region == null || region == Color.RED || region == Color.CYAN, move.toString());
        }
        assertTrue(restricted.contains(new Move(origin, landing, List.of(yellowCell))));
    }

    @Test
    void findMoveResolvesOriginAndDestination() {
        GameState state = twoPlayer(placements(
                new Cell(0, 0), Color.RED,
                new Cell(1, 0), Color.CYAN,
                new Cell(3, 0), Color.CYAN), Color.RED);

        Move move = generator.findMove(state, new Cell(0, 0), new Cell(4, 0));

        assertEquals(List.of(new Cell(2, 0)), move.hops());
        assertTrue(generator.isLegal(state, move));
        assertNull(generator.findMove(state, new Cell(0, 0), new Cell(0, 3)));
        assertNull(generator.findMove(state, new Cell(8, -8), new Cell(0, 0)));
    }
}

package com.chinesecheckers.core;

import static com.chinesecheckers.core.TestPositions.BOARD;
import static com.chinesecheckers.core.TestPositions.PAIRS;
import static com.chinesecheckers.core.TestPositions.placements;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GameStateTest {

    @Test
    void initialStateFillsHomeTriangles() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.CYAN));

        assertEquals(Color.RED, state.sideToMove());
        assertEquals(0, state.getTurnNumber());
        assertEquals(List.of(Color.RED, Color.CYAN), state.participants());
        assertEquals(BOARD.homeRegion(Color.RED), new HashSet<>(state.piecesOf(Color.RED)));
        assertEquals(Board.PEGS_PER_COLOR, state.piecesOf(Color.CYAN).size());
        assertNull(state.winner());
        assertFalse(state.isGameOver());
    }

    @Test
    void teamStartFillsEveryControlledTriangle() {
        GameState state = GameState.initial(BOARD, PAIRS);

        assertEquals(List.of(Color.RED, Color.CYAN), state.participants());
        assertEquals(BOARD.homeRegion(Color.YELLOW), new HashSet<>(state.piecesOf(Color.YELLOW)));
        assertEquals(Board.PEGS_PER_COLOR, state.piecesOf(Color.BLUE).size());
        assertEquals(Color.RED, state.sideAt(BOARD.indexOf(state.piecesOf(Color.YELLOW).get(0))));
        state.checkInvariants();
    }

    @Test
    void sideMovesPegsOfEveryColorItControls() {
        Map<Cell, Color> placements = placements(
                new Cell(0, 0), Color.YELLOW,
                new Cell(0, 3), Color.BLUE);

        GameState redToMove = TestPositions.pairs(placements, Color.RED);
        redToMove.applyMove(Move.of(new Cell(0, 0), new Cell(1, 0)));
        assertEquals(Color.YELLOW, redToMove.colorAt(new Cell(1, 0)));
        assertEquals(Color.CYAN, redToMove.sideToMove());

        GameState cyanToMove = TestPositions.pairs(placements, Color.CYAN);
        assertThrows(InvalidMoveException.class,
                () -> cyanToMove.applyMove(Move.of(new Cell(0, 0), new Cell(1, 0))));
        cyanToMove.applyMove(Move.of(new Cell(0, 3), new Cell(0, 2)));
        assertEquals(Color.BLUE, cyanToMove.colorAt(new Cell(0, 2)));
    }

    @Test
    void teamWinNeedsEveryControlledColorInItsTarget() {
        Map<Cell, Color> placements = new LinkedHashMap<>();
        for (Cell cell : BOARD.targetRegion(Color.RED)) {
            placements.put(cell, Color.RED);
        }
        placements.put(new Cell(0, 0), Color.YELLOW);
        placements.put(new Cell(0, 3), Color.CYAN);
        assertFalse(TestPositions.pairs(placements, Color.CYAN).hasWon(Color.RED));

        placements.remove(new Cell(0, 0));
        for (Cell cell : BOARD.targetRegion(Color.YELLOW)) {
            placements.put(cell, Color.YELLOW);
        }
        GameState state = TestPositions.pairs(placements, Color.CYAN);
        assertTrue(state.hasWon(Color.RED));
        assertEquals(Color.RED, state.winner());
        assertFalse(state.hasWon(Color.YELLOW), "YELLOW does not lead a side");
    }

    @Test
    void rejectsPegsOfColorsOutsideTheGame() {
        assertThrows(IllegalArgumentException.class,
                () -> TestPositions.pairs(placements(new Cell(0, 0), Color.GREEN), Color.RED));
        assertThrows(IllegalArgumentException.class,
                () -> TestPositions.pairs(placements(new Cell(0, 0), Color.RED), Color.YELLOW));
    }

    @Test
    void rejectsTooFewOrDuplicateColors() {
        assertThrows(IllegalArgumentException.class, () -> GameState.initial(BOARD, List.of(Color.RED)));
        assertThrows(IllegalArgumentException.class,
                () -> GameState.initial(BOARD, List.of(Color.RED, Color.RED)));
    }

    @Test
    void stepMovesPegAndPassesTheTurn() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.CYAN));

        state.applyMove(Move.of(new Cell(1, -5), new Cell(0, -4)));

        assertNull(state.colorAt(new Cell(1, -5)));
        assertEquals(Color.RED, state.colorAt(new Cell(0, -4)));
        assertEquals(Color.CYAN, state.sideToMove());
        assertEquals(1, state.getTurnNumber());
        state.checkInvariants();
    }

    @Test
    void invalidMovesLeaveTheStateUntouched() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.CYAN));
        Color[] before = state.occupancySnapshot();

        assertThrows(InvalidMoveException.class,
                () -> state.applyMove(Move.of(new Cell(-1, 5), new Cell(-1, 4))), "CYAN peg while RED moves");
        assertThrows(InvalidMoveException.class,
                () -> state.applyMove(Move.of(new Cell(2, -6), new Cell(1, -5))), "occupied destination");
        assertThrows(InvalidMoveException.class,
                () -> state.applyMove(Move.of(new Cell(0, 0), new Cell(1, 0))), "no peg on origin");
        assertThrows(InvalidMoveException.class,
                () -> state.applyMove(Move.of(new Cell(1, -5), new Cell(1, -3))), "jump over an empty cell");
        assertThrows(InvalidMoveException.class,
                () -> state.applyMove(Move.of(new Cell(1, -5), new Cell(8, -8))), "off the board");

        assertArrayEquals(before, state.occupancySnapshot());
        assertEquals(Color.RED, state.sideToMove());
        assertEquals(0, state.getTurnNumber());
    }

    @Test
    void jumpOverAnyPegIsAccepted() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.CYAN));

        state.applyMove(Move.of(new Cell(2, -6), new Cell(0, -4)));

        assertEquals(Color.RED, state.colorAt(new Cell(0, -4)));
        assertEquals(Color.RED, state.colorAt(new Cell(1, -5)), "jumped peg stays");
    }

    @Test
    void copyIsIndependent() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.CYAN));
        GameState copy = state.copy();

        copy.applyMove(Move.of(new Cell(1, -5), new Cell(0, -4)));

        assertEquals(Color.RED, state.colorAt(new Cell(1, -5)));
        assertEquals(Color.RED, state.sideToMove());
        assertEquals(Color.CYAN, copy.sideToMove());
    }

    @Test
    void resignationRemovesColorFromRotation() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.GREEN, Color.BLUE));

        state.resign(Color.GREEN);
        assertEquals(List.of(Color.RED, Color.BLUE), state.activeColors());
        assertEquals(Color.RED, state.sideToMove());

        state.passTurn();
        assertEquals(Color.BLUE, state.sideToMove());
        state.resign(Color.BLUE);
        assertEquals(Color.RED, state.sideToMove());
        assertEquals(Board.PEGS_PER_COLOR, state.piecesOf(Color.GREEN).size(), "pegs stay as obstacles");
        assertTrue(state.isGameOver());
        state.checkInvariants();
        assertThrows(IllegalArgumentException.class, () -> state.resign(Color.GREEN));
    }

    @Test
    void detectsWinnerWhenTargetIsFull() {
        GameState state = TestPositions.redWinsInOne();
        assertNull(state.winner());

        state.applyMove(Move.of(new Cell(-1, 4), new Cell(-1, 5)));

        assertTrue(state.hasWon(Color.RED));
        assertEquals(Color.RED, state.winner());
        assertTrue(state.isGameOver());
    }
}

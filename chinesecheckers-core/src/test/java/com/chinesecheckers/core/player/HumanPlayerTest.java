package com.chinesecheckers.core.player;

import static com.chinesecheckers.core.TestPositions.BOARD;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chinesecheckers.core.Cell;
import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.InvalidMoveException;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.console.ConsoleMoveInput;
import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class HumanPlayerTest {

    private final GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.CYAN));
    private final StringWriter output = new StringWriter();

    private HumanPlayer player(String lines) {
        ConsoleMoveInput input = new ConsoleMoveInput(new BufferedReader(new StringReader(lines)),
                new PrintWriter(output, true));
        return new HumanPlayer(input, new MoveGenerator(BOARD));
    }

    @Test
    void chooseMoveReturnsTheTypedMove() {
        Move move = player("1,-5 0,-4\n").chooseMove(state, Color.RED);

        assertEquals(Move.of(new Cell(1, -5), new Cell(0, -4)), move);
    }

    @Test
    void chooseMoveFailsWhenInputEnds() {
        HumanPlayer player = player("");

        IllegalStateException ex = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(IllegalStateException.class, () -> player.chooseMove(state, Color.RED)));
        assertTrue(ex.getMessage().contains("resign"), ex.getMessage());
    }

    @Test
    void chooseMoveFailsOnPass() {
        HumanPlayer player = player("pass\n1,-5 0,-4\n");

        assertThrows(IllegalStateException.class, () -> player.chooseMove(state, Color.RED));
    }

    @Test
    void decideLetsTheSeatPassOrResign() {
        HumanPlayer player = player("pass\nresign\n");
        List<Move> legalMoves = new MoveGenerator(BOARD).legalMoves(state, Color.RED);

        assertEquals(HumanDecision.pass(), player.decide(state, Color.RED, legalMoves));
        assertEquals(HumanDecision.resign(), player.decide(state, Color.RED, legalMoves));
    }

    @Test
    void rejectionsAreReportedToTheInput() {
        Move move = Move.of(new Cell(4, -8), new Cell(4, -6));

        player("").moveRejected(move, new InvalidMoveException(move, "Destination (4,-6) is occupied"));

        assertTrue(output.toString().contains("Rejected (4,-8)->(4,-6): Destination (4,-6) is occupied"));
    }
}

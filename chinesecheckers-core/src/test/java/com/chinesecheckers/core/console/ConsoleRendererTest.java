package com.chinesecheckers.core.console;

import static com.chinesecheckers.core.TestPositions.BOARD;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameOutcome;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.TestPositions;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConsoleRendererTest {

    @Test
    void drawsSeventeenRowsWithEveryCell() {
        GameState state = GameState.initial(BOARD, List.of(Color.RED, Color.CYAN));

        String text = ConsoleRenderer.render(state);

        String[] lines = text.split("\n");
        assertEquals(17, lines.length);
        assertEquals(10, count(text, 'R'));
        assertEquals(10, count(text, 'C'));
        assertEquals(BOARD.cellCount() - 20, count(text, '.'));
        assertTrue(lines[0].endsWith("R"), "top point holds a RED peg");
    }

    @Test
    void reportsTheOutcome() {
        StringWriter output = new StringWriter();
        ConsoleRenderer renderer = new ConsoleRenderer(new PrintWriter(output));

        renderer.onGameOver(GameState.initial(BOARD, List.of(Color.RED, Color.CYAN)),
                new GameOutcome(GameOutcome.Kind.WINNER, Color.RED, 42));

        assertTrue(output.toString().contains("RED wins after 42 plies"));
    }

    @Test
    void namesEveryColorOfATeamOnItsTurn() {
        StringWriter output = new StringWriter();
        ConsoleRenderer renderer = new ConsoleRenderer(new PrintWriter(output));

        renderer.onTurnStarted(GameState.initial(BOARD, TestPositions.PAIRS), Color.RED);

        assertTrue(output.toString().contains("RED to move with [RED, YELLOW] (turn 1)"));
    }

    private static long count(String text, char symbol) {
        return text.chars().filter(c -> c == symbol).count();
    }
}

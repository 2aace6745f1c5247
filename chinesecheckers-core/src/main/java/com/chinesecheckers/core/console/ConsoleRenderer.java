package com.chinesecheckers.core.console;

import com.chinesecheckers.core.Board;
import com.chinesecheckers.core.Cell;
import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameListener;
import com.chinesecheckers.core.GameOutcome;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.TurnResult;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Objects;

/**
 * Prints the star as text after every turn. Each row of the board is one line; a cell {@code (q, r)} sits in
 * column {@code q - s} so neighbouring cells are two columns apart. Pegs show their color symbol and empty
 * cells a dot.
 */
public final class ConsoleRenderer implements GameListener {

    private static final int RADIUS = 8;
    private static final int COLUMN_OFFSET = 12;
    private static final int WIDTH = 2 * COLUMN_OFFSET + 1;

    private final PrintWriter out;

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public static String render(GameState state) {
        Board board = state.board();
        StringBuilder builder = new StringBuilder();
        for (int r = -RADIUS; r <= RADIUS; r++) {
            char[] line = new char[WIDTH];
            Arrays.fill(line, ' ');
            boolean any = false;
            for (int q = -RADIUS; q <= RADIUS; q++) {
                if (!board.isValidCell(q, r)) {
                    continue;
                }
                Cell cell = new Cell(q, r);
                Color color = state.colorAt(cell);
                line[cell.q() - cell.s() + COLUMN_OFFSET] = color == null ? '.' : color.symbol();
                any = true;
            }
            if (any) {
                builder.append(String.format("%3d  ", r)).append(new String(line).stripTrailing()).append('\n');
            }
        }
        return builder.toString();
    }

    @Override
    public void onTurnStarted(GameState state, Color color) {
        out.print(render(state));
        if (state.teams().isSolo()) {
            out.printf("%s to move (turn %d)%n", color, state.getTurnNumber() + 1);
        } else {
            out.printf("%s to move with %s (turn %d)%n", color, state.teams().colorsOf(color),
                    state.getTurnNumber() + 1);
        }
        out.flush();
    }

    @Override
    public void onMoveApplied(GameState state, Color color, Move move) {
        out.printf("%s played %s%n", color, move);
        out.flush();
    }

    @Override
    public void onTurnSkipped(GameState state, TurnResult result) {
        if (result.kind() == TurnResult.Kind.PASSED) {
            out.printf("%s passed%n", result.color());
        } else {
            out.printf("%s cannot move and skips the turn%n", result.color());
        }
        out.flush();
    }

    @Override
    public void onColorResigned(GameState state, Color color) {
        out.printf("%s resigned%n", color);
        out.flush();
    }

    @Override
    public void onGameOver(GameState state, GameOutcome outcome) {
        out.print(render(state));
        out.println(outcome.describe());
        out.flush();
    }
}

package com.chinesecheckers.core.console;

import com.chinesecheckers.core.Cell;
import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.core.player.HumanDecision;
import com.chinesecheckers.core.player.MoveInput;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads human decisions from a text stream. Accepted lines are a move number from the {@code moves} listing,
 * an origin and destination such as {@code 4,-8 4,-7} (or {@code 4,-8->4,-7}), {@code moves}, {@code pass} and
 * {@code resign} (or {@code quit}). End of input resigns.
 */
public final class ConsoleMoveInput implements MoveInput {

    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleMoveInput(BufferedReader in, PrintWriter out) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public HumanDecision nextDecision(GameState state, Color color, List<Move> legalMoves) {
        while (true) {
            out.printf("%s, enter a move (q,r q,r), a move number, 'moves', 'pass' or 'resign': ", color);
            out.flush();
            String line = readLine();
            if (line == null) {
                return HumanDecision.resign();
            }
            String command = line.trim().toLowerCase(Locale.ROOT);
            if (command.isEmpty()) {
                continue;
            }
            switch (command) {
                case "moves" -> printMoves(legalMoves);
                case "pass" -> {
                    return HumanDecision.pass();
                }
                case "resign", "quit" -> {
                    return HumanDecision.resign();
                }
                default -> {
                    HumanDecision decision = parseMove(command, legalMoves);
                    if (decision != null) {
                        return decision;
                    }
                }
            }
        }
    }

    @Override
    public void rejected(Move move, String reason) {
        out.println(move == null ? reason : "Rejected " + move + ": " + reason);
        out.flush();
    }

    private HumanDecision parseMove(String command, List<Move> legalMoves) {
        if (command.chars().allMatch(Character::isDigit)) {
            int number;
            try {
                number = Integer.parseInt(command);
            } catch (NumberFormatException ex) {
                number = -1;
            }
            if (number < 1 || number > legalMoves.size()) {
                out.printf("Move number must be between 1 and %d.%n", legalMoves.size());
                return null;
            }
            return HumanDecision.play(legalMoves.get(number - 1));
        }
        String[] parts = command.split("\\s*->\\s*|\\s+");
        if (parts.length != 2) {
            out.println("Please enter an origin and a destination such as 4,-8 4,-7.");
            return null;
        }
        Cell origin;
        Cell destination;
        try {
            origin = Cell.parse(parts[0]);
            destination = Cell.parse(parts[1]);
        } catch (IllegalArgumentException ex) {
            out.println("Please enter cells as q,r: " + ex.getMessage());
            return null;
        }
        if (origin.equals(destination)) {
            out.println("Origin and destination must differ.");
            return null;
        }
        for (Move move : legalMoves) {
            if (move.origin().equals(origin) && move.destination().equals(destination)) {
                return HumanDecision.play(move);
            }
        }
        return HumanDecision.play(Move.of(origin, destination));
    }

    private void printMoves(List<Move> legalMoves) {
        for (int i = 0; i < legalMoves.size(); i++) {
            out.printf("%3d. %s%n", i + 1, legalMoves.get(i));
        }
        out.flush();
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read move", ex);
        }
    }
}

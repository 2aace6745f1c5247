package com.chinesecheckers.core.config;

import com.chinesecheckers.core.Color;
import java.util.Locale;
import java.util.Objects;

/**
 * One seat: the color it plays, its strategy and, for minimax seats, the search depth.
 */
public record SeatConfig(Color color, Strategy strategy, int depth) {

    public SeatConfig {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(strategy, "strategy");
        if (strategy == Strategy.MINIMAX && depth <= 0) {
            throw new InvalidConfigurationException("Minimax seat " + color + " needs a positive depth, got " + depth);
        }
    }

    public static SeatConfig human(Color color) {
        return new SeatConfig(color, Strategy.HUMAN, 0);
    }

    public static SeatConfig greedy(Color color) {
        return new SeatConfig(color, Strategy.GREEDY, 0);
    }

    public static SeatConfig minimax(Color color, int depth) {
        return new SeatConfig(color, Strategy.MINIMAX, depth);
    }

    /**
     * Parses {@code COLOR:strategy[:depth]}, for example {@code red:minimax:3}. A minimax seat without an
     * explicit depth uses {@code defaultDepth}.
     */
    public static SeatConfig parse(String text, int defaultDepth) {
        String[] parts = text.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new InvalidConfigurationException("Seat must look like COLOR:strategy[:depth]: " + text);
        }
        Color color;
        try {
            color = Color.valueOf(parts[0].trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidConfigurationException("Unknown color: " + parts[0], ex);
        }
        Strategy strategy = Strategy.parse(parts[1]);
        int depth = strategy == Strategy.MINIMAX ? defaultDepth : 0;
        if (parts.length == 3) {
            if (strategy != Strategy.MINIMAX) {
                throw new InvalidConfigurationException("Only minimax seats take a depth: " + text);
            }
            try {
                depth = Integer.parseInt(parts[2].trim());
            } catch (NumberFormatException ex) {
                throw new InvalidConfigurationException("Invalid depth in seat " + text, ex);
            }
        }
        return new SeatConfig(color, strategy, depth);
    }

    @Override
    public String toString() {
        return strategy == Strategy.MINIMAX
                ? color + ":" + strategy.name().toLowerCase(Locale.ROOT) + ":" + depth
                : color + ":" + strategy.name().toLowerCase(Locale.ROOT);
    }
}

package com.chinesecheckers.core.config;

import java.util.Locale;

/**
 * How a seat chooses its moves.
 */
public enum Strategy {
    HUMAN,
    GREEDY,
    MINIMAX;

    public static Strategy parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidConfigurationException("Unknown strategy: " + text, ex);
        }
    }
}

package com.chinesecheckers.core;

import com.chinesecheckers.core.config.GameConfig;
import com.chinesecheckers.core.console.ConsoleMoveInput;
import com.chinesecheckers.core.console.ConsoleRenderer;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end. Seats are chosen with {@code --seat=COLOR:strategy[:depth]}; every color without a seat
 * option is played by minimax.
 */
public final class ChineseCheckersCLI {

    private static final Logger LOGGER = Logger.getLogger(ChineseCheckersCLI.class.getName());

    private ChineseCheckersCLI() {
    }

    public static void main(String[] args) {
        LoggingConfig.configure();
        GameConfig config;
        try {
            config = GameConfig.fromArguments(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
            return;
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        out.println("Chinese Checkers - console edition");

        TurnController controller = TurnController.fromConfig(config, new ConsoleMoveInput(in, out));
        controller.addListener(new ConsoleRenderer(out));
        GameOutcome outcome = controller.playGame();
        out.printf("Result: %s%n", outcome.describe());
    }

    private static void printUsage() {
        System.err.println(
                "Usage: ChineseCheckersCLI [--colors=2|3|4|6] [--seat=COLOR:human|greedy|minimax[:depth]]... "
                        + "[--colors-per-seat=1|2|3] [--depth=<n>] [--branch-limit=<n>] [--mode=seq|par] "
                        + "[--entry-rule=unrestricted|no-foreign-triangles] [--max-plies=<n>]");
    }
}

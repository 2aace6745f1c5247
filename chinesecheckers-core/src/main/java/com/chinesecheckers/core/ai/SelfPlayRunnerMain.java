package com.chinesecheckers.core.ai;

import com.chinesecheckers.core.LoggingConfig;
import com.chinesecheckers.core.config.GameConfig;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link SelfPlayRunner} sessions with configurable parameters.
 */
public final class SelfPlayRunnerMain {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayRunnerMain.class.getName());

    private SelfPlayRunnerMain() {
    }

    public static void main(String[] args) {
        LoggingConfig.configure();
        if (args.length < 1) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            GameConfig config = GameConfig.fromArguments(Arrays.copyOfRange(args, 1, args.length));
            SelfPlayRunner runner = new SelfPlayRunner(config);
            runner.playGames(gameCount);
            System.out.println(runner.summary());
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: SelfPlayRunnerMain <gameCount> [--colors=2|3|4|6] [--seat=COLOR:greedy|minimax[:depth]]... "
                        + "[--colors-per-seat=1|2|3] [--depth=<n>] [--branch-limit=<n>] [--mode=seq|par] "
                        + "[--entry-rule=unrestricted|no-foreign-triangles] [--max-plies=<n>]");
    }
}

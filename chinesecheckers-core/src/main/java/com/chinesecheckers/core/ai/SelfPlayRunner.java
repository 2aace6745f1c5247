package com.chinesecheckers.core.ai;

import com.chinesecheckers.core.Board;
import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.Evaluator;
import com.chinesecheckers.core.GameOutcome;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.TurnController;
import com.chinesecheckers.core.config.GameConfig;
import com.chinesecheckers.core.config.InvalidConfigurationException;
import com.chinesecheckers.core.config.SeatConfig;
import com.chinesecheckers.core.config.Strategy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays computer-only games from one configuration and keeps win, stalemate and ply-limit statistics across
 * them. Every finished position is checked for peg conservation.
 */
public final class SelfPlayRunner {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayRunner.class.getName());

    private final GameConfig config;
    private final MinimaxSearch search;

    private final Map<Color, Integer> wins = new EnumMap<>(Color.class);
    private int gamesPlayed;
    private int stalemates;
    private int plyLimitStops;
    private long cumulativePlies;

    public SelfPlayRunner(GameConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        for (SeatConfig seat : config.seats()) {
            if (seat.strategy() == Strategy.HUMAN) {
                throw new InvalidConfigurationException("Self-play cannot seat a human at " + seat.color());
            }
        }
        MoveGenerator generator = new MoveGenerator(Board.standard(), config.entryRule());
        this.search = new MinimaxSearch(generator, new Evaluator());
    }

    public List<GameOutcome> playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        List<GameOutcome> outcomes = new ArrayList<>(gameCount);
        try {
            for (int i = 0; i < gameCount; i++) {
                outcomes.add(playSingleGame());
            }
        } finally {
            search.shutdown();
        }
        return Collections.unmodifiableList(outcomes);
    }

    private GameOutcome playSingleGame() {
        TurnController controller = TurnController.fromConfig(config, null, search);
        GameOutcome outcome = controller.playGame();
        GameState finalState = controller.snapshot();
        finalState.checkInvariants();

        gamesPlayed++;
        cumulativePlies += outcome.plies();
        switch (outcome.kind()) {
            case WINNER, RESIGNATION -> wins.merge(outcome.winner(), 1, Integer::sum);
            case STALEMATE -> stalemates++;
            case PLY_LIMIT -> plyLimitStops++;
        }

        final int gameNumber = gamesPlayed;
        final double average = averagePlies();
        LOGGER.info(() -> String.format("Completed self-play game %d (%s, averagePlies=%.1f)", gameNumber,
                outcome.describe(), average));
        return outcome;
    }

    public int gamesPlayed() {
        return gamesPlayed;
    }

    public int wins(Color color) {
        return wins.getOrDefault(color, 0);
    }

    public int stalemates() {
        return stalemates;
    }

    public int plyLimitStops() {
        return plyLimitStops;
    }

    public double averagePlies() {
        return gamesPlayed == 0 ? 0.0 : (double) cumulativePlies / gamesPlayed;
    }

    /**
     * One line per color with its wins, followed by the draws.
     */
    public String summary() {
        StringBuilder builder = new StringBuilder();
        builder.append(String.format("Games: %d, average plies: %.1f%n", gamesPlayed, averagePlies()));
        for (SeatConfig seat : config.seats()) {
            builder.append(String.format("  %-8s %-20s wins: %d%n", seat.color(), seat, wins(seat.color())));
        }
        builder.append(String.format("  stalemates: %d, ply-limit stops: %d", stalemates, plyLimitStops));
        return builder.toString();
    }
}

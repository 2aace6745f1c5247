package com.chinesecheckers.core;

import com.chinesecheckers.core.ai.MinimaxSearch;
import com.chinesecheckers.core.ai.SearchConstraints;
import com.chinesecheckers.core.config.GameConfig;
import com.chinesecheckers.core.config.SeatConfig;
import com.chinesecheckers.core.player.GreedyPlayer;
import com.chinesecheckers.core.player.HumanDecision;
import com.chinesecheckers.core.player.HumanPlayer;
import com.chinesecheckers.core.player.MinimaxPlayer;
import com.chinesecheckers.core.player.MoveInput;
import com.chinesecheckers.core.player.Player;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a game: asks the seat of the side to move for a decision, checks the move against the legal moves,
 * applies it and reports the turn to listeners until a color wins, nobody can move or the ply limit is hit.
 * Colors without any legal move have their turn skipped.
 */
public final class TurnController {

    private static final Logger LOGGER = Logger.getLogger(TurnController.class.getName());

    private final GameState state;
    private final MoveGenerator generator;
    private final Map<Color, Player> players;
    private final int maxPlies;
    private final List<GameListener> listeners = new CopyOnWriteArrayList<>();

    private int plies;
    private GameOutcome outcome;

    public TurnController(GameState state, MoveGenerator generator, Map<Color, Player> players, int maxPlies) {
        this.state = Objects.requireNonNull(state, "state");
        this.generator = Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(players, "players");
        if (maxPlies <= 0) {
            throw new IllegalArgumentException("maxPlies must be positive");
        }
        for (Color color : state.participants()) {
            if (!players.containsKey(color)) {
                throw new IllegalArgumentException("No player seated for " + color);
            }
        }
        this.players = new EnumMap<>(players);
        this.maxPlies = maxPlies;
    }

    /**
     * Builds the standard starting position and the seats described by {@code config}. {@code input} feeds
     * the human seats and may be {@code null} when there are none.
     */
    public static TurnController fromConfig(GameConfig config, MoveInput input) {
        Objects.requireNonNull(config, "config");
        MoveGenerator generator = new MoveGenerator(Board.standard(), config.entryRule());
        return fromConfig(config, input, new MinimaxSearch(generator, new Evaluator()));
    }

    /**
     * Same as {@link #fromConfig(GameConfig, MoveInput)} but every minimax seat shares {@code search}, whose
     * move generator must follow the configured entry rule. The caller owns the search and shuts it down.
     */
    public static TurnController fromConfig(GameConfig config, MoveInput input, MinimaxSearch search) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(search, "search");
        MoveGenerator generator = search.getGenerator();
        Evaluator evaluator = search.getEvaluator();
        if (generator.getEntryRule() != config.entryRule()) {
            throw new IllegalArgumentException("Search uses entry rule " + generator.getEntryRule()
                    + " but the game uses " + config.entryRule());
        }
        Board board = generator.getBoard();

        Map<Color, Player> players = new EnumMap<>(Color.class);
        for (SeatConfig seat : config.seats()) {
            Player player = switch (seat.strategy()) {
                case HUMAN -> new HumanPlayer(Objects.requireNonNull(input, "input for human seat " + seat.color()),
                        generator);
                case GREEDY -> new GreedyPlayer(generator, evaluator);
                case MINIMAX -> new MinimaxPlayer(search,
                        new SearchConstraints(seat.depth(), config.branchLimit(), config.mode()));
            };
            players.put(seat.color(), player);
        }
        GameState initial = GameState.initial(board, config.teams());
        LOGGER.info(() -> String.format("New game: seats=%s, teams=%s, entryRule=%s, mode=%s, maxPlies=%d",
                config.seats(), config.teams(), config.entryRule(), config.mode(), config.maxPlies()));
        return new TurnController(initial, generator, players, config.maxPlies());
    }

    public void addListener(GameListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(GameListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns a copy of the current state.
     */
    public GameState snapshot() {
        return state.copy();
    }

    public Player player(Color color) {
        Player player = players.get(color);
        if (player == null) {
            throw new IllegalArgumentException("No player seated for " + color);
        }
        return player;
    }

    public MoveGenerator getGenerator() {
        return generator;
    }

    public int pliesPlayed() {
        return plies;
    }

    /**
     * Returns {@code true} once the game has ended, evaluating the current position if needed.
     */
    public boolean isFinished() {
        return refreshOutcome() != null;
    }

    /**
     * Returns the outcome of a finished game, or {@code null} while it is still running.
     */
    public GameOutcome outcome() {
        return refreshOutcome();
    }

    /**
     * Plays turns until the game ends.
     */
    public GameOutcome playGame() {
        while (!isFinished()) {
            playTurn();
        }
        return outcome;
    }

    /**
     * Plays the turn of the side to move.
     *
     * @throws IllegalStateException if the game is already over
     * @throws InvalidMoveException if a computer seat returns an illegal move
     */
    public TurnResult playTurn() {
        if (isFinished()) {
            throw new IllegalStateException("Game is over: " + outcome.describe());
        }
        Color color = state.sideToMove();
        notifyListeners(listener -> listener.onTurnStarted(state.copy(), color));

        List<Move> legalMoves = generator.legalMoves(state, color);
        TurnResult result;
        if (legalMoves.isEmpty()) {
            result = skip(color, TurnResult.Kind.SKIPPED_NO_MOVES);
        } else {
            result = takeTurn(color, legalMoves);
        }
        plies++;
        refreshOutcome();
        return result;
    }

    private TurnResult takeTurn(Color color, List<Move> legalMoves) {
        Player player = players.get(color);
        while (true) {
            HumanDecision decision;
            try {
                decision = player.decide(state.copy(), color, legalMoves);
            } catch (NoLegalMoveException ex) {
                LOGGER.log(Level.WARNING, player.describe() + " found no move for " + color, ex);
                return skip(color, TurnResult.Kind.SKIPPED_NO_MOVES);
            }
            switch (decision.kind()) {
                case PASS:
                    return skip(color, TurnResult.Kind.PASSED);
                case RESIGN:
                    return resign(color);
                case PLAY:
                default:
                    Move move = decision.move();
                    try {
                        checkLegal(move, color, legalMoves);
                    } catch (InvalidMoveException ex) {
                        LOGGER.fine(() -> String.format("Rejected %s for %s: %s", move, color, ex.getMessage()));
                        player.moveRejected(move, ex);
                        continue;
                    }
                    state.applyMove(move);
                    LOGGER.fine(() -> String.format("Ply %d: %s (%s) played %s", plies + 1, color,
                            player.describe(), move));
                    notifyListeners(listener -> listener.onMoveApplied(state.copy(), color, move));
                    return new TurnResult(TurnResult.Kind.MOVED, color, move, plies + 1);
            }
        }
    }

    private void checkLegal(Move move, Color color, List<Move> legalMoves) {
        if (legalMoves.contains(move)) {
            return;
        }
        state.copy().applyMove(move);
        throw new InvalidMoveException(move, move + " is not a legal move for " + color);
    }

    private TurnResult skip(Color color, TurnResult.Kind kind) {
        state.passTurn();
        TurnResult result = new TurnResult(kind, color, null, plies + 1);
        LOGGER.fine(() -> String.format("Ply %d: %s %s", result.ply(), color, kind));
        notifyListeners(listener -> listener.onTurnSkipped(state.copy(), result));
        return result;
    }

    private TurnResult resign(Color color) {
        state.resign(color);
        LOGGER.info(() -> String.format("%s resigned after %d plies", color, plies));
        notifyListeners(listener -> listener.onColorResigned(state.copy(), color));
        return new TurnResult(TurnResult.Kind.RESIGNED, color, null, plies + 1);
    }

    private GameOutcome refreshOutcome() {
        if (outcome != null) {
            return outcome;
        }
        GameOutcome detected = detectOutcome();
        if (detected != null) {
            outcome = detected;
            LOGGER.info(() -> String.format("Game over: %s", detected.describe()));
            notifyListeners(listener -> listener.onGameOver(state.copy(), detected));
        }
        return outcome;
    }

    private GameOutcome detectOutcome() {
        Color winner = state.winner();
        if (winner != null) {
            return new GameOutcome(GameOutcome.Kind.WINNER, winner, plies);
        }
        List<Color> active = state.activeColors();
        if (active.size() == 1) {
            return new GameOutcome(GameOutcome.Kind.RESIGNATION, active.get(0), plies);
        }
        if (!generator.anyActiveColorCanMove(state)) {
            return new GameOutcome(GameOutcome.Kind.STALEMATE, null, plies);
        }
        if (plies >= maxPlies) {
            return new GameOutcome(GameOutcome.Kind.PLY_LIMIT, null, plies);
        }
        return null;
    }

    private void notifyListeners(Consumer<GameListener> callback) {
        for (GameListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Game listener failed", ex);
            }
        }
    }
}

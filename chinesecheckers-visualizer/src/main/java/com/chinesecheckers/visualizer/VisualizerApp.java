package com.chinesecheckers.visualizer;

import com.chinesecheckers.core.Board;
import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.EntryRule;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.LoggingConfig;
import com.chinesecheckers.core.Teams;
import com.chinesecheckers.core.ai.SearchConstraints;
import com.chinesecheckers.core.config.GameConfig;
import com.chinesecheckers.core.config.InvalidConfigurationException;
import com.chinesecheckers.core.config.SeatConfig;
import com.chinesecheckers.core.config.Strategy;
import com.chinesecheckers.visualizer.model.GameFrame;
import com.chinesecheckers.visualizer.simulation.SelfPlayTask;
import com.chinesecheckers.visualizer.ui.BoardView;
import com.chinesecheckers.visualizer.ui.StatsPane;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.application.Application;
import javafx.beans.binding.Bindings;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.scene.layout.VBox;
import javafx.stage.Stage;
import javafx.util.StringConverter;

public final class VisualizerApp extends Application {

    private static final int MAX_DEPTH = 5;
    private static final int MAX_BRANCH_LIMIT = 200;
    private static final List<Integer> COLOR_COUNTS = List.of(2, 3, 4, 6);
    private static final List<Integer> COLORS_PER_SEAT = List.of(1, 2, 3);
    private static final javafx.util.Duration PLAYBACK_INTERVAL = javafx.util.Duration.millis(250);
    private static final Logger LOGGER = Logger.getLogger(VisualizerApp.class.getName());

    private final ObservableList<GameFrame> frames = FXCollections.observableArrayList();
    private final IntegerProperty currentIndex = new SimpleIntegerProperty(0);
    private final ObjectProperty<GameFrame> currentFrame = new SimpleObjectProperty<>();
    private final BooleanProperty playing = new SimpleBooleanProperty(false);
    private final BooleanProperty simulationRunning = new SimpleBooleanProperty(false);

    private GameConfig launchConfig = GameConfig.builder().build();
    private Timeline playbackTimeline;
    private BoardView boardView;
    private StatsPane statsPane;
    private ComboBox<Integer> colorCountComboBox;
    private ComboBox<Integer> colorsPerSeatComboBox;
    private Spinner<Integer> depthSpinner;
    private Spinner<Integer> branchLimitSpinner;
    private ComboBox<SearchConstraints.SearchMode> searchModeComboBox;
    private ComboBox<EntryRule> entryRuleComboBox;
    private ProgressBar progressBar;
    private Label statusLabel;
    private SelfPlayTask simulationTask;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        LoggingConfig.configure();
        configureFromArguments(getParameters().getRaw());

        boardView = new BoardView();
        statsPane = new StatsPane();

        setupIndexListener();
        setupPlaybackTimeline();

        currentFrame.addListener((obs, oldFrame, newFrame) -> {
            boardView.update(newFrame);
            statsPane.update(newFrame);
        });

        showInitialPosition(launchConfig.teams());

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setCenter(boardView);
        BorderPane.setAlignment(boardView, Pos.CENTER);
        root.setRight(statsPane);
        BorderPane.setMargin(statsPane, new Insets(0, 0, 0, 16));

        VBox controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        Scene scene = new Scene(root, 1200, 860);
        stage.setTitle("Chinese Checkers Visualizer");
        stage.setScene(scene);
        stage.setMinWidth(960);
        stage.setMinHeight(760);
        stage.show();
    }

    @Override
    public void stop() {
        cancelSimulation();
    }

    private void setupIndexListener() {
        currentIndex.addListener((obs, oldValue, newValue) -> {
            if (frames.isEmpty()) {
                currentFrame.set(null);
                return;
            }
            int requested = newValue.intValue();
            int clamped = Math.max(0, Math.min(requested, frames.size() - 1));
            if (clamped != requested) {
                currentIndex.set(clamped);
                return;
            }
            currentFrame.set(frames.get(clamped));
        });
    }

    private void setupPlaybackTimeline() {
        playbackTimeline = new Timeline(new KeyFrame(PLAYBACK_INTERVAL, event -> advanceFrame()));
        playbackTimeline.setCycleCount(Timeline.INDEFINITE);
    }

    private VBox buildControls() {
        Button simulateButton = new Button("Run simulation");
        simulateButton.setOnAction(event -> runSimulation());

        Button stopButton = new Button("Stop");
        stopButton.setOnAction(event -> cancelSimulation());

        Button previousButton = new Button("⏮");
        previousButton.setOnAction(event -> {
            pausePlayback();
            stepBackward();
        });

        Button nextButton = new Button("⏭");
        nextButton.setOnAction(event -> {
            pausePlayback();
            stepForward();
        });

        Button playButton = new Button("▶");
        playButton.setOnAction(event -> startPlayback());

        Button pauseButton = new Button("⏸");
        pauseButton.setOnAction(event -> pausePlayback());

        Button resetButton = new Button("⏮⏮");
        resetButton.setOnAction(event -> {
            pausePlayback();
            if (!frames.isEmpty()) {
                currentIndex.set(0);
            }
        });

        colorCountComboBox = new ComboBox<>();
        colorCountComboBox.getItems().setAll(COLOR_COUNTS);
        colorCountComboBox.setValue(launchConfig.teams().colors().size());
        colorCountComboBox.valueProperty().addListener((obs, oldValue, newValue) -> previewLayout());

        colorsPerSeatComboBox = new ComboBox<>();
        colorsPerSeatComboBox.getItems().setAll(COLORS_PER_SEAT);
        colorsPerSeatComboBox.setValue(launchConfig.colorsPerSeat());
        colorsPerSeatComboBox.valueProperty().addListener((obs, oldValue, newValue) -> previewLayout());

        depthSpinner = new Spinner<>();
        depthSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(1, MAX_DEPTH,
                Math.min(MAX_DEPTH, Math.max(1, launchDepth()))));
        depthSpinner.setEditable(true);
        depthSpinner.setPrefWidth(80);

        branchLimitSpinner = new Spinner<>();
        branchLimitSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, MAX_BRANCH_LIMIT,
                Math.min(MAX_BRANCH_LIMIT, launchConfig.branchLimit()), 5));
        branchLimitSpinner.setEditable(true);
        branchLimitSpinner.setPrefWidth(90);

        searchModeComboBox = new ComboBox<>();
        searchModeComboBox.getItems().setAll(SearchConstraints.SearchMode.values());
        searchModeComboBox.setConverter(new StringConverter<>() {
            @Override
            public String toString(SearchConstraints.SearchMode mode) {
                if (mode == null) {
                    return "";
                }
                return switch (mode) {
                    case SEQ -> "Sequential";
                    case PAR -> "Parallel";
                };
            }

            @Override
            public SearchConstraints.SearchMode fromString(String string) {
                if (string == null) {
                    return null;
                }
                return switch (string.toLowerCase()) {
                    case "sequential" -> SearchConstraints.SearchMode.SEQ;
                    case "parallel" -> SearchConstraints.SearchMode.PAR;
                    default -> null;
                };
            }
        });
        searchModeComboBox.setValue(launchConfig.mode());

        entryRuleComboBox = new ComboBox<>();
        entryRuleComboBox.getItems().setAll(EntryRule.values());
        entryRuleComboBox.setValue(launchConfig.entryRule());

        progressBar = new ProgressBar(0);
        progressBar.setPrefWidth(180);

        statusLabel = new Label("Ready");
        statusLabel.setMinWidth(220);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        HBox navigation = new HBox(8, resetButton, previousButton, nextButton, playButton, pauseButton);
        navigation.setAlignment(Pos.CENTER_LEFT);

        HBox settings = new HBox(12,
                new Label("Colors:"),
                colorCountComboBox,
                new Label("Colors per seat:"),
                colorsPerSeatComboBox,
                new Label("Depth:"),
                depthSpinner,
                new Label("Branch limit:"),
                branchLimitSpinner,
                new Label("Search mode:"),
                searchModeComboBox,
                new Label("Entry rule:"),
                entryRuleComboBox);
        settings.setAlignment(Pos.CENTER_LEFT);

        HBox actions = new HBox(12,
                simulateButton,
                stopButton,
                navigation,
                spacer,
                progressBar,
                statusLabel);
        actions.setAlignment(Pos.CENTER_LEFT);

        var frameCount = Bindings.size(frames);
        previousButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> currentIndex.get() <= 0, currentIndex, frameCount));
        nextButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> frames.isEmpty() || currentIndex.get() >= frames.size() - 1, currentIndex, frameCount));
        resetButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> frames.isEmpty() || currentIndex.get() == 0, currentIndex, frameCount));
        playButton.disableProperty().bind(playing.or(frameCount.lessThanOrEqualTo(1)).or(simulationRunning));
        pauseButton.disableProperty().bind(playing.not());
        simulateButton.disableProperty().bind(simulationRunning);
        stopButton.disableProperty().bind(simulationRunning.not());
        colorCountComboBox.disableProperty().bind(simulationRunning);
        colorsPerSeatComboBox.disableProperty().bind(simulationRunning);
        depthSpinner.disableProperty().bind(simulationRunning);
        branchLimitSpinner.disableProperty().bind(simulationRunning);
        searchModeComboBox.disableProperty().bind(simulationRunning);
        entryRuleComboBox.disableProperty().bind(simulationRunning);

        VBox controls = new VBox(10, settings, actions);
        return controls;
    }

    private void startPlayback() {
        if (frames.size() <= 1) {
            return;
        }
        if (currentIndex.get() >= frames.size() - 1) {
            currentIndex.set(0);
        }
        playing.set(true);
        playbackTimeline.play();
    }

    private void pausePlayback() {
        playbackTimeline.stop();
        playing.set(false);
    }

    private void stepForward() {
        if (frames.isEmpty()) {
            return;
        }
        currentIndex.set(Math.min(frames.size() - 1, currentIndex.get() + 1));
    }

    private void stepBackward() {
        if (frames.isEmpty()) {
            return;
        }
        currentIndex.set(Math.max(0, currentIndex.get() - 1));
    }

    private void advanceFrame() {
        if (frames.isEmpty()) {
            pausePlayback();
            return;
        }
        int next = currentIndex.get() + 1;
        if (next >= frames.size()) {
            pausePlayback();
            return;
        }
        currentIndex.set(next);
    }

    private void previewLayout() {
        if (simulationRunning.get() || colorCountComboBox.getValue() == null
                || colorsPerSeatComboBox.getValue() == null) {
            return;
        }
        try {
            showInitialPosition(GameConfig.standardTeams(colorCountComboBox.getValue(),
                    colorsPerSeatComboBox.getValue()));
            statusLabel.setText("Ready");
        } catch (InvalidConfigurationException ex) {
            LOGGER.fine(() -> "No board preview: " + ex.getMessage());
            statusLabel.setText("Error: " + ex.getMessage());
        }
    }

    private void showInitialPosition(Teams teams) {
        GameFrame initialFrame = GameFrame.initial(GameState.initial(Board.standard(), teams));
        frames.setAll(initialFrame);
        currentIndex.set(0);
        currentFrame.set(initialFrame);
    }

    private void runSimulation() {
        pausePlayback();
        cancelSimulation();

        GameConfig config;
        try {
            config = buildConfig();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Invalid simulation settings", ex);
            statusLabel.setText("Error: " + ex.getMessage());
            return;
        }
        showInitialPosition(config.teams());

        SelfPlayTask task = new SelfPlayTask(config, frame -> {
            frames.add(frame);
            if (simulationRunning.get()) {
                currentIndex.set(frames.size() - 1);
            }
        });
        simulationTask = task;
        simulationRunning.set(true);
        progressBar.progressProperty().bind(task.progressProperty());
        statusLabel.textProperty().bind(task.messageProperty());
        attachSimulationHandlers(task);

        Thread thread = new Thread(task, "chinesecheckers-visualizer-simulation");
        thread.setDaemon(true);
        thread.start();
    }

    private void cancelSimulation() {
        if (simulationTask != null) {
            simulationTask.cancel(false);
        }
    }

    private GameConfig buildConfig() {
        int colorCount = colorCountComboBox.getValue() == null
                ? launchConfig.teams().colors().size()
                : colorCountComboBox.getValue();
        int colorsPerSeat = colorsPerSeatComboBox.getValue() == null
                ? launchConfig.colorsPerSeat()
                : colorsPerSeatComboBox.getValue();
        List<Color> seats = GameConfig.standardTeams(colorCount, colorsPerSeat).sides();
        GameConfig.Builder builder = GameConfig.builder()
                .colorCount(colorCount)
                .colorsPerSeat(colorsPerSeat)
                .defaultDepth(Math.max(1, normalizeSpinnerValue(depthSpinner)))
                .branchLimit(Math.max(0, normalizeSpinnerValue(branchLimitSpinner)))
                .mode(searchModeComboBox.getValue() == null
                        ? SearchConstraints.SearchMode.SEQ
                        : searchModeComboBox.getValue())
                .entryRule(entryRuleComboBox.getValue() == null
                        ? EntryRule.UNRESTRICTED
                        : entryRuleComboBox.getValue())
                .maxPlies(launchConfig.maxPlies());
        // Greedy seats from the command line survive while their color still leads a seat.
        for (SeatConfig seat : launchConfig.seats()) {
            if (seat.strategy() == Strategy.GREEDY && seats.contains(seat.color())) {
                builder.seat(seat);
            }
        }
        return builder.build();
    }

    private int launchDepth() {
        for (SeatConfig seat : launchConfig.seats()) {
            if (seat.strategy() == Strategy.MINIMAX) {
                return seat.depth();
            }
        }
        return GameConfig.DEFAULT_DEPTH;
    }

    private int normalizeSpinnerValue(Spinner<Integer> spinner) {
        SpinnerValueFactory<Integer> factory = spinner.getValueFactory();
        if (factory != null) {
            try {
                Integer parsed = factory.getConverter().fromString(spinner.getEditor().getText());
                if (parsed != null) {
                    factory.setValue(parsed);
                }
            } catch (NumberFormatException ex) {
                LOGGER.log(Level.FINE, "Keeping previous spinner value", ex);
            }
        }
        Integer value = spinner.getValue();
        return value == null ? 0 : value;
    }

    private void attachSimulationHandlers(SelfPlayTask task) {
        task.setOnSucceeded(event -> {
            cleanupTaskBindings();
            List<GameFrame> result = task.getValue();
            frames.setAll(result);
            if (!frames.isEmpty()) {
                int lastIndex = frames.size() - 1;
                currentIndex.set(lastIndex);
                currentFrame.set(frames.get(lastIndex));
                GameFrame last = frames.get(lastIndex);
                statusLabel.setText(last.outcome() == null ? "Stopped" : last.outcome().describe());
            } else {
                currentIndex.set(0);
                currentFrame.set(null);
                statusLabel.setText("Ready");
            }
            progressBar.setProgress(1.0);
        });

        task.setOnFailed(event -> {
            cleanupTaskBindings();
            Throwable error = task.getException();
            progressBar.setProgress(0);
            statusLabel.setText(error == null ? "Error" : "Error: " + error.getMessage());
            if (error != null) {
                LOGGER.log(Level.SEVERE, "Simulation failed", error);
            }
        });

        task.setOnCancelled(event -> {
            cleanupTaskBindings();
            progressBar.setProgress(0);
            statusLabel.setText("Cancelled");
        });
    }

    private void cleanupTaskBindings() {
        simulationRunning.set(false);
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        simulationTask = null;
    }

    private void configureFromArguments(List<String> args) {
        if (args == null || args.isEmpty()) {
            return;
        }
        try {
            GameConfig parsed = GameConfig.fromArguments(args.toArray(new String[0]));
            for (SeatConfig seat : parsed.seats()) {
                if (seat.strategy() == Strategy.HUMAN) {
                    LOGGER.warning(() -> "Ignoring human seat " + seat + ": the visualizer only plays computer seats");
                }
            }
            launchConfig = parsed;
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Ignoring invalid arguments " + args, ex);
        }
    }
}

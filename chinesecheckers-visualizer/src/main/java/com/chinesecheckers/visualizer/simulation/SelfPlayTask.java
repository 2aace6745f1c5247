package com.chinesecheckers.visualizer.simulation;

import com.chinesecheckers.core.Board;
import com.chinesecheckers.core.Evaluator;
import com.chinesecheckers.core.MoveGenerator;
import com.chinesecheckers.core.TurnController;
import com.chinesecheckers.core.ai.MinimaxSearch;
import com.chinesecheckers.core.config.GameConfig;
import com.chinesecheckers.core.config.InvalidConfigurationException;
import com.chinesecheckers.core.config.SeatConfig;
import com.chinesecheckers.core.config.Strategy;
import com.chinesecheckers.visualizer.model.GameFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import javafx.application.Platform;
import javafx.concurrent.Task;

/**
 * Background task that plays a single computer-only game described by a {@link GameConfig}.
 */
public final class SelfPlayTask extends Task<List<GameFrame>> {

    private final GameConfig config;
    private final Consumer<GameFrame> frameListener;

    public SelfPlayTask(GameConfig config, Consumer<GameFrame> frameListener) {
        this.config = Objects.requireNonNull(config, "config");
        for (SeatConfig seat : config.seats()) {
            if (seat.strategy() == Strategy.HUMAN) {
                throw new InvalidConfigurationException("The visualizer only plays computer seats, got " + seat);
            }
        }
        this.frameListener = Objects.requireNonNull(frameListener, "frameListener");
    }

    @Override
    protected List<GameFrame> call() {
        boolean onFxThread;
        try {
            onFxThread = Platform.isFxApplicationThread();
        } catch (IllegalStateException ex) {
            onFxThread = false;
        }
        if (onFxThread) {
            throw new IllegalStateException("Search must not run on the JavaFX application thread");
        }

        updateMessage("Подготовка...");
        updateProgress(0, config.maxPlies());

        MinimaxSearch search = new MinimaxSearch(new MoveGenerator(Board.standard(), config.entryRule()),
                new Evaluator());
        try {
            FrameRecorder recorder = new FrameRecorder(TurnController.fromConfig(config, null, search));
            List<GameFrame> frames = new ArrayList<>();
            frames.add(recorder.initialFrame());

            while (!recorder.isFinished()) {
                if (isCancelled()) {
                    updateMessage("Остановлено");
                    return frames;
                }

                int ply = recorder.pliesPlayed() + 1;
                updateMessage(String.format("Поиск хода %d", ply));
                GameFrame frame = recorder.playNext();
                frames.add(frame);
                publishFrame(frame);
                updateProgress(frame.ply(), config.maxPlies());
            }

            GameFrame last = frames.get(frames.size() - 1);
            updateProgress(config.maxPlies(), config.maxPlies());
            updateMessage(last.outcome() == null ? "Симуляция завершена" : last.outcome().describe());
            return frames;
        } finally {
            search.shutdown();
        }
    }

    private void publishFrame(GameFrame frame) {
        Platform.runLater(() -> frameListener.accept(frame));
    }
}

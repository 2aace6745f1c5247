package com.chinesecheckers.visualizer.simulation;

import com.chinesecheckers.core.TurnController;
import com.chinesecheckers.core.TurnResult;
import com.chinesecheckers.core.ai.SearchResult;
import com.chinesecheckers.core.player.MinimaxPlayer;
import com.chinesecheckers.core.player.Player;
import com.chinesecheckers.visualizer.model.GameFrame;
import java.util.Objects;

/**
 * Plays a game one turn at a time and turns every turn into a {@link GameFrame}.
 */
public final class FrameRecorder {

    private final TurnController controller;

    public FrameRecorder(TurnController controller) {
        this.controller = Objects.requireNonNull(controller, "controller");
    }

    public GameFrame initialFrame() {
        return new GameFrame(controller.snapshot(), null, null, controller.outcome(), controller.pliesPlayed());
    }

    public boolean isFinished() {
        return controller.isFinished();
    }

    public int pliesPlayed() {
        return controller.pliesPlayed();
    }

    /**
     * Plays the next turn and records the position after it.
     *
     * @throws IllegalStateException if the game is already over
     */
    public GameFrame playNext() {
        TurnResult turn = controller.playTurn();
        SearchResult search = null;
        if (turn.kind() == TurnResult.Kind.MOVED) {
            Player player = controller.player(turn.color());
            if (player instanceof MinimaxPlayer minimax) {
                search = minimax.lastResult();
            }
        }
        return new GameFrame(controller.snapshot(), turn, search, controller.outcome(), turn.ply());
    }
}

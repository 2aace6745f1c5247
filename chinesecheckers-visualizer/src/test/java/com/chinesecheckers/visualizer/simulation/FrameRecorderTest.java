package com.chinesecheckers.visualizer.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameOutcome;
import com.chinesecheckers.core.TurnController;
import com.chinesecheckers.core.TurnResult;
import com.chinesecheckers.core.config.GameConfig;
import com.chinesecheckers.core.config.SeatConfig;
import com.chinesecheckers.visualizer.model.GameFrame;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FrameRecorderTest {

    private static FrameRecorder recorder(int maxPlies) {
        GameConfig config = GameConfig.builder()
                .seat(SeatConfig.greedy(Color.RED))
                .seat(SeatConfig.minimax(Color.CYAN, 1))
                .maxPlies(maxPlies)
                .build();
        return new FrameRecorder(TurnController.fromConfig(config, null));
    }

    @Test
    void initialFrameShowsStartingPosition() {
        GameFrame initial = recorder(6).initialFrame();

        assertEquals(0, initial.ply());
        assertFalse(initial.hasLastMove());
        assertNull(initial.mover());
        assertNull(initial.outcome());
        assertEquals(Color.RED, initial.state().sideToMove());
        assertEquals(10, initial.state().piecesOf(Color.RED).size());
    }

    @Test
    void recordsSearchStatisticsOnlyForMinimaxSeats() {
        FrameRecorder recorder = recorder(6);

        GameFrame greedy = recorder.playNext();
        GameFrame minimax = recorder.playNext();

        assertEquals(1, greedy.ply());
        assertEquals(Color.RED, greedy.mover());
        assertEquals(TurnResult.Kind.MOVED, greedy.turn().kind());
        assertTrue(greedy.hasLastMove());
        assertNull(greedy.search());
        assertEquals(0L, greedy.visitedNodes());

        assertEquals(2, minimax.ply());
        assertEquals(Color.CYAN, minimax.mover());
        assertNotNull(minimax.search());
        assertEquals(minimax.lastMove(), minimax.search().move());
        assertTrue(minimax.visitedNodes() > 0);
    }

    @Test
    void framesHoldIndependentSnapshots() {
        FrameRecorder recorder = recorder(6);
        GameFrame initial = recorder.initialFrame();
        GameFrame first = recorder.playNext();

        assertTrue(initial.state().isEmpty(first.lastMove().destination()));
        assertEquals(Color.RED, first.state().colorAt(first.lastMove().destination()));
        assertTrue(first.state().isEmpty(first.lastMove().origin()));
    }

    @Test
    void teamGameFramesShowEveryControlledColor() {
        GameConfig config = GameConfig.builder()
                .colorCount(6)
                .colorsPerSeat(3)
                .seat(SeatConfig.greedy(Color.RED))
                .seat(SeatConfig.greedy(Color.CYAN))
                .maxPlies(2)
                .build();
        FrameRecorder recorder = new FrameRecorder(TurnController.fromConfig(config, null));

        GameFrame initial = recorder.initialFrame();
        GameFrame first = recorder.playNext();

        assertEquals(List.of(Color.RED, Color.CYAN), initial.state().participants());
        for (Color color : Color.values()) {
            assertEquals(10, initial.state().piecesOf(color).size(), color.name());
        }
        assertEquals(Color.RED, first.mover());
        assertEquals(Color.RED, first.state().sideAt(
                first.state().board().indexOf(first.lastMove().destination())));
    }

    @Test
    void lastFrameCarriesOutcome() {
        FrameRecorder recorder = recorder(4);
        List<GameFrame> frames = new ArrayList<>();
        while (!recorder.isFinished()) {
            frames.add(recorder.playNext());
        }

        assertEquals(4, frames.size());
        GameFrame last = frames.get(frames.size() - 1);
        assertTrue(last.isFinal());
        assertEquals(GameOutcome.Kind.PLY_LIMIT, last.outcome().kind());
        for (GameFrame frame : frames.subList(0, frames.size() - 1)) {
            assertFalse(frame.isFinal());
        }
        assertThrows(IllegalStateException.class, recorder::playNext);
    }
}

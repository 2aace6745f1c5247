package com.chinesecheckers.visualizer.ui;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.TurnResult;
import com.chinesecheckers.core.ai.SearchResult;
import com.chinesecheckers.visualizer.model.GameFrame;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;
import javafx.scene.shape.Circle;

/**
 * Displays aggregated information about the current simulation frame.
 */
public final class StatsPane extends VBox {

    private final Label moveValue = valueLabel();
    private final Label turnValue = valueLabel();
    private final Circle turnSwatch = new Circle(6);
    private final Label lastMoveValue = valueLabel();
    private final Label lastTurnValue = valueLabel();
    private final Label scoreValue = valueLabel();
    private final Label depthValue = valueLabel();
    private final Label nodesValue = valueLabel();
    private final Label cutoffsValue = valueLabel();
    private final Label searchTimeValue = valueLabel();
    private final Label activeValue = valueLabel();
    private final Label outcomeValue = valueLabel();

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(308);
        setMinWidth(308);
        setMaxWidth(308);

        Label title = new Label("Статистика");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        turnSwatch.setVisible(false);
        turnValue.setGraphic(turnSwatch);
        outcomeValue.setWrapText(true);
        lastMoveValue.setWrapText(true);

        addRow(grid, 0, "Ход", moveValue);
        addRow(grid, 1, "Ходит", turnValue);
        addRow(grid, 2, "Последний ход", lastMoveValue);
        addRow(grid, 3, "Итог хода", lastTurnValue);
        addRow(grid, 4, "Оценка", scoreValue);
        addRow(grid, 5, "Глубина", depthValue);
        addRow(grid, 6, "Посещено узлов", nodesValue);
        addRow(grid, 7, "Отсечения", cutoffsValue);
        addRow(grid, 8, "Время поиска", searchTimeValue);
        addRow(grid, 9, "В игре", activeValue);
        addRow(grid, 10, "Результат", outcomeValue);

        getChildren().addAll(title, grid);
    }

    public void update(GameFrame frame) {
        if (frame == null) {
            moveValue.setText("—");
            turnValue.setText("—");
            turnSwatch.setVisible(false);
            lastMoveValue.setText("—");
            lastTurnValue.setText("—");
            activeValue.setText("—");
            outcomeValue.setText("—");
            clearSearch();
            return;
        }

        GameState state = frame.state();
        moveValue.setText(String.valueOf(frame.ply()));
        if (frame.isFinal()) {
            turnValue.setText("—");
            turnSwatch.setVisible(false);
        } else {
            Color side = state.sideToMove();
            turnValue.setText(side.name());
            turnSwatch.setFill(BoardView.pegColor(side));
            turnSwatch.setVisible(true);
        }

        TurnResult turn = frame.turn();
        lastMoveValue.setText(frame.hasLastMove()
                ? String.format("%s (%s)", frame.lastMove(), frame.mover())
                : "—");
        lastTurnValue.setText(turn == null ? "—" : describeTurn(turn));
        activeValue.setText(String.valueOf(state.activeColors()));
        outcomeValue.setText(frame.outcome() == null ? "—" : frame.outcome().describe());

        SearchResult search = frame.search();
        if (search == null) {
            clearSearch();
        } else {
            scoreValue.setText(String.format("%.1f", search.score()));
            depthValue.setText(Integer.toString(search.depthEvaluated()));
            nodesValue.setText(search.visitedNodes() > 0 ? Long.toString(search.visitedNodes()) : "—");
            cutoffsValue.setText(Long.toString(search.cutoffs()));
            searchTimeValue.setText(search.elapsedNanos() > 0
                    ? String.format("%.1f мс", search.elapsedMillis())
                    : "—");
        }
    }

    private void clearSearch() {
        scoreValue.setText("—");
        depthValue.setText("—");
        nodesValue.setText("—");
        cutoffsValue.setText("—");
        searchTimeValue.setText("—");
    }

    private static String describeTurn(TurnResult turn) {
        return switch (turn.kind()) {
            case MOVED -> turn.move().isJump() ? "прыжок" : "шаг";
            case PASSED -> "пас";
            case SKIPPED_NO_MOVES -> "нет ходов";
            case RESIGNED -> "сдался";
        };
    }

    private static void addRow(GridPane grid, int row, String label, Node value) {
        Label caption = new Label(label + ":");
        caption.setStyle("-fx-text-fill: #4a4f64; -fx-font-weight: 600;");
        grid.addRow(row, caption, value);
    }

    private static Label valueLabel() {
        Label label = new Label("—");
        label.setStyle("-fx-font-size: 14px; -fx-text-fill: #1f2333;");
        return label;
    }
}

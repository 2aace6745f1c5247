package com.chinesecheckers.visualizer.ui;

import com.chinesecheckers.core.Board;
import com.chinesecheckers.core.Cell;
import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.GameState;
import com.chinesecheckers.core.Move;
import com.chinesecheckers.visualizer.model.GameFrame;
import java.util.EnumMap;
import java.util.Map;
import javafx.geometry.Insets;
import javafx.scene.Group;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Paint;
import javafx.scene.shape.Circle;
import javafx.scene.shape.Polyline;
import javafx.scene.shape.StrokeLineCap;
import javafx.scene.shape.StrokeLineJoin;

/**
 * Visual representation of the star-shaped Chinese Checkers board.
 */
public final class BoardView extends Pane {

    private static final double CELL_SPACING = 34.0;
    private static final double HOLE_RADIUS = CELL_SPACING * 0.36;
    private static final double HORIZONTAL_SPACING = CELL_SPACING;
    private static final double VERTICAL_SPACING = CELL_SPACING * Math.sqrt(3) / 2.0;
    private static final Paint EMPTY_FILL = javafx.scene.paint.Color.rgb(235, 238, 245);
    private static final Paint GRID_STROKE = javafx.scene.paint.Color.rgb(170, 177, 189);
    private static final Paint PEG_STROKE = javafx.scene.paint.Color.web("#1f2333");
    private static final Paint PATH_COLOR = javafx.scene.paint.Color.web("#FFB300", 0.8);
    private static final Paint LAST_MOVE_FILL = javafx.scene.paint.Color.web("#FFB300", 0.45);
    private static final double DEFAULT_STROKE_WIDTH = 1.0;
    private static final double PEG_STROKE_WIDTH = 1.5;
    private static final double PATH_THICKNESS = 5.0;
    private static final Map<Color, javafx.scene.paint.Color> PEG_COLORS = new EnumMap<>(Color.class);

    static {
        PEG_COLORS.put(Color.RED, javafx.scene.paint.Color.web("#E53935"));
        PEG_COLORS.put(Color.YELLOW, javafx.scene.paint.Color.web("#FDD835"));
        PEG_COLORS.put(Color.GREEN, javafx.scene.paint.Color.web("#43A047"));
        PEG_COLORS.put(Color.CYAN, javafx.scene.paint.Color.web("#00ACC1"));
        PEG_COLORS.put(Color.BLUE, javafx.scene.paint.Color.web("#3949AB"));
        PEG_COLORS.put(Color.MAGENTA, javafx.scene.paint.Color.web("#D81B60"));
    }

    private final Board board;
    private final Circle[] holes;
    private final Paint[] emptyFills;
    private final double[] centerX;
    private final double[] centerY;
    private final Group boardGroup;
    private final Polyline lastMovePath;
    private final Circle lastMoveMarker;
    private final double contentWidth;
    private final double contentHeight;

    public BoardView() {
        this(Board.standard());
    }

    public BoardView(Board board) {
        this.board = board;
        int cellCount = board.cellCount();
        holes = new Circle[cellCount];
        emptyFills = new Paint[cellCount];
        centerX = new double[cellCount];
        centerY = new double[cellCount];

        setPadding(new Insets(16));
        setStyle("-fx-background-color: linear-gradient(to bottom, #fdfdfd, #e7ebf5);");
        boardGroup = new Group();
        getChildren().add(boardGroup);

        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (int index = 0; index < cellCount; index++) {
            Cell cell = board.cellAt(index);
            double x = (cell.q() + cell.r() / 2.0) * HORIZONTAL_SPACING;
            double y = cell.r() * VERTICAL_SPACING;
            centerX[index] = x;
            centerY[index] = y;
            minX = Math.min(minX, x - HOLE_RADIUS);
            maxX = Math.max(maxX, x + HOLE_RADIUS);
            minY = Math.min(minY, y - HOLE_RADIUS);
            maxY = Math.max(maxY, y + HOLE_RADIUS);
        }

        for (int index = 0; index < cellCount; index++) {
            centerX[index] -= minX;
            centerY[index] -= minY;
            Color region = board.regionAt(index);
            emptyFills[index] = region == null ? EMPTY_FILL : PEG_COLORS.get(region).deriveColor(0, 0.35, 1.0, 0.35);

            Circle hole = new Circle(centerX[index], centerY[index], HOLE_RADIUS);
            hole.setFill(emptyFills[index]);
            hole.setStroke(GRID_STROKE);
            hole.setStrokeWidth(DEFAULT_STROKE_WIDTH);
            holes[index] = hole;
            boardGroup.getChildren().add(hole);
        }
        contentWidth = maxX - minX;
        contentHeight = maxY - minY;

        lastMovePath = new Polyline();
        lastMovePath.setStroke(PATH_COLOR);
        lastMovePath.setStrokeWidth(PATH_THICKNESS);
        lastMovePath.setStrokeLineCap(StrokeLineCap.ROUND);
        lastMovePath.setStrokeLineJoin(StrokeLineJoin.ROUND);
        lastMovePath.setMouseTransparent(true);
        lastMovePath.setVisible(false);
        boardGroup.getChildren().add(lastMovePath);

        lastMoveMarker = new Circle(HOLE_RADIUS * 0.5);
        lastMoveMarker.setFill(LAST_MOVE_FILL);
        lastMoveMarker.setStroke(javafx.scene.paint.Color.TRANSPARENT);
        lastMoveMarker.setMouseTransparent(true);
        lastMoveMarker.setVisible(false);
        boardGroup.getChildren().add(lastMoveMarker);

        setPrefSize(contentWidth + CELL_SPACING * 2, contentHeight + CELL_SPACING * 2);
        setMinSize(0, 0);
        setMaxSize(Double.MAX_VALUE, Double.MAX_VALUE);
    }

    public void update(GameFrame frame) {
        if (frame == null) {
            for (int index = 0; index < holes.length; index++) {
                paintEmpty(index);
            }
            updateLastMove(null);
            return;
        }

        GameState state = frame.state();
        for (int index = 0; index < holes.length; index++) {
            Color occupant = state.colorAt(index);
            if (occupant == null) {
                paintEmpty(index);
            } else {
                Circle hole = holes[index];
                hole.setFill(PEG_COLORS.get(occupant));
                hole.setStroke(PEG_STROKE);
                hole.setStrokeWidth(PEG_STROKE_WIDTH);
            }
        }
        updateLastMove(frame.lastMove());
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        var insets = getInsets();
        double availableWidth = getWidth() - insets.getLeft() - insets.getRight();
        double availableHeight = getHeight() - insets.getTop() - insets.getBottom();
        double offsetX = insets.getLeft() + (availableWidth - contentWidth) / 2.0;
        double offsetY = insets.getTop() + (availableHeight - contentHeight) / 2.0;
        boardGroup.relocate(offsetX, offsetY);
    }

    /**
     * Returns the fill used for pegs of the given color.
     */
    public static javafx.scene.paint.Color pegColor(Color color) {
        return PEG_COLORS.get(color);
    }

    private void paintEmpty(int index) {
        Circle hole = holes[index];
        hole.setFill(emptyFills[index]);
        hole.setStroke(GRID_STROKE);
        hole.setStrokeWidth(DEFAULT_STROKE_WIDTH);
    }

    private void updateLastMove(Move move) {
        lastMovePath.getPoints().clear();
        if (move == null) {
            lastMovePath.setVisible(false);
            lastMoveMarker.setVisible(false);
            return;
        }
        for (Cell cell : move.path()) {
            int index = board.indexOf(cell);
            lastMovePath.getPoints().addAll(centerX[index], centerY[index]);
        }
        lastMovePath.setVisible(true);

        int origin = board.indexOf(move.origin());
        lastMoveMarker.setCenterX(centerX[origin]);
        lastMoveMarker.setCenterY(centerY[origin]);
        lastMoveMarker.setVisible(true);
    }
}

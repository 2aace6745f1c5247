package com.chinesecheckers.core;

import java.util.List;

/**
 * Positional heuristic. A color's advancement sums, over its pegs, the progress made along its home-to-target
 * axis, a small penalty for drifting away from that axis, a bonus for pegs resting in the target triangle and
 * a penalty for pegs still at home. A side's advancement is the sum over the colors it controls. The score of
 * a side is its advancement minus the mean advancement of the other sides in play, with a decisive bonus or
 * malus once any side has won.
 *
 * <p>Evaluation is a pure function of the position.
 */
public final class Evaluator {

    public static final double WIN_SCORE = 100_000.0;
    public static final int PROGRESS_WEIGHT = 10;
    public static final int LATERAL_WEIGHT = 1;
    public static final int TARGET_BONUS = 20;
    public static final int HOME_PENALTY = 15;

    private static final int TIP_AXIS_VALUE = 8;

    public double score(Position position, Color side) {
        Board board = position.board();
        Teams teams = position.teams();
        int colorCount = Color.values().length;
        double[] advancement = new double[colorCount];
        int[] pegs = new int[colorCount];
        int[] inTarget = new int[colorCount];

        for (int index = 0; index < board.cellCount(); index++) {
            Color peg = position.colorAt(index);
            if (peg == null) {
                continue;
            }
            int slot = teams.sideOf(peg).ordinal();
            advancement[slot] += pegValue(board, index, peg);
            pegs[slot]++;
            if (board.isInTarget(index, peg)) {
                inTarget[slot]++;
            }
        }

        double opponents = 0.0;
        int opponentCount = 0;
        for (Color other : position.activeColors()) {
            if (other != side) {
                opponents += advancement[other.ordinal()];
                opponentCount++;
            }
        }
        boolean opponentWon = false;
        for (Color participant : position.participants()) {
            int slot = participant.ordinal();
            if (participant != side && pegs[slot] > 0 && inTarget[slot] == pegs[slot]) {
                opponentWon = true;
            }
        }

        int own = side.ordinal();
        double score = advancement[own] - (opponentCount == 0 ? 0.0 : opponents / opponentCount);
        if (pegs[own] > 0 && inTarget[own] == pegs[own]) {
            score += WIN_SCORE;
        } else if (opponentWon) {
            score -= WIN_SCORE;
        }
        return score;
    }

    /**
     * Returns the advancement of a single side over every color it controls, ignoring everybody else.
     */
    public double advancement(Position position, Color side) {
        Board board = position.board();
        Teams teams = position.teams();
        double total = 0.0;
        for (int index = 0; index < board.cellCount(); index++) {
            Color peg = position.colorAt(index);
            if (peg != null && teams.sideOf(peg) == side) {
                total += pegValue(board, index, peg);
            }
        }
        return total;
    }

    /**
     * Returns the sum of the advancement of every listed side, used to order candidate moves cheaply.
     */
    public double totalAdvancement(Position position, List<Color> sides) {
        double total = 0.0;
        for (Color side : sides) {
            total += advancement(position, side);
        }
        return total;
    }

    private static int pegValue(Board board, int index, Color color) {
        Cell cell = board.cellAt(index);
        int progress = TIP_AXIS_VALUE - color.axisValue(cell);
        int value = PROGRESS_WEIGHT * progress - LATERAL_WEIGHT * color.lateralOffset(cell);
        if (board.isInTarget(index, color)) {
            value += TARGET_BONUS;
        } else if (board.isInHome(index, color)) {
            value -= HOME_PENALTY;
        }
        return value;
    }
}

package com.chinesecheckers.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assignment of colors to the sides taking turns. A side moves the pegs of every color it controls and is named
 * after the first of them, its lead color. In the common game every side controls exactly one color.
 */
public final class Teams {

    private final List<Color> sides;
    private final List<Color> colors;
    private final Map<Color, List<Color>> colorsBySide;
    private final Map<Color, Color> sideByColor;

    private Teams(List<List<Color>> groups) {
        List<Color> leads = new ArrayList<>(groups.size());
        List<Color> all = new ArrayList<>();
        Map<Color, List<Color>> bySide = new EnumMap<>(Color.class);
        Map<Color, Color> byColor = new EnumMap<>(Color.class);
        for (List<Color> group : groups) {
            Objects.requireNonNull(group, "group");
            if (group.isEmpty()) {
                throw new IllegalArgumentException("Every side needs at least one color");
            }
            Color lead = Objects.requireNonNull(group.get(0), "color");
            for (Color color : group) {
                Objects.requireNonNull(color, "color");
                if (byColor.put(color, lead) != null) {
                    throw new IllegalArgumentException("Color " + color + " is assigned twice");
                }
                all.add(color);
            }
            leads.add(lead);
            bySide.put(lead, List.copyOf(group));
        }
        if (leads.size() < 2) {
            throw new IllegalArgumentException("At least two sides must take part");
        }
        this.sides = Collections.unmodifiableList(leads);
        this.colors = Collections.unmodifiableList(all);
        this.colorsBySide = Collections.unmodifiableMap(bySide);
        this.sideByColor = Collections.unmodifiableMap(byColor);
    }

    /**
     * One side per color, in the given turn order.
     *
     * @throws IllegalArgumentException if fewer than two colors are given or a color repeats
     */
    public static Teams solo(List<Color> colors) {
        Objects.requireNonNull(colors, "colors");
        List<List<Color>> groups = new ArrayList<>(colors.size());
        for (Color color : colors) {
            groups.add(List.of(Objects.requireNonNull(color, "color")));
        }
        return new Teams(groups);
    }

    /**
     * One side per group, in the given turn order. The first color of a group names the side.
     *
     * @throws IllegalArgumentException if fewer than two groups are given, a group is empty or a color repeats
     */
    public static Teams of(List<List<Color>> groups) {
        Objects.requireNonNull(groups, "groups");
        return new Teams(groups);
    }

    /**
     * Lead colors in turn order.
     */
    public List<Color> sides() {
        return sides;
    }

    /**
     * Every color on the board, grouped by side in turn order.
     */
    public List<Color> colors() {
        return colors;
    }

    public List<Color> colorsOf(Color side) {
        List<Color> controlled = colorsBySide.get(side);
        if (controlled == null) {
            throw new IllegalArgumentException(side + " does not lead a side");
        }
        return controlled;
    }

    /**
     * Returns the side moving pegs of {@code color}, or {@code null} if the color is not on the board.
     */
    public Color sideOf(Color color) {
        return sideByColor.get(color);
    }

    public boolean isSolo() {
        return colors.size() == sides.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Teams teams
                && sides.equals(teams.sides)
                && colorsBySide.equals(teams.colorsBySide);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sides, colorsBySide);
    }

    @Override
    public String toString() {
        if (isSolo()) {
            return sides.toString();
        }
        List<String> groups = new ArrayList<>(sides.size());
        for (Color side : sides) {
            groups.add(String.join("+", colorsOf(side).stream().map(Color::name).toList()));
        }
        return groups.toString();
    }
}

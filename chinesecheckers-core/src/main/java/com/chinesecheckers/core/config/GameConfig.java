package com.chinesecheckers.core.config;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.EntryRule;
import com.chinesecheckers.core.Teams;
import com.chinesecheckers.core.ai.SearchConstraints.SearchMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validated description of a game: the seats in turn order, how many colors each seat controls and the rule and
 * search options shared by every seat. Seats are ordered clockwise around the star starting at
 * {@link Color#RED}; a seat is keyed by the lead color of the colors it controls.
 */
public record GameConfig(List<SeatConfig> seats, int branchLimit, SearchMode mode, EntryRule entryRule,
        int maxPlies, int colorsPerSeat) {

    public static final int DEFAULT_COLOR_COUNT = 2;
    public static final int DEFAULT_COLORS_PER_SEAT = 1;
    public static final int DEFAULT_DEPTH = 2;
    public static final int DEFAULT_MAX_PLIES = 1000;

    public GameConfig {
        Objects.requireNonNull(seats, "seats");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(entryRule, "entryRule");
        Set<Color> seen = EnumSet.noneOf(Color.class);
        for (SeatConfig seat : seats) {
            Objects.requireNonNull(seat, "seat");
            if (!seen.add(seat.color())) {
                throw new InvalidConfigurationException("Color " + seat.color() + " is seated twice");
            }
        }
        if (colorsPerSeat < 1) {
            throw new InvalidConfigurationException("Colors per seat must be positive, got " + colorsPerSeat);
        }
        List<Color> leads = standardTeams(seats.size() * colorsPerSeat, colorsPerSeat).sides();
        if (!seen.equals(EnumSet.copyOf(leads))) {
            throw new InvalidConfigurationException("Seats " + seen + " do not match the standard layout " + leads
                    + " for " + seats.size() + " seats of " + colorsPerSeat + " colors");
        }
        if (branchLimit < 0) {
            throw new InvalidConfigurationException("Branch limit must not be negative, got " + branchLimit);
        }
        if (maxPlies <= 0) {
            throw new InvalidConfigurationException("Ply limit must be positive, got " + maxPlies);
        }
        List<SeatConfig> ordered = new ArrayList<>(seats);
        ordered.sort(Comparator.comparing(SeatConfig::color));
        seats = List.copyOf(ordered);
    }

    /**
     * Returns the colors used for a game of {@code count} colors: opposite pairs for 2, 4 and 6 colors and
     * every other point for 3.
     *
     * @throws InvalidConfigurationException if the star has no standard layout for {@code count} colors
     */
    public static List<Color> standardColors(int count) {
        return switch (count) {
            case 2 -> List.of(Color.RED, Color.CYAN);
            case 3 -> List.of(Color.RED, Color.GREEN, Color.BLUE);
            case 4 -> List.of(Color.RED, Color.YELLOW, Color.CYAN, Color.BLUE);
            case 6 -> List.of(Color.values());
            default -> throw new InvalidConfigurationException(
                    "Unsupported number of colors: " + count + " (expected 2, 3, 4 or 6)");
        };
    }

    /**
     * Splits the standard colors of a {@code colorCount} color game into seats of {@code colorsPerSeat}
     * neighbouring colors, clockwise from {@link Color#RED}. Seats of two colors in a four or six color game
     * and seats of three colors in a six color game make every seat's targets mirror its homes.
     *
     * @throws InvalidConfigurationException if the colors cannot be split into at least two equal seats
     */
    public static Teams standardTeams(int colorCount, int colorsPerSeat) {
        List<Color> colors = standardColors(colorCount);
        if (colorsPerSeat < 1 || colorCount % colorsPerSeat != 0 || colorCount / colorsPerSeat < 2) {
            throw new InvalidConfigurationException("Cannot split " + colorCount + " colors into seats of "
                    + colorsPerSeat + " colors");
        }
        List<List<Color>> groups = new ArrayList<>();
        for (int start = 0; start < colorCount; start += colorsPerSeat) {
            groups.add(colors.subList(start, start + colorsPerSeat));
        }
        return Teams.of(groups);
    }

    /**
     * Colors controlled by each seat, in turn order.
     */
    public Teams teams() {
        return standardTeams(seats.size() * colorsPerSeat, colorsPerSeat);
    }

    /**
     * Seat colors in turn order. With several colors per seat these are the lead colors only.
     */
    public List<Color> colors() {
        List<Color> colors = new ArrayList<>(seats.size());
        for (SeatConfig seat : seats) {
            colors.add(seat.color());
        }
        return colors;
    }

    public SeatConfig seat(Color color) {
        for (SeatConfig seat : seats) {
            if (seat.color() == color) {
                return seat;
            }
        }
        throw new IllegalArgumentException(color + " has no seat");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses {@code --key=value} options. Colors without an explicit {@code --seat} are played by minimax at
     * the {@code --depth} given (default {@value #DEFAULT_DEPTH}).
     *
     * @throws InvalidConfigurationException on unknown options or invalid values
     */
    public static GameConfig fromArguments(String[] args) {
        Objects.requireNonNull(args, "args");
        Builder builder = builder();
        List<String> seatSpecs = new ArrayList<>();
        int depth = DEFAULT_DEPTH;
        for (String option : args) {
            if (option.startsWith("--colors=")) {
                builder.colorCount(parseInt(option, "--colors="));
            } else if (option.startsWith("--colors-per-seat=")) {
                builder.colorsPerSeat(parseInt(option, "--colors-per-seat="));
            } else if (option.startsWith("--seat=")) {
                seatSpecs.add(option.substring("--seat=".length()));
            } else if (option.startsWith("--depth=")) {
                depth = parseInt(option, "--depth=");
            } else if (option.startsWith("--branch-limit=")) {
                builder.branchLimit(parseInt(option, "--branch-limit="));
            } else if (option.startsWith("--mode=")) {
                builder.mode(parseEnum(SearchMode.class, option.substring("--mode=".length())));
            } else if (option.startsWith("--entry-rule=")) {
                builder.entryRule(parseEnum(EntryRule.class, option.substring("--entry-rule=".length())));
            } else if (option.startsWith("--max-plies=")) {
                builder.maxPlies(parseInt(option, "--max-plies="));
            } else {
                throw new InvalidConfigurationException("Unrecognised argument: " + option);
            }
        }
        builder.defaultDepth(depth);
        for (String seatSpec : seatSpecs) {
            builder.seat(SeatConfig.parse(seatSpec, depth));
        }
        return builder.build();
    }

    private static int parseInt(String option, String prefix) {
        String value = option.substring(prefix.length());
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException("Invalid number for " + prefix + " " + value, ex);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidConfigurationException("Unknown " + type.getSimpleName() + ": " + value, ex);
        }
    }

    /**
     * Builder starting from a two color game of minimax seats.
     */
    public static final class Builder {

        private int colorCount = DEFAULT_COLOR_COUNT;
        private int colorsPerSeat = DEFAULT_COLORS_PER_SEAT;
        private int defaultDepth = DEFAULT_DEPTH;
        private final Map<Color, SeatConfig> seats = new EnumMap<>(Color.class);
        private int branchLimit;
        private SearchMode mode = SearchMode.SEQ;
        private EntryRule entryRule = EntryRule.UNRESTRICTED;
        private int maxPlies = DEFAULT_MAX_PLIES;

        private Builder() {
        }

        public Builder colorCount(int colorCount) {
            this.colorCount = colorCount;
            return this;
        }

        public Builder colorsPerSeat(int colorsPerSeat) {
            this.colorsPerSeat = colorsPerSeat;
            return this;
        }

        public Builder defaultDepth(int defaultDepth) {
            this.defaultDepth = defaultDepth;
            return this;
        }

        public Builder seat(SeatConfig seat) {
            Objects.requireNonNull(seat, "seat");
            if (seats.put(seat.color(), seat) != null) {
                throw new InvalidConfigurationException("Color " + seat.color() + " is seated twice");
            }
            return this;
        }

        public Builder branchLimit(int branchLimit) {
            this.branchLimit = branchLimit;
            return this;
        }

        public Builder mode(SearchMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder entryRule(EntryRule entryRule) {
            this.entryRule = Objects.requireNonNull(entryRule, "entryRule");
            return this;
        }

        public Builder maxPlies(int maxPlies) {
            this.maxPlies = maxPlies;
            return this;
        }

        public GameConfig build() {
            List<Color> leads = standardTeams(colorCount, colorsPerSeat).sides();
            for (Color seated : seats.keySet()) {
                if (!leads.contains(seated)) {
                    throw new InvalidConfigurationException(seated + " does not lead a seat in a " + colorCount
                            + " color game with " + colorsPerSeat + " colors per seat " + leads);
                }
            }
            List<SeatConfig> resolved = new ArrayList<>(leads.size());
            for (Color color : leads) {
                SeatConfig seat = seats.get(color);
                resolved.add(seat != null ? seat : SeatConfig.minimax(color, defaultDepth));
            }
            return new GameConfig(resolved, branchLimit, mode, entryRule, maxPlies, colorsPerSeat);
        }
    }
}

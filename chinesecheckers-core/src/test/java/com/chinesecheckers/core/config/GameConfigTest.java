package com.chinesecheckers.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.chinesecheckers.core.Color;
import com.chinesecheckers.core.EntryRule;
import com.chinesecheckers.core.Teams;
import com.chinesecheckers.core.ai.SearchConstraints.SearchMode;
import java.util.List;
import org.junit.jupiter.api.Test;

class GameConfigTest {

    @Test
    void defaultsToTwoMinimaxSeats() {
        GameConfig config = GameConfig.builder().build();

        assertEquals(List.of(Color.RED, Color.CYAN), config.colors());
        assertEquals(SeatConfig.minimax(Color.CYAN, GameConfig.DEFAULT_DEPTH), config.seat(Color.CYAN));
        assertEquals(0, config.branchLimit());
        assertEquals(SearchMode.SEQ, config.mode());
        assertEquals(EntryRule.UNRESTRICTED, config.entryRule());
        assertEquals(GameConfig.DEFAULT_MAX_PLIES, config.maxPlies());
        assertEquals(1, config.colorsPerSeat());
        assertEquals(Teams.solo(List.of(Color.RED, Color.CYAN)), config.teams());
    }

    @Test
    void standardColorCombinations() {
        assertEquals(List.of(Color.RED, Color.GREEN, Color.BLUE), GameConfig.standardColors(3));
        assertEquals(4, GameConfig.standardColors(4).size());
        assertEquals(6, GameConfig.standardColors(6).size());
        assertThrows(InvalidConfigurationException.class, () -> GameConfig.standardColors(5));
        assertThrows(InvalidConfigurationException.class, () -> GameConfig.standardColors(1));
    }

    @Test
    void parsesCommandLineOptions() {
        GameConfig config = GameConfig.fromArguments(new String[] {
            "--colors=3", "--seat=green:human", "--seat=BLUE:minimax:4", "--depth=3", "--branch-limit=8",
            "--mode=par", "--entry-rule=no-foreign-triangles", "--max-plies=500"});

        assertEquals(List.of(Color.RED, Color.GREEN, Color.BLUE), config.colors());
        assertEquals(SeatConfig.minimax(Color.RED, 3), config.seat(Color.RED));
        assertEquals(SeatConfig.human(Color.GREEN), config.seat(Color.GREEN));
        assertEquals(SeatConfig.minimax(Color.BLUE, 4), config.seat(Color.BLUE));
        assertEquals(8, config.branchLimit());
        assertEquals(SearchMode.PAR, config.mode());
        assertEquals(EntryRule.NO_FOREIGN_TRIANGLES, config.entryRule());
        assertEquals(500, config.maxPlies());
    }

    @Test
    void seatsAreOrderedClockwise() {
        GameConfig config = new GameConfig(List.of(SeatConfig.greedy(Color.CYAN), SeatConfig.human(Color.RED)), 0,
                SearchMode.SEQ, EntryRule.UNRESTRICTED, 10, 1);

        assertEquals(List.of(Color.RED, Color.CYAN), config.colors());
    }

    @Test
    void rejectsInvalidConfigurations() {
        assertThrows(InvalidConfigurationException.class, () -> GameConfig.builder().colorCount(5).build());
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.builder().seat(SeatConfig.greedy(Color.RED)).seat(SeatConfig.human(Color.RED)));
        assertThrows(InvalidConfigurationException.class, () -> SeatConfig.minimax(Color.RED, 0));
        assertThrows(InvalidConfigurationException.class, () -> GameConfig.builder().branchLimit(-1).build());
        assertThrows(InvalidConfigurationException.class, () -> GameConfig.builder().maxPlies(0).build());
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.builder().seat(SeatConfig.greedy(Color.GREEN)).build());
        assertThrows(InvalidConfigurationException.class,
                () -> new GameConfig(List.of(SeatConfig.greedy(Color.RED), SeatConfig.greedy(Color.RED)), 0,
                        SearchMode.SEQ, EntryRule.UNRESTRICTED, 10, 1));
        assertThrows(InvalidConfigurationException.class,
                () -> new GameConfig(List.of(SeatConfig.minimax(Color.RED, 2), SeatConfig.minimax(Color.YELLOW, 2)),
                        0, SearchMode.SEQ, EntryRule.UNRESTRICTED, 100, 1));
        assertThrows(InvalidConfigurationException.class,
                () -> new GameConfig(List.of(SeatConfig.greedy(Color.RED), SeatConfig.greedy(Color.GREEN)), 0,
                        SearchMode.SEQ, EntryRule.UNRESTRICTED, 100, 2));
        assertThrows(InvalidConfigurationException.class,
                () -> new GameConfig(List.of(SeatConfig.greedy(Color.RED), SeatConfig.greedy(Color.CYAN)), 0,
                        SearchMode.SEQ, EntryRule.UNRESTRICTED, 100, 0));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.builder().colorCount(3).colorsPerSeat(3).build());
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.builder().colorCount(6).colorsPerSeat(4).build());
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.builder().colorCount(4).colorsPerSeat(2).seat(SeatConfig.greedy(Color.YELLOW))
                        .build());
    }

    @Test
    void groupsNeighbouringColorsIntoSeats() {
        assertEquals(Teams.of(List.of(List.of(Color.RED, Color.YELLOW), List.of(Color.CYAN, Color.BLUE))),
                GameConfig.standardTeams(4, 2));
        assertEquals(List.of(Color.RED, Color.GREEN, Color.BLUE), GameConfig.standardTeams(6, 2).sides());
        assertEquals(List.of(Color.CYAN, Color.BLUE, Color.MAGENTA),
                GameConfig.standardTeams(6, 3).colorsOf(Color.CYAN));
        assertEquals(Teams.solo(List.of(Color.RED, Color.GREEN, Color.BLUE)), GameConfig.standardTeams(3, 1));
    }

    @Test
    void parsesColorsPerSeat() {
        GameConfig config = GameConfig.fromArguments(new String[] {
            "--colors=6", "--colors-per-seat=3", "--seat=cyan:greedy"});

        assertEquals(List.of(Color.RED, Color.CYAN), config.colors());
        assertEquals(SeatConfig.greedy(Color.CYAN), config.seat(Color.CYAN));
        assertEquals(List.of(Color.RED, Color.YELLOW, Color.GREEN), config.teams().colorsOf(Color.RED));
        assertEquals(6, config.teams().colors().size());
    }

    @Test
    void rejectsMalformedArguments() {
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--colors=two"}));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--seat=purple:human"}));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--seat=red:greedy:3"}));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--seat=red:human", "--seat=red:greedy"}));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--depth=0"}));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--mode=fast"}));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--verbose"}));
        assertThrows(InvalidConfigurationException.class,
                () -> GameConfig.fromArguments(new String[] {"--colors=4", "--colors-per-seat=3"}));
    }
}

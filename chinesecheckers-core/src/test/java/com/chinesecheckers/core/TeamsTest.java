package com.chinesecheckers.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TeamsTest {

    @Test
    void soloGivesEveryColorItsOwnSide() {
        Teams teams = Teams.solo(List.of(Color.RED, Color.GREEN, Color.BLUE));

        assertTrue(teams.isSolo());
        assertEquals(List.of(Color.RED, Color.GREEN, Color.BLUE), teams.sides());
        assertEquals(teams.sides(), teams.colors());
        assertEquals(List.of(Color.GREEN), teams.colorsOf(Color.GREEN));
        assertEquals(Color.BLUE, teams.sideOf(Color.BLUE));
        assertNull(teams.sideOf(Color.CYAN));
        assertEquals("[RED, GREEN, BLUE]", teams.toString());
    }

    @Test
    void groupsAreNamedAfterTheirFirstColor() {
        Teams teams = Teams.of(List.of(
                List.of(Color.RED, Color.YELLOW, Color.GREEN),
                List.of(Color.CYAN, Color.BLUE, Color.MAGENTA)));

        assertFalse(teams.isSolo());
        assertEquals(List.of(Color.RED, Color.CYAN), teams.sides());
        assertEquals(6, teams.colors().size());
        assertEquals(Color.RED, teams.sideOf(Color.GREEN));
        assertEquals(Color.CYAN, teams.sideOf(Color.MAGENTA));
        assertEquals(List.of(Color.CYAN, Color.BLUE, Color.MAGENTA), teams.colorsOf(Color.CYAN));
        assertThrows(IllegalArgumentException.class, () -> teams.colorsOf(Color.YELLOW));
        assertEquals("[RED+YELLOW+GREEN, CYAN+BLUE+MAGENTA]", teams.toString());
    }

    @Test
    void equalityFollowsTheGrouping() {
        Teams pairs = Teams.of(List.of(List.of(Color.RED, Color.YELLOW), List.of(Color.CYAN, Color.BLUE)));

        assertEquals(TestPositions.PAIRS, pairs);
        assertEquals(TestPositions.PAIRS.hashCode(), pairs.hashCode());
        assertFalse(pairs.equals(Teams.solo(List.of(Color.RED, Color.YELLOW, Color.CYAN, Color.BLUE))));
    }

    @Test
    void rejectsMalformedGroups() {
        assertThrows(IllegalArgumentException.class, () -> Teams.solo(List.of(Color.RED)));
        assertThrows(IllegalArgumentException.class,
                () -> Teams.of(List.of(List.of(Color.RED, Color.YELLOW))));
        assertThrows(IllegalArgumentException.class,
                () -> Teams.of(List.of(List.of(Color.RED), List.of())));
        assertThrows(IllegalArgumentException.class,
                () -> Teams.of(List.of(List.of(Color.RED, Color.CYAN), List.of(Color.CYAN))));
    }
}

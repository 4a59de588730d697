package ru.uzden.vpnpanel.services;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryRoundRobinCursorTest {

    @Test
    void cyclesThroughCandidatesPerLocation() {
        InMemoryRoundRobinCursor cursor = new InMemoryRoundRobinCursor();
        List<Long> ids = List.of(10L, 20L, 30L);

        assertEquals(10L, cursor.advance(1L, ids));
        assertEquals(20L, cursor.advance(1L, ids));
        assertEquals(30L, cursor.advance(1L, ids));
        assertEquals(10L, cursor.advance(1L, ids));
        // другая локация - свой курсор
        assertEquals(10L, cursor.advance(2L, ids));
    }

    @Test
    void restartsWhenLastPanelLeftCandidates() {
        InMemoryRoundRobinCursor cursor = new InMemoryRoundRobinCursor();
        cursor.advance(1L, List.of(10L, 20L));
        cursor.advance(1L, List.of(10L, 20L));

        assertEquals(30L, cursor.advance(1L, List.of(30L, 40L)));
    }

    @Test
    void nextAfterWrapsAround() {
        assertEquals(5L, RoundRobinCursor.nextAfter(null, List.of(5L, 6L)));
        assertEquals(6L, RoundRobinCursor.nextAfter(5L, List.of(5L, 6L)));
        assertEquals(5L, RoundRobinCursor.nextAfter(6L, List.of(5L, 6L)));
        assertEquals(5L, RoundRobinCursor.nextAfter(99L, List.of(5L, 6L)));
    }

    @Test
    void emptyCandidatesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryRoundRobinCursor().advance(1L, List.of()));
    }
}

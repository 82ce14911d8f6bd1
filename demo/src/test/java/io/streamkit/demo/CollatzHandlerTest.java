package io.streamkit.demo;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CollatzHandlerTest {
    @Test
    void counts_steps_to_one() {
        CollatzHandler h = new CollatzHandler();
        assertEquals(0L, h.handle(1L));
        assertEquals(1L, h.handle(2L));
        assertEquals(7L, h.handle(3L));
        assertEquals(111L, h.handle(27L));
        assertThrows(IllegalArgumentException.class, () -> h.handle(0L));
    }
}

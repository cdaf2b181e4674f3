package com.pathtree.engine.tree;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

final class PathsTest {

    @Test
    void displayStringJoinsKeys() {
        assertEquals("", Paths.toDisplayString(null));
        assertEquals("track", Paths.toDisplayString("track"));
        assertEquals("a/1/x", Paths.toDisplayString(List.of("a", 1, "x")));
    }

    @Test
    void compositeWidthCountsParts() {
        assertEquals(1, Paths.compositeWidth("a"));
        assertEquals(3, Paths.compositeWidth(List.of("a", "b", "c")));
        assertTrue(Paths.isComposite(List.of("a")));
        assertFalse(Paths.isComposite(7));
    }
}

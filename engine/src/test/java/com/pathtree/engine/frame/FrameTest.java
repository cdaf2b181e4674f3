package com.pathtree.engine.frame;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class FrameTest {

    @Test
    void ofPadsShortRows() {
        Frame frame = Frame.of(List.of("a", "b"), List.of("x", "y"), List.of(List.of(1, 2), List.of(3)));

        assertEquals(List.of(List.of("a"), List.of("b")), frame.index());
        assertEquals(Arrays.asList(3, null), frame.rows().get(1));
        assertEquals(2, frame.columnCount());
        assertEquals(2, frame.get(0, 1));
    }

    @Test
    void ofRejectsMismatchedSizes() {
        assertThrows(IllegalArgumentException.class,
                () -> Frame.of(List.of("a"), List.of("x"), List.of(List.of(1), List.of(2))));
        assertThrows(IllegalArgumentException.class,
                () -> Frame.of(List.of("a"), List.of("x"), List.of(List.of(1, 2))));
    }

    @Test
    void fromColumnsIndexesByPosition() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("x", List.of(1, 2));
        columns.put("y", List.of("p", "q"));

        Frame frame = Frame.fromColumns(columns);

        assertEquals(List.of(List.of(0), List.of(1)), frame.index());
        assertEquals(List.of("x", "y"), frame.columns());
        assertEquals(List.of("p", "q"), frame.column("y"));
        assertNull(frame.column("z"));
    }

    @Test
    void fromColumnsRejectsUnequalLengths() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("x", List.of(1, 2));
        columns.put("y", List.of(3));

        assertThrows(IllegalArgumentException.class, () -> Frame.fromColumns(columns));
    }

    @Test
    void concatUnitesColumns() {
        Frame first = Frame.of(List.of("r"), List.of("x"), List.of(List.of(1)));
        Frame second = Frame.of(List.of("r"), List.of("y", "x"), List.of(List.of(2, 3)));

        Frame frame = Frame.concat(List.of(List.of("a"), List.of("b", "c")), List.of(first, second));

        assertEquals(List.of(List.of("a", "r"), List.of("b", "c", "r")), frame.index());
        assertEquals(List.of("x", "y"), frame.columns());
        assertEquals(List.of(Arrays.asList(1, null), List.of(3, 2)), frame.rows());
    }

    @Test
    void reorderColumnsFillsMissingLabels() {
        Frame frame = Frame.of(List.of("r"), List.of("x", "y"), List.of(List.of(1, 2)));

        Frame reordered = frame.reorderColumns(List.of("y", "z", "x"));

        assertEquals(List.of("y", "z", "x"), reordered.columns());
        assertEquals(List.of(Arrays.asList(2, null, 1)), reordered.rows());
        assertEquals(frame.index(), reordered.index());
    }

    @Test
    void isImmutable() {
        Frame frame = Frame.of(List.of("r"), List.of("x"), List.of(List.of(1)));

        assertThrows(UnsupportedOperationException.class, () -> frame.rows().get(0).set(0, 2));
        assertTrue(Frame.empty().isEmpty());
        assertEquals(frame, Frame.of(List.of("r"), List.of("x"), List.of(List.of(1))));
    }
}

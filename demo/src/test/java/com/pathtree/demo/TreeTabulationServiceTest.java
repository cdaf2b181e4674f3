package com.pathtree.demo;

import static org.junit.jupiter.api.Assertions.*;

import com.pathtree.engine.reshape.StructuralReducer.PrunedLevel;
import com.pathtree.engine.table.Table;
import com.pathtree.engine.tree.PathTree;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class TreeTabulationServiceTest {

    private static PathTree sample() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("x", 1);
        a.put("y", 2);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("x", 3);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("a", Map.of("only", a));
        root.put("b", Map.of("only", b));
        return PathTree.fromMap(root);
    }

    @Test
    void tableFallsBackToConfiguredDefaults() {
        TreeTabulationService service = new TreeTabulationService(new PathTreeProperties(1, true, null));

        Table table = service.table(sample(), null, null);

        // transposed: column headers become row headers
        assertEquals(List.of("a"), table.colHeaders());
        assertEquals(List.of("", "x", "y"), table.rowHeaders());
    }

    @Test
    void requestValuesOverrideDefaults() {
        TreeTabulationService service = new TreeTabulationService(new PathTreeProperties(1, true, null));

        Table table = service.table(sample(), false, 0);

        assertEquals(List.of("a", "b"), table.rowHeaders());
        assertEquals(2, table.rowCount());
    }

    @Test
    void pruneHonoursIgnoredLabels() {
        TreeTabulationService keeping = new TreeTabulationService(new PathTreeProperties(0, false, Set.of("only")));
        TreeTabulationService pruning = new TreeTabulationService(new PathTreeProperties(0, false, null));

        assertTrue(keeping.prune(sample()).isEmpty());
        assertEquals(List.of(new PrunedLevel(1, "only")), pruning.prune(sample()));
    }

    @Test
    void swopLeavesInputUntouched() {
        TreeTabulationService service = new TreeTabulationService(new PathTreeProperties(0, false, null));
        PathTree tree = sample();

        PathTree swopped = service.swop(tree, 0, 1);

        assertEquals(List.of("only"), List.copyOf(swopped.root().keys()));
        assertEquals(sample(), tree);
    }
}

package com.pathtree.engine.reshape;

import static com.pathtree.engine.TestTrees.map;
import static com.pathtree.engine.TestTrees.tree;
import static org.junit.jupiter.api.Assertions.*;

import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.PathTree;
import com.pathtree.engine.tree.TreeShapeException;
import java.util.List;
import org.junit.jupiter.api.Test;

final class LevelTransposerTest {

    @Test
    void swopsFirstTwoLevels() {
        PathTree tree = new PathTree();
        for (String path : List.of("a/1/x", "a/1/y", "b/2/y", "b/2/x", "c/1/y")) {
            tree.set(List.of((Object[]) path.split("/")), path);
        }

        PathTree swopped = LevelTransposer.swop(tree, 0, 1);

        assertEquals(List.of("1", "2"), List.copyOf(swopped.root().keys()));
        assertEquals("a/1/x", swopped.get("1", "a", "x"));
        assertEquals("a/1/y", swopped.get("1", "a", "y"));
        assertEquals("c/1/y", swopped.get("1", "c", "y"));
        assertEquals("b/2/y", swopped.get("2", "b", "y"));
        assertEquals("b/2/x", swopped.get("2", "b", "x"));
        assertNull(swopped.get("2", "a"));
        assertEquals(
                List.of("y", "x"),
                List.copyOf(((Branch) swopped.get("2", "b")).keys()),
                "order below the swopped levels is kept");
    }

    @Test
    void swoppingTwiceRestoresBindings() {
        PathTree tree =
                tree(
                        "a", map("m", map("x", 1, "y", 2), "n", map("x", 3)),
                        "b", map("m", map("y", 4)));
        PathTree original = tree.deepCopy();

        PathTree back = LevelTransposer.swop(LevelTransposer.swop(tree, 0, 2), 0, 2);

        assertEquals(original, back);
        assertEquals(original, tree, "source tree must not change");
    }

    @Test
    void sharedLabelsDoNotCollide() {
        PathTree tree = tree("a", map("b", 1, "a", 2), "b", map("a", 3));

        PathTree swopped = LevelTransposer.swop(tree, 0, 1);

        assertEquals(1, swopped.get("b", "a"));
        assertEquals(2, swopped.get("a", "a"));
        assertEquals(3, swopped.get("a", "b"));
        assertEquals(List.of("b", "a"), List.copyOf(swopped.root().keys()));
        assertEquals(2, tree.get("a", "a"), "source tree must not change");
    }

    @Test
    void keepsVariableDepthBelowSecondLevel() {
        PathTree tree = tree("a", map("x", map("deep", 1), "y", 2));

        PathTree swopped = LevelTransposer.swop(tree, 1, 0);

        assertEquals(1, swopped.get("x", "a", "deep"));
        assertEquals(2, swopped.get("y", "a"));
    }

    @Test
    void equalLevelsAreANoOp() {
        PathTree tree = tree("a", map("b", 1));
        assertSame(tree, LevelTransposer.swop(tree, 1, 1));
    }

    @Test
    void rejectsLevelsOutOfRange() {
        PathTree tree = tree("a", map("b", 1));
        TreeShapeException error =
                assertThrows(TreeShapeException.class, () -> LevelTransposer.swop(tree, 0, 2));
        assertEquals(TreeShapeException.Reason.LEVEL_OUT_OF_RANGE, error.reason());
        assertThrows(TreeShapeException.class, () -> LevelTransposer.swop(tree, -1, 0));
    }
}

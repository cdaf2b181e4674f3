package com.pathtree.engine.tree;

import static com.pathtree.engine.TestTrees.map;
import static org.junit.jupiter.api.Assertions.*;

import com.pathtree.engine.tree.Node.Branch;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class PathTreeTest {

    @Test
    void setAutovivifiesAndGetNeverFails() {
        PathTree tree = new PathTree();
        tree.set(List.of("a", "b"), 5);

        assertEquals(5, tree.get("a", "b"));
        assertNull(tree.get("a", "x"), "missing key should read as null");
        assertNull(tree.get("x", "y", "z"));
        assertNull(tree.get("a", "b", "c"), "descending through a leaf should read as null");
        assertSame(tree.root(), tree.get(), "empty path should return the root");
        assertTrue(tree.get("a") instanceof Branch);
    }

    @Test
    void siblingOrderFollowsInsertion() {
        PathTree tree = new PathTree();
        tree.set(List.of("z"), 1);
        tree.set(List.of("a"), 2);
        tree.set(List.of("m"), 3);
        assertEquals(List.of("z", "a", "m"), List.copyOf(tree.root().keys()));
    }

    @Test
    void emptyPathReplacesRootContent() {
        PathTree tree = new PathTree();
        tree.set(List.of("old"), 1);
        tree.set(List.of(), map("new", 2));
        assertNull(tree.get("old"));
        assertEquals(2, tree.get("new"));
        assertThrows(IllegalArgumentException.class, () -> tree.set(List.of(), 3));
    }

    @Test
    void setThroughLeafIsRejected() {
        PathTree tree = new PathTree();
        tree.set(List.of("a"), 1);
        assertThrows(IllegalArgumentException.class, () -> tree.set(List.of("a", "b"), 2));
    }

    @Test
    void removeDeletesExistingKeyOnly() {
        PathTree tree = PathTree.fromMap(map("a", map("b", 1, "c", 2)));
        tree.remove(List.of("a", "b"));
        assertNull(tree.get("a", "b"));
        assertEquals(2, tree.get("a", "c"));

        TreeShapeException missing =
                assertThrows(TreeShapeException.class, () -> tree.remove(List.of("a", "b")));
        assertEquals(TreeShapeException.Reason.MISSING_KEY, missing.reason());
        assertThrows(TreeShapeException.class, () -> tree.remove(List.of("x", "y")));

        tree.remove(List.of());
        assertTrue(tree.isEmpty());
    }

    @Test
    void plainMapConversionKeepsStructure() {
        Map<String, Object> data = map("a", map("x", 1, "y", List.of(1, 2)), "b", "text");
        PathTree tree = PathTree.fromMap(data);
        assertEquals(data, tree.toPlainMap());
        assertEquals(List.of(1, 2), tree.get("a", "y"));
    }

    @Test
    void deepCopyIsIndependent() {
        PathTree tree = PathTree.fromMap(map("a", map("b", 1)));
        PathTree copy = tree.deepCopy();
        copy.set(List.of("a", "c"), 2);
        assertNull(tree.get("a", "c"));
        assertEquals(1, copy.get("a", "b"));
    }

    @Test
    void toStringListsLevels() {
        assertEquals("NA", new PathTree().toString());
        PathTree tree = PathTree.fromMap(map("a", map("b", 1)));
        assertEquals("< datatree: [[a], [b]] >", tree.toString());
    }
}

package com.pathtree.engine.analysis;

import static com.pathtree.engine.TestTrees.map;
import static com.pathtree.engine.TestTrees.tree;
import static org.junit.jupiter.api.Assertions.*;

import com.pathtree.engine.analysis.PathAnalyzer.PathNode;
import com.pathtree.engine.frame.Frame;
import com.pathtree.engine.tree.PathTree;
import com.pathtree.engine.tree.TreeShapeException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class PathAnalyzerTest {

    @Test
    void getPathsCollectsDistinctKeysPerLevel() {
        PathTree tree = tree("a", map("x", 1, "y", 2), "b", map("y", 3, "z", 4));
        assertEquals(List.of(List.of("a", "b"), List.of("x", "y", "z")), PathAnalyzer.getPaths(tree));
        assertEquals(List.of(), PathAnalyzer.getPaths(new PathTree()));
    }

    @Test
    void framesAreOpaque() {
        Frame frame = Frame.of(List.of("r"), List.of("c"), List.of(List.of(1)));
        PathTree tree = tree("a", map("t", frame), "b", map("t", frame));
        assertEquals(List.of(List.of("a", "b"), List.of("t")), PathAnalyzer.getPaths(tree));
    }

    @Test
    void uniformTreeHasSingleDepth() {
        PathTree tree = tree("a", map("x", 1, "y", 2), "b", map("x", 3));
        Set<Integer> depths = new HashSet<>(PathAnalyzer.getDepths(tree));
        assertEquals(Set.of(1), depths);
        assertEquals(1, PathAnalyzer.checkUniformDepth(tree));
    }

    @Test
    void mixedDepthsAreReported() {
        PathTree tree = tree("a", 1, "b", map("c", 2));
        assertEquals(Set.of(0, 1), new HashSet<>(PathAnalyzer.getDepths(tree)));
        TreeShapeException error =
                assertThrows(TreeShapeException.class, () -> PathAnalyzer.checkUniformDepth(tree));
        assertEquals(TreeShapeException.Reason.NON_UNIFORM_DEPTH, error.reason());
        assertTrue(error.getMessage().contains("min=0, max=1"), error.getMessage());
    }

    @Test
    void emptyBranchesHaveNoDepth() {
        PathTree tree = tree("a", map());
        assertTrue(PathAnalyzer.getDepths(tree).isEmpty());
        assertEquals(-1, PathAnalyzer.checkUniformDepth(tree));
    }

    @Test
    void getNodesWalksBreadthFirst() {
        PathTree tree = tree("a", map("x", 1, "y", 2), "b", map("z", 3));
        List<List<Object>> level1 =
                PathAnalyzer.getNodes(tree, 1).stream().map(PathNode::path).toList();
        assertEquals(List.of(List.of("a", "x"), List.of("a", "y"), List.of("b", "z")), level1);

        List<PathNode> level0 = PathAnalyzer.getNodes(tree, 0);
        assertEquals(List.of("a"), level0.get(0).path());
        assertSame(tree.getNode(List.of("b")), level0.get(1).node());

        assertTrue(PathAnalyzer.getNodes(tree, -1).isEmpty());
        assertTrue(PathAnalyzer.getNodes(tree, 5).isEmpty());
    }

    @Test
    void prefixesAreCartesianProducts() {
        PathTree tree = tree("a", map("x", map("k", 1)), "b", map("y", map("k", 2)));
        assertEquals(List.of(List.of()), PathAnalyzer.getPrefixes(tree, 0));
        assertEquals(
                List.of(List.of("a", "x"), List.of("a", "y"), List.of("b", "x"), List.of("b", "y")),
                PathAnalyzer.getPrefixes(tree, 2));
    }
}

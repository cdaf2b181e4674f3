package com.pathtree.engine.analysis;

import com.pathtree.engine.tree.Node;
import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.PathTree;
import com.pathtree.engine.tree.TreeShapeException;
import com.pathtree.engine.util.Products;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Structural queries over a {@link PathTree}: the keys present at each level, the depth of every
 * leaf, and the nodes found at a given level. Leaves of any kind, frames included, end descent.
 */
public final class PathAnalyzer {

    /** A node together with the full path leading to it from the root. */
    public record PathNode(List<Object> path, Node node) {
        public PathNode {
            path = List.copyOf(path);
        }
    }

    private PathAnalyzer() {}

    /**
     * Returns, for every depth, the distinct keys of all branches at that depth in first-seen
     * order. The size of the result is the nominal depth of the tree.
     */
    public static List<List<Object>> getPaths(PathTree tree) {
        List<List<Object>> labels = new ArrayList<>();
        List<Branch> thisLevel = List.of(tree.root());
        while (true) {
            LinkedHashSet<Object> keys = new LinkedHashSet<>();
            List<Branch> nextLevel = new ArrayList<>();
            for (Branch branch : thisLevel) {
                for (Map.Entry<Object, Node> entry : branch.entries()) {
                    keys.add(entry.getKey());
                    if (entry.getValue() instanceof Branch child) {
                        nextLevel.add(child);
                    }
                }
            }
            if (keys.isEmpty()) {
                break;
            }
            labels.add(Collections.unmodifiableList(new ArrayList<>(keys)));
            thisLevel = nextLevel;
        }
        return labels;
    }

    /**
     * Returns the depth of every leaf, depth-first. A leaf stored directly under the root has depth
     * 0. Empty branches contribute nothing.
     */
    public static List<Integer> getDepths(PathTree tree) {
        List<Integer> depths = new ArrayList<>();
        Deque<Map.Entry<Integer, Node>> stack = new ArrayDeque<>();
        for (Node child : tree.root().values()) {
            stack.push(Map.entry(0, child));
        }
        while (!stack.isEmpty()) {
            Map.Entry<Integer, Node> current = stack.pop();
            if (current.getValue() instanceof Branch branch) {
                for (Node child : branch.values()) {
                    stack.push(Map.entry(current.getKey() + 1, child));
                }
            } else {
                depths.add(current.getKey());
            }
        }
        return depths;
    }

    /**
     * Fails unless every leaf sits at the same depth. A tree without leaves passes.
     *
     * @return the common leaf depth, or -1 for a tree without leaves
     * @throws TreeShapeException with reason {@code NON_UNIFORM_DEPTH}
     */
    public static int checkUniformDepth(PathTree tree) {
        List<Integer> depths = getDepths(tree);
        if (depths.isEmpty()) {
            return -1;
        }
        int min = Collections.min(depths);
        int max = Collections.max(depths);
        if (min != max) {
            throw new TreeShapeException(
                    TreeShapeException.Reason.NON_UNIFORM_DEPTH,
                    "data tree not of uniform depth, min=" + min + ", max=" + max);
        }
        return min;
    }

    /**
     * Returns all nodes whose key sits at {@code level}, i.e. whose path has {@code level + 1}
     * keys, in breadth-first order.
     */
    public static List<PathNode> getNodes(PathTree tree, int level) {
        List<PathNode> nodes = new ArrayList<>();
        if (level < 0) {
            return nodes;
        }
        Deque<PathNode> queue = new ArrayDeque<>();
        queue.add(new PathNode(List.of(), tree.root()));
        while (!queue.isEmpty()) {
            PathNode current = queue.poll();
            int depth = current.path().size() - 1;
            if (depth == level) {
                nodes.add(current);
                continue;
            }
            if (current.node() instanceof Branch branch) {
                for (Map.Entry<Object, Node> entry : branch.entries()) {
                    List<Object> path = new ArrayList<>(current.path());
                    path.add(entry.getKey());
                    queue.add(new PathNode(path, entry.getValue()));
                }
            }
        }
        return nodes;
    }

    /** Returns every combination of keys of the first {@code level} levels. */
    public static List<List<Object>> getPrefixes(PathTree tree, int level) {
        List<List<Object>> paths = getPaths(tree);
        return Products.cartesian(paths.subList(0, Math.min(level, paths.size())));
    }
}

package com.pathtree.engine.reshape;

import com.pathtree.engine.analysis.PathAnalyzer;
import com.pathtree.engine.tree.Node;
import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.Node.Leaf;
import com.pathtree.engine.tree.PathTree;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes structure that carries no information: empty branches and levels holding a single key.
 */
public final class StructuralReducer {

    private static final Logger log = LoggerFactory.getLogger(StructuralReducer.class);

    /** A level removed by {@link #prune}, together with its only key. */
    public record PrunedLevel(int level, Object label) {}

    private StructuralReducer() {}

    /**
     * Removes empty leaves and the branches left empty by their removal, in place.
     *
     * @return {@code true} if the tree still has content
     */
    public static boolean removeEmptyLeaves(PathTree tree) {
        return prune(tree.root());
    }

    private static boolean prune(Branch branch) {
        List<Object> toDelete = new ArrayList<>();
        for (Map.Entry<Object, Node> entry : branch.entries()) {
            boolean keep =
                    entry.getValue() instanceof Branch child ? prune(child) : !((Leaf) entry.getValue()).isEmpty();
            if (!keep) {
                toDelete.add(entry.getKey());
            }
        }
        for (Object key : toDelete) {
            branch.remove(key);
        }
        return !branch.isEmpty();
    }

    /**
     * Removes {@code level} in place: below every prefix reaching it, the children of each key at
     * that level move up into the parent. A leaf found at that level replaces its parent.
     */
    public static void removeLevel(PathTree tree, int level) {
        for (List<Object> prefix : PathAnalyzer.getPrefixes(tree, level)) {
            if (!(tree.getNode(prefix) instanceof Branch branch)) {
                continue;
            }
            for (Object key : List.copyOf(branch.keys())) {
                Node child = branch.remove(key);
                if (child instanceof Branch grandchildren) {
                    for (Map.Entry<Object, Node> entry : grandchildren.entries()) {
                        branch.put(entry.getKey(), entry.getValue());
                    }
                } else {
                    tree.set(prefix, child);
                }
            }
        }
    }

    /**
     * Prunes the tree in place. First all empty leaves are removed, then every level holding a
     * single label is collapsed, unless the label is in {@code ignore} or some branch at that level
     * holds other keys besides it. The top level of a single-level tree is never removed.
     *
     * @return the removed levels, deepest first
     */
    public static List<PrunedLevel> prune(PathTree tree, Set<?> ignore) {
        removeEmptyLeaves(tree);

        List<List<Object>> paths = PathAnalyzer.getPaths(tree);
        int nlevels = paths.size();

        List<PrunedLevel> candidates = new ArrayList<>();
        for (int level = 0; level < nlevels; level++) {
            if (paths.get(level).size() != 1) {
                continue;
            }
            Object label = paths.get(level).get(0);
            if (ignore.contains(label)) {
                continue;
            }
            if (!hasDistinctSibling(tree, level, label)) {
                candidates.add(new PrunedLevel(level, label));
            }
        }
        Collections.reverse(candidates);

        List<PrunedLevel> pruned = new ArrayList<>();
        for (PrunedLevel candidate : candidates) {
            if (candidate.level() == 0 && nlevels == 1) {
                continue;
            }
            removeLevel(tree, candidate.level());
            pruned.add(candidate);
            nlevels--;
        }
        if (!pruned.isEmpty()) {
            log.debug("pruned levels {}", pruned);
        }
        return pruned;
    }

    public static List<PrunedLevel> prune(PathTree tree) {
        return prune(tree, Set.of());
    }

    private static boolean hasDistinctSibling(PathTree tree, int level, Object label) {
        for (List<Object> prefix : PathAnalyzer.getPrefixes(tree, level)) {
            if (!(tree.getNode(prefix) instanceof Branch leaves)) {
                continue;
            }
            if (leaves.size() > 1 || !leaves.containsKey(label)) {
                return true;
            }
        }
        return false;
    }
}

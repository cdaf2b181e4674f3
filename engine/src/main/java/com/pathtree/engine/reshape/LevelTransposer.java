package com.pathtree.engine.reshape;

import com.pathtree.engine.analysis.PathAnalyzer;
import com.pathtree.engine.tree.Node;
import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.PathTree;
import com.pathtree.engine.tree.TreeShapeException;
import com.pathtree.engine.util.Products;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges two levels of a tree.
 *
 * <p>For example, swopping levels 0 and 1 of the paths {@code a/1/x, a/1/y, b/2/y, b/2/x, c/1/y}
 * gives {@code 1/a/x, 1/a/y, 1/c/y, 2/b/y, 2/b/x}. The order of keys below the second level is
 * kept per branch.
 */
public final class LevelTransposer {

    private static final Logger log = LoggerFactory.getLogger(LevelTransposer.class);

    private LevelTransposer() {}

    /**
     * Returns a new tree in which {@code level1} and {@code level2} have changed places. The input
     * is left untouched; equal levels return the input itself.
     *
     * @throws TreeShapeException with reason {@code LEVEL_OUT_OF_RANGE} if a level is negative or
     *     not smaller than the number of levels
     */
    public static PathTree swop(PathTree tree, int level1, int level2) {
        List<List<Object>> paths = PathAnalyzer.getPaths(tree);
        int nlevels = paths.size();
        checkLevel(level1, nlevels);
        checkLevel(level2, nlevels);
        if (level1 == level2) {
            return tree;
        }
        if (level1 > level2) {
            int tmp = level1;
            level1 = level2;
            level2 = tmp;
        }

        List<List<Object>> prefixes = Products.cartesian(paths.subList(0, level1));
        List<List<Object>> infixes = Products.cartesian(paths.subList(level1 + 1, level2));

        // a key may occur on both levels, so nothing is written into the source
        PathTree swopped = new PathTree();
        int copied = 0;
        for (Object first : paths.get(level1)) {
            for (Object second : paths.get(level2)) {
                for (List<Object> prefix : prefixes) {
                    for (List<Object> infix : infixes) {
                        List<Object> oldBase = Products.join(prefix, List.of(first), infix, List.of(second));
                        Node node = tree.getNode(oldBase);
                        if (node == null) {
                            continue;
                        }
                        List<Object> newBase = Products.join(prefix, List.of(second), infix, List.of(first));
                        if (node instanceof Branch branch && !branch.isEmpty()) {
                            for (Object suffix : branch.keys()) {
                                swopped.set(
                                        Products.join(newBase, List.of(suffix)),
                                        branch.get(suffix).deepCopy());
                                copied++;
                            }
                        } else {
                            swopped.set(newBase, node.deepCopy());
                            copied++;
                        }
                    }
                }
            }
        }
        log.debug("swopped levels {} and {}: {} subtrees moved", level1, level2, copied);
        return swopped;
    }

    private static void checkLevel(int level, int nlevels) {
        if (level < 0 || level >= nlevels) {
            throw new TreeShapeException(
                    TreeShapeException.Reason.LEVEL_OUT_OF_RANGE,
                    "level out of range: " + level + " >= " + nlevels);
        }
    }
}

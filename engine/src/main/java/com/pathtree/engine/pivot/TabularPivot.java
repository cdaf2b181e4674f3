package com.pathtree.engine.pivot;

import com.pathtree.engine.analysis.PathAnalyzer;
import com.pathtree.engine.analysis.PathAnalyzer.PathNode;
import com.pathtree.engine.frame.Frame;
import com.pathtree.engine.tree.Node;
import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.Node.Leaf;
import com.pathtree.engine.tree.PathTree;
import com.pathtree.engine.tree.TreeShapeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a uniform-depth tree into a single {@link Frame} whose row index is built from the tree
 * paths.
 *
 * <p>How leaves are merged depends on their kind:
 *
 * <ul>
 *   <li>sequences: sibling sequences form the columns of one block per branch;
 *   <li>frames: the frames are stacked;
 *   <li>scalars: the innermost level becomes the columns, the levels above it the rows.
 * </ul>
 *
 * Branches in one of the {@link CompositeEncoding composite encodings} are first replaced by the
 * frame they describe. This rewrites the input tree; a tree that is a single encoded branch yields
 * that frame directly.
 */
public final class TabularPivot {

    private static final Logger log = LoggerFactory.getLogger(TabularPivot.class);

    private static final String ALL = "all";

    private TabularPivot() {}

    /**
     * Builds the frame.
     *
     * @return the frame, or {@code null} if the tree holds no data
     * @throws TreeShapeException with reason {@code NON_UNIFORM_DEPTH} if leaves sit at different
     *     depths, or {@code RAGGED_COLUMNS} if sibling sequences differ in length
     */
    public static Frame asFrame(PathTree tree) {
        if (tree.isEmpty()) {
            return null;
        }
        if (PathAnalyzer.getPaths(tree).size() == 1) {
            CompositeEncoding encoding = CompositeEncoding.detect(tree.root());
            if (encoding != null) {
                return encoding.convert(tree.root());
            }
        }
        normalize(tree);
        PathAnalyzer.checkUniformDepth(tree);

        List<List<Object>> labels = PathAnalyzer.getPaths(tree);
        int nlevels = labels.size();
        // empty branches may share the deepest level with the leaves
        List<PathNode> leaves = new ArrayList<>();
        for (PathNode node : PathAnalyzer.getNodes(tree, nlevels - 1)) {
            if (node.node() instanceof Leaf) {
                leaves.add(node);
            }
        }
        if (leaves.isEmpty()) {
            return null;
        }
        Leaf leaf = (Leaf) leaves.get(0).node();

        return switch (leaf.kind()) {
            case SEQUENCE -> fromSequences(tree, nlevels);
            case FRAME -> fromFrames(leaves);
            case SCALAR -> fromScalars(tree, labels);
        };
    }

    /**
     * Replaces every grid or overlap encoded branch two levels above the leaves by the frame it
     * describes.
     */
    static void normalize(PathTree tree) {
        int nlevels = PathAnalyzer.getPaths(tree).size();
        for (PathNode node : PathAnalyzer.getNodes(tree, nlevels - 2)) {
            if (!(node.node() instanceof Branch branch)) {
                continue;
            }
            CompositeEncoding encoding = CompositeEncoding.detect(branch);
            if (encoding != null) {
                tree.set(node.path(), Leaf.of(encoding.convert(branch)));
                log.debug("normalized {} encoded branch {}", encoding, node.path());
            }
        }
    }

    private static Frame fromSequences(PathTree tree, int nlevels) {
        List<PathNode> branches;
        if (nlevels == 1) {
            branches = List.of(new PathNode(List.of(ALL), tree.root()));
        } else {
            branches = PathAnalyzer.getNodes(tree, nlevels - 2);
        }
        List<List<Object>> keys = new ArrayList<>();
        List<Frame> frames = new ArrayList<>();
        for (PathNode node : branches) {
            if (node.node() instanceof Branch branch) {
                frames.add(sequenceBlock(node.path(), branch));
                keys.add(node.path());
            }
        }
        return Frame.concat(keys, frames);
    }

    /** Sibling sequences become columns; scalars are repeated down the whole column. */
    private static Frame sequenceBlock(List<Object> path, Branch branch) {
        int length = -1;
        for (Node child : branch.values()) {
            if (child instanceof Leaf leaf && leaf.kind() == Leaf.Kind.SEQUENCE) {
                int size = leaf.sequence().size();
                if (length >= 0 && size != length) {
                    throw new TreeShapeException(
                            TreeShapeException.Reason.RAGGED_COLUMNS,
                            "sequences below " + path + " differ in length: " + length + " != " + size);
                }
                length = size;
            }
        }
        int rows = length < 0 ? 1 : length;
        Map<Object, List<?>> columns = new LinkedHashMap<>();
        for (Map.Entry<Object, Node> entry : branch.entries()) {
            if (entry.getValue() instanceof Branch) {
                continue;
            }
            if (entry.getValue() instanceof Leaf leaf && leaf.kind() == Leaf.Kind.SEQUENCE) {
                columns.put(entry.getKey(), leaf.sequence());
            } else {
                columns.put(entry.getKey(), Collections.nCopies(rows, entry.getValue().toPlain()));
            }
        }
        return Frame.fromColumns(columns);
    }

    private static Frame fromFrames(List<PathNode> leaves) {
        List<List<Object>> keys = new ArrayList<>();
        List<Frame> frames = new ArrayList<>();
        for (PathNode node : leaves) {
            keys.add(node.path());
            frames.add(((Leaf) node.node()).frame());
        }
        return Frame.concat(keys, frames);
    }

    private static Frame fromScalars(PathTree tree, List<List<Object>> labels) {
        int nlevels = labels.size();
        if (nlevels == 1) {
            List<Object> index = new ArrayList<>();
            List<List<Object>> values = new ArrayList<>();
            for (Map.Entry<Object, Node> entry : tree.root().entries()) {
                if (entry.getValue() instanceof Branch) {
                    continue;
                }
                index.add(entry.getKey());
                values.add(Collections.singletonList(entry.getValue().toPlain()));
            }
            return Frame.of(index, List.of(0), values);
        }
        if (nlevels == 2) {
            return transposeBlock(tree.root()).reorderColumns(labels.get(nlevels - 1));
        }
        List<List<Object>> keys = new ArrayList<>();
        List<Frame> frames = new ArrayList<>();
        for (PathNode node : PathAnalyzer.getNodes(tree, nlevels - 3)) {
            if (node.node() instanceof Branch branch) {
                keys.add(node.path());
                frames.add(transposeBlock(branch));
            }
        }
        return Frame.concat(keys, frames);
    }

    private static boolean hasLeaf(Branch branch) {
        for (Node child : branch.values()) {
            if (child instanceof Leaf) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lays out a branch of branches with its keys as rows and the keys one level down as columns.
     */
    private static Frame transposeBlock(Branch branch) {
        LinkedHashSet<Object> columns = new LinkedHashSet<>();
        for (Node child : branch.values()) {
            if (child instanceof Branch inner) {
                for (Map.Entry<Object, Node> entry : inner.entries()) {
                    if (entry.getValue() instanceof Leaf) {
                        columns.add(entry.getKey());
                    }
                }
            }
        }
        List<Object> index = new ArrayList<>();
        List<List<Object>> values = new ArrayList<>();
        for (Map.Entry<Object, Node> entry : branch.entries()) {
            if (!(entry.getValue() instanceof Branch inner) || !hasLeaf(inner)) {
                continue;
            }
            index.add(entry.getKey());
            List<Object> row = new ArrayList<>(columns.size());
            for (Object column : columns) {
                row.add(inner.get(column) instanceof Leaf cell ? cell.toPlain() : null);
            }
            values.add(row);
        }
        return Frame.of(index, new ArrayList<>(columns), values);
    }
}

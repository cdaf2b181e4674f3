package com.pathtree.engine.tree;

import com.pathtree.engine.analysis.PathAnalyzer;
import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.Node.Leaf;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered nested container addressed by paths, i.e. sequences of keys. The path
 * {@code ("data1", "slice1", "distance")} addresses {@code root["data1"]["slice1"]["distance"]}.
 *
 * <p>Reads never fail: a missing key, or a path that runs through a leaf, yields {@code null}.
 * Writes create missing intermediate branches. Instances are mutable and meant for use by a single
 * thread.
 */
public final class PathTree {

    private Branch root;

    public PathTree() {
        this(new Branch());
    }

    public PathTree(Branch root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    /** Builds a tree from nested maps, see {@link Node#wrap}. */
    public static PathTree fromMap(Map<?, ?> data) {
        return new PathTree((Branch) Node.wrap(Objects.requireNonNull(data, "data")));
    }

    public Branch root() {
        return root;
    }

    /** Returns the node at {@code path}, the root for an empty path, or {@code null}. */
    public Node getNode(List<?> path) {
        Node work = root;
        for (Object key : path) {
            if (!(work instanceof Branch branch)) {
                return null;
            }
            work = branch.get(key);
            if (work == null) {
                return null;
            }
        }
        return work;
    }

    /**
     * Returns the payload of the leaf at {@code path}, the branch at {@code path}, or {@code null}
     * when nothing is there.
     */
    public Object get(List<?> path) {
        Node node = getNode(path);
        if (node instanceof Leaf leaf) {
            return leaf.payload();
        }
        return node;
    }

    public Object get(Object... path) {
        return get(List.of(path));
    }

    /**
     * Stores {@code value} at {@code path}, wrapping plain data with {@link Node#wrap}. An empty
     * path replaces the whole tree content, which then must be a branch.
     */
    public void set(List<?> path, Object value) {
        Node node = Node.wrap(value);
        if (path.isEmpty()) {
            if (!(node instanceof Branch branch)) {
                throw new IllegalArgumentException("the root of a tree must be a branch, got " + node);
            }
            root = branch;
            return;
        }
        Branch work = root;
        for (Object key : path.subList(0, path.size() - 1)) {
            Node child = work.get(key);
            if (child == null) {
                Branch created = new Branch();
                work.put(key, created);
                work = created;
            } else if (child instanceof Branch branch) {
                work = branch;
            } else {
                throw new IllegalArgumentException(
                        "cannot set " + Paths.toDisplayString(path) + ": " + key + " holds a leaf");
            }
        }
        work.put(path.get(path.size() - 1), node);
    }

    /**
     * Removes the node at {@code path}. An empty path clears the tree.
     *
     * @throws TreeShapeException with reason {@code MISSING_KEY} if nothing is stored there
     */
    public Node remove(List<?> path) {
        if (path.isEmpty()) {
            root.clear();
            return root;
        }
        Node parent = getNode(path.subList(0, path.size() - 1));
        Object key = path.get(path.size() - 1);
        if (!(parent instanceof Branch branch) || !branch.containsKey(key)) {
            throw new TreeShapeException(
                    TreeShapeException.Reason.MISSING_KEY, "no such path: " + Paths.toDisplayString(path));
        }
        return branch.remove(key);
    }

    /** Distinct keys per level, see {@link PathAnalyzer#getPaths}. */
    public List<List<Object>> paths() {
        return PathAnalyzer.getPaths(this);
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    public int size() {
        return root.size();
    }

    public PathTree deepCopy() {
        return new PathTree(root.deepCopy());
    }

    public Map<Object, Object> toPlainMap() {
        return root.toPlain();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof PathTree tree && root.equals(tree.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        List<List<Object>> paths = paths();
        if (paths.isEmpty()) {
            return "NA";
        }
        return "< datatree: " + paths + " >";
    }
}

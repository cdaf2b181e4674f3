package com.pathtree.engine.pivot;

import com.pathtree.engine.frame.Frame;
import com.pathtree.engine.tree.Node;
import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.Node.Leaf;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Branch shapes that stand for a single table and are turned into a {@link Frame}.
 *
 * <ul>
 *   <li>{@link #GRID}: the keys {@code rows}, {@code columns} and {@code matrix} describe a dense
 *       table.
 *   <li>{@link #OVERLAP}: keys naming every non-empty subset of a two or three element universe
 *       ({@code 01, 10, 11} or {@code 001 ... 111}) hold set overlap counts.
 * </ul>
 */
public enum CompositeEncoding {
    GRID {
        @Override
        boolean matches(Set<Object> keys) {
            return keys.containsAll(GRID_KEYS);
        }

        @Override
        Frame toFrame(Branch branch) {
            return Frame.of(
                    sequence(branch.get("rows")),
                    sequence(branch.get("columns")),
                    gridRows(branch.get("matrix")));
        }
    },
    OVERLAP {
        @Override
        boolean matches(Set<Object> keys) {
            return keys.containsAll(OVERLAP2_KEYS) || keys.containsAll(OVERLAP3_KEYS);
        }

        @Override
        Frame toFrame(Branch branch) {
            List<Map.Entry<Object, Node>> entries = new ArrayList<>();
            branch.entries().forEach(entries::add);
            entries.sort(Comparator.comparing(entry -> String.valueOf(entry.getKey())));

            List<Object> index = new ArrayList<>();
            for (Map.Entry<Object, Node> entry : entries) {
                index.add(entry.getKey());
            }
            // one column per field of nested records, per position of sequences, else column 0
            LinkedHashSet<Object> fields = new LinkedHashSet<>();
            for (Map.Entry<Object, Node> entry : entries) {
                fields.addAll(fieldsOf(entry.getValue()));
            }
            List<List<Object>> values = new ArrayList<>();
            for (Map.Entry<Object, Node> entry : entries) {
                List<Object> row = new ArrayList<>(fields.size());
                for (Object field : fields) {
                    row.add(fieldValue(entry.getValue(), field));
                }
                values.add(row);
            }
            return Frame.of(index, new ArrayList<>(fields), values);
        }
    };

    private static final Set<Object> GRID_KEYS = Set.of("rows", "columns", "matrix");
    private static final Set<Object> OVERLAP2_KEYS = Set.of("01", "10", "11");
    private static final Set<Object> OVERLAP3_KEYS =
            Set.of("001", "010", "011", "100", "101", "110", "111");

    abstract boolean matches(Set<Object> keys);

    abstract Frame toFrame(Branch branch);

    /** Returns the encoding {@code branch} matches, or {@code null} if it is an ordinary branch. */
    public static CompositeEncoding detect(Branch branch) {
        Set<Object> keys = branch.keys();
        for (CompositeEncoding encoding : values()) {
            if (encoding.matches(keys)) {
                return encoding;
            }
        }
        return null;
    }

    /** Converts a branch of this encoding into a frame. */
    public Frame convert(Branch branch) {
        return toFrame(branch);
    }

    private static List<Object> fieldsOf(Node node) {
        if (node instanceof Branch branch) {
            return new ArrayList<>(branch.keys());
        }
        if (node instanceof Leaf leaf && leaf.kind() == Leaf.Kind.SEQUENCE) {
            List<Object> positions = new ArrayList<>();
            for (int i = 0; i < leaf.sequence().size(); i++) {
                positions.add(i);
            }
            return positions;
        }
        return List.of(0);
    }

    private static Object fieldValue(Node node, Object field) {
        if (node instanceof Branch branch) {
            Node cell = branch.get(field);
            return cell == null ? null : cell.toPlain();
        }
        if (node instanceof Leaf leaf && leaf.kind() == Leaf.Kind.SEQUENCE) {
            List<Object> sequence = leaf.sequence();
            return field instanceof Integer position && position < sequence.size()
                    ? sequence.get(position)
                    : null;
        }
        return field.equals(0) ? node.toPlain() : null;
    }

    private static List<Object> sequence(Node node) {
        if (node instanceof Leaf leaf && leaf.kind() == Leaf.Kind.SEQUENCE) {
            return leaf.sequence();
        }
        throw new IllegalArgumentException("expected a sequence, got " + node);
    }

    private static List<List<Object>> gridRows(Node node) {
        List<List<Object>> rows = new ArrayList<>();
        for (Object row : sequence(node)) {
            if (!(row instanceof List<?> cells)) {
                throw new IllegalArgumentException("matrix row is not a sequence: " + row);
            }
            rows.add(new ArrayList<>(cells));
        }
        return rows;
    }
}

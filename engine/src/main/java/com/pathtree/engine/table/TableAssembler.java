package com.pathtree.engine.table;

import com.pathtree.engine.analysis.PathAnalyzer;
import com.pathtree.engine.tree.Node;
import com.pathtree.engine.tree.Node.Branch;
import com.pathtree.engine.tree.Node.Leaf;
import com.pathtree.engine.tree.PathTree;
import com.pathtree.engine.tree.Paths;
import com.pathtree.engine.tree.TreeShapeException;
import com.pathtree.engine.util.Products;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays a tree out as a table. Keys of the first level become rows, keys of the last level become
 * columns, and every combination of the levels in between becomes a sub-row of its main row.
 *
 * <p>A sub-row spans several table rows when each of its cells holds a sequence; all sequences
 * must then have the same length. Composite keys (lists) on the row levels are spread over extra
 * leading columns.
 */
public final class TableAssembler {

    private static final Logger log = LoggerFactory.getLogger(TableAssembler.class);

    private TableAssembler() {}

    public static Table tree2table(PathTree tree) {
        return tree2table(tree, false, 0);
    }

    /**
     * Builds the table.
     *
     * @param transpose swap rows and columns of the finished table
     * @param head if positive, keep only this many rows
     * @throws TreeShapeException with reason {@code INSUFFICIENT_LEVELS} for trees with fewer than
     *     two levels, or {@code RAGGED_MULTI_ROW} for sequences of unequal length within a sub-row
     */
    public static Table tree2table(PathTree tree, boolean transpose, int head) {
        List<List<Object>> labels = PathAnalyzer.getPaths(tree);
        if (labels.size() < 2) {
            throw new TreeShapeException(
                    TreeShapeException.Reason.INSUFFICIENT_LEVELS,
                    "expected at least two levels for building table, got " + labels.size() + ": " + labels);
        }

        List<Object> columns = labels.get(labels.size() - 1);
        // one leading column per key part above the last level, less the one held by the row header
        int leading = -1;
        for (List<Object> level : labels.subList(0, labels.size() - 1)) {
            leading += Paths.compositeWidth(level.get(0));
        }
        int ncols = leading + columns.size();

        List<String> colHeaders = new ArrayList<>(ncols);
        for (int i = 0; i < leading; i++) {
            colHeaders.add("");
        }
        for (Object column : columns) {
            colHeaders.add(displayKey(column));
        }
        log.debug("creating table with {} columns", ncols);

        List<List<Object>> subRows = Products.cartesian(labels.subList(1, labels.size() - 1));
        List<List<String>> matrix = new ArrayList<>();
        List<String> rowHeaders = new ArrayList<>();

        rows:
        for (Object row : labels.get(0)) {
            boolean first = true;
            for (List<Object> path : subRows) {
                Node node = tree.getNode(Products.join(List.of(row), path));
                if (!(node instanceof Branch work) || work.isEmpty()) {
                    continue;
                }

                String[] rowData = blankRow(ncols);
                if (first) {
                    rowHeaders.add(rowHeader(row, rowData, leading));
                    first = false;
                } else {
                    rowHeaders.add("");
                }
                int offset = Math.max(0, Paths.compositeWidth(row) - 1);
                for (Object key : path) {
                    if (key instanceof List<?> parts) {
                        for (Object part : parts) {
                            offset = fill(rowData, offset, leading, part);
                        }
                    } else {
                        offset = fill(rowData, offset, leading, key);
                    }
                }

                int stacked = stackedRows(work, columns);
                if (stacked >= 0) {
                    for (int z = 0; z < stacked; z++) {
                        for (int y = 0; y < columns.size(); y++) {
                            Node cell = work.get(columns.get(y));
                            if (cell != null) {
                                rowData[leading + y] = displayCell(((Leaf) cell).sequence().get(z));
                            }
                        }
                        if (z < stacked - 1) {
                            matrix.add(Arrays.asList(rowData));
                            rowHeaders.add("");
                            rowData = blankRow(ncols);
                        }
                    }
                } else {
                    for (int y = 0; y < columns.size(); y++) {
                        Node cell = work.get(columns.get(y));
                        if (cell != null) {
                            rowData[leading + y] = displayCell(cell);
                        }
                    }
                }
                matrix.add(Arrays.asList(rowData));

                if (head > 0 && matrix.size() >= head) {
                    break rows;
                }
            }
        }

        if (head > 0 && matrix.size() > head) {
            matrix = new ArrayList<>(matrix.subList(0, head));
            rowHeaders = new ArrayList<>(rowHeaders.subList(0, head));
        }

        if (transpose) {
            List<String> swap = rowHeaders;
            rowHeaders = colHeaders;
            colHeaders = swap;
            matrix = transpose(matrix, ncols);
        }
        return new Table(matrix, rowHeaders, colHeaders);
    }

    /**
     * Returns the common length of the sequences in {@code work}, or -1 if some present column
     * holds anything but a sequence.
     */
    private static int stackedRows(Branch work, List<Object> columns) {
        int rows = -1;
        for (Object column : columns) {
            Node cell = work.get(column);
            if (cell == null) {
                continue;
            }
            if (!(cell instanceof Leaf leaf) || leaf.kind() != Leaf.Kind.SEQUENCE) {
                return -1;
            }
            int length = leaf.sequence().size();
            if (rows < 0) {
                rows = length;
            } else if (rows != length) {
                throw new TreeShapeException(
                        TreeShapeException.Reason.RAGGED_MULTI_ROW,
                        "multi-level rows - unequal lengths: " + rows + " != " + length);
            }
        }
        return rows;
    }

    /** Header of a main row; the extra parts of a composite key go to the leading columns. */
    private static String rowHeader(Object row, String[] rowData, int leading) {
        if (!(row instanceof List<?> parts) || parts.isEmpty()) {
            return displayKey(row);
        }
        int offset = 0;
        for (Object part : parts.subList(1, parts.size())) {
            offset = fill(rowData, offset, leading, part);
        }
        return displayKey(parts.get(0));
    }

    private static int fill(String[] rowData, int offset, int limit, Object part) {
        if (offset < limit) {
            rowData[offset] = displayKey(part);
        }
        return offset + 1;
    }

    private static String[] blankRow(int ncols) {
        String[] row = new String[ncols];
        Arrays.fill(row, "");
        return row;
    }

    private static List<List<String>> transpose(List<List<String>> matrix, int ncols) {
        List<List<String>> transposed = new ArrayList<>(ncols);
        if (matrix.isEmpty()) {
            return transposed;
        }
        for (int col = 0; col < ncols; col++) {
            List<String> line = new ArrayList<>(matrix.size());
            for (List<String> row : matrix) {
                line.add(row.get(col));
            }
            transposed.add(line);
        }
        return transposed;
    }

    /**
     * Header text of a key. A {@code null} key renders as the empty string, like an empty cell.
     */
    static String displayKey(Object key) {
        if (key == null) {
            return "";
        }
        return Paths.toDisplayString(key);
    }

    static String displayCell(Object value) {
        if (value instanceof Leaf leaf) {
            value = leaf.payload();
        }
        return value == null ? "" : String.valueOf(value);
    }
}

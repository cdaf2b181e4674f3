package com.pathtree.engine.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table with a hierarchical row index and labelled columns.
 *
 * <p>Every row key is a list of parts; a plain table uses single-part keys, a table built by
 * {@link #concat} prefixes each block's keys with the block key. Cells may be {@code null}.
 */
public final class Frame {
    private static final Frame EMPTY = new Frame(List.of(), List.of(), List.of());

    private final List<List<Object>> index;
    private final List<Object> columns;
    private final List<List<Object>> rows;

    private Frame(List<List<Object>> index, List<Object> columns, List<List<Object>> rows) {
        this.index = index;
        this.columns = columns;
        this.rows = rows;
    }

    public static Frame empty() {
        return EMPTY;
    }

    /**
     * Builds a frame from single-part row labels, column labels and a row-major grid. Grid rows
     * shorter than the column list are padded with {@code null}.
     */
    public static Frame of(List<?> rowLabels, List<?> columnLabels, List<? extends List<?>> values) {
        Objects.requireNonNull(rowLabels, "rowLabels");
        Objects.requireNonNull(columnLabels, "columnLabels");
        Objects.requireNonNull(values, "values");
        if (rowLabels.size() != values.size()) {
            throw new IllegalArgumentException(
                    "index has " + rowLabels.size() + " labels but grid has " + values.size() + " rows");
        }
        List<List<Object>> index = new ArrayList<>(rowLabels.size());
        for (Object label : rowLabels) {
            index.add(freeze(Collections.singletonList(label)));
        }
        return create(index, new ArrayList<>(columnLabels), values);
    }

    /**
     * Builds a frame from named columns of equal length, indexed {@code 0..n-1}.
     */
    public static Frame fromColumns(Map<?, ? extends List<?>> columnData) {
        Objects.requireNonNull(columnData, "columnData");
        int length = -1;
        for (Map.Entry<?, ? extends List<?>> entry : columnData.entrySet()) {
            int size = entry.getValue().size();
            if (length >= 0 && size != length) {
                throw new IllegalArgumentException(
                        "column " + entry.getKey() + " has length " + size + ", expected " + length);
            }
            length = size;
        }
        length = Math.max(length, 0);
        List<Object> columns = new ArrayList<>(columnData.keySet());
        List<List<Object>> grid = new ArrayList<>(length);
        List<Object> labels = new ArrayList<>(length);
        for (int row = 0; row < length; row++) {
            List<Object> cells = new ArrayList<>(columns.size());
            for (List<?> column : columnData.values()) {
                cells.add(column.get(row));
            }
            grid.add(cells);
            labels.add(row);
        }
        return of(labels, columns, grid);
    }

    /**
     * Stacks frames vertically, prefixing the row keys of each frame with the parts of its block
     * key. Columns are the union of all block columns in first-seen order; cells a block lacks are
     * {@code null}.
     */
    public static Frame concat(List<? extends List<?>> keys, List<Frame> frames) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(frames, "frames");
        if (keys.size() != frames.size()) {
            throw new IllegalArgumentException(
                    "got " + keys.size() + " block keys for " + frames.size() + " frames");
        }
        Map<Object, Integer> position = new LinkedHashMap<>();
        for (Frame frame : frames) {
            for (Object column : frame.columns) {
                position.putIfAbsent(column, position.size());
            }
        }
        List<List<Object>> index = new ArrayList<>();
        List<List<Object>> grid = new ArrayList<>();
        for (int block = 0; block < frames.size(); block++) {
            Frame frame = frames.get(block);
            List<?> key = keys.get(block);
            for (int row = 0; row < frame.rowCount(); row++) {
                List<Object> rowKey = new ArrayList<>(key);
                rowKey.addAll(frame.index.get(row));
                index.add(rowKey);
                List<Object> cells = new ArrayList<>(Collections.nCopies(position.size(), null));
                for (int col = 0; col < frame.columns.size(); col++) {
                    cells.set(position.get(frame.columns.get(col)), frame.rows.get(row).get(col));
                }
                grid.add(cells);
            }
        }
        return create(index, new ArrayList<>(position.keySet()), grid);
    }

    private static Frame create(
            List<List<Object>> index, List<Object> columns, List<? extends List<?>> values) {
        List<List<Object>> frozenIndex = new ArrayList<>(index.size());
        for (List<Object> key : index) {
            frozenIndex.add(freeze(key));
        }
        List<List<Object>> frozenRows = new ArrayList<>(values.size());
        for (List<?> row : values) {
            if (row.size() > columns.size()) {
                throw new IllegalArgumentException(
                        "row has " + row.size() + " cells but there are " + columns.size() + " columns");
            }
            List<Object> cells = new ArrayList<>(row);
            while (cells.size() < columns.size()) {
                cells.add(null);
            }
            frozenRows.add(freeze(cells));
        }
        return new Frame(
                Collections.unmodifiableList(frozenIndex),
                freeze(columns),
                Collections.unmodifiableList(frozenRows));
    }

    private static List<Object> freeze(List<?> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<List<Object>> index() {
        return index;
    }

    public List<Object> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Object get(int row, int column) {
        return rows.get(row).get(column);
    }

    /** Returns the cells of the column labelled {@code label}, or {@code null} if there is none. */
    public List<Object> column(Object label) {
        int col = columns.indexOf(label);
        if (col < 0) {
            return null;
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(col));
        }
        return Collections.unmodifiableList(values);
    }

    /** Selects and reorders columns; labels the frame lacks become all-{@code null} columns. */
    public Frame reorderColumns(List<?> labels) {
        List<List<Object>> grid = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> cells = new ArrayList<>(labels.size());
            for (Object label : labels) {
                int col = columns.indexOf(label);
                cells.add(col < 0 ? null : row.get(col));
            }
            grid.add(cells);
        }
        return create(index, new ArrayList<>(labels), grid);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Frame frame)) {
            return false;
        }
        return index.equals(frame.index) && columns.equals(frame.columns) && rows.equals(frame.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, columns, rows);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("index\t").append(columns).append('\n');
        for (int row = 0; row < rows.size(); row++) {
            sb.append(index.get(row)).append('\t').append(rows.get(row)).append('\n');
        }
        return sb.toString();
    }
}

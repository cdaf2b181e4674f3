package com.pathtree.engine.table;

import java.util.List;

/**
 * A rectangular table of display strings with its row and column headers.
 */
public record Table(List<List<String>> matrix, List<String> rowHeaders, List<String> colHeaders) {

    public Table {
        matrix = matrix.stream().map(List::copyOf).toList();
        rowHeaders = List.copyOf(rowHeaders);
        colHeaders = List.copyOf(colHeaders);
    }

    public int rowCount() {
        return matrix.size();
    }
}

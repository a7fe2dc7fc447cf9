package com.example.routereport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Row {
    private final List<Cell> cells;

    public Row(List<Cell> cells) {
        if (cells == null) {
            throw new IllegalArgumentException("Row cells must not be null");
        }
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    /**
     * Builds a row from raw values, coercing each with {@link Cell#of(Object)}.
     */
    public static Row of(Object... values) {
        List<Cell> cells = new ArrayList<>(values.length);
        for (Object v : values) {
            cells.add(Cell.of(v));
        }
        return new Row(cells);
    }

    public Cell getCell(int column) {
        return cells.get(column);
    }

    public int size() {
        return cells.size();
    }
}

package com.example.routereport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the layout engine needs to draw one table. The engine borrows a
 * spec for the duration of a render and never mutates it.
 */
public final class TableSpec {
    private final String title;
    private final List<String> headers;
    private final List<Row> rows;
    private final List<Float> columnWidths;
    private final TableStyle style;

    private TableSpec(Builder b) {
        this.title = b.title;
        this.headers = Collections.unmodifiableList(new ArrayList<>(b.headers));
        this.rows = Collections.unmodifiableList(new ArrayList<>(b.rows));
        this.columnWidths = Collections.unmodifiableList(new ArrayList<>(b.columnWidths));
        this.style = b.style;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTitle() {
        return title;
    }

    public boolean hasTitle() {
        return title != null && !title.trim().isEmpty();
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<Float> getColumnWidths() {
        return columnWidths;
    }

    public TableStyle getStyle() {
        return style;
    }

    public int getColumnCount() {
        return headers.size();
    }

    public float getTableWidth() {
        float sum = 0;
        for (Float w : columnWidths) {
            sum += w;
        }
        return sum;
    }

    /**
     * Same table with different column widths, e.g. scaled to fit a page.
     */
    public TableSpec withColumnWidths(List<Float> widths) {
        return builder()
                .title(title)
                .headers(headers)
                .rows(rows)
                .columnWidths(widths)
                .style(style)
                .build();
    }

    /**
     * Header labels as a row of text cells, so the header goes through the
     * same height calculation as body rows.
     */
    public Row getHeaderRow() {
        List<Cell> cells = new ArrayList<>(headers.size());
        for (String h : headers) {
            cells.add(Cell.text(h));
        }
        return new Row(cells);
    }

    public static final class Builder {
        private String title;
        private final List<String> headers = new ArrayList<>();
        private final List<Row> rows = new ArrayList<>();
        private final List<Float> columnWidths = new ArrayList<>();
        private TableStyle style = TableStyle.defaults();

        private Builder() {}

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder headers(List<String> headers) {
            this.headers.clear();
            this.headers.addAll(headers);
            return this;
        }

        public Builder headers(String... headers) {
            return headers(List.of(headers));
        }

        public Builder columnWidths(List<Float> widths) {
            this.columnWidths.clear();
            this.columnWidths.addAll(widths);
            return this;
        }

        public Builder columnWidths(float... widths) {
            this.columnWidths.clear();
            for (float w : widths) {
                this.columnWidths.add(w);
            }
            return this;
        }

        public Builder row(Row row) {
            this.rows.add(row);
            return this;
        }

        public Builder row(Object... values) {
            return row(Row.of(values));
        }

        public Builder rows(List<Row> rows) {
            this.rows.addAll(rows);
            return this;
        }

        public Builder style(TableStyle style) {
            this.style = style;
            return this;
        }

        public TableSpec build() {
            if (headers.isEmpty()) {
                throw new IllegalArgumentException("Table needs at least one header");
            }
            if (columnWidths.size() != headers.size()) {
                throw new IllegalArgumentException(String.format(
                        "Column widths (%d) must match header count (%d)", columnWidths.size(), headers.size()));
            }
            for (int i = 0; i < columnWidths.size(); i++) {
                Float w = columnWidths.get(i);
                if (w == null || w <= 0) {
                    throw new IllegalArgumentException("Column width " + i + " must be positive, got " + w);
                }
            }
            for (int i = 0; i < rows.size(); i++) {
                Row r = rows.get(i);
                if (r == null || r.size() != headers.size()) {
                    throw new IllegalArgumentException(String.format(
                            "Row %d has %d cells, expected %d", i, r == null ? 0 : r.size(), headers.size()));
                }
            }
            if (style == null) {
                style = TableStyle.defaults();
            }
            return new TableSpec(this);
        }
    }
}

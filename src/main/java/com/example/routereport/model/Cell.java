package com.example.routereport.model;

import java.util.Objects;

/**
 * One table entry. Immutable once built.
 * Numeric cells are center-aligned; link cells carry the target URL.
 */
public final class Cell {
    private final CellType type;
    private final String text;
    private final String url;

    private Cell(CellType type, String text, String url) {
        this.type = type;
        this.text = text == null ? "" : text;
        this.url = url;
    }

    public static Cell text(String text) {
        return new Cell(CellType.TEXT, text, null);
    }

    public static Cell numeric(String text) {
        return new Cell(CellType.NUMERIC, text, null);
    }

    public static Cell link(String displayText, String url) {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("Link cell requires a url");
        }
        return new Cell(CellType.LINK, displayText, url.trim());
    }

    /**
     * Coerces an arbitrary value into a cell: numbers become numeric cells,
     * null becomes an empty text cell, anything else its string form.
     */
    public static Cell of(Object value) {
        if (value instanceof Cell) {
            return (Cell) value;
        }
        if (value == null) {
            return text("");
        }
        if (value instanceof Number) {
            return numeric(String.valueOf(value));
        }
        return text(String.valueOf(value));
    }

    public CellType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getUrl() {
        return url;
    }

    public boolean isLink() {
        return type == CellType.LINK;
    }

    public boolean isNumeric() {
        return type == CellType.NUMERIC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Cell)) return false;
        Cell cell = (Cell) o;
        return type == cell.type && text.equals(cell.text) && Objects.equals(url, cell.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, url);
    }

    @Override
    public String toString() {
        return type == CellType.LINK ? "Link(" + text + ", " + url + ")" : type + "(" + text + ")";
    }
}

package com.example.routereport.model;

import java.util.Collections;
import java.util.List;

/**
 * Wrapped lines of every cell in a row and the resulting row height.
 * Lives only while that row is being drawn.
 */
public class RowLayout {
    private final List<List<String>> wrappedLines;
    private final float height;
    private final int maxLineCount;

    public RowLayout(List<List<String>> wrappedLines, float height, int maxLineCount) {
        this.wrappedLines = Collections.unmodifiableList(wrappedLines);
        this.height = height;
        this.maxLineCount = maxLineCount;
    }

    public List<String> getLines(int column) {
        return wrappedLines.get(column);
    }

    public float getHeight() {
        return height;
    }

    public int getMaxLineCount() {
        return maxLineCount;
    }
}

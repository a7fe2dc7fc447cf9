package com.example.routereport.layout;

import com.example.routereport.model.Row;
import com.example.routereport.model.RowLayout;
import com.example.routereport.surface.TableFont;
import com.example.routereport.util.WordWrapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes how tall a row must be to hold its tallest wrapped cell.
 * Must run per row: widths are table-wide but content is not.
 */
public class RowHeightCalculator {

    private final WordWrapper wrapper;

    public RowHeightCalculator(WordWrapper wrapper) {
        this.wrapper = wrapper;
    }

    /**
     * Wraps every cell of {@code row} and returns the lines together with the
     * row height {@code max(minRowHeight, maxLineCount * lineSpacing + padding)}.
     *
     * @param textPaddingX horizontal padding on each side of a cell; text is
     *                     wrapped at {@code columnWidth - 2 * textPaddingX}
     */
    public RowLayout layout(Row row, List<Float> columnWidths, TableFont font, float size,
                            float lineSpacing, float padding, float textPaddingX, float minRowHeight) {
        List<List<String>> wrapped = new ArrayList<>(row.size());
        int maxLineCount = 1;

        for (int col = 0; col < row.size(); col++) {
            float textWidth = textWidth(columnWidths.get(col), textPaddingX);
            List<String> lines = wrapper.wrap(row.getCell(col).getText(), font, size, textWidth);
            wrapped.add(lines);
            maxLineCount = Math.max(maxLineCount, lines.size());
        }

        float height = Math.max(minRowHeight, maxLineCount * lineSpacing + padding);
        return new RowLayout(wrapped, height, maxLineCount);
    }

    public float height(Row row, List<Float> columnWidths, TableFont font, float size,
                        float lineSpacing, float padding, float textPaddingX, float minRowHeight) {
        return layout(row, columnWidths, font, size, lineSpacing, padding, textPaddingX, minRowHeight).getHeight();
    }

    static float textWidth(float columnWidth, float textPaddingX) {
        return Math.max(1f, columnWidth - 2 * textPaddingX);
    }
}

package com.example.routereport.layout;

import com.example.routereport.model.Cell;
import com.example.routereport.model.Cursor;
import com.example.routereport.model.LinkRegion;
import com.example.routereport.model.PageGeometry;
import com.example.routereport.model.PlacedText;
import com.example.routereport.model.RenderSession;
import com.example.routereport.model.RenderState;
import com.example.routereport.model.Row;
import com.example.routereport.model.RowLayout;
import com.example.routereport.model.TableRenderResult;
import com.example.routereport.model.TableSpec;
import com.example.routereport.model.TableStyle;
import com.example.routereport.surface.DrawingSurface;
import com.example.routereport.surface.FontMetricsProvider;
import com.example.routereport.surface.TableFont;
import com.example.routereport.util.WordWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Draws a {@link TableSpec} onto a {@link DrawingSurface}: title bar, header
 * row and body rows, flowing onto new pages as needed and repeating the header
 * on every continuation page.
 * <p>
 * One engine can serve many renders, including concurrent ones on separate
 * surfaces; all per-render state lives in a {@link RenderSession}.
 */
public class TableLayoutEngine {

    private static final Logger logger = LoggerFactory.getLogger(TableLayoutEngine.class);

    private final FontMetricsProvider metrics;
    private final PageGeometry geometry;
    private final WordWrapper wrapper;
    private final RowHeightCalculator rowHeights;
    private final HyperlinkRegionMapper linkMapper;

    public TableLayoutEngine(FontMetricsProvider metrics, PageGeometry geometry, boolean continueOnLinkError) {
        this.metrics = metrics;
        this.geometry = geometry;
        this.wrapper = new WordWrapper(metrics);
        this.rowHeights = new RowHeightCalculator(wrapper);
        this.linkMapper = new HyperlinkRegionMapper(continueOnLinkError);
    }

    public WordWrapper getWrapper() {
        return wrapper;
    }

    public PageGeometry getGeometry() {
        return geometry;
    }

    /**
     * Renders the table with its top-left corner at ({@code startX}, {@code startY})
     * and returns the Y just below the last row, on whatever page that is.
     */
    public float renderTable(DrawingSurface surface, TableSpec spec, float startX, float startY) throws IOException {
        return render(surface, spec, startX, startY).getFinalY();
    }

    public TableRenderResult render(DrawingSurface surface, TableSpec spec, float startX, float startY) throws IOException {
        RenderState state = new RenderState();
        Cursor cursor = new Cursor(surface.getPageNumber(), startY);
        RenderSession session = new RenderSession(surface, cursor, state, startX);
        PaginationController pagination = new PaginationController(session, geometry);

        TableStyle style = spec.getStyle();
        List<Row> rows = spec.getRows();
        RowLayout headerLayout = layoutHeader(spec);

        pagination.begin();
        int firstPage = cursor.getPageNumber();
        boolean continuation = false;
        RowLayout pending = rows.isEmpty() ? null : layoutBody(spec, rows.get(0));

        while (true) {
            boolean drawTitle = spec.hasTitle() && (!continuation || style.isRepeatTitle());
            List<String> titleLines = drawTitle ? titleLines(spec, continuation) : Collections.emptyList();
            float titleHeight = drawTitle ? titleHeight(style, titleLines) : 0f;

            if (!continuation) {
                float firstRowHeight = pending == null ? 0f : pending.getHeight();
                if (pagination.needsFreshPageBeforeHeader(titleHeight + headerLayout.getHeight() + firstRowHeight)) {
                    pagination.moveTableToNewPage();
                }
                firstPage = cursor.getPageNumber();
            }

            if (drawTitle) {
                drawTitleBar(session, spec, titleLines, titleHeight);
            }
            drawHeaderRow(session, spec, headerLayout);
            pagination.headerEmitted();

            boolean brokePage = false;
            while (state.getNextRowIndex() < rows.size()) {
                int index = state.getNextRowIndex();
                if (pending == null) {
                    pending = layoutBody(spec, rows.get(index));
                }
                if (pagination.shouldBreakBefore(pending.getHeight())) {
                    pagination.breakPage(style, true);
                    brokePage = true;
                    break;
                }
                drawBodyRow(session, spec, rows.get(index), pending, index);
                state.rowRendered();
                pending = null;
            }

            if (!brokePage) {
                break;
            }
            continuation = true;
        }
        pagination.finish();

        logger.debug("Rendered table '{}': {} rows, pages {}-{}, {} header emissions, {} links",
                spec.getTitle(), state.getRowsRenderedSoFar(), firstPage, cursor.getPageNumber(),
                state.getHeaderEmissions(), state.getLinksRegistered());

        return new TableRenderResult(cursor.getY(), firstPage, cursor.getPageNumber(),
                state.getRowsRenderedSoFar(), state.getHeaderEmissions(), state.getLinksRegistered());
    }

    /**
     * Height the table needs before its first body row is complete: title bar,
     * header row and first row. A table starting with less room than this
     * moves to the next page.
     */
    public float leadingHeight(TableSpec spec) {
        float height = layoutHeader(spec).getHeight();
        if (spec.hasTitle()) {
            height += titleHeight(spec.getStyle(), titleLines(spec, false));
        }
        if (!spec.getRows().isEmpty()) {
            height += layoutBody(spec, spec.getRows().get(0)).getHeight();
        }
        return height;
    }

    /* ======================= Row layout ======================= */

    private List<String> titleLines(TableSpec spec, boolean continuation) {
        TableStyle style = spec.getStyle();
        String title = continuation ? spec.getTitle() + " (continued)" : spec.getTitle();
        return wrapper.wrap(title, TableFont.BOLD, style.getTitleFontSize(),
                RowHeightCalculator.textWidth(spec.getTableWidth(), style.getTextPaddingX()));
    }

    private static float titleHeight(TableStyle style, List<String> lines) {
        return Math.max(style.getTitleBarHeight(), lines.size() * titleLineSpacing(style) + style.getCellPadding());
    }

    private static float titleLineSpacing(TableStyle style) {
        return style.getTitleFontSize() * style.getLineSpacingFactor();
    }

    private RowLayout layoutHeader(TableSpec spec) {
        TableStyle style = spec.getStyle();
        return rowHeights.layout(spec.getHeaderRow(), spec.getColumnWidths(), TableFont.BOLD,
                style.getHeaderFontSize(), style.getHeaderLineSpacing(), style.getCellPadding(),
                style.getTextPaddingX(), style.getMinHeaderHeight());
    }

    private RowLayout layoutBody(TableSpec spec, Row row) {
        TableStyle style = spec.getStyle();
        return rowHeights.layout(row, spec.getColumnWidths(), TableFont.REGULAR,
                style.getFontSize(), style.getBodyLineSpacing(), style.getCellPadding(),
                style.getTextPaddingX(), style.getMinRowHeight());
    }

    /* ======================= Drawing ======================= */

    private void drawTitleBar(RenderSession session, TableSpec spec, List<String> lines, float height) throws IOException {
        TableStyle style = spec.getStyle();
        DrawingSurface surface = session.getSurface();
        Cursor cursor = session.getCursor();
        float top = cursor.getY();

        surface.setFillColor(style.getTitleBackground());
        surface.drawRect(session.getStartX(), top - height, spec.getTableWidth(), height, true, false);

        drawCellLines(session, lines, session.getStartX(), spec.getTableWidth(), top, height, TableFont.BOLD,
                style.getTitleFontSize(), titleLineSpacing(style), style.getTextPaddingX(), false, style.getTitleColor());

        cursor.moveDown(height);
    }

    private void drawHeaderRow(RenderSession session, TableSpec spec, RowLayout layout) throws IOException {
        TableStyle style = spec.getStyle();
        DrawingSurface surface = session.getSurface();
        Cursor cursor = session.getCursor();
        float top = cursor.getY();
        float height = layout.getHeight();

        surface.setFillColor(style.getHeaderBackground());
        surface.drawRect(session.getStartX(), top - height, spec.getTableWidth(), height, true, false);
        drawCellBorders(session, spec, top, height);

        float x = session.getStartX();
        for (int col = 0; col < spec.getColumnCount(); col++) {
            float width = spec.getColumnWidths().get(col);
            drawCellLines(session, layout.getLines(col), x, width, top, height, TableFont.BOLD,
                    style.getHeaderFontSize(), style.getHeaderLineSpacing(), style.getTextPaddingX(),
                    true, style.getHeaderTextColor());
            x += width;
        }
        cursor.moveDown(height);
    }

    private void drawBodyRow(RenderSession session, TableSpec spec, Row row, RowLayout layout, int rowIndex) throws IOException {
        TableStyle style = spec.getStyle();
        DrawingSurface surface = session.getSurface();
        Cursor cursor = session.getCursor();
        float top = cursor.getY();
        float height = layout.getHeight();

        Color background = rowIndex % 2 == 1 ? style.getAlternateRowBackground() : style.getRowBackground();
        surface.setFillColor(background);
        surface.drawRect(session.getStartX(), top - height, spec.getTableWidth(), height, true, false);
        drawCellBorders(session, spec, top, height);

        float x = session.getStartX();
        for (int col = 0; col < row.size(); col++) {
            Cell cell = row.getCell(col);
            float width = spec.getColumnWidths().get(col);
            Color color = cell.isLink() ? style.getLinkColor() : style.getTextColor();

            List<PlacedText> placed = drawCellLines(session, layout.getLines(col), x, width, top, height,
                    TableFont.REGULAR, style.getFontSize(), style.getBodyLineSpacing(), style.getTextPaddingX(),
                    cell.isNumeric(), color);

            if (cell.isLink()) {
                LinkRegion region = linkMapper.hotZone(cell.getUrl(), placed,
                        metrics.ascent(TableFont.REGULAR, style.getFontSize()),
                        metrics.descent(TableFont.REGULAR, style.getFontSize()));
                if (region != null) {
                    linkMapper.register(session, region);
                }
            }
            x += width;
        }
        cursor.moveDown(height);
    }

    private void drawCellBorders(RenderSession session, TableSpec spec, float top, float height) throws IOException {
        DrawingSurface surface = session.getSurface();
        surface.setStrokeColor(spec.getStyle().getBorderColor());
        float x = session.getStartX();
        for (Float width : spec.getColumnWidths()) {
            surface.drawRect(x, top - height, width, height, false, true);
            x += width;
        }
    }

    /**
     * Draws wrapped lines vertically centered in the cell; the block starts
     * {@code (rowHeight - lineCount * lineSpacing) / 2} below the row top.
     */
    private List<PlacedText> drawCellLines(RenderSession session, List<String> lines, float cellX, float cellWidth,
                                           float rowTop, float rowHeight, TableFont font, float size,
                                           float lineSpacing, float paddingX, boolean centered, Color color) throws IOException {
        DrawingSurface surface = session.getSurface();
        surface.setFillColor(color);

        float topOffset = (rowHeight - lines.size() * lineSpacing) / 2f;
        List<PlacedText> placed = new ArrayList<>(lines.size());

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            float lineTop = rowTop - topOffset - i * lineSpacing;
            float baseline = centeredBaseline(lineTop, lineSpacing, font, size);
            float lineWidth = measure(line, font, size);
            float x = centered ? cellX + (cellWidth - lineWidth) / 2f : cellX + paddingX;

            surface.drawText(x, baseline, line, font, size);
            placed.add(new PlacedText(line, x, baseline, lineWidth));
        }
        return placed;
    }

    private float centeredBaseline(float boxTop, float boxHeight, TableFont font, float size) {
        float ascent = metrics.ascent(font, size);
        float descent = metrics.descent(font, size);
        return boxTop - (boxHeight - (ascent - descent)) / 2f - ascent;
    }

    private float measure(String text, TableFont font, float size) {
        try {
            return metrics.measure(text, font, size);
        } catch (IOException | RuntimeException e) {
            logger.debug("Estimating width of '{}': {}", text, e.getMessage());
            return WordWrapper.estimateWidth(text, size);
        }
    }
}

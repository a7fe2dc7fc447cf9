package com.example.routereport.service;

import com.example.routereport.layout.TableLayoutEngine;
import com.example.routereport.model.OutlineEntry;
import com.example.routereport.model.PageGeometry;
import com.example.routereport.model.ReportLayout;
import com.example.routereport.model.ReportRequest;
import com.example.routereport.model.ReportSection;
import com.example.routereport.model.TableRenderResult;
import com.example.routereport.model.TableSpec;
import com.example.routereport.surface.TableFont;
import com.example.routereport.surface.impl.PdfBoxDrawingSurface;
import com.example.routereport.surface.impl.PdfBoxFontMetrics;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes a route report: title block, then each section's heading,
 * free-text paragraphs and table, flowing across as many pages as needed.
 */
@Service
public class ReportDocumentService {

    private static final Logger logger = LoggerFactory.getLogger(ReportDocumentService.class);

    private static final float TITLE_FONT_SIZE = 16f;
    private static final float SUBTITLE_FONT_SIZE = 10f;
    private static final float HEADING_FONT_SIZE = 12f;
    private static final float HEADING_LINE_HEIGHT = HEADING_FONT_SIZE * 1.2f;
    // rule under the heading plus the gap before the section body
    private static final float HEADING_RULE_SPACING = 12f;
    private static final float PARAGRAPH_FONT_SIZE = 9f;
    private static final float PARAGRAPH_LINE_FACTOR = 1.35f;
    private static final float SECTION_SPACING = 14f;
    // heading is moved to the next page unless this much room remains below it
    private static final float MIN_SPACE_BELOW_HEADING = 45f;
    private static final Color HEADING_COLOR = new Color(31, 78, 121);

    @Value("${report.page.size:A4}")
    private String pageSize = "A4";

    @Value("${report.page.margin-top:50}")
    private float marginTop = 50f;

    @Value("${report.page.margin-bottom:50}")
    private float marginBottom = 50f;

    @Value("${report.page.margin-left:40}")
    private float marginLeft = 40f;

    @Value("${report.page.margin-right:40}")
    private float marginRight = 40f;

    @Value("${report.render.continue-on-error:true}")
    private boolean continueOnError = true;

    private final ReportOutlineWriterService outlineWriter;

    // stateless, shared by every document this process renders
    private final PdfBoxFontMetrics fontMetrics = new PdfBoxFontMetrics();

    public ReportDocumentService(ReportOutlineWriterService outlineWriter) {
        this.outlineWriter = outlineWriter;
    }

    /* ======================= Public API ======================= */

    public byte[] renderReport(ReportRequest request) throws IOException {
        ReportLayout layout = compose(request);
        return outlineWriter.addOutline(layout.getPdfBytes(), layout.getOutline());
    }

    /**
     * Runs the full composition and reports where everything landed, without
     * the outline pass.
     */
    public ReportLayout previewLayout(ReportRequest request) throws IOException {
        ReportLayout layout = compose(request);
        return new ReportLayout(null, layout.getTotalPages(), layout.getOutline());
    }

    public float getContentWidth() {
        return resolvePageSize().getWidth() - marginLeft - marginRight;
    }

    /* ======================= Composition ======================= */

    private ReportLayout compose(ReportRequest request) throws IOException {
        long startTime = System.currentTimeMillis();
        PDRectangle size = resolvePageSize();
        PageGeometry geometry = new PageGeometry(size.getHeight() - marginTop, marginBottom);
        TableLayoutEngine engine = new TableLayoutEngine(fontMetrics, geometry, continueOnError);
        float contentWidth = getContentWidth();

        List<OutlineEntry> outline = new ArrayList<>();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int totalPages;

        try (PDDocument document = new PDDocument()) {
            try (PdfBoxDrawingSurface surface = new PdfBoxDrawingSurface(document, size, fontMetrics)) {
                float y = drawTitleBlock(surface, engine, request, geometry.getTopY(), contentWidth);

                for (ReportSection section : request.getSections()) {
                    y = drawSection(surface, engine, section, y, contentWidth, outline);
                }
                totalPages = surface.getPageNumber();
            }
            document.save(out);
        }

        logger.info("Composed report '{}': {} sections, {} pages in {} ms", request.getTitle(),
                request.getSections().size(), totalPages, System.currentTimeMillis() - startTime);
        return new ReportLayout(out.toByteArray(), totalPages, outline);
    }

    private float drawTitleBlock(PdfBoxDrawingSurface surface, TableLayoutEngine engine, ReportRequest request,
                                 float y, float contentWidth) throws IOException {
        surface.setFillColor(HEADING_COLOR);
        for (String line : engine.getWrapper().wrap(request.getTitle(), TableFont.BOLD, TITLE_FONT_SIZE, contentWidth)) {
            y -= TITLE_FONT_SIZE * 1.2f;
            surface.drawText(marginLeft, y, line, TableFont.BOLD, TITLE_FONT_SIZE);
        }
        if (request.getSubtitle() != null && !request.getSubtitle().trim().isEmpty()) {
            surface.setFillColor(Color.DARK_GRAY);
            y -= 4f;
            y = drawParagraph(surface, engine, request.getSubtitle(), TableFont.ITALIC, SUBTITLE_FONT_SIZE, y, contentWidth);
        }
        surface.setFillColor(HEADING_COLOR);
        y -= 6f;
        surface.drawRect(marginLeft, y, contentWidth, 1.5f, true, false);
        return y - SECTION_SPACING;
    }

    private float drawSection(PdfBoxDrawingSurface surface, TableLayoutEngine engine, ReportSection section,
                              float y, float contentWidth, List<OutlineEntry> outline) throws IOException {
        PageGeometry geometry = engine.getGeometry();
        TableSpec table = section.hasTable() ? fitToWidth(section.getTable(), contentWidth) : null;

        if (section.getHeading() != null && !section.getHeading().trim().isEmpty()) {
            List<String> lines = engine.getWrapper().wrap(section.getHeading(), TableFont.BOLD, HEADING_FONT_SIZE, contentWidth);
            float headingHeight = lines.size() * HEADING_LINE_HEIGHT + HEADING_RULE_SPACING;
            // a heading directly above a table stays with the table's title, header and first row
            float below = MIN_SPACE_BELOW_HEADING;
            if (table != null && section.getParagraphs().isEmpty()) {
                below = Math.max(below, engine.leadingHeight(table));
            }
            if (y - headingHeight - below < geometry.getBottomMargin() && y < geometry.getTopY()) {
                surface.startNewPage();
                y = geometry.getTopY();
            }
            outline.add(new OutlineEntry(section.getHeading(), surface.getPageNumber(), 1));

            surface.setFillColor(HEADING_COLOR);
            for (String line : lines) {
                y -= HEADING_LINE_HEIGHT;
                surface.drawText(marginLeft, y, line, TableFont.BOLD, HEADING_FONT_SIZE);
            }
            y -= 4f;
            surface.drawRect(marginLeft, y, contentWidth, 0.75f, true, false);
            y -= HEADING_RULE_SPACING - 4f;
        }

        for (String paragraph : section.getParagraphs()) {
            surface.setFillColor(Color.BLACK);
            y = drawParagraph(surface, engine, paragraph, TableFont.REGULAR, PARAGRAPH_FONT_SIZE, y, contentWidth);
            y -= PARAGRAPH_FONT_SIZE * 0.5f;
        }

        if (table != null) {
            TableRenderResult result = engine.render(surface, table, marginLeft, y);
            if (table.hasTitle()) {
                outline.add(new OutlineEntry(table.getTitle(), result.getFirstPage(), 2));
            }
            logger.debug("Table '{}' rendered {} rows over {} page(s)", table.getTitle(),
                    result.getRowsRendered(), result.getPageCount());
            y = result.getFinalY();
        }
        return y - SECTION_SPACING;
    }

    /**
     * Draws wrapped free text line by line, starting a new page whenever the
     * next line would cross the bottom margin. The fill color is left to the caller.
     */
    private float drawParagraph(PdfBoxDrawingSurface surface, TableLayoutEngine engine, String text, TableFont font,
                                float size, float y, float contentWidth) throws IOException {
        PageGeometry geometry = engine.getGeometry();
        float lineHeight = size * PARAGRAPH_LINE_FACTOR;

        for (String line : engine.getWrapper().wrapParagraph(text, font, size, contentWidth)) {
            if (y - lineHeight < geometry.getBottomMargin()) {
                Color color = surface.getFillColor();
                surface.startNewPage();
                surface.setFillColor(color);
                y = geometry.getTopY();
            }
            y -= lineHeight;
            surface.drawText(marginLeft, y + (lineHeight - size), line, font, size);
        }
        return y;
    }

    /**
     * Scales column widths down proportionally when a table is wider than the
     * printable area.
     */
    TableSpec fitToWidth(TableSpec table, float contentWidth) {
        float tableWidth = table.getTableWidth();
        if (tableWidth <= contentWidth) {
            return table;
        }
        float scale = contentWidth / tableWidth;
        List<Float> scaled = new ArrayList<>();
        for (Float w : table.getColumnWidths()) {
            scaled.add(w * scale);
        }
        logger.debug("Scaling table '{}' from {} to {} points wide", table.getTitle(), tableWidth, contentWidth);
        return table.withColumnWidths(scaled);
    }

    private PDRectangle resolvePageSize() {
        if ("LETTER".equalsIgnoreCase(pageSize)) {
            return PDRectangle.LETTER;
        }
        if ("A3".equalsIgnoreCase(pageSize)) {
            return PDRectangle.A3;
        }
        return PDRectangle.A4;
    }
}

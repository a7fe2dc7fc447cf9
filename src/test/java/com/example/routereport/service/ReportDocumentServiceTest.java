package com.example.routereport.service;

import com.example.routereport.model.Cell;
import com.example.routereport.model.OutlineEntry;
import com.example.routereport.model.ReportLayout;
import com.example.routereport.model.ReportRequest;
import com.example.routereport.model.ReportSection;
import com.example.routereport.model.TableSpec;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Report document composition")
class ReportDocumentServiceTest {

    private static final int ROW_COUNT = 120;

    private ReportDocumentService service;

    @BeforeEach
    void setUp() {
        service = new ReportDocumentService(new ReportOutlineWriterService());
    }

    @Test
    @DisplayName("A long table flows over several pages with headers, notes and links")
    void rendersMultiPageReport() throws IOException {
        byte[] pdf = service.renderReport(sampleRequest());

        try (PDDocument document = PDDocument.load(pdf)) {
            int pages = document.getNumberOfPages();
            assertTrue(pages >= 3, "expected at least 3 pages, got " + pages);

            int pagesWithNote = 0;
            for (int p = 1; p <= pages; p++) {
                String text = pageText(document, p);
                assertTrue(text.contains("Risk score"), "header missing on page " + p);
                if (text.contains("Continued on next page...")) {
                    pagesWithNote++;
                }
            }
            assertEquals(pages - 1, pagesWithNote);
            assertTrue(pageText(document, pages).contains("Segment " + ROW_COUNT));

            int links = 0;
            for (int p = 0; p < pages; p++) {
                for (PDAnnotation annotation : document.getPage(p).getAnnotations()) {
                    PDAnnotationLink link = assertInstanceOf(PDAnnotationLink.class, annotation);
                    PDActionURI action = assertInstanceOf(PDActionURI.class, link.getAction());
                    assertTrue(action.getURI().startsWith("https://maps.example/segment/"));
                    links++;
                }
            }
            assertEquals(ROW_COUNT, links);
        }
    }

    @Test
    @DisplayName("Section headings and table titles become a nested outline")
    void addsOutline() throws IOException {
        byte[] pdf = service.renderReport(sampleRequest());

        try (PDDocument document = PDDocument.load(pdf)) {
            PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
            assertNotNull(outline);

            PDOutlineItem segments = outline.getFirstChild();
            assertEquals("Segments", segments.getTitle());
            assertEquals("Segment risk", segments.getFirstChild().getTitle());
            assertNull(segments.getFirstChild().getNextSibling());

            PDOutlineItem notes = segments.getNextSibling();
            assertEquals("Notes", notes.getTitle());
            assertNull(notes.getFirstChild());
            assertNull(notes.getNextSibling());
        }
    }

    @Test
    @DisplayName("Layout preview reports pages and outline without document bytes")
    void previewsLayout() throws IOException {
        ReportRequest request = sampleRequest();
        ReportLayout layout = service.previewLayout(request);

        assertNull(layout.getPdfBytes());
        try (PDDocument document = PDDocument.load(service.renderReport(request))) {
            assertEquals(document.getNumberOfPages(), layout.getTotalPages());
        }

        List<OutlineEntry> outline = layout.getOutline();
        assertEquals(3, outline.size());
        assertEquals("Segments", outline.get(0).getTitle());
        assertEquals(1, outline.get(0).getPage());
        assertEquals(1, outline.get(0).getLevel());
        assertEquals("Segment risk", outline.get(1).getTitle());
        assertEquals(1, outline.get(1).getPage());
        assertEquals(2, outline.get(1).getLevel());
        assertEquals("Notes", outline.get(2).getTitle());
        assertEquals(layout.getTotalPages(), outline.get(2).getPage());
    }

    @Test
    @DisplayName("Characters outside the standard fonts are replaced rather than failing")
    void replacesUnencodableCharacters() throws IOException {
        TableSpec table = TableSpec.builder()
                .headers("Check", "Note")
                .columnWidths(100, 200)
                .row("✓", "Ünïcödé is fine, → is not")
                .build();
        ReportRequest request = new ReportRequest("Symbols ✓", null,
                Collections.singletonList(new ReportSection("Checks ✓", Collections.singletonList("Done ✓"), table)));

        try (PDDocument document = PDDocument.load(service.renderReport(request))) {
            String text = pageText(document, 1);
            assertTrue(text.contains("Symbols ?"), text);
            assertTrue(text.contains("Ünïcödé is fine, ? is not"), text);
        }
    }

    @Test
    @DisplayName("Tables wider than the printable area are scaled to fit")
    void scalesWideTables() {
        TableSpec wide = TableSpec.builder()
                .headers("A", "B")
                .columnWidths(400, 200)
                .row("x", "y")
                .build();

        float contentWidth = service.getContentWidth();
        TableSpec fitted = service.fitToWidth(wide, contentWidth);

        assertEquals(contentWidth, fitted.getTableWidth(), 0.01f);
        assertEquals(2f, fitted.getColumnWidths().get(0) / fitted.getColumnWidths().get(1), 0.001f);
        assertEquals(wide.getRows(), fitted.getRows());

        TableSpec narrow = TableSpec.builder().headers("A").columnWidths(100).build();
        assertSame(narrow, service.fitToWidth(narrow, contentWidth));
    }

    @Test
    @DisplayName("The configured page size is used for every page")
    void honoursPageSize() throws IOException {
        ReflectionTestUtils.setField(service, "pageSize", "LETTER");
        assertEquals(PDRectangle.LETTER.getWidth() - 80f, service.getContentWidth(), 0.01f);

        try (PDDocument document = PDDocument.load(service.renderReport(sampleRequest()))) {
            for (int p = 0; p < document.getNumberOfPages(); p++) {
                assertEquals(PDRectangle.LETTER.getWidth(), document.getPage(p).getMediaBox().getWidth(), 0.01f);
                assertEquals(PDRectangle.LETTER.getHeight(), document.getPage(p).getMediaBox().getHeight(), 0.01f);
            }
        }
    }

    @Test
    @DisplayName("A heading directly above a table moves to the next page with it")
    void headingStaysWithTable() throws IOException {
        StringBuilder filler = new StringBuilder("Line 1");
        for (int i = 2; i <= 42; i++) {
            filler.append('\n').append("Line ").append(i);
        }
        StringBuilder tallCell = new StringBuilder("segment");
        for (int i = 2; i <= 12; i++) {
            tallCell.append(" segment");
        }
        // the first row wraps to one word per line, so it is far taller than the usual heading reserve
        TableSpec detail = TableSpec.builder()
                .title("Detail table")
                .headers("Hazard", "Notes")
                .columnWidths(60, 200)
                .row(tallCell.toString(), "stretch with reduced visibility")
                .build();
        ReportRequest request = new ReportRequest("Route detail report", null, Arrays.asList(
                new ReportSection("Intro", Collections.singletonList(filler.toString()), null),
                new ReportSection("Route detail", Collections.emptyList(), detail)));

        List<OutlineEntry> outline = service.previewLayout(request).getOutline();

        assertEquals("Intro", outline.get(0).getTitle());
        assertEquals(1, outline.get(0).getPage());
        assertEquals("Route detail", outline.get(1).getTitle());
        assertEquals("Detail table", outline.get(2).getTitle());
        assertEquals(2, outline.get(1).getPage());
        assertEquals(outline.get(1).getPage(), outline.get(2).getPage());
    }

    @Test
    @DisplayName("Long section headings wrap within the printable width")
    void wrapsLongHeadings() throws IOException {
        String heading = "Accident prone areas, blind spots and sharp turns along the northern highway corridor"
                + " between the fuel depot and the coastal terminal";
        ReportRequest request = new ReportRequest("Corridor review", null, Collections.singletonList(
                new ReportSection(heading, Collections.singletonList("Details follow."), null)));

        byte[] pdf = service.renderReport(request);

        try (PDDocument document = PDDocument.load(pdf)) {
            String text = pageText(document, 1);
            assertFalse(text.contains(heading), "heading was drawn on a single line");
            assertTrue(text.replaceAll("\\s+", " ").contains(heading));
            assertEquals(heading, document.getDocumentCatalog().getDocumentOutline().getFirstChild().getTitle());
        }
    }

    private static ReportRequest sampleRequest() {
        TableSpec.Builder table = TableSpec.builder()
                .title("Segment risk")
                .headers("Segment", "Risk score", "Map")
                .columnWidths(255, 100, 160);
        for (int i = 1; i <= ROW_COUNT; i++) {
            table.row("Segment " + i, i % 10, Cell.link("map", "https://maps.example/segment/" + i));
        }

        ReportSection segments = new ReportSection("Segments",
                Arrays.asList("Risk scores per road segment.", "Scores run from 0 to 9."), table.build());
        ReportSection notes = new ReportSection("Notes",
                Collections.singletonList("Reviewed by the routing team."), null);
        return new ReportRequest("Route 7 risk review", "Quarterly summary", Arrays.asList(segments, notes));
    }

    private static String pageText(PDDocument document, int page) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        return stripper.getText(document);
    }
}

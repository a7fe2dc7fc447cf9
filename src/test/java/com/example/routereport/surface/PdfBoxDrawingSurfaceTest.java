package com.example.routereport.surface;

import com.example.routereport.surface.impl.PdfBoxDrawingSurface;
import com.example.routereport.surface.impl.PdfBoxFontMetrics;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PDFBox drawing surface")
class PdfBoxDrawingSurfaceTest {

    private final PdfBoxFontMetrics metrics = new PdfBoxFontMetrics();

    @Test
    @DisplayName("Helvetica metrics are proportional to size")
    void measuresText() throws Exception {
        float at10 = metrics.measure("Route 66", TableFont.REGULAR, 10f);
        float at20 = metrics.measure("Route 66", TableFont.REGULAR, 20f);
        assertTrue(at10 > 0);
        assertEquals(at10 * 2, at20, 0.001f);
        assertTrue(metrics.measure("Route 66", TableFont.BOLD, 10f) >= at10);
        assertEquals(0f, metrics.measure("", TableFont.REGULAR, 10f));
        assertTrue(metrics.ascent(TableFont.REGULAR, 10f) > 0);
        assertTrue(metrics.descent(TableFont.REGULAR, 10f) < 0);
    }

    @Test
    @DisplayName("Text is measured in the form it is drawn")
    void measuresPrintableForm() throws Exception {
        assertEquals("? ok", metrics.printable("✓ ok", TableFont.REGULAR));
        assertEquals("a b c", metrics.printable("a\tb\nc", TableFont.REGULAR));
        assertEquals("Ünïcödé", metrics.printable("Ünïcödé", TableFont.BOLD));
        assertEquals(metrics.measure("? ok", TableFont.REGULAR, 10f),
                metrics.measure("✓ ok", TableFont.REGULAR, 10f), 0.0001f);
    }

    @Test
    @DisplayName("Pages, text and link annotations end up in the document")
    void drawsPagesTextAndLinks() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PDDocument document = new PDDocument()) {
            try (PdfBoxDrawingSurface surface = new PdfBoxDrawingSurface(document, PDRectangle.A4, metrics)) {
                assertEquals(1, surface.getPageNumber());
                surface.setFillColor(Color.LIGHT_GRAY);
                surface.setStrokeColor(Color.GRAY);
                surface.drawRect(40, 700, 200, 20, true, true);
                surface.setFillColor(Color.BLACK);
                surface.drawText(44, 706, "First page", TableFont.REGULAR, 10f);

                surface.startNewPage();
                assertEquals(2, surface.getPageNumber());
                surface.drawText(44, 706, "Checkmark ✓ and\ttab", TableFont.BOLD, 10f);
                surface.registerLink("https://maps.example/x", 44, 704, 60, 10);
            }
            document.save(out);
        }

        try (PDDocument reloaded = PDDocument.load(out.toByteArray())) {
            assertEquals(2, reloaded.getNumberOfPages());

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(2);
            stripper.setEndPage(2);
            String text = stripper.getText(reloaded);
            assertTrue(text.contains("Checkmark ? and tab"), text);

            assertTrue(reloaded.getPage(0).getAnnotations().isEmpty());
            List<PDAnnotation> annotations = reloaded.getPage(1).getAnnotations();
            assertEquals(1, annotations.size());
            PDAnnotationLink link = assertInstanceOf(PDAnnotationLink.class, annotations.get(0));
            PDActionURI action = assertInstanceOf(PDActionURI.class, link.getAction());
            assertEquals("https://maps.example/x", action.getURI());
            assertEquals(60f, link.getRectangle().getWidth(), 0.01f);
        }
    }
}

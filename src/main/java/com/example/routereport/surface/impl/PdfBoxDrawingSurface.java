package com.example.routereport.surface.impl;

import com.example.routereport.surface.DrawingSurface;
import com.example.routereport.surface.TableFont;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDBorderStyleDictionary;

import java.awt.Color;
import java.io.Closeable;
import java.io.IOException;

/**
 * {@link DrawingSurface} backed by a PDFBox document. The first page is
 * opened on construction; every {@link #startNewPage()} closes the current
 * content stream and appends a fresh page of the same size.
 */
public class PdfBoxDrawingSurface implements DrawingSurface, Closeable {

    private final PDDocument document;
    private final PDRectangle pageSize;
    private final PdfBoxFontMetrics metrics;

    private PDPage currentPage;
    private PDPageContentStream currentContent;
    private int pageNumber;
    private Color fillColor = Color.BLACK;
    private Color strokeColor = Color.BLACK;

    public PdfBoxDrawingSurface(PDDocument document, PDRectangle pageSize, PdfBoxFontMetrics metrics) throws IOException {
        this.document = document;
        this.pageSize = pageSize;
        this.metrics = metrics;
        startNewPage();
    }

    public Color getFillColor() {
        return fillColor;
    }

    @Override
    public void setFillColor(Color color) throws IOException {
        fillColor = color;
        currentContent.setNonStrokingColor(color);
    }

    @Override
    public void setStrokeColor(Color color) throws IOException {
        strokeColor = color;
        currentContent.setStrokingColor(color);
    }

    @Override
    public void drawRect(float x, float y, float width, float height, boolean fill, boolean stroke) throws IOException {
        if (!fill && !stroke) return;
        currentContent.addRect(x, y, width, height);
        if (fill && stroke) {
            currentContent.fillAndStroke();
        } else if (fill) {
            currentContent.fill();
        } else {
            currentContent.stroke();
        }
    }

    @Override
    public void drawText(float x, float y, String text, TableFont font, float size) throws IOException {
        if (text == null || text.isEmpty()) return;
        PDFont pdFont = metrics.pdFont(font);
        String safe = metrics.printable(text, font);

        currentContent.beginText();
        try {
            currentContent.setFont(pdFont, size);
            currentContent.newLineAtOffset(x, y);
            currentContent.showText(safe);
        } finally {
            currentContent.endText();
        }
    }

    @Override
    public float measureText(String text, TableFont font, float size) throws IOException {
        return metrics.measure(text, font, size);
    }

    @Override
    public void startNewPage() throws IOException {
        closeCurrentContent();
        currentPage = new PDPage(pageSize);
        document.addPage(currentPage);
        currentContent = new PDPageContentStream(document, currentPage);
        pageNumber++;

        // a new content stream starts with the default graphics state
        currentContent.setNonStrokingColor(fillColor);
        currentContent.setStrokingColor(strokeColor);
        currentContent.setLineWidth(0.5f);
    }

    @Override
    public void registerLink(String url, float x, float y, float width, float height) throws IOException {
        PDAnnotationLink link = new PDAnnotationLink();
        link.setRectangle(new PDRectangle(x, y, width, height));

        PDBorderStyleDictionary borderStyle = new PDBorderStyleDictionary();
        borderStyle.setWidth(0);
        link.setBorderStyle(borderStyle);

        PDActionURI action = new PDActionURI();
        action.setURI(url);
        link.setAction(action);

        currentPage.getAnnotations().add(link);
    }

    @Override
    public int getPageNumber() {
        return pageNumber;
    }

    @Override
    public void close() throws IOException {
        closeCurrentContent();
    }

    private void closeCurrentContent() throws IOException {
        if (currentContent != null) {
            currentContent.close();
            currentContent = null;
        }
    }
}

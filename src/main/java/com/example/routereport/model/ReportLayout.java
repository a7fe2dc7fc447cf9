package com.example.routereport.model;

import java.util.List;

/**
 * Outcome of composing a report: where each section landed and how many pages
 * the document has. The PDF bytes are only present for full renders.
 */
public class ReportLayout {
    private final byte[] pdfBytes;
    private final int totalPages;
    private final List<OutlineEntry> outline;

    public ReportLayout(byte[] pdfBytes, int totalPages, List<OutlineEntry> outline) {
        this.pdfBytes = pdfBytes;
        this.totalPages = totalPages;
        this.outline = outline;
    }

    public byte[] getPdfBytes() {
        return pdfBytes;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public List<OutlineEntry> getOutline() {
        return outline;
    }
}

package com.example.routereport.surface.impl;

import com.example.routereport.surface.FontMetricsProvider;
import com.example.routereport.surface.TableFont;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.IOException;

/**
 * Metrics for the standard Helvetica family. Stateless; one instance can be
 * shared by every document the process renders.
 */
public class PdfBoxFontMetrics implements FontMetricsProvider {

    public PDFont pdFont(TableFont font) {
        switch (font) {
            case BOLD:
                return PDType1Font.HELVETICA_BOLD;
            case ITALIC:
                return PDType1Font.HELVETICA_OBLIQUE;
            default:
                return PDType1Font.HELVETICA;
        }
    }

    /**
     * Measures the text exactly as {@link PdfBoxDrawingSurface} shows it, with
     * unencodable glyphs already replaced.
     */
    @Override
    public float measure(String text, TableFont font, float size) throws IOException {
        if (text == null || text.isEmpty()) {
            return 0f;
        }
        return pdFont(font).getStringWidth(printable(text, font)) / 1000f * size;
    }

    /**
     * The string that is actually drawn for {@code text}: control characters
     * become spaces and glyphs the font cannot encode become '?'.
     */
    public String printable(String text, TableFont font) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        PDFont pdFont = pdFont(font);
        String cleaned = text.replace('\r', ' ').replace('\n', ' ').replace('\t', ' ');
        if (canEncode(pdFont, cleaned)) {
            return cleaned;
        }

        StringBuilder sb = new StringBuilder(cleaned.length());
        int i = 0;
        while (i < cleaned.length()) {
            int cp = cleaned.codePointAt(i);
            String ch = new String(Character.toChars(cp));
            if (Character.isISOControl(cp)) {
                sb.append(' ');
            } else if (canEncode(pdFont, ch)) {
                sb.append(ch);
            } else {
                sb.append('?');
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }

    @Override
    public float ascent(TableFont font, float size) {
        PDFontDescriptor fd = pdFont(font).getFontDescriptor();
        if (fd == null || fd.getAscent() == 0) {
            return FontMetricsProvider.super.ascent(font, size);
        }
        return fd.getAscent() / 1000f * size;
    }

    @Override
    public float descent(TableFont font, float size) {
        PDFontDescriptor fd = pdFont(font).getFontDescriptor();
        if (fd == null || fd.getDescent() == 0) {
            return FontMetricsProvider.super.descent(font, size);
        }
        return fd.getDescent() / 1000f * size;
    }

    private static boolean canEncode(PDFont font, String text) {
        try {
            font.encode(text);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }
}

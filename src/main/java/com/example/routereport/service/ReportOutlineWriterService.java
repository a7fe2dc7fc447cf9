package com.example.routereport.service;

import com.example.routereport.model.OutlineEntry;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfOutline;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.navigation.PdfExplicitDestination;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds a bookmark outline to a rendered report so sections can be reached
 * from the viewer's navigation pane.
 */
@Service
public class ReportOutlineWriterService {

    public byte[] addOutline(byte[] pdfBytes, List<OutlineEntry> entries) throws IOException {
        if (entries == null || entries.isEmpty()) {
            return pdfBytes;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(pdfBytes)), new PdfWriter(out))) {
            PdfOutline root = pdf.getOutlines(false);

            // key=level, value=most recent outline at that level
            Map<Integer, PdfOutline> levelMap = new HashMap<>();
            levelMap.put(0, root);

            for (OutlineEntry entry : entries) {
                if (entry.getPage() < 1 || entry.getPage() > pdf.getNumberOfPages()) continue;

                // attach to the nearest shallower level, falling back to root
                PdfOutline parent = root;
                for (int l = entry.getLevel() - 1; l >= 0; l--) {
                    if (levelMap.containsKey(l)) {
                        parent = levelMap.get(l);
                        break;
                    }
                }

                PdfPage page = pdf.getPage(entry.getPage());
                PdfOutline current = parent.addOutline(entry.getTitle());
                current.addDestination(PdfExplicitDestination.createFitH(page, page.getPageSize().getTop()));

                levelMap.put(entry.getLevel(), current);
                levelMap.keySet().removeIf(k -> k > entry.getLevel());
            }
        }
        return out.toByteArray();
    }
}

package com.example.routereport.util;

import com.example.routereport.model.Cell;
import com.example.routereport.model.CellType;
import com.example.routereport.model.ReportRequest;
import com.example.routereport.model.ReportSection;
import com.example.routereport.model.Row;
import com.example.routereport.model.TableSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Report request parsing")
class ReportRequestParserTest {

    private final ReportRequestParser parser = new ReportRequestParser(new ObjectMapper());

    private static final String FULL_REQUEST = "{"
            + "\"title\": \"Route 7 risk review\","
            + "\"subtitle\": \"Quarterly\","
            + "\"sections\": [{"
            + "  \"heading\": \"Segments\","
            + "  \"paragraphs\": [\"Overview.\", null],"
            + "  \"table\": {"
            + "    \"title\": \"Segment risk\","
            + "    \"headers\": [\"Segment\", \"Score\", \"Map\"],"
            + "    \"columnWidths\": [200, 80, 120],"
            + "    \"style\": {\"repeatTitle\": true, \"headerBackground\": \"#102030\", \"minRowHeight\": 20},"
            + "    \"rows\": ["
            + "      [\"Bridge approach\", 7.5, {\"type\": \"link\", \"text\": \"view\", \"url\": \"https://maps.example/1\"}],"
            + "      [null, {\"type\": \"numeric\", \"text\": \"12\"}, {\"type\": \"link\", \"url\": \"https://maps.example/2\"}],"
            + "      [true, 3, \"plain\"]"
            + "    ]"
            + "  }"
            + "}]}";

    @Test
    @DisplayName("A full request maps onto sections, tables and typed cells")
    void parsesFullRequest() {
        ReportRequest request = parser.parse(FULL_REQUEST);

        assertEquals("Route 7 risk review", request.getTitle());
        assertEquals("Quarterly", request.getSubtitle());
        assertEquals(1, request.getSections().size());

        ReportSection section = request.getSections().get(0);
        assertEquals("Segments", section.getHeading());
        assertEquals(2, section.getParagraphs().size());
        assertEquals("", section.getParagraphs().get(1));
        assertTrue(section.hasTable());

        TableSpec table = section.getTable();
        assertEquals("Segment risk", table.getTitle());
        assertEquals(3, table.getColumnCount());
        assertEquals(400f, table.getTableWidth(), 0.001f);
        assertTrue(table.getStyle().isRepeatTitle());
        assertEquals(new Color(0x10, 0x20, 0x30), table.getStyle().getHeaderBackground());
        assertEquals(20f, table.getStyle().getMinRowHeight(), 0.001f);
        assertEquals(3, table.getRows().size());

        Row first = table.getRows().get(0);
        assertEquals(CellType.TEXT, first.getCell(0).getType());
        assertEquals(CellType.NUMERIC, first.getCell(1).getType());
        assertEquals("7.5", first.getCell(1).getText());
        assertEquals(Cell.link("view", "https://maps.example/1"), first.getCell(2));

        Row second = table.getRows().get(1);
        assertEquals(Cell.text(""), second.getCell(0));
        assertEquals(Cell.numeric("12"), second.getCell(1));
        assertEquals("https://maps.example/2", second.getCell(2).getText());

        Row third = table.getRows().get(2);
        assertEquals(Cell.text("true"), third.getCell(0));
        assertTrue(third.getCell(1).isNumeric());
    }

    @Test
    @DisplayName("Missing column widths split the default table width evenly")
    void defaultsColumnWidths() {
        ReportRequest request = parser.parse("{\"title\": \"T\", \"sections\": [{"
                + "\"table\": {\"headers\": [\"A\", \"B\", \"C\", \"D\", \"E\"], \"rows\": [[1, 2, 3, 4, 5]]}}]}");

        TableSpec table = request.getSections().get(0).getTable();
        assertEquals(5, table.getColumnWidths().size());
        table.getColumnWidths().forEach(w -> assertEquals(103f, w, 0.001f));
        assertNull(table.getTitle());
        assertFalse(table.getStyle().isRepeatTitle());
    }

    @Test
    @DisplayName("A single paragraph may be given as a string")
    void acceptsStringParagraph() {
        ReportRequest request = parser.parse("{\"title\": \"T\", \"sections\": [{\"paragraphs\": \"Only one.\"}]}");
        ReportSection section = request.getSections().get(0);
        assertEquals(1, section.getParagraphs().size());
        assertFalse(section.hasTable());
        assertNull(section.getHeading());
    }

    @Test
    @DisplayName("Structural problems are reported as request errors")
    void rejectsInvalidRequests() {
        assertRejected("{not json", "Malformed JSON");
        assertRejected("[]", "JSON object");
        assertRejected("{\"sections\": [{}]}", "title");
        assertRejected("{\"title\": \"T\", \"sections\": []}", "at least one section");
        assertRejected("{\"title\": \"T\", \"sections\": [\"x\"]}", "must be an object");
        assertRejected("{\"title\": \"T\", \"sections\": [{\"table\": {\"rows\": []}}]}", "headers");
        assertRejected("{\"title\": \"T\", \"sections\": [{\"table\": {\"headers\": [\"A\"], \"rows\": [\"x\"]}}]}",
                "must be arrays");
    }

    @Test
    @DisplayName("Cell and table validation failures name the offending section")
    void rejectsInvalidTables() {
        assertRejected("{\"title\": \"T\", \"sections\": [{\"table\": {\"headers\": [\"A\", \"B\"],"
                + " \"rows\": [[\"only one\"]]}}]}", "section 0");
        assertRejected("{\"title\": \"T\", \"sections\": [{\"table\": {\"headers\": [\"A\"],"
                + " \"rows\": [[{\"type\": \"link\", \"text\": \"no url\"}]]}}]}", "no url");
        assertRejected("{\"title\": \"T\", \"sections\": [{\"table\": {\"headers\": [\"A\"],"
                + " \"rows\": [[{\"type\": \"image\"}]]}}]}", "Unknown cell type");
        assertRejected("{\"title\": \"T\", \"sections\": [{\"table\": {\"headers\": [\"A\"], \"columnWidths\": [0],"
                + " \"rows\": []}}]}", "Invalid table");
        assertRejected("{\"title\": \"T\", \"sections\": [{\"table\": {\"headers\": [\"A\"],"
                + " \"style\": {\"linkColor\": \"blueish\"}, \"rows\": []}}]}", "Invalid color");
    }

    private void assertRejected(String json, String messageFragment) {
        ReportRequestException e = assertThrows(ReportRequestException.class, () -> parser.parse(json));
        assertTrue(e.getMessage().contains(messageFragment),
                "expected '" + messageFragment + "' in: " + e.getMessage());
    }
}

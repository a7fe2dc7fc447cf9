package com.example.routereport.util;

import com.example.routereport.model.Cell;
import com.example.routereport.model.ReportRequest;
import com.example.routereport.model.ReportSection;
import com.example.routereport.model.Row;
import com.example.routereport.model.TableSpec;
import com.example.routereport.model.TableStyle;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a report request from JSON.
 * <p>
 * Cells may be plain strings, numbers (numeric cells), booleans, null, or objects
 * of the form {@code {"type": "link", "text": "view", "url": "https://..."}}.
 * Missing column widths are spread evenly over the default table width.
 */
@Component
public class ReportRequestParser {

    private final ObjectMapper objectMapper;

    @Value("${report.table.default-width:515}")
    private float defaultTableWidth = 515f;

    public ReportRequestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReportRequest parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ReportRequestException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ReportRequestException("Request body must be a JSON object");
        }

        String title = text(root, "title");
        if (title == null || title.trim().isEmpty()) {
            throw new ReportRequestException("Report title is required");
        }

        JsonNode sectionsNode = root.get("sections");
        if (sectionsNode == null || !sectionsNode.isArray() || sectionsNode.size() == 0) {
            throw new ReportRequestException("Report needs at least one section");
        }

        List<ReportSection> sections = new ArrayList<>();
        for (int i = 0; i < sectionsNode.size(); i++) {
            sections.add(parseSection(sectionsNode.get(i), i));
        }
        return new ReportRequest(title.trim(), text(root, "subtitle"), sections);
    }

    private ReportSection parseSection(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new ReportRequestException("Section " + index + " must be an object");
        }
        List<String> paragraphs = new ArrayList<>();
        JsonNode paragraphNode = node.get("paragraphs");
        if (paragraphNode != null && paragraphNode.isArray()) {
            paragraphNode.forEach(p -> paragraphs.add(p.isNull() ? "" : p.asText()));
        } else if (paragraphNode != null && paragraphNode.isTextual()) {
            paragraphs.add(paragraphNode.asText());
        }

        TableSpec table = null;
        JsonNode tableNode = node.get("table");
        if (tableNode != null && !tableNode.isNull()) {
            table = parseTable(tableNode, "section " + index);
        }
        return new ReportSection(text(node, "heading"), paragraphs, table);
    }

    TableSpec parseTable(JsonNode node, String where) {
        JsonNode headersNode = node.get("headers");
        if (headersNode == null || !headersNode.isArray() || headersNode.size() == 0) {
            throw new ReportRequestException("Table in " + where + " needs a non-empty 'headers' array");
        }
        List<String> headers = new ArrayList<>();
        headersNode.forEach(h -> headers.add(h.asText()));

        List<Float> widths = new ArrayList<>();
        JsonNode widthsNode = node.get("columnWidths");
        if (widthsNode != null && widthsNode.isArray() && widthsNode.size() > 0) {
            widthsNode.forEach(w -> widths.add((float) w.asDouble()));
        } else {
            float even = defaultTableWidth / headers.size();
            for (int i = 0; i < headers.size(); i++) {
                widths.add(even);
            }
        }

        List<Row> rows = new ArrayList<>();
        JsonNode rowsNode = node.get("rows");
        if (rowsNode != null && rowsNode.isArray()) {
            for (JsonNode rowNode : rowsNode) {
                if (!rowNode.isArray()) {
                    throw new ReportRequestException("Rows of the table in " + where + " must be arrays");
                }
                List<Cell> cells = new ArrayList<>();
                rowNode.forEach(c -> cells.add(parseCell(c, where)));
                rows.add(new Row(cells));
            }
        }

        try {
            return TableSpec.builder()
                    .title(text(node, "title"))
                    .headers(headers)
                    .columnWidths(widths)
                    .rows(rows)
                    .style(parseStyle(node.get("style"), where))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ReportRequestException("Invalid table in " + where + ": " + e.getMessage(), e);
        }
    }

    Cell parseCell(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return Cell.text("");
        }
        if (node.isNumber()) {
            return Cell.numeric(node.asText());
        }
        if (!node.isObject()) {
            return Cell.of(node.asText());
        }

        String type = text(node, "type");
        String value = text(node, "text");
        if (type == null || "text".equalsIgnoreCase(type)) {
            return Cell.text(value);
        }
        if ("numeric".equalsIgnoreCase(type)) {
            return Cell.numeric(value);
        }
        if ("link".equalsIgnoreCase(type)) {
            String url = text(node, "url");
            if (url == null || url.trim().isEmpty()) {
                throw new ReportRequestException("Link cell in " + where + " has no url");
            }
            return Cell.link(value == null ? url : value, url);
        }
        throw new ReportRequestException("Unknown cell type '" + type + "' in " + where);
    }

    private TableStyle parseStyle(JsonNode node, String where) {
        TableStyle.Builder b = TableStyle.builder();
        if (node == null || !node.isObject()) {
            return b.build();
        }
        if (node.has("repeatTitle")) b.repeatTitle(node.get("repeatTitle").asBoolean());
        if (node.has("fontSize")) b.fontSize((float) node.get("fontSize").asDouble());
        if (node.has("headerFontSize")) b.headerFontSize((float) node.get("headerFontSize").asDouble());
        if (node.has("titleFontSize")) b.titleFontSize((float) node.get("titleFontSize").asDouble());
        if (node.has("minRowHeight")) b.minRowHeight((float) node.get("minRowHeight").asDouble());
        if (node.has("continuedNote")) b.continuedNote(node.get("continuedNote").asText());
        if (node.has("headerBackground")) b.headerBackground(color(node, "headerBackground", where));
        if (node.has("alternateRowBackground")) b.alternateRowBackground(color(node, "alternateRowBackground", where));
        if (node.has("titleBackground")) b.titleBackground(color(node, "titleBackground", where));
        if (node.has("linkColor")) b.linkColor(color(node, "linkColor", where));
        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new ReportRequestException("Invalid table style in " + where + ": " + e.getMessage(), e);
        }
    }

    private static Color color(JsonNode node, String field, String where) {
        String value = node.get(field).asText();
        try {
            return Color.decode(value.startsWith("#") ? value : "#" + value);
        } catch (NumberFormatException e) {
            throw new ReportRequestException("Invalid color '" + value + "' for " + field + " in " + where, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

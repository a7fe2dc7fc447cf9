package com.example.routereport.model;

import java.util.ArrayList;
import java.util.List;

public class ReportSection {
    private final String heading;
    private final List<String> paragraphs;
    private final TableSpec table;

    public ReportSection(String heading, List<String> paragraphs, TableSpec table) {
        this.heading = heading;
        this.paragraphs = paragraphs == null ? new ArrayList<>() : paragraphs;
        this.table = table;
    }

    public String getHeading() {
        return heading;
    }

    public List<String> getParagraphs() {
        return paragraphs;
    }

    public TableSpec getTable() {
        return table;
    }

    public boolean hasTable() {
        return table != null;
    }
}

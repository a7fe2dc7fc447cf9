package com.example.routereport.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A whole report: title block followed by sections in order.
 */
public class ReportRequest {
    private final String title;
    private final String subtitle;
    private final List<ReportSection> sections;

    public ReportRequest(String title, String subtitle, List<ReportSection> sections) {
        this.title = title;
        this.subtitle = subtitle;
        this.sections = sections == null ? new ArrayList<>() : sections;
    }

    public String getTitle() {
        return title;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public List<ReportSection> getSections() {
        return sections;
    }
}

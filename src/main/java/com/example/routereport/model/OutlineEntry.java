package com.example.routereport.model;

/**
 * One bookmark in the finished report: a section heading or table title and
 * the 1-based page it starts on.
 */
public class OutlineEntry {
    private final String title;
    private final int page;
    private final int level;

    public OutlineEntry(String title, int page, int level) {
        this.title = title;
        this.page = page;
        this.level = level;
    }

    public String getTitle() {
        return title;
    }

    public int getPage() {
        return page;
    }

    public int getLevel() {
        return level;
    }
}

package com.example.routereport.model;

public class TableRenderResult {
    private final float finalY;
    private final int firstPage;
    private final int lastPage;
    private final int rowsRendered;
    private final int headerEmissions;
    private final int linksRegistered;

    public TableRenderResult(float finalY, int firstPage, int lastPage, int rowsRendered,
                             int headerEmissions, int linksRegistered) {
        this.finalY = finalY;
        this.firstPage = firstPage;
        this.lastPage = lastPage;
        this.rowsRendered = rowsRendered;
        this.headerEmissions = headerEmissions;
        this.linksRegistered = linksRegistered;
    }

    public float getFinalY() { return finalY; }
    public int getFirstPage() { return firstPage; }
    public int getLastPage() { return lastPage; }
    public int getRowsRendered() { return rowsRendered; }
    public int getHeaderEmissions() { return headerEmissions; }
    public int getLinksRegistered() { return linksRegistered; }

    public int getPageCount() {
        return lastPage - firstPage + 1;
    }
}

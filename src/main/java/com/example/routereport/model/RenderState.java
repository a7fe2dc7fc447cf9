package com.example.routereport.model;

/**
 * Pagination bookkeeping for a single table render. Created per call, never shared.
 */
public class RenderState {
    private PaginationState state = PaginationState.IDLE;
    private boolean headersEmittedOnCurrentPage;
    private boolean pageStartedAtTop;
    private int nextRowIndex;
    private int rowsRenderedSoFar;
    private int rowsOnCurrentPage;
    private int headerEmissions;
    private int linksRegistered;

    public PaginationState getState() {
        return state;
    }

    public void setState(PaginationState state) {
        this.state = state;
    }

    public boolean isHeadersEmittedOnCurrentPage() {
        return headersEmittedOnCurrentPage;
    }

    public boolean isPageStartedAtTop() {
        return pageStartedAtTop;
    }

    public int getNextRowIndex() {
        return nextRowIndex;
    }

    public int getRowsRenderedSoFar() {
        return rowsRenderedSoFar;
    }

    public int getRowsOnCurrentPage() {
        return rowsOnCurrentPage;
    }

    public int getHeaderEmissions() {
        return headerEmissions;
    }

    public int getLinksRegistered() {
        return linksRegistered;
    }

    public void rowRendered() {
        nextRowIndex++;
        rowsRenderedSoFar++;
        rowsOnCurrentPage++;
    }

    public void headerEmitted() {
        headersEmittedOnCurrentPage = true;
        headerEmissions++;
    }

    public void linkRegistered() {
        linksRegistered++;
    }

    public void pageStarted(boolean atTop) {
        headersEmittedOnCurrentPage = false;
        rowsOnCurrentPage = 0;
        pageStartedAtTop = atTop;
    }
}

package com.example.routereport.model;

/**
 * Current drawing position. Y is measured from the page bottom, so it
 * decreases as content is drawn and jumps back to the top offset on a new page.
 */
public class Cursor {
    private int pageNumber;
    private float y;

    public Cursor(int pageNumber, float y) {
        this.pageNumber = pageNumber;
        this.y = y;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public float getY() {
        return y;
    }

    public void moveDown(float amount) {
        this.y -= amount;
    }

    public void newPage(float topY) {
        this.pageNumber++;
        this.y = topY;
    }
}

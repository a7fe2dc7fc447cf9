package com.example.routereport.model;

/**
 * Vertical limits of a page as seen by the pagination controller.
 */
public class PageGeometry {
    private final float topY;
    private final float bottomMargin;

    public PageGeometry(float topY, float bottomMargin) {
        if (topY <= bottomMargin) {
            throw new IllegalArgumentException("Top offset " + topY + " must lie above bottom margin " + bottomMargin);
        }
        this.topY = topY;
        this.bottomMargin = bottomMargin;
    }

    /** Cursor Y after a page break. */
    public float getTopY() {
        return topY;
    }

    /** Lowest Y a row may reach; the space below holds the continued note. */
    public float getBottomMargin() {
        return bottomMargin;
    }
}

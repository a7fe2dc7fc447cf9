package com.example.routereport.model;

/**
 * Clickable rectangle bound to a URL. x/y is the lower-left corner.
 */
public class LinkRegion {
    private final String url;
    private final float x;
    private final float y;
    private final float width;
    private final float height;

    public LinkRegion(String url, float x, float y, float width, float height) {
        this.url = url;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public String getUrl() { return url; }
    public float getX() { return x; }
    public float getY() { return y; }
    public float getWidth() { return width; }
    public float getHeight() { return height; }

    public boolean containedIn(float left, float bottom, float right, float top) {
        float eps = 0.001f;
        return x >= left - eps && y >= bottom - eps && x + width <= right + eps && y + height <= top + eps;
    }

    @Override
    public String toString() {
        return String.format("LinkRegion[%s @ %.1f,%.1f %.1fx%.1f]", url, x, y, width, height);
    }
}

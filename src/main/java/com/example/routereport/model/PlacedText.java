package com.example.routereport.model;

/**
 * A line of text as drawn: left x, baseline y and measured width.
 */
public class PlacedText {
    private final String text;
    private final float x;
    private final float baseline;
    private final float width;

    public PlacedText(String text, float x, float baseline, float width) {
        this.text = text;
        this.x = x;
        this.baseline = baseline;
        this.width = width;
    }

    public String getText() { return text; }
    public float getX() { return x; }
    public float getBaseline() { return baseline; }
    public float getWidth() { return width; }
}

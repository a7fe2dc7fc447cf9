package com.example.routereport.surface;

import java.awt.Color;
import java.io.IOException;

/**
 * Immediate-mode page drawing. Coordinates are in points from the lower-left
 * corner of the current page; rectangles are given by their lower-left corner.
 * Not thread-safe: a surface carries its own page cursor.
 */
public interface DrawingSurface {

    void setFillColor(Color color) throws IOException;

    void setStrokeColor(Color color) throws IOException;

    void drawRect(float x, float y, float width, float height, boolean fill, boolean stroke) throws IOException;

    void drawText(float x, float y, String text, TableFont font, float size) throws IOException;

    float measureText(String text, TableFont font, float size) throws IOException;

    void startNewPage() throws IOException;

    void registerLink(String url, float x, float y, float width, float height) throws IOException;

    /** 1-based number of the page currently being drawn. */
    int getPageNumber();
}

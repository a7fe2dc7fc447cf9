package com.example.routereport.model;

import com.example.routereport.surface.DrawingSurface;

/**
 * The surface being drawn on plus the cursor and pagination state of the
 * current table. Passed explicitly to each layout step.
 */
public class RenderSession {
    private final DrawingSurface surface;
    private final Cursor cursor;
    private final RenderState renderState;
    private final float startX;

    public RenderSession(DrawingSurface surface, Cursor cursor, RenderState renderState, float startX) {
        this.surface = surface;
        this.cursor = cursor;
        this.renderState = renderState;
        this.startX = startX;
    }

    public DrawingSurface getSurface() {
        return surface;
    }

    public Cursor getCursor() {
        return cursor;
    }

    public RenderState getRenderState() {
        return renderState;
    }

    public float getStartX() {
        return startX;
    }
}

package com.example.routereport.surface;

import java.io.IOException;

/**
 * Text measurement in points. Implementations may throw when a glyph cannot
 * be measured; callers decide how to degrade.
 */
public interface FontMetricsProvider {

    float measure(String text, TableFont font, float size) throws IOException;

    /** Distance from baseline to the top of the tallest glyph. */
    default float ascent(TableFont font, float size) {
        return size * 0.8f;
    }

    /** Distance from baseline to the lowest descender, negative. */
    default float descent(TableFont font, float size) {
        return size * -0.2f;
    }
}

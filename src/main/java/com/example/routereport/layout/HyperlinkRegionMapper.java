package com.example.routereport.layout;

import com.example.routereport.model.LinkRegion;
import com.example.routereport.model.PlacedText;
import com.example.routereport.model.RenderSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Turns the drawn lines of a link into a clickable region on the current page.
 * The region covers the glyph box of the text only, not the surrounding cell.
 */
public class HyperlinkRegionMapper {

    private static final Logger logger = LoggerFactory.getLogger(HyperlinkRegionMapper.class);

    private final boolean continueOnError;

    public HyperlinkRegionMapper(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    /**
     * Bounding box of the placed lines: from the leftmost x to the rightmost
     * line end, from the last baseline plus descent up to the first baseline
     * plus ascent. Returns null when nothing visible was drawn.
     */
    public LinkRegion hotZone(String url, List<PlacedText> lines, float ascent, float descent) {
        float left = Float.MAX_VALUE;
        float right = -Float.MAX_VALUE;
        float top = -Float.MAX_VALUE;
        float bottom = Float.MAX_VALUE;
        boolean any = false;

        for (PlacedText line : lines) {
            if (line.getText().isEmpty() || line.getWidth() <= 0) continue;
            any = true;
            left = Math.min(left, line.getX());
            right = Math.max(right, line.getX() + line.getWidth());
            top = Math.max(top, line.getBaseline() + ascent);
            bottom = Math.min(bottom, line.getBaseline() + descent);
        }
        if (!any) {
            return null;
        }
        return new LinkRegion(url, left, bottom, right - left, top - bottom);
    }

    /**
     * Registers {@code region} on the session's current page.
     *
     * @return false when registration failed and failures are tolerated
     */
    public boolean register(RenderSession session, LinkRegion region) throws IOException {
        try {
            session.getSurface().registerLink(region.getUrl(), region.getX(), region.getY(),
                    region.getWidth(), region.getHeight());
            session.getRenderState().linkRegistered();
            return true;
        } catch (IOException | RuntimeException e) {
            if (!continueOnError) {
                throw e;
            }
            logger.warn("Skipping link {} on page {}: {}", region.getUrl(),
                    session.getCursor().getPageNumber(), e.getMessage());
            return false;
        }
    }
}

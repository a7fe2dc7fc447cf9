package com.example.routereport.util;

import com.example.routereport.surface.FontMetricsProvider;
import com.example.routereport.surface.TableFont;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Greedy, word-atomic line breaking against measured text width.
 * <p>
 * Words are never split: a single word wider than the line is placed alone on
 * its own line and allowed to overflow. When the metrics provider fails, line
 * breaking falls back to a characters-per-line estimate so layout degrades
 * instead of aborting.
 */
public class WordWrapper {

    private static final Logger logger = LoggerFactory.getLogger(WordWrapper.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    /** Average glyph width as a fraction of font size, used when measuring fails. */
    static final float FALLBACK_CHAR_WIDTH_FACTOR = 0.5f;

    private final FontMetricsProvider metrics;

    public WordWrapper(FontMetricsProvider metrics) {
        this.metrics = metrics;
    }

    /**
     * Breaks {@code text} into lines no wider than {@code maxWidth}.
     * Always returns at least one line; empty input yields a single empty line.
     */
    public List<String> wrap(String text, TableFont font, float size, float maxWidth) {
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            return Collections.singletonList("");
        }
        try {
            return wrapMeasured(tokens, font, size, maxWidth);
        } catch (IOException | RuntimeException e) {
            logger.warn("Font metrics unavailable for {} {}pt, using character estimate: {}", font, size, e.getMessage());
            return wrapByCharacterCount(tokens, charactersPerLine(size, maxWidth));
        }
    }

    /**
     * Wraps free text while keeping its explicit line breaks; blank source
     * lines come back as empty lines.
     */
    public List<String> wrapParagraph(String text, TableFont font, float size, float maxWidth) {
        if (text == null || text.isEmpty()) {
            return Collections.singletonList("");
        }
        List<String> lines = new ArrayList<>();
        for (String sourceLine : LINE_BREAK.split(text, -1)) {
            lines.addAll(wrap(sourceLine, font, size, maxWidth));
        }
        return lines;
    }

    private List<String> wrapMeasured(List<String> tokens, TableFont font, float size, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();

        for (String token : tokens) {
            if (line.length() == 0) {
                line.append(token);
                continue;
            }
            String candidate = line + " " + token;
            if (metrics.measure(candidate, font, size) <= maxWidth) {
                line.append(' ').append(token);
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(token);
            }
        }
        lines.add(line.toString());
        return lines;
    }

    private List<String> wrapByCharacterCount(List<String> tokens, int charsPerLine) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();

        for (String token : tokens) {
            if (line.length() == 0) {
                line.append(token);
            } else if (line.length() + 1 + token.length() <= charsPerLine) {
                line.append(' ').append(token);
            } else {
                lines.add(line.toString());
                line.setLength(0);
                line.append(token);
            }
        }
        lines.add(line.toString());
        return lines;
    }

    /** Width estimate used wherever measuring fails. */
    public static float estimateWidth(String text, float size) {
        return text == null ? 0f : text.length() * size * FALLBACK_CHAR_WIDTH_FACTOR;
    }

    static int charactersPerLine(float size, float maxWidth) {
        return Math.max(1, (int) (maxWidth / (size * FALLBACK_CHAR_WIDTH_FACTOR)));
    }

    private static List<String> tokenize(String text) {
        if (text == null) {
            return Collections.emptyList();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        Collections.addAll(tokens, WHITESPACE.split(trimmed));
        return tokens;
    }
}

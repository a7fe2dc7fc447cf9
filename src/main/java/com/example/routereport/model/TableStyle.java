package com.example.routereport.model;

import java.awt.Color;

/**
 * Visual options for one table. Built through {@link #builder()}; every
 * option has a default matching the route report look.
 */
public final class TableStyle {
    private final Color headerBackground;
    private final Color headerTextColor;
    private final Color rowBackground;
    private final Color alternateRowBackground;
    private final Color borderColor;
    private final Color textColor;
    private final Color titleBackground;
    private final Color titleColor;
    private final Color linkColor;
    private final Color continuedNoteColor;
    private final float fontSize;
    private final float headerFontSize;
    private final float titleFontSize;
    private final float continuedNoteFontSize;
    private final float lineSpacingFactor;
    private final float cellPadding;
    private final float textPaddingX;
    private final float minRowHeight;
    private final float minHeaderHeight;
    private final float titleBarHeight;
    private final boolean repeatTitle;
    private final String continuedNote;

    private TableStyle(Builder b) {
        this.headerBackground = b.headerBackground;
        this.headerTextColor = b.headerTextColor;
        this.rowBackground = b.rowBackground;
        this.alternateRowBackground = b.alternateRowBackground;
        this.borderColor = b.borderColor;
        this.textColor = b.textColor;
        this.titleBackground = b.titleBackground;
        this.titleColor = b.titleColor;
        this.linkColor = b.linkColor;
        this.continuedNoteColor = b.continuedNoteColor;
        this.fontSize = b.fontSize;
        this.headerFontSize = b.headerFontSize;
        this.titleFontSize = b.titleFontSize;
        this.continuedNoteFontSize = b.continuedNoteFontSize;
        this.lineSpacingFactor = b.lineSpacingFactor;
        this.cellPadding = b.cellPadding;
        this.textPaddingX = b.textPaddingX;
        this.minRowHeight = b.minRowHeight;
        this.minHeaderHeight = b.minHeaderHeight;
        this.titleBarHeight = b.titleBarHeight;
        this.repeatTitle = b.repeatTitle;
        this.continuedNote = b.continuedNote;
    }

    public static TableStyle defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Color getHeaderBackground() { return headerBackground; }
    public Color getHeaderTextColor() { return headerTextColor; }
    public Color getRowBackground() { return rowBackground; }
    public Color getAlternateRowBackground() { return alternateRowBackground; }
    public Color getBorderColor() { return borderColor; }
    public Color getTextColor() { return textColor; }
    public Color getTitleBackground() { return titleBackground; }
    public Color getTitleColor() { return titleColor; }
    public Color getLinkColor() { return linkColor; }
    public Color getContinuedNoteColor() { return continuedNoteColor; }
    public float getFontSize() { return fontSize; }
    public float getHeaderFontSize() { return headerFontSize; }
    public float getTitleFontSize() { return titleFontSize; }
    public float getContinuedNoteFontSize() { return continuedNoteFontSize; }
    public float getLineSpacingFactor() { return lineSpacingFactor; }
    public float getCellPadding() { return cellPadding; }
    public float getTextPaddingX() { return textPaddingX; }
    public float getMinRowHeight() { return minRowHeight; }
    public float getMinHeaderHeight() { return minHeaderHeight; }
    public float getTitleBarHeight() { return titleBarHeight; }
    public boolean isRepeatTitle() { return repeatTitle; }
    public String getContinuedNote() { return continuedNote; }

    public float getBodyLineSpacing() {
        return fontSize * lineSpacingFactor;
    }

    public float getHeaderLineSpacing() {
        return headerFontSize * lineSpacingFactor;
    }

    public static final class Builder {
        private Color headerBackground = new Color(31, 78, 121);
        private Color headerTextColor = Color.WHITE;
        private Color rowBackground = Color.WHITE;
        private Color alternateRowBackground = new Color(242, 242, 242);
        private Color borderColor = new Color(191, 191, 191);
        private Color textColor = Color.BLACK;
        private Color titleBackground = new Color(220, 230, 241);
        private Color titleColor = new Color(31, 78, 121);
        private Color linkColor = new Color(0, 0, 204);
        private Color continuedNoteColor = new Color(100, 100, 100);
        private float fontSize = 8f;
        private float headerFontSize = 9f;
        private float titleFontSize = 11f;
        private float continuedNoteFontSize = 7f;
        private float lineSpacingFactor = 1.25f;
        private float cellPadding = 6f;
        private float textPaddingX = 4f;
        private float minRowHeight = 16f;
        private float minHeaderHeight = 18f;
        private float titleBarHeight = 20f;
        private boolean repeatTitle = false;
        private String continuedNote = "Continued on next page...";

        private Builder() {}

        public Builder headerBackground(Color c) { this.headerBackground = c; return this; }
        public Builder headerTextColor(Color c) { this.headerTextColor = c; return this; }
        public Builder rowBackground(Color c) { this.rowBackground = c; return this; }
        public Builder alternateRowBackground(Color c) { this.alternateRowBackground = c; return this; }
        public Builder borderColor(Color c) { this.borderColor = c; return this; }
        public Builder textColor(Color c) { this.textColor = c; return this; }
        public Builder titleBackground(Color c) { this.titleBackground = c; return this; }
        public Builder titleColor(Color c) { this.titleColor = c; return this; }
        public Builder linkColor(Color c) { this.linkColor = c; return this; }
        public Builder continuedNoteColor(Color c) { this.continuedNoteColor = c; return this; }
        public Builder fontSize(float v) { this.fontSize = v; return this; }
        public Builder headerFontSize(float v) { this.headerFontSize = v; return this; }
        public Builder titleFontSize(float v) { this.titleFontSize = v; return this; }
        public Builder continuedNoteFontSize(float v) { this.continuedNoteFontSize = v; return this; }
        public Builder lineSpacingFactor(float v) { this.lineSpacingFactor = v; return this; }
        public Builder cellPadding(float v) { this.cellPadding = v; return this; }
        public Builder textPaddingX(float v) { this.textPaddingX = v; return this; }
        public Builder minRowHeight(float v) { this.minRowHeight = v; return this; }
        public Builder minHeaderHeight(float v) { this.minHeaderHeight = v; return this; }
        public Builder titleBarHeight(float v) { this.titleBarHeight = v; return this; }
        public Builder repeatTitle(boolean v) { this.repeatTitle = v; return this; }
        public Builder continuedNote(String v) { this.continuedNote = v; return this; }

        public TableStyle build() {
            if (fontSize <= 0 || headerFontSize <= 0 || titleFontSize <= 0) {
                throw new IllegalArgumentException("Font sizes must be positive");
            }
            if (lineSpacingFactor <= 0) {
                throw new IllegalArgumentException("Line spacing factor must be positive");
            }
            return new TableStyle(this);
        }
    }
}

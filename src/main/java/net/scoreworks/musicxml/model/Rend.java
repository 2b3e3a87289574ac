/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

/**
 * Text rendition attributes of a {@link TextRun}
 */
public final class Rend {

    public enum HorizontalAlign {
        LEFT, CENTER, RIGHT, NONE
    }

    public enum FontStyle {
        NORMAL, ITALIC, OBLIQUE, NONE
    }

    public enum FontWeight {
        NORMAL, BOLD, NONE
    }

    private final HorizontalAlign halign;
    private final String color;
    private final String fontFamily;
    private final FontStyle fontStyle;
    private final FontWeight fontWeight;
    private final String lang;

    public Rend(@Nullable HorizontalAlign halign, @Nullable String color, @Nullable String fontFamily,
                @Nullable FontStyle fontStyle, @Nullable FontWeight fontWeight, @Nullable String lang) {
        this.halign = halign;
        this.color = color;
        this.fontFamily = fontFamily;
        this.fontStyle = fontStyle;
        this.fontWeight = fontWeight;
        this.lang = lang;
    }

    @Nullable
    public HorizontalAlign getHalign() {
        return halign;
    }

    @Nullable
    public String getColor() {
        return color;
    }

    @Nullable
    public String getFontFamily() {
        return fontFamily;
    }

    @Nullable
    public FontStyle getFontStyle() {
        return fontStyle;
    }

    @Nullable
    public FontWeight getFontWeight() {
        return fontWeight;
    }

    @Nullable
    public String getLang() {
        return lang;
    }
}

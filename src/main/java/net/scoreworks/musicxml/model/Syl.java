/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

/**
 * One lyric syllable with its connection to the following syllable
 */
public final class Syl {

    /** connector to the next syllable */
    public enum Con {
        /** extender line */
        UNDERSCORE,
        /** elision bridge */
        BRIDGE,
        /** hyphen */
        DASH,
        NONE
    }

    /** position of the syllable within its word */
    public enum WordPos {
        INITIAL, MEDIAL, TERMINAL, NONE
    }

    private final String text;
    private final Con con;
    private final WordPos wordPos;
    private final String lang;
    private final Rend.FontStyle fontStyle;
    private final Rend.FontWeight fontWeight;

    public Syl(String text, Con con, WordPos wordPos, @Nullable String lang, @Nullable Rend.FontStyle fontStyle,
               @Nullable Rend.FontWeight fontWeight) {
        this.text = text;
        this.con = con;
        this.wordPos = wordPos;
        this.lang = lang;
        this.fontStyle = fontStyle;
        this.fontWeight = fontWeight;
    }

    public String getText() {
        return text;
    }

    public Con getCon() {
        return con;
    }

    public WordPos getWordPos() {
        return wordPos;
    }

    @Nullable
    public String getLang() {
        return lang;
    }

    @Nullable
    public Rend.FontStyle getFontStyle() {
        return fontStyle;
    }

    @Nullable
    public Rend.FontWeight getFontWeight() {
        return fontWeight;
    }
}

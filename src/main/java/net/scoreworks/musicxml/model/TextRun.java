/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

/**
 * A piece of text, optionally with a rendition
 */
public final class TextRun {
    private final String text;
    private final Rend rend;

    public TextRun(String text, @Nullable Rend rend) {
        this.text = text;
        this.rend = rend;
    }

    public TextRun(String text) {
        this(text, null);
    }

    public String getText() {
        return text;
    }

    @Nullable
    public Rend getRend() {
        return rend;
    }
}

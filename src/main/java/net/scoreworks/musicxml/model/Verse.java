/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Lyric verse of a note. Verses are numbered starting with 1
 */
public final class Verse {
    private final int n;
    private final String color;
    private final List<Syl> syls;

    public Verse(int n, @Nullable String color, List<Syl> syls) {
        this.n = n;
        this.color = color;
        this.syls = List.copyOf(syls);
    }

    public int getN() {
        return n;
    }

    @Nullable
    public String getColor() {
        return color;
    }

    public List<Syl> getSyls() {
        return syls;
    }
}

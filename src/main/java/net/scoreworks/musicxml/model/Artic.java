/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Group of articulation marks attached to a layer element. Marks from a MusicXML technical block are tagged with
 * the type {@value #TECHNICAL}
 */
public final class Artic {
    public static final String TECHNICAL = "technical";

    private final List<Articulation> artics;
    private final String type;

    public Artic(List<Articulation> artics, @Nullable String type) {
        this.artics = List.copyOf(artics);
        this.type = type;
    }

    public List<Articulation> getArtics() {
        return artics;
    }

    @Nullable
    public String getType() {
        return type;
    }

    public boolean isTechnical() {
        return TECHNICAL.equals(type);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Fingered tremolo alternating between two notes or chords
 */
public class FTrem extends ContainerElement {
    private int slash;

    public FTrem(LayerElementContainer owner) {
        super(owner);
    }

    public int getSlash() {
        return slash;
    }

    public void setSlash(int slash) {
        this.slash = slash;
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitFTrem(this);
    }
}

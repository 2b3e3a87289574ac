/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Measure repeat sign, meaning the layer repeats the content of the previous measure
 */
public class MRpt extends LayerElement {

    public MRpt(LayerElementContainer owner) {
        super(owner);
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitMRpt(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Beam extends ContainerElement {

    public Beam(LayerElementContainer owner) {
        super(owner);
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitBeam(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Bowed (single note) tremolo
 */
public class BTrem extends ContainerElement {

    public BTrem(LayerElementContainer owner) {
        super(owner);
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitBTrem(this);
    }
}

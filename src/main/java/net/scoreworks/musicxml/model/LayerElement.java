/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of everything that lives inside a {@link Layer}, either directly or nested in a {@link ContainerElement}.
 * Elements are appended to their owner on construction, so creation order is document order.
 */
public abstract class LayerElement extends Child<LayerElementContainer> {
    private final List<Artic> artics = new ArrayList<>();

    protected LayerElement(LayerElementContainer owner) {
        super(owner);
    }

    protected void addToOwner() {
        getOwner().attachLayerElement(this);
    }
    protected void removeFromOwner() {
        getOwner().detachLayerElement(this);
    }

    public Layer getLayer() {
        return getOwner().getLayer();
    }

    public List<Artic> getArtics() {
        return Collections.unmodifiableList(artics);
    }

    public void addArtic(Artic artic) {
        artics.add(artic);
    }

    public abstract <R> R accept(LayerElementVisitor<R> visitor);
}

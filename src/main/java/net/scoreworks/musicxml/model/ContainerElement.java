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
 * A layer element grouping other layer elements (chords, beams, tuplets and tremolos). Children are owned exclusively
 */
public abstract class ContainerElement extends LayerElement implements LayerElementContainer {
    private final List<LayerElement> elements = new ArrayList<>();

    protected ContainerElement(LayerElementContainer owner) {
        super(owner);
    }

    @Override
    public List<LayerElement> getLayerElements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public void attachLayerElement(LayerElement element) {
        elements.add(element);
    }

    @Override
    public void detachLayerElement(LayerElement element) {
        elements.remove(element);
    }

    @Override
    public List<? extends Child<?>> getChildren() {
        return getLayerElements();
    }
}

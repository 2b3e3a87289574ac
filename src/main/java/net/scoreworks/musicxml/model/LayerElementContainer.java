/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.ScoreObject;

import java.util.List;

/**
 * Owner of {@link LayerElement}s: a {@link Layer} or a grouping {@link ContainerElement}. Elements attach and detach
 * themselves through this interface when they are constructed, moved or removed.
 */
public interface LayerElementContainer extends ScoreObject {

    /**
     * @return the owned elements in document order
     */
    List<LayerElement> getLayerElements();

    /**
     * Invoked by an element that has this container as its new owner. Use constructors or
     * {@link LayerElement#moveTo(net.scoreworks.musicxml.tree.ScoreObject)} instead of calling it directly
     */
    void attachLayerElement(LayerElement element);

    /**
     * Invoked by an element that leaves this container
     */
    void detachLayerElement(LayerElement element);

    /**
     * @return the layer this container belongs to
     */
    Layer getLayer();
}

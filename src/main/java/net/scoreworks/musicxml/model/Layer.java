/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;
import net.scoreworks.musicxml.tree.MappedChild;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A voice within a staff, keyed by its voice number. Owns its elements in document order
 */
public class Layer extends MappedChild<Staff, Integer> implements LayerElementContainer {
    final List<LayerElement> elements = new ArrayList<>();

    public Layer(Staff staff, int n) {
        super(staff, n);
    }

    protected void addToOwner() {
        getOwner().layers.put(getKey(), this);
    }
    protected void removeFromOwner() {
        getOwner().layers.remove(getKey());
    }

    public int getN() {
        return getKey();
    }

    public Staff getStaff() {
        return getOwner();
    }

    @Override
    public Layer getLayer() {
        return this;
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

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.ContainerElement;
import net.scoreworks.musicxml.model.Layer;
import net.scoreworks.musicxml.model.LayerElementContainer;

import java.util.ArrayList;
import java.util.List;

/**
 * Open chords, beams, tuplets and tremolos of the measure being read. New layer elements go into the innermost open
 * container, or into the layer if none is open.
 */
public class NestingStack {
    private final List<ContainerElement> stack = new ArrayList<>();

    /**
     * @return where an element read for the given layer has to be attached to
     */
    public LayerElementContainer target(Layer layer) {
        if (stack.isEmpty())
            return layer;
        return stack.get(stack.size()-1);
    }

    public void push(ContainerElement container) {
        stack.add(container);
    }

    /**
     * Close the nearest open container of the given type. Containers opened above it stay open, so overlapping
     * spans of malformed input don't lose elements
     * @return false if no container of this type was open
     */
    public boolean removeLast(Class<? extends ContainerElement> type) {
        for (int i = stack.size()-1; i >= 0; i--) {
            if (type.isInstance(stack.get(i))) {
                stack.remove(i);
                return true;
            }
        }
        return false;
    }

    public boolean isTopOf(Class<? extends ContainerElement> type) {
        return !stack.isEmpty() && type.isInstance(stack.get(stack.size()-1));
    }

    public int size() {
        return stack.size();
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public void clear() {
        stack.clear();
    }
}

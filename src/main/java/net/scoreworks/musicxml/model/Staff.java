/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;
import net.scoreworks.musicxml.tree.IndexedChild;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One staff within a measure. Its index is the global staff number, which stays the same when the staff is merged
 * into the measure of another part. Layers are created lazily in order of first reference.
 */
public class Staff extends IndexedChild<Measure> {
    final Map<Integer, Layer> layers = new LinkedHashMap<>();

    public Staff(Measure measure, int n) {
        super(measure, n);
    }

    protected void addToOwner() {
        getOwner().staves.add(this);
    }
    protected void removeFromOwner() {
        getOwner().staves.remove(this);
    }

    public int getN() {
        return getIndex();
    }

    @Nullable
    public Layer getLayer(int n) {
        return layers.get(n);
    }

    /**
     * @return the layer created first or null if there are none
     */
    @Nullable
    public Layer getFirstLayer() {
        if (layers.isEmpty())
            return null;
        return layers.values().iterator().next();
    }

    public List<Layer> getLayers() {
        return Collections.unmodifiableList(new ArrayList<>(layers.values()));
    }

    public int getLayerCount() {
        return layers.size();
    }

    @Override
    public List<? extends Child<?>> getChildren() {
        return getLayers();
    }
}

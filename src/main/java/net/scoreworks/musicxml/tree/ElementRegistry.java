/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.tree;

import org.apache.commons.collections4.bidimap.DualHashBidiMap;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;


/**
 * A two-way link between {@link ObjectId}s and the {@link Child}ren of one {@link RootEntity}. Every child registers
 * itself on construction and is unregistered when removed, so string references of the form {@code #<id>} can be
 * resolved back to the node they point at. Moving a node to another owner keeps its id.
 */
public class ElementRegistry extends DualHashBidiMap<ObjectId, Child<?>> {

    /** counter for ids of this registry only */
    private long nextId;

    ElementRegistry() {}

    ObjectId register(Child<?> child) {
        if (containsValue(child))
            return getKey(child);
        ObjectId objectId = new ObjectId(child.getClass().getSimpleName().toLowerCase(Locale.ROOT), nextId++);
        put(objectId, child);
        return objectId;
    }

    void unregister(Child<?> child) {
        removeValue(child);
    }

    /**
     * @param reference id in textual ({@code note-3}) or reference ({@code #note-3}) form
     * @return the registered node or null if nothing is registered under this id
     */
    @Nullable
    public Child<?> resolve(String reference) {
        ObjectId objectId = ObjectId.parse(reference);
        if (objectId == null)
            return null;
        return get(objectId);
    }
}

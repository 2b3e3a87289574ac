/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.tree;

import org.jetbrains.annotations.Nullable;


/**
 * Base class for the root element of a score tree. The root owns the {@link ElementRegistry} that hands out ids to
 * and resolves references of all nodes in the tree.
 */
public abstract class RootEntity implements ScoreObject {

    /**
     * Registry of all nodes. As member of this class, this field is not part of the tree itself
     */
    final transient ElementRegistry registry = new ElementRegistry();

    /**
     * Resolve a cross-reference string like {@code #note-12}
     * @return the node or null if the reference doesn't point at a node of this tree
     */
    @Nullable
    public Child<?> resolveReference(String reference) {
        return registry.resolve(reference);
    }

    @Override
    public RootEntity getRootEntity() {
        return this;
    }
}

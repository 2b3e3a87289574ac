/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.tree;

import java.util.List;

/**
 * Base interface for any node of the score tree.
 */
public interface ScoreObject {

    /**
     * @return the root of the tree this object belongs to
     */
    RootEntity getRootEntity();

    /**
     * @return all direct children in document order. Used for recursive removal and traversal
     */
    List<? extends Child<?>> getChildren();
}

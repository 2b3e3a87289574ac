/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.tree;

/**
 * Child entity that is identified by a final index within its owner (e.g. the global number of a staff). The index
 * survives moving the child to another owner.
 * @param <O> class-type of the owner class
 */
public abstract class IndexedChild<O extends ScoreObject> extends Child<O> {

    /**
     * Reference to the index the object is saved with
     */
    private final int index;

    public IndexedChild(O owner, int index) {
        super(owner);
        this.index = index;
        addToOwner();   // now index can be used
    }

    public int getIndex() {
        return index;
    }

    @Override
    protected boolean isDirectChild() {
        return false;
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.tree;

import net.scoreworks.musicxml.tree.exceptions.IllegalScoreModelException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for each class in the score tree except the {@link RootEntity}. Each such class has exactly one owner
 * at any time. The owner can be exchanged with {@link Child#moveTo(ScoreObject)}, which keeps the node and its id
 * intact (no copy is made).
 * @param <O> class-type of the owner class
 */
public abstract class Child<O extends ScoreObject> implements ScoreObject {

    /**
     * Cache reference to the root entity of the tree for direct access
     */
    private final RootEntity root;

    /**
     * Reference to the owner of the class
     */
    private O owner;

    /**
     * Prevent removal to be triggered several times on the same object
     */
    private transient boolean removalInProcess;

    protected Child(O owner) {
        this.owner = owner;
        //save direct reference to tree root
        ScoreObject it = owner;
        while(!(it instanceof RootEntity)) {
            it = ((Child<?>)it).getOwner();
        }
        root = (RootEntity) it;
        root.registry.register(this);
        //call addToOwner only if the current instance is a direct Child. If not, derivations will call it once fields are set
        if (isDirectChild())
            addToOwner();
    }

    public O getOwner() {
        return owner;
    }

    /**
     * @return the id this node is registered with, or null once it was removed
     */
    public ObjectId getObjectId() {
        return root.registry.getKey(this);
    }

    /**
     * @return a string reference to this node of the form {@code #<id>}
     */
    public String getReference() {
        return getObjectId().toReference();
    }

    /**
     * Transfer ownership to another owner of the same tree. The node is removed from its current owner and appended
     * to the new one, children come along
     */
    public void moveTo(O newOwner) {
        if (newOwner.getRootEntity() != root)
            throw new IllegalScoreModelException(getClass(), "can't be moved into a different score");
        removeFromOwner();
        owner = newOwner;
        addToOwner();
    }

    /**
     * Remove this object and all subsequent children from the tree.
     * This method will go through all children recursively and call {@link Child#removeFromOwner()} and
     * {@link Child#onRemove()} on them and unregister their ids
     */
    public final void remove() {
        if (removalInProcess)
            return;
        removalInProcess = true;
        recursivelyRemove(this);
    }
    private void recursivelyRemove(Child<?> ch) {
        for (Child<?> t : new ArrayList<>(ch.getChildren())) {
            recursivelyRemove(t);
        }
        ch.removeFromOwner();
        ch.onRemove();
        root.registry.unregister(ch);
    }

    /**
     * Internal method to differentiate Child from its derivations which must call addToOwner() only after setting all
     * construction parameters
     */
    protected boolean isDirectChild() {
        return true;
    }

    /**
     * Remove itself from the owner's collection or field. Since name of the owning field is unknown, this must be
     * implemented by each implementing class
     */
    protected abstract void removeFromOwner();

    /**
     * Add itself to the owner's collection or field. Since name of the owning field is unknown, this must be
     * implemented by each implementing class
     */
    protected abstract void addToOwner();

    /**
     * This method gets called when this object is being removed from the tree. Implementation is optional
     */
    protected void onRemove() {}

    @Override
    public List<? extends Child<?>> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public RootEntity getRootEntity() {
        return root;
    }
}

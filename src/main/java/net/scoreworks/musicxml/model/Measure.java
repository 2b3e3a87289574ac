/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;
import net.scoreworks.musicxml.tree.exceptions.IllegalScoreModelException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A measure of the whole score. Measures of different parts that share the same position are merged into one, so a
 * measure owns the staves of all parts. Its number is taken from the document and is not necessarily unique.
 */
public class Measure extends Child<Section> implements ControlElementOwner {
    final List<Staff> staves = new ArrayList<>();
    final List<ControlElement> controlElements = new ArrayList<>();

    private final int n;
    private BarRendition left = BarRendition.NONE;
    private BarRendition right = BarRendition.NONE;

    public Measure(Section section, int n) {
        super(section);
        this.n = n;
    }

    protected void addToOwner() {
        getOwner().measures.add(this);
    }
    protected void removeFromOwner() {
        getOwner().measures.remove(this);
    }

    public int getN() {
        return n;
    }

    public BarRendition getLeft() {
        return left;
    }

    public void setLeft(BarRendition left) {
        this.left = left;
    }

    public BarRendition getRight() {
        return right;
    }

    public void setRight(BarRendition right) {
        this.right = right;
    }

    public List<Staff> getStaves() {
        return Collections.unmodifiableList(staves);
    }

    public int getStaffCount() {
        return staves.size();
    }

    public Staff getStaff(int idx) {
        return staves.get(idx);
    }

    /**
     * @return the staff with the given global number or null
     */
    public Staff findStaffByN(int n) {
        for (Staff staff : staves) {
            if (staff.getN() == n)
                return staff;
        }
        return null;
    }

    /**
     * Move all staves of another measure into this one, keeping their order. The other measure is left empty
     */
    public void takeStavesFrom(Measure other) {
        if (other == this)
            throw new IllegalScoreModelException(getClass(), "can't take staves from itself");
        for (Staff staff : new ArrayList<>(other.staves)) {
            staff.moveTo(this);
        }
    }

    @Override
    public List<ControlElement> getControlElements() {
        return Collections.unmodifiableList(controlElements);
    }

    @Override
    public void attachControlElement(ControlElement element) {
        controlElements.add(element);
    }

    @Override
    public void detachControlElement(ControlElement element) {
        controlElements.remove(element);
    }

    @Override
    public List<? extends Child<?>> getChildren() {
        List<Child<?>> children = new ArrayList<>(staves);
        children.addAll(controlElements);
        return children;
    }
}

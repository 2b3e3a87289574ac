/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;
import org.jetbrains.annotations.Nullable;

/**
 * Annotation that is not part of a layer but points at layer elements through references of the form
 * {@code #<id>}. A control element remembers the number of the measure it was read in and is created with the
 * {@link Score} as owner until it is moved into that measure.
 */
public abstract class ControlElement extends Child<ControlElementOwner> {
    private final int measureN;

    private String startId;
    private String endId;
    private Integer staff;
    private Integer tstamp;
    private StaffRel place = StaffRel.NONE;
    private String color;

    protected ControlElement(ControlElementOwner owner, int measureN) {
        super(owner);
        this.measureN = measureN;
    }

    protected void addToOwner() {
        getOwner().attachControlElement(this);
    }
    protected void removeFromOwner() {
        getOwner().detachControlElement(this);
    }

    /**
     * @return number of the measure this element belongs to
     */
    public int getMeasureN() {
        return measureN;
    }

    @Nullable
    public String getStartId() {
        return startId;
    }

    public void setStartId(@Nullable String startId) {
        this.startId = startId;
    }

    public boolean hasStartId() {
        return startId != null;
    }

    @Nullable
    public String getEndId() {
        return endId;
    }

    public void setEndId(@Nullable String endId) {
        this.endId = endId;
    }

    public boolean hasEndId() {
        return endId != null;
    }

    /**
     * @return global number of the staff this element refers to
     */
    @Nullable
    public Integer getStaff() {
        return staff;
    }

    public void setStaff(@Nullable Integer staff) {
        this.staff = staff;
    }

    /**
     * @return beat position within the measure, only used when there is no start reference
     */
    @Nullable
    public Integer getTstamp() {
        return tstamp;
    }

    public void setTstamp(@Nullable Integer tstamp) {
        this.tstamp = tstamp;
    }

    public StaffRel getPlace() {
        return place;
    }

    public void setPlace(StaffRel place) {
        this.place = place;
    }

    @Nullable
    public String getColor() {
        return color;
    }

    public void setColor(@Nullable String color) {
        this.color = color;
    }

    public abstract <R> R accept(ControlElementVisitor<R> visitor);
}

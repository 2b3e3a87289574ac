/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

public class Tuplet extends ContainerElement {

    public enum NumFormat {
        COUNT, RATIO, NONE
    }

    private Integer num;
    private Integer numbase;
    private Place numPlace = Place.NONE;
    private Place bracketPlace = Place.NONE;
    private NumFormat numFormat = NumFormat.NONE;
    private Boolean numVisible;
    private Boolean bracketVisible;

    public Tuplet(LayerElementContainer owner) {
        super(owner);
    }

    @Nullable
    public Integer getNum() {
        return num;
    }

    public void setNum(@Nullable Integer num) {
        this.num = num;
    }

    @Nullable
    public Integer getNumbase() {
        return numbase;
    }

    public void setNumbase(@Nullable Integer numbase) {
        this.numbase = numbase;
    }

    public Place getNumPlace() {
        return numPlace;
    }

    public void setNumPlace(Place numPlace) {
        this.numPlace = numPlace;
    }

    public Place getBracketPlace() {
        return bracketPlace;
    }

    public void setBracketPlace(Place bracketPlace) {
        this.bracketPlace = bracketPlace;
    }

    public NumFormat getNumFormat() {
        return numFormat;
    }

    public void setNumFormat(NumFormat numFormat) {
        this.numFormat = numFormat;
    }

    @Nullable
    public Boolean getNumVisible() {
        return numVisible;
    }

    public void setNumVisible(@Nullable Boolean numVisible) {
        this.numVisible = numVisible;
    }

    @Nullable
    public Boolean getBracketVisible() {
        return bracketVisible;
    }

    public void setBracketVisible(@Nullable Boolean bracketVisible) {
        this.bracketVisible = bracketVisible;
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitTuplet(this);
    }
}

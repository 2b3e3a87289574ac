/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Octave shift bracket (ottava). The referenced notes are written with the displacement already applied
 */
public class Octave extends ControlElement {
    private OctaveDis dis = OctaveDis.NONE;
    private Place disPlace = Place.NONE;

    public Octave(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    public OctaveDis getDis() {
        return dis;
    }

    public void setDis(OctaveDis dis) {
        this.dis = dis;
    }

    public Place getDisPlace() {
        return disPlace;
    }

    public void setDisPlace(Place disPlace) {
        this.disPlace = disPlace;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitOctave(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Clef change within a measure
 */
public class Clef extends LayerElement {
    private ClefShape shape = ClefShape.NONE;
    private int line;
    private OctaveDis dis = OctaveDis.NONE;
    private Place disPlace = Place.NONE;

    public Clef(LayerElementContainer owner) {
        super(owner);
    }

    public ClefShape getShape() {
        return shape;
    }

    public void setShape(ClefShape shape) {
        this.shape = shape;
    }

    public int getLine() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
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
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitClef(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Slur extends ControlElement {
    private CurveDir curvedir = CurveDir.NONE;

    public Slur(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    public CurveDir getCurvedir() {
        return curvedir;
    }

    public void setCurvedir(CurveDir curvedir) {
        this.curvedir = curvedir;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitSlur(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Tie extends ControlElement {
    private CurveDir curvedir = CurveDir.NONE;

    public Tie(ControlElementOwner owner, int measureN) {
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
        return visitor.visitTie(this);
    }
}

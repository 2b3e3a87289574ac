/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Fermata extends ControlElement {

    public enum Shape {
        CURVED, ANGULAR, SQUARE, NONE
    }

    public enum Form {
        NORM, INV, NONE
    }

    private Shape shape = Shape.NONE;
    private Form form = Form.NONE;

    public Fermata(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    public Shape getShape() {
        return shape;
    }

    public void setShape(Shape shape) {
        this.shape = shape;
    }

    public Form getForm() {
        return form;
    }

    public void setForm(Form form) {
        this.form = form;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitFermata(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Turn extends ControlElement {

    public enum Form {
        NORM, INV
    }

    private Form form = Form.NORM;

    public Turn(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    public Form getForm() {
        return form;
    }

    public void setForm(Form form) {
        this.form = form;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitTurn(this);
    }
}

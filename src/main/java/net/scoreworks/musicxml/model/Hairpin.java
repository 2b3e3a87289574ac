/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Hairpin extends ControlElement {

    public enum Form {
        CRES, DIM, NONE
    }

    private Form form = Form.NONE;

    public Hairpin(ControlElementOwner owner, int measureN) {
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
        return visitor.visitHairpin(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

public class Mordent extends ControlElement {

    public enum Form {
        NORM, INV
    }

    private Form form = Form.NORM;
    private Boolean longMordent;

    public Mordent(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    public Form getForm() {
        return form;
    }

    public void setForm(Form form) {
        this.form = form;
    }

    @Nullable
    public Boolean getLong() {
        return longMordent;
    }

    public void setLong(@Nullable Boolean longMordent) {
        this.longMordent = longMordent;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitMordent(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Trill extends ControlElement {

    public Trill(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitTrill(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public class Pedal extends ControlElement {

    public enum Dir {
        DOWN, UP, NONE
    }

    private Dir dir = Dir.NONE;

    public Pedal(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    public Dir getDir() {
        return dir;
    }

    public void setDir(Dir dir) {
        this.dir = dir;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitPedal(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Textual direction like "dolce" or "rit."
 */
public class Dir extends TextDirective {

    public Dir(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitDir(this);
    }
}

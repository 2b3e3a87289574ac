/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

/**
 * Harmony symbol, e.g. a chord name
 */
public class Harm extends TextDirective {
    private String type;

    public Harm(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    @Nullable
    public String getType() {
        return type;
    }

    public void setType(@Nullable String type) {
        this.type = type;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitHarm(this);
    }
}

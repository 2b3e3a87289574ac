/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Invisible placeholder taking up time in a layer
 */
public class Space extends LayerElement implements HasDuration {
    private Duration dur = Duration.NONE;

    public Space(LayerElementContainer owner) {
        super(owner);
    }

    public Space(LayerElementContainer owner, Duration dur) {
        super(owner);
        this.dur = dur;
    }

    @Override
    public Duration getDur() {
        return dur;
    }

    public void setDur(Duration dur) {
        this.dur = dur;
    }

    @Override
    public int getDots() {
        return 0;
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitSpace(this);
    }
}

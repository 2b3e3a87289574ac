/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

public class Rest extends LayerElement implements HasDuration {
    private Duration dur = Duration.NONE;
    private int dots;
    private boolean cue;
    private PitchName ploc = PitchName.NONE;
    private Integer oloc;

    public Rest(LayerElementContainer owner) {
        super(owner);
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
        return dots;
    }

    public void setDots(int dots) {
        this.dots = dots;
    }

    public boolean isCue() {
        return cue;
    }

    public void setCue(boolean cue) {
        this.cue = cue;
    }

    /**
     * @return displayed step of the rest
     */
    public PitchName getPloc() {
        return ploc;
    }

    public void setPloc(PitchName ploc) {
        this.ploc = ploc;
    }

    @Nullable
    public Integer getOloc() {
        return oloc;
    }

    public void setOloc(@Nullable Integer oloc) {
        this.oloc = oloc;
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitRest(this);
    }
}

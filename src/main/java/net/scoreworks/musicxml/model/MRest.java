/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

/**
 * Rest lasting the whole measure, regardless of the meter
 */
public class MRest extends LayerElement {
    private boolean cue;
    private PitchName ploc = PitchName.NONE;
    private Integer oloc;
    private Boolean visible;

    public MRest(LayerElementContainer owner) {
        super(owner);
    }

    public boolean isCue() {
        return cue;
    }

    public void setCue(boolean cue) {
        this.cue = cue;
    }

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

    @Nullable
    public Boolean getVisible() {
        return visible;
    }

    public void setVisible(@Nullable Boolean visible) {
        this.visible = visible;
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitMRest(this);
    }
}

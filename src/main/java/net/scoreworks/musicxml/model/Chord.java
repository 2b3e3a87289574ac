/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Notes sounding at the same onset. Rhythmic and stem attributes are kept on the chord rather than on its notes
 */
public class Chord extends ContainerElement implements HasDuration {
    private Duration dur = Duration.NONE;
    private int dots;
    private StemDirection stemDir = StemDirection.NONE;
    private StemModifier stemMod = StemModifier.NONE;
    private boolean cue;

    public Chord(LayerElementContainer owner) {
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

    public StemDirection getStemDir() {
        return stemDir;
    }

    public void setStemDir(StemDirection stemDir) {
        this.stemDir = stemDir;
    }

    public StemModifier getStemMod() {
        return stemMod;
    }

    public void setStemMod(StemModifier stemMod) {
        this.stemMod = stemMod;
    }

    public boolean isCue() {
        return cue;
    }

    public void setCue(boolean cue) {
        this.cue = cue;
    }

    public List<Note> getNotes() {
        List<Note> notes = new ArrayList<>();
        for (LayerElement element : getLayerElements()) {
            if (element instanceof Note)
                notes.add((Note) element);
        }
        return notes;
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitChord(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

public class Tempo extends TextDirective {
    private Integer mm;
    private Duration mmUnit = Duration.NONE;
    private int mmDots;
    private Integer midiBpm;

    public Tempo(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    /**
     * @return metronome value in beats per minute of {@link #getMmUnit()}
     */
    @Nullable
    public Integer getMm() {
        return mm;
    }

    public void setMm(@Nullable Integer mm) {
        this.mm = mm;
    }

    public Duration getMmUnit() {
        return mmUnit;
    }

    public void setMmUnit(Duration mmUnit) {
        this.mmUnit = mmUnit;
    }

    public int getMmDots() {
        return mmDots;
    }

    public void setMmDots(int mmDots) {
        this.mmDots = mmDots;
    }

    @Nullable
    public Integer getMidiBpm() {
        return midiBpm;
    }

    public void setMidiBpm(@Nullable Integer midiBpm) {
        this.midiBpm = midiBpm;
    }

    @Override
    public <R> R accept(ControlElementVisitor<R> visitor) {
        return visitor.visitTempo(this);
    }
}

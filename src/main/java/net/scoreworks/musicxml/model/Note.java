/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pitched note. Duration, dots, stem and cue size are only set when the note is not part of a {@link Chord},
 * otherwise the chord carries them.
 */
public class Note extends LayerElement implements HasDuration {

    public enum Grace {
        UNSPECIFIED, UNSLASHED, SLASHED
    }

    private final List<Verse> verses = new ArrayList<>();

    private PitchName pname = PitchName.NONE;
    private int oct;
    private Integer octGes;
    private Accid accid;
    private Duration dur = Duration.NONE;
    private int dots;
    private StemDirection stemDir = StemDirection.NONE;
    private StemModifier stemMod = StemModifier.NONE;
    private boolean cue;
    private Grace grace;
    private Boolean visible;
    private String color;

    public Note(LayerElementContainer owner) {
        super(owner);
    }

    public PitchName getPname() {
        return pname;
    }

    public void setPname(PitchName pname) {
        this.pname = pname;
    }

    /**
     * @return the written octave
     */
    public int getOct() {
        return oct;
    }

    public void setOct(int oct) {
        this.oct = oct;
    }

    /**
     * @return the sounding octave if it differs from the written one because of an octave shift, else null
     */
    @Nullable
    public Integer getOctGes() {
        return octGes;
    }

    public void setOctGes(@Nullable Integer octGes) {
        this.octGes = octGes;
    }

    @Nullable
    public Accid getAccid() {
        return accid;
    }

    public void setAccid(@Nullable Accid accid) {
        this.accid = accid;
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

    /**
     * @return the grace type or null if this is not a grace note
     */
    @Nullable
    public Grace getGrace() {
        return grace;
    }

    public void setGrace(@Nullable Grace grace) {
        this.grace = grace;
    }

    @Nullable
    public Boolean getVisible() {
        return visible;
    }

    public void setVisible(@Nullable Boolean visible) {
        this.visible = visible;
    }

    @Nullable
    public String getColor() {
        return color;
    }

    public void setColor(@Nullable String color) {
        this.color = color;
    }

    public List<Verse> getVerses() {
        return Collections.unmodifiableList(verses);
    }

    public void addVerse(Verse verse) {
        verses.add(verse);
    }

    /**
     * @return the chord this note belongs to or null
     */
    @Nullable
    public Chord getChord() {
        return getOwner() instanceof Chord ? (Chord) getOwner() : null;
    }

    @Override
    public <R> R accept(LayerElementVisitor<R> visitor) {
        return visitor.visitNote(this);
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.collection.HashStack;
import net.scoreworks.musicxml.model.ControlElement;
import net.scoreworks.musicxml.model.Hairpin;
import net.scoreworks.musicxml.model.Note;
import net.scoreworks.musicxml.model.Octave;
import net.scoreworks.musicxml.model.PitchName;
import net.scoreworks.musicxml.model.Slur;
import net.scoreworks.musicxml.model.Tie;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Pairs the start and end of spanning control elements that can be arbitrarily far apart in the document, and hands
 * the reference of the next note read to control elements that precede it.
 * <p>
 * Ties match on staff, layer, pitch name and octave. Slurs match on staff, layer and number, hairpins on number only.
 * Octave shifts are tracked per staff together with the octave displacement they apply to subsequent notes.
 * Directions, dynamics, harmonies, tempos, pedals and octave shifts wait in pending stacks until the next note or
 * rest is read.
 */
public class CrossReferenceResolver {

    private static final class OpenTie {
        final Tie tie;
        final int staffN;
        final int layerN;
        final PitchName pname;
        final int oct;

        OpenTie(Tie tie, int staffN, int layerN, PitchName pname, int oct) {
            this.tie = tie;
            this.staffN = staffN;
            this.layerN = layerN;
            this.pname = pname;
            this.oct = oct;
        }
    }

    private static final class OpenSlur {
        final Slur slur;
        final int staffN;
        final int layerN;
        final int number;

        OpenSlur(Slur slur, int staffN, int layerN, int number) {
            this.slur = slur;
            this.staffN = staffN;
            this.layerN = layerN;
            this.number = number;
        }
    }

    private static final class OpenHairpin {
        final Hairpin hairpin;
        final int number;
        String endId;

        OpenHairpin(Hairpin hairpin, int number) {
            this.hairpin = hairpin;
            this.number = number;
        }
    }

    private final ImportWarnings warnings;

    private final List<OpenTie> openTies = new ArrayList<>();
    private final List<OpenSlur> openSlurs = new ArrayList<>();
    private final List<OpenHairpin> openHairpins = new ArrayList<>();

    /** control elements waiting for the next note, by type */
    private final HashStack<Class<? extends ControlElement>, ControlElement> pending = new HashStack<>();

    /** octave shifts that are not stopped yet, by global staff number */
    private final HashStack<Integer, Octave> openOctaves = new HashStack<>();

    /** octave displacement applied to notes read, by global staff number */
    private final Map<Integer, Integer> octaveDisplacement = new HashMap<>();

    public CrossReferenceResolver(ImportWarnings warnings) {
        this.warnings = warnings;
    }

    //=====TIES=====================================================================================

    /**
     * Record a tie starting at the given note
     */
    public void openTie(Tie tie, int staffN, int layerN, Note note) {
        tie.setStartId(note.getReference());
        openTies.add(new OpenTie(tie, staffN, layerN, note.getPname(), note.getOct()));
    }

    /**
     * Close the first open tie with the same staff, layer, pitch name and octave as the note. A match is closed even
     * if the note has no tie stop
     * @param isClosingTie whether the note carries a tie stop
     * @return the closed tie or null if nothing matched
     */
    @Nullable
    public Tie closeTie(int staffN, int layerN, Note note, boolean isClosingTie) {
        Iterator<OpenTie> it = openTies.iterator();
        while (it.hasNext()) {
            OpenTie openTie = it.next();
            if (openTie.staffN == staffN && openTie.layerN == layerN && openTie.pname == note.getPname()
                    && openTie.oct == note.getOct()) {
                openTie.tie.setEndId(note.getReference());
                it.remove();
                if (!isClosingTie)
                    warnings.warn("Closing tie for note '{}' even though the tie stop is missing", note.getObjectId());
                return openTie.tie;
            }
        }
        return null;
    }

    public int getOpenTieCount() {
        return openTies.size();
    }

    //=====SLURS====================================================================================

    /**
     * Record a slur starting at the given element reference. No staff is set on the slur as it may end on another
     * staff
     */
    public void openSlur(Slur slur, int staffN, int layerN, int number, String startRef) {
        slur.setStartId(startRef);
        openSlurs.add(new OpenSlur(slur, staffN, layerN, number));
    }

    /**
     * @return the closed slur or null if no open slur matched, which is warned
     */
    @Nullable
    public Slur closeSlur(int staffN, int layerN, int number, String endRef) {
        Iterator<OpenSlur> it = openSlurs.iterator();
        while (it.hasNext()) {
            OpenSlur openSlur = it.next();
            if (openSlur.staffN == staffN && openSlur.layerN == layerN && openSlur.number == number) {
                openSlur.slur.setEndId(endRef);
                it.remove();
                return openSlur.slur;
            }
        }
        warnings.warn("Closing slur for element '{}' could not be matched", endRef);
        return null;
    }

    public int getOpenSlurCount() {
        return openSlurs.size();
    }

    //=====HAIRPINS=================================================================================

    public void openHairpin(Hairpin hairpin, int number) {
        openHairpins.add(new OpenHairpin(hairpin, number));
    }

    /**
     * Close the first open hairpin with the given number. Its end is the last element read while it was open
     * @return the closed hairpin or null if nothing matched
     */
    @Nullable
    public Hairpin closeHairpin(int number) {
        Iterator<OpenHairpin> it = openHairpins.iterator();
        while (it.hasNext()) {
            OpenHairpin openHairpin = it.next();
            if (openHairpin.number == number) {
                openHairpin.hairpin.setEndId(openHairpin.endId);
                it.remove();
                return openHairpin.hairpin;
            }
        }
        warnings.warn("Closing hairpin {} could not be matched", number);
        return null;
    }

    public int getOpenHairpinCount() {
        return openHairpins.size();
    }

    //=====OCTAVE SHIFTS============================================================================

    /**
     * Start an octave shift on a staff. Notes read on that staff from now on are displaced by the given number of
     * octaves
     */
    public void openOctave(Octave octave, int staffN, int displacement) {
        octaveDisplacement.put(staffN, displacement);
        openOctaves.pushValue(staffN, octave);
    }

    /**
     * Stop the octave shift of a staff. The most recently opened octave still open on that staff ends at the given
     * reference
     * @return the closed octave or null if none was open
     */
    @Nullable
    public Octave closeOctave(int staffN, @Nullable String endRef) {
        octaveDisplacement.remove(staffN);
        Octave octave = openOctaves.popValue(staffN);
        if (octave == null) {
            warnings.warn("Octave shift stop on staff {} without matching start", staffN);
            return null;
        }
        octave.setEndId(endRef);
        return octave;
    }

    /**
     * @return displacement in octaves for notes on the given staff, 0 if no shift is active
     */
    public int getOctaveDisplacement(int staffN) {
        return octaveDisplacement.getOrDefault(staffN, 0);
    }

    //=====PENDING START REFERENCES=================================================================

    /**
     * Let a control element wait for the next note or rest
     */
    public void addPending(ControlElement element) {
        pending.pushValue(element.getClass(), element);
    }

    public int getPendingCount(Class<? extends ControlElement> type) {
        return pending.getStackSize(type);
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    /**
     * A note or rest has been read: all pending control elements start at it and the pending stacks are emptied.
     * Open hairpins without start get it as start, and all open hairpins extend to it
     * @param startRef reference of the element read
     * @param staffN global number of its staff
     */
    public void elementRead(String startRef, int staffN) {
        for (ControlElement element : pending.allValues()) {
            element.setStaff(staffN);
            element.setStartId(startRef);
        }
        pending.clearStacks();
        for (OpenHairpin openHairpin : openHairpins) {
            if (!openHairpin.hairpin.hasStartId()) {
                openHairpin.hairpin.setStaff(staffN);
                openHairpin.hairpin.setStartId(startRef);
            }
            openHairpin.endId = startRef;
        }
    }
}

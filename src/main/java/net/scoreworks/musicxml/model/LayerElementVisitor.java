/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Exhaustive dispatch over all concrete {@link LayerElement} types
 * @param <R> result type
 */
public interface LayerElementVisitor<R> {

    R visitNote(Note note);

    R visitRest(Rest rest);

    R visitMRest(MRest mRest);

    R visitSpace(Space space);

    R visitClef(Clef clef);

    R visitMRpt(MRpt mRpt);

    R visitChord(Chord chord);

    R visitBeam(Beam beam);

    R visitTuplet(Tuplet tuplet);

    R visitBTrem(BTrem bTrem);

    R visitFTrem(FTrem fTrem);
}

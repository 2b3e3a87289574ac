/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Exhaustive dispatch over all concrete {@link ControlElement} types
 * @param <R> result type
 */
public interface ControlElementVisitor<R> {

    R visitTie(Tie tie);

    R visitSlur(Slur slur);

    R visitHairpin(Hairpin hairpin);

    R visitDir(Dir dir);

    R visitDynam(Dynam dynam);

    R visitHarm(Harm harm);

    R visitTempo(Tempo tempo);

    R visitPedal(Pedal pedal);

    R visitFermata(Fermata fermata);

    R visitOctave(Octave octave);

    R visitMordent(Mordent mordent);

    R visitTrill(Trill trill);

    R visitTurn(Turn turn);
}

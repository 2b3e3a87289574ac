/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.apache.commons.lang3.math.Fraction;

/**
 * Written duration of an event. The value is given relative to a whole note.
 */
public enum Duration {
    MAXIMA(Fraction.getFraction(8, 1)),
    LONG(Fraction.getFraction(4, 1)),
    BREVE(Fraction.getFraction(2, 1)),
    WHOLE(Fraction.ONE),
    HALF(Fraction.ONE_HALF),
    QUARTER(Fraction.ONE_QUARTER),
    EIGHTH(Fraction.getFraction(1, 8)),
    SIXTEENTH(Fraction.getFraction(1, 16)),
    THIRTY_SECOND(Fraction.getFraction(1, 32)),
    SIXTY_FOURTH(Fraction.getFraction(1, 64)),
    HUNDRED_TWENTY_EIGHTH(Fraction.getFraction(1, 128)),
    TWO_HUNDRED_FIFTY_SIXTH(Fraction.getFraction(1, 256)),
    NONE(Fraction.ZERO);

    private final Fraction value;

    Duration(Fraction value) {
        this.value = value;
    }

    /**
     * @return length relative to a whole note, zero for {@link #NONE}
     */
    public Fraction getValue() {
        return value;
    }

    /**
     * @return length including augmentation dots, each dot adding half of the previous addition
     */
    public Fraction getValue(int dots) {
        Fraction total = value;
        Fraction addition = value;
        for (int i=0; i<dots; i++) {
            addition = addition.divideBy(Fraction.getFraction(2, 1));
            total = total.add(addition);
        }
        return total;
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.apache.commons.lang3.math.Fraction;

/**
 * Implemented by layer elements that carry a written duration
 */
public interface HasDuration {

    Duration getDur();

    int getDots();

    /**
     * @return the dotted length relative to a whole note
     */
    default Fraction getValue() {
        return getDur().getValue(getDots());
    }
}

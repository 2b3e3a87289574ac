/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Written accidentals
 */
public enum AccidentalExplicit {
    SHARP, NATURAL, FLAT, DOUBLE_SHARP, SHARP_SHARP, FLAT_FLAT, NATURAL_SHARP, NATURAL_FLAT,
    QUARTER_FLAT, QUARTER_SHARP, THREE_QUARTERS_FLAT, THREE_QUARTERS_SHARP, NONE
}

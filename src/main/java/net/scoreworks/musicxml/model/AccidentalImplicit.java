/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Sounding (gestural) accidentals implied by a pitch alteration
 */
public enum AccidentalImplicit {
    /** -2 */ DOUBLE_FLAT,
    /** -1.5 */ FLAT_DOWN,
    /** -1 */ FLAT,
    /** -0.5 */ FLAT_UP,
    /** 0 */ NATURAL,
    /** 0.5 */ SHARP_DOWN,
    /** 1 */ SHARP,
    /** 1.5 */ SHARP_UP,
    /** 2 */ DOUBLE_SHARP,
    NONE
}

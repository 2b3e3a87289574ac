/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Size of an octave displacement in scale steps, as used by clefs and ottava lines
 */
public enum OctaveDis {
    DIS_8, DIS_15, DIS_22, NONE
}

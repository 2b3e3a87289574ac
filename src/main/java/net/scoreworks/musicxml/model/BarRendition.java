/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public enum BarRendition {
    SINGLE, DASHED, DOTTED, DBL, END, INVIS, RPTSTART, RPTEND, NONE
}

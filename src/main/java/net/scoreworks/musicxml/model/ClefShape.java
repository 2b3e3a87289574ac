/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public enum ClefShape {
    G, F, C, PERC, TAB, NONE
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public enum PitchName {
    C, D, E, F, G, A, B, NONE
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public enum Articulation {
    ACC, TEN, STACC, STACCISS, SPICC, MARC, TEN_STACC,
    DNBOW, UPBOW, HARM, OPEN, SNAP, STOP,
    NONE
}

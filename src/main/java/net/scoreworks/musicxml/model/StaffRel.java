/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Placement of an annotation relative to the staff
 */
public enum StaffRel {
    ABOVE, BELOW, BETWEEN, WITHIN, NONE
}

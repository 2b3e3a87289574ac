/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

public interface StaffGroupVisitor<R> {

    R visitStaffGroup(StaffGroup staffGroup);

    R visitStaffDef(StaffDef staffDef);
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Node of the staff group tree: either a {@link StaffDef} leaf or a nested {@link StaffGroup}
 */
public interface StaffGroupMember {

    <R> R accept(StaffGroupVisitor<R> visitor);
}

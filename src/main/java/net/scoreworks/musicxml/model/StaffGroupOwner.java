/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.ScoreObject;

import java.util.List;

/**
 * Owner of {@link StaffGroupMember}s: the {@link Score} (for the root group) or a {@link StaffGroup}
 */
public interface StaffGroupOwner extends ScoreObject {

    List<StaffGroupMember> getMembers();

    /** Invoked by a member that has this as its new owner */
    void attachMember(StaffGroupMember member);

    /** Invoked by a member that leaves this owner */
    void detachMember(StaffGroupMember member);
}

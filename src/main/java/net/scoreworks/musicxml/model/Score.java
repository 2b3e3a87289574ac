/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;
import net.scoreworks.musicxml.tree.RootEntity;
import net.scoreworks.musicxml.tree.exceptions.IllegalScoreModelException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of the score tree. Owns the static staff definitions (a single root {@link StaffGroup}), exactly one
 * {@link Section} holding the measures and, while a conversion is running, the control elements that have not been
 * attached to their measure yet.
 */
public class Score extends RootEntity implements StaffGroupOwner, ControlElementOwner {
    StaffGroup staffGroup;
    Section section;
    final List<ControlElement> floatingControlElements = new ArrayList<>();

    private String title;
    private Integer midiBpm;

    @Nullable
    public StaffGroup getStaffGroup() {
        return staffGroup;
    }

    @Nullable
    public Section getSection() {
        return section;
    }

    @Nullable
    public String getTitle() {
        return title;
    }

    public void setTitle(@Nullable String title) {
        this.title = title;
    }

    @Nullable
    public Integer getMidiBpm() {
        return midiBpm;
    }

    public void setMidiBpm(@Nullable Integer midiBpm) {
        this.midiBpm = midiBpm;
    }

    /**
     * @return true if no content has been added to this score yet
     */
    public boolean isEmpty() {
        return staffGroup == null && section == null && floatingControlElements.isEmpty();
    }

    //=====OWNER====================================================================================

    @Override
    public List<StaffGroupMember> getMembers() {
        if (staffGroup == null)
            return Collections.emptyList();
        return Collections.singletonList(staffGroup);
    }

    @Override
    public void attachMember(StaffGroupMember member) {
        if (!(member instanceof StaffGroup))
            throw new IllegalScoreModelException(member.getClass(), "can't be the root of the staff group tree");
        if (staffGroup != null && staffGroup != member)
            throw new IllegalScoreModelException(member.getClass(), "can't be added, score already has a root staff group");
        staffGroup = (StaffGroup) member;
    }

    @Override
    public void detachMember(StaffGroupMember member) {
        if (staffGroup == member)
            staffGroup = null;
    }

    /**
     * @return control elements that are not attached to a measure
     */
    @Override
    public List<ControlElement> getControlElements() {
        return Collections.unmodifiableList(floatingControlElements);
    }

    @Override
    public void attachControlElement(ControlElement element) {
        floatingControlElements.add(element);
    }

    @Override
    public void detachControlElement(ControlElement element) {
        floatingControlElements.remove(element);
    }

    @Override
    public List<? extends Child<?>> getChildren() {
        List<Child<?>> children = new ArrayList<>();
        if (staffGroup != null)
            children.add(staffGroup);
        if (section != null)
            children.add(section);
        children.addAll(floatingControlElements);
        return children;
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the static staff definition tree. Either the root group of a {@link Score}, a part-group of the document
 * or the brace that wraps the staves of a multi-staff part.
 */
public class StaffGroup extends Child<StaffGroupOwner> implements StaffGroupOwner, StaffGroupMember {

    public enum GroupSymbol {
        BRACE, BRACKET, LINE, NONE
    }

    final List<StaffGroupMember> members = new ArrayList<>();

    private GroupSymbol symbol = GroupSymbol.NONE;
    private String label;
    private String labelAbbr;
    private boolean barThru;

    public StaffGroup(StaffGroupOwner owner) {
        super(owner);
    }

    protected void addToOwner() {
        getOwner().attachMember(this);
    }
    protected void removeFromOwner() {
        getOwner().detachMember(this);
    }

    public GroupSymbol getSymbol() {
        return symbol;
    }

    public void setSymbol(GroupSymbol symbol) {
        this.symbol = symbol;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getLabelAbbr() {
        return labelAbbr;
    }

    public void setLabelAbbr(String labelAbbr) {
        this.labelAbbr = labelAbbr;
    }

    public boolean isBarThru() {
        return barThru;
    }

    public void setBarThru(boolean barThru) {
        this.barThru = barThru;
    }

    /**
     * @return all staff definitions below this group in depth-first order
     */
    public List<StaffDef> getStaffDefs() {
        List<StaffDef> staffDefs = new ArrayList<>();
        collectStaffDefs(this, staffDefs);
        return staffDefs;
    }
    private static void collectStaffDefs(StaffGroup group, List<StaffDef> result) {
        for (StaffGroupMember member : group.members) {
            if (member instanceof StaffDef)
                result.add((StaffDef) member);
            else
                collectStaffDefs((StaffGroup) member, result);
        }
    }

    @Override
    public List<StaffGroupMember> getMembers() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public void attachMember(StaffGroupMember member) {
        members.add(member);
    }

    @Override
    public void detachMember(StaffGroupMember member) {
        members.remove(member);
    }

    @Override
    public <R> R accept(StaffGroupVisitor<R> visitor) {
        return visitor.visitStaffGroup(this);
    }

    @Override
    public List<? extends Child<?>> getChildren() {
        List<Child<?>> children = new ArrayList<>();
        for (StaffGroupMember member : members) {
            children.add((Child<?>) member);
        }
        return children;
    }
}

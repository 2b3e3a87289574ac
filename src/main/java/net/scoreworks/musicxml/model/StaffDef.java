/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.IndexedChild;

/**
 * Static attributes of one staff. The index is the global staff number, unique across all parts of the score.
 */
public class StaffDef extends IndexedChild<StaffGroupOwner> implements StaffGroupMember {

    public enum MeterSym {
        COMMON, CUT, NONE
    }

    public enum MeterRend {
        NORM, NUM, NONE
    }

    public enum NotationType {
        CMN, TAB
    }

    private ClefShape clefShape = ClefShape.NONE;
    private int clefLine;
    private OctaveDis clefDis = OctaveDis.NONE;
    private Place clefDisPlace = Place.NONE;
    private Integer keyFifths;
    private boolean mixedKey;
    private KeyMode keyMode = KeyMode.NONE;
    private MeterSym meterSym = MeterSym.NONE;
    private MeterRend meterRend = MeterRend.NONE;
    private int meterCount;
    private int meterUnit;
    private int lines = 5;
    private Integer scale;
    private Integer transDiat;
    private Integer transSemi;
    private NotationType notationType = NotationType.CMN;
    private int ppq;
    private String label;
    private String labelAbbr;

    public StaffDef(StaffGroupOwner owner, int n) {
        super(owner, n);
    }

    protected void addToOwner() {
        getOwner().attachMember(this);
    }
    protected void removeFromOwner() {
        getOwner().detachMember(this);
    }

    public int getN() {
        return getIndex();
    }

    public ClefShape getClefShape() {
        return clefShape;
    }

    public void setClefShape(ClefShape clefShape) {
        this.clefShape = clefShape;
    }

    public int getClefLine() {
        return clefLine;
    }

    public void setClefLine(int clefLine) {
        this.clefLine = clefLine;
    }

    public OctaveDis getClefDis() {
        return clefDis;
    }

    public void setClefDis(OctaveDis clefDis) {
        this.clefDis = clefDis;
    }

    public Place getClefDisPlace() {
        return clefDisPlace;
    }

    public void setClefDisPlace(Place clefDisPlace) {
        this.clefDisPlace = clefDisPlace;
    }

    /**
     * @return number of fifths of the key signature (negative for flats) or null if none or a mixed key was given
     */
    public Integer getKeyFifths() {
        return keyFifths;
    }

    public void setKeyFifths(Integer keyFifths) {
        this.keyFifths = keyFifths;
    }

    public boolean isMixedKey() {
        return mixedKey;
    }

    public void setMixedKey(boolean mixedKey) {
        this.mixedKey = mixedKey;
    }

    public KeyMode getKeyMode() {
        return keyMode;
    }

    public void setKeyMode(KeyMode keyMode) {
        this.keyMode = keyMode;
    }

    public MeterSym getMeterSym() {
        return meterSym;
    }

    public void setMeterSym(MeterSym meterSym) {
        this.meterSym = meterSym;
    }

    public MeterRend getMeterRend() {
        return meterRend;
    }

    public void setMeterRend(MeterRend meterRend) {
        this.meterRend = meterRend;
    }

    public int getMeterCount() {
        return meterCount;
    }

    public void setMeterCount(int meterCount) {
        this.meterCount = meterCount;
    }

    public int getMeterUnit() {
        return meterUnit;
    }

    public void setMeterUnit(int meterUnit) {
        this.meterUnit = meterUnit;
    }

    public int getLines() {
        return lines;
    }

    public void setLines(int lines) {
        this.lines = lines;
    }

    /**
     * @return display scale in percent or null for default size
     */
    public Integer getScale() {
        return scale;
    }

    public void setScale(Integer scale) {
        this.scale = scale;
    }

    public Integer getTransDiat() {
        return transDiat;
    }

    public void setTransDiat(Integer transDiat) {
        this.transDiat = transDiat;
    }

    public Integer getTransSemi() {
        return transSemi;
    }

    public void setTransSemi(Integer transSemi) {
        this.transSemi = transSemi;
    }

    public NotationType getNotationType() {
        return notationType;
    }

    public void setNotationType(NotationType notationType) {
        this.notationType = notationType;
    }

    /**
     * @return divisions per quarter note this staff was read with
     */
    public int getPpq() {
        return ppq;
    }

    public void setPpq(int ppq) {
        this.ppq = ppq;
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

    @Override
    public <R> R accept(StaffGroupVisitor<R> visitor) {
        return visitor.visitStaffDef(this);
    }
}

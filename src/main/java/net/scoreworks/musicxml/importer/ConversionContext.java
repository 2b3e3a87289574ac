/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Score;
import nu.xom.Element;

import java.util.HashSet;
import java.util.Set;

/**
 * All mutable state of one conversion. Each import creates its own context, so conversions of different documents
 * don't share anything.
 */
public class ConversionContext {
    private final Score score;
    private final ImportWarnings warnings;
    private final Vocabulary vocabulary;
    private final LayerSelector layerSelector;
    private final NestingStack nestingStack = new NestingStack();
    private final DurationCursor durationCursor = new DurationCursor();
    private final CrossReferenceResolver resolver;

    /** attribute blocks consumed while reading the staff definitions of a part */
    private final Set<Element> readAttributes = new HashSet<>();

    private int ppq;
    private int meterCount;
    private boolean measureRepeat;
    private String lastElementId;
    private int staffOffset;

    public ConversionContext(Score score, ImportWarnings warnings) {
        this.score = score;
        this.warnings = warnings;
        this.vocabulary = new Vocabulary(warnings);
        this.layerSelector = new LayerSelector(warnings);
        this.resolver = new CrossReferenceResolver(warnings);
    }

    public Score getScore() {
        return score;
    }

    public ImportWarnings getWarnings() {
        return warnings;
    }

    public Vocabulary getVocabulary() {
        return vocabulary;
    }

    public LayerSelector getLayerSelector() {
        return layerSelector;
    }

    public NestingStack getNestingStack() {
        return nestingStack;
    }

    public DurationCursor getDurationCursor() {
        return durationCursor;
    }

    public CrossReferenceResolver getResolver() {
        return resolver;
    }

    public void markAttributesRead(Element attributes) {
        readAttributes.add(attributes);
    }

    public boolean isAttributesRead(Element attributes) {
        return readAttributes.contains(attributes);
    }

    /**
     * @return divisions per quarter note, 0 while unknown
     */
    public int getPpq() {
        return ppq;
    }

    public void setPpq(int ppq) {
        this.ppq = ppq;
    }

    /**
     * @return number of beats of the last time signature read
     */
    public int getMeterCount() {
        return meterCount;
    }

    public void setMeterCount(int meterCount) {
        this.meterCount = meterCount;
    }

    public boolean isMeasureRepeat() {
        return measureRepeat;
    }

    public void setMeasureRepeat(boolean measureRepeat) {
        this.measureRepeat = measureRepeat;
    }

    /**
     * @return reference of the last note, rest or chord read, or null before the first one
     */
    public String getLastElementId() {
        return lastElementId;
    }

    public void setLastElementId(String lastElementId) {
        this.lastElementId = lastElementId;
    }

    /**
     * @return number of staves of all parts read before the current one
     */
    public int getStaffOffset() {
        return staffOffset;
    }

    public void setStaffOffset(int staffOffset) {
        this.staffOffset = staffOffset;
    }
}

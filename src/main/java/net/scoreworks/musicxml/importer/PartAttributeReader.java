/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.OctaveDis;
import net.scoreworks.musicxml.model.Place;
import net.scoreworks.musicxml.model.StaffDef;
import net.scoreworks.musicxml.model.StaffGroup;
import nu.xom.Element;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the static staff definitions of a part from the leading attribute blocks of its first measure. Values
 * numbered for a staff take precedence over unnumbered ones.
 */
public class PartAttributeReader {
    private static final Logger logger = LoggerFactory.getLogger(PartAttributeReader.class);

    private final ConversionContext context;

    public PartAttributeReader(ConversionContext context) {
        this.context = context;
    }

    /**
     * Create one {@link StaffDef} per staff of the part inside the given group. Reading stops at the first child of
     * the measure that is not an attributes, barline, print or sound element. Attribute blocks read here are not
     * read again by the {@link MeasureTranslator}
     * @param firstMeasure first measure element of the part
     * @param partGroup group receiving the staff definitions
     * @param staffOffset number of staves of all previous parts
     * @return the number of staves of the part
     */
    public int read(Element firstMeasure, StaffGroup partGroup, int staffOffset) {
        int nbStaves = 1;

        for (Element it : XmlNodes.children(firstMeasure)) {
            if (!XmlNodes.isElement(it, "attributes") && !XmlNodes.isElement(it, "barline")
                    && !XmlNodes.isElement(it, "print") && !XmlNodes.isElement(it, "sound"))
                break;
            if (XmlNodes.isElement(it, "attributes"))
                context.markAttributesRead(it);

            String staves = XmlNodes.childValue(it, "staves");
            if (!staves.isEmpty()) {
                int values = XmlNodes.toInt(staves);
                nbStaves = (values > 0) ? values : 1;
            }
            for (int i = 0; i < nbStaves; i++) {
                readStaffDef(it, findOrCreate(partGroup, i + 1 + staffOffset), i + 1);
            }
        }
        // the first child may already be something else
        for (int i = 0; i < nbStaves; i++) {
            findOrCreate(partGroup, i + 1 + staffOffset);
        }
        logger.debug("Read {} staves starting at staff {}", nbStaves, staffOffset + 1);
        return nbStaves;
    }

    private StaffDef findOrCreate(StaffGroup partGroup, int n) {
        for (StaffDef staffDef : partGroup.getStaffDefs()) {
            if (staffDef.getN() == n)
                return staffDef;
        }
        StaffDef staffDef = new StaffDef(partGroup, n);
        staffDef.setPpq(context.getPpq());
        return staffDef;
    }

    /**
     * @return the element numbered for the staff or, if absent, the unnumbered default
     */
    private static Element numbered(Element attributes, String name, int localN) {
        Element element = XmlNodes.first(attributes, name + "[@number='" + localN + "']");
        if (element == null)
            element = XmlNodes.first(attributes, name);
        return element;
    }

    private void readStaffDef(Element attributes, StaffDef staffDef, int localN) {
        Vocabulary vocabulary = context.getVocabulary();

        Element clef = numbered(attributes, "clef", localN);
        if (clef != null) {
            String sign = XmlNodes.childValue(clef, "sign");
            if (!sign.isEmpty())
                staffDef.setClefShape(vocabulary.toClefShape(sign));
            String line = XmlNodes.childValue(clef, "line");
            if (!line.isEmpty())
                staffDef.setClefLine(XmlNodes.toInt(line));
            String octaveChange = XmlNodes.childValue(clef, "clef-octave-change");
            if (!octaveChange.isEmpty()) {
                int change = XmlNodes.toInt(octaveChange);
                staffDef.setClefDis(clefDisplacement(change));
                if (change < 0)
                    staffDef.setClefDisPlace(Place.BELOW);
                else if (change > 0)
                    staffDef.setClefDisPlace(Place.ABOVE);
            }
        }

        Element key = numbered(attributes, "key", localN);
        if (key != null) {
            if (XmlNodes.hasChild(key, "fifths"))
                staffDef.setKeyFifths(XmlNodes.toInt(XmlNodes.childValue(key, "fifths")));
            else if (XmlNodes.hasChild(key, "key-step"))
                staffDef.setMixedKey(true);
            if (XmlNodes.hasChild(key, "mode"))
                staffDef.setKeyMode(vocabulary.toKeyMode(XmlNodes.childValue(key, "mode")));
        }

        Element staffDetails = numbered(attributes, "staff-details", localN);
        if (staffDetails != null) {
            String lines = XmlNodes.childValue(staffDetails, "staff-lines");
            staffDef.setLines(lines.isEmpty() ? 5 : XmlNodes.toInt(lines));
            String scale = XmlNodes.childValue(staffDetails, "staff-size");
            if (!scale.isEmpty())
                staffDef.setScale(XmlNodes.toInt(scale));
            if (XmlNodes.hasChild(staffDetails, "staff-tuning"))
                staffDef.setNotationType(StaffDef.NotationType.TAB);
        }

        Element time = numbered(attributes, "time", localN);
        if (time != null)
            readTime(time, staffDef);

        Element transpose = numbered(attributes, "transpose", localN);
        if (transpose != null) {
            staffDef.setTransDiat(XmlNodes.toInt(XmlNodes.childValue(transpose, "diatonic")));
            staffDef.setTransSemi(XmlNodes.toInt(XmlNodes.childValue(transpose, "chromatic")));
        }

        String divisions = XmlNodes.childValue(attributes, "divisions");
        if (!divisions.isEmpty()) {
            context.setPpq(XmlNodes.toInt(divisions));
            staffDef.setPpq(context.getPpq());
        }
    }

    private void readTime(Element time, StaffDef staffDef) {
        String symbol = XmlNodes.attribute(time, "symbol");
        if (!symbol.isEmpty()) {
            if (symbol.equals("common"))
                staffDef.setMeterSym(StaffDef.MeterSym.COMMON);
            else if (symbol.equals("cut"))
                staffDef.setMeterSym(StaffDef.MeterSym.CUT);
            else if (symbol.equals("single-number"))
                staffDef.setMeterRend(StaffDef.MeterRend.NUM);
            else
                staffDef.setMeterRend(StaffDef.MeterRend.NORM);
        }
        if (XmlNodes.children(time, "beats").size() > 1)
            context.getWarnings().warn("Compound meter signatures are not supported");
        String beats = XmlNodes.childValue(time, "beats");
        if (!beats.isEmpty()) {
            int meterCount = 0;
            for (String summand : StringUtils.split(beats, '+')) {
                meterCount += XmlNodes.toInt(summand);
            }
            if (beats.contains("+"))
                context.getWarnings().warn("Compound time is not supported");
            context.setMeterCount(meterCount);
            staffDef.setMeterCount(meterCount);
        }
        String beatType = XmlNodes.childValue(time, "beat-type");
        if (!beatType.isEmpty())
            staffDef.setMeterUnit(XmlNodes.toInt(beatType));
    }

    /**
     * @return the clef octave displacement for an octave change, NONE if it is neither one nor two octaves
     */
    static OctaveDis clefDisplacement(int change) {
        switch (Math.abs(change)) {
            case 1:
                return OctaveDis.DIS_8;
            case 2:
                return OctaveDis.DIS_15;
            default:
                return OctaveDis.NONE;
        }
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.BarRendition;
import net.scoreworks.musicxml.model.Clef;
import net.scoreworks.musicxml.model.Duration;
import net.scoreworks.musicxml.model.Fermata;
import net.scoreworks.musicxml.model.Layer;
import net.scoreworks.musicxml.model.MRest;
import net.scoreworks.musicxml.model.Measure;
import net.scoreworks.musicxml.model.Place;
import net.scoreworks.musicxml.model.Space;
import net.scoreworks.musicxml.model.Staff;
import nu.xom.Element;
import org.apache.commons.lang3.math.Fraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates one &lt;measure&gt; element of a part. Children are dispatched in document order while the
 * {@link DurationCursor} and the {@link NestingStack} of the context follow along.
 */
public class MeasureTranslator {
    private static final Logger logger = LoggerFactory.getLogger(MeasureTranslator.class);

    private final ConversionContext context;
    private final NoteReader noteReader;
    private final DirectionReader directionReader;

    public MeasureTranslator(ConversionContext context) {
        this.context = context;
        this.noteReader = new NoteReader(context);
        this.directionReader = new DirectionReader(context);
    }

    /**
     * Fill the given measure with one staff per staff of the part and read the content of the measure element into
     * them
     * @param nbStaves number of staves of the part
     * @param staffOffset number of staves of all previous parts
     */
    public void translate(Element node, Measure measure, int nbStaves, int staffOffset) {
        int measureN = measure.getN();
        for (int i = 0; i < nbStaves; i++) {
            new Staff(measure, i + 1 + staffOffset);
        }
        if (!context.getNestingStack().isEmpty())
            logger.debug("Dropping {} open containers at measure {}", context.getNestingStack().size(), measureN);
        context.getNestingStack().clear();
        context.getDurationCursor().reset();

        for (Element it : XmlNodes.children(node)) {
            switch (it.getLocalName()) {
                case "attributes":
                    if (!context.isAttributesRead(it))
                        readAttributes(it, measure);
                    break;
                case "backup":
                    readBackup(it, measure);
                    break;
                case "barline":
                    readBarLine(it, measure, measureN);
                    break;
                case "direction":
                    directionReader.readDirection(it, measureN);
                    break;
                case "forward":
                    readForward(it, measure);
                    break;
                case "harmony":
                    directionReader.readHarmony(it, measureN);
                    break;
                case "note":
                    noteReader.read(it, measure, measureN);
                    break;
                case "print":
                    readPrint(it, measureN);
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Attribute changes within the part: clef changes, measure repeats and a new time unit
     */
    private void readAttributes(Element node, Measure measure) {
        Element clef = node.getFirstChildElement("clef");
        if (clef != null) {
            String numberStr = XmlNodes.attribute(clef, "number");
            int staffNum = numberStr.isEmpty() ? 1 : XmlNodes.toInt(numberStr);
            Layer layer = context.getLayerSelector().select(staffNum, measure);
            String sign = XmlNodes.childValue(clef, "sign");
            String line = XmlNodes.childValue(clef, "line");
            if (clef.getFirstChildElement("sign") != null && clef.getFirstChildElement("line") != null) {
                Clef clefChange = new Clef(context.getNestingStack().target(layer));
                clefChange.setShape(context.getVocabulary().toClefShape(sign));
                clefChange.setLine(XmlNodes.toInt(line));
                String octaveChange = XmlNodes.childValue(clef, "clef-octave-change");
                if (!octaveChange.isEmpty()) {
                    int change = XmlNodes.toInt(octaveChange);
                    clefChange.setDis(PartAttributeReader.clefDisplacement(change));
                    clefChange.setDisPlace(change < 0 ? Place.BELOW : Place.ABOVE);
                }
            }
        }

        Element measureRepeat = XmlNodes.first(node, "measure-style/measure-repeat");
        if (measureRepeat != null)
            context.setMeasureRepeat(XmlNodes.hasAttributeValue(measureRepeat, "type", "start"));

        String divisions = XmlNodes.childValue(node, "divisions");
        if (!divisions.isEmpty())
            context.setPpq(XmlNodes.toInt(divisions));
    }

    private void readBackup(Element node, Measure measure) {
        DurationCursor cursor = context.getDurationCursor();
        cursor.rewind(XmlNodes.toInt(XmlNodes.childValue(node, "duration")));

        // a note that follows and does not start at the beginning of the measure needs a space before it
        Element nextNote = XmlNodes.first(node, "following-sibling::note[1]");
        if (nextNote != null && cursor.getDurTotal() > 0) {
            Layer layer = context.getLayerSelector().select(nextNote, measure);
            fillSpace(layer, cursor.getDurTotal());
        }
    }

    private void readForward(Element node, Measure measure) {
        int duration = XmlNodes.toInt(XmlNodes.childValue(node, "duration"));
        context.getDurationCursor().advance(duration);

        Element prevNote = XmlNodes.first(node, "preceding-sibling::note[1]");
        Element nextNote = XmlNodes.first(node, "following-sibling::note[1]");
        if (nextNote != null) {
            // without a voice the space goes into the layer of the next note
            Element voiceSource = XmlNodes.hasChild(node, "voice") ? node : nextNote;
            fillSpace(context.getLayerSelector().select(voiceSource, measure), duration);
        }
        else if (prevNote == null && XmlNodes.first(node, "preceding-sibling::backup") == null) {
            // nothing else in this measure, use an invisible measure rest
            Layer layer = context.getLayerSelector().select(node, measure);
            MRest mRest = new MRest(context.getNestingStack().target(layer));
            mRest.setVisible(false);
        }
    }

    /**
     * Insert invisible spaces for a gap in the given layer
     */
    void fillSpace(Layer layer, int divisions) {
        int ppq = context.getPpq();
        if (ppq <= 0) {
            context.getWarnings().warn("Cannot fill a gap of {} divisions without divisions per quarter note", divisions);
            return;
        }
        for (Duration duration : DurationCursor.fillerDurations(divisions, ppq)) {
            new Space(context.getNestingStack().target(layer), duration);
        }
        Fraction remainder = DurationCursor.unfilledRemainder(divisions, ppq);
        if (remainder.compareTo(Fraction.ZERO) > 0)
            context.getWarnings().warn("Gap of {} divisions could not be filled completely, {} of a whole note left",
                    divisions, remainder);
    }

    private void readBarLine(Element node, Measure measure, int measureN) {
        Staff staff = measure.getStaff(0);
        String location = XmlNodes.attribute(node, "location");

        String barStyle = XmlNodes.childValue(node, "bar-style");
        if (!barStyle.isEmpty()) {
            BarRendition barRendition = context.getVocabulary().toBarRendition(barStyle,
                    XmlNodes.hasChild(node, "repeat"));
            if (location.equals("left"))
                measure.setLeft(barRendition);
            else if (location.equals("middle"))
                context.getWarnings().warn("Unsupported barline location 'middle'");
            else
                measure.setRight(barRendition);
        }
        if (XmlNodes.hasChild(node, "ending"))
            context.getWarnings().warn("Endings not supported");

        Element xmlFermata = node.getFirstChildElement("fermata");
        if (xmlFermata != null) {
            Fermata fermata = new Fermata(context.getScore(), measureN);
            if (location.equals("left"))
                fermata.setTstamp(0);
            else if (location.equals("middle"))
                context.getWarnings().warn("Unsupported barline location 'middle'");
            else
                fermata.setTstamp(context.getMeterCount() + 1);
            fermata.setStaff(staff.getN());
            NoteReader.applyFermata(xmlFermata, fermata);
        }
    }

    private void readPrint(Element node, int measureN) {
        // system and page breaks are left to the page layout
        if (XmlNodes.hasAttributeValue(node, "new-system", "yes"))
            logger.debug("System break before measure {}", measureN);
        if (XmlNodes.hasAttributeValue(node, "new-page", "yes"))
            logger.debug("Page break before measure {}", measureN);
    }
}

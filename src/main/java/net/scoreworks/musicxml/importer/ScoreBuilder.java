/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.ControlElement;
import net.scoreworks.musicxml.model.Measure;
import net.scoreworks.musicxml.model.Score;
import net.scoreworks.musicxml.model.Section;
import net.scoreworks.musicxml.model.StaffDef;
import net.scoreworks.musicxml.model.StaffGroup;
import net.scoreworks.musicxml.model.StaffGroupOwner;
import nu.xom.Element;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts a partwise MusicXML document into a {@link Score}.
 * <p>
 * The conversion runs in two phases. First the part list is walked in order: part-groups build the staff group
 * tree, and each part gets its staff definitions read and its measures translated. Measures of different parts at
 * the same position are merged into one. Control elements created on the way stay with the score. In the second
 * phase they are moved into the measure with their measure number.
 */
public class ScoreBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ScoreBuilder.class);

    static final String ROOT_ELEMENT = "score-partwise";

    private final ConversionContext context;
    private final PartAttributeReader partAttributeReader;
    private final MeasureTranslator measureTranslator;

    /** part-groups opened and not closed yet */
    private final Deque<StaffGroup> groupStack = new ArrayDeque<>();

    public ScoreBuilder(Score score, ImportWarnings warnings) {
        this.context = new ConversionContext(score, warnings);
        this.partAttributeReader = new PartAttributeReader(context);
        this.measureTranslator = new MeasureTranslator(context);
    }

    /**
     * Convert the document into the score this builder was created with. The score is not modified if the root
     * element is not a partwise score
     * @return the score
     * @throws MusicXmlImportException if the root is not a &lt;score-partwise&gt; element or the score is not empty
     */
    public Score convert(Element root) throws MusicXmlImportException {
        if (!XmlNodes.isElement(root, ROOT_ELEMENT))
            throw new MusicXmlImportException("Unsupported root element '" + root.getLocalName() + "', only "
                    + ROOT_ELEMENT + " can be imported");
        Score score = context.getScore();
        if (!score.isEmpty())
            throw new MusicXmlImportException("The destination score already has content");

        readTitle(root);
        Element sound = XmlNodes.first(root, "part[1]/measure[1]/sound[@tempo][1]");
        if (sound != null)
            score.setMidiBpm(XmlNodes.toInt(XmlNodes.attribute(sound, "tempo")));

        Section section = new Section(score);
        StaffGroup rootGroup = new StaffGroup(score);
        int staffOffset = 0;

        Element partList = root.getFirstChildElement("part-list");
        if (partList == null)
            context.getWarnings().warn("Could not find the 'part-list' element");
        for (Element it : XmlNodes.children(partList)) {
            if (XmlNodes.isElement(it, "part-group")) {
                readPartGroup(it, rootGroup);
            }
            else if (XmlNodes.isElement(it, "score-part")) {
                staffOffset += readScorePart(it, root, section, currentGroup(rootGroup), staffOffset);
            }
        }
        if (getOpenGroupCount() > 0)
            logger.debug("{} part-groups left open", getOpenGroupCount());
        CrossReferenceResolver resolver = context.getResolver();
        logger.debug("Left open: {} ties, {} slurs, {} hairpins", resolver.getOpenTieCount(),
                resolver.getOpenSlurCount(), resolver.getOpenHairpinCount());

        attachControlElements(section);
        return score;
    }

    private StaffGroupOwner currentGroup(StaffGroup rootGroup) {
        return groupStack.isEmpty() ? rootGroup : groupStack.peek();
    }

    private void readPartGroup(Element partGroup, StaffGroup rootGroup) {
        if (XmlNodes.hasAttributeValue(partGroup, "type", "start")) {
            StaffGroup staffGroup = new StaffGroup(currentGroup(rootGroup));
            switch (XmlNodes.childValue(partGroup, "group-symbol")) {
                case "bracket":
                    staffGroup.setSymbol(StaffGroup.GroupSymbol.BRACKET);
                    break;
                case "brace":
                    staffGroup.setSymbol(StaffGroup.GroupSymbol.BRACE);
                    break;
                case "line":
                    staffGroup.setSymbol(StaffGroup.GroupSymbol.LINE);
                    break;
                default:
                    break;
            }
            groupStack.push(staffGroup);
        }
        else if (XmlNodes.hasAttributeValue(partGroup, "type", "stop")) {
            if (groupStack.isEmpty())
                context.getWarnings().warn("Closing part-group '{}' that was never opened",
                        XmlNodes.attribute(partGroup, "number"));
            else
                groupStack.pop();
        }
    }

    /**
     * @return the number of staves added by the part, 0 if it was skipped
     */
    private int readScorePart(Element scorePart, Element root, Section section, StaffGroupOwner owner,
                              int staffOffset) {
        String partId = XmlNodes.attribute(scorePart, "id");
        Element part = findPart(root, partId);
        Element firstMeasure = XmlNodes.first(part, "measure[1]");
        if (firstMeasure == null) {
            context.getWarnings().warn("No measure to load for part '{}'", partId);
            return 0;
        }
        if (firstMeasure.getFirstChildElement("attributes") == null) {
            context.getWarnings().warn("Could not find the 'attributes' element in the first measure of part '{}'",
                    partId);
            return 0;
        }
        String partName = StringUtils.trimToNull(XmlNodes.childValue(scorePart, "part-name"));
        String partAbbr = StringUtils.trimToNull(XmlNodes.childValue(scorePart, "part-abbreviation"));

        StaffGroup partGroup = new StaffGroup(owner);
        int nbStaves = partAttributeReader.read(firstMeasure, partGroup, staffOffset);
        if (nbStaves > 1) {
            partGroup.setLabel(partName);
            partGroup.setLabelAbbr(partAbbr);
            partGroup.setSymbol(StaffGroup.GroupSymbol.BRACE);
            partGroup.setBarThru(true);
        }
        else {
            // a single staff goes directly into the enclosing group
            for (StaffDef staffDef : partGroup.getStaffDefs()) {
                staffDef.setLabel(partName);
                staffDef.setLabelAbbr(partAbbr);
                staffDef.moveTo(owner);
            }
            partGroup.remove();
        }

        context.setStaffOffset(staffOffset);
        readPart(part, section, nbStaves, staffOffset);
        return nbStaves;
    }

    @Nullable
    private static Element findPart(Element root, String partId) {
        for (Element part : XmlNodes.children(root, "part")) {
            if (XmlNodes.hasAttributeValue(part, "id", partId))
                return part;
        }
        return null;
    }

    private void readPart(Element part, Section section, int nbStaves, int staffOffset) {
        List<Element> measures = XmlNodes.children(part, "measure");
        logger.debug("Reading part '{}' with {} measures", XmlNodes.attribute(part, "id"), measures.size());
        for (int i = 0; i < measures.size(); i++) {
            Element xmlMeasure = measures.get(i);
            Measure measure = new Measure(section, XmlNodes.toInt(XmlNodes.attribute(xmlMeasure, "number")));
            measureTranslator.translate(xmlMeasure, measure, nbStaves, staffOffset);
            addMeasure(section, measure, i);
        }
    }

    /**
     * The measure was appended to the section. If a measure already exists at this position, move the staves of the
     * new measure into it and drop the new one
     */
    void addMeasure(Section section, Measure measure, int i) {
        if (section.getMeasureCount() - 1 == i)
            return;
        Measure existing = section.getMeasure(i);
        existing.takeStavesFrom(measure);
        measure.remove();
    }

    /**
     * Move all control elements still owned by the score into the measure with their measure number, in order of
     * creation. Elements without such a measure are dropped
     */
    public void attachControlElements(Section section) {
        Score score = context.getScore();
        Measure measure = null;
        List<ControlElement> controlElements = new ArrayList<>(score.getControlElements());
        for (ControlElement controlElement : controlElements) {
            if (measure == null || measure.getN() != controlElement.getMeasureN())
                measure = section.findMeasureByN(controlElement.getMeasureN());
            if (measure == null) {
                context.getWarnings().warn("Element '{}' could not be added to measure '{}'",
                        controlElement.getClass().getSimpleName(), controlElement.getMeasureN());
                controlElement.remove();
                continue;
            }
            controlElement.moveTo(measure);
        }
    }

    private void readTitle(Element root) {
        String movementTitle = XmlNodes.childValue(root, "movement-title");
        if (root.getFirstChildElement("movement-title") != null)
            context.getScore().setTitle(movementTitle);
        else if (XmlNodes.first(root, "work/work-title") != null)
            context.getScore().setTitle(XmlNodes.pathValue(root, "work/work-title"));
    }

    /**
     * @return number of part-groups that were opened but not closed
     */
    public int getOpenGroupCount() {
        return groupStack.size();
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Dir;
import net.scoreworks.musicxml.model.Dynam;
import net.scoreworks.musicxml.model.Hairpin;
import net.scoreworks.musicxml.model.Harm;
import net.scoreworks.musicxml.model.Octave;
import net.scoreworks.musicxml.model.OctaveDis;
import net.scoreworks.musicxml.model.Pedal;
import net.scoreworks.musicxml.model.Place;
import net.scoreworks.musicxml.model.Rend;
import net.scoreworks.musicxml.model.Score;
import net.scoreworks.musicxml.model.StaffRel;
import net.scoreworks.musicxml.model.Tempo;
import net.scoreworks.musicxml.model.TextDirective;
import net.scoreworks.musicxml.model.TextRun;
import nu.xom.Element;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Reads &lt;direction&gt; and &lt;harmony&gt; elements into control elements. Most of them wait in the
 * {@link CrossReferenceResolver} for the next note to get their start reference.
 */
public class DirectionReader {
    private final ConversionContext context;

    public DirectionReader(ConversionContext context) {
        this.context = context;
    }

    public void readDirection(Element node, int measureN) {
        Score score = context.getScore();
        CrossReferenceResolver resolver = context.getResolver();

        Element type = node.getFirstChildElement("direction-type");
        StaffRel place = Vocabulary.toStaffRel(XmlNodes.attribute(node, "placement"));
        List<Element> words = XmlNodes.children(type, "words");
        boolean soundTempo = XmlNodes.first(node, "sound[@tempo]") != null;

        if (!words.isEmpty() && !soundTempo) {
            Dir dir = new Dir(score, measureN);
            if (words.size() == 1)
                dir.setLang(StringUtils.trimToNull(XmlNodes.lang(words.get(0))));
            dir.setPlace(place);
            addWords(words, dir);
            resolver.addPending(dir);
        }

        Element xmlDynam = XmlNodes.first(type, "dynamics");
        if (xmlDynam != null) {
            Dynam dynam = new Dynam(score, measureN);
            dynam.setPlace(place);
            dynam.addText(new TextRun(NoteReader.dynamicsText(xmlDynam)));
            resolver.addPending(dynam);
        }

        Element wedge = XmlNodes.first(type, "wedge");
        if (wedge != null)
            readWedge(wedge, place, measureN);

        Element xmlShift = XmlNodes.first(type, "octave-shift");
        if (xmlShift != null)
            readOctaveShift(node, xmlShift, measureN);

        Element xmlPedal = XmlNodes.first(type, "pedal");
        if (xmlPedal != null) {
            Pedal pedal = new Pedal(score, measureN);
            pedal.setPlace(place);
            String pedalType = XmlNodes.attribute(xmlPedal, "type");
            if (!pedalType.isEmpty())
                pedal.setDir(context.getVocabulary().toPedalDir(pedalType));
            if (pedalType.equals("stop"))
                pedal.setStartId(context.getLastElementId());
            resolver.addPending(pedal);
        }

        Element metronome = XmlNodes.first(type, "metronome");
        if (soundTempo || metronome != null) {
            Tempo tempo = new Tempo(score, measureN);
            if (words.size() == 1)
                tempo.setLang(StringUtils.trimToNull(XmlNodes.lang(words.get(0))));
            tempo.setPlace(place);
            addWords(words, tempo);
            if (metronome != null)
                readMetronome(metronome, tempo);
            else
                tempo.setMidiBpm(XmlNodes.toInt(XmlNodes.attribute(XmlNodes.first(node, "sound[@tempo]"), "tempo")));
            resolver.addPending(tempo);
        }

        if (words.isEmpty() && xmlDynam == null && metronome == null && xmlShift == null && xmlPedal == null
                && wedge == null) {
            String name = "";
            if (type != null && type.getChildElements().size() > 0)
                name = type.getChildElements().get(0).getLocalName();
            context.getWarnings().warn("Unsupported direction-type '{}'", name);
        }
    }

    private void readWedge(Element wedge, StaffRel place, int measureN) {
        int hairpinNumber = Math.max(XmlNodes.toInt(XmlNodes.attribute(wedge, "number")), 1);
        if (XmlNodes.hasAttributeValue(wedge, "type", "stop")) {
            context.getResolver().closeHairpin(hairpinNumber);
            return;
        }
        Hairpin hairpin = new Hairpin(context.getScore(), measureN);
        if (XmlNodes.hasAttributeValue(wedge, "type", "crescendo"))
            hairpin.setForm(Hairpin.Form.CRES);
        else if (XmlNodes.hasAttributeValue(wedge, "type", "diminuendo"))
            hairpin.setForm(Hairpin.Form.DIM);
        hairpin.setColor(StringUtils.trimToNull(XmlNodes.attribute(wedge, "color")));
        hairpin.setPlace(place);
        context.getResolver().openHairpin(hairpin, hairpinNumber);
    }

    private void readOctaveShift(Element node, Element xmlShift, int measureN) {
        String staffStr = XmlNodes.childValue(node, "staff");
        int staffN = context.getStaffOffset() + (staffStr.isEmpty() ? 1 : XmlNodes.toInt(staffStr));
        CrossReferenceResolver resolver = context.getResolver();
        String shiftType = XmlNodes.attribute(xmlShift, "type");
        if (shiftType.equals("stop")) {
            resolver.closeOctave(staffN, context.getLastElementId());
            return;
        }
        if (shiftType.equals("continue"))
            return;
        int size = XmlNodes.toInt(XmlNodes.attribute(xmlShift, "size"));
        Octave octave = new Octave(context.getScore(), measureN);
        octave.setColor(StringUtils.trimToNull(XmlNodes.attribute(xmlShift, "color")));
        octave.setStaff(staffN);
        octave.setDis(octaveDis(size));
        int displacement = octaveDisplacement(size);
        if (shiftType.equals("down")) {
            octave.setDisPlace(Place.BELOW);
            displacement = -displacement;
        }
        else {
            octave.setDisPlace(Place.ABOVE);
        }
        resolver.openOctave(octave, staffN, displacement);
        resolver.addPending(octave);
    }

    /**
     * @return whole octaves of an octave-shift size, where 8 is one octave, 15 two and 22 three
     */
    static int octaveDisplacement(int size) {
        return (size + 2) / 8;
    }

    static OctaveDis octaveDis(int size) {
        switch (size) {
            case 8:
                return OctaveDis.DIS_8;
            case 15:
                return OctaveDis.DIS_15;
            case 22:
                return OctaveDis.DIS_22;
            default:
                return OctaveDis.NONE;
        }
    }

    private void readMetronome(Element metronome, Tempo tempo) {
        String tempoText = "M.M.";
        Element perMinute = metronome.getFirstChildElement("per-minute");
        if (perMinute != null) {
            String mm = StringUtils.trimToEmpty(perMinute.getValue());
            if (XmlNodes.toInt(mm) != 0)
                tempo.setMm(XmlNodes.toInt(mm));
            tempoText = tempoText + " = " + mm;
        }
        String beatUnit = XmlNodes.childValue(metronome, "beat-unit");
        if (XmlNodes.hasChild(metronome, "beat-unit"))
            tempo.setMmUnit(context.getVocabulary().toDuration(beatUnit));
        tempo.setMmDots(XmlNodes.children(metronome, "beat-unit-dot").size());
        if (XmlNodes.hasAttributeValue(metronome, "parentheses", "yes"))
            tempoText = "(" + tempoText + ")";
        tempo.addText(new TextRun(tempoText));
    }

    /**
     * Read a chord symbol: root step, alteration sign and the text of its kind
     */
    public void readHarmony(Element node, int measureN) {
        StringBuilder harmText = new StringBuilder(XmlNodes.pathValue(node, "root/root-step"));
        Element alter = XmlNodes.first(node, "root/root-alter");
        if (alter != null) {
            switch (StringUtils.trimToEmpty(alter.getValue())) {
                case "-1":
                    harmText.append('♭');
                    break;
                case "0":
                    harmText.append('♮');
                    break;
                case "1":
                    harmText.append('♯');
                    break;
                default:
                    break;
            }
        }
        Element kind = node.getFirstChildElement("kind");
        if (kind != null)
            harmText.append(XmlNodes.attribute(kind, "text"));
        Harm harm = new Harm(context.getScore(), measureN);
        harm.setPlace(Vocabulary.toStaffRel(XmlNodes.attribute(node, "placement")));
        harm.setType(StringUtils.trimToNull(XmlNodes.attribute(node, "type")));
        harm.addText(new TextRun(harmText.toString()));
        context.getResolver().addPending(harm);
    }

    private static void addWords(List<Element> words, TextDirective directive) {
        for (Element word : words) {
            directive.addText(wordsRun(word, words.size() > 1));
        }
    }

    /**
     * Build a text run for a &lt;words&gt; element. A rendition is only created if color or font are given, the
     * language is kept on it only if the direction has several words elements
     */
    static TextRun wordsRun(Element words, boolean keepLang) {
        String color = XmlNodes.attribute(words, "color");
        String font = XmlNodes.attribute(words, "font-family");
        String style = XmlNodes.attribute(words, "font-style");
        String weight = XmlNodes.attribute(words, "font-weight");
        if (color.isEmpty() && font.isEmpty() && style.isEmpty() && weight.isEmpty())
            return new TextRun(words.getValue());
        String lang = keepLang ? StringUtils.trimToNull(XmlNodes.lang(words)) : null;
        Rend rend = new Rend(Vocabulary.toHorizontalAlign(XmlNodes.attribute(words, "halign")),
                StringUtils.trimToNull(color), StringUtils.trimToNull(font), Vocabulary.toFontStyle(style),
                Vocabulary.toFontWeight(weight), lang);
        return new TextRun(words.getValue(), rend);
    }
}

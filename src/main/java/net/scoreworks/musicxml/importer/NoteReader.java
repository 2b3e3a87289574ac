/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Accid;
import net.scoreworks.musicxml.model.Artic;
import net.scoreworks.musicxml.model.Articulation;
import net.scoreworks.musicxml.model.BTrem;
import net.scoreworks.musicxml.model.Beam;
import net.scoreworks.musicxml.model.Chord;
import net.scoreworks.musicxml.model.CurveDir;
import net.scoreworks.musicxml.model.Dynam;
import net.scoreworks.musicxml.model.FTrem;
import net.scoreworks.musicxml.model.Fermata;
import net.scoreworks.musicxml.model.Layer;
import net.scoreworks.musicxml.model.LayerElement;
import net.scoreworks.musicxml.model.LayerElementContainer;
import net.scoreworks.musicxml.model.MRest;
import net.scoreworks.musicxml.model.MRpt;
import net.scoreworks.musicxml.model.Measure;
import net.scoreworks.musicxml.model.Mordent;
import net.scoreworks.musicxml.model.Note;
import net.scoreworks.musicxml.model.Rest;
import net.scoreworks.musicxml.model.Score;
import net.scoreworks.musicxml.model.Slur;
import net.scoreworks.musicxml.model.Space;
import net.scoreworks.musicxml.model.Staff;
import net.scoreworks.musicxml.model.StaffRel;
import net.scoreworks.musicxml.model.StemDirection;
import net.scoreworks.musicxml.model.StemModifier;
import net.scoreworks.musicxml.model.Syl;
import net.scoreworks.musicxml.model.TextRun;
import net.scoreworks.musicxml.model.Tie;
import net.scoreworks.musicxml.model.Trill;
import net.scoreworks.musicxml.model.Tuplet;
import net.scoreworks.musicxml.model.Turn;
import net.scoreworks.musicxml.model.Verse;
import nu.xom.Element;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the layer elements of a &lt;note&gt; element: notes, rests, measure rests, spaces and measure repeats, the
 * chords, beams, tuplets and tremolos they open or close, and the control elements attached to them through
 * &lt;notations&gt; (ties, slurs, dynamics and ornaments).
 */
public class NoteReader {
    private final ConversionContext context;

    public NoteReader(ConversionContext context) {
        this.context = context;
    }

    /**
     * Read a note element of the measure with the given number
     */
    public void read(Element node, Measure measure, int measureN) {
        Layer layer = context.getLayerSelector().select(node, measure);
        Staff staff = layer.getStaff();
        NestingStack nestingStack = context.getNestingStack();
        Vocabulary vocabulary = context.getVocabulary();

        if (!XmlNodes.hasChild(node, "chord"))
            context.getDurationCursor().advance(XmlNodes.toInt(XmlNodes.childValue(node, "duration")));

        // a measure repeat replaces the whole content of the layer
        if (context.isMeasureRepeat()) {
            if (!containsMRpt(layer))
                new MRpt(nestingStack.target(layer));
            return;
        }

        Element notations = XmlNodes.first(node, "notations[not(@print-object='no')]");
        boolean cue = XmlNodes.hasChild(node, "cue") || XmlNodes.first(node, "type[@size='cue']") != null;
        String typeStr = XmlNodes.childValue(node, "type");
        int dots = XmlNodes.children(node, "dot").size();

        Element tremolo = XmlNodes.first(notations, "ornaments/tremolo");
        String tremSlashNum = "0";
        if (tremolo != null) {
            if (XmlNodes.hasAttributeValue(tremolo, "type", "single")) {
                nestingStack.push(new BTrem(nestingStack.target(layer)));
                tremSlashNum = StringUtils.trimToEmpty(tremolo.getValue());
            }
            else if (XmlNodes.hasAttributeValue(tremolo, "type", "start")) {
                FTrem fTrem = new FTrem(nestingStack.target(layer));
                fTrem.setSlash(XmlNodes.toInt(tremolo.getValue()));
                nestingStack.push(fTrem);
            }
        }

        if (XmlNodes.first(node, "beam[@number='1'][text()='begin']") != null)
            nestingStack.push(new Beam(nestingStack.target(layer)));

        Element tupletStart = XmlNodes.first(notations, "tuplet[@type='start']");
        if (tupletStart != null)
            nestingStack.push(readTuplet(node, tupletStart, nestingStack.target(layer)));

        LayerElement element;
        Element rest = node.getFirstChildElement("rest");
        if (rest != null) {
            element = readRest(node, rest, nestingStack.target(layer), typeStr, dots, cue);
        }
        else {
            StemDirection stemDir = StemDirection.NONE;
            String stemDirStr = XmlNodes.childValue(node, "stem");
            if (stemDirStr.equals("down"))
                stemDir = StemDirection.DOWN;
            else if (stemDirStr.equals("up"))
                stemDir = StemDirection.UP;

            // look at the next note to see if we are starting or ending a chord
            Element nextNote = XmlNodes.first(node, "following-sibling::note[1]");
            boolean nextIsChord = XmlNodes.hasChild(nextNote, "chord");
            Chord chord = null;
            if (nextIsChord && !nestingStack.isTopOf(Chord.class)) {
                chord = new Chord(nestingStack.target(layer));
                chord.setDur(vocabulary.toDuration(typeStr));
                chord.setDots(dots);
                chord.setStemDir(stemDir);
                chord.setCue(cue);
                if (!tremSlashNum.equals("0"))
                    chord.setStemMod(StemModifier.ofSlashes(XmlNodes.toInt(tremSlashNum)));
                nestingStack.push(chord);
            }

            Note note = readNote(node, nestingStack.target(layer), staff);

            Element grace = node.getFirstChildElement("grace");
            if (grace != null) {
                String slashStr = XmlNodes.attribute(grace, "slash");
                if (slashStr.equals("no")) {
                    note.setGrace(Note.Grace.UNSLASHED);
                }
                else if (slashStr.equals("yes")) {
                    note.setGrace(Note.Grace.SLASHED);
                    note.setStemMod(StemModifier.SLASH_1);
                }
                else {
                    note.setGrace(Note.Grace.UNSPECIFIED);
                }
            }

            // chord attributes take precedence
            if (!nestingStack.isTopOf(Chord.class)) {
                note.setDur(vocabulary.toDuration(typeStr));
                note.setDots(dots);
                note.setStemDir(stemDir);
                note.setCue(cue);
                if (!tremSlashNum.equals("0"))
                    note.setStemMod(StemModifier.ofSlashes(XmlNodes.toInt(tremSlashNum)));
            }

            for (Element lyric : XmlNodes.children(node, "lyric")) {
                note.addVerse(readVerse(lyric));
            }

            readTies(notations, note, staff, layer, measureN);

            element = (chord != null) ? chord : note;
            readArticulations(notations, element);

            if (!nextIsChord && nestingStack.isTopOf(Chord.class))
                nestingStack.removeLast(Chord.class);
        }

        String elementId = element.getReference();
        context.setLastElementId(elementId);

        readNotationControlElements(notations, staff, measureN, elementId);
        readSlurs(notations, staff, layer, measureN, elementId);

        if (tremolo != null) {
            if (XmlNodes.hasAttributeValue(tremolo, "type", "single"))
                nestingStack.removeLast(BTrem.class);
            if (XmlNodes.hasAttributeValue(tremolo, "type", "stop"))
                nestingStack.removeLast(FTrem.class);
        }
        if (XmlNodes.first(notations, "tuplet[@type='stop']") != null)
            nestingStack.removeLast(Tuplet.class);
        if (XmlNodes.first(node, "beam[@number='1'][text()='end']") != null)
            nestingStack.removeLast(Beam.class);

        context.getResolver().elementRead(elementId, staff.getN());
    }

    private static boolean containsMRpt(Layer layer) {
        for (LayerElement element : layer.getLayerElements()) {
            if (element instanceof MRpt)
                return true;
        }
        return false;
    }

    private Tuplet readTuplet(Element node, Element tupletStart, LayerElementContainer target) {
        Tuplet tuplet = new Tuplet(target);
        String actualNotes = XmlNodes.pathValue(node, "time-modification/actual-notes");
        String normalNotes = XmlNodes.pathValue(node, "time-modification/normal-notes");
        if (!actualNotes.isEmpty() && !normalNotes.isEmpty()) {
            tuplet.setNum(XmlNodes.toInt(actualNotes));
            tuplet.setNumbase(XmlNodes.toInt(normalNotes));
        }
        String placement = XmlNodes.attribute(tupletStart, "placement");
        if (!placement.isEmpty()) {
            tuplet.setNumPlace(Vocabulary.toPlace(placement));
            tuplet.setBracketPlace(Vocabulary.toPlace(placement));
        }
        String showNumber = XmlNodes.attribute(tupletStart, "show-number");
        tuplet.setNumFormat(Vocabulary.toNumFormat(showNumber));
        if (showNumber.equals("none"))
            tuplet.setNumVisible(false);
        tuplet.setBracketVisible(Vocabulary.toBoolean(XmlNodes.attribute(tupletStart, "bracket")));
        return tuplet;
    }

    private LayerElement readRest(Element node, Element rest, LayerElementContainer target, String typeStr, int dots,
                                  boolean cue) {
        Vocabulary vocabulary = context.getVocabulary();
        String stepStr = XmlNodes.childValue(rest, "display-step");
        String octaveStr = XmlNodes.childValue(rest, "display-octave");
        if (XmlNodes.hasAttributeValue(node, "print-object", "no")) {
            Space space = new Space(target);
            space.setDur(vocabulary.toDuration(typeStr));
            return space;
        }
        // a rest without type is a measure rest
        if (typeStr.isEmpty() || XmlNodes.hasAttributeValue(rest, "measure", "yes")) {
            MRest mRest = new MRest(target);
            mRest.setCue(cue);
            if (!stepStr.isEmpty())
                mRest.setPloc(vocabulary.toPitchName(stepStr));
            mRest.setOloc(XmlNodes.toInteger(octaveStr));
            return mRest;
        }
        Rest r = new Rest(target);
        r.setDur(vocabulary.toDuration(typeStr));
        r.setDots(dots);
        r.setCue(cue);
        if (!stepStr.isEmpty())
            r.setPloc(vocabulary.toPitchName(stepStr));
        r.setOloc(XmlNodes.toInteger(octaveStr));
        return r;
    }

    private Note readNote(Element node, LayerElementContainer target, Staff staff) {
        Vocabulary vocabulary = context.getVocabulary();
        Note note = new Note(target);
        note.setVisible(Vocabulary.toBoolean(XmlNodes.attribute(node, "print-object")));
        note.setColor(StringUtils.trimToNull(XmlNodes.attribute(node, "color")));

        Element accidental = node.getFirstChildElement("accidental");
        if (accidental != null) {
            Accid.Func func = null;
            if (XmlNodes.hasAttributeValue(accidental, "cautionary", "yes"))
                func = Accid.Func.CAUTION;
            if (XmlNodes.hasAttributeValue(accidental, "editorial", "yes"))
                func = Accid.Func.EDIT;
            Accid.Enclosure enclose = null;
            if (XmlNodes.hasAttributeValue(accidental, "bracket", "yes"))
                enclose = Accid.Enclosure.BRACK;
            if (XmlNodes.hasAttributeValue(accidental, "parentheses", "yes"))
                enclose = Accid.Enclosure.PAREN;
            note.setAccid(Accid.written(vocabulary.toAccidental(StringUtils.trimToEmpty(accidental.getValue())), func,
                    enclose, StringUtils.trimToNull(XmlNodes.attribute(accidental, "color"))));
        }

        Element pitch = node.getFirstChildElement("pitch");
        if (pitch != null) {
            String stepStr = XmlNodes.childValue(pitch, "step");
            if (!stepStr.isEmpty())
                note.setPname(vocabulary.toPitchName(stepStr));
            String octaveStr = XmlNodes.childValue(pitch, "octave");
            if (!octaveStr.isEmpty()) {
                int octave = XmlNodes.toInt(octaveStr);
                int displacement = context.getResolver().getOctaveDisplacement(staff.getN());
                if (displacement != 0) {
                    note.setOct(octave + displacement);
                    note.setOctGes(octave);
                }
                else {
                    note.setOct(octave);
                }
            }
            String alterStr = XmlNodes.childValue(pitch, "alter");
            if (accidental == null && !alterStr.isEmpty())
                note.setAccid(Accid.sounding(vocabulary.toAccidentalGes(alterStr)));
        }
        return note;
    }

    private Verse readVerse(Element lyric) {
        int lyricNumber = XmlNodes.toInt(XmlNodes.attribute(lyric, "number"));
        lyricNumber = Math.max(lyricNumber, 1);
        List<Syl> syls = new ArrayList<>();
        if (!XmlNodes.hasAttributeValue(lyric, "print-object", "no")) {
            String syllabic = XmlNodes.childValue(lyric, "syllabic");
            for (Element text : XmlNodes.children(lyric, "text")) {
                Syl.Con con = Syl.Con.NONE;
                Syl.WordPos wordPos = Syl.WordPos.NONE;
                if (XmlNodes.hasChild(lyric, "extend"))
                    con = Syl.Con.UNDERSCORE;
                if (XmlNodes.first(text, "following-sibling::elision") != null)
                    con = Syl.Con.BRIDGE;
                switch (syllabic) {
                    case "begin":
                        con = Syl.Con.DASH;
                        wordPos = Syl.WordPos.INITIAL;
                        break;
                    case "middle":
                        con = Syl.Con.DASH;
                        wordPos = Syl.WordPos.MEDIAL;
                        break;
                    case "end":
                        wordPos = Syl.WordPos.TERMINAL;
                        break;
                    default:
                        break;
                }
                syls.add(new Syl(text.getValue(), con, wordPos, StringUtils.trimToNull(XmlNodes.lang(text)),
                        Vocabulary.toFontStyle(XmlNodes.attribute(text, "font-style")),
                        Vocabulary.toFontWeight(XmlNodes.attribute(text, "font-weight"))));
            }
        }
        return new Verse(lyricNumber, StringUtils.trimToNull(XmlNodes.attribute(lyric, "color")), syls);
    }

    private void readTies(@Nullable Element notations, Note note, Staff staff, Layer layer, int measureN) {
        Element startTie = XmlNodes.first(notations, "tied[@type='start']");
        Element endTie = XmlNodes.first(notations, "tied[@type='stop']");
        CrossReferenceResolver resolver = context.getResolver();
        resolver.closeTie(staff.getN(), layer.getN(), note, endTie != null);
        if (startTie != null) {
            Tie tie = new Tie(context.getScore(), measureN);
            tie.setColor(StringUtils.trimToNull(XmlNodes.attribute(startTie, "color")));
            tie.setCurvedir(curveDir(startTie));
            resolver.openTie(tie, staff.getN(), layer.getN(), note);
        }
    }

    private void readArticulations(@Nullable Element notations, LayerElement element) {
        Vocabulary vocabulary = context.getVocabulary();
        for (Element articulations : XmlNodes.children(notations, "articulations")) {
            List<Articulation> artics = new ArrayList<>();
            for (Element child : XmlNodes.children(articulations)) {
                Articulation articulation = vocabulary.toArticulation(child.getLocalName());
                if (articulation != null)
                    artics.add(articulation);
            }
            if (!artics.isEmpty())
                element.addArtic(new Artic(artics, null));
        }
        for (Element technical : XmlNodes.children(notations, "technical")) {
            List<Articulation> artics = new ArrayList<>();
            for (Element child : XmlNodes.children(technical)) {
                Articulation articulation = vocabulary.toTechnical(child.getLocalName());
                if (articulation != null)
                    artics.add(articulation);
            }
            if (!artics.isEmpty())
                element.addArtic(new Artic(artics, Artic.TECHNICAL));
        }
    }

    private void readNotationControlElements(@Nullable Element notations, Staff staff, int measureN, String elementId) {
        if (notations == null)
            return;
        Score score = context.getScore();

        Element xmlDynam = notations.getFirstChildElement("dynamics");
        if (xmlDynam != null) {
            Dynam dynam = new Dynam(score, measureN);
            dynam.setStaff(staff.getN());
            dynam.setStartId(elementId);
            dynam.addText(new TextRun(dynamicsText(xmlDynam)));
            dynam.setPlace(Vocabulary.toStaffRel(XmlNodes.attribute(xmlDynam, "placement")));
        }

        Element xmlFermata = notations.getFirstChildElement("fermata");
        if (xmlFermata != null) {
            Fermata fermata = new Fermata(score, measureN);
            fermata.setStaff(staff.getN());
            fermata.setStartId(elementId);
            applyFermata(xmlFermata, fermata);
        }

        Element ornaments = notations.getFirstChildElement("ornaments");
        if (ornaments == null)
            return;
        Element xmlMordent = ornaments.getFirstChildElement("mordent");
        if (xmlMordent != null)
            readMordent(xmlMordent, Mordent.Form.NORM, staff, measureN, elementId);
        Element xmlMordentInv = ornaments.getFirstChildElement("inverted-mordent");
        if (xmlMordentInv != null)
            readMordent(xmlMordentInv, Mordent.Form.INV, staff, measureN, elementId);

        Element xmlTrill = ornaments.getFirstChildElement("trill-mark");
        if (xmlTrill != null) {
            Trill trill = new Trill(score, measureN);
            trill.setStaff(staff.getN());
            trill.setStartId(elementId);
            trill.setColor(StringUtils.trimToNull(XmlNodes.attribute(xmlTrill, "color")));
            trill.setPlace(Vocabulary.toStaffRel(XmlNodes.attribute(xmlTrill, "placement")));
        }

        Element xmlTurn = ornaments.getFirstChildElement("turn");
        if (xmlTurn != null)
            readTurn(xmlTurn, Turn.Form.NORM, staff, measureN, elementId);
        Element xmlTurnInv = ornaments.getFirstChildElement("inverted-turn");
        if (xmlTurnInv != null)
            readTurn(xmlTurnInv, Turn.Form.INV, staff, measureN, elementId);
    }

    private void readMordent(Element xmlMordent, Mordent.Form form, Staff staff, int measureN, String elementId) {
        Mordent mordent = new Mordent(context.getScore(), measureN);
        mordent.setStaff(staff.getN());
        mordent.setStartId(elementId);
        mordent.setColor(StringUtils.trimToNull(XmlNodes.attribute(xmlMordent, "color")));
        mordent.setForm(form);
        mordent.setLong(Vocabulary.toBoolean(XmlNodes.attribute(xmlMordent, "long")));
        mordent.setPlace(Vocabulary.toStaffRel(XmlNodes.attribute(xmlMordent, "placement")));
    }

    private void readTurn(Element xmlTurn, Turn.Form form, Staff staff, int measureN, String elementId) {
        Turn turn = new Turn(context.getScore(), measureN);
        turn.setStaff(staff.getN());
        turn.setStartId(elementId);
        turn.setColor(StringUtils.trimToNull(XmlNodes.attribute(xmlTurn, "color")));
        turn.setForm(form);
        turn.setPlace(Vocabulary.toStaffRel(XmlNodes.attribute(xmlTurn, "placement")));
    }

    private void readSlurs(@Nullable Element notations, Staff staff, Layer layer, int measureN, String elementId) {
        // slurs ending on another staff are not matched
        for (Element xmlSlur : XmlNodes.children(notations, "slur")) {
            int slurNumber = Math.max(XmlNodes.toInt(XmlNodes.attribute(xmlSlur, "number")), 1);
            if (XmlNodes.hasAttributeValue(xmlSlur, "type", "start")) {
                Slur slur = new Slur(context.getScore(), measureN);
                slur.setColor(StringUtils.trimToNull(XmlNodes.attribute(xmlSlur, "color")));
                slur.setCurvedir(curveDir(xmlSlur));
                context.getResolver().openSlur(slur, staff.getN(), layer.getN(), slurNumber, elementId);
            }
            else if (XmlNodes.hasAttributeValue(xmlSlur, "type", "stop")) {
                context.getResolver().closeSlur(staff.getN(), layer.getN(), slurNumber, elementId);
            }
        }
    }

    /**
     * Orientation gives the curve direction unless an explicit placement overrides it
     */
    private static CurveDir curveDir(Element spanner) {
        String placement = XmlNodes.attribute(spanner, "placement");
        if (!placement.isEmpty())
            return Vocabulary.placementToCurveDir(placement);
        return Vocabulary.orientationToCurveDir(XmlNodes.attribute(spanner, "orientation"));
    }

    /**
     * @return the text of &lt;other-dynamics&gt; or else the name of the first dynamics mark
     */
    static String dynamicsText(Element xmlDynam) {
        String text = XmlNodes.childValue(xmlDynam, "other-dynamics");
        if (text.isEmpty()) {
            List<Element> marks = XmlNodes.children(xmlDynam);
            if (!marks.isEmpty())
                text = marks.get(0).getLocalName();
        }
        return text;
    }

    /**
     * Set color, shape, form and placement of a fermata read from a note or a barline
     */
    static void applyFermata(Element xmlFermata, Fermata fermata) {
        fermata.setColor(StringUtils.trimToNull(XmlNodes.attribute(xmlFermata, "color")));
        fermata.setShape(Vocabulary.toFermataShape(xmlFermata.getValue()));
        if (XmlNodes.hasAttributeValue(xmlFermata, "type", "inverted")) {
            fermata.setForm(Fermata.Form.INV);
            fermata.setPlace(StaffRel.BELOW);
        }
        else if (XmlNodes.hasAttributeValue(xmlFermata, "type", "upright")) {
            fermata.setForm(Fermata.Form.NORM);
            fermata.setPlace(StaffRel.ABOVE);
        }
    }
}

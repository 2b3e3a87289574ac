/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.json;

import net.scoreworks.musicxml.model.Accid;
import net.scoreworks.musicxml.model.Artic;
import net.scoreworks.musicxml.model.BTrem;
import net.scoreworks.musicxml.model.Beam;
import net.scoreworks.musicxml.model.Chord;
import net.scoreworks.musicxml.model.Clef;
import net.scoreworks.musicxml.model.ContainerElement;
import net.scoreworks.musicxml.model.ControlElement;
import net.scoreworks.musicxml.model.ControlElementVisitor;
import net.scoreworks.musicxml.model.Dir;
import net.scoreworks.musicxml.model.Dynam;
import net.scoreworks.musicxml.model.FTrem;
import net.scoreworks.musicxml.model.Fermata;
import net.scoreworks.musicxml.model.Hairpin;
import net.scoreworks.musicxml.model.Harm;
import net.scoreworks.musicxml.model.Layer;
import net.scoreworks.musicxml.model.LayerElement;
import net.scoreworks.musicxml.model.LayerElementVisitor;
import net.scoreworks.musicxml.model.MRest;
import net.scoreworks.musicxml.model.MRpt;
import net.scoreworks.musicxml.model.Measure;
import net.scoreworks.musicxml.model.Mordent;
import net.scoreworks.musicxml.model.Note;
import net.scoreworks.musicxml.model.Octave;
import net.scoreworks.musicxml.model.Pedal;
import net.scoreworks.musicxml.model.Rend;
import net.scoreworks.musicxml.model.Rest;
import net.scoreworks.musicxml.model.Score;
import net.scoreworks.musicxml.model.Section;
import net.scoreworks.musicxml.model.Slur;
import net.scoreworks.musicxml.model.Space;
import net.scoreworks.musicxml.model.Staff;
import net.scoreworks.musicxml.model.StaffDef;
import net.scoreworks.musicxml.model.StaffGroup;
import net.scoreworks.musicxml.model.StaffGroupMember;
import net.scoreworks.musicxml.model.StaffGroupVisitor;
import net.scoreworks.musicxml.model.Syl;
import net.scoreworks.musicxml.model.Tempo;
import net.scoreworks.musicxml.model.TextDirective;
import net.scoreworks.musicxml.model.TextRun;
import net.scoreworks.musicxml.model.Tie;
import net.scoreworks.musicxml.model.Trill;
import net.scoreworks.musicxml.model.Tuplet;
import net.scoreworks.musicxml.model.Turn;
import net.scoreworks.musicxml.model.Verse;
import net.scoreworks.musicxml.tree.Child;

import java.util.Collection;
import java.util.function.Consumer;


/**
 * Writes a (formatted) Json-String of a {@link Score}. The output only depends on the content of the score, so two
 * conversions of the same document produce the same string.
 * <ul>
 *  <li>'class':    simple class name of the element</li>
 *  <li>'id':       the object id of the element. Start and end references of control elements point at these</li>
 * </ul>
 * Null fields and empty lists are left out.
 */
public final class ScoreJsonWriter {
    private static final String INDENT = "  ";

    private ScoreJsonWriter() {}

    public static String toJson(Score score, boolean prettyPrinting) {
        Serialization serialization = new Serialization(prettyPrinting);
        serialization.printScore(score);
        return serialization.strb.toString();
    }

    private static class Serialization implements StaffGroupVisitor<Void>, LayerElementVisitor<Void>,
            ControlElementVisitor<Void> {

        /**
         * adds line breaks and indentations if set to true
         */
        private final boolean prettyPrinting;

        private final StringBuilder strb = new StringBuilder();

        private int indentation;

        Serialization(boolean prettyPrinting) {
            this.prettyPrinting = prettyPrinting;
        }

        void printScore(Score score) {
            beginObject("Score", null, false);
            field("title", score.getTitle());
            field("midiBpm", score.getMidiBpm());
            if (score.getStaffGroup() != null) {
                key("staffGroup");
                score.getStaffGroup().accept(this);
            }
            Section section = score.getSection();
            if (section != null) {
                key("section");
                beginObject("Section", section, false);
                array("measures", section.getMeasures(), this::printMeasure);
                endObject();
            }
            array("controlElements", score.getControlElements(), e -> e.accept(this));
            // the root has no trailing comma
            endObject();
            strb.setLength(strb.length() - 1);
        }

        //=====STAFF GROUPS=========================================================================

        @Override
        public Void visitStaffGroup(StaffGroup staffGroup) {
            beginObject(staffGroup, staffGroup.getOwner() instanceof StaffGroup);
            field("symbol", staffGroup.getSymbol());
            field("label", staffGroup.getLabel());
            field("labelAbbr", staffGroup.getLabelAbbr());
            field("barThru", staffGroup.isBarThru());
            array("members", staffGroup.getMembers(), (StaffGroupMember m) -> m.accept(this));
            endObject();
            return null;
        }

        @Override
        public Void visitStaffDef(StaffDef staffDef) {
            beginObject(staffDef, true);
            field("n", staffDef.getN());
            field("label", staffDef.getLabel());
            field("labelAbbr", staffDef.getLabelAbbr());
            field("lines", staffDef.getLines());
            field("notationType", staffDef.getNotationType());
            field("clefShape", staffDef.getClefShape());
            field("clefLine", staffDef.getClefLine());
            field("clefDis", staffDef.getClefDis());
            field("clefDisPlace", staffDef.getClefDisPlace());
            field("keyFifths", staffDef.getKeyFifths());
            field("mixedKey", staffDef.isMixedKey());
            field("keyMode", staffDef.getKeyMode());
            field("meterSym", staffDef.getMeterSym());
            field("meterRend", staffDef.getMeterRend());
            field("meterCount", staffDef.getMeterCount());
            field("meterUnit", staffDef.getMeterUnit());
            field("scale", staffDef.getScale());
            field("transDiat", staffDef.getTransDiat());
            field("transSemi", staffDef.getTransSemi());
            field("ppq", staffDef.getPpq());
            endObject();
            return null;
        }

        //=====MEASURES=============================================================================

        private void printMeasure(Measure measure) {
            beginObject(measure, true);
            field("n", measure.getN());
            field("left", measure.getLeft());
            field("right", measure.getRight());
            array("staves", measure.getStaves(), this::printStaff);
            array("controlElements", measure.getControlElements(), e -> e.accept(this));
            endObject();
        }

        private void printStaff(Staff staff) {
            beginObject(staff, true);
            field("n", staff.getN());
            array("layers", staff.getLayers(), this::printLayer);
            endObject();
        }

        private void printLayer(Layer layer) {
            beginObject(layer, true);
            field("n", layer.getN());
            array("elements", layer.getLayerElements(), e -> e.accept(this));
            endObject();
        }

        //=====LAYER ELEMENTS=======================================================================

        @Override
        public Void visitNote(Note note) {
            beginObject(note, true);
            field("pname", note.getPname());
            field("oct", note.getOct());
            field("octGes", note.getOctGes());
            if (note.getAccid() != null) {
                key("accid");
                printAccid(note.getAccid());
            }
            field("dur", note.getDur());
            field("dots", note.getDots());
            field("stemDir", note.getStemDir());
            field("stemMod", note.getStemMod());
            field("cue", note.isCue());
            field("grace", note.getGrace());
            field("visible", note.getVisible());
            field("color", note.getColor());
            printArtics(note);
            array("verses", note.getVerses(), this::printVerse);
            endObject();
            return null;
        }

        @Override
        public Void visitRest(Rest rest) {
            beginObject(rest, true);
            field("dur", rest.getDur());
            field("dots", rest.getDots());
            field("cue", rest.isCue());
            field("ploc", rest.getPloc());
            field("oloc", rest.getOloc());
            printArtics(rest);
            endObject();
            return null;
        }

        @Override
        public Void visitMRest(MRest mRest) {
            beginObject(mRest, true);
            field("cue", mRest.isCue());
            field("ploc", mRest.getPloc());
            field("oloc", mRest.getOloc());
            field("visible", mRest.getVisible());
            endObject();
            return null;
        }

        @Override
        public Void visitSpace(Space space) {
            beginObject(space, true);
            field("dur", space.getDur());
            endObject();
            return null;
        }

        @Override
        public Void visitClef(Clef clef) {
            beginObject(clef, true);
            field("shape", clef.getShape());
            field("line", clef.getLine());
            field("dis", clef.getDis());
            field("disPlace", clef.getDisPlace());
            endObject();
            return null;
        }

        @Override
        public Void visitMRpt(MRpt mRpt) {
            beginObject(mRpt, true);
            endObject();
            return null;
        }

        @Override
        public Void visitChord(Chord chord) {
            beginObject(chord, true);
            field("dur", chord.getDur());
            field("dots", chord.getDots());
            field("stemDir", chord.getStemDir());
            field("stemMod", chord.getStemMod());
            field("cue", chord.isCue());
            printLayerElements(chord);
            endObject();
            return null;
        }

        @Override
        public Void visitBeam(Beam beam) {
            beginObject(beam, true);
            printLayerElements(beam);
            endObject();
            return null;
        }

        @Override
        public Void visitTuplet(Tuplet tuplet) {
            beginObject(tuplet, true);
            field("num", tuplet.getNum());
            field("numbase", tuplet.getNumbase());
            field("numFormat", tuplet.getNumFormat());
            field("numPlace", tuplet.getNumPlace());
            field("numVisible", tuplet.getNumVisible());
            field("bracketPlace", tuplet.getBracketPlace());
            field("bracketVisible", tuplet.getBracketVisible());
            printLayerElements(tuplet);
            endObject();
            return null;
        }

        @Override
        public Void visitBTrem(BTrem bTrem) {
            beginObject(bTrem, true);
            printLayerElements(bTrem);
            endObject();
            return null;
        }

        @Override
        public Void visitFTrem(FTrem fTrem) {
            beginObject(fTrem, true);
            field("slash", fTrem.getSlash());
            printLayerElements(fTrem);
            endObject();
            return null;
        }

        private void printLayerElements(ContainerElement container) {
            array("elements", container.getLayerElements(), (LayerElement e) -> e.accept(this));
        }

        private void printArtics(LayerElement element) {
            array("artics", element.getArtics(), (Artic artic) -> {
                beginObject("Artic", null, true);
                field("type", artic.getType());
                array("artic", artic.getArtics(), a -> {
                    newLine();
                    value(a);
                    strb.append(",");
                });
                endObject();
            });
        }

        private void printAccid(Accid accid) {
            beginObject("Accid", null, false);
            field("accid", accid.getAccid());
            field("accidGes", accid.getAccidGes());
            field("func", accid.getFunc());
            field("enclose", accid.getEnclose());
            field("color", accid.getColor());
            endObject();
        }

        private void printVerse(Verse verse) {
            beginObject("Verse", null, true);
            field("n", verse.getN());
            field("color", verse.getColor());
            array("syls", verse.getSyls(), (Syl syl) -> {
                beginObject("Syl", null, true);
                field("text", syl.getText());
                field("con", syl.getCon());
                field("wordPos", syl.getWordPos());
                field("lang", syl.getLang());
                field("fontStyle", syl.getFontStyle());
                field("fontWeight", syl.getFontWeight());
                endObject();
            });
            endObject();
        }

        //=====CONTROL ELEMENTS=====================================================================

        private void beginControlElement(ControlElement element) {
            beginObject(element, true);
            field("measure", element.getMeasureN());
            field("startid", element.getStartId());
            field("endid", element.getEndId());
            field("staff", element.getStaff());
            field("tstamp", element.getTstamp());
            field("place", element.getPlace());
            field("color", element.getColor());
        }

        private void printText(TextDirective directive) {
            field("lang", directive.getLang());
            array("text", directive.getText(), (TextRun run) -> {
                beginObject("TextRun", null, true);
                field("text", run.getText());
                Rend rend = run.getRend();
                if (rend != null) {
                    key("rend");
                    beginObject("Rend", null, false);
                    field("halign", rend.getHalign());
                    field("color", rend.getColor());
                    field("fontFamily", rend.getFontFamily());
                    field("fontStyle", rend.getFontStyle());
                    field("fontWeight", rend.getFontWeight());
                    field("lang", rend.getLang());
                    endObject();
                }
                endObject();
            });
        }

        @Override
        public Void visitTie(Tie tie) {
            beginControlElement(tie);
            field("curvedir", tie.getCurvedir());
            endObject();
            return null;
        }

        @Override
        public Void visitSlur(Slur slur) {
            beginControlElement(slur);
            field("curvedir", slur.getCurvedir());
            endObject();
            return null;
        }

        @Override
        public Void visitHairpin(Hairpin hairpin) {
            beginControlElement(hairpin);
            field("form", hairpin.getForm());
            endObject();
            return null;
        }

        @Override
        public Void visitDir(Dir dir) {
            beginControlElement(dir);
            printText(dir);
            endObject();
            return null;
        }

        @Override
        public Void visitDynam(Dynam dynam) {
            beginControlElement(dynam);
            printText(dynam);
            endObject();
            return null;
        }

        @Override
        public Void visitHarm(Harm harm) {
            beginControlElement(harm);
            field("type", harm.getType());
            printText(harm);
            endObject();
            return null;
        }

        @Override
        public Void visitTempo(Tempo tempo) {
            beginControlElement(tempo);
            field("mm", tempo.getMm());
            field("mmUnit", tempo.getMmUnit());
            field("mmDots", tempo.getMmDots());
            field("midiBpm", tempo.getMidiBpm());
            printText(tempo);
            endObject();
            return null;
        }

        @Override
        public Void visitPedal(Pedal pedal) {
            beginControlElement(pedal);
            field("dir", pedal.getDir());
            endObject();
            return null;
        }

        @Override
        public Void visitFermata(Fermata fermata) {
            beginControlElement(fermata);
            field("shape", fermata.getShape());
            field("form", fermata.getForm());
            endObject();
            return null;
        }

        @Override
        public Void visitOctave(Octave octave) {
            beginControlElement(octave);
            field("dis", octave.getDis());
            field("disPlace", octave.getDisPlace());
            endObject();
            return null;
        }

        @Override
        public Void visitMordent(Mordent mordent) {
            beginControlElement(mordent);
            field("form", mordent.getForm());
            field("long", mordent.getLong());
            endObject();
            return null;
        }

        @Override
        public Void visitTrill(Trill trill) {
            beginControlElement(trill);
            endObject();
            return null;
        }

        @Override
        public Void visitTurn(Turn turn) {
            beginControlElement(turn);
            field("form", turn.getForm());
            endObject();
            return null;
        }

        //=====PRINTING=============================================================================

        private void beginObject(Child<?> element, boolean newLine) {
            beginObject(element.getClass().getSimpleName(), element, newLine);
        }

        private void beginObject(String className, Child<?> element, boolean newLine) {
            if (newLine)
                newLine();
            strb.append("{");
            indentation++;
            field("class", className);
            if (element != null)
                field("id", element.getObjectId().toString());
        }

        private void endObject() {
            //erase last comma, if last character is a comma (leave brackets alone)
            if (strb.charAt(strb.length() - 1) == ',')
                strb.setLength(strb.length() - 1);
            indentation--;
            newLine();
            strb.append("},");
        }

        private void key(String name) {
            newLine();
            strb.append("\"").append(name).append("\":");
        }

        private void field(String name, Object value) {
            if (value == null)
                return;
            key(name);
            value(value);
            strb.append(",");
        }

        private void value(Object value) {
            if (value instanceof Number || value instanceof Boolean)
                strb.append(value);
            else
                strb.append("\"").append(escape(value.toString())).append("\"");
        }

        private <T> void array(String name, Collection<T> items, Consumer<T> printer) {
            if (items.isEmpty())
                return;
            key(name);
            strb.append("[");
            indentation++;
            for (T item : items) {
                printer.accept(item);
            }
            strb.setLength(strb.length() - 1);
            indentation--;
            newLine();
            strb.append("],");
        }

        private void newLine() {
            if (prettyPrinting)
                newIndentedLine(strb, indentation);
        }
    }

    static String escape(String string) {
        StringBuilder escaped = new StringBuilder(string.length());
        for (char c : string.toCharArray()) {
            switch (c) {
                case '"':
                    escaped.append("\\\"");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                default:
                    if (c < 0x20)
                        escaped.append(String.format("\\u%04x", (int) c));
                    else
                        escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static void newIndentedLine(StringBuilder strb, int number) {
        strb.append("\n");
        while (number > 0) {
            strb.append(INDENT);
            number--;
        }
    }
}

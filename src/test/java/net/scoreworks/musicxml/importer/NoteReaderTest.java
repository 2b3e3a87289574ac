package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Accid;
import net.scoreworks.musicxml.model.AccidentalExplicit;
import net.scoreworks.musicxml.model.AccidentalImplicit;
import net.scoreworks.musicxml.model.Artic;
import net.scoreworks.musicxml.model.Articulation;
import net.scoreworks.musicxml.model.BTrem;
import net.scoreworks.musicxml.model.Beam;
import net.scoreworks.musicxml.model.Chord;
import net.scoreworks.musicxml.model.Clef;
import net.scoreworks.musicxml.model.ClefShape;
import net.scoreworks.musicxml.model.ControlElement;
import net.scoreworks.musicxml.model.Duration;
import net.scoreworks.musicxml.model.Dynam;
import net.scoreworks.musicxml.model.Fermata;
import net.scoreworks.musicxml.model.LayerElement;
import net.scoreworks.musicxml.model.MRpt;
import net.scoreworks.musicxml.model.Measure;
import net.scoreworks.musicxml.model.Note;
import net.scoreworks.musicxml.model.Octave;
import net.scoreworks.musicxml.model.OctaveDis;
import net.scoreworks.musicxml.model.PitchName;
import net.scoreworks.musicxml.model.Place;
import net.scoreworks.musicxml.model.Rest;
import net.scoreworks.musicxml.model.Space;
import net.scoreworks.musicxml.model.StaffRel;
import net.scoreworks.musicxml.model.StemModifier;
import net.scoreworks.musicxml.model.Syl;
import net.scoreworks.musicxml.model.Tie;
import net.scoreworks.musicxml.model.Tuplet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.scoreworks.musicxml.importer.MusicXmlFixtures.note;
import static net.scoreworks.musicxml.importer.MusicXmlFixtures.quarter;
import static net.scoreworks.musicxml.importer.MusicXmlFixtures.singlePart;

public class NoteReaderTest {

    private static Measure measure(MusicXmlInput input, int idx) {
        return input.getScore().getSection().getMeasure(idx);
    }

    private static List<LayerElement> elements(MusicXmlInput input, int measureIdx) {
        return measure(input, measureIdx).getStaff(0).getLayer(1).getLayerElements();
    }

    @Test
    public void testChordOnSameOnset() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                quarter("C", 4) + note("E", 4, 480, "quarter", "<chord/>")));
        List<LayerElement> elements = elements(input, 0);
        Assertions.assertEquals(1, elements.size());
        Chord chord = (Chord) elements.get(0);
        Assertions.assertEquals(Duration.QUARTER, chord.getDur());
        Assertions.assertEquals(0, chord.getDots());
        List<Note> notes = chord.getNotes();
        Assertions.assertEquals(2, notes.size());
        Assertions.assertEquals(PitchName.C, notes.get(0).getPname());
        Assertions.assertEquals(PitchName.E, notes.get(1).getPname());
        for (Note note : notes) {
            Assertions.assertEquals(Duration.NONE, note.getDur());
        }
    }

    @Test
    public void testChordsFollowingEachOther() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 4, 960, "half", "<dot/>")
                        + note("E", 4, 960, "half", "<chord/><dot/>")
                        + quarter("D", 4)
                        + note("F", 4, 480, "quarter", "<chord/>")));
        List<LayerElement> elements = elements(input, 0);
        Assertions.assertEquals(2, elements.size());
        Assertions.assertEquals(1, ((Chord) elements.get(0)).getDots());
        Assertions.assertEquals(Duration.QUARTER, ((Chord) elements.get(1)).getDur());
        Assertions.assertEquals(2, ((Chord) elements.get(1)).getNotes().size());
    }

    @Test
    public void testOctaveShiftDown() {
        String shiftDown = "<direction><direction-type><octave-shift type=\"down\" size=\"8\"/></direction-type></direction>";
        String shiftStop = "<direction><direction-type><octave-shift type=\"stop\" size=\"8\"/></direction-type></direction>";
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                shiftDown + quarter("C", 5) + quarter("D", 5) + shiftStop + quarter("C", 5) + quarter("C", 5)));
        List<LayerElement> elements = elements(input, 0);
        Note first = (Note) elements.get(0);
        Note second = (Note) elements.get(1);
        Note third = (Note) elements.get(2);
        Assertions.assertEquals(4, first.getOct());
        Assertions.assertEquals(Integer.valueOf(5), first.getOctGes());
        Assertions.assertEquals(4, second.getOct());
        Assertions.assertEquals(5, third.getOct());
        Assertions.assertNull(third.getOctGes());

        List<ControlElement> controlElements = measure(input, 0).getControlElements();
        Assertions.assertEquals(1, controlElements.size());
        Octave octave = (Octave) controlElements.get(0);
        Assertions.assertEquals(OctaveDis.DIS_8, octave.getDis());
        Assertions.assertEquals(Place.BELOW, octave.getDisPlace());
        Assertions.assertEquals(Integer.valueOf(1), octave.getStaff());
        Assertions.assertEquals(first.getReference(), octave.getStartId());
        Assertions.assertEquals(second.getReference(), octave.getEndId());
    }

    @Test
    public void testTwoOctavesUp() {
        String shiftUp = "<direction><direction-type><octave-shift type=\"up\" size=\"15\"/></direction-type></direction>";
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1, shiftUp + quarter("C", 2)));
        Note note = (Note) elements(input, 0).get(0);
        Assertions.assertEquals(4, note.getOct());
        Assertions.assertEquals(Integer.valueOf(2), note.getOctGes());
        Octave octave = (Octave) measure(input, 0).getControlElements().get(0);
        Assertions.assertEquals(OctaveDis.DIS_15, octave.getDis());
        Assertions.assertEquals(Place.ABOVE, octave.getDisPlace());
        Assertions.assertFalse(octave.hasEndId());
    }

    @Test
    public void testTieAcrossMeasures() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 4, 1920, "whole", "<notations><tied type=\"start\"/></notations>"),
                note("C", 4, 1920, "whole", "<notations><tied type=\"stop\"/></notations>")));
        List<ControlElement> controlElements = measure(input, 0).getControlElements();
        Assertions.assertEquals(1, controlElements.size());
        Tie tie = (Tie) controlElements.get(0);
        Assertions.assertEquals(elements(input, 0).get(0).getReference(), tie.getStartId());
        Assertions.assertEquals(elements(input, 1).get(0).getReference(), tie.getEndId());
        Assertions.assertTrue(measure(input, 1).getControlElements().isEmpty());
        Assertions.assertTrue(input.getWarnings().isEmpty());
    }

    @Test
    public void testTieWithoutStopIsClosedByMatchingNote() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 4, 960, "half", "<notations><tied type=\"start\"/></notations>")
                        + note("C", 4, 960, "half", "")));
        Tie tie = (Tie) measure(input, 0).getControlElements().get(0);
        Assertions.assertEquals(elements(input, 0).get(1).getReference(), tie.getEndId());
        Assertions.assertEquals(1, input.getWarnings().count("tie stop is missing"));
    }

    @Test
    public void testUnmatchedTieKeepsStartOnly() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 4, 960, "half", "<notations><tied type=\"start\"/></notations>")
                        + note("D", 4, 960, "half", "<notations><tied type=\"stop\"/></notations>")));
        Tie tie = (Tie) measure(input, 0).getControlElements().get(0);
        Assertions.assertTrue(tie.hasStartId());
        Assertions.assertFalse(tie.hasEndId());
    }

    @Test
    public void testRests() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                "<note print-object=\"no\"><rest/><duration>480</duration><voice>1</voice><type>quarter</type></note>"
                        + "<note><rest><display-step>E</display-step><display-octave>4</display-octave></rest>"
                        + "<duration>1440</duration><voice>1</voice><type>half</type><dot/></note>"));
        List<LayerElement> elements = elements(input, 0);
        Assertions.assertEquals(Duration.QUARTER, ((Space) elements.get(0)).getDur());
        Rest rest = (Rest) elements.get(1);
        Assertions.assertEquals(Duration.HALF, rest.getDur());
        Assertions.assertEquals(1, rest.getDots());
        Assertions.assertEquals(PitchName.E, rest.getPloc());
        Assertions.assertEquals(Integer.valueOf(4), rest.getOloc());
    }

    @Test
    public void testAccidentals() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                "<note><pitch><step>F</step><alter>1</alter><octave>4</octave></pitch><duration>480</duration>"
                        + "<voice>1</voice><type>quarter</type>"
                        + "<accidental cautionary=\"yes\" parentheses=\"yes\">sharp</accidental></note>"
                        + "<note><pitch><step>B</step><alter>-1</alter><octave>4</octave></pitch><duration>480</duration>"
                        + "<voice>1</voice><type>quarter</type></note>"
                        + "<note><pitch><step>B</step><alter>3</alter><octave>4</octave></pitch><duration>960</duration>"
                        + "<voice>1</voice><type>half</type></note>"));
        List<LayerElement> elements = elements(input, 0);
        Accid written = ((Note) elements.get(0)).getAccid();
        Assertions.assertEquals(AccidentalExplicit.SHARP, written.getAccid());
        Assertions.assertEquals(Accid.Func.CAUTION, written.getFunc());
        Assertions.assertEquals(Accid.Enclosure.PAREN, written.getEnclose());
        Assertions.assertEquals(AccidentalImplicit.FLAT, ((Note) elements.get(1)).getAccid().getAccidGes());
        Assertions.assertEquals(AccidentalImplicit.NONE, ((Note) elements.get(2)).getAccid().getAccidGes());
        Assertions.assertEquals(1, input.getWarnings().count("Unsupported alter value '3'"));
    }

    @Test
    public void testLyrics() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 4, 960, "half", "<lyric number=\"1\"><syllabic>begin</syllabic><text>Hal</text></lyric>")
                        + note("D", 4, 480, "quarter",
                        "<lyric number=\"1\"><syllabic>end</syllabic><text>lo</text><extend/></lyric>")
                        + note("E", 4, 480, "quarter", "<lyric><syllabic>single</syllabic><text>a</text>"
                        + "<elision/><syllabic>single</syllabic><text>b</text></lyric>")));
        List<LayerElement> elements = elements(input, 0);
        Syl begin = ((Note) elements.get(0)).getVerses().get(0).getSyls().get(0);
        Assertions.assertEquals("Hal", begin.getText());
        Assertions.assertEquals(Syl.Con.DASH, begin.getCon());
        Assertions.assertEquals(Syl.WordPos.INITIAL, begin.getWordPos());

        Syl end = ((Note) elements.get(1)).getVerses().get(0).getSyls().get(0);
        Assertions.assertEquals(Syl.Con.UNDERSCORE, end.getCon());
        Assertions.assertEquals(Syl.WordPos.TERMINAL, end.getWordPos());

        Note elided = (Note) elements.get(2);
        Assertions.assertEquals(1, elided.getVerses().get(0).getN());
        List<Syl> syls = elided.getVerses().get(0).getSyls();
        Assertions.assertEquals(2, syls.size());
        Assertions.assertEquals(Syl.Con.BRIDGE, syls.get(0).getCon());
        Assertions.assertEquals(Syl.Con.NONE, syls.get(1).getCon());
    }

    @Test
    public void testArticulationGroups() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 4, 1920, "whole", "<notations><articulations><staccato/><scoop/><tenuto/></articulations>"
                        + "<technical><up-bow/></technical><technical><fingering>1</fingering></technical></notations>")));
        List<Artic> artics = elements(input, 0).get(0).getArtics();
        Assertions.assertEquals(2, artics.size());
        Assertions.assertNull(artics.get(0).getType());
        Assertions.assertEquals(List.of(Articulation.STACC, Articulation.TEN), artics.get(0).getArtics());
        Assertions.assertTrue(artics.get(1).isTechnical());
        Assertions.assertEquals(List.of(Articulation.UPBOW), artics.get(1).getArtics());
        Assertions.assertTrue(input.getWarnings().isEmpty());
    }

    @Test
    public void testGraceNotes() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                "<note><grace slash=\"yes\"/><pitch><step>D</step><octave>5</octave></pitch><voice>1</voice>"
                        + "<type>eighth</type></note>"
                        + "<note><grace/><pitch><step>D</step><octave>5</octave></pitch><voice>1</voice>"
                        + "<type>eighth</type></note>"
                        + note("C", 5, 1920, "whole", "")));
        List<LayerElement> elements = elements(input, 0);
        Note slashed = (Note) elements.get(0);
        Assertions.assertEquals(Note.Grace.SLASHED, slashed.getGrace());
        Assertions.assertEquals(StemModifier.SLASH_1, slashed.getStemMod());
        Assertions.assertEquals(Note.Grace.UNSPECIFIED, ((Note) elements.get(1)).getGrace());
        Assertions.assertNull(((Note) elements.get(2)).getGrace());
    }

    @Test
    public void testBeamedTriplet() {
        String timeModification = "<time-modification><actual-notes>3</actual-notes><normal-notes>2</normal-notes>"
                + "</time-modification>";
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 5, 160, "eighth", timeModification + "<beam number=\"1\">begin</beam>"
                        + "<notations><tuplet type=\"start\" bracket=\"yes\"/></notations>")
                        + note("D", 5, 160, "eighth", timeModification + "<beam number=\"1\">continue</beam>")
                        + note("E", 5, 160, "eighth", timeModification + "<beam number=\"1\">end</beam>"
                        + "<notations><tuplet type=\"stop\"/></notations>")
                        + note("F", 5, 1440, "half", "<dot/>")));
        List<LayerElement> elements = elements(input, 0);
        Assertions.assertEquals(2, elements.size());
        Beam beam = (Beam) elements.get(0);
        Assertions.assertEquals(1, beam.getLayerElements().size());
        Tuplet tuplet = (Tuplet) beam.getLayerElements().get(0);
        Assertions.assertEquals(Integer.valueOf(3), tuplet.getNum());
        Assertions.assertEquals(Integer.valueOf(2), tuplet.getNumbase());
        Assertions.assertEquals(Boolean.TRUE, tuplet.getBracketVisible());
        Assertions.assertEquals(3, tuplet.getLayerElements().size());
        Assertions.assertTrue(elements.get(1) instanceof Note);
    }

    @Test
    public void testSingleTremolo() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 5, 1920, "whole", "<notations><ornaments><tremolo type=\"single\">3</tremolo></ornaments>"
                        + "</notations>")));
        BTrem bTrem = (BTrem) elements(input, 0).get(0);
        Note note = (Note) bTrem.getLayerElements().get(0);
        Assertions.assertEquals(StemModifier.SLASH_3, note.getStemMod());
    }

    @Test
    public void testMeasureRepeat() {
        String four = quarter("C", 4) + quarter("C", 4) + quarter("C", 4) + quarter("C", 4);
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                four,
                "<attributes><measure-style><measure-repeat type=\"start\">1</measure-repeat></measure-style>"
                        + "</attributes>" + four,
                four,
                "<attributes><measure-style><measure-repeat type=\"stop\"/></measure-style></attributes>" + four));
        Assertions.assertEquals(4, elements(input, 0).size());
        for (int i = 1; i <= 2; i++) {
            List<LayerElement> elements = elements(input, i);
            Assertions.assertEquals(1, elements.size());
            Assertions.assertTrue(elements.get(0) instanceof MRpt);
        }
        Assertions.assertEquals(4, elements(input, 3).size());
    }

    @Test
    public void testClefChange() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 5, 960, "half", "")
                        + "<attributes><clef><sign>F</sign><line>4</line><clef-octave-change>-1</clef-octave-change>"
                        + "</clef></attributes>"
                        + note("C", 3, 960, "half", "")));
        List<LayerElement> elements = elements(input, 0);
        Assertions.assertEquals(3, elements.size());
        Clef clef = (Clef) elements.get(1);
        Assertions.assertEquals(ClefShape.F, clef.getShape());
        Assertions.assertEquals(4, clef.getLine());
        Assertions.assertEquals(OctaveDis.DIS_8, clef.getDis());
        Assertions.assertEquals(Place.BELOW, clef.getDisPlace());
    }

    @Test
    public void testNotationsOnNote() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 5, 1920, "whole", "<notations><dynamics placement=\"above\"><sf/></dynamics>"
                        + "<fermata type=\"inverted\">angled</fermata></notations>")));
        String reference = elements(input, 0).get(0).getReference();
        List<ControlElement> controlElements = measure(input, 0).getControlElements();
        Assertions.assertEquals(2, controlElements.size());
        Dynam dynam = (Dynam) controlElements.get(0);
        Assertions.assertEquals("sf", dynam.getPlainText());
        Assertions.assertEquals(StaffRel.ABOVE, dynam.getPlace());
        Assertions.assertEquals(reference, dynam.getStartId());
        Fermata fermata = (Fermata) controlElements.get(1);
        Assertions.assertEquals(Fermata.Form.INV, fermata.getForm());
        Assertions.assertEquals(Fermata.Shape.ANGULAR, fermata.getShape());
        Assertions.assertEquals(StaffRel.BELOW, fermata.getPlace());
        Assertions.assertEquals(reference, fermata.getStartId());
    }

    @Test
    public void testUnknownTypeWarnsOnce() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1, note("C", 5, 1920, "wholish", "")));
        Assertions.assertEquals(Duration.NONE, ((Note) elements(input, 0).get(0)).getDur());
        Assertions.assertEquals(1, input.getWarnings().count("Unsupported type 'wholish'"));
    }
}

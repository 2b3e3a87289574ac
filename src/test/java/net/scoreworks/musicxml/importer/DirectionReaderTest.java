package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.ControlElement;
import net.scoreworks.musicxml.model.Dir;
import net.scoreworks.musicxml.model.Duration;
import net.scoreworks.musicxml.model.Dynam;
import net.scoreworks.musicxml.model.Hairpin;
import net.scoreworks.musicxml.model.Harm;
import net.scoreworks.musicxml.model.LayerElement;
import net.scoreworks.musicxml.model.Measure;
import net.scoreworks.musicxml.model.Note;
import net.scoreworks.musicxml.model.Octave;
import net.scoreworks.musicxml.model.OctaveDis;
import net.scoreworks.musicxml.model.Pedal;
import net.scoreworks.musicxml.model.Rend;
import net.scoreworks.musicxml.model.StaffRel;
import net.scoreworks.musicxml.model.Tempo;
import net.scoreworks.musicxml.model.TextRun;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.scoreworks.musicxml.importer.MusicXmlFixtures.note;
import static net.scoreworks.musicxml.importer.MusicXmlFixtures.quarter;
import static net.scoreworks.musicxml.importer.MusicXmlFixtures.singlePart;

public class DirectionReaderTest {

    private static Measure measure(MusicXmlInput input, int idx) {
        return input.getScore().getSection().getMeasure(idx);
    }

    private static List<LayerElement> elements(MusicXmlInput input, int measureIdx) {
        return measure(input, measureIdx).getStaff(0).getLayer(1).getLayerElements();
    }

    private static String direction(String type) {
        return "<direction><direction-type>" + type + "</direction-type></direction>";
    }

    @Test
    public void testPendingDirectionsStartAtNextNote() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                quarter("C", 4)
                        + direction("<words>cantabile</words>")
                        + direction("<dynamics><mf/></dynamics>")
                        + "<harmony><root><root-step>F</root-step></root><kind text=\"maj7\">major-seventh</kind></harmony>"
                        + quarter("D", 4)
                        + note("E", 4, 960, "half", "")));
        String d4 = elements(input, 0).get(1).getReference();
        List<ControlElement> controlElements = measure(input, 0).getControlElements();
        Assertions.assertEquals(3, controlElements.size());
        for (ControlElement controlElement : controlElements) {
            Assertions.assertEquals(d4, controlElement.getStartId());
            Assertions.assertEquals(Integer.valueOf(1), controlElement.getStaff());
        }
        Assertions.assertEquals("cantabile", ((Dir) controlElements.get(0)).getPlainText());
        Assertions.assertEquals("mf", ((Dynam) controlElements.get(1)).getPlainText());
        Assertions.assertEquals("Fmaj7", ((Harm) controlElements.get(2)).getPlainText());
    }

    @Test
    public void testWordsRendition() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                "<direction placement=\"above\"><direction-type>"
                        + "<words font-style=\"italic\" font-weight=\"bold\" color=\"#FF0000\">espr.</words>"
                        + "<words xml:lang=\"de\">sehr</words>"
                        + "</direction-type></direction>"
                        + note("C", 4, 1920, "whole", "")));
        Dir dir = (Dir) measure(input, 0).getControlElements().get(0);
        Assertions.assertEquals(StaffRel.ABOVE, dir.getPlace());
        Assertions.assertEquals("espr.sehr", dir.getPlainText());
        List<TextRun> runs = dir.getText();
        Assertions.assertEquals(2, runs.size());
        Rend rend = runs.get(0).getRend();
        Assertions.assertNotNull(rend);
        Assertions.assertEquals("#FF0000", rend.getColor());
        Assertions.assertEquals(Rend.FontStyle.ITALIC, rend.getFontStyle());
        Assertions.assertEquals(Rend.FontWeight.BOLD, rend.getFontWeight());
        Assertions.assertNull(runs.get(1).getRend());
    }

    @Test
    public void testMetronome() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                direction("<metronome parentheses=\"yes\"><beat-unit>quarter</beat-unit><beat-unit-dot/>"
                        + "<per-minute>120</per-minute></metronome>")
                        + note("C", 4, 1920, "whole", "")));
        Tempo tempo = (Tempo) measure(input, 0).getControlElements().get(0);
        Assertions.assertEquals("(M.M. = 120)", tempo.getPlainText());
        Assertions.assertEquals(Integer.valueOf(120), tempo.getMm());
        Assertions.assertEquals(Duration.QUARTER, tempo.getMmUnit());
        Assertions.assertEquals(1, tempo.getMmDots());
        Assertions.assertEquals(elements(input, 0).get(0).getReference(), tempo.getStartId());
    }

    @Test
    public void testWordsWithSoundTempo() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                "<direction><direction-type><words>Allegro</words></direction-type><sound tempo=\"132\"/></direction>"
                        + note("C", 4, 1920, "whole", "")));
        List<ControlElement> controlElements = measure(input, 0).getControlElements();
        Assertions.assertEquals(1, controlElements.size());
        Tempo tempo = (Tempo) controlElements.get(0);
        Assertions.assertEquals("Allegro", tempo.getPlainText());
        Assertions.assertEquals(Integer.valueOf(132), tempo.getMidiBpm());
        Assertions.assertNull(tempo.getMm());
    }

    @Test
    public void testHairpinEndsAtLastElementBeforeStop() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                direction("<wedge type=\"diminuendo\" number=\"2\"/>")
                        + quarter("G", 4) + quarter("F", 4) + quarter("E", 4)
                        + direction("<wedge type=\"stop\" number=\"2\"/>")
                        + quarter("D", 4)));
        List<LayerElement> elements = elements(input, 0);
        Hairpin hairpin = (Hairpin) measure(input, 0).getControlElements().get(0);
        Assertions.assertEquals(Hairpin.Form.DIM, hairpin.getForm());
        Assertions.assertEquals(elements.get(0).getReference(), hairpin.getStartId());
        Assertions.assertEquals(elements.get(2).getReference(), hairpin.getEndId());
    }

    @Test
    public void testUnmatchedHairpinStop() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                note("C", 4, 1920, "whole", "") + direction("<wedge type=\"stop\"/>")));
        Assertions.assertTrue(measure(input, 0).getControlElements().isEmpty());
        Assertions.assertEquals(1, input.getWarnings().count("Closing hairpin 1 could not be matched"));
    }

    @Test
    public void testPedal() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                direction("<pedal type=\"start\"/>")
                        + note("C", 4, 1920, "whole", "")
                        + direction("<pedal type=\"stop\"/>")));
        String c4 = elements(input, 0).get(0).getReference();
        List<ControlElement> controlElements = measure(input, 0).getControlElements();
        Pedal down = (Pedal) controlElements.get(0);
        Assertions.assertEquals(Pedal.Dir.DOWN, down.getDir());
        Assertions.assertEquals(c4, down.getStartId());
        //no note follows, the release stays at the last note
        Pedal up = (Pedal) controlElements.get(1);
        Assertions.assertEquals(Pedal.Dir.UP, up.getDir());
        Assertions.assertEquals(c4, up.getStartId());
    }

    @Test
    public void testUnsupportedDirectionType() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1,
                direction("<rehearsal>A</rehearsal>") + note("C", 4, 1920, "whole", "")));
        Assertions.assertTrue(measure(input, 0).getControlElements().isEmpty());
        Assertions.assertEquals(1, input.getWarnings().count("Unsupported direction-type 'rehearsal'"));
    }

    @Test
    public void testOctaveShiftOnSecondStaff() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(2,
                "<direction><direction-type><octave-shift type=\"up\" size=\"8\"/></direction-type>"
                        + "<staff>2</staff></direction>"
                        + note("C", 5, 1920, "whole", "<staff>1</staff>")
                        + "<backup><duration>1920</duration></backup>"
                        + note("C", 2, 1920, "whole", "<staff>2</staff>")));
        Measure measure = measure(input, 0);
        Note upper = (Note) measure.getStaff(0).getLayer(1).getLayerElements().get(0);
        Note lower = (Note) measure.getStaff(1).getLayer(1).getLayerElements().get(0);
        Assertions.assertEquals(5, upper.getOct());
        Assertions.assertEquals(3, lower.getOct());
        Octave octave = (Octave) measure.getControlElements().get(0);
        Assertions.assertEquals(OctaveDis.DIS_8, octave.getDis());
    }
}

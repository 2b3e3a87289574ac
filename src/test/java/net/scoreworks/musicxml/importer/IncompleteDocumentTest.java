package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Score;
import net.scoreworks.musicxml.model.StaffDef;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.scoreworks.musicxml.importer.MusicXmlFixtures.note;
import static net.scoreworks.musicxml.importer.MusicXmlFixtures.singlePart;

/**
 * Documents that parse but lack parts of the usual structure still import
 */
public class IncompleteDocumentTest {

    private static String wholeNote() {
        return note("C", 4, 1920, "whole", "");
    }

    @Test
    public void testNoScoreTempo() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1, wholeNote()));
        Score score = input.getScore();
        Assertions.assertNull(score.getMidiBpm());
        Assertions.assertEquals(1, score.getSection().getMeasureCount());
        Assertions.assertTrue(input.getWarnings().isEmpty());
    }

    @Test
    public void testMissingPartList() {
        MusicXmlInput input = MusicXmlFixtures.importString("<score-partwise version=\"4.0\"><part id=\"P1\">"
                + "<measure number=\"1\">" + wholeNote() + "</measure></part></score-partwise>");
        Score score = input.getScore();
        Assertions.assertEquals(1, input.getWarnings().count("Could not find the 'part-list' element"));
        Assertions.assertEquals(0, score.getSection().getMeasureCount());
        Assertions.assertTrue(score.getStaffGroup().getMembers().isEmpty());
    }

    @Test
    public void testEmptyPartList() {
        MusicXmlInput input = MusicXmlFixtures.importString("<score-partwise><part-list/></score-partwise>");
        Assertions.assertEquals(0, input.getScore().getSection().getMeasureCount());
        Assertions.assertTrue(input.getWarnings().isEmpty());
    }

    @Test
    public void testScorePartWithoutPart() {
        String document = singlePart(1, wholeNote()).replace("</part-list>",
                "<score-part id=\"P2\"><part-name>Gone</part-name></score-part></part-list>");
        MusicXmlInput input = MusicXmlFixtures.importString(document);
        Assertions.assertEquals(1, input.getWarnings().count("No measure to load for part 'P2'"));
        Assertions.assertEquals(1, input.getScore().getStaffGroup().getStaffDefs().size());
        Assertions.assertEquals(1, input.getScore().getSection().getMeasure(0).getStaffCount());
    }

    @Test
    public void testPartIdWithQuote() {
        String document = singlePart(1, wholeNote()).replace("\"P1\"", "\"P'1\"");
        MusicXmlInput input = MusicXmlFixtures.importString(document);
        List<StaffDef> staffDefs = input.getScore().getStaffGroup().getStaffDefs();
        Assertions.assertEquals(1, staffDefs.size());
        Assertions.assertEquals("Music", staffDefs.get(0).getLabel());
        Assertions.assertEquals(1, input.getScore().getSection().getMeasureCount());
        Assertions.assertTrue(input.getWarnings().isEmpty());
    }

    @Test
    public void testMeasureWithoutChildren() {
        MusicXmlInput input = MusicXmlFixtures.importString(singlePart(1, wholeNote(), ""));
        Assertions.assertEquals(2, input.getScore().getSection().getMeasureCount());
        Assertions.assertEquals(1, input.getScore().getSection().getMeasure(1).getStaffCount());
    }

    @Test
    public void testPartWithoutMeasures() {
        MusicXmlInput input = MusicXmlFixtures.importString("<score-partwise><part-list>"
                + "<score-part id=\"P1\"><part-name>Empty</part-name></score-part></part-list>"
                + "<part id=\"P1\"/></score-partwise>");
        Assertions.assertEquals(1, input.getWarnings().count("No measure to load for part 'P1'"));
        Assertions.assertEquals(0, input.getScore().getSection().getMeasureCount());
    }
}

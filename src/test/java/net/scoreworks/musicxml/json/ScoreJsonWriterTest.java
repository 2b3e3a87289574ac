package net.scoreworks.musicxml.json;

import net.scoreworks.musicxml.importer.MusicXmlFixtures;
import net.scoreworks.musicxml.importer.MusicXmlInput;
import net.scoreworks.musicxml.model.Score;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ScoreJsonWriterTest {

    private static String convert(boolean prettyPrinting) {
        String document = MusicXmlFixtures.resource("piano_and_violin.musicxml");
        MusicXmlInput input = MusicXmlFixtures.importString(document);
        return ScoreJsonWriter.toJson(input.getScore(), prettyPrinting);
    }

    @Test
    public void testOutputIsDeterministic() {
        Assertions.assertEquals(convert(false), convert(false));
        Assertions.assertEquals(convert(true), convert(true));
    }

    @Test
    public void testContent() {
        String json = convert(false);
        Assertions.assertTrue(json.startsWith("{\"class\":\"Score\",\"title\":\"Little Suite\",\"midiBpm\":96"));
        Assertions.assertTrue(json.endsWith("}"));
        Assertions.assertTrue(json.contains("\"label\":\"Piano\""));
        Assertions.assertTrue(json.contains("\"class\":\"Tie\""));
        Assertions.assertTrue(json.contains("\"startid\":\"#note-"));
        Assertions.assertFalse(json.contains(",}"));
        Assertions.assertFalse(json.contains(",]"));
    }

    @Test
    public void testPrettyPrintingOnlyAddsWhitespace() {
        Assertions.assertEquals(convert(false), convert(true).replaceAll("\n *", ""));
    }

    @Test
    public void testEmptyScore() {
        Assertions.assertEquals("{\"class\":\"Score\"}", ScoreJsonWriter.toJson(new Score(), false));
    }

    @Test
    public void testEscape() {
        Assertions.assertEquals("say \\\"hi\\\"\\n", ScoreJsonWriter.escape("say \"hi\"\n"));
        Assertions.assertEquals("\\u0001", ScoreJsonWriter.escape("\u0001"));
    }
}

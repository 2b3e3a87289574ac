package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Score;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static net.scoreworks.musicxml.importer.MusicXmlFixtures.note;
import static net.scoreworks.musicxml.importer.MusicXmlFixtures.singlePart;

public class MusicXmlInputTest {

    @Test
    public void testUnparsableInput() {
        Score score = new Score();
        MusicXmlInput input = new MusicXmlInput(score);
        AtomicInteger layouts = new AtomicInteger();
        input.setPageLayout(s -> layouts.incrementAndGet());
        Assertions.assertFalse(input.importString("<score-partwise><part-list></score-partwise>"));
        Assertions.assertTrue(score.isEmpty());
        Assertions.assertEquals(0, layouts.get());
    }

    @Test
    public void testTimewiseScoreIsRejected() {
        Score score = new Score();
        MusicXmlInput input = new MusicXmlInput(score);
        AtomicInteger layouts = new AtomicInteger();
        input.setPageLayout(s -> layouts.incrementAndGet());
        Assertions.assertFalse(input.importString("<score-timewise version=\"4.0\"><part-list/></score-timewise>"));
        Assertions.assertTrue(score.isEmpty());
        Assertions.assertNull(score.getSection());
        Assertions.assertEquals(0, layouts.get());
    }

    @Test
    public void testPageLayoutCalledOnce() {
        Score score = new Score();
        MusicXmlInput input = new MusicXmlInput(score);
        AtomicInteger layouts = new AtomicInteger();
        input.setPageLayout(s -> {
            Assertions.assertSame(score, s);
            //everything is attached when the layout runs
            Assertions.assertEquals(1, s.getSection().getMeasureCount());
            layouts.incrementAndGet();
        });
        Assertions.assertTrue(input.importString(singlePart(1, note("C", 4, 1920, "whole", ""))));
        Assertions.assertEquals(1, layouts.get());
    }

    @Test
    public void testDoctypeIsNotFetched() {
        //the fixture declares the public MusicXML DTD, which must not be loaded
        MusicXmlInput input = new MusicXmlInput(new Score());
        Assertions.assertTrue(input.importString(MusicXmlFixtures.resource("piano_and_violin.musicxml")));
        Assertions.assertTrue(input.getWarnings().isEmpty());
    }

    @Test
    public void testImportFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("single.musicxml");
        Files.write(file, singlePart(1, note("E", 5, 1920, "whole", "")).getBytes(StandardCharsets.UTF_8));
        MusicXmlInput input = new MusicXmlInput(new Score());
        Assertions.assertTrue(input.importFile(file));
        Assertions.assertEquals(1, input.getScore().getSection().getMeasureCount());

        Assertions.assertFalse(new MusicXmlInput(new Score()).importFile(dir.resolve("missing.musicxml")));
    }

    @Test
    public void testSecondImportIntoSameScore() {
        MusicXmlInput input = new MusicXmlInput(new Score());
        String document = singlePart(1, note("C", 4, 1920, "whole", ""));
        Assertions.assertTrue(input.importString(document));
        Assertions.assertFalse(input.importString(document));
        Assertions.assertEquals(1, input.getScore().getSection().getMeasureCount());
    }

    @Test
    public void testWarningsAreResetPerImport() {
        MusicXmlInput input = new MusicXmlInput(new Score());
        Assertions.assertTrue(input.importString(singlePart(1, note("C", 4, 1920, "semibreve", ""))));
        Assertions.assertFalse(input.getWarnings().isEmpty());
        Assertions.assertFalse(input.importString("<score-timewise/>"));
        Assertions.assertTrue(input.getWarnings().isEmpty());
    }
}

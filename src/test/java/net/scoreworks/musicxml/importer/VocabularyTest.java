package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.AccidentalExplicit;
import net.scoreworks.musicxml.model.AccidentalImplicit;
import net.scoreworks.musicxml.model.BarRendition;
import net.scoreworks.musicxml.model.ClefShape;
import net.scoreworks.musicxml.model.Duration;
import net.scoreworks.musicxml.model.PitchName;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class VocabularyTest {
    ImportWarnings warnings = new ImportWarnings();
    Vocabulary vocabulary = new Vocabulary(warnings);

    @Test
    public void testDurationNames() {
        String[] names = {"maxima", "long", "breve", "whole", "half", "quarter", "eighth", "16th", "32nd", "64th",
                "128th", "256th"};
        for (int i = 0; i < names.length; i++) {
            Assertions.assertEquals(Duration.values()[i], vocabulary.toDuration(names[i]));
        }
        Assertions.assertTrue(warnings.isEmpty());
    }

    @Test
    public void testUnknownValuesWarnOnce() {
        Assertions.assertEquals(Duration.NONE, vocabulary.toDuration("dotted-quarter"));
        Assertions.assertEquals(1, warnings.size());
        Assertions.assertEquals("Unsupported type 'dotted-quarter'", warnings.getMessages().get(0));

        Assertions.assertEquals(PitchName.NONE, vocabulary.toPitchName("H"));
        Assertions.assertEquals(AccidentalExplicit.NONE, vocabulary.toAccidental("sharp-sharp-sharp"));
        Assertions.assertEquals(ClefShape.NONE, vocabulary.toClefShape("X"));
        Assertions.assertEquals(4, warnings.size());
    }

    @Test
    public void testAccidentalNames() {
        Assertions.assertEquals(AccidentalExplicit.DOUBLE_SHARP, vocabulary.toAccidental("double-sharp"));
        Assertions.assertEquals(AccidentalExplicit.THREE_QUARTERS_FLAT, vocabulary.toAccidental("three-quarters-flat"));
        Assertions.assertEquals(AccidentalExplicit.FLAT, vocabulary.toAccidental("flat"));
    }

    @Test
    public void testAlterations() {
        Assertions.assertEquals(AccidentalImplicit.FLAT, vocabulary.toAccidentalGes("-1"));
        Assertions.assertEquals(AccidentalImplicit.SHARP_UP, vocabulary.toAccidentalGes("1.5"));
        Assertions.assertEquals(AccidentalImplicit.NATURAL, vocabulary.toAccidentalGes("0"));
        Assertions.assertEquals(AccidentalImplicit.NATURAL, vocabulary.toAccidentalGes("-0"));
        Assertions.assertEquals(AccidentalImplicit.NATURAL, vocabulary.toAccidentalGes("-0.0"));
        Assertions.assertTrue(warnings.isEmpty());
        Assertions.assertEquals(AccidentalImplicit.NONE, vocabulary.toAccidentalGes("3"));
        Assertions.assertEquals(AccidentalImplicit.NONE, vocabulary.toAccidentalGes("sharp"));
        Assertions.assertEquals(2, warnings.count("Unsupported alter value"));
    }

    @Test
    public void testBarRenditions() {
        Assertions.assertEquals(BarRendition.END, vocabulary.toBarRendition("light-heavy", false));
        Assertions.assertEquals(BarRendition.RPTEND, vocabulary.toBarRendition("light-heavy", true));
        Assertions.assertEquals(BarRendition.RPTSTART, vocabulary.toBarRendition("heavy-light", true));
        Assertions.assertEquals(BarRendition.INVIS, vocabulary.toBarRendition("none", false));
        Assertions.assertTrue(warnings.isEmpty());
        Assertions.assertEquals(BarRendition.NONE, vocabulary.toBarRendition("heavy-light", false));
        Assertions.assertEquals(1, warnings.count("Unsupported bar-style 'heavy-light'"));
    }

    @Test
    public void testClefSignPrefix() {
        Assertions.assertEquals(ClefShape.PERC, vocabulary.toClefShape("percussion"));
        Assertions.assertEquals(ClefShape.G, vocabulary.toClefShape("G"));
    }

    @Test
    public void testBooleans() {
        Assertions.assertEquals(Boolean.TRUE, Vocabulary.toBoolean("yes"));
        Assertions.assertEquals(Boolean.FALSE, Vocabulary.toBoolean("no"));
        Assertions.assertNull(Vocabulary.toBoolean("maybe"));
    }
}

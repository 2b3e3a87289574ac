/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.AccidentalExplicit;
import net.scoreworks.musicxml.model.AccidentalImplicit;
import net.scoreworks.musicxml.model.Articulation;
import net.scoreworks.musicxml.model.BarRendition;
import net.scoreworks.musicxml.model.ClefShape;
import net.scoreworks.musicxml.model.CurveDir;
import net.scoreworks.musicxml.model.Duration;
import net.scoreworks.musicxml.model.Fermata;
import net.scoreworks.musicxml.model.KeyMode;
import net.scoreworks.musicxml.model.Pedal;
import net.scoreworks.musicxml.model.PitchName;
import net.scoreworks.musicxml.model.Place;
import net.scoreworks.musicxml.model.Rend;
import net.scoreworks.musicxml.model.StaffRel;
import net.scoreworks.musicxml.model.Tuplet;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup tables from MusicXML vocabulary to model values. Unknown values of the tables that are expected to be
 * complete map to the NONE constant and produce one warning per call.
 */
public class Vocabulary {
    private static final Map<String, Duration> DURATIONS = new HashMap<>();
    private static final Map<String, PitchName> PITCH_NAMES = new HashMap<>();
    private static final Map<String, AccidentalExplicit> ACCIDENTALS = new HashMap<>();
    private static final Map<Double, AccidentalImplicit> ALTERATIONS = new HashMap<>();
    private static final Map<String, Articulation> ARTICULATIONS = new HashMap<>();
    private static final Map<String, Articulation> TECHNICALS = new HashMap<>();
    private static final Map<String, ClefShape> CLEF_SHAPES = new HashMap<>();

    static {
        DURATIONS.put("maxima", Duration.MAXIMA);
        DURATIONS.put("long", Duration.LONG);
        DURATIONS.put("breve", Duration.BREVE);
        DURATIONS.put("whole", Duration.WHOLE);
        DURATIONS.put("half", Duration.HALF);
        DURATIONS.put("quarter", Duration.QUARTER);
        DURATIONS.put("eighth", Duration.EIGHTH);
        DURATIONS.put("16th", Duration.SIXTEENTH);
        DURATIONS.put("32nd", Duration.THIRTY_SECOND);
        DURATIONS.put("64th", Duration.SIXTY_FOURTH);
        DURATIONS.put("128th", Duration.HUNDRED_TWENTY_EIGHTH);
        DURATIONS.put("256th", Duration.TWO_HUNDRED_FIFTY_SIXTH);

        for (PitchName pitchName : PitchName.values()) {
            if (pitchName != PitchName.NONE)
                PITCH_NAMES.put(pitchName.name(), pitchName);
        }

        for (AccidentalExplicit accidental : AccidentalExplicit.values()) {
            if (accidental != AccidentalExplicit.NONE)
                ACCIDENTALS.put(accidental.name().toLowerCase(Locale.ROOT).replace('_', '-'), accidental);
        }

        ALTERATIONS.put(-2.0, AccidentalImplicit.DOUBLE_FLAT);
        ALTERATIONS.put(-1.5, AccidentalImplicit.FLAT_DOWN);
        ALTERATIONS.put(-1.0, AccidentalImplicit.FLAT);
        ALTERATIONS.put(-0.5, AccidentalImplicit.FLAT_UP);
        ALTERATIONS.put(0.0, AccidentalImplicit.NATURAL);
        ALTERATIONS.put(0.5, AccidentalImplicit.SHARP_DOWN);
        ALTERATIONS.put(1.0, AccidentalImplicit.SHARP);
        ALTERATIONS.put(1.5, AccidentalImplicit.SHARP_UP);
        ALTERATIONS.put(2.0, AccidentalImplicit.DOUBLE_SHARP);

        ARTICULATIONS.put("accent", Articulation.ACC);
        ARTICULATIONS.put("detached-legato", Articulation.TEN_STACC);
        ARTICULATIONS.put("spiccato", Articulation.SPICC);
        ARTICULATIONS.put("staccatissimo", Articulation.STACCISS);
        ARTICULATIONS.put("staccato", Articulation.STACC);
        ARTICULATIONS.put("strong-accent", Articulation.MARC);
        ARTICULATIONS.put("tenuto", Articulation.TEN);

        TECHNICALS.put("down-bow", Articulation.DNBOW);
        TECHNICALS.put("harmonic", Articulation.HARM);
        TECHNICALS.put("open-string", Articulation.OPEN);
        TECHNICALS.put("snap-pizzicato", Articulation.SNAP);
        TECHNICALS.put("stopped", Articulation.STOP);
        TECHNICALS.put("up-bow", Articulation.UPBOW);

        CLEF_SHAPES.put("G", ClefShape.G);
        CLEF_SHAPES.put("F", ClefShape.F);
        CLEF_SHAPES.put("C", ClefShape.C);
        CLEF_SHAPES.put("perc", ClefShape.PERC);
        CLEF_SHAPES.put("TAB", ClefShape.TAB);
    }

    private final ImportWarnings warnings;

    public Vocabulary(ImportWarnings warnings) {
        this.warnings = warnings;
    }

    public Duration toDuration(String type) {
        Duration duration = DURATIONS.get(type);
        if (duration == null) {
            warnings.warn("Unsupported type '{}'", type);
            return Duration.NONE;
        }
        return duration;
    }

    public PitchName toPitchName(String step) {
        PitchName pitchName = PITCH_NAMES.get(step);
        if (pitchName == null) {
            warnings.warn("Unsupported pitch name '{}'", step);
            return PitchName.NONE;
        }
        return pitchName;
    }

    public AccidentalExplicit toAccidental(String value) {
        AccidentalExplicit accidental = ACCIDENTALS.get(value);
        if (accidental == null) {
            warnings.warn("Unsupported accidental value '{}'", value);
            return AccidentalExplicit.NONE;
        }
        return accidental;
    }

    /**
     * Map a chromatic alteration in semitones onto the implied accidental. Only whole and half steps between -2 and 2
     * are known
     */
    public AccidentalImplicit toAccidentalGes(String alter) {
        AccidentalImplicit accidental = null;
        if (NumberUtils.isCreatable(alter))
            accidental = ALTERATIONS.get(NumberUtils.toDouble(alter) + 0.0);  // -0 reads as 0
        if (accidental == null) {
            warnings.warn("Unsupported alter value '{}'", alter);
            return AccidentalImplicit.NONE;
        }
        return accidental;
    }

    public BarRendition toBarRendition(String style, boolean repeat) {
        switch (style) {
            case "regular":
                return BarRendition.SINGLE;
            case "dashed":
                return BarRendition.DASHED;
            case "dotted":
                return BarRendition.DOTTED;
            case "light-light":
                return BarRendition.DBL;
            case "light-heavy":
                return repeat ? BarRendition.RPTEND : BarRendition.END;
            case "heavy-light":
                if (repeat)
                    return BarRendition.RPTSTART;
                break;
            case "none":
                return BarRendition.INVIS;
            default:
                break;
        }
        warnings.warn("Unsupported bar-style '{}'", style);
        return BarRendition.NONE;
    }

    /**
     * @return the matching articulation or null for a child of &lt;articulations&gt; without counterpart
     */
    @Nullable
    public Articulation toArticulation(String name) {
        return ARTICULATIONS.get(name);
    }

    /**
     * @return the matching articulation or null for a child of &lt;technical&gt; without counterpart
     */
    @Nullable
    public Articulation toTechnical(String name) {
        return TECHNICALS.get(name);
    }

    /**
     * Clef signs are compared on their first four characters, so "percussion" reads as a percussion clef
     */
    public ClefShape toClefShape(String sign) {
        ClefShape shape = CLEF_SHAPES.get(StringUtils.left(sign, 4));
        if (shape == null) {
            warnings.warn("Unsupported clef sign '{}'", sign);
            return ClefShape.NONE;
        }
        return shape;
    }

    public KeyMode toKeyMode(String mode) {
        for (KeyMode keyMode : KeyMode.values()) {
            if (keyMode != KeyMode.NONE && keyMode.name().equalsIgnoreCase(mode))
                return keyMode;
        }
        warnings.warn("Unsupported key mode '{}'", mode);
        return KeyMode.NONE;
    }

    public Pedal.Dir toPedalDir(String type) {
        if ("start".equals(type))
            return Pedal.Dir.DOWN;
        if ("stop".equals(type))
            return Pedal.Dir.UP;
        warnings.warn("Unsupported type '{}' for pedal", type);
        return Pedal.Dir.NONE;
    }

    //=====SILENT LOOKUPS===========================================================================

    /**
     * @return true for "yes", false for "no" and null for everything else
     */
    @Nullable
    public static Boolean toBoolean(String value) {
        if ("yes".equals(value))
            return Boolean.TRUE;
        if ("no".equals(value))
            return Boolean.FALSE;
        return null;
    }

    public static CurveDir orientationToCurveDir(String orientation) {
        if ("over".equals(orientation))
            return CurveDir.ABOVE;
        if ("under".equals(orientation))
            return CurveDir.BELOW;
        return CurveDir.NONE;
    }

    public static CurveDir placementToCurveDir(String placement) {
        if ("above".equals(placement))
            return CurveDir.ABOVE;
        if ("below".equals(placement))
            return CurveDir.BELOW;
        return CurveDir.NONE;
    }

    public static StaffRel toStaffRel(String placement) {
        for (StaffRel staffRel : StaffRel.values()) {
            if (staffRel != StaffRel.NONE && staffRel.name().equalsIgnoreCase(placement))
                return staffRel;
        }
        return StaffRel.NONE;
    }

    public static Place toPlace(String placement) {
        if ("above".equals(placement))
            return Place.ABOVE;
        if ("below".equals(placement))
            return Place.BELOW;
        return Place.NONE;
    }

    public static Fermata.Shape toFermataShape(String value) {
        switch (StringUtils.trimToEmpty(value)) {
            case "normal":
                return Fermata.Shape.CURVED;
            case "angled":
                return Fermata.Shape.ANGULAR;
            case "square":
                return Fermata.Shape.SQUARE;
            default:
                return Fermata.Shape.NONE;
        }
    }

    public static Tuplet.NumFormat toNumFormat(String showNumber) {
        if ("actual".equals(showNumber))
            return Tuplet.NumFormat.COUNT;
        if ("both".equals(showNumber))
            return Tuplet.NumFormat.RATIO;
        return Tuplet.NumFormat.NONE;
    }

    @Nullable
    public static Rend.HorizontalAlign toHorizontalAlign(String halign) {
        for (Rend.HorizontalAlign align : Rend.HorizontalAlign.values()) {
            if (align != Rend.HorizontalAlign.NONE && align.name().equalsIgnoreCase(halign))
                return align;
        }
        return null;
    }

    @Nullable
    public static Rend.FontStyle toFontStyle(String style) {
        for (Rend.FontStyle fontStyle : Rend.FontStyle.values()) {
            if (fontStyle != Rend.FontStyle.NONE && fontStyle.name().equalsIgnoreCase(style))
                return fontStyle;
        }
        return null;
    }

    @Nullable
    public static Rend.FontWeight toFontWeight(String weight) {
        for (Rend.FontWeight fontWeight : Rend.FontWeight.values()) {
            if (fontWeight != Rend.FontWeight.NONE && fontWeight.name().equalsIgnoreCase(weight))
                return fontWeight;
        }
        return null;
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Duration;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Elapsed time within the current measure, in divisions. Forward elements and notes that don't belong to a chord
 * advance it, backup elements rewind it. It is only used to size fillers and never to reject input.
 */
public class DurationCursor {

    /** longest duration used for a single filler */
    static final Duration LONGEST_FILLER = Duration.HALF;

    private static final Duration[] FILLER_DURATIONS = {
            LONGEST_FILLER, Duration.QUARTER, Duration.EIGHTH, Duration.SIXTEENTH, Duration.THIRTY_SECOND,
            Duration.SIXTY_FOURTH, Duration.HUNDRED_TWENTY_EIGHTH, Duration.TWO_HUNDRED_FIFTY_SIXTH
    };

    private int durTotal;

    public void reset() {
        durTotal = 0;
    }

    public void advance(int divisions) {
        durTotal += divisions;
    }

    public void rewind(int divisions) {
        durTotal -= divisions;
    }

    /**
     * @return elapsed divisions since the start of the measure, may be negative for malformed input
     */
    public int getDurTotal() {
        return durTotal;
    }

    /**
     * Convert a number of divisions into a duration relative to a whole note
     */
    public static Fraction toWholeNotes(int divisions, int ppq) {
        return Fraction.getReducedFraction(divisions, 4 * ppq);
    }

    /**
     * Split a gap into filler durations, longest first, none longer than a half note. The split stops when the rest
     * is shorter than a 256th, so the returned durations may add up to less than the gap
     * @param divisions length of the gap
     * @param ppq divisions per quarter note
     */
    public static List<Duration> fillerDurations(int divisions, int ppq) {
        List<Duration> result = new ArrayList<>();
        if (divisions <= 0 || ppq <= 0)
            return result;
        Fraction remaining = toWholeNotes(divisions, ppq);
        int i = 0;
        while (remaining.compareTo(Fraction.ZERO) > 0 && i < FILLER_DURATIONS.length) {
            Duration candidate = FILLER_DURATIONS[i];
            if (candidate.getValue().compareTo(remaining) <= 0) {
                result.add(candidate);
                remaining = remaining.subtract(candidate.getValue());
            }
            else {
                i++;
            }
        }
        return result;
    }

    /**
     * @return the part of the gap that {@link #fillerDurations(int, int)} can't represent
     */
    public static Fraction unfilledRemainder(int divisions, int ppq) {
        if (divisions <= 0 || ppq <= 0)
            return Fraction.ZERO;
        Fraction remaining = toWholeNotes(divisions, ppq);
        for (Duration duration : fillerDurations(divisions, ppq)) {
            remaining = remaining.subtract(duration.getValue());
        }
        return remaining;
    }
}

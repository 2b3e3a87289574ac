/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

/**
 * Tremolo slashes through a stem
 */
public enum StemModifier {
    SLASH_1(1), SLASH_2(2), SLASH_3(3), SLASH_4(4), SLASH_5(5), SLASH_6(6), NONE(0);

    private final int slashes;

    StemModifier(int slashes) {
        this.slashes = slashes;
    }

    public static StemModifier ofSlashes(int slashes) {
        for (StemModifier modifier : values()) {
            if (modifier.slashes == slashes)
                return modifier;
        }
        return NONE;
    }
}

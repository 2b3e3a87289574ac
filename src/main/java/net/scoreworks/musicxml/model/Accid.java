/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

/**
 * Immutable accidental of a {@link Note}. Either written (explicit) or only sounding (gestural), the latter being
 * derived from a pitch alteration when no accidental is printed.
 */
public final class Accid {

    public enum Func {
        CAUTION, EDIT
    }

    public enum Enclosure {
        BRACK, PAREN
    }

    private final AccidentalExplicit accid;
    private final AccidentalImplicit accidGes;
    private final Func func;
    private final Enclosure enclose;
    private final String color;

    private Accid(AccidentalExplicit accid, AccidentalImplicit accidGes, Func func, Enclosure enclose, String color) {
        this.accid = accid;
        this.accidGes = accidGes;
        this.func = func;
        this.enclose = enclose;
        this.color = color;
    }

    public static Accid written(AccidentalExplicit accid, @Nullable Func func, @Nullable Enclosure enclose, @Nullable String color) {
        return new Accid(accid, AccidentalImplicit.NONE, func, enclose, color);
    }

    public static Accid sounding(AccidentalImplicit accidGes) {
        return new Accid(AccidentalExplicit.NONE, accidGes, null, null, null);
    }

    public AccidentalExplicit getAccid() {
        return accid;
    }

    public AccidentalImplicit getAccidGes() {
        return accidGes;
    }

    @Nullable
    public Func getFunc() {
        return func;
    }

    @Nullable
    public Enclosure getEnclose() {
        return enclose;
    }

    @Nullable
    public String getColor() {
        return color;
    }
}

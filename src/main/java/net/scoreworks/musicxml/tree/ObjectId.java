/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.tree;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;


/**
 * Identifier of a {@link Child} within one {@link RootEntity}. Ids are handed out by a counter owned by the root, so
 * converting the same document twice yields the same ids. The textual form is {@code <kind>-<number>}, e.g. {@code note-12}
 */
public final class ObjectId implements Comparable<ObjectId> {
    private final String kind;
    private final long id;

    ObjectId(String kind, long id) {
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public long getId() {
        return id;
    }

    /**
     * @return the cross-reference form of this id, {@code #<kind>-<number>}
     */
    public String toReference() {
        return "#" + this;
    }

    /**
     * Parse an id in textual or reference form. Returns null if the string is not a valid id
     */
    @Nullable
    public static ObjectId parse(String value) {
        String str = StringUtils.removeStart(value, "#");
        int separator = StringUtils.lastIndexOf(str, '-');
        if (separator < 1 || separator == str.length() - 1)
            return null;
        String number = str.substring(separator + 1);
        if (!StringUtils.isNumeric(number))
            return null;
        return new ObjectId(str.substring(0, separator), Long.parseLong(number));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ObjectId)) {
            return false;
        }
        ObjectId other = (ObjectId) o;
        return this.id == other.id && this.kind.equals(other.kind);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public int compareTo(@NotNull ObjectId right) {
        return Long.compare(id, right.id);
    }

    @Override
    public String toString() {
        return kind + "-" + id;
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.Child;
import net.scoreworks.musicxml.tree.exceptions.IllegalScoreModelException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sequence of {@link Measure}s. A score holds exactly one section until it is paginated downstream.
 */
public class Section extends Child<Score> {
    final List<Measure> measures = new ArrayList<>();

    public Section(Score score) {
        super(score);
    }

    protected void addToOwner() {
        if (getOwner().section != null && getOwner().section != this)
            throw new IllegalScoreModelException(getClass(), "can't be added, score already has a section");
        getOwner().section = this;
    }
    protected void removeFromOwner() {
        if (getOwner().section == this)
            getOwner().section = null;
    }

    public List<Measure> getMeasures() {
        return Collections.unmodifiableList(measures);
    }

    public int getMeasureCount() {
        return measures.size();
    }

    public Measure getMeasure(int idx) {
        return measures.get(idx);
    }

    /**
     * @return the first measure with the given number or null if there is none
     */
    @Nullable
    public Measure findMeasureByN(int n) {
        for (Measure measure : measures) {
            if (measure.getN() == n)
                return measure;
        }
        return null;
    }

    @Override
    public List<? extends Child<?>> getChildren() {
        return Collections.unmodifiableList(measures);
    }
}

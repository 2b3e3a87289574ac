/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import net.scoreworks.musicxml.tree.ScoreObject;

import java.util.List;

/**
 * Owner of {@link ControlElement}s. During conversion control elements float on the {@link Score}; the final pass
 * transfers them into the {@link Measure} they were read in.
 */
public interface ControlElementOwner extends ScoreObject {

    List<ControlElement> getControlElements();

    /** Invoked by a control element that has this as its new owner */
    void attachControlElement(ControlElement element);

    /** Invoked by a control element that leaves this owner */
    void detachControlElement(ControlElement element);
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Score;

/**
 * Hook that turns the single flat section of a freshly imported score into a paginated layout. Called exactly once
 * per successful import, after all measures and control elements have been attached.
 */
@FunctionalInterface
public interface PageLayout {

    /** Leaves the score as it is */
    PageLayout NONE = score -> {};

    void convertToPageBased(Score score);
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.tree.exceptions;

/**
 * An exception that gets thrown if the score tree is used in a way that would break its ownership rules
 */
public class IllegalScoreModelException extends RuntimeException {
    public IllegalScoreModelException(Class<?> clazz, String message) {
        super(clazz.getSimpleName() + " " + message);
    }
}

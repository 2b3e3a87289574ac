/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

/**
 * Thrown when a document can't be imported at all. Every other anomaly of the input is reported through
 * {@link ImportWarnings} instead
 */
public class MusicXmlImportException extends Exception {

    public MusicXmlImportException(String message) {
        super(message);
    }

    public MusicXmlImportException(String message, Throwable cause) {
        super(message, cause);
    }
}

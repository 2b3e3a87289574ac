/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the recoverable problems of one conversion. Each warning is logged and kept in order of occurrence.
 */
public class ImportWarnings {
    private static final Logger logger = LoggerFactory.getLogger(ImportWarnings.class);

    private final List<String> messages = new ArrayList<>();

    /**
     * @param format message with {} placeholders, as used by slf4j
     */
    public void warn(String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        logger.warn(message);
        messages.add(message);
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * @return number of warnings containing the given text
     */
    public int count(String fragment) {
        int count = 0;
        for (String message : messages) {
            if (message.contains(fragment))
                count++;
        }
        return count;
    }
}

/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.model;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Control element that displays text, made of one or more {@link TextRun}s
 */
public abstract class TextDirective extends ControlElement {
    private final List<TextRun> text = new ArrayList<>();
    private String lang;

    protected TextDirective(ControlElementOwner owner, int measureN) {
        super(owner, measureN);
    }

    public List<TextRun> getText() {
        return Collections.unmodifiableList(text);
    }

    public void addText(TextRun run) {
        text.add(run);
    }

    /**
     * @return all text runs concatenated
     */
    public String getPlainText() {
        StringBuilder sb = new StringBuilder();
        for (TextRun run : text) {
            sb.append(run.getText());
        }
        return sb.toString();
    }

    @Nullable
    public String getLang() {
        return lang;
    }

    public void setLang(@Nullable String lang) {
        this.lang = lang;
    }
}

package com.latexdoc.core.model;

/**
 * Sectioning level 0, {@code \chapter}. Only meaningful in book and report classes.
 */
public final class Chapter extends SectionElement {

    public Chapter(String name) {
        this(Text.of(name));
    }

    public Chapter(Text name) {
        super("chapter", name);
    }

    @Override
    protected Chapter create(Text name) {
        return new Chapter(name);
    }
}

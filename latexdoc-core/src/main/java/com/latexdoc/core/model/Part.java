package com.latexdoc.core.model;

/**
 * Sectioning level -1, {@code \part}. Only meaningful in book and report classes.
 */
public final class Part extends SectionElement {

    public Part(String name) {
        this(Text.of(name));
    }

    public Part(Text name) {
        super("part", name);
    }

    @Override
    protected Part create(Text name) {
        return new Part(name);
    }
}

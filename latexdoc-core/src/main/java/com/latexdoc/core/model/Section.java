package com.latexdoc.core.model;

/**
 * Sectioning level 1, {@code \section}.
 */
public final class Section extends SectionElement {

    public Section(String name) {
        this(Text.of(name));
    }

    public Section(Text name) {
        super("section", name);
    }

    @Override
    protected Section create(Text name) {
        return new Section(name);
    }
}

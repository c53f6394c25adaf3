package com.latexdoc.core.model;

/**
 * Sectioning level 2, {@code \subsection}.
 */
public final class Subsection extends SectionElement {

    public Subsection(String name) {
        this(Text.of(name));
    }

    public Subsection(Text name) {
        super("subsection", name);
    }

    @Override
    protected Subsection create(Text name) {
        return new Subsection(name);
    }
}

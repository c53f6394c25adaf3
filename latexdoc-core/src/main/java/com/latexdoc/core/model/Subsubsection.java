package com.latexdoc.core.model;

/**
 * Sectioning level 3, {@code \subsubsection}.
 */
public final class Subsubsection extends SectionElement {

    public Subsubsection(String name) {
        this(Text.of(name));
    }

    public Subsubsection(Text name) {
        super("subsubsection", name);
    }

    @Override
    protected Subsubsection create(Text name) {
        return new Subsubsection(name);
    }
}

package com.latexdoc.core.model;

/**
 * Sectioning level 5, {@code \subparagraph}.
 */
public final class Subparagraph extends SectionElement {

    public Subparagraph(String name) {
        this(Text.of(name));
    }

    public Subparagraph(Text name) {
        super("subparagraph", name);
    }

    @Override
    protected Subparagraph create(Text name) {
        return new Subparagraph(name);
    }
}

package com.latexdoc.core.model;

/**
 * Sectioning level 4, {@code \paragraph}.
 */
public final class Paragraph extends SectionElement {

    public Paragraph(String name) {
        this(Text.of(name));
    }

    public Paragraph(Text name) {
        super("paragraph", name);
    }

    @Override
    protected Paragraph create(Text name) {
        return new Paragraph(name);
    }
}

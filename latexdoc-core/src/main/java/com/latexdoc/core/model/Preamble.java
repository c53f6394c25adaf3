package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything between {@code \documentclass} and {@code \begin{document}}: package imports,
 * macro definitions, raw lines, then title and author.
 *
 * <p>When the preamble has entries and a title or author is set, one empty line separates
 * the entries from the metadata.
 */
public final class Preamble implements Writable {

    private final List<PreambleElement> elements = new ArrayList<>();
    private String title;
    private String author;

    public String title() {
        return title;
    }

    public Preamble title(String title) {
        this.title = title;
        return this;
    }

    public String author() {
        return author;
    }

    public Preamble author(String author) {
        this.author = author;
        return this;
    }

    public Preamble usePackage(String name) {
        return push(PreambleElement.UsePackage.of(name));
    }

    public Preamble usePackage(String name, String argument) {
        return push(new PreambleElement.UsePackage(name, argument));
    }

    /**
     * Adds the common form of {@code \newcommand}: a fixed argument count and no default.
     *
     * @param name macro name without backslash
     * @param argumentCount number of arguments
     * @param definition macro body
     * @return this preamble
     */
    public Preamble newCommand(String name, int argumentCount, String definition) {
        return push(new PreambleElement.NewCommand(name, argumentCount, null, definition));
    }

    public Preamble push(PreambleElement element) {
        elements.add(Objects.requireNonNull(element, "element must not be null"));
        return this;
    }

    public List<PreambleElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * Returns whether there are no package, macro or raw entries. Title and author are
     * not counted.
     *
     * @return true if no entries
     */
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    Preamble copy() {
        Preamble copy = new Preamble();
        copy.elements.addAll(elements);
        copy.title = title;
        copy.author = author;
        return copy;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        for (PreambleElement element : elements) {
            element.writeTo(writer);
        }

        if (!isEmpty() && (title != null || author != null)) {
            Markup.newline(writer);
        }

        if (title != null) {
            Markup.command(writer, "title");
            Markup.braced(writer, title);
            Markup.newline(writer);
        }
        if (author != null) {
            Markup.command(writer, "author");
            Markup.braced(writer, author);
            Markup.newline(writer);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Preamble other
            && elements.equals(other.elements)
            && Objects.equals(title, other.title)
            && Objects.equals(author, other.author);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, title, author);
    }

    @Override
    public String toString() {
        return "Preamble[title=" + title + ", author=" + author + ", elements=" + elements + "]";
    }
}

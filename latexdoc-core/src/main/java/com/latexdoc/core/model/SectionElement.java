package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Heading-bearing container shared by the seven sectioning kinds.
 *
 * <p>A numbered node renders as {@code \keyword[toc title]{name}}, where the bracket group
 * appears only when a distinct table-of-contents title is set. An unnumbered node renders
 * the starred form {@code \keyword*{name}} and never emits the toc title. The name is
 * inline {@link Text}, so bold, italic and links are honoured in headings.
 *
 * <p>Every child is followed by a newline. Paragraph text that is not separated this way
 * is merged into one paragraph by LaTeX.
 *
 * <p>Subclasses only supply the keyword.
 */
public abstract sealed class SectionElement implements Element
    permits Part, Chapter, Section, Subsection, Subsubsection, Paragraph, Subparagraph {

    private final String keyword;
    private final List<Element> elements = new ArrayList<>();
    private Text name;
    private Text tocTitle;
    private boolean numbered = true;

    protected SectionElement(String keyword, Text name) {
        this.keyword = Objects.requireNonNull(keyword, "keyword must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns the LaTeX keyword, e.g. {@code section}.
     *
     * @return keyword without backslash
     */
    public String keyword() {
        return keyword;
    }

    public Text name() {
        return name;
    }

    public SectionElement name(Text name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    /**
     * Returns the table-of-contents entry, or {@code null} when it equals the name.
     *
     * @return toc title or null
     */
    public Text tocTitle() {
        return tocTitle;
    }

    public SectionElement tocTitle(Text tocTitle) {
        this.tocTitle = tocTitle;
        return this;
    }

    public SectionElement tocTitle(String tocTitle) {
        return tocTitle(Text.of(tocTitle));
    }

    public boolean isNumbered() {
        return numbered;
    }

    public SectionElement numbered(boolean numbered) {
        this.numbered = numbered;
        return this;
    }

    public SectionElement push(Element element) {
        elements.add(Objects.requireNonNull(element, "element must not be null"));
        return this;
    }

    public SectionElement push(String text) {
        return push(Text.of(text));
    }

    public List<Element> elements() {
        return Collections.unmodifiableList(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Creates an empty node of the same kind with the given name.
     */
    protected abstract SectionElement create(Text name);

    @Override
    public SectionElement copy() {
        SectionElement copy = create(name.copy());
        copy.tocTitle = tocTitle == null ? null : tocTitle.copy();
        copy.numbered = numbered;
        elements.forEach(element -> copy.elements.add(element.copy()));
        return copy;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        Markup.command(writer, keyword);
        if (!numbered) {
            writer.write(Markup.STAR);
        } else if (tocTitle != null) {
            writer.write(Markup.OPEN_BRACKET);
            tocTitle.writeTo(writer);
            writer.write(Markup.CLOSE_BRACKET);
        }

        writer.write(Markup.OPEN_BRACE);
        name.writeTo(writer);
        writer.write(Markup.CLOSE_BRACE);
        Markup.newline(writer);

        for (Element element : elements) {
            element.writeTo(writer);
            Markup.newline(writer);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SectionElement other = (SectionElement) o;
        return numbered == other.numbered
            && name.equals(other.name)
            && Objects.equals(tocTitle, other.tocTitle)
            && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, name, tocTitle, numbered, elements);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", numbered=" + numbered
            + ", elements=" + elements + "]";
    }
}

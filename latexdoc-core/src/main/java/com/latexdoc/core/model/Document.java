package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Root of the document tree.
 *
 * <p>A full document renders as
 * <pre>
 * \documentclass[12pt,a4paper]{article}
 * ...preamble...
 * \begin{document}
 * ...elements...
 * \end{document}
 * </pre>
 * with no blank lines inserted between these wrapper lines. A document of class
 * {@link DocumentClass#PART} renders its elements only.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Document doc = new Document(DocumentClass.ARTICLE);
 * doc.preamble().title("My Fancy Document").author("Jane Doe");
 *
 * doc.push(SimpleCommand.TITLE_PAGE)
 *     .push(SimpleCommand.CLEAR_PAGE)
 *     .push(SimpleCommand.TABLE_OF_CONTENTS)
 *     .push(new Section("Section 1")
 *         .push("Here is some text which will be put in paragraph 1.")
 *         .push(Align.of("y &= mx + c")));
 *
 * String latex = Latex.print(doc);
 * }</pre>
 */
public final class Document implements Writable {

    private final DocumentClass documentClass;
    private final List<String> arguments = new ArrayList<>();
    private final Preamble preamble;
    private final List<Element> elements = new ArrayList<>();

    public Document(DocumentClass documentClass) {
        this(documentClass, new Preamble());
    }

    private Document(DocumentClass documentClass, Preamble preamble) {
        this.documentClass = Objects.requireNonNull(documentClass, "documentClass must not be null");
        this.preamble = preamble;
    }

    public DocumentClass documentClass() {
        return documentClass;
    }

    public Preamble preamble() {
        return preamble;
    }

    /**
     * Adds a class option such as {@code 12pt}.
     *
     * @param argument class option
     * @return this document
     */
    public Document addArgument(String argument) {
        arguments.add(Objects.requireNonNull(argument, "argument must not be null"));
        return this;
    }

    public List<String> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Document push(Element element) {
        elements.add(Objects.requireNonNull(element, "element must not be null"));
        return this;
    }

    public Document push(String text) {
        return push(Text.of(text));
    }

    /**
     * Appends copies of every element of {@code other}. This is how a {@link DocumentClass#PART}
     * fragment is inlined into a full document.
     *
     * @param other document whose elements are copied
     * @return this document
     */
    public Document pushDocument(Document other) {
        other.elements.forEach(element -> push(element.copy()));
        return this;
    }

    public List<Element> elements() {
        return Collections.unmodifiableList(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Returns an independent deep copy.
     *
     * @return copy of this document
     */
    public Document copy() {
        Document copy = new Document(documentClass, preamble.copy());
        copy.arguments.addAll(arguments);
        return copy.pushDocument(this);
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        if (documentClass.isPart()) {
            writeElements(writer);
            return;
        }

        Markup.command(writer, "documentclass");
        Markup.bracketed(writer, String.join(Markup.SEPARATOR, arguments));
        Markup.braced(writer, documentClass.name());
        Markup.newline(writer);

        preamble.writeTo(writer);

        Markup.begin(writer, "document");
        Markup.newline(writer);
        writeElements(writer);
        Markup.end(writer, "document");
    }

    private void writeElements(Writer writer) throws IOException {
        for (Element element : elements) {
            element.writeTo(writer);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Document other
            && documentClass.equals(other.documentClass)
            && arguments.equals(other.arguments)
            && preamble.equals(other.preamble)
            && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentClass, arguments, preamble, elements);
    }

    @Override
    public String toString() {
        return "Document[class=" + documentClass + ", arguments=" + arguments + ", elements=" + elements + "]";
    }
}

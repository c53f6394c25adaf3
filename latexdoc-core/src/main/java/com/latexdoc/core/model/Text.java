package com.latexdoc.core.model;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A run of inline {@link TextElement}s rendered back to back, with no separators and no
 * trailing newline.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Text text = new Text()
 *     .push("Hello ")
 *     .push(TextElement.italic("World"))
 *     .push("! Here is an equation ")
 *     .push(TextElement.inlineMath("y = mx + c"));
 * // Hello \textit{World}! Here is an equation $y = mx + c$
 * }</pre>
 */
public final class Text implements Element {

    private final List<TextElement> elements = new ArrayList<>();

    public Text() {
    }

    /**
     * Creates a text holding one plain run.
     *
     * @param text raw text
     * @return new text
     */
    public static Text of(String text) {
        return new Text().push(text);
    }

    /**
     * Creates a text from the given runs.
     *
     * @param elements runs in order
     * @return new text
     */
    public static Text of(TextElement... elements) {
        Text text = new Text();
        for (TextElement element : elements) {
            text.push(element);
        }
        return text;
    }

    public Text push(TextElement element) {
        elements.add(Objects.requireNonNull(element, "element must not be null"));
        return this;
    }

    /**
     * Appends a plain run.
     *
     * @param text raw text
     * @return this text
     */
    public Text push(String text) {
        return push(new TextElement.Plain(text));
    }

    public List<TextElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public Text copy() {
        Text copy = new Text();
        copy.elements.addAll(elements);
        return copy;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        for (TextElement element : elements) {
            element.writeTo(writer);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Text other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Text" + elements;
    }
}

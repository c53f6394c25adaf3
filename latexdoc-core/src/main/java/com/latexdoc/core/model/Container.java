package com.latexdoc.core.model;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Transparent grouping of elements. Renders its children back to back and adds no
 * formatting of its own.
 */
public final class Container implements Element {

    private final List<Element> elements = new ArrayList<>();

    public Container() {
    }

    /**
     * Creates a container holding the given elements.
     *
     * @param elements children in order
     * @return new container
     */
    public static Container of(Element... elements) {
        Container container = new Container();
        for (Element element : elements) {
            container.push(element);
        }
        return container;
    }

    public Container push(Element element) {
        elements.add(Objects.requireNonNull(element, "element must not be null"));
        return this;
    }

    public Container push(String text) {
        return push(Text.of(text));
    }

    public List<Element> elements() {
        return Collections.unmodifiableList(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public Container copy() {
        Container copy = new Container();
        elements.forEach(element -> copy.elements.add(element.copy()));
        return copy;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        for (Element element : elements) {
            element.writeTo(writer);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Container other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Container" + elements;
    }
}

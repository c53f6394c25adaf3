package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * A node that can appear in the body of a {@link Document} or inside any composite node.
 *
 * <p>The set of element kinds is closed: sectioning nodes, inline {@link Text},
 * {@link Container}, {@link Command}, {@link Equation}, {@link Align}, {@link Environment},
 * {@link ItemList}, an {@link Input} directive and a raw {@link UserDefined} fragment.
 * Composite nodes own their children; the tree never shares nodes.
 */
public sealed interface Element extends Writable
    permits SectionElement, Text, Container, Command, Equation, Align, Environment, ItemList,
        Element.Input, Element.UserDefined {

    /**
     * Returns an independent copy of this element and everything below it.
     *
     * @return deep copy, or {@code this} for immutable elements
     */
    Element copy();

    /**
     * Include-file directive, rendered as {@code \input{file}}.
     *
     * @param file path passed to {@code \input}
     */
    record Input(String file) implements Element {

        public Input {
            Objects.requireNonNull(file, "file must not be null");
        }

        @Override
        public Element copy() {
            return this;
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            Markup.command(writer, "input");
            Markup.braced(writer, file);
            Markup.newline(writer);
        }
    }

    /**
     * Escape hatch for anything the model does not cover. The fragment is written
     * unchanged, followed by a newline.
     *
     * @param content raw LaTeX
     */
    record UserDefined(String content) implements Element {

        public UserDefined {
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public Element copy() {
            return this;
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            writer.write(content);
            Markup.newline(writer);
        }
    }
}

package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * One inline run inside a {@link Text}.
 *
 * <p>{@link Bold} and {@link Italic} wrap another element, so styles nest arbitrarily:
 * {@code bold(italic("x"))} renders {@code \textbf{\textit{x}}}. Nothing is escaped.
 */
public sealed interface TextElement extends Writable
    permits TextElement.Plain, TextElement.Bold, TextElement.Italic, TextElement.Link, TextElement.InlineMath {

    static TextElement plain(String text) {
        return new Plain(text);
    }

    static TextElement bold(TextElement inner) {
        return new Bold(inner);
    }

    static TextElement bold(String text) {
        return new Bold(new Plain(text));
    }

    static TextElement italic(TextElement inner) {
        return new Italic(inner);
    }

    static TextElement italic(String text) {
        return new Italic(new Plain(text));
    }

    static TextElement link(String description, String target) {
        return new Link(description, target);
    }

    static TextElement inlineMath(String expression) {
        return new InlineMath(expression);
    }

    /**
     * Raw text.
     *
     * @param text emitted as-is
     */
    record Plain(String text) implements TextElement {

        public Plain {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            writer.write(text);
        }
    }

    /**
     * {@code \textbf{inner}}.
     *
     * @param inner styled element
     */
    record Bold(TextElement inner) implements TextElement {

        public Bold {
            Objects.requireNonNull(inner, "inner must not be null");
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            Markup.command(writer, "textbf");
            writer.write(Markup.OPEN_BRACE);
            inner.writeTo(writer);
            writer.write(Markup.CLOSE_BRACE);
        }
    }

    /**
     * {@code \textit{inner}}.
     *
     * @param inner styled element
     */
    record Italic(TextElement inner) implements TextElement {

        public Italic {
            Objects.requireNonNull(inner, "inner must not be null");
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            Markup.command(writer, "textit");
            writer.write(Markup.OPEN_BRACE);
            inner.writeTo(writer);
            writer.write(Markup.CLOSE_BRACE);
        }
    }

    /**
     * Hyperlink, rendered as {@code \href{target}{description}}.
     *
     * @param description visible text
     * @param target URL
     */
    record Link(String description, String target) implements TextElement {

        public Link {
            Objects.requireNonNull(description, "description must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            Markup.command(writer, "href");
            Markup.braced(writer, target);
            Markup.braced(writer, description);
        }
    }

    /**
     * Inline math, rendered between single dollar signs.
     *
     * @param expression math source
     */
    record InlineMath(String expression) implements TextElement {

        public InlineMath {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            writer.write("$");
            writer.write(expression);
            writer.write("$");
        }
    }
}

package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * One row of an {@link Align} block.
 *
 * @param text row source, usually containing an {@code &} alignment point
 * @param label optional label written after the row text
 * @param numbered whether the row gets a number; only has an effect in a numbered block
 */
public record AlignEquation(String text, String label, boolean numbered) {

    public AlignEquation {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static AlignEquation of(String text) {
        return new AlignEquation(text, null, true);
    }

    public static AlignEquation labeled(String label, String text) {
        return new AlignEquation(text, label, true);
    }

    public AlignEquation label(String label) {
        return new AlignEquation(text, label, numbered);
    }

    public AlignEquation numbered(boolean numbered) {
        return new AlignEquation(text, label, numbered);
    }

    /**
     * Writes the row inside a block whose numbering is {@code blockNumbered}.
     */
    void writeTo(Writer writer, boolean blockNumbered) throws IOException {
        if (!numbered && blockNumbered) {
            Markup.command(writer, "nonumber");
            Markup.newline(writer);
        }

        writer.write(text);
        writer.write(" ");
        if (label != null) {
            Markup.command(writer, "label");
            Markup.braced(writer, label);
            writer.write(" ");
        }
        writer.write("\\\\");
        Markup.newline(writer);
    }
}

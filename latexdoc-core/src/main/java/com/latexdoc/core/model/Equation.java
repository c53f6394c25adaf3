package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Single displayed equation in an {@code equation} environment, or {@code equation*}
 * when unnumbered. The starred form needs {@code amsmath}.
 *
 * <pre>
 * \begin{equation}
 * \label{eq:line}
 * y = mx + c
 * \end{equation}
 * </pre>
 *
 * @param text equation source
 * @param label optional label, written on its own line before the equation
 * @param numbered whether the equation gets a number
 */
public record Equation(String text, String label, boolean numbered) implements Element {

    static final String ENVIRONMENT = "equation";

    public Equation {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static Equation of(String text) {
        return new Equation(text, null, true);
    }

    public static Equation labeled(String label, String text) {
        return new Equation(text, label, true);
    }

    public Equation label(String label) {
        return new Equation(text, label, numbered);
    }

    public Equation numbered(boolean numbered) {
        return new Equation(text, label, numbered);
    }

    @Override
    public Element copy() {
        return this;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        String environment = numbered ? ENVIRONMENT : ENVIRONMENT + Markup.STAR;

        Markup.begin(writer, environment);
        Markup.newline(writer);
        if (label != null) {
            new Command.Label(label).writeTo(writer);
        }
        writer.write(text);
        Markup.newline(writer);
        Markup.end(writer, environment);
    }
}

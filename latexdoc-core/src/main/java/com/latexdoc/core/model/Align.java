package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Block of aligned equations in an {@code align} environment ({@code align*} when
 * unnumbered). Needs {@code amsmath}.
 *
 * <pre>{@code
 * Align align = new Align()
 *     .push(AlignEquation.labeled("eq:mc2", "E &= m c^2"))
 *     .push("y &= m x + c");
 * }</pre>
 * renders
 * <pre>
 * \begin{align}
 * E &amp;= m c^2 \label{eq:mc2} \\
 * y &amp;= m x + c \\
 * \end{align}
 * </pre>
 *
 * <p>A block label is written on its own line after {@code \begin{align}}. Labelling both
 * the block and its rows makes amsmath drop one of them; avoiding that is up to the caller.
 */
public final class Align implements Element {

    static final String ENVIRONMENT = "align";

    private final List<AlignEquation> equations = new ArrayList<>();
    private String label;
    private boolean numbered = true;

    public Align() {
    }

    /**
     * Creates a block holding a single equation.
     *
     * @param equation equation source
     * @return new block
     */
    public static Align of(String equation) {
        return new Align().push(equation);
    }

    public static Align labeled(String label) {
        return new Align().label(label);
    }

    public Align push(AlignEquation equation) {
        equations.add(Objects.requireNonNull(equation, "equation must not be null"));
        return this;
    }

    public Align push(String equation) {
        return push(AlignEquation.of(equation));
    }

    public List<AlignEquation> equations() {
        return Collections.unmodifiableList(equations);
    }

    public String label() {
        return label;
    }

    public Align label(String label) {
        this.label = label;
        return this;
    }

    public boolean isNumbered() {
        return numbered;
    }

    public Align numbered(boolean numbered) {
        this.numbered = numbered;
        return this;
    }

    @Override
    public Align copy() {
        Align copy = new Align();
        copy.equations.addAll(equations);
        copy.label = label;
        copy.numbered = numbered;
        return copy;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        String environment = numbered ? ENVIRONMENT : ENVIRONMENT + Markup.STAR;

        Markup.begin(writer, environment);
        Markup.newline(writer);
        if (label != null) {
            new Command.Label(label).writeTo(writer);
        }
        for (AlignEquation equation : equations) {
            equation.writeTo(writer, numbered);
        }
        Markup.end(writer, environment);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Align other
            && numbered == other.numbered
            && Objects.equals(label, other.label)
            && equations.equals(other.equations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(equations, label, numbered);
    }

    @Override
    public String toString() {
        return "Align[label=" + label + ", numbered=" + numbered + ", equations=" + equations + "]";
    }
}

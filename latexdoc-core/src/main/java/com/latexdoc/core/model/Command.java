package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One-line directive, terminated by a newline.
 *
 * <p>Bare directives without parameters are the {@link SimpleCommand} constants. The
 * parameterized commands are records whose fields are written in declared order, each
 * through one {@link Markup} formatting unit:
 *
 * <table>
 *   <caption>Parameterized commands</caption>
 *   <tr><th>Command</th><th>Output</th></tr>
 *   <tr><td>{@link Label}</td><td>{@code \label{name}}</td></tr>
 *   <tr><td>{@link Ref}</td><td>{@code \ref{label}}</td></tr>
 *   <tr><td>{@link Cite}</td><td>{@code \cite[note]{key1,key2}}</td></tr>
 *   <tr><td>{@link FrameBox}</td><td>{@code \framebox[width][position]{text}}</td></tr>
 *   <tr><td>{@link IncludeGraphics}</td><td>{@code \includegraphics[width=w,height=h,angle=a]{path}}</td></tr>
 *   <tr><td>{@link Footnote}</td><td>{@code \footnote{text}}</td></tr>
 * </table>
 */
public sealed interface Command extends Element
    permits SimpleCommand, Command.Label, Command.Ref, Command.Cite, Command.FrameBox,
        Command.IncludeGraphics, Command.Footnote {

    /**
     * Returns the LaTeX keyword of this command.
     *
     * @return keyword without backslash
     */
    String keyword();

    /**
     * Writes the parameter groups that follow the keyword.
     *
     * @param writer destination
     * @throws IOException if the sink fails
     */
    void writeParameters(Writer writer) throws IOException;

    @Override
    default void writeTo(Writer writer) throws IOException {
        Markup.command(writer, keyword());
        writeParameters(writer);
        Markup.newline(writer);
    }

    /**
     * {@code \label{name}}.
     *
     * @param name label key
     */
    record Label(String name) implements Command {

        public Label {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String keyword() {
            return "label";
        }

        @Override
        public void writeParameters(Writer writer) throws IOException {
            Markup.braced(writer, name);
        }

        @Override
        public Element copy() {
            return this;
        }
    }

    /**
     * {@code \ref{label}}.
     *
     * @param label referenced label key
     */
    record Ref(String label) implements Command {

        public Ref {
            Objects.requireNonNull(label, "label must not be null");
        }

        @Override
        public String keyword() {
            return "ref";
        }

        @Override
        public void writeParameters(Writer writer) throws IOException {
            Markup.braced(writer, label);
        }

        @Override
        public Element copy() {
            return this;
        }
    }

    /**
     * {@code \cite[note]{key1,key2}}; the note bracket is omitted when absent.
     *
     * @param note optional post-note, e.g. {@code p. 42}
     * @param keys bibliography keys, comma-joined in one brace group
     */
    record Cite(String note, List<String> keys) implements Command {

        public Cite {
            Objects.requireNonNull(keys, "keys must not be null");
            keys = List.copyOf(keys);
        }

        public static Cite of(String... keys) {
            return new Cite(null, Arrays.asList(keys));
        }

        public Cite withNote(String note) {
            return new Cite(note, keys);
        }

        @Override
        public String keyword() {
            return "cite";
        }

        @Override
        public void writeParameters(Writer writer) throws IOException {
            Markup.optionalBracket(writer, note);
            Markup.braceGroup(writer, keys);
        }

        @Override
        public Element copy() {
            return this;
        }
    }

    /**
     * {@code \framebox[width][position]{text}}.
     *
     * <p>LaTeX reads the optional arguments positionally, so a position without a width
     * is written as {@code [position]} and will be taken as the width.
     *
     * @param width optional box width, e.g. {@code 5cm}
     * @param position optional text position, e.g. {@code c}
     * @param text boxed text
     */
    record FrameBox(String width, String position, Text text) implements Command {

        public FrameBox {
            Objects.requireNonNull(text, "text must not be null");
        }

        public static FrameBox of(String text) {
            return new FrameBox(null, null, Text.of(text));
        }

        @Override
        public String keyword() {
            return "framebox";
        }

        @Override
        public void writeParameters(Writer writer) throws IOException {
            Markup.optionalBracket(writer, width);
            Markup.optionalBracket(writer, position);
            writer.write(Markup.OPEN_BRACE);
            text.writeTo(writer);
            writer.write(Markup.CLOSE_BRACE);
        }

        @Override
        public Element copy() {
            return new FrameBox(width, position, text.copy());
        }
    }

    /**
     * {@code \includegraphics[options]{path}}, where the options group holds every
     * present key/value pair in the order width, height, angle.
     *
     * @param width optional width, e.g. {@code 0.5\textwidth}
     * @param height optional height
     * @param angle optional rotation in degrees
     * @param path image path
     */
    record IncludeGraphics(String width, String height, String angle, String path) implements Command {

        public IncludeGraphics {
            Objects.requireNonNull(path, "path must not be null");
        }

        public static IncludeGraphics of(String path) {
            return new IncludeGraphics(null, null, null, path);
        }

        @Override
        public String keyword() {
            return "includegraphics";
        }

        @Override
        public void writeParameters(Writer writer) throws IOException {
            Markup.bracketGroup(writer, Arrays.asList(
                option("width", width),
                option("height", height),
                option("angle", angle)));
            Markup.braced(writer, path);
        }

        private static String option(String key, String value) {
            return value == null ? null : key + "=" + value;
        }

        @Override
        public Element copy() {
            return this;
        }
    }

    /**
     * {@code \footnote{text}}.
     *
     * @param text footnote body
     */
    record Footnote(Text text) implements Command {

        public Footnote {
            Objects.requireNonNull(text, "text must not be null");
        }

        public static Footnote of(String text) {
            return new Footnote(Text.of(text));
        }

        @Override
        public String keyword() {
            return "footnote";
        }

        @Override
        public void writeParameters(Writer writer) throws IOException {
            writer.write(Markup.OPEN_BRACE);
            text.writeTo(writer);
            writer.write(Markup.CLOSE_BRACE);
        }

        @Override
        public Element copy() {
            return new Footnote(text.copy());
        }
    }
}

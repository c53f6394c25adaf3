package com.latexdoc.core.util;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Formatting units for command-like markup.
 *
 * <p>Commands and environments are written as a keyword followed by a fixed sequence of
 * parameter groups. Each method here writes exactly one such group:
 * <ul>
 *   <li>{@link #bare(Writer, String)} - the raw value, no delimiters</li>
 *   <li>{@link #braced(Writer, String)} - {@code {value}}</li>
 *   <li>{@link #optionalBracket(Writer, String)} - {@code [value]}, or nothing if absent</li>
 *   <li>{@link #bracketGroup(Writer, List)} - {@code [a,b]} over the present values only</li>
 *   <li>{@link #braceGroup(Writer, List)} - {@code {a,b}}</li>
 * </ul>
 *
 * <p>Values are written byte-for-byte; nothing is escaped.
 */
public final class Markup {

    public static final String BACKSLASH = "\\";
    public static final String NEWLINE = "\n";
    public static final String OPEN_BRACE = "{";
    public static final String CLOSE_BRACE = "}";
    public static final String OPEN_BRACKET = "[";
    public static final String CLOSE_BRACKET = "]";
    public static final String STAR = "*";
    public static final String SEPARATOR = ",";

    private Markup() {
        // Utility class
    }

    /**
     * Writes {@code \keyword}.
     *
     * @param writer destination
     * @param keyword command keyword without the backslash
     * @throws IOException if the sink fails
     */
    public static void command(Writer writer, String keyword) throws IOException {
        writer.write(BACKSLASH);
        writer.write(keyword);
    }

    /**
     * Writes {@code value} with no delimiters.
     *
     * @param writer destination
     * @param value raw value
     * @throws IOException if the sink fails
     */
    public static void bare(Writer writer, String value) throws IOException {
        writer.write(value);
    }

    public static void braced(Writer writer, String value) throws IOException {
        writer.write(OPEN_BRACE);
        writer.write(value);
        writer.write(CLOSE_BRACE);
    }

    public static void bracketed(Writer writer, String value) throws IOException {
        writer.write(OPEN_BRACKET);
        writer.write(value);
        writer.write(CLOSE_BRACKET);
    }

    /**
     * Writes {@code [value]} when {@code value} is present, nothing otherwise.
     *
     * @param writer destination
     * @param value optional value, may be null
     * @throws IOException if the sink fails
     */
    public static void optionalBracket(Writer writer, String value) throws IOException {
        if (value != null) {
            bracketed(writer, value);
        }
    }

    /**
     * Writes one bracket group holding every present value, comma-joined.
     *
     * <p>Absent (null) values are skipped without leaving an empty slot, and the group
     * is omitted entirely when no value is present.
     *
     * @param writer destination
     * @param values optional values in declared order
     * @throws IOException if the sink fails
     */
    public static void bracketGroup(Writer writer, List<String> values) throws IOException {
        String joined = joinPresent(values);
        if (!joined.isEmpty()) {
            bracketed(writer, joined);
        }
    }

    /**
     * Writes one brace group holding all values, comma-joined.
     *
     * @param writer destination
     * @param values values in declared order
     * @throws IOException if the sink fails
     */
    public static void braceGroup(Writer writer, List<String> values) throws IOException {
        braced(writer, String.join(SEPARATOR, values));
    }

    public static void newline(Writer writer) throws IOException {
        writer.write(NEWLINE);
    }

    /**
     * Writes {@code \begin{name}} without a trailing newline.
     */
    public static void begin(Writer writer, String name) throws IOException {
        command(writer, "begin");
        braced(writer, name);
    }

    /**
     * Writes {@code \end{name}} followed by a newline.
     */
    public static void end(Writer writer, String name) throws IOException {
        command(writer, "end");
        braced(writer, name);
        newline(writer);
    }

    static String joinPresent(List<String> values) {
        return values.stream()
            .filter(Objects::nonNull)
            .collect(Collectors.joining(SEPARATOR));
    }
}

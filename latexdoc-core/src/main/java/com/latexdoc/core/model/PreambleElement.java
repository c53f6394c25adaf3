package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * An entry of the {@link Preamble}, before {@code \begin{document}}.
 */
public sealed interface PreambleElement extends Writable
    permits PreambleElement.UsePackage, PreambleElement.NewCommand, PreambleElement.RawPreamble {

    /**
     * <code>&#92;usepackage{name}</code> or <code>&#92;usepackage[argument]{name}</code>.
     *
     * @param name package name
     * @param argument optional package option
     */
    record UsePackage(String name, String argument) implements PreambleElement {

        public UsePackage {
            Objects.requireNonNull(name, "name must not be null");
        }

        public static UsePackage of(String name) {
            return new UsePackage(name, null);
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            Markup.command(writer, "usepackage");
            Markup.optionalBracket(writer, argument);
            Markup.braced(writer, name);
            Markup.newline(writer);
        }
    }

    /**
     * Macro definition:
     * <pre>
     * \newcommand{\name}[argumentCount][defaultArgument]{
     * definition
     * }
     * </pre>
     *
     * @param name macro name without backslash
     * @param argumentCount optional number of arguments
     * @param defaultArgument optional default for the first argument
     * @param definition macro body
     */
    record NewCommand(String name, Integer argumentCount, String defaultArgument, String definition)
        implements PreambleElement {

        public NewCommand {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(definition, "definition must not be null");
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            Markup.command(writer, "newcommand");
            writer.write(Markup.OPEN_BRACE);
            Markup.command(writer, name);
            writer.write(Markup.CLOSE_BRACE);
            if (argumentCount != null) {
                Markup.bracketed(writer, argumentCount.toString());
            }
            Markup.optionalBracket(writer, defaultArgument);
            writer.write(Markup.OPEN_BRACE);
            Markup.newline(writer);
            writer.write(definition);
            Markup.newline(writer);
            writer.write(Markup.CLOSE_BRACE);
            Markup.newline(writer);
        }
    }

    /**
     * Arbitrary preamble line, written unchanged and followed by a newline.
     *
     * @param content raw LaTeX
     */
    record RawPreamble(String content) implements PreambleElement {

        public RawPreamble {
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public void writeTo(Writer writer) throws IOException {
            writer.write(content);
            Markup.newline(writer);
        }
    }
}

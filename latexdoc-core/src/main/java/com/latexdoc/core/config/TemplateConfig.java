package com.latexdoc.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.latexdoc.core.model.Document;
import com.latexdoc.core.model.DocumentClass;
import com.latexdoc.core.model.Preamble;
import com.latexdoc.core.model.PreambleElement;

import java.util.List;
import java.util.Objects;

/**
 * Document skeleton loaded from a YAML template: class, class options and preamble.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * documentClass: report
 * arguments: [12pt, a4paper]
 * title: "Quarterly Report"
 * author: "Finance Team"
 *
 * packages:
 *   - name: amsmath
 *   - name: geometry
 *     argument: margin=1in
 *
 * commands:
 *   - name: R
 *     arguments: 0
 *     definition: "\\mathbb{R}"
 *
 * preamble:
 *   - "\\setlength{\\parindent}{0pt}"
 * }</pre>
 *
 * @param documentClass class name, see {@link DocumentClass#parse(String)}
 * @param arguments class options
 * @param title optional title
 * @param author optional author
 * @param packages package imports in order
 * @param commands macro definitions in order
 * @param preamble raw preamble lines, written after packages and macros
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateConfig(
    @JsonProperty("documentClass") String documentClass,
    @JsonProperty("arguments") List<String> arguments,
    @JsonProperty("title") String title,
    @JsonProperty("author") String author,
    @JsonProperty("packages") List<PackageConfig> packages,
    @JsonProperty("commands") List<CommandConfig> commands,
    @JsonProperty("preamble") List<String> preamble
) {
    static final String DEFAULT_CLASS = "article";

    /**
     * Compact constructor applying defaults.
     */
    public TemplateConfig {
        if (documentClass == null || documentClass.isBlank()) {
            documentClass = DEFAULT_CLASS;
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        packages = packages == null ? List.of() : List.copyOf(packages);
        commands = commands == null ? List.of() : List.copyOf(commands);
        preamble = preamble == null ? List.of() : List.copyOf(preamble);
    }

    /**
     * Creates the default template: an empty {@code article}.
     *
     * @return default template
     */
    public static TemplateConfig defaults() {
        return new TemplateConfig(DEFAULT_CLASS, List.of(), null, null, List.of(), List.of(), List.of());
    }

    /**
     * Builds a new, empty-bodied document from this template.
     *
     * @return document with class, options and preamble set
     */
    public Document toDocument() {
        Document document = new Document(DocumentClass.parse(documentClass));
        arguments.forEach(document::addArgument);

        Preamble target = document.preamble();
        packages.forEach(pkg -> target.push(new PreambleElement.UsePackage(pkg.name(), pkg.argument())));
        commands.forEach(cmd -> target.push(new PreambleElement.NewCommand(
            cmd.name(), cmd.arguments(), cmd.defaultArgument(), cmd.definition())));
        preamble.forEach(line -> target.push(new PreambleElement.RawPreamble(line)));
        target.title(title).author(author);

        return document;
    }

    /**
     * Package import.
     *
     * @param name package name
     * @param argument optional package option
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PackageConfig(
        @JsonProperty("name") String name,
        @JsonProperty("argument") String argument
    ) {
        public PackageConfig {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * Macro definition.
     *
     * @param name macro name without backslash
     * @param arguments optional argument count
     * @param defaultArgument optional default for the first argument
     * @param definition macro body
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommandConfig(
        @JsonProperty("name") String name,
        @JsonProperty("arguments") Integer arguments,
        @JsonProperty("default") String defaultArgument,
        @JsonProperty("definition") String definition
    ) {
        public CommandConfig {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(definition, "definition must not be null");
        }
    }
}

package com.latexdoc.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TemplateLoader}.
 */
class TemplateLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsTemplate() throws IOException {
        Path templateFile = tempDir.resolve("template.yaml");
        Files.writeString(templateFile, """
            documentClass: report
            arguments: [12pt, a4paper]
            title: "Quarterly Report"
            author: "Finance Team"

            packages:
              - name: amsmath
              - name: geometry
                argument: margin=1in

            commands:
              - name: vect
                arguments: 1
                default: v
                definition: "\\\\mathbf{#1}"

            preamble:
              - "\\\\setlength{\\\\parindent}{0pt}"
            """);

        TemplateConfig template = TemplateLoader.load(templateFile);

        assertThat(template.documentClass()).isEqualTo("report");
        assertThat(template.arguments()).containsExactly("12pt", "a4paper");
        assertThat(template.title()).isEqualTo("Quarterly Report");
        assertThat(template.author()).isEqualTo("Finance Team");
        assertThat(template.packages()).containsExactly(
            new TemplateConfig.PackageConfig("amsmath", null),
            new TemplateConfig.PackageConfig("geometry", "margin=1in"));
        assertThat(template.commands()).containsExactly(
            new TemplateConfig.CommandConfig("vect", 1, "v", "\\mathbf{#1}"));
        assertThat(template.preamble()).containsExactly("\\setlength{\\parindent}{0pt}");
    }

    @Test
    void load_minimalYaml_appliesDefaults() throws IOException {
        Path templateFile = tempDir.resolve("template.yaml");
        Files.writeString(templateFile, """
            title: "Only a title"
            """);

        TemplateConfig template = TemplateLoader.load(templateFile);

        assertThat(template.documentClass()).isEqualTo("article");
        assertThat(template.arguments()).isEmpty();
        assertThat(template.packages()).isEmpty();
        assertThat(template.commands()).isEmpty();
        assertThat(template.preamble()).isEmpty();
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path templateFile = tempDir.resolve("template.yaml");
        Files.writeString(templateFile, """
            documentClass: book
            engine: xelatex
            """);

        assertThat(TemplateLoader.load(templateFile).documentClass()).isEqualTo("book");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        TemplateConfig template = TemplateLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(template).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(TemplateLoader.load(tempDir)).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path templateFile = tempDir.resolve("template.yaml");
        Files.writeString(templateFile, "arguments: [unclosed\n  - : :");

        assertThat(TemplateLoader.load(templateFile)).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void load_packageWithoutName_returnsDefaults() throws IOException {
        Path templateFile = tempDir.resolve("template.yaml");
        Files.writeString(templateFile, """
            documentClass: report
            packages:
              - argument: margin=1in
            """);

        TemplateConfig template = TemplateLoader.load(templateFile);

        assertThat(template).isEqualTo(TemplateConfig.defaults());
        assertThat(template.toDocument().preamble().isEmpty()).isTrue();
    }

    @Test
    void load_commandWithoutDefinition_returnsDefaults() throws IOException {
        Path templateFile = tempDir.resolve("template.yaml");
        Files.writeString(templateFile, """
            documentClass: report
            commands:
              - name: R
                arguments: 0
            """);

        assertThat(TemplateLoader.load(templateFile)).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void load_classpathFixture_returnsTemplate() throws Exception {
        Path fixture = Paths.get(getClass().getResource("/templates/book.yaml").toURI());

        TemplateConfig template = TemplateLoader.load(fixture);

        assertThat(template.documentClass()).isEqualTo("book");
        assertThat(template.packages()).extracting(TemplateConfig.PackageConfig::name)
            .containsExactly("amsmath", "hyperref");
    }

    @Test
    void loadFromString_blank_returnsDefaults() {
        assertThat(TemplateLoader.loadFromString("  ")).isEqualTo(TemplateConfig.defaults());
        assertThat(TemplateLoader.loadFromString(null)).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void loadFromString_nullDocument_returnsDefaults() {
        assertThat(TemplateLoader.loadFromString("~\n")).isEqualTo(TemplateConfig.defaults());
        assertThat(TemplateLoader.loadFromString("---\n")).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void loadFromString_packageWithoutName_returnsDefaults() {
        TemplateConfig template = TemplateLoader.loadFromString("packages:\n  - argument: margin=1in\n");

        assertThat(template).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void loadFromString_validYaml_returnsTemplate() {
        TemplateConfig template = TemplateLoader.loadFromString("documentClass: beamer\n");

        assertThat(template.documentClass()).isEqualTo("beamer");
    }
}

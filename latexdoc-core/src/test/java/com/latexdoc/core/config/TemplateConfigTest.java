package com.latexdoc.core.config;

import com.latexdoc.core.model.Document;
import com.latexdoc.core.model.DocumentClass;
import com.latexdoc.core.model.Section;
import com.latexdoc.core.renderer.Latex;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TemplateConfig}.
 */
class TemplateConfigTest {

    @Test
    void constructor_withNulls_appliesDefaults() {
        TemplateConfig template = new TemplateConfig(null, null, null, null, null, null, null);

        assertThat(template).isEqualTo(TemplateConfig.defaults());
    }

    @Test
    void toDocument_buildsClassArgumentsAndPreamble() throws IOException {
        TemplateConfig template = new TemplateConfig(
            "report",
            List.of("12pt"),
            "Quarterly Report",
            "Finance Team",
            List.of(new TemplateConfig.PackageConfig("geometry", "margin=1in")),
            List.of(new TemplateConfig.CommandConfig("R", null, null, "\\mathbb{R}")),
            List.of("\\setlength{\\parindent}{0pt}"));

        Document doc = template.toDocument();
        doc.push(new Section("Results"));

        assertThat(doc.documentClass()).isEqualTo(DocumentClass.REPORT);
        assertThat(Latex.print(doc)).isEqualTo("""
            \\documentclass[12pt]{report}
            \\usepackage[margin=1in]{geometry}
            \\newcommand{\\R}{
            \\mathbb{R}
            }
            \\setlength{\\parindent}{0pt}

            \\title{Quarterly Report}
            \\author{Finance Team}
            \\begin{document}
            \\section{Results}
            \\end{document}
            """);
    }

    @Test
    void toDocument_partClass_rendersFragment() throws IOException {
        TemplateConfig template = new TemplateConfig("part", null, "ignored", null, null, null, null);

        Document doc = template.toDocument();
        doc.push("Just text.");

        assertThat(Latex.print(doc)).isEqualTo("Just text.");
    }

    @Test
    void toDocument_returnsNewDocumentEachCall() {
        TemplateConfig template = TemplateConfig.defaults();

        Document first = template.toDocument();
        first.push("x");

        assertThat(template.toDocument().isEmpty()).isTrue();
    }

    @Test
    void packageConfig_withoutName_throwsException() {
        assertThatThrownBy(() -> new TemplateConfig.PackageConfig(null, "margin=1in"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("name must not be null");
    }

    @Test
    void commandConfig_withoutDefinition_throwsException() {
        assertThatThrownBy(() -> new TemplateConfig.CommandConfig("R", 0, null, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("definition must not be null");
    }
}

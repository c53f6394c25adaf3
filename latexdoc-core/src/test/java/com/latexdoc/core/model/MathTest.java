package com.latexdoc.core.model;

import com.latexdoc.core.renderer.RenderTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Equation}, {@link Align} and {@link AlignEquation}.
 */
class MathTest extends RenderTestBase {

    @Test
    void render_emptyAlign_writesBeginAndEnd() throws IOException {
        assertRenders(new Align(), "\\begin{align}\n\\end{align}\n");
    }

    @Test
    void render_simpleEquation_writesEquationBlock() throws IOException {
        assertRenders(Equation.of("x &= y + \\sigma"), "\\begin{equation}\nx &= y + \\sigma\n\\end{equation}\n");
    }

    @Test
    void render_equationWithLabel_writesLabelLineFirst() throws IOException {
        Equation equation = Equation.of("E &= m c^2").label("eq:mass-energy-equivalence");

        assertRenders(equation,
            "\\begin{equation}\n\\label{eq:mass-energy-equivalence}\nE &= m c^2\n\\end{equation}\n");
    }

    @Test
    void render_unnumberedEquation_writesStarredEnvironment() throws IOException {
        assertRenders(Equation.of("E &= m c^2").numbered(false), "\\begin{equation*}\nE &= m c^2\n\\end{equation*}\n");
    }

    @Test
    void render_severalEquations_writesRowsWithTerminators() throws IOException {
        Align align = new Align()
            .push(AlignEquation.labeled("eq:mc2", "E &= m c^2"))
            .push("y &= m x + c");

        assertRenders(align, "\\begin{align}\nE &= m c^2 \\label{eq:mc2} \\\\\ny &= m x + c \\\\\n\\end{align}\n");
    }

    @Test
    void render_unnumberedRowInNumberedBlock_writesNonumberFirst() throws IOException {
        Align align = new Align().push(AlignEquation.of("a &= b").numbered(false));

        assertRenders(align, "\\begin{align}\n\\nonumber\na &= b \\\\\n\\end{align}\n");
    }

    @Test
    void render_unnumberedBlock_writesStarredWithoutNonumber() throws IOException {
        Align align = new Align().numbered(false).push(AlignEquation.of("a &= b").numbered(false));

        assertRenders(align, "\\begin{align*}\na &= b \\\\\n\\end{align*}\n");
    }

    @Test
    void render_blockLabel_writesLabelLineAfterBegin() throws IOException {
        Align align = Align.labeled("eq:system").push("x &= 1");

        assertRenders(align, "\\begin{align}\n\\label{eq:system}\nx &= 1 \\\\\n\\end{align}\n");
    }

    @Test
    void of_string_createsSingleEquationBlock() {
        Align align = Align.of("y &= mx + c");

        assertThat(align.equations()).containsExactly(AlignEquation.of("y &= mx + c"));
        assertThat(align.isNumbered()).isTrue();
    }

    @Test
    void render_emptyEquationText_isAccepted() throws IOException {
        assertRenders(Equation.of(""), "\\begin{equation}\n\n\\end{equation}\n");
    }
}

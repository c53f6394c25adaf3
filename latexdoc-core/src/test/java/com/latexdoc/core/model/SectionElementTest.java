package com.latexdoc.core.model;

import com.latexdoc.core.renderer.RenderTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SectionElement} and its seven kinds.
 */
class SectionElementTest extends RenderTestBase {

    static Stream<Arguments> allKinds() {
        return Stream.of(
            Arguments.of(new Part("First Section"), "part"),
            Arguments.of(new Chapter("First Section"), "chapter"),
            Arguments.of(new Section("First Section"), "section"),
            Arguments.of(new Subsection("First Section"), "subsection"),
            Arguments.of(new Subsubsection("First Section"), "subsubsection"),
            Arguments.of(new Paragraph("First Section"), "paragraph"),
            Arguments.of(new Subparagraph("First Section"), "subparagraph")
        );
    }

    @ParameterizedTest
    @MethodSource("allKinds")
    void render_blankSection_writesHeadingOnly(SectionElement section, String keyword) throws IOException {
        assertThat(section.keyword()).isEqualTo(keyword);
        assertRenders(section, "\\" + keyword + "{First Section}\n");
    }

    @Test
    void render_intro_writesExactHeading() throws IOException {
        assertRenders(new Section("Intro"), "\\section{Intro}\n");
    }

    @Test
    void render_withChildren_writesNewlineAfterEachChild() throws IOException {
        Section section = new Section("First Section");
        section.push("Lorem Ipsum...").push("Hello World!");

        assertRenders(section, "\\section{First Section}\nLorem Ipsum...\nHello World!\n");
    }

    @Test
    void render_blockChild_isFollowedByBlankLine() throws IOException {
        Section section = new Section("S");
        section.push(SimpleCommand.BIG_SKIP).push("after");

        assertRenders(section, "\\section{S}\n\\bigskip\n\nafter\n");
    }

    @Test
    void render_notNumbered_writesStarredForm() throws IOException {
        Section section = new Section("First Section");
        section.numbered(false).push("Lorem Ipsum...");

        assertRenders(section, "\\section*{First Section}\nLorem Ipsum...\n");
    }

    @Test
    void render_withTocTitle_writesBracketBeforeName() throws IOException {
        Section section = new Section("First Section");
        section.tocTitle("Not First Section").push("Lorem Ipsum...");

        assertRenders(section, "\\section[Not First Section]{First Section}\nLorem Ipsum...\n");
    }

    @Test
    void render_notNumberedWithTocTitle_suppressesTocTitle() throws IOException {
        Subsection section = new Subsection("Name");
        section.tocTitle("Short").numbered(false);

        assertRenders(section, "\\subsection*{Name}\n");
    }

    @Test
    void render_formattedName_rendersInlineText() throws IOException {
        Text name = Text.of(TextElement.link("example", "https://example.com"));
        Section section = new Section(name);
        section.push("Lorem Ipsum...");

        assertRenders(section, "\\section{\\href{https://example.com}{example}}\nLorem Ipsum...\n");
    }

    @Test
    void render_nestedSections_rendersDepthFirst() throws IOException {
        Chapter chapter = new Chapter("Results");
        chapter.push(new Section("Data").push("Numbers."));

        assertRenders(chapter, "\\chapter{Results}\n\\section{Data}\nNumbers.\n\n");
    }

    @Test
    void isEmpty_reflectsChildren() {
        Section section = new Section("S");
        assertThat(section.isEmpty()).isTrue();

        section.push("x");
        assertThat(section.isEmpty()).isFalse();
        assertThat(section.elements()).hasSize(1);
    }

    @Test
    void copy_preservesKindAndIsIndependent() {
        Subsubsection original = new Subsubsection("S");
        original.tocTitle("T").numbered(false).push("child");

        SectionElement copy = original.copy();
        copy.push("extra");

        assertThat(copy).isInstanceOf(Subsubsection.class);
        assertThat(copy.isNumbered()).isFalse();
        assertThat(copy.tocTitle()).isEqualTo(Text.of("T"));
        assertThat(original.elements()).hasSize(1);
        assertThat(copy.elements()).hasSize(2);
    }

    @Test
    void equals_differentKindsWithSameName_areNotEqual() {
        assertThat(new Section("A")).isNotEqualTo(new Subsection("A"));
        assertThat(new Section("A")).isEqualTo(new Section("A"));
    }
}

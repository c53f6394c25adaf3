package com.latexdoc.core.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Markup}.
 */
class MarkupTest {

    private final StringWriter writer = new StringWriter();

    @Test
    void bare_writesValueWithoutDelimiters() throws IOException {
        Markup.bare(writer, "12pt");

        assertThat(writer.toString()).isEqualTo("12pt");
    }

    @Test
    void braced_wrapsInBraces() throws IOException {
        Markup.braced(writer, "x");

        assertThat(writer.toString()).isEqualTo("{x}");
    }

    @Test
    void optionalBracket_withValue_wrapsInBrackets() throws IOException {
        Markup.optionalBracket(writer, "t");

        assertThat(writer.toString()).isEqualTo("[t]");
    }

    @Test
    void optionalBracket_withNull_writesNothing() throws IOException {
        Markup.optionalBracket(writer, null);

        assertThat(writer.toString()).isEmpty();
    }

    @Test
    void bracketGroup_skipsAbsentValues() throws IOException {
        Markup.bracketGroup(writer, Arrays.asList(null, "b", null, "d"));

        assertThat(writer.toString()).isEqualTo("[b,d]");
    }

    @Test
    void bracketGroup_allAbsent_writesNothing() throws IOException {
        Markup.bracketGroup(writer, Arrays.asList(null, null));

        assertThat(writer.toString()).isEmpty();
    }

    @Test
    void braceGroup_joinsAllValues() throws IOException {
        Markup.braceGroup(writer, List.of("a", "b", "c"));

        assertThat(writer.toString()).isEqualTo("{a,b,c}");
    }

    @Test
    void beginAndEnd_writeEnvironmentMarkers() throws IOException {
        Markup.begin(writer, "center");
        Markup.newline(writer);
        Markup.end(writer, "center");

        assertThat(writer.toString()).isEqualTo("\\begin{center}\n\\end{center}\n");
    }
}

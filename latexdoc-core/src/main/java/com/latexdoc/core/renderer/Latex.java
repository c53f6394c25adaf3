package com.latexdoc.core.renderer;

import com.latexdoc.core.model.Document;
import com.latexdoc.core.model.Writable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Entry points that render to a string.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Document doc = new Document(DocumentClass.ARTICLE);
 * doc.push(new Section("Intro").push("Hello"));
 *
 * String tex = Latex.print(doc);
 * Files.writeString(Path.of("report.tex"), tex);
 * }</pre>
 *
 * @see LatexWriter
 */
public final class Latex {

    private static final Logger log = LoggerFactory.getLogger(Latex.class);

    private Latex() {
        // Utility class
    }

    /**
     * Renders a whole document.
     *
     * @param document document to render
     * @return LaTeX source
     * @throws IOException if rendering fails
     */
    public static String print(Document document) throws IOException {
        log.debug("Rendering {} document with {} top-level elements",
            document.documentClass().kind(), document.size());

        String rendered = render(document);

        log.debug("Rendered document: {} characters", rendered.length());
        return rendered;
    }

    /**
     * Renders any single node.
     *
     * @param node node to render
     * @return LaTeX source of the node
     * @throws IOException if rendering fails
     */
    public static String render(Writable node) throws IOException {
        StringWriter sink = new StringWriter();
        new LatexWriter(sink).write(node);
        return sink.toString();
    }
}

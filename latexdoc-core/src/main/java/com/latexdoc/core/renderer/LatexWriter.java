package com.latexdoc.core.renderer;

import com.latexdoc.core.model.Writable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Adapts an output sink to the {@link Writable} protocol.
 *
 * <p>A writer can render any node, not only whole documents, and can be reused for any
 * number of calls; output accumulates in the sink in call order. The sink is flushed after
 * every node. Closing the sink stays the caller's job.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * StringWriter sink = new StringWriter();
 * LatexWriter latex = new LatexWriter(sink);
 * latex.write(new Section("Intro"))
 *      .write(SimpleCommand.NEW_PAGE);
 * // sink: "\section{Intro}\n\newpage\n"
 * }</pre>
 *
 * <p>Not thread-safe: one writer per sink. The nodes themselves may be shared.
 */
public class LatexWriter {

    private static final Logger log = LoggerFactory.getLogger(LatexWriter.class);

    private final Writer writer;

    public LatexWriter(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    /**
     * Creates a writer that encodes to {@code stream} as UTF-8.
     *
     * @param stream byte sink
     * @return new writer
     */
    public static LatexWriter forStream(OutputStream stream) {
        Objects.requireNonNull(stream, "stream must not be null");
        return new LatexWriter(new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8)));
    }

    /**
     * Renders {@code node} to the sink and flushes it.
     *
     * @param node node to render
     * @return this writer
     * @throws IOException if the sink fails; the traversal stops at the failing write
     */
    public LatexWriter write(Writable node) throws IOException {
        Objects.requireNonNull(node, "node must not be null");
        log.trace("Writing {}", node.getClass().getSimpleName());

        node.writeTo(writer);
        writer.flush();
        return this;
    }

    /**
     * Returns the underlying sink.
     *
     * @return sink passed at construction
     */
    public Writer getWriter() {
        return writer;
    }
}

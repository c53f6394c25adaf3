package com.latexdoc.core.model;

import java.io.IOException;
import java.io.Writer;

/**
 * Capability shared by every node of the document tree: rendering itself as LaTeX.
 *
 * <p>Implementations write their own markup and recursively render their children.
 * Rendering only reads the tree, so the same node can be written any number of times,
 * to any number of sinks, including concurrently from separate threads.
 *
 * <p>The only failure is an {@link IOException} raised by the sink. It is propagated
 * unchanged and aborts the rest of the traversal; anything already written stays written.
 *
 * @see com.latexdoc.core.renderer.LatexWriter
 */
public interface Writable {

    /**
     * Writes this node as LaTeX to {@code writer}.
     *
     * @param writer destination sink
     * @throws IOException if the sink fails
     */
    void writeTo(Writer writer) throws IOException;
}

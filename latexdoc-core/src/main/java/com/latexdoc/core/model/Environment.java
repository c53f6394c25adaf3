package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generic {@code \begin{name} ... \end{name}} block.
 *
 * <p>Mandatory parameters follow the name, each in its own brace group; optional
 * parameters are comma-joined into a single bracket group after them:
 * <pre>
 * \begin{tabular}{|p{2cm}|p{8cm}|}
 * \begin{lstlisting}[language=Python,numbers=left]
 * </pre>
 * Each child is followed by a newline.
 *
 * <p>The numbered flag is carried for environments with a starred companion and does not
 * change how a generic environment is rendered.
 */
public final class Environment implements Element {

    private final String name;
    private final List<String> params = new ArrayList<>();
    private final List<String> optionalParams = new ArrayList<>();
    private final List<Element> elements = new ArrayList<>();
    private boolean numbered = true;

    private Environment(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates an environment with no parameters and no content.
     *
     * @param name environment name
     * @return new environment
     */
    public static Environment empty(String name) {
        return new Environment(name);
    }

    /**
     * Creates an environment whose content is the given lines, one plain text element each.
     *
     * @param name environment name
     * @param lines content lines
     * @return new environment
     */
    public static Environment of(String name, String... lines) {
        Environment environment = new Environment(name);
        for (String line : lines) {
            environment.push(line);
        }
        return environment;
    }

    /**
     * Creates an environment with parameters and no content.
     *
     * @param name environment name
     * @param params mandatory parameters, may be null
     * @param optionalParams optional parameters, may be null
     * @return new environment
     */
    public static Environment withParams(String name, List<String> params, List<String> optionalParams) {
        Environment environment = new Environment(name);
        if (params != null) {
            params.forEach(environment::param);
        }
        if (optionalParams != null) {
            optionalParams.forEach(environment::optionalParam);
        }
        return environment;
    }

    public String name() {
        return name;
    }

    public List<String> params() {
        return Collections.unmodifiableList(params);
    }

    public List<String> optionalParams() {
        return Collections.unmodifiableList(optionalParams);
    }

    public List<Element> elements() {
        return Collections.unmodifiableList(elements);
    }

    public boolean isNumbered() {
        return numbered;
    }

    public Environment numbered(boolean numbered) {
        this.numbered = numbered;
        return this;
    }

    public Environment param(String param) {
        params.add(Objects.requireNonNull(param, "param must not be null"));
        return this;
    }

    public Environment optionalParam(String param) {
        optionalParams.add(Objects.requireNonNull(param, "param must not be null"));
        return this;
    }

    public Environment push(Element element) {
        elements.add(Objects.requireNonNull(element, "element must not be null"));
        return this;
    }

    public Environment push(String text) {
        return push(Text.of(text));
    }

    public Environment pushText(Text text) {
        return push((Element) text);
    }

    @Override
    public Environment copy() {
        Environment copy = new Environment(name);
        copy.params.addAll(params);
        copy.optionalParams.addAll(optionalParams);
        copy.numbered = numbered;
        elements.forEach(element -> copy.elements.add(element.copy()));
        return copy;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        Markup.begin(writer, name);
        for (String param : params) {
            Markup.braced(writer, param);
        }
        if (!optionalParams.isEmpty()) {
            Markup.bracketed(writer, String.join(Markup.SEPARATOR, optionalParams));
        }
        Markup.newline(writer);

        for (Element element : elements) {
            element.writeTo(writer);
            Markup.newline(writer);
        }
        Markup.end(writer, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Environment other)) {
            return false;
        }
        return numbered == other.numbered
            && name.equals(other.name)
            && params.equals(other.params)
            && optionalParams.equals(other.optionalParams)
            && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, params, optionalParams, elements, numbered);
    }

    @Override
    public String toString() {
        return "Environment[name=" + name + ", params=" + params + ", optionalParams=" + optionalParams
            + ", elements=" + elements + "]";
    }
}

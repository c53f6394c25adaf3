package com.latexdoc.core.model;

import java.io.Writer;

/**
 * Bare one-line commands, rendered as {@code \keyword} followed by a newline.
 */
public enum SimpleCommand implements Command {

    /** {@code \tableofcontents} */
    TABLE_OF_CONTENTS("tableofcontents"),

    /** {@code \maketitle} */
    TITLE_PAGE("maketitle"),

    /** {@code \clearpage} */
    CLEAR_PAGE("clearpage"),

    /** {@code \bigskip} */
    BIG_SKIP("bigskip"),

    /** {@code \newpage} */
    NEW_PAGE("newpage");

    private final String keyword;

    SimpleCommand(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    @Override
    public void writeParameters(Writer writer) {
        // No parameters
    }

    @Override
    public Element copy() {
        return this;
    }
}

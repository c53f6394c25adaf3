package com.latexdoc.core.model;

/**
 * Kind of {@link ItemList}.
 */
public enum ListKind {

    /** Numbered list */
    ENUMERATE("enumerate"),

    /** Bullet list */
    ITEMIZE("itemize");

    private final String environmentName;

    ListKind(String environmentName) {
        this.environmentName = environmentName;
    }

    public String environmentName() {
        return environmentName;
    }
}

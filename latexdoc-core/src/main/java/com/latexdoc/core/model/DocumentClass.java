package com.latexdoc.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The {@code \documentclass} of a {@link Document}.
 *
 * <p>{@link #PART} is not a LaTeX class: a document of this class is rendered as a bare
 * fragment, meant to be pulled into another document with {@code \input} or
 * {@code \include}.
 *
 * @param kind standard kind, or {@link Kind#OTHER}
 * @param name class name written in {@code \documentclass}
 */
public record DocumentClass(Kind kind, String name) {

    public static final DocumentClass ARTICLE = new DocumentClass(Kind.ARTICLE, "article");
    public static final DocumentClass BOOK = new DocumentClass(Kind.BOOK, "book");
    public static final DocumentClass REPORT = new DocumentClass(Kind.REPORT, "report");
    public static final DocumentClass PART = new DocumentClass(Kind.PART, "");

    /**
     * Kinds of document class.
     */
    public enum Kind {
        ARTICLE,
        BOOK,
        REPORT,
        PART,
        OTHER
    }

    public DocumentClass {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates a custom class such as {@code beamer} or {@code memoir}.
     *
     * @param name class name
     * @return custom document class
     */
    public static DocumentClass other(String name) {
        return new DocumentClass(Kind.OTHER, name);
    }

    /**
     * Maps a class name to a standard constant, ignoring case, or to a custom class.
     *
     * @param name class name, e.g. {@code "report"}
     * @return matching document class
     */
    public static DocumentClass parse(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "article" -> ARTICLE;
            case "book" -> BOOK;
            case "report" -> REPORT;
            case "part" -> PART;
            default -> other(name.trim());
        };
    }

    public boolean isPart() {
        return kind == Kind.PART;
    }

    @Override
    public String toString() {
        return name;
    }
}

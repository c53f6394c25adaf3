package com.latexdoc.core.model;

import java.util.Objects;

/**
 * A single list entry. The content is a {@link Container}, so an item can hold several
 * elements, not just text.
 *
 * @param content item content
 */
public record Item(Container content) {

    public Item {
        Objects.requireNonNull(content, "content must not be null");
    }

    Item copy() {
        return new Item(content.copy());
    }
}

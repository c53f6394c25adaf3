package com.latexdoc.core.model;

import com.latexdoc.core.util.Markup;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An {@code itemize} or {@code enumerate} list.
 *
 * <p>Every item is written as {@code \item } followed by its content and a newline:
 * <pre>
 * \begin{itemize}
 * \item Apple
 * \item Orange
 * \end{itemize}
 * </pre>
 */
public final class ItemList implements Element {

    private final ListKind kind;
    private final List<Item> items = new ArrayList<>();

    public ItemList(ListKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ItemList itemize() {
        return new ItemList(ListKind.ITEMIZE);
    }

    public static ItemList enumerate() {
        return new ItemList(ListKind.ENUMERATE);
    }

    public ListKind kind() {
        return kind;
    }

    public ItemList push(Container content) {
        items.add(new Item(content));
        return this;
    }

    /**
     * Adds an item holding a single element.
     *
     * @param element item content
     * @return this list
     */
    public ItemList pushElement(Element element) {
        return push(Container.of(element));
    }

    public ItemList pushText(Text text) {
        return pushElement(text);
    }

    public ItemList pushText(String text) {
        return pushElement(Text.of(text));
    }

    public List<Item> items() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public ItemList copy() {
        ItemList copy = new ItemList(kind);
        items.forEach(item -> copy.items.add(item.copy()));
        return copy;
    }

    @Override
    public void writeTo(Writer writer) throws IOException {
        String environment = kind.environmentName();

        Markup.begin(writer, environment);
        Markup.newline(writer);
        for (Item item : items) {
            Markup.command(writer, "item");
            writer.write(" ");
            item.content().writeTo(writer);
            Markup.newline(writer);
        }
        Markup.end(writer, environment);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ItemList other && kind == other.kind && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, items);
    }

    @Override
    public String toString() {
        return "ItemList[kind=" + kind + ", items=" + items + "]";
    }
}

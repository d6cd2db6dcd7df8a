package lkml.java17.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable formatting state threaded through [MappingBuilder].
///
/// Every build step receives a context and hands back its successor together
/// with the nodes it produced, so a recursion level can be exercised on its own.
///
/// @param parentKey the innermost enclosing block or list key, null at document level
/// @param level the indent depth
/// @param lastEmitted what was emitted last at this level
/// @param path the enclosing keys, outermost first
record FormatContext(String parentKey, int level, Emitted lastEmitted, List<String> path) {

    static final String INDENT_UNIT = "  ";

    /// What precedes the next node at the current level.
    enum Emitted {
        /// Nothing yet; at the start of the document.
        DOCUMENT,
        /// Nothing yet; inside a freshly opened block or multiline list.
        FRESH,
        BLOCK,
        LIST,
        PAIR
    }

    FormatContext {
        Objects.requireNonNull(lastEmitted, "lastEmitted must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative, got: " + level);
        }
        path = List.copyOf(path);
    }

    static FormatContext root() {
        return new FormatContext(null, 0, Emitted.DOCUMENT, List.of());
    }

    String indent() {
        return INDENT_UNIT.repeat(level);
    }

    String newlineIndent() {
        return "\n" + indent();
    }

    /// {@return whitespace to put before the next node at this level}
    String prefix() {
        return switch (lastEmitted) {
            case DOCUMENT -> "";
            case BLOCK -> "\n" + newlineIndent();
            case FRESH, LIST, PAIR -> newlineIndent();
        };
    }

    /// {@return the context for the body of a block or multiline list keyed by `key`}
    FormatContext enter(String key) {
        final var nested = new ArrayList<String>(path.size() + 1);
        nested.addAll(path);
        nested.add(key);
        return new FormatContext(key, level + 1, Emitted.FRESH, nested);
    }

    /// {@return this context with `key` as the parent, for inline list items}
    FormatContext withParent(String key) {
        final var nested = new ArrayList<String>(path.size() + 1);
        nested.addAll(path);
        nested.add(key);
        return new FormatContext(key, level, lastEmitted, nested);
    }

    /// {@return the context following a node of the given kind at this level}
    FormatContext emitted(Emitted kind) {
        return new FormatContext(parentKey, level, kind, path);
    }

    String keyPath() {
        return String.join(".", path);
    }

    String keyPath(String key) {
        return path.isEmpty() ? key : keyPath() + "." + key;
    }
}

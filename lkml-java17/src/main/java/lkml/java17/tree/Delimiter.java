package lkml.java17.tree;

import java.util.Objects;

/// A brace or bracket. Carries its own prefix so an empty block can collapse
/// to `{}` while a non-empty one puts the closing brace on its own line.
public record Delimiter(String value, String prefix) {

    public Delimiter {
        Objects.requireNonNull(value, "value must not be null");
        prefix = prefix == null ? "" : prefix;
    }

    public static Delimiter leftBrace(String prefix) {
        return new Delimiter("{", prefix);
    }

    public static Delimiter rightBrace(String prefix) {
        return new Delimiter("}", prefix);
    }

    public static Delimiter leftBracket() {
        return new Delimiter("[", "");
    }

    public static Delimiter rightBracket(String prefix) {
        return new Delimiter("]", prefix);
    }

    /// {@return the prefix followed by the delimiter character}
    public String render() {
        return prefix + value;
    }
}

package lkml.java17.tree;

import java.util.Objects;

/// A token rendered between double quotes, e.g. `label: "Order ID"`.
///
/// Embedded double quotes are escaped with a backslash when rendered.
public record QuotedToken(String value, String prefix, String suffix) implements SyntaxToken {

    public QuotedToken {
        Objects.requireNonNull(value, "value must not be null");
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public QuotedToken(String value) {
        this(value, "", "");
    }

    @Override
    public String formatValue() {
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitQuoted(this);
    }
}

package lkml.java17.tree;

import java.util.Objects;

/// An unquoted token such as a key, a block name or a bare value like `yes`.
public record LiteralToken(String value, String prefix, String suffix) implements SyntaxToken {

    public LiteralToken {
        Objects.requireNonNull(value, "value must not be null");
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public LiteralToken(String value, String prefix) {
        this(value, prefix, "");
    }

    public LiteralToken(String value) {
        this(value, "", "");
    }

    @Override
    public String formatValue() {
        return value;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}

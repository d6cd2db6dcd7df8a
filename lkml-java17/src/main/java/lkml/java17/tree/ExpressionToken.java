package lkml.java17.tree;

import java.util.Objects;

/// A raw code fragment such as SQL or HTML, e.g. `sql: ${TABLE}.id ;;`.
///
/// The stored value has surrounding whitespace stripped. Rendering appends
/// exactly one space and the `;;` terminator, which ends the fragment.
public record ExpressionToken(String value, String prefix, String suffix) implements SyntaxToken {

    /// The terminator closing an expression value.
    public static final String TERMINATOR = ";;";

    public ExpressionToken {
        Objects.requireNonNull(value, "value must not be null");
        value = value.strip();
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public ExpressionToken(String value) {
        this(value, "", "");
    }

    @Override
    public String formatValue() {
        return value + " " + TERMINATOR;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }
}

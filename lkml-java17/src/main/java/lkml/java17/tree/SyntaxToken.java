package lkml.java17.tree;

/// The atomic renderable unit: a value plus the whitespace around it.
///
/// `prefix` and `suffix` are never null; an absent one is the empty string.
public sealed interface SyntaxToken extends ListItem permits LiteralToken, QuotedToken, ExpressionToken {

    /// {@return the logical value, without quotes or terminators}
    String value();

    /// {@return text rendered before the value, usually a newline and indent}
    String prefix();

    /// {@return text rendered after the value}
    String suffix();

    /// {@return the value as it appears in LookML, without prefix or suffix}
    String formatValue();
}

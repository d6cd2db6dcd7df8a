package lkml.java17.tree;

import java.util.Objects;

/// A single scalar assignment, e.g. `type: number`.
///
/// @param type the key
/// @param value the value token
public record PairNode(LiteralToken type, SyntaxToken value) implements ContainerItem, ListItem {

    public PairNode {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPair(this);
    }
}

package lkml.java17.tree;

import java.util.Objects;

/// The root of a LookML tree.
///
/// @param container the top-level declarations
public record DocumentNode(ContainerNode container) implements SyntaxNode {

    public DocumentNode {
        Objects.requireNonNull(container, "container must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDocument(this);
    }
}

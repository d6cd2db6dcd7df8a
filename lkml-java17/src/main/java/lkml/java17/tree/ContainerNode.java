package lkml.java17.tree;

import java.util.List;
import java.util.Objects;

/// An ordered run of blocks, lists and pairs.
///
/// Order is significant: it is the declaration order of the keys, with each
/// repeated key expanded into consecutive siblings.
///
/// @param items the children in declaration order
public record ContainerNode(List<ContainerItem> items) implements SyntaxNode {

    public ContainerNode {
        Objects.requireNonNull(items, "items must not be null");
        items = List.copyOf(items);
    }

    /// {@return `true` if this container has no children}
    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitContainer(this);
    }
}

package lkml.java17.tree;

import java.util.Objects;
import java.util.Optional;

/// A named or anonymous block, e.g. `dimension: order_id { ... }` or
/// `explore_source: { ... }`.
///
/// @param type the block's key
/// @param name the block's name (null for an anonymous block)
/// @param leftBrace the opening brace
/// @param container the block body
/// @param rightBrace the closing brace
public record BlockNode(
        LiteralToken type,
        LiteralToken name,
        Delimiter leftBrace,
        ContainerNode container,
        Delimiter rightBrace
) implements ContainerItem {

    public BlockNode {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(leftBrace, "leftBrace must not be null");
        Objects.requireNonNull(container, "container must not be null");
        Objects.requireNonNull(rightBrace, "rightBrace must not be null");
    }

    /// {@return the name token, or empty for an anonymous block}
    public Optional<LiteralToken> nameToken() {
        return Optional.ofNullable(name);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}

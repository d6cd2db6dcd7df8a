package lkml.java17.tree;

import java.util.List;
import java.util.Objects;

/// A bracketed list, e.g. `fields: [orders.id, orders.status]` or
/// `filters: [orders.status: "complete"]`.
///
/// Items are homogeneous: all tokens or all pairs.
///
/// @param type the list's key
/// @param leftBracket the opening bracket
/// @param items the list items
/// @param rightBracket the closing bracket
/// @param trailingComma whether a comma follows the last item
public record ListNode(
        LiteralToken type,
        Delimiter leftBracket,
        List<ListItem> items,
        Delimiter rightBracket,
        boolean trailingComma
) implements ContainerItem {

    public ListNode {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(leftBracket, "leftBracket must not be null");
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(rightBracket, "rightBracket must not be null");
        items = List.copyOf(items);
        if (!items.isEmpty()) {
            final boolean pairs = items.get(0) instanceof PairNode;
            for (final var item : items) {
                if ((item instanceof PairNode) != pairs) {
                    throw new IllegalArgumentException(
                            "list '" + type.value() + "' mixes pairs and tokens");
                }
            }
        }
    }

    /// {@return `true` if the items are pairs rather than tokens}
    public boolean isPairList() {
        return !items.isEmpty() && items.get(0) instanceof PairNode;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}

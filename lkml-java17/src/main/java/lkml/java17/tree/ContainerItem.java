package lkml.java17.tree;

/// A node that may appear directly inside a [ContainerNode].
public sealed interface ContainerItem extends SyntaxNode permits BlockNode, ListNode, PairNode {

    /// {@return the token naming this item's key, e.g. `dimension` or `sql`}
    LiteralToken type();
}

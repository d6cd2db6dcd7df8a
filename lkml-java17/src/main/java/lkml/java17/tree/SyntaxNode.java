package lkml.java17.tree;

/// A node in a LookML concrete syntax tree.
///
/// Instances are immutable. A tree is built in one pass, handed to a renderer
/// or a visitor, then discarded.
public sealed interface SyntaxNode permits DocumentNode, ContainerNode, ContainerItem, ListItem {

    /// Dispatches to the [NodeVisitor] method for this node's kind.
    ///
    /// @param visitor the visitor
    /// @param <R> the visitor's result type
    /// @return the visitor's result for this node
    <R> R accept(NodeVisitor<R> visitor);
}

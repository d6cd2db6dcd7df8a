package lkml.java17.tree;

/// A node that may appear between the brackets of a [ListNode].
public sealed interface ListItem extends SyntaxNode permits PairNode, SyntaxToken {}

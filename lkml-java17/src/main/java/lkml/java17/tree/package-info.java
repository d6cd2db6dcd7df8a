/// Concrete syntax tree for LookML documents.
///
/// ## Node kinds
/// A [DocumentNode] wraps one [ContainerNode]. Container children are
/// [BlockNode]s (`dimension: order_id { ... }`), [ListNode]s
/// (`fields: [a, b]`) and [PairNode]s (`hidden: yes`). Values are carried by
/// the three [SyntaxToken] kinds: [LiteralToken], [QuotedToken] and
/// [ExpressionToken].
///
/// Every node and token records the whitespace that precedes it, so a tree
/// renders back to text deterministically:
/// ```java
/// String text = LookmlRenderer.render(document);
/// ```
///
/// The hierarchy is sealed. Walk it with a [NodeVisitor]; a new node kind
/// cannot be added without every visitor failing to compile.
package lkml.java17.tree;

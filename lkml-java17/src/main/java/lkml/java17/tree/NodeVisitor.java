package lkml.java17.tree;

/// Visitor over every concrete [SyntaxNode] kind.
///
/// @param <R> the result type
public interface NodeVisitor<R> {

    R visitDocument(DocumentNode document);

    R visitContainer(ContainerNode container);

    R visitBlock(BlockNode block);

    R visitList(ListNode list);

    R visitPair(PairNode pair);

    R visitLiteral(LiteralToken token);

    R visitQuoted(QuotedToken token);

    R visitExpression(ExpressionToken token);
}

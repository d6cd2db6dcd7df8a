package lkml.java17.tree;

import java.util.Objects;
import java.util.logging.Logger;

/// Renders a syntax tree to LookML text.
///
/// A pure formatter: every token contributes `prefix + value + suffix` in tree
/// order, keys are followed by `": "`, list items are separated by `,`. No
/// whitespace is invented here; all layout decisions live in the prefixes
/// recorded on the tree.
public final class LookmlRenderer implements NodeVisitor<String> {

    private static final Logger LOG = Logger.getLogger(LookmlRenderer.class.getName());

    static final String COLON = ": ";
    static final String COMMA = ",";

    private static final LookmlRenderer INSTANCE = new LookmlRenderer();

    private LookmlRenderer() {}

    /// Renders a node and everything below it.
    ///
    /// @param node the node to render
    /// @return the LookML text
    /// @throws NullPointerException if node is null
    public static String render(SyntaxNode node) {
        Objects.requireNonNull(node, "node must not be null");
        final var text = node.accept(INSTANCE);
        LOG.finer(() -> "Rendered " + node.getClass().getSimpleName() + " to " + text.length() + " chars");
        return text;
    }

    @Override
    public String visitDocument(DocumentNode document) {
        return document.container().accept(this);
    }

    @Override
    public String visitContainer(ContainerNode container) {
        final var sb = new StringBuilder();
        for (final var item : container.items()) {
            sb.append(item.accept(this));
        }
        return sb.toString();
    }

    @Override
    public String visitBlock(BlockNode block) {
        final var sb = new StringBuilder();
        sb.append(block.type().accept(this)).append(COLON);
        if (block.name() != null) {
            sb.append(block.name().accept(this));
        }
        sb.append(block.leftBrace().render());
        sb.append(block.container().accept(this));
        sb.append(block.rightBrace().render());
        return sb.toString();
    }

    @Override
    public String visitList(ListNode list) {
        final var sb = new StringBuilder();
        sb.append(list.type().accept(this)).append(COLON);
        sb.append(list.leftBracket().render());
        for (int i = 0; i < list.items().size(); i++) {
            if (i > 0) sb.append(COMMA);
            sb.append(list.items().get(i).accept(this));
        }
        if (list.trailingComma()) sb.append(COMMA);
        sb.append(list.rightBracket().render());
        return sb.toString();
    }

    @Override
    public String visitPair(PairNode pair) {
        return pair.type().accept(this) + COLON + pair.value().accept(this);
    }

    @Override
    public String visitLiteral(LiteralToken token) {
        return token(token);
    }

    @Override
    public String visitQuoted(QuotedToken token) {
        return token(token);
    }

    @Override
    public String visitExpression(ExpressionToken token) {
        return token(token);
    }

    private static String token(SyntaxToken token) {
        return token.prefix() + token.formatValue() + token.suffix();
    }
}

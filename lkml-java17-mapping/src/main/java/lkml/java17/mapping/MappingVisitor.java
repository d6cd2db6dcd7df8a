package lkml.java17.mapping;

import lkml.java17.keys.KeyClassifier;
import lkml.java17.tree.BlockNode;
import lkml.java17.tree.ContainerNode;
import lkml.java17.tree.DocumentNode;
import lkml.java17.tree.ExpressionToken;
import lkml.java17.tree.ListNode;
import lkml.java17.tree.LiteralToken;
import lkml.java17.tree.NodeVisitor;
import lkml.java17.tree.PairNode;
import lkml.java17.tree.QuotedToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import static lkml.java17.mapping.LkmlException.Kind.KEY_CONFLICT;
import static lkml.java17.mapping.LkmlException.Kind.MALFORMED_UPDATE;
import static lkml.java17.mapping.LkmlException.Kind.MAX_DEPTH_EXCEEDED;

/// Reduces a syntax tree to a nested mapping, discarding concrete syntax.
///
/// Containers become [LinkedHashMap]s, lists become [ArrayList]s and tokens
/// their string values. Repeated siblings such as `dimension` blocks are
/// collected into one list under the plural key `dimensions`.
///
/// Holds a depth counter, so use a fresh instance for every tree.
final class MappingVisitor implements NodeVisitor<Object> {

    private static final Logger LOG = Logger.getLogger(MappingVisitor.class.getName());

    private final KeyClassifier keys;
    private final LkmlOptions options;
    private final Deque<String> path = new ArrayDeque<>();

    /// Nesting of the container being visited; the document's container is 0.
    private int depth = -1;

    MappingVisitor(KeyClassifier keys, LkmlOptions options) {
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    Map<String, Object> visit(DocumentNode document) {
        Objects.requireNonNull(document, "document must not be null");
        LOG.fine(() -> "Visiting document with " + document.container().items().size() + " top-level items");
        return asMap(document.accept(this));
    }

    /// Folds a single-key `update` into `target`.
    ///
    /// Repeatable keys accumulate under their plural form. Any other key that is
    /// already present is a conflict, except at the top level of the document,
    /// where the last declaration wins and a warning is logged.
    @SuppressWarnings("unchecked")
    void merge(Map<String, Object> target, Map<String, Object> update) {
        if (update.size() != 1) {
            throw new LkmlException(MALFORMED_UPDATE,
                    "Update must hold exactly one key, got: " + update.keySet(), keyPath());
        }
        final var entry = update.entrySet().iterator().next();
        final var key = entry.getKey();
        final var value = entry.getValue();

        if (keys.isRepeatable(key)) {
            final var plural = keys.pluralize(key);
            final var existing = target.get(plural);
            if (existing == null) {
                final var values = new ArrayList<Object>();
                values.add(value);
                target.put(plural, values);
            } else if (existing instanceof List<?> values) {
                ((List<Object>) values).add(value);
            } else {
                throw new LkmlException(KEY_CONFLICT,
                        "Key \"" + plural + "\" already holds a non-list value", keyPath(plural));
            }
        } else if (target.containsKey(key)) {
            if (depth == 0) {
                LOG.warning(() -> "Multiple declarations of top-level key \"" + key + "\" found. "
                        + "Using the last-declared value.");
                target.put(key, value);
            } else {
                throw new LkmlException(KEY_CONFLICT,
                        "Key \"" + key + "\" already exists and would overwrite the existing value",
                        keyPath(key));
            }
        } else {
            target.put(key, value);
        }
    }

    @Override
    public Object visitDocument(DocumentNode document) {
        return document.container().accept(this);
    }

    @Override
    public Object visitContainer(ContainerNode node) {
        final var container = new LinkedHashMap<String, Object>();
        depth++;
        if (depth > options.maxDepth()) {
            throw new LkmlException(MAX_DEPTH_EXCEEDED,
                    "Nesting exceeds the maximum depth of " + options.maxDepth(), keyPath());
        }
        for (final var item : node.items()) {
            merge(container, asMap(item.accept(this)));
        }
        depth--;
        return container;
    }

    @Override
    public Object visitBlock(BlockNode node) {
        final var type = node.type().value();
        path.addLast(type);
        final var body = asMap(node.container().accept(this));
        path.removeLast();
        if (node.name() != null) {
            body.put(MappingBuilder.NAME, node.name().value());
        }
        return single(type, body);
    }

    @Override
    public Object visitList(ListNode node) {
        final var type = node.type().value();
        path.addLast(type);
        final var values = new ArrayList<Object>(node.items().size());
        for (final var item : node.items()) {
            values.add(item.accept(this));
        }
        path.removeLast();
        return single(type, values);
    }

    @Override
    public Object visitPair(PairNode node) {
        return single(node.type().value(), node.value().accept(this));
    }

    @Override
    public Object visitLiteral(LiteralToken token) {
        return token.value();
    }

    @Override
    public Object visitQuoted(QuotedToken token) {
        return token.value();
    }

    @Override
    public Object visitExpression(ExpressionToken token) {
        return token.value();
    }

    private static Map<String, Object> single(String key, Object value) {
        final var map = new LinkedHashMap<String, Object>(2);
        map.put(key, value);
        return map;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private String keyPath() {
        return String.join(".", path);
    }

    private String keyPath(String key) {
        return path.isEmpty() ? key : keyPath() + "." + key;
    }
}

package lkml.java17.mapping;

import lkml.java17.keys.KeyClassifier;
import lkml.java17.mapping.FormatContext.Emitted;
import lkml.java17.tree.BlockNode;
import lkml.java17.tree.ContainerItem;
import lkml.java17.tree.ContainerNode;
import lkml.java17.tree.Delimiter;
import lkml.java17.tree.DocumentNode;
import lkml.java17.tree.ExpressionToken;
import lkml.java17.tree.ListItem;
import lkml.java17.tree.ListNode;
import lkml.java17.tree.LiteralToken;
import lkml.java17.tree.PairNode;
import lkml.java17.tree.QuotedToken;
import lkml.java17.tree.SyntaxToken;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import static lkml.java17.mapping.LkmlException.Kind.MAX_DEPTH_EXCEEDED;
import static lkml.java17.mapping.LkmlException.Kind.UNSUPPORTED_VALUE_TYPE;

/// Builds a LookML syntax tree from a nested mapping.
///
/// Each key is classified by the shape of its value:
/// - a string becomes a pair, `hidden: yes`
/// - a sequence under a repeatable plural key becomes repeated siblings,
///   `dimensions: [...]` -> one `dimension` block per element
/// - any other sequence becomes a bracketed list
/// - a mapping becomes a block, its `name` entry floated out as the block name
///   unless the key keeps a name field
///
/// Layout is decided here and recorded as token prefixes: blocks and
/// multiline lists indent their contents by one [FormatContext#INDENT_UNIT],
/// a block that follows a block is preceded by a blank line, and lists of five
/// or more items or of pairs go one item per line with a trailing comma.
///
/// The builder holds no mutable state; formatting state travels in
/// [FormatContext] values, so one instance is safe to reuse and share.
final class MappingBuilder {

    private static final Logger LOG = Logger.getLogger(MappingBuilder.class.getName());

    static final String NAME = "name";
    static final String FILTERS = "filters";
    static final String SUGGESTIONS = "suggestions";
    static final String ALLOWED_VALUE = "allowed_value";
    static final String ACCESS_GRANT = "access_grant";

    /// Lists with at least this many items are laid out one item per line.
    static final int MULTILINE_THRESHOLD = 5;

    private final KeyClassifier keys;
    private final LkmlOptions options;

    /// Nodes produced by one step plus the context that follows them.
    record Built(List<ContainerItem> nodes, FormatContext context) {
        Built {
            Objects.requireNonNull(nodes, "nodes must not be null");
            Objects.requireNonNull(context, "context must not be null");
            nodes = List.copyOf(nodes);
        }
    }

    MappingBuilder(KeyClassifier keys, LkmlOptions options) {
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    DocumentNode build(Map<String, ?> mapping) {
        Objects.requireNonNull(mapping, "mapping must not be null");
        LOG.fine(() -> "Building tree from mapping with " + mapping.size() + " top-level keys");
        final var built = members(mapping, FormatContext.root(), 0);
        return new DocumentNode(new ContainerNode(built.nodes()));
    }

    private Built members(Map<String, ?> mapping, FormatContext context, int depth) {
        final var nodes = new ArrayList<ContainerItem>();
        var current = context;
        for (final var entry : mapping.entrySet()) {
            final var built = classify(entry.getKey(), entry.getValue(), current, depth);
            nodes.addAll(built.nodes());
            current = built.context();
        }
        return new Built(nodes, current);
    }

    Built classify(String key, Object value, FormatContext context, int depth) {
        Objects.requireNonNull(key, "mapping keys must not be null");
        if (depth > options.maxDepth()) {
            throw new LkmlException(MAX_DEPTH_EXCEEDED,
                    "Nesting exceeds the maximum depth of " + options.maxDepth(), context.keyPath(key));
        }
        final var shape = MappingValue.of(value);
        if (shape instanceof MappingValue.Scalar scalar) {
            return new Built(List.of(pair(key, scalar.text(), context)), context.emitted(Emitted.PAIR));
        }
        if (shape instanceof MappingValue.Sequence sequence) {
            return isPluralKey(key, context.parentKey())
                    ? expand(key, sequence.elements(), context, depth)
                    : list(key, sequence.elements(), context);
        }
        if (shape instanceof MappingValue.Nested nested) {
            return block(key, nested.members(), context, depth);
        }
        final var unsupported = (MappingValue.Unsupported) shape;
        throw new LkmlException(UNSUPPORTED_VALUE_TYPE,
                "Value must be a string, list or map, got: " + describe(unsupported.value()), context.keyPath(key));
    }

    /// A key is plural when its singular form is repeatable. `allowed_values`
    /// directly inside an `access_grant` is the one exception: there it is an
    /// ordinary list.
    boolean isPluralKey(String key, String parentKey) {
        final var singular = keys.singularize(key);
        if (!keys.isRepeatable(singular)) {
            return false;
        }
        return !(ALLOWED_VALUE.equals(singular)
                && parentKey != null
                && ACCESS_GRANT.equals(stripTrailingS(parentKey)));
    }

    private Built expand(String key, List<?> values, FormatContext context, int depth) {
        final var singular = keys.singularize(key);
        LOG.finer(() -> "Expanding '" + key + "' into " + values.size() + " '" + singular + "' siblings");
        final var nodes = new ArrayList<ContainerItem>();
        var current = context;
        for (final var value : values) {
            final int next = value instanceof List ? depth + 1 : depth;
            final var built = classify(singular, value, current, next);
            nodes.addAll(built.nodes());
            current = built.context();
        }
        return new Built(nodes, current);
    }

    private Built block(String key, Map<String, ?> members, FormatContext context, int depth) {
        String name = null;
        Map<String, ?> fields = members;
        if (!keys.hasNameField(key) && members.containsKey(NAME)) {
            final Object rawName = members.get(NAME);
            if (!(rawName instanceof String nameText)) {
                throw new LkmlException(UNSUPPORTED_VALUE_TYPE,
                        "Block name must be a string, got: " + describe(rawName),
                        context.keyPath(key));
            }
            name = nameText.isEmpty() ? null : nameText;
            final var copy = new LinkedHashMap<String, Object>(members);
            copy.remove(NAME);
            fields = copy;
        }

        // one level per block body, as MappingVisitor counts containers
        if (depth + 1 > options.maxDepth()) {
            throw new LkmlException(MAX_DEPTH_EXCEEDED,
                    "Nesting exceeds the maximum depth of " + options.maxDepth(), context.keyPath(key));
        }
        final var prefix = context.prefix();
        final var body = members(fields, context.enter(key), depth + 1);
        final var container = new ContainerNode(body.nodes());

        final var node = new BlockNode(
                new LiteralToken(key, prefix),
                name == null ? null : new LiteralToken(name),
                Delimiter.leftBrace(name == null ? "" : " "),
                container,
                Delimiter.rightBrace(container.isEmpty() ? "" : context.newlineIndent()));
        return new Built(List.of(node), context.emitted(Emitted.BLOCK));
    }

    private Built list(String key, List<?> values, FormatContext context) {
        // `suggestions` is quoted only as a list
        final boolean forceQuote = SUGGESTIONS.equals(key);
        final boolean pairMode = !values.isEmpty() && !MappingValue.isListScalar(values.get(0));
        final boolean multiline = pairMode || values.size() >= MULTILINE_THRESHOLD;

        final var type = new LiteralToken(key, context.prefix());
        final var items = new ArrayList<ListItem>(values.size());
        final Delimiter rightBracket;

        if (multiline) {
            var inner = context.enter(key);
            for (final var value : values) {
                if (pairMode) {
                    final var entry = singleEntry(value, inner);
                    items.add(pair(entry.getKey(), entry.getValue(), inner));
                    inner = inner.emitted(Emitted.PAIR);
                } else {
                    items.add(token(key, scalarText(value, inner), forceQuote, inner.newlineIndent()));
                }
            }
            rightBracket = Delimiter.rightBracket(context.newlineIndent());
        } else {
            final var inner = context.withParent(key);
            for (int i = 0; i < values.size(); i++) {
                items.add(token(key, scalarText(values.get(i), inner), forceQuote, i == 0 ? "" : " "));
            }
            rightBracket = Delimiter.rightBracket("");
        }

        LOG.finer(() -> "List '" + key + "' with " + values.size() + " items, multiline=" + multiline
                + " pairMode=" + pairMode);
        final var node = new ListNode(type, Delimiter.leftBracket(), items, rightBracket, multiline);
        return new Built(List.of(node), context.emitted(Emitted.LIST));
    }

    private PairNode pair(String key, String value, FormatContext context) {
        final boolean forceQuote = FILTERS.equals(context.parentKey());
        return new PairNode(new LiteralToken(key, context.prefix()), token(key, value, forceQuote, ""));
    }

    private SyntaxToken token(String key, String value, boolean forceQuote, String prefix) {
        if (forceQuote || keys.isQuotedLiteral(key)) {
            return new QuotedToken(value, prefix, "");
        }
        if (keys.isExpressionBlock(key)) {
            return new ExpressionToken(value, prefix, "");
        }
        return new LiteralToken(value, prefix, "");
    }

    private static Map.Entry<String, String> singleEntry(Object element, FormatContext context) {
        if (element instanceof Map<?, ?> map && map.size() == 1) {
            final var entry = map.entrySet().iterator().next();
            if (entry.getKey() instanceof String key && MappingValue.isListScalar(entry.getValue())) {
                return Map.entry(key, entry.getValue().toString());
            }
        }
        throw new LkmlException(UNSUPPORTED_VALUE_TYPE,
                "List of pairs requires single-key maps with scalar values, got: " + describe(element),
                context.keyPath());
    }

    private static String scalarText(Object element, FormatContext context) {
        if (MappingValue.isListScalar(element)) {
            return element.toString();
        }
        throw new LkmlException(UNSUPPORTED_VALUE_TYPE,
                "List items must all be scalars or all be single-key maps, got: " + describe(element),
                context.keyPath());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static String stripTrailingS(String key) {
        int end = key.length();
        while (end > 0 && key.charAt(end - 1) == 's') end--;
        return key.substring(0, end);
    }
}

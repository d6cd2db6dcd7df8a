package lkml.java17.mapping;

import lkml.java17.keys.KeyClassifier;
import lkml.java17.tree.DocumentNode;
import lkml.java17.tree.LookmlRenderer;

import java.util.Map;
import java.util.Objects;

/// Converts between nested mappings and LookML syntax trees.
///
/// Usage:
/// ```java
/// var view = new LinkedHashMap<String, Object>();
/// view.put("name", "orders");
/// view.put("sql_table_name", "analytics.orders");
/// DocumentNode tree = Lkml.build(Map.of("view", view));
/// String text = Lkml.render(tree);
/// Map<String, Object> back = Lkml.visit(tree);
/// ```
///
/// Every call uses its own state, so calls may run concurrently on independent
/// inputs. Failures are reported as [LkmlException]; no partial result is
/// returned.
public final class Lkml {

    private Lkml() {
        // Static utility class
    }

    /// Builds a tree from a mapping using the LookML key tables and default options.
    ///
    /// @param mapping keys to strings, lists or nested maps, in declaration order
    /// @return the syntax tree
    /// @throws LkmlException if a value has an unsupported type or nesting is too deep
    public static DocumentNode build(Map<String, ?> mapping) {
        return build(mapping, KeyClassifier.lookml(), LkmlOptions.defaults());
    }

    /// Builds a tree from a mapping.
    ///
    /// @param mapping keys to strings, lists or nested maps, in declaration order
    /// @param keys the key classification to apply
    /// @param options limits to enforce
    /// @return the syntax tree
    /// @throws NullPointerException if any argument is null
    /// @throws LkmlException if a value has an unsupported type or nesting is too deep
    public static DocumentNode build(Map<String, ?> mapping, KeyClassifier keys, LkmlOptions options) {
        Objects.requireNonNull(mapping, "mapping must not be null");
        return new MappingBuilder(keys, options).build(mapping);
    }

    /// Reduces a tree to a mapping using the LookML key tables and default options.
    ///
    /// @param document the tree
    /// @return a fresh mutable mapping
    /// @throws LkmlException if a non-repeatable key repeats below the top level
    public static Map<String, Object> visit(DocumentNode document) {
        return visit(document, KeyClassifier.lookml(), LkmlOptions.defaults());
    }

    /// Reduces a tree to a mapping.
    ///
    /// @param document the tree
    /// @param keys the key classification to apply
    /// @param options limits to enforce
    /// @return a fresh mutable mapping
    /// @throws NullPointerException if any argument is null
    /// @throws LkmlException if a non-repeatable key repeats below the top level
    public static Map<String, Object> visit(DocumentNode document, KeyClassifier keys, LkmlOptions options) {
        Objects.requireNonNull(document, "document must not be null");
        return new MappingVisitor(keys, options).visit(document);
    }

    /// Renders a tree as LookML text.
    ///
    /// @param document the tree
    /// @return the text
    public static String render(DocumentNode document) {
        return LookmlRenderer.render(document);
    }
}

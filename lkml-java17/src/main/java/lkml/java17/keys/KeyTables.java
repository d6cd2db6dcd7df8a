package lkml.java17.keys;

import java.util.Objects;
import java.util.Set;

/// A [KeyClassifier] backed by immutable key sets.
///
/// Pluralization is regular: keys in `pluralExempt` are their own singular and
/// plural, a consonant followed by `y` becomes `ies`, and anything else gains or
/// loses a single `s`.
///
/// @param repeatable keys that may repeat within a block
/// @param nameFieldKeys block keys whose `name` stays a field
/// @param quotedLiterals keys whose values are quoted
/// @param expressionBlocks keys whose values are `;;`-terminated expressions
/// @param pluralExempt keys that are identical in singular and plural form
public record KeyTables(
        Set<String> repeatable,
        Set<String> nameFieldKeys,
        Set<String> quotedLiterals,
        Set<String> expressionBlocks,
        Set<String> pluralExempt
) implements KeyClassifier {

    static final KeyTables LOOKML = new KeyTables(
            Set.of(
                    "view", "measure", "dimension", "dimension_group", "filter", "access_filter",
                    "bind_filters", "map_layer", "parameter", "set", "column", "derived_column",
                    "include", "explore", "link", "when", "allowed_value", "named_value_format",
                    "join", "datagroup", "access_grant", "sql_step", "sql_where", "action",
                    "param", "form_param", "option", "user_attribute_param", "assert", "test",
                    "query", "extends", "aggregate_table", "constant", "local_dependency",
                    "remote_dependency", "extension", "override_constant"),
            Set.of("user_attribute_param", "param", "form_param", "option"),
            Set.of(
                    "label", "view_label", "group_label", "group_item_label", "suggest_persist_for",
                    "default_value", "direction", "value_format", "name", "url", "icon_url",
                    "form_url", "default", "tags", "value", "description", "sortkeys", "indexes",
                    "partition_keys", "connection", "include", "max_cache_age", "allowed_values",
                    "timezone", "persist_for", "cluster_keys", "distribution", "extends__all",
                    "extends", "file", "sql_trigger_value", "interval_trigger"),
            Set.of(
                    "expression_custom_filter", "expression", "html", "sql_trigger_value",
                    "sql_table_name", "sql_distinct_key", "sql_start", "sql_always_having",
                    "sql_always_where", "sql_trigger", "sql_foreign_key", "sql_where", "sql_end",
                    "sql_for", "sql_latitude", "sql_longitude", "sql_step", "sql_on", "sql",
                    "sql_preamble"),
            Set.of("filters", "bind_filters", "extends"));

    public KeyTables {
        Objects.requireNonNull(repeatable, "repeatable must not be null");
        Objects.requireNonNull(nameFieldKeys, "nameFieldKeys must not be null");
        Objects.requireNonNull(quotedLiterals, "quotedLiterals must not be null");
        Objects.requireNonNull(expressionBlocks, "expressionBlocks must not be null");
        Objects.requireNonNull(pluralExempt, "pluralExempt must not be null");
        repeatable = Set.copyOf(repeatable);
        nameFieldKeys = Set.copyOf(nameFieldKeys);
        quotedLiterals = Set.copyOf(quotedLiterals);
        expressionBlocks = Set.copyOf(expressionBlocks);
        pluralExempt = Set.copyOf(pluralExempt);
    }

    @Override
    public boolean isRepeatable(String key) {
        return repeatable.contains(key);
    }

    @Override
    public String pluralize(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (pluralExempt.contains(key)) {
            return key;
        }
        if (endsWithConsonantY(key)) {
            return key.substring(0, key.length() - 1) + "ies";
        }
        return key + "s";
    }

    @Override
    public String singularize(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (pluralExempt.contains(key)) {
            return key;
        }
        if (key.endsWith("ies") && key.length() > 3) {
            return key.substring(0, key.length() - 3) + "y";
        }
        if (key.endsWith("s")) {
            return key.substring(0, key.length() - 1);
        }
        return key;
    }

    @Override
    public boolean hasNameField(String key) {
        return nameFieldKeys.contains(key);
    }

    @Override
    public boolean isQuotedLiteral(String key) {
        return quotedLiterals.contains(key);
    }

    @Override
    public boolean isExpressionBlock(String key) {
        return expressionBlocks.contains(key);
    }

    private static boolean endsWithConsonantY(String key) {
        if (key.length() < 2 || !key.endsWith("y")) {
            return false;
        }
        return "aeiou".indexOf(key.charAt(key.length() - 2)) < 0;
    }
}

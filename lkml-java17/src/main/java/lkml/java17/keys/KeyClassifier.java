package lkml.java17.keys;

/// Read-only key lookups that drive both directions of the mapping codec.
///
/// The classifier is passed explicitly to the codec rather than read from a
/// global, so a caller can substitute another grammar. Implementations must be
/// immutable; one instance may serve concurrent callers.
public interface KeyClassifier {

    /// {@return `true` if the key may appear more than once in the same block,
    /// e.g. `dimension`}
    boolean isRepeatable(String key);

    /// {@return the plural form used as the mapping key for a repeatable key,
    /// e.g. `dimension` -> `dimensions`}
    String pluralize(String key);

    /// {@return the singular form of a plural mapping key, e.g. `dimensions` -> `dimension`}
    String singularize(String key);

    /// {@return `true` if blocks of this type keep `name` as an ordinary field
    /// instead of floating it out as the block name}
    boolean hasNameField(String key);

    /// {@return `true` if values of this key are rendered in double quotes}
    boolean isQuotedLiteral(String key);

    /// {@return `true` if values of this key are raw expressions terminated by `;;`}
    boolean isExpressionBlock(String key);

    /// {@return the LookML grammar}
    static KeyClassifier lookml() {
        return KeyTables.LOOKML;
    }
}

package lkml.java17.mapping;

import java.util.Objects;

/// Exception thrown when a mapping cannot be turned into a tree or a tree
/// cannot be turned into a mapping.
///
/// The failure is fatal for the whole call; no partial result is returned.
/// [#kind()] tells callers which contract was broken and [#keyPath()] where.
public class LkmlException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// The failure categories.
    public enum Kind {
        /// A mapping value is not a string, sequence or nested mapping.
        UNSUPPORTED_VALUE_TYPE,
        /// A non-repeatable key is declared twice below the document root.
        KEY_CONFLICT,
        /// A merge was handed an update that does not hold exactly one key.
        MALFORMED_UPDATE,
        /// Nesting went deeper than [LkmlOptions#maxDepth()].
        MAX_DEPTH_EXCEEDED
    }

    private final Kind kind;
    private final String keyPath;

    /// Creates a new exception.
    /// @param kind the failure category
    /// @param message the error message
    /// @param keyPath dotted path of the enclosing keys, empty at document level
    public LkmlException(Kind kind, String message, String keyPath) {
        super(formatMessage(message, keyPath));
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.keyPath = keyPath == null ? "" : keyPath;
    }

    /// Returns the failure category.
    public Kind kind() {
        return kind;
    }

    /// Returns the dotted key path where the failure occurred, or the empty
    /// string at document level.
    public String keyPath() {
        return keyPath;
    }

    private static String formatMessage(String message, String keyPath) {
        if (keyPath == null || keyPath.isEmpty()) {
            return message;
        }
        return message + " at key path: " + keyPath;
    }
}

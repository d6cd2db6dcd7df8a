package lkml.java17.mapping;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The shape of one value in a nested mapping, decided once before a key is
/// turned into syntax.
sealed interface MappingValue permits MappingValue.Scalar, MappingValue.Sequence,
        MappingValue.Nested, MappingValue.Unsupported {

    /// A string, rendered as a pair.
    record Scalar(String text) implements MappingValue {
        public Scalar {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// An ordered sequence, rendered as a list or as repeated siblings.
    record Sequence(List<?> elements) implements MappingValue {
        public Sequence {
            Objects.requireNonNull(elements, "elements must not be null");
        }
    }

    /// A nested mapping, rendered as a block.
    record Nested(Map<String, ?> members) implements MappingValue {
        public Nested {
            Objects.requireNonNull(members, "members must not be null");
        }
    }

    /// Anything else, including null.
    record Unsupported(Object value) implements MappingValue {
    }

    @SuppressWarnings("unchecked")
    static MappingValue of(Object value) {
        if (value instanceof String s) return new Scalar(s);
        if (value instanceof List<?> l) return new Sequence(l);
        if (value instanceof Map<?, ?> m && keysAreStrings(m)) return new Nested((Map<String, ?>) m);
        return new Unsupported(value);
    }

    /// {@return `true` if the value may be written as a bare list element}
    static boolean isListScalar(Object value) {
        return value instanceof String
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof java.math.BigInteger;
    }

    private static boolean keysAreStrings(Map<?, ?> map) {
        for (final var key : map.keySet()) {
            if (!(key instanceof String)) return false;
        }
        return true;
    }
}

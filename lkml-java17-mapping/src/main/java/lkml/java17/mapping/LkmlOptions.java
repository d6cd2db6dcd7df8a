package lkml.java17.mapping;

import java.util.logging.Logger;

/// Limits applied by the mapping codec.
///
/// The default maximum nesting depth can be set with the system property
/// {@code lkml.mapping.maxDepth}; it is read once, when this class initialises.
///
/// @param maxDepth the deepest allowed nesting of blocks and lists, at least 1
public record LkmlOptions(int maxDepth) {

    private static final Logger LOG = Logger.getLogger(LkmlOptions.class.getName());

    /// System property key for the default maximum nesting depth
    public static final String MAX_DEPTH_PROPERTY = "lkml.mapping.maxDepth";

    /// Depth used when the system property is absent or invalid
    public static final int DEFAULT_MAX_DEPTH = 512;

    private static final LkmlOptions DEFAULTS;

    static {
        final String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
        int depth = DEFAULT_MAX_DEPTH;
        if (propertyValue != null) {
            try {
                depth = Integer.parseInt(propertyValue.trim());
                if (depth < 1) {
                    LOG.warning(() -> "Non-positive " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                            + ". Using default: " + DEFAULT_MAX_DEPTH);
                    depth = DEFAULT_MAX_DEPTH;
                } else {
                    final int configured = depth;
                    LOG.fine(() -> "Max depth set to " + configured + " via system property");
                }
            } catch (NumberFormatException e) {
                LOG.warning(() -> "Invalid " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                        + ". Using default: " + DEFAULT_MAX_DEPTH);
                depth = DEFAULT_MAX_DEPTH;
            }
        }
        DEFAULTS = new LkmlOptions(depth);
    }

    public LkmlOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got: " + maxDepth);
        }
    }

    /// {@return the options configured from system properties}
    public static LkmlOptions defaults() {
        return DEFAULTS;
    }
}

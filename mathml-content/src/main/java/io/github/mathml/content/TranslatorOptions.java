package io.github.mathml.content;

import java.util.logging.Logger;

/// Options controlling a [ContentTranslator].
///
/// The default depth limit can be changed for the whole process with the system property
/// {@code mathml.content.maxDepth}, read once when this class is initialized.
///
/// @param maxDepth the deepest element nesting accepted, counting `<math>` as depth 1
public record TranslatorOptions(int maxDepth) {

    private static final Logger LOG = Logger.getLogger(TranslatorOptions.class.getName());

    /// System property overriding the default depth limit.
    public static final String MAX_DEPTH_PROPERTY = "mathml.content.maxDepth";

    /// Depth limit used when the system property is absent or invalid.
    public static final int DEFAULT_MAX_DEPTH = 256;

    public static final TranslatorOptions DEFAULT = new TranslatorOptions(configuredMaxDepth());

    public TranslatorOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got: " + maxDepth);
        }
    }

    public TranslatorOptions withMaxDepth(int newMaxDepth) {
        return new TranslatorOptions(newMaxDepth);
    }

    String summary() {
        return "maxDepth=" + maxDepth;
    }

    private static int configuredMaxDepth() {
        final String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
        if (propertyValue == null) {
            return DEFAULT_MAX_DEPTH;
        }
        try {
            final int value = Integer.parseInt(propertyValue.trim());
            if (value < 1) {
                LOG.warning(() -> "Ignoring " + MAX_DEPTH_PROPERTY + "=" + propertyValue
                        + ", must be positive. Using default: " + DEFAULT_MAX_DEPTH);
                return DEFAULT_MAX_DEPTH;
            }
            LOG.fine(() -> "Max depth set to " + value + " via system property");
            return value;
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Invalid " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                    + ". Using default: " + DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
    }
}

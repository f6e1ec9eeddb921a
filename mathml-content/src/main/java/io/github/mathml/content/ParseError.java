package io.github.mathml.content;

import java.util.Objects;

/// Why a document could not be translated.
///
/// Every case carries enough detail (tag, path locator) for a caller to report an
/// actionable diagnostic without walking the input again. [#message] renders it.
public sealed interface ParseError {

    /// A human-readable one-line diagnostic.
    String message();

    /// The root `<math>` element is not in the MathML namespace.
    ///
    /// @param found the namespace that was found, or null if none was declared
    record NamespaceError(String found) implements ParseError {
        @Override
        public String message() {
            if (found == null) {
                return "<math> has no namespace, expected " + ContentTranslator.MATHML_NAMESPACE;
            }
            return "<math> is in namespace '" + found + "', expected " + ContentTranslator.MATHML_NAMESPACE;
        }
    }

    /// A recognized element is used in a structurally invalid way.
    record StructureError(String tag, String reason, String path) implements ParseError {
        public StructureError {
            Objects.requireNonNull(tag, "tag must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String message() {
            return "Invalid <" + tag + "> at " + path + ": " + reason;
        }
    }

    /// An element outside the supported Content Markup vocabulary.
    record UnknownElementError(String tag, String path) implements ParseError {
        public UnknownElementError {
            Objects.requireNonNull(tag, "tag must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String message() {
            return "Unknown element <" + tag + "> at " + path;
        }
    }

    /// Nesting exceeded the configured limit.
    record DepthExceededError(int limit) implements ParseError {
        @Override
        public String message() {
            return "Element nesting exceeds the maximum depth of " + limit;
        }
    }
}

package io.github.mathml.content;

import java.util.Objects;

/// Outcome of translating a document or fragment: exactly one of `node` and `error` is set.
///
/// When `isSuccess()` is true `node()` holds the completed tree and `error()` is null.
/// Otherwise `error()` describes the first failure and no partial tree is kept.
public record TranslationResult<T extends ContentNode>(T node, ParseError error) {

    public TranslationResult {
        if ((node == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of node and error must be set");
        }
    }

    public static <T extends ContentNode> TranslationResult<T> success(T node) {
        return new TranslationResult<>(Objects.requireNonNull(node, "node must not be null"), null);
    }

    public static <T extends ContentNode> TranslationResult<T> failure(ParseError error) {
        return new TranslationResult<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /// Returns the tree or rethrows the failure.
    /// @throws MathMlParseException if translation failed
    public T orElseThrow() {
        if (error != null) {
            throw new MathMlParseException(error);
        }
        return node;
    }
}

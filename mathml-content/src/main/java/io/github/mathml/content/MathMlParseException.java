package io.github.mathml.content;

import java.util.Objects;

/// Exception thrown when a MathML document cannot be translated.
/// Carries the structured [ParseError] describing the failure.
public class MathMlParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ParseError error;

    /// Creates a new parse exception for the given error.
    /// @param error the structured error
    public MathMlParseException(ParseError error) {
        super(Objects.requireNonNull(error, "error must not be null").message());
        this.error = error;
    }

    /// Returns the structured error.
    public ParseError error() {
        return error;
    }
}

package io.github.mathml.content.xml;

/// Exception thrown when a document is not well-formed XML or cannot be read by the XML parser.
/// Carries the line and column reported by the parser where available.
public class XmlReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    /// Creates a new read exception with the given message and cause.
    public XmlReadException(String message, Throwable cause) {
        this(message, -1, -1, cause);
    }

    /// Creates a new read exception with position information.
    public XmlReadException(String message, int line, int column, Throwable cause) {
        super(formatMessage(message, line, column), cause);
        this.line = line;
        this.column = column;
    }

    /// Returns the 1-based line of the error, or -1 if unknown.
    public int line() {
        return line;
    }

    /// Returns the 1-based column of the error, or -1 if unknown.
    public int column() {
        return column;
    }

    private static String formatMessage(String message, int line, int column) {
        if (line < 0) {
            return message;
        }
        return message + " at line " + line + ", column " + column;
    }
}

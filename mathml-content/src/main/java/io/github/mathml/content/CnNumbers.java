package io.github.mathml.content;

import io.github.mathml.content.ContentNode.Sep;
import io.github.mathml.content.ContentNode.Text;
import io.github.mathml.content.NumberValue.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/// Interprets the content of a `<cn>` element as a [NumberValue].
///
/// Two-part types (`rational`, `complex-cartesian`, `complex-polar` and the MathML form of
/// `e-notation`) expect exactly two text runs around one `<sep/>`. `e-notation` also accepts
/// the single-run `2e-5` form found in SBML documents.
/// Malformed literals raise [IllegalArgumentException] with a reason suitable for a diagnostic.
final class CnNumbers {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)");
    private static final Pattern DECIMAL_INTEGER = Pattern.compile("[+-]?\\d+");

    static final String DEFAULT_TYPE = "real";
    static final int DEFAULT_BASE = 10;

    private CnNumbers() {}

    /// Parses a `base` attribute value.
    /// @param raw the attribute value, or null if absent
    static int parseBase(String raw) {
        if (raw == null) {
            return DEFAULT_BASE;
        }
        final int base;
        try {
            base = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("base '" + raw + "' is not a number", e);
        }
        if (base < Character.MIN_RADIX || base > Character.MAX_RADIX) {
            throw new IllegalArgumentException("base " + base + " is outside "
                    + Character.MIN_RADIX + ".." + Character.MAX_RADIX);
        }
        return base;
    }

    /// Interprets translated `<cn>` content.
    /// @param type the `type` attribute, or null for the default `real`
    /// @param base the radix for integer parts
    /// @param content the translated content: [Text] and [Sep] nodes
    static NumberValue interpret(String type, int base, List<ContentNode> content) {
        final String effectiveType = type == null ? DEFAULT_TYPE : type.trim();
        final List<String> parts = split(content);
        return switch (effectiveType) {
            case "real" -> new Real(parseDecimal(single(parts, effectiveType)));
            case "integer" -> new IntegerValue(parseInteger(single(parts, effectiveType), base));
            case "rational" -> {
                final List<String> pair = pair(parts, effectiveType);
                final long denominator = parseInteger(pair.get(1), base);
                if (denominator == 0) {
                    throw new IllegalArgumentException("rational denominator must not be zero");
                }
                yield new Rational(parseInteger(pair.get(0), base), denominator);
            }
            case "complex-cartesian" -> {
                final List<String> pair = pair(parts, effectiveType);
                yield new ComplexCartesian(parseDecimal(pair.get(0)), parseDecimal(pair.get(1)));
            }
            case "complex-polar" -> {
                final List<String> pair = pair(parts, effectiveType);
                yield new ComplexPolar(parseDecimal(pair.get(0)), parseDecimal(pair.get(1)));
            }
            case "constant" -> new Constant(single(parts, effectiveType));
            case "e-notation" -> parseENotation(parts);
            default -> throw new IllegalArgumentException("unsupported number type '" + effectiveType + "'");
        };
    }

    /// Splits content into the text between separators. Adjacent text runs are joined.
    private static List<String> split(List<ContentNode> content) {
        final List<String> parts = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        for (final ContentNode node : content) {
            if (node instanceof Text text) {
                current.append(text.value());
            } else if (node instanceof Sep) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                throw new IllegalArgumentException("unexpected " + node.getClass().getSimpleName()
                        + " inside a number literal");
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private static String single(List<String> parts, String type) {
        if (parts.size() != 1) {
            throw new IllegalArgumentException("type '" + type + "' does not take a <sep/>");
        }
        return requireText(parts.get(0), type);
    }

    private static List<String> pair(List<String> parts, String type) {
        if (parts.size() != 2) {
            throw new IllegalArgumentException("type '" + type + "' needs exactly two parts separated by <sep/>, got "
                    + parts.size());
        }
        return List.of(requireText(parts.get(0), type), requireText(parts.get(1), type));
    }

    private static String requireText(String part, String type) {
        if (part.isEmpty()) {
            throw new IllegalArgumentException("empty number for type '" + type + "'");
        }
        return part;
    }

    private static double parseDecimal(String text) {
        if (!DECIMAL.matcher(text).matches()) {
            throw new IllegalArgumentException("'" + text + "' is not a decimal number");
        }
        return Double.parseDouble(text);
    }

    private static long parseInteger(String text, int base) {
        try {
            return Long.parseLong(text, base);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + text + "' is not an integer in base " + base, e);
        }
    }

    private static ENotation parseENotation(List<String> parts) {
        if (parts.size() == 2) {
            final List<String> pair = pair(parts, "e-notation");
            return new ENotation(parseDecimal(pair.get(0)), parseExponent(pair.get(1)));
        }
        final String text = single(parts, "e-notation").toLowerCase(Locale.ROOT);
        final int e = text.indexOf('e');
        if (e < 0 || e != text.lastIndexOf('e')) {
            throw new IllegalArgumentException("'" + text + "' is not in e-notation");
        }
        final String mantissa = text.substring(0, e).trim();
        if (!PLAIN_DECIMAL.matcher(mantissa).matches()) {
            throw new IllegalArgumentException("'" + mantissa + "' is not a valid mantissa");
        }
        return new ENotation(Double.parseDouble(mantissa), parseExponent(text.substring(e + 1).trim()));
    }

    private static long parseExponent(String text) {
        if (!DECIMAL_INTEGER.matcher(text).matches()) {
            throw new IllegalArgumentException("'" + text + "' is not a valid exponent");
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("exponent '" + text + "' is out of range", e);
        }
    }
}

package io.github.mathml.content.xml;

import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Rewrites MathML named character entities such as `&tau;` into numeric character
/// references such as `&#x3C4;`.
///
/// MathML documents routinely use the entity names of the MathML DTD without declaring
/// them, and a parser with DOCTYPE processing disabled rejects undeclared entities.
/// The five predefined XML entities and names not in the table are left untouched,
/// so an undeclared unknown entity still fails in the parser. CDATA sections, comments
/// and processing instructions are copied verbatim, since entities are not recognized there.
final class EntitySanitizer {

    private static final Logger LOG = Logger.getLogger(EntitySanitizer.class.getName());

    /// Either a section to copy as is, or a named entity with its name in group 1.
    private static final Pattern NAMED_ENTITY = Pattern.compile(
            "<!\\[CDATA\\[.*?]]>|<!--.*?-->|<\\?.*?\\?>|&([A-Za-z][A-Za-z0-9]*);", Pattern.DOTALL);

    private static final Map<String, Integer> ENTITIES = Map.ofEntries(
            // Greek lowercase
            Map.entry("alpha", 0x03B1), Map.entry("beta", 0x03B2), Map.entry("gamma", 0x03B3),
            Map.entry("delta", 0x03B4), Map.entry("epsilon", 0x03B5), Map.entry("zeta", 0x03B6),
            Map.entry("eta", 0x03B7), Map.entry("theta", 0x03B8), Map.entry("iota", 0x03B9),
            Map.entry("kappa", 0x03BA), Map.entry("lambda", 0x03BB), Map.entry("mu", 0x03BC),
            Map.entry("nu", 0x03BD), Map.entry("xi", 0x03BE), Map.entry("omicron", 0x03BF),
            Map.entry("pi", 0x03C0), Map.entry("rho", 0x03C1), Map.entry("sigma", 0x03C3),
            Map.entry("tau", 0x03C4), Map.entry("upsilon", 0x03C5), Map.entry("phi", 0x03C6),
            Map.entry("chi", 0x03C7), Map.entry("psi", 0x03C8), Map.entry("omega", 0x03C9),
            // Greek uppercase
            Map.entry("Gamma", 0x0393), Map.entry("Delta", 0x0394), Map.entry("Theta", 0x0398),
            Map.entry("Lambda", 0x039B), Map.entry("Xi", 0x039E), Map.entry("Pi", 0x03A0),
            Map.entry("Sigma", 0x03A3), Map.entry("Upsilon", 0x03A5), Map.entry("Phi", 0x03A6),
            Map.entry("Psi", 0x03A8), Map.entry("Omega", 0x03A9),
            // MathML invisible operators and common symbols
            Map.entry("InvisibleTimes", 0x2062), Map.entry("ApplyFunction", 0x2061),
            Map.entry("InvisibleComma", 0x2063), Map.entry("ExponentialE", 0x2147),
            Map.entry("ImaginaryI", 0x2148), Map.entry("DifferentialD", 0x2146),
            Map.entry("infin", 0x221E), Map.entry("nbsp", 0x00A0), Map.entry("minus", 0x2212),
            Map.entry("times", 0x00D7), Map.entry("plusmn", 0x00B1), Map.entry("deg", 0x00B0));

    private EntitySanitizer() {}

    static String sanitize(String xml) {
        final Matcher matcher = NAMED_ENTITY.matcher(xml);
        final StringBuilder out = new StringBuilder(xml.length());
        int replaced = 0;
        while (matcher.find()) {
            final String name = matcher.group(1);
            final Integer codePoint = name == null ? null : ENTITIES.get(name);
            if (codePoint == null) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
            } else {
                matcher.appendReplacement(out, "&#x" + Integer.toHexString(codePoint).toUpperCase(Locale.ROOT) + ";");
                replaced++;
            }
        }
        matcher.appendTail(out);
        final int count = replaced;
        LOG.finer(() -> "Replaced " + count + " named entities");
        return out.toString();
    }
}

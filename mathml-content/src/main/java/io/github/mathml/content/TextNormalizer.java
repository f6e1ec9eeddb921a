package io.github.mathml.content;

import java.util.regex.Pattern;

/// Whitespace rules for leaf text: runs of XML whitespace collapse to one space
/// and leading and trailing whitespace is removed.
final class TextNormalizer {

    private static final Pattern XML_WHITESPACE = Pattern.compile("[ \\t\\r\\n]+");

    private TextNormalizer() {}

    static String normalize(String raw) {
        final String collapsed = XML_WHITESPACE.matcher(raw).replaceAll(" ");
        int start = 0;
        int end = collapsed.length();
        if (start < end && collapsed.charAt(start) == ' ') {
            start++;
        }
        if (start < end && collapsed.charAt(end - 1) == ' ') {
            end--;
        }
        return collapsed.substring(start, end);
    }

    static boolean isBlank(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') {
                return false;
            }
        }
        return true;
    }
}

package io.github.mathml.content;

import io.github.mathml.content.ContentNode.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/// Renders a [ContentNode] tree as an indented outline, one node per line:
///
/// ```
/// Root
///   Apply
///     Op plus
///     Ci
///       Text "x"
/// ```
///
/// This is a debugging view, not MathML.
public final class ContentTreePrinter {

    private static final String INDENT = "  ";

    private ContentTreePrinter() {}

    public static String print(ContentNode node) {
        final var sb = new StringBuilder();
        final Deque<Line> pending = new ArrayDeque<>();
        pending.push(new Line(node, 0));
        while (!pending.isEmpty()) {
            final Line line = pending.pop();
            sb.append(INDENT.repeat(line.level()));
            final List<ContentNode> children = describe(line.node(), sb);
            sb.append('\n');
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Line(children.get(i), line.level() + 1));
            }
        }
        return sb.toString();
    }

    private record Line(ContentNode node, int level) {}

    /// Appends the node's own line and returns the children to print below it.
    private static List<ContentNode> describe(ContentNode node, StringBuilder sb) {
        if (node instanceof Root root) {
            sb.append("Root");
            return root.children();
        } else if (node instanceof Apply apply) {
            sb.append("Apply");
            return apply.children();
        } else if (node instanceof Op op) {
            sb.append("Op ");
            if (op.operator() instanceof Operator.Symbol symbol) {
                sb.append("symbol:").append(symbol.name());
            } else {
                sb.append(op.operator().tag());
            }
        } else if (node instanceof Ci ci) {
            sb.append("Ci");
            if (ci.type() != null) {
                sb.append(" type=").append(ci.type());
            }
            return ci.content();
        } else if (node instanceof Cn cn) {
            sb.append("Cn ").append(cn.type()).append(' ').append(cn.value());
            if (cn.base() != CnNumbers.DEFAULT_BASE) {
                sb.append(" base=").append(cn.base());
            }
            for (final Map.Entry<String, String> attribute : cn.attributes().entrySet()) {
                sb.append(' ').append(attribute.getKey()).append('=').append(attribute.getValue());
            }
            return cn.content();
        } else if (node instanceof Csymbol csymbol) {
            sb.append("Csymbol");
            if (csymbol.definitionUrl() != null) {
                sb.append(" definitionURL=").append(csymbol.definitionUrl());
            }
            return csymbol.content();
        } else if (node instanceof Sep) {
            sb.append("Sep");
        } else if (node instanceof Text text) {
            sb.append("Text \"").append(text.value()).append('"');
        }
        return List.of();
    }
}

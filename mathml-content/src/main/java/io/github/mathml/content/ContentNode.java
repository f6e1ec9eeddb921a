package io.github.mathml.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// AST for MathML Content Markup.
///
/// A translated document is an immutable tree of [ContentNode] records rooted at a
/// single [Root]. Every node exclusively owns its children; lists and maps are
/// copied on construction so a built tree can be shared freely between threads.
///
/// ## Node Types
/// - [Root]: the expressions directly under `<math>`
/// - [Apply]: operator application, first child is the operator
/// - [Op]: a built-in token element or a user-defined symbol
/// - [Ci], [Cn], [Csymbol]: token elements wrapping leaf content
/// - [Sep]: the `<sep/>` separator inside a `<cn>`
/// - [Text]: normalized character data
public sealed interface ContentNode {

    /// The top-level expressions of a `<math>` element in document order.
    record Root(List<ContentNode> children) implements ContentNode {
        public Root {
            Objects.requireNonNull(children, "children must not be null");
            children = List.copyOf(children);
        }

        public static Root of(ContentNode... children) {
            return new Root(List.of(children));
        }
    }

    /// `<apply>`: the first child denotes the operator, the rest are operands.
    /// Arity is not checked here.
    record Apply(List<ContentNode> children) implements ContentNode {
        public Apply {
            Objects.requireNonNull(children, "children must not be null");
            if (children.isEmpty()) {
                throw new IllegalArgumentException("Apply must have at least one child");
            }
            children = List.copyOf(children);
        }

        public static Apply of(ContentNode... children) {
            return new Apply(List.of(children));
        }

        /// The node in operator position.
        public ContentNode operator() {
            return children.get(0);
        }

        /// Everything after the operator.
        public List<ContentNode> operands() {
            return children.subList(1, children.size());
        }
    }

    /// An operator token.
    record Op(Operator operator) implements ContentNode {
        public Op {
            Objects.requireNonNull(operator, "operator must not be null");
        }

        public static Op symbol(String name) {
            return new Op(new Operator.Symbol(name));
        }
    }

    /// `<ci>`: a content identifier.
    ///
    /// @param content leaf content, normally a single [Text]
    /// @param type the MathML `type` attribute (null if absent)
    record Ci(List<ContentNode> content, String type) implements ContentNode {
        public Ci {
            Objects.requireNonNull(content, "content must not be null");
            content = List.copyOf(content);
        }

        public Ci(List<ContentNode> content) {
            this(content, null);
        }

        /// A plain identifier with a single text leaf.
        public static Ci of(String name) {
            return new Ci(List.of(new Text(name)));
        }
    }

    /// `<cn>`: a number literal.
    ///
    /// @param content leaf content: [Text] runs, separated by [Sep] for two-part numbers
    /// @param value the literal interpreted according to its `type` and `base`
    /// @param base the radix of integer and rational parts
    /// @param definitionUrl the `definitionURL` attribute (null if absent)
    /// @param encoding the `encoding` attribute (null if absent)
    /// @param attributes any other attributes, in document order
    record Cn(
        List<ContentNode> content,
        NumberValue value,
        int base,
        String definitionUrl,
        String encoding,
        Map<String, String> attributes
    ) implements ContentNode {
        public Cn {
            Objects.requireNonNull(content, "content must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(attributes, "attributes must not be null");
            content = List.copyOf(content);
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        /// A base-10 literal with no extra attributes.
        public Cn(List<ContentNode> content, NumberValue value) {
            this(content, value, 10, null, null, Map.of());
        }

        /// The MathML `type` name of this literal, e.g. `integer` or `complex-polar`.
        public String type() {
            return value.typeName();
        }
    }

    /// `<csymbol>`: a symbol whose meaning is given by an external definition.
    ///
    /// @param content leaf content naming the symbol
    /// @param definitionUrl the `definitionURL` attribute (null if absent)
    /// @param encoding the `encoding` attribute (null if absent)
    record Csymbol(List<ContentNode> content, String definitionUrl, String encoding) implements ContentNode {
        public Csymbol {
            Objects.requireNonNull(content, "content must not be null");
            content = List.copyOf(content);
        }
    }

    /// `<sep/>` between the parts of a two-part `<cn>`.
    record Sep() implements ContentNode {}

    /// Normalized character data: trimmed, internal whitespace runs collapsed.
    record Text(String value) implements ContentNode {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}

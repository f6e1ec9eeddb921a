package io.github.mathml.content;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Input model consumed by the translator: an already-tokenized XML tree.
///
/// Producing this tree (well-formedness, entity decoding, namespace scoping) is the job
/// of an XML reader such as `io.github.mathml.content.xml.DomXmlReader`. The translator
/// only ever reads it.
public sealed interface XmlNode {

    /// An element with its local name, resolved namespace URI, attributes and children.
    ///
    /// @param name the local tag name, without any prefix
    /// @param namespaceUri the resolved namespace URI, or null when the reader did not resolve one
    /// @param attributes attributes in document order
    /// @param children child elements and text runs in document order
    record Element(String name, String namespaceUri, List<Attribute> attributes, List<XmlNode> children)
            implements XmlNode {
        public Element {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(attributes, "attributes must not be null");
            Objects.requireNonNull(children, "children must not be null");
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
        }

        /// Element without a resolved namespace.
        public Element(String name, List<Attribute> attributes, List<XmlNode> children) {
            this(name, null, attributes, children);
        }

        /// Convenience factory for a namespace-less element without attributes.
        public static Element of(String name, XmlNode... children) {
            return new Element(name, null, List.of(), Arrays.asList(children));
        }

        /// Returns a copy of this element with one more attribute appended.
        public Element withAttribute(String attributeName, String value) {
            final var extended = new ArrayList<>(attributes);
            extended.add(new Attribute(attributeName, value));
            return new Element(name, namespaceUri, extended, children);
        }

        /// Returns the value of the first attribute with the given name.
        /// @return the value or null if absent
        public String attribute(String attributeName) {
            for (final Attribute a : attributes) {
                if (a.name().equals(attributeName)) {
                    return a.value();
                }
            }
            return null;
        }

        /// Child elements only, in document order.
        public List<Element> childElements() {
            final var elements = new ArrayList<Element>();
            for (final XmlNode child : children) {
                if (child instanceof Element e) {
                    elements.add(e);
                }
            }
            return elements;
        }

        /// True if any direct text run contains something other than XML whitespace.
        public boolean hasNonBlankText() {
            for (final XmlNode child : children) {
                if (child instanceof Text t && !TextNormalizer.isBlank(t.value())) {
                    return true;
                }
            }
            return false;
        }
    }

    /// A run of character data.
    record Text(String value) implements XmlNode {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// A name/value attribute pair. The name is the qualified name as written in the document.
    record Attribute(String name, String value) {
        public Attribute {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}

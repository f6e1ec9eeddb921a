package io.github.mathml.content.xml;

import io.github.mathml.content.XmlNode;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads XML text into the [XmlNode] tree consumed by the translator, using the JDK's
/// namespace-aware DOM parser.
///
/// - MathML named entities are rewritten first by [EntitySanitizer].
/// - DOCTYPE declarations and external entities are rejected.
/// - Comments and processing instructions are dropped; CDATA is merged into text.
/// - Element names are local names; namespaces are resolved per element.
///
/// The DOM is converted with an explicit stack, so arbitrarily deep documents reach
/// the translator's depth guard instead of overflowing the call stack here.
public final class DomXmlReader {

    private static final Logger LOG = Logger.getLogger(DomXmlReader.class.getName());

    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    private DomXmlReader() {}

    /// Parses a document held in a string.
    /// @param xml the document text
    /// @return the root element
    /// @throws XmlReadException if the document is not well-formed
    public static XmlNode.Element read(String xml) {
        Objects.requireNonNull(xml, "xml must not be null");
        LOG.fine(() -> "Reading XML document of " + xml.length() + " chars");
        final Document document = parseDom(EntitySanitizer.sanitize(xml));
        return convert(document.getDocumentElement());
    }

    /// Parses a UTF-8 document from a file.
    /// @throws IOException if the file cannot be read
    /// @throws XmlReadException if the document is not well-formed
    public static XmlNode.Element read(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        LOG.fine(() -> "Reading XML file " + file);
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    private static Document parseDom(String xml) {
        final DocumentBuilder builder = newBuilder();
        try {
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new XmlReadException("Malformed XML: " + e.getMessage(), e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw new XmlReadException("Malformed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new XmlReadException("Failed to read XML: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newBuilder() {
        final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(DISALLOW_DOCTYPE, true);
            final DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RethrowingErrorHandler.INSTANCE);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new XmlReadException("XML parser cannot be configured securely: " + e.getMessage(), e);
        }
    }

    /// An element whose children are still being converted.
    private static final class Frame {
        final Element source;
        final List<XmlNode> children = new ArrayList<>();
        Node next;

        Frame(Element source) {
            this.source = source;
            this.next = source.getFirstChild();
        }
    }

    static XmlNode.Element convert(Element root) {
        final Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        XmlNode.Element converted = null;
        while (!stack.isEmpty()) {
            final Frame top = stack.peek();
            final Node node = top.next;
            if (node == null) {
                stack.pop();
                final XmlNode.Element element = toElement(top);
                if (stack.isEmpty()) {
                    converted = element;
                } else {
                    stack.peek().children.add(element);
                }
                continue;
            }
            top.next = node.getNextSibling();
            switch (node.getNodeType()) {
                case Node.ELEMENT_NODE -> stack.push(new Frame((Element) node));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> top.children.add(new XmlNode.Text(node.getNodeValue()));
                default -> LOG.finest(() -> "Skipping DOM node of type " + node.getNodeType());
            }
        }
        return converted;
    }

    private static XmlNode.Element toElement(Frame frame) {
        final Element source = frame.source;
        final String name = source.getLocalName() != null ? source.getLocalName() : source.getNodeName();
        final NamedNodeMap map = source.getAttributes();
        final List<XmlNode.Attribute> attributes = new ArrayList<>(map.getLength());
        for (int i = 0; i < map.getLength(); i++) {
            final Attr attr = (Attr) map.item(i);
            attributes.add(new XmlNode.Attribute(attr.getName(), attr.getValue()));
        }
        return new XmlNode.Element(name, source.getNamespaceURI(), attributes, frame.children);
    }

    /// Turns parser warnings into log lines and errors into exceptions, instead of printing to stderr.
    private enum RethrowingErrorHandler implements ErrorHandler {
        INSTANCE;

        @Override
        public void warning(SAXParseException exception) {
            LOG.warning(() -> "XML warning at line " + exception.getLineNumber() + ": " + exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}

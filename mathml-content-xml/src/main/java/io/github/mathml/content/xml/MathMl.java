package io.github.mathml.content.xml;

import io.github.mathml.content.ContentNode;
import io.github.mathml.content.ContentTranslator;
import io.github.mathml.content.TranslationResult;
import io.github.mathml.content.XmlNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/// Entry point for parsing MathML Content Markup documents from text.
///
/// Usage:
/// ```java
/// TranslationResult<ContentNode.Root> result = MathMl.parse(
///     "<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><apply><plus/><ci>x</ci><ci>y</ci></apply></math>");
/// ContentNode.Root root = result.orElseThrow();
/// ```
///
/// Content Markup problems come back as a failed [TranslationResult]. Text that is not
/// well-formed XML raises [XmlReadException].
public final class MathMl {

    private MathMl() {}

    /// Parses a document with the default translator.
    /// @throws XmlReadException if the text is not well-formed XML
    public static TranslationResult<ContentNode.Root> parse(String xml) {
        return parse(xml, ContentTranslator.withDefaults());
    }

    /// Parses a document with the given translator.
    /// @throws XmlReadException if the text is not well-formed XML
    public static TranslationResult<ContentNode.Root> parse(String xml, ContentTranslator translator) {
        Objects.requireNonNull(translator, "translator must not be null");
        final XmlNode.Element document = DomXmlReader.read(xml);
        return translator.translate(document);
    }

    /// Parses a UTF-8 document file with the default translator.
    /// @throws IOException if the file cannot be read
    /// @throws XmlReadException if the file is not well-formed XML
    public static TranslationResult<ContentNode.Root> parse(Path file) throws IOException {
        return parse(file, ContentTranslator.withDefaults());
    }

    /// Parses a UTF-8 document file with the given translator.
    /// @throws IOException if the file cannot be read
    /// @throws XmlReadException if the file is not well-formed XML
    public static TranslationResult<ContentNode.Root> parse(Path file, ContentTranslator translator) throws IOException {
        Objects.requireNonNull(translator, "translator must not be null");
        final XmlNode.Element document = DomXmlReader.read(file);
        return translator.translate(document);
    }

    /// Parses a bare content expression (for example an `<apply>` without a `<math>` wrapper).
    /// @throws XmlReadException if the text is not well-formed XML
    public static TranslationResult<ContentNode> parseExpression(String xml) {
        return ContentTranslator.withDefaults().translateExpression(DomXmlReader.read(xml));
    }
}

package io.github.mathml.content;

import io.github.mathml.content.ContentNode.*;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based tests for the translator.
/// Generates random well-formed content trees and checks the invariants that hold for all of them.
class ContentTranslatorPropertyTest extends MathMlTestBase {

    private static final List<String> IDENTIFIERS = List.of("x", "y", "alpha", "f", "long name");
    private static final List<String> OPERATORS = Arrays.stream(BuiltinOp.values())
            .filter(op -> op.category() != BuiltinOp.Category.CONSTANT)
            .map(BuiltinOp::tag)
            .toList();
    private static final List<String> PADDING = List.of("", " ", "\n  ", "\t", " \n\t ");

    private final ContentTranslator translator = ContentTranslator.withDefaults();

    private static Arbitrary<XmlNode.Element> expression(int depth) {
        final Arbitrary<XmlNode.Element> leaf = Combinators.combine(
                Arbitraries.of(IDENTIFIERS), Arbitraries.of(PADDING), Arbitraries.of(PADDING))
                .as((name, before, after) -> el("ci", text(before + name + after)));
        if (depth <= 0) {
            return leaf;
        }
        final Arbitrary<XmlNode.Element> applied = Combinators.combine(
                Arbitraries.of(OPERATORS), expression(depth - 1).list().ofMinSize(0).ofMaxSize(3))
                .as((op, operands) -> {
                    final List<XmlNode> children = new ArrayList<>();
                    children.add(el(op));
                    children.addAll(operands);
                    return new XmlNode.Element("apply", List.of(), children);
                });
        return Arbitraries.oneOf(leaf, applied);
    }

    @Provide
    Arbitrary<XmlNode.Element> documents() {
        return expression(4).list().ofMinSize(1).ofMaxSize(3)
                .map(children -> math(children.toArray(new XmlNode[0])));
    }

    @Property(generation = GenerationMode.AUTO)
    void translationSucceedsAndIsDeterministic(@ForAll("documents") XmlNode.Element document) {
        final var first = translator.translate(document);
        final var second = translator.translate(document);

        assertThat(first.isSuccess()).isTrue();
        assertThat(first).isEqualTo(second);
        assertThat(first.node().children()).hasSize(document.childElements().size());
    }

    @Property(generation = GenerationMode.AUTO)
    void missingNamespaceAlwaysFails(@ForAll("documents") XmlNode.Element document) {
        final var bare = new XmlNode.Element("math", null, List.of(), document.children());

        assertThat(translator.translate(bare).error()).isEqualTo(new ParseError.NamespaceError(null));
    }

    @Property(generation = GenerationMode.AUTO)
    void leafTextIsNormalized(@ForAll("documents") XmlNode.Element document) {
        final Root root = translator.translate(document).node();
        root.children().forEach(ContentTranslatorPropertyTest::assertNormalized);
    }

    @Property(generation = GenerationMode.AUTO)
    void emptyApplyFailsAnywhere(@ForAll("documents") XmlNode.Element document) {
        final List<XmlNode> children = new ArrayList<>(document.children());
        children.add(el("apply"));
        final var broken = new XmlNode.Element("math", ContentTranslator.MATHML_NAMESPACE, List.of(), children);

        assertThat(translator.translate(broken).error()).isInstanceOf(ParseError.StructureError.class);
    }

    private static void assertNormalized(ContentNode node) {
        if (node instanceof Text t) {
            assertThat(t.value()).isNotEmpty().doesNotStartWith(" ").doesNotEndWith(" ").doesNotContain("  ", "\n", "\t");
        } else if (node instanceof Apply apply) {
            apply.children().forEach(ContentTranslatorPropertyTest::assertNormalized);
        } else if (node instanceof Ci ci) {
            assertThat(ci.content()).hasSize(1);
            ci.content().forEach(ContentTranslatorPropertyTest::assertNormalized);
        }
    }
}

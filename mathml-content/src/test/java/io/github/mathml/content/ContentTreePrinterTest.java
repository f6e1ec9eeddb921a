package io.github.mathml.content;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTreePrinterTest extends MathMlTestBase {

    @Test
    void testPrintsIndentedOutline() {
        final var root = ContentTranslator.withDefaults().translateOrThrow(math(
                el("apply", el("myop"), ci("x"), cn("rational", text("1"), el("sep"), text("2")))));

        assertThat(ContentTreePrinter.print(root)).isEqualTo("""
                Root
                  Apply
                    Op symbol:myop
                    Ci
                      Text "x"
                    Cn rational Rational[numerator=1, denominator=2]
                      Text "1"
                      Sep
                      Text "2"
                """);
    }

    @Test
    void testPrintsAttributes() {
        final var root = ContentTranslator.withDefaults().translateOrThrow(math(
                el("apply",
                        el("csymbol", text("delay")).withAttribute("definitionURL", "urn:delay"),
                        ci("v").withAttribute("type", "vector"),
                        cn("integer", text("ff")).withAttribute("base", "16"))));

        assertThat(ContentTreePrinter.print(root)).isEqualTo("""
                Root
                  Apply
                    Csymbol definitionURL=urn:delay
                      Text "delay"
                    Ci type=vector
                      Text "v"
                    Cn integer IntegerValue[value=255] base=16
                      Text "ff"
                """);
    }

    @Test
    void testPrintsDeepTree() {
        final var root = new ContentTranslator(new TranslatorOptions(10_000))
                .translateOrThrow(math(nestedApplies(2_000)));

        final String[] lines = ContentTreePrinter.print(root).split("\n");

        assertThat(lines).hasSize(4_005);
        assertThat(lines[0]).isEqualTo("Root");
        assertThat(lines[lines.length - 1]).isEqualTo("  ".repeat(2_002) + "Text \"y\"");
    }
}

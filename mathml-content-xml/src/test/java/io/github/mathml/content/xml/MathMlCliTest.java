package io.github.mathml.content.xml;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MathMlCliTest extends MathMlXmlTestBase {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        return MathMlCli.run(args, new PrintWriter(out), new PrintWriter(err));
    }

    @Test
    void testNoArgumentsIsUsageError() {
        assertThat(run()).isEqualTo(2);
        assertThat(err.toString()).contains(MathMlCli.USAGE);
    }

    @Test
    void testUnknownOptionIsUsageError() {
        assertThat(run("--verbose", "a.mml")).isEqualTo(2);
        assertThat(err.toString()).contains("Unknown option: --verbose");
    }

    @Test
    void testBadMaxDepthIsUsageError() {
        assertThat(run("--max-depth", "zero", "a.mml")).isEqualTo(2);
        assertThat(run("--max-depth", "0", "a.mml")).isEqualTo(2);
        assertThat(run("--max-depth")).isEqualTo(2);
    }

    @Test
    void testInvalidFileNameIsUsageError() {
        assertThat(run("bad\u0000name.mml")).isEqualTo(2);
        assertThat(err.toString()).contains("Invalid file name").contains(MathMlCli.USAGE);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testPrintsOutlineForValidFile() {
        final Path file = resource("simple.mml");

        assertThat(run(file.toString())).isEqualTo(0);
        assertThat(out.toString()).contains("== " + file)
                .contains("Root")
                .contains("Op plus")
                .contains("Text \"x\"");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testReportsParseErrorWithPath() {
        final Path file = resource("unknown-element.mml");

        assertThat(run(file.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown element <mi> at /math/apply[1]/mi[3]");
    }

    @Test
    void testMixedFilesReportEachAndFail() {
        final Path good = resource("numbers.mml");
        final Path bad = resource("unknown-element.mml");

        assertThat(run(good.toString(), bad.toString())).isEqualTo(1);
        assertThat(out.toString()).contains("== " + good);
        assertThat(err.toString()).contains(bad.toString());
    }

    @Test
    void testMissingFileFails(@TempDir Path dir) {
        final Path missing = dir.resolve("missing.mml");

        assertThat(run(missing.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("cannot read");
    }

    @Test
    void testMalformedFileFails(@TempDir Path dir) throws IOException {
        final Path broken = dir.resolve("broken.mml");
        Files.writeString(broken, "<math><ci>x</math>", StandardCharsets.UTF_8);

        assertThat(run(broken.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Malformed XML");
    }

    @Test
    void testMaxDepthOption(@TempDir Path dir) throws IOException {
        final Path nested = dir.resolve("nested.mml");
        Files.writeString(nested, "<math xmlns=\"http://www.w3.org/1998/Math/MathML\">"
                + "<apply><minus/><apply><minus/><ci>x</ci></apply></apply></math>", StandardCharsets.UTF_8);

        assertThat(run("--max-depth", "3", nested.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("maximum depth of 3");
        assertThat(run("--max-depth", "8", nested.toString())).isEqualTo(0);
    }
}

package io.github.mathml.content.xml;

import io.github.mathml.content.ContentNode;
import io.github.mathml.content.ContentTranslator;
import io.github.mathml.content.ContentTreePrinter;
import io.github.mathml.content.TranslationResult;
import io.github.mathml.content.TranslatorOptions;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// CLI entry point: parses MathML Content Markup files and prints their AST outline.
///
/// Usage:
/// `java -jar mathml-content-xml.jar [--max-depth N] file.mml...`
///
/// Exit codes: 0 when every file parsed, 1 when any file failed to read or translate,
/// 2 on bad arguments.
public final class MathMlCli {

    private static final Logger LOG = Logger.getLogger(MathMlCli.class.getName());

    static final String USAGE = "Usage: java -jar mathml-content-xml.jar [--max-depth N] <file.mml>...";

    private MathMlCli() {}

    public static void main(String[] args) {
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        System.exit(run(args, out, err));
    }

    static int run(String[] args, PrintWriter out, PrintWriter err) {
        if (args == null || args.length == 0) {
            err.println(USAGE);
            return 2;
        }

        TranslatorOptions options = TranslatorOptions.DEFAULT;
        final List<Path> files = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if (arg.equals("--max-depth")) {
                if (i + 1 >= args.length) {
                    err.println("--max-depth needs a value");
                    err.println(USAGE);
                    return 2;
                }
                try {
                    options = options.withMaxDepth(Integer.parseInt(args[++i]));
                } catch (IllegalArgumentException e) {
                    err.println("Invalid --max-depth: " + args[i]);
                    return 2;
                }
            } else if (arg.startsWith("--")) {
                err.println("Unknown option: " + arg);
                err.println(USAGE);
                return 2;
            } else {
                try {
                    files.add(Path.of(arg));
                } catch (InvalidPathException e) {
                    err.println("Invalid file name: " + e.getMessage());
                    err.println(USAGE);
                    return 2;
                }
            }
        }
        if (files.isEmpty()) {
            err.println(USAGE);
            return 2;
        }

        final var translator = new ContentTranslator(options);
        int status = 0;
        for (final Path file : files) {
            if (!parseOne(file, translator, out, err)) {
                status = 1;
            }
        }
        out.flush();
        err.flush();
        return status;
    }

    private static boolean parseOne(Path file, ContentTranslator translator, PrintWriter out, PrintWriter err) {
        LOG.fine(() -> "Parsing " + file);
        final TranslationResult<ContentNode.Root> result;
        try {
            result = MathMl.parse(file, translator);
        } catch (IOException e) {
            err.println(file + ": cannot read: " + e.getMessage());
            return false;
        } catch (XmlReadException e) {
            err.println(file + ": " + e.getMessage());
            return false;
        }
        if (!result.isSuccess()) {
            err.println(file + ": " + result.error().message());
            return false;
        }
        out.println("== " + file);
        out.print(ContentTreePrinter.print(result.node()));
        return true;
    }
}

package org.texparse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonParseException;

import org.texparse.latex.parser.LatexContext;
import org.texparse.latex.parser.LatexParser;
import org.texparse.latex.parser.LoggingDiagnostics;
import org.texparse.latex.syntax.SyntaxCatalog;
import org.texparse.latex.syntax.SyntaxPackageReader;
import org.texparse.latex.tree.LatexToken;
import org.texparse.syntax.SyntaxTree;

class App {

    // ==========================================================
    // MAIN PIPELINE
    // ==========================================================

    public static void main(String[] args) {
        try {
            // 1. Arguments and input
            Options options = parseOptions(args);
            if (options == null) return;
            String source = readSource(options);
            if (source == null) return;

            // 2. Syntax packages
            SyntaxCatalog catalog = loadSyntax(options);
            if (catalog == null) return;

            // 3. Parsing
            var diagnostics = new CountingDiagnostics();
            SyntaxTree<LatexToken> tree = new LatexParser(catalog, diagnostics).parseTree(source);

            // 4. Output
            System.out.println(new TreePrinter(source).print(tree.root()));
            System.out.println("Normalized source:");
            System.out.println(tree.root().toSource());
            if (options.json) {
                System.out.println(TreeJson.toJson(tree.root()));
            }
            System.out.println("\nDiagnostics: " + diagnostics.count);

        } catch (IOException e) {
            System.err.println("Critical I/O Error: " + e.getMessage());
        }
    }

    // ==========================================================
    // STAGE 1: INPUT HANDLING
    // ==========================================================

    private record Options(Path file, List<Path> packages, boolean json) {}

    private static Options parseOptions(String[] args) {
        Path file = null;
        var packages = new ArrayList<Path>();
        boolean json = false;
        for (String arg : args) {
            if (arg.startsWith("--package=")) {
                packages.add(Paths.get(arg.substring("--package=".length())));
            } else if (arg.equals("--json")) {
                json = true;
            } else if (arg.startsWith("--")) {
                System.err.println("Unknown option: " + arg);
                System.err.println("Usage: App [file] [--package=path.json]... [--json]");
                return null;
            } else {
                file = Paths.get(arg);
            }
        }
        return new Options(file, packages, json);
    }

    private static String readSource(Options options) throws IOException {
        if (options.file == null) {
            // Default document for trying things out
            return """
                \\documentclass{article}
                % sample
                \\begin{document}
                \\section{Intro}
                Some \\textbf{bold} text with $x^2 + y_1$ and a \\label{sec:intro}.

                \\begin{itemize}
                  \\item First
                  \\item[2.] Second
                \\end{itemize}
                \\end{document}
                """;
        }
        if (!Files.exists(options.file)) {
            System.err.println("Cannot find file: " + options.file);
            System.err.println("Current dir: " + System.getProperty("user.dir"));
            return null;
        }
        return Files.readString(options.file, StandardCharsets.UTF_8);
    }

    // ==========================================================
    // STAGE 2: SYNTAX
    // ==========================================================

    private static SyntaxCatalog loadSyntax(Options options) throws IOException {
        var reader = new SyntaxPackageReader();
        var catalog = new SyntaxCatalog();
        try {
            catalog.load("base", reader.readBase());
            for (Path path : options.packages) {
                catalog.load(path.getFileName().toString(), reader.read(path));
            }
        } catch (JsonParseException e) {
            System.err.println("Invalid syntax package");
            System.err.println(e.getMessage());
            return null;
        }
        return catalog;
    }

    // ==========================================================
    // STAGE 3: DIAGNOSTICS
    // ==========================================================

    private static class CountingDiagnostics extends LoggingDiagnostics {
        int count = 0;

        @Override
        protected void report(LatexContext context, String problem, String... arguments) {
            count++;
            super.report(context, problem, arguments);
        }
    }
}

package org.pragmatica.flowchart.cli;

import org.pragmatica.flowchart.AnalyzerConfig;
import org.pragmatica.flowchart.CppFlowchart;
import org.pragmatica.flowchart.generator.DiagramNotation;
import org.pragmatica.flowchart.tree.TreePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point.
 *
 * <p>Exit codes: 0 on success, 1 when the analysis reported errors or the file could not be
 * read, 2 on usage errors.
 */
public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "Usage: cpp-flowchart <file> [--format dot|mermaid] [--name N] [--tree]";

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path input = null;
        var notation = DiagramNotation.DOT;
        String name = null;
        var printTree = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--format" -> {
                    if (i + 1 >= args.length) {
                        return usage(err, "missing value for --format");
                    }
                    var value = args[++i];
                    var parsed = DiagramNotation.fromName(value);
                    if (parsed.isEmpty()) {
                        return usage(err, "unknown format '" + value + "'");
                    }
                    notation = parsed.get();
                }
                case "--name" -> {
                    if (i + 1 >= args.length) {
                        return usage(err, "missing value for --name");
                    }
                    name = args[++i];
                }
                case "--tree" -> printTree = true;
                default -> {
                    if (args[i].startsWith("--") || input != null) {
                        return usage(err, "unexpected argument '" + args[i] + "'");
                    }
                    input = Path.of(args[i]);
                }
            }
        }
        if (input == null) {
            return usage(err, "missing input file");
        }

        String source;
        try {
            source = Files.readString(input);
        } catch (IOException e) {
            LOG.debug("Failed to read {}", input, e);
            err.println("error: cannot read " + input + ": " + e.getMessage());
            return 1;
        }

        var diagramName = name != null ? name : baseName(input);
        var config = AnalyzerConfig.DEFAULT.withNotation(notation);
        var result = CppFlowchart.analyze(source, config);

        if (printTree) {
            result.program().ifPresent(program -> out.print(TreePrinter.print(program)));
        }
        if (!result.diagnostics().isEmpty()) {
            err.print(result.formatDiagnostics(input.getFileName().toString()));
            err.println(result.errorCount() + " error(s), " + result.warningCount() + " warning(s)");
        }
        CppFlowchart.flowchart(result, diagramName, config)
                    .map(graph -> config.notation().renderer().render(graph))
                    .ifPresent(out::print);

        return result.hasErrors() ? 1 : 0;
    }

    private static int usage(PrintStream err, String problem) {
        err.println("error: " + problem);
        err.println(USAGE);
        return 2;
    }

    private static String baseName(Path input) {
        var fileName = input.getFileName().toString();
        var dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}

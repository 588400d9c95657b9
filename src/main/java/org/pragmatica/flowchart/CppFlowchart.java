package org.pragmatica.flowchart;

import org.pragmatica.flowchart.generator.DiagramNotation;
import org.pragmatica.flowchart.generator.FlowGraph;
import org.pragmatica.flowchart.generator.FlowchartSynthesizer;
import org.pragmatica.flowchart.lexer.Lexer;
import org.pragmatica.flowchart.parser.CppParser;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for analyzing C++ subset sources and drawing their flowcharts.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = CppFlowchart.analyze("""
 *     int main() {
 *         int x = 0;
 *         while (x < 10) { x = x + 1; }
 *         return x;
 *     }
 *     """);
 *
 * var dot = CppFlowchart.render(result, "main", DiagramNotation.DOT);
 * }</pre>
 */
public final class CppFlowchart {
    private CppFlowchart() {}

    /**
     * Scan and parse source text with the default configuration.
     */
    public static AnalysisResult analyze(String source) {
        return analyze(source, AnalyzerConfig.DEFAULT);
    }

    /**
     * Scan and parse source text.
     */
    public static AnalysisResult analyze(String source, AnalyzerConfig config) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(config, "config");
        var lexed = Lexer.scan(source, config.lexer());
        var parsed = CppParser.parse(lexed.tokens());
        return new AnalysisResult(source,
                                  lexed.tokens(),
                                  lexed.diagnostics(),
                                  parsed.diagnostics(),
                                  parsed.program(),
                                  parsed.scopes());
    }

    /**
     * Build the flowchart graph of an analyzed program, or empty when there is no tree.
     */
    public static Optional<FlowGraph> flowchart(AnalysisResult result, String name) {
        return flowchart(result, name, AnalyzerConfig.DEFAULT);
    }

    public static Optional<FlowGraph> flowchart(AnalysisResult result, String name, AnalyzerConfig config) {
        var synthesizer = FlowchartSynthesizer.create(config.flowchart());
        return result.program()
                     .map(program -> synthesizer.synthesize(program, name));
    }

    /**
     * Render the flowchart of an analyzed program in the given notation.
     */
    public static Optional<String> render(AnalysisResult result, String name, DiagramNotation notation) {
        return flowchart(result, name).map(graph -> notation.renderer().render(graph));
    }

    /**
     * Analyze source text and render its flowchart in one step.
     */
    public static Optional<String> flowchartOf(String source, String name, AnalyzerConfig config) {
        var result = analyze(source, config);
        return flowchart(result, name, config).map(graph -> config.notation().renderer().render(graph));
    }
}

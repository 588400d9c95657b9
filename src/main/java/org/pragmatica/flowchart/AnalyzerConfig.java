package org.pragmatica.flowchart;

import org.pragmatica.flowchart.generator.DiagramNotation;
import org.pragmatica.flowchart.generator.FlowchartConfig;
import org.pragmatica.flowchart.lexer.LexerConfig;

/**
 * Analyzer configuration options.
 */
public record AnalyzerConfig(
    LexerConfig lexer,
    FlowchartConfig flowchart,
    DiagramNotation notation
) {
    public static final AnalyzerConfig DEFAULT = new AnalyzerConfig(
        LexerConfig.DEFAULT,
        FlowchartConfig.DEFAULT,
        DiagramNotation.DOT
    );

    public AnalyzerConfig withNotation(DiagramNotation notation) {
        return new AnalyzerConfig(lexer, flowchart, notation);
    }

    public AnalyzerConfig withLexer(LexerConfig lexer) {
        return new AnalyzerConfig(lexer, flowchart, notation);
    }
}

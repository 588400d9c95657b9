package org.pragmatica.flowchart;

import org.junit.jupiter.api.Test;
import org.pragmatica.flowchart.generator.DiagramNotation;
import org.pragmatica.flowchart.generator.NodeShape;
import org.pragmatica.flowchart.lexer.LexerConfig;

import static org.assertj.core.api.Assertions.assertThat;

class CppFlowchartTest {

    private static final String PROGRAM = """
        #include <iostream>
        using namespace std;

        int main() {
            int n = 0;
            cin >> n;
            int sum = 0;
            for (int i = 1; i <= n; i++) {
                if (i % 2 == 0) {
                    sum = sum + i;
                }
            }
            cout << sum << endl;
            return 0;
        }
        """;

    @Test
    void analyze_wellFormedProgram_isClean() {
        var result = CppFlowchart.analyze(PROGRAM);

        assertThat(result.isClean()).isTrue();
        assertThat(result.program()).isPresent();
        assertThat(result.tokens()).last().satisfies(token -> assertThat(token.lexeme()).isEmpty());
        assertThat(result.scopes().lookup("main")).isPresent();
    }

    @Test
    void analyze_keepsDiagnosticChannelsSeparate() {
        var result = CppFlowchart.analyze("int x = 1 @;\nstring s = \"open",
                                          AnalyzerConfig.DEFAULT.withLexer(LexerConfig.STRICT));

        assertThat(result.lexicalDiagnostics())
            .extracting(d -> d.message())
            .containsExactly("unexpected character '@'", "unterminated string literal");
        assertThat(result.syntaxDiagnostics()).isNotEmpty();
        assertThat(result.diagnostics()).hasSize(result.lexicalDiagnostics().size() + result.syntaxDiagnostics().size());
        assertThat(result.hasErrors()).isTrue();
    }

    @Test
    void flowchart_ofProgram_containsExpectedShapes() {
        var graph = CppFlowchart.flowchart(CppFlowchart.analyze(PROGRAM), "main").orElseThrow();

        assertThat(graph.nodesOf(NodeShape.CALL)).hasSize(1);
        assertThat(graph.nodesOf(NodeShape.DECISION)).hasSize(2);
        assertThat(graph.nodesOf(NodeShape.LOOP_PREP)).hasSize(2);
        assertThat(graph.nodesOf(NodeShape.IO)).extracting(node -> node.label())
                                               .containsExactly("cin >> n", "cout << sum << endl");
    }

    @Test
    void render_producesBothNotations() {
        var result = CppFlowchart.analyze(PROGRAM);

        assertThat(CppFlowchart.render(result, "main", DiagramNotation.DOT))
            .hasValueSatisfying(text -> assertThat(text).startsWith("digraph \"main\""));
        assertThat(CppFlowchart.render(result, "main", DiagramNotation.MERMAID))
            .hasValueSatisfying(text -> assertThat(text).contains("flowchart TD"));
    }

    @Test
    void flowchartOf_usesConfiguredNotation() {
        var text = CppFlowchart.flowchartOf("int x = 1;", "tiny",
                                            AnalyzerConfig.DEFAULT.withNotation(DiagramNotation.MERMAID));

        assertThat(text).hasValueSatisfying(diagram -> assertThat(diagram).contains("n1[\"int x = 1\"]"));
    }
}

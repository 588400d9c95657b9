package org.pragmatica.flowchart;

import org.pragmatica.flowchart.error.Diagnostic;
import org.pragmatica.flowchart.lexer.Token;
import org.pragmatica.flowchart.scope.ScopeManager;
import org.pragmatica.flowchart.tree.AstNode.Program;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Result of analyzing one source text.
 *
 * <p>Lexical and syntax diagnostics are kept in separate channels, each in report order. The
 * program is absent only when the parser aborted on an internal fault.
 *
 * @param source             The original source text (for formatting diagnostics)
 * @param tokens             Token stream, ending with EOF
 * @param lexicalDiagnostics Diagnostics reported by the lexer
 * @param syntaxDiagnostics  Diagnostics reported by the parser and the symbol table
 * @param program            The parsed tree, or empty if parsing was aborted
 * @param scopes             Symbol table after the parse
 */
public record AnalysisResult(
    String source,
    List<Token> tokens,
    List<Diagnostic> lexicalDiagnostics,
    List<Diagnostic> syntaxDiagnostics,
    Optional<Program> program,
    ScopeManager scopes
) {
    public AnalysisResult {
        tokens = List.copyOf(tokens);
        lexicalDiagnostics = List.copyOf(lexicalDiagnostics);
        syntaxDiagnostics = List.copyOf(syntaxDiagnostics);
    }

    /**
     * Check if analysis produced a tree and no diagnostics at all.
     */
    public boolean isClean() {
        return program.isPresent() && lexicalDiagnostics.isEmpty() && syntaxDiagnostics.isEmpty();
    }

    /**
     * Check if any diagnostic is an error. Warnings do not count.
     */
    public boolean hasErrors() {
        return errorCount() > 0;
    }

    /**
     * All diagnostics, lexical first.
     */
    public List<Diagnostic> diagnostics() {
        return Stream.concat(lexicalDiagnostics.stream(), syntaxDiagnostics.stream()).toList();
    }

    public int errorCount() {
        return (int) diagnostics().stream()
                                  .filter(Diagnostic::isError)
                                  .count();
    }

    public int warningCount() {
        return (int) diagnostics().stream()
                                  .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                                  .count();
    }

    /**
     * Format all diagnostics with a source excerpt.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String filename) {
        var sb = new StringBuilder();
        for (var diag : diagnostics()) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }
}

package org.pragmatica.flowchart.lexer;

import org.pragmatica.flowchart.error.Diagnostic;

import java.util.List;

/**
 * Token stream together with the lexical diagnostics collected while scanning.
 *
 * @param tokens      tokens in source order, always terminated by exactly one EOF token
 * @param diagnostics lexical diagnostics in report order
 */
public record LexResult(List<Token> tokens, List<Diagnostic> diagnostics) {
    public LexResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}

package org.pragmatica.flowchart.parser;

import org.pragmatica.flowchart.error.Diagnostic;
import org.pragmatica.flowchart.scope.ScopeManager;
import org.pragmatica.flowchart.tree.AstNode.Program;

import java.util.List;
import java.util.Optional;

/**
 * Result of a parse: the tree (absent after an internal fault), the accumulated diagnostics
 * in report order, and the symbol table as it stands at the end of the parse.
 *
 * @param program     parsed tree, empty when the parse was aborted
 * @param diagnostics syntax and semantic diagnostics
 * @param scopes      scope manager; only the global scope remains on its stack
 */
public record ParseOutcome(Optional<Program> program, List<Diagnostic> diagnostics, ScopeManager scopes) {
    public ParseOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    public static ParseOutcome parsed(Program program, List<Diagnostic> diagnostics, ScopeManager scopes) {
        return new ParseOutcome(Optional.of(program), diagnostics, scopes);
    }

    public static ParseOutcome aborted(List<Diagnostic> diagnostics, ScopeManager scopes) {
        return new ParseOutcome(Optional.empty(), diagnostics, scopes);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}

package org.pragmatica.flowchart.parser;

import org.pragmatica.flowchart.error.Diagnostic;
import org.pragmatica.flowchart.error.DiagnosticSink;
import org.pragmatica.flowchart.lexer.Token;
import org.pragmatica.flowchart.lexer.TokenKind;
import org.pragmatica.flowchart.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable parser state: token cursor, recovery flag and accumulated diagnostics.
 *
 * <p>One instance belongs to exactly one parse.
 */
public final class ParserState implements DiagnosticSink {
    private static final Token END = Token.eof(-1, -1);

    private final List<Token> tokens;
    private final List<Diagnostic> diagnostics;
    private int pos;

    // Error recovery state
    private boolean inRecovery;

    private ParserState(List<Token> tokens) {
        this.tokens = tokens;
        this.diagnostics = new ArrayList<>();
        this.pos = 0;
        this.inRecovery = false;
    }

    public static ParserState create(List<Token> tokens) {
        return new ParserState(List.copyOf(tokens));
    }

    // === Token Access ===

    public Token peek() {
        return peek(0);
    }

    private Token peek(int offset) {
        int index = pos + offset;
        return index < tokens.size()
               ? tokens.get(index)
               : END;
    }

    public boolean isAtEnd() {
        return peek().is(TokenKind.EOF);
    }

    public boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    public boolean checkKeyword(String word) {
        return peek().isKeyword(word);
    }

    public boolean checkOperator(String op) {
        return peek().isOperator(op);
    }

    /**
     * Consume the current token. Consuming a token moves past the last failure point, so the
     * next error is reported again. At end of input the EOF token is returned and the cursor
     * stays.
     */
    public Token advance() {
        var token = skip();
        if (!token.is(TokenKind.EOF)) {
            inRecovery = false;
        }
        return token;
    }

    /**
     * Step over the current token while resynchronizing. Recovery mode is kept.
     */
    public Token skip() {
        var token = peek();
        if (pos < tokens.size() && !token.is(TokenKind.EOF)) {
            pos++;
        }
        return token;
    }

    public SourceLocation location() {
        return peek().location();
    }

    /**
     * Consume a token of the given kind, or report {@code message} once per failure point and
     * leave the cursor where it is.
     *
     * @return true when the expected token was consumed
     */
    public boolean expect(TokenKind kind, String message) {
        if (check(kind)) {
            advance();
            return true;
        }
        errorOnce(location(), message);
        return false;
    }

    /**
     * Report an error unless one was already reported for the current failure point.
     */
    public void errorOnce(SourceLocation location, String message) {
        if (!inRecovery) {
            inRecovery = true;
            error(location, message);
        }
    }

    // === Resynchronization ===

    /**
     * Skip to the end of the current statement: past the next semicolon, or up to (not past) a
     * closing brace or parenthesis.
     */
    public void skipToStatementEnd() {
        while (!isAtEnd()
               && !check(TokenKind.SEMICOLON)
               && !check(TokenKind.RBRACE)
               && !check(TokenKind.RPAREN)) {
            skip();
        }
        if (check(TokenKind.SEMICOLON)) {
            skip();
        }
    }

    /**
     * Skip up to (not past) one of the targets or a brace.
     */
    public void skipTo(TokenKind first, TokenKind second) {
        while (!isAtEnd()
               && !check(first)
               && !check(second)
               && !check(TokenKind.LBRACE)
               && !check(TokenKind.RBRACE)) {
            skip();
        }
    }

    // === Diagnostic Collection ===

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void error(SourceLocation location, String message) {
        report(Diagnostic.syntax(location, message));
    }

    public void warning(SourceLocation location, String message) {
        report(Diagnostic.warning(Diagnostic.Phase.SYNTAX, location, message));
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    // === Error Recovery State ===

    /**
     * Exit recovery mode after a statement was parsed.
     */
    public void exitRecovery() {
        inRecovery = false;
    }
}

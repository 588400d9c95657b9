package org.pragmatica.flowchart.lexer;

import org.pragmatica.flowchart.tree.SourceLocation;

/**
 * A classified, positioned lexeme.
 */
public record Token(TokenKind kind, String lexeme, int line, int column) {

    public static Token eof(int line, int column) {
        return new Token(TokenKind.EOF, "", line, column);
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column);
    }

    public boolean is(TokenKind kind) {
        return this.kind == kind;
    }

    public boolean is(TokenKind kind, String lexeme) {
        return this.kind == kind && this.lexeme.equals(lexeme);
    }

    public boolean isKeyword(String word) {
        return is(TokenKind.KEYWORD, word);
    }

    public boolean isOperator(String op) {
        return is(TokenKind.OPERATOR, op);
    }

    @Override
    public String toString() {
        return kind + "('" + lexeme + "') at " + line + ":" + column;
    }
}

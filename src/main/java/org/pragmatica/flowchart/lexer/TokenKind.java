package org.pragmatica.flowchart.lexer;

/**
 * Token categories produced by the {@link Lexer}.
 */
public enum TokenKind {
    // Identifiers and literals
    IDENTIFIER,
    NUMBER,
    STRING_LITERAL,
    CHAR_LITERAL,
    BOOL_LITERAL,
    KEYWORD,

    // Operators
    OPERATOR,
    ARROW,
    DOUBLE_COLON,

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COMMA,
    DOT,
    COLON,

    // Special
    PREPROCESSOR,
    EOF,
    UNKNOWN
}

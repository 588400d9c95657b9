package org.pragmatica.flowchart.lexer;

/**
 * Lexer configuration options.
 *
 * @param reportUnknownCharacters report a diagnostic for every character the lexer cannot
 *                                classify; such characters are dropped from the token stream
 *                                either way
 */
public record LexerConfig(boolean reportUnknownCharacters) {
    public static final LexerConfig DEFAULT = new LexerConfig(false);

    public static final LexerConfig STRICT = new LexerConfig(true);
}

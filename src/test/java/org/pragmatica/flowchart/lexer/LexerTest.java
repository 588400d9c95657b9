package org.pragmatica.flowchart.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<Token> tokens(String source) {
        return Lexer.scan(source).tokens();
    }

    private static List<TokenKind> kinds(String source) {
        return tokens(source).stream().map(Token::kind).toList();
    }

    @Test
    void scan_emptySource_returnsOnlyEof() {
        var result = Lexer.scan("");

        assertEquals(1, result.tokens().size());
        assertTrue(result.tokens().get(0).is(TokenKind.EOF));
        assertFalse(result.hasErrors());
    }

    @ParameterizedTest
    @ValueSource(strings = {"int x = 5;", "\"unterminated", "'", "/* open comment", "@@@ $", "#include <x>", "a\n\n\tb"})
    void scan_anyInput_endsWithExactlyOneEof(String source) {
        var tokens = tokens(source);

        assertTrue(tokens.get(tokens.size() - 1).is(TokenKind.EOF));
        assertEquals(1, tokens.stream().filter(t -> t.is(TokenKind.EOF)).count());
    }

    @Test
    void scan_declaration_classifiesTokens() {
        assertEquals(List.of(TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.OPERATOR,
                             TokenKind.NUMBER, TokenKind.SEMICOLON, TokenKind.EOF),
                     kinds("int x = 5;"));
    }

    @Test
    void scan_trueAndFalse_areBoolLiterals() {
        var tokens = tokens("true false truth");

        assertEquals(TokenKind.BOOL_LITERAL, tokens.get(0).kind());
        assertEquals(TokenKind.BOOL_LITERAL, tokens.get(1).kind());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
    }

    @Test
    void scan_numbers_keepPrefixesFractionsAndSuffixes() {
        var tokens = tokens("0x1F 0b101 3.14f 10UL 7.");

        assertEquals("0x1F", tokens.get(0).lexeme());
        assertEquals("0b101", tokens.get(1).lexeme());
        assertEquals("3.14f", tokens.get(2).lexeme());
        assertEquals("10UL", tokens.get(3).lexeme());
        assertEquals("7", tokens.get(4).lexeme());
        assertEquals(TokenKind.DOT, tokens.get(5).kind());
    }

    @Test
    void scan_stringLiteral_keepsDelimitersAndEscapes() {
        var token = tokens("\"a\\\"b\\n\"").get(0);

        assertEquals(TokenKind.STRING_LITERAL, token.kind());
        assertEquals("\"a\\\"b\\n\"", token.lexeme());
    }

    @Test
    void scan_charLiteral_keepsEscape() {
        var token = tokens("'\\n'").get(0);

        assertEquals(TokenKind.CHAR_LITERAL, token.kind());
        assertEquals("'\\n'", token.lexeme());
    }

    @Test
    void scan_unterminatedString_reportsOnceAndReturnsPartialToken() {
        var result = Lexer.scan("x = \"abc");

        assertEquals(1, result.diagnostics().size());
        assertEquals("unterminated string literal", result.diagnostics().get(0).message());
        var literal = result.tokens().get(2);
        assertEquals(TokenKind.STRING_LITERAL, literal.kind());
        assertEquals("\"abc", literal.lexeme());
    }

    @Test
    void scan_unterminatedChar_reportsOnce() {
        var result = Lexer.scan("'ab");

        assertEquals(1, result.diagnostics().size());
        assertEquals("unterminated character literal", result.diagnostics().get(0).message());
    }

    @Test
    void scan_comments_areDiscarded() {
        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.EOF),
                     kinds("a // line comment\n/* block\ncomment */ b"));
    }

    @Test
    void scan_preprocessorLine_isOneToken() {
        var tokens = tokens("#include <iostream>\nint x;");

        assertEquals(TokenKind.PREPROCESSOR, tokens.get(0).kind());
        assertEquals("#include <iostream>", tokens.get(0).lexeme());
        assertEquals(TokenKind.KEYWORD, tokens.get(1).kind());
        assertEquals(2, tokens.get(1).line());
    }

    @Test
    void scan_multiCharacterOperators_matchGreedily() {
        var tokens = tokens("a<<=b->c::d");

        assertEquals("<<", tokens.get(1).lexeme());
        assertEquals("=", tokens.get(2).lexeme());
        assertEquals(TokenKind.ARROW, tokens.get(4).kind());
        assertEquals(TokenKind.DOUBLE_COLON, tokens.get(6).kind());
    }

    @Test
    void scan_unknownCharacters_areDroppedSilentlyByDefault() {
        var result = Lexer.scan("a @ $ b");

        assertEquals(List.of(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.EOF),
                     result.tokens().stream().map(Token::kind).toList());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void scan_unknownCharacters_areReportedWhenStrict() {
        var result = Lexer.scan("a @ $ b", LexerConfig.STRICT);

        assertEquals(3, result.tokens().size());
        assertEquals(2, result.diagnostics().size());
        assertEquals("unexpected character '@'", result.diagnostics().get(0).message());
        assertEquals(1, result.diagnostics().get(0).line());
        assertEquals(3, result.diagnostics().get(0).column());
    }

    @Test
    void scan_positions_trackLinesAndColumns() {
        var tokens = tokens("int x;\n  x = 1;");

        var secondX = tokens.get(3);
        assertEquals("x", secondX.lexeme());
        assertEquals(2, secondX.line());
        assertEquals(3, secondX.column());
    }
}

package org.pragmatica.flowchart.lexer;

import org.pragmatica.flowchart.error.Diagnostic;
import org.pragmatica.flowchart.error.DiagnosticSink;
import org.pragmatica.flowchart.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lexer for the C++ subset.
 *
 * <p>Scanning never fails: malformed literals are reported as diagnostics and returned with
 * whatever text was scanned, unclassifiable characters are dropped, and the result always ends
 * with a single EOF token.
 */
public final class Lexer {
    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final char EOF_CHAR = '\0';

    public static final Set<String> KEYWORDS = Set.of(
        // types
        "int", "float", "double", "char", "bool", "void", "long", "short",
        "unsigned", "signed", "auto", "const", "static", "volatile",
        // control flow
        "if", "else", "switch", "case", "default", "break", "continue",
        "for", "while", "do", "return", "goto",
        // logical words
        "and", "or", "not", "xor",
        // other
        "struct", "class", "union", "enum", "namespace", "using",
        "new", "delete", "template", "typename",
        "public", "private", "protected"
    );

    // Matched before single-character operators
    private static final List<String> TWO_CHAR_OPERATORS = List.of(
        "==", "!=", "<=", ">=", "&&", "||", "++", "--", "->", "::", "<<", ">>"
    );

    private final String input;
    private final LexerConfig config;
    private final DiagnosticSink.Collecting diagnostics = DiagnosticSink.collecting();
    private int pos;
    private int line;
    private int column;

    private Lexer(String input, LexerConfig config) {
        this.input = input;
        this.config = config;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static LexResult scan(String source) {
        return scan(source, LexerConfig.DEFAULT);
    }

    public static LexResult scan(String source, LexerConfig config) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(config, "config");
        return new Lexer(source, config).scanAll();
    }

    private LexResult scanAll() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            if (token == null) {
                // comment
                continue;
            }
            if (token.is(TokenKind.UNKNOWN)) {
                if (config.reportUnknownCharacters()) {
                    diagnostics.report(Diagnostic.lexical(token.location(),
                                                       "unexpected character '" + token.lexeme() + "'"));
                }
                continue;
            }
            tokens.add(token);
        }
        tokens.add(Token.eof(line, column));
        LOG.debug("Scanned {} tokens with {} lexical diagnostics", tokens.size(), diagnostics.diagnostics().size());
        return new LexResult(tokens, diagnostics.diagnostics());
    }

    /**
     * Scan one token at the current position, or return null after skipping a comment.
     */
    private Token nextToken() {
        char c = peek();
        if (c == '/' && peekNext() == '/') {
            skipLineComment();
            return null;
        }
        if (c == '/' && peekNext() == '*') {
            skipBlockComment();
            return null;
        }
        if (c == '#') {
            return scanPreprocessor();
        }
        if (isDigit(c)) {
            return scanNumber();
        }
        if (c == '"') {
            return scanStringLiteral();
        }
        if (c == '\'') {
            return scanCharLiteral();
        }
        if (isIdentifierStart(c)) {
            return scanIdentifierOrKeyword();
        }
        return scanOperator();
    }

    // === Comments and preprocessor ===

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void skipBlockComment() {
        advance();
        advance();
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
    }

    private Token scanPreprocessor() {
        int startLine = line;
        int startColumn = column;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '\n') {
            sb.append(advance());
        }
        return new Token(TokenKind.PREPROCESSOR, sb.toString(), startLine, startColumn);
    }

    // === Numbers ===

    private Token scanNumber() {
        int startLine = line;
        int startColumn = column;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);

        if (peek() == '0' && (peekNext() == 'x' || peekNext() == 'X')) {
            sb.append(advance()).append(advance());
            while (!isAtEnd() && isHexDigit(peek())) {
                sb.append(advance());
            }
            return new Token(TokenKind.NUMBER, sb.toString(), startLine, startColumn);
        }
        if (peek() == '0' && (peekNext() == 'b' || peekNext() == 'B')) {
            sb.append(advance()).append(advance());
            while (!isAtEnd() && (peek() == '0' || peek() == '1')) {
                sb.append(advance());
            }
            return new Token(TokenKind.NUMBER, sb.toString(), startLine, startColumn);
        }

        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        if (peek() == '.' && isDigit(peekNext())) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }
        // suffixes: f, u, l, ...
        while (!isAtEnd() && (Character.isLetter(peek()) || peek() == '_')) {
            sb.append(advance());
        }
        return new Token(TokenKind.NUMBER, sb.toString(), startLine, startColumn);
    }

    // === String and character literals ===

    private Token scanStringLiteral() {
        int startLine = line;
        int startColumn = column;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(advance());

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                sb.append(advance());
                if (!isAtEnd()) {
                    sb.append(advance());
                }
            } else {
                sb.append(advance());
            }
        }

        if (isAtEnd()) {
            diagnostics.report(Diagnostic.lexical(currentLocation(), "unterminated string literal"));
        } else {
            sb.append(advance());
        }
        return new Token(TokenKind.STRING_LITERAL, sb.toString(), startLine, startColumn);
    }

    private Token scanCharLiteral() {
        int startLine = line;
        int startColumn = column;
        var sb = new StringBuilder(4);
        sb.append(advance());

        if (peek() == '\\') {
            sb.append(advance());
            if (!isAtEnd()) {
                sb.append(advance());
            }
        } else if (!isAtEnd() && peek() != '\'') {
            sb.append(advance());
        }

        if (!isAtEnd() && peek() == '\'') {
            sb.append(advance());
        } else {
            diagnostics.report(Diagnostic.lexical(currentLocation(), "unterminated character literal"));
        }
        return new Token(TokenKind.CHAR_LITERAL, sb.toString(), startLine, startColumn);
    }

    // === Identifiers and keywords ===

    private Token scanIdentifierOrKeyword() {
        int startLine = line;
        int startColumn = column;
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var lexeme = sb.toString();
        if (lexeme.equals("true") || lexeme.equals("false")) {
            return new Token(TokenKind.BOOL_LITERAL, lexeme, startLine, startColumn);
        }
        var kind = KEYWORDS.contains(lexeme)
                   ? TokenKind.KEYWORD
                   : TokenKind.IDENTIFIER;
        return new Token(kind, lexeme, startLine, startColumn);
    }

    // === Operators and delimiters ===

    private Token scanOperator() {
        int startLine = line;
        int startColumn = column;

        if (pos + 1 < input.length()) {
            var pair = input.substring(pos, pos + 2);
            if (TWO_CHAR_OPERATORS.contains(pair)) {
                advance();
                advance();
                var kind = switch (pair) {
                    case "->" -> TokenKind.ARROW;
                    case "::" -> TokenKind.DOUBLE_COLON;
                    default -> TokenKind.OPERATOR;
                };
                return new Token(kind, pair, startLine, startColumn);
            }
        }

        char c = advance();
        var kind = switch (c) {
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case '[' -> TokenKind.LBRACKET;
            case ']' -> TokenKind.RBRACKET;
            case ';' -> TokenKind.SEMICOLON;
            case ',' -> TokenKind.COMMA;
            case '.' -> TokenKind.DOT;
            case ':' -> TokenKind.COLON;
            case '+', '-', '*', '/', '%', '=', '<', '>', '!', '&', '|', '^', '~', '?' -> TokenKind.OPERATOR;
            default -> TokenKind.UNKNOWN;
        };
        return new Token(kind, String.valueOf(c), startLine, startColumn);
    }

    // === Character access ===

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return isAtEnd()
               ? EOF_CHAR
               : input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < input.length()
               ? input.charAt(pos + 1)
               : EOF_CHAR;
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}

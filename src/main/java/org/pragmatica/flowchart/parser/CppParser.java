package org.pragmatica.flowchart.parser;

import org.pragmatica.flowchart.lexer.Token;
import org.pragmatica.flowchart.lexer.TokenKind;
import org.pragmatica.flowchart.scope.Entry;
import org.pragmatica.flowchart.scope.ScopeManager;
import org.pragmatica.flowchart.scope.SymbolKind;
import org.pragmatica.flowchart.tree.AstNode.Assign;
import org.pragmatica.flowchart.tree.AstNode.Binary;
import org.pragmatica.flowchart.tree.AstNode.Block;
import org.pragmatica.flowchart.tree.AstNode.Break;
import org.pragmatica.flowchart.tree.AstNode.Continue;
import org.pragmatica.flowchart.tree.AstNode.Delete;
import org.pragmatica.flowchart.tree.AstNode.DoWhile;
import org.pragmatica.flowchart.tree.AstNode.ExprStatement;
import org.pragmatica.flowchart.tree.AstNode.Expression;
import org.pragmatica.flowchart.tree.AstNode.For;
import org.pragmatica.flowchart.tree.AstNode.FuncDef;
import org.pragmatica.flowchart.tree.AstNode.Identifier;
import org.pragmatica.flowchart.tree.AstNode.If;
import org.pragmatica.flowchart.tree.AstNode.Index;
import org.pragmatica.flowchart.tree.AstNode.InitList;
import org.pragmatica.flowchart.tree.AstNode.Literal;
import org.pragmatica.flowchart.tree.AstNode.New;
import org.pragmatica.flowchart.tree.AstNode.Postfix;
import org.pragmatica.flowchart.tree.AstNode.Program;
import org.pragmatica.flowchart.tree.AstNode.Return;
import org.pragmatica.flowchart.tree.AstNode.Statement;
import org.pragmatica.flowchart.tree.AstNode.Unary;
import org.pragmatica.flowchart.tree.AstNode.VarDecl;
import org.pragmatica.flowchart.tree.AstNode.While;
import org.pragmatica.flowchart.tree.SourceLocation;
import org.pragmatica.flowchart.types.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for the C++ subset.
 *
 * <p>Declarations and uses are checked against a {@link ScopeManager} during descent, and
 * initializers and assignments are checked with {@link TypeChecker}. Problems are recorded as
 * diagnostics and parsing resumes at the next statement boundary.
 */
public final class CppParser {
    private static final Logger LOG = LoggerFactory.getLogger(CppParser.class);

    private static final Set<String> TYPE_KEYWORDS = Set.of(
        "int", "float", "double", "char", "bool", "void", "long", "short", "unsigned", "signed", "auto"
    );
    private static final Set<String> TYPE_IDENTIFIERS = Set.of("vector", "string");
    private static final Set<String> EQUALITY_OPERATORS = Set.of("==", "!=");
    private static final Set<String> RELATIONAL_OPERATORS = Set.of("<", ">", "<=", ">=", "<<", ">>");
    private static final Set<String> ADDITIVE_OPERATORS = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE_OPERATORS = Set.of("*", "/", "%");
    private static final Set<String> PREFIX_OPERATORS = Set.of("+", "-", "!", "++", "--");

    private final ParserState state;
    private final ScopeManager scopes;
    private final TypeChecker types;

    private CppParser(List<Token> tokens) {
        this.state = ParserState.create(tokens);
        this.scopes = new ScopeManager(state);
        this.types = new TypeChecker(scopes);
    }

    /**
     * Parse a token stream into a program.
     *
     * <p>Never throws for malformed input. An unexpected internal fault is converted into a
     * single diagnostic without a position and an outcome without a tree.
     */
    public static ParseOutcome parse(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return new CppParser(tokens).run();
    }

    private ParseOutcome run() {
        try {
            var program = parseProgram();
            LOG.debug("Parsed {} top-level statements with {} diagnostics",
                      program.children().size(), state.diagnostics().size());
            return ParseOutcome.parsed(program, state.diagnostics(), scopes);
        } catch (RuntimeException | StackOverflowError e) {
            LOG.error("Parser aborted near {}", state.peek(), e);
            state.error(SourceLocation.UNKNOWN, "internal parser error: " + describe(e));
            return ParseOutcome.aborted(state.diagnostics(), scopes);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null
               ? e.getMessage()
               : e.getClass().getSimpleName();
    }

    // === Top level ===

    private Program parseProgram() {
        var start = state.location();
        var statements = new ArrayList<Statement>();

        while (!state.isAtEnd()) {
            if (state.check(TokenKind.PREPROCESSOR)
                || state.check(TokenKind.SEMICOLON)
                || state.check(TokenKind.RBRACE)) {
                state.advance();
                continue;
            }
            if (state.checkKeyword("using")) {
                parseUsingDirective();
                continue;
            }
            collect(statements, parseDeclarationOrStatement());
        }
        return new Program(statements, start);
    }

    private void parseUsingDirective() {
        var using = state.advance();
        if (!state.checkKeyword("namespace")) {
            state.error(using.location(), "expected 'namespace' after 'using'");
            state.skipToStatementEnd();
            return;
        }
        state.advance();
        if (!state.check(TokenKind.IDENTIFIER)) {
            state.error(state.location(), "expected namespace name");
            state.skipToStatementEnd();
            return;
        }
        state.advance();
        if (!state.check(TokenKind.SEMICOLON)) {
            state.error(state.location(), "expected ';' after using directive");
            state.skipToStatementEnd();
            return;
        }
        state.advance();
    }

    /**
     * Append a parsed statement, or resynchronize after a failed one.
     */
    private void collect(List<Statement> statements, Optional<Statement> statement) {
        if (statement.isPresent()) {
            statements.add(statement.get());
        } else {
            state.skipToStatementEnd();
        }
        state.exitRecovery();
    }

    // === Declarations ===

    private Optional<Statement> parseDeclarationOrStatement() {
        var constToken = state.checkKeyword("const")
                         ? Optional.of(state.advance())
                         : Optional.<Token>empty();
        if (!isTypeName(state.peek())) {
            constToken.ifPresent(token -> state.error(token.location(), "expected type after 'const'"));
            return parseStatement();
        }

        var typeToken = state.advance();
        skipTemplateArguments();
        var pointers = new StringBuilder();
        while (state.checkOperator("*")) {
            state.advance();
            pointers.append('*');
        }
        if (!state.check(TokenKind.IDENTIFIER)) {
            state.error(state.location(), "expected identifier after type");
            return Optional.empty();
        }
        var nameToken = state.advance();
        var baseType = typeToken.lexeme() + pointers;

        if (state.check(TokenKind.LPAREN)) {
            constToken.ifPresent(token -> state.error(token.location(),
                                                      "'const' cannot be applied to a function declaration"));
            return Optional.of(parseFunction(typeToken, baseType, nameToken));
        }
        return Optional.of(parseVariable(typeToken, baseType, nameToken, constToken.isPresent()));
    }

    private static boolean isTypeName(Token token) {
        return (token.is(TokenKind.KEYWORD) && TYPE_KEYWORDS.contains(token.lexeme()))
               || (token.is(TokenKind.IDENTIFIER) && TYPE_IDENTIFIERS.contains(token.lexeme()));
    }

    /**
     * Skip a {@code <...>} template argument list as balanced text. {@code >>} closes two levels.
     */
    private void skipTemplateArguments() {
        if (!state.checkOperator("<")) {
            return;
        }
        int depth = 0;
        while (!state.isAtEnd()) {
            if (state.checkOperator("<")) {
                depth++;
            } else if (state.checkOperator(">")) {
                depth--;
            } else if (state.checkOperator(">>")) {
                depth -= 2;
            }
            state.advance();
            if (depth <= 0) {
                return;
            }
        }
    }

    private Statement parseVariable(Token typeToken, String baseType, Token nameToken, boolean constant) {
        var name = nameToken.lexeme();
        var arraySuffix = new StringBuilder();
        while (state.check(TokenKind.LBRACKET)) {
            state.advance();
            if (!state.check(TokenKind.RBRACKET)) {
                // checked for symbol use, then dropped
                parseExpression();
            }
            arraySuffix.append("[]");
            if (state.check(TokenKind.RBRACKET)) {
                state.advance();
            } else {
                state.error(state.location(), "expected ']' in array declaration");
            }
        }

        var declaredType = baseType + arraySuffix;
        var fresh = scopes.current().local(name).isEmpty();
        var entry = scopes.declare(name, SymbolKind.VAR, declaredType, constant, nameToken.location());

        Optional<Expression> initializer = Optional.empty();
        if (state.checkOperator("=")) {
            state.advance();
            initializer = Optional.of(parseExpression());
        } else if (state.check(TokenKind.LBRACE)) {
            initializer = Optional.of(parseInitList());
        }

        initializer.ifPresent(value -> {
            var valueType = types.inferType(value);
            if (!TypeChecker.areCompatible(declaredType, valueType)) {
                state.error(nameToken.location(), "incompatible types in initialization of '" + name + "': "
                                                  + declaredType + " = " + valueType);
            }
            if (fresh) {
                entry.markInitialized();
            }
        });
        if (constant && initializer.isEmpty()) {
            state.error(nameToken.location(), "constant '" + name + "' must be initialized");
        }

        finishStatement("expected ';' after declaration of '" + name + "'");
        return new VarDecl(baseType, name, arraySuffix.toString(), constant, initializer, typeToken.location());
    }

    private Statement parseFunction(Token typeToken, String returnType, Token nameToken) {
        var entry = scopes.declare(nameToken.lexeme(), SymbolKind.FUNC, returnType, false, nameToken.location());
        if (entry.kind() == SymbolKind.FUNC) {
            entry.markInitialized();
        }
        skipParameters();

        if (state.check(TokenKind.SEMICOLON)) {
            state.advance();
            return new FuncDef(returnType, nameToken.lexeme(), Optional.empty(), false, typeToken.location());
        }
        if (state.check(TokenKind.LBRACE)) {
            var body = inScope(this::parseBlock);
            return new FuncDef(returnType, nameToken.lexeme(), Optional.of(body), false, typeToken.location());
        }

        state.warning(nameToken.location(), "missing '{' after function declaration, assuming body");
        var body = inScope(this::parseImplicitBody);
        return new FuncDef(returnType, nameToken.lexeme(), Optional.of(body), true, typeToken.location());
    }

    private void skipParameters() {
        state.advance();
        int depth = 1;
        while (!state.isAtEnd()) {
            if (state.check(TokenKind.LPAREN)) {
                depth++;
            } else if (state.check(TokenKind.RPAREN)) {
                depth--;
                if (depth == 0) {
                    state.advance();
                    return;
                }
            }
            state.advance();
        }
        state.expect(TokenKind.RPAREN, "expected ')' after function parameters");
    }

    /**
     * Statements up to and including the first {@code return}, or to end of input.
     */
    private Block parseImplicitBody() {
        var start = state.location();
        var statements = new ArrayList<Statement>();
        while (!state.isAtEnd() && !state.checkKeyword("return")) {
            if (state.check(TokenKind.SEMICOLON) || state.check(TokenKind.RBRACE)) {
                state.advance();
                continue;
            }
            collect(statements, parseDeclarationOrStatement());
        }
        if (state.checkKeyword("return")) {
            statements.add(parseReturn());
            state.exitRecovery();
        }
        return new Block(statements, start);
    }

    // === Statements ===

    private Optional<Statement> parseStatement() {
        if (state.checkKeyword("const") || isTypeName(state.peek())) {
            return parseDeclarationOrStatement();
        }
        if (state.check(TokenKind.LBRACE)) {
            return Optional.of(inScope(this::parseBlock));
        }
        if (state.check(TokenKind.KEYWORD)) {
            switch (state.peek().lexeme()) {
                case "if":
                    return Optional.of(parseIf());
                case "while":
                    return Optional.of(parseWhile());
                case "do":
                    return Optional.of(parseDoWhile());
                case "for":
                    return Optional.of(parseFor());
                case "break":
                    return Optional.of(new Break(keywordStatement("expected ';' after break")));
                case "continue":
                    return Optional.of(new Continue(keywordStatement("expected ';' after continue")));
                case "return":
                    return Optional.of(parseReturn());
                case "delete":
                    return Optional.of(parseDelete());
                default:
                    break;
            }
        }
        var start = state.location();
        var expression = parseExpression();
        finishStatement("expected ';' after expression");
        return Optional.of(new ExprStatement(expression, start));
    }

    /**
     * Brace-delimited statement list. The caller decides which scope the block runs in.
     */
    private Block parseBlock() {
        var open = state.advance();
        var statements = new ArrayList<Statement>();
        while (!state.check(TokenKind.RBRACE) && !state.isAtEnd()) {
            if (state.check(TokenKind.SEMICOLON)) {
                state.advance();
                continue;
            }
            collect(statements, parseStatement());
        }
        state.expect(TokenKind.RBRACE, "expected '}'");
        return new Block(statements, open.location());
    }

    /**
     * Branch or loop body. A missing body yields an empty block.
     */
    private Statement parseBody() {
        if (state.check(TokenKind.LBRACE)) {
            return inScope(this::parseBlock);
        }
        var start = state.location();
        return parseStatement().orElseGet(() -> new Block(List.of(), start));
    }

    private Statement parseIf() {
        var keyword = state.advance();
        var condition = parseCondition("if");
        var thenBranch = inScope(this::parseBody);
        Optional<Statement> elseBranch = Optional.empty();
        if (state.checkKeyword("else")) {
            state.advance();
            elseBranch = Optional.of(inScope(this::parseBody));
        }
        return new If(condition, thenBranch, elseBranch, keyword.location());
    }

    private Statement parseWhile() {
        var keyword = state.advance();
        var condition = parseCondition("while");
        var body = parseBody();
        return new While(condition, body, keyword.location());
    }

    /**
     * Parenthesized condition. Without the opening parenthesis the condition is parsed anyway
     * and the parser resynchronizes to the body.
     */
    private Expression parseCondition(String keyword) {
        if (!state.check(TokenKind.LPAREN)) {
            state.error(state.location(), "expected '(' after " + keyword);
            var condition = parseExpression();
            state.skipTo(TokenKind.LBRACE, TokenKind.SEMICOLON);
            return condition;
        }
        state.advance();
        var condition = parseExpression();
        state.expect(TokenKind.RPAREN, "expected ')' after " + keyword + " condition");
        return condition;
    }

    private Statement parseDoWhile() {
        var keyword = state.advance();
        var body = parseBody();
        if (!state.checkKeyword("while")) {
            state.error(state.location(), "expected 'while' after do body");
            return new DoWhile(body, Literal.error("", state.location()), keyword.location());
        }
        state.advance();
        state.expect(TokenKind.LPAREN, "expected '(' after while");
        var condition = parseExpression();
        state.expect(TokenKind.RPAREN, "expected ')' after while condition");
        state.expect(TokenKind.SEMICOLON, "expected ';' after do-while");
        return new DoWhile(body, condition, keyword.location());
    }

    private Statement parseFor() {
        var keyword = state.advance();
        state.expect(TokenKind.LPAREN, "expected '(' after for");
        return inScope(() -> {
            Optional<Statement> init = Optional.empty();
            if (state.check(TokenKind.SEMICOLON)) {
                state.advance();
            } else if (state.checkKeyword("const") || isTypeName(state.peek())) {
                // the declaration consumes its own ';'
                init = parseDeclarationOrStatement();
            } else {
                var start = state.location();
                init = Optional.of(new ExprStatement(parseExpression(), start));
                finishForClause("expected ';' after for initializer");
            }

            Optional<Expression> condition = Optional.empty();
            if (state.check(TokenKind.SEMICOLON)) {
                state.advance();
            } else if (!state.check(TokenKind.RPAREN)) {
                condition = Optional.of(parseExpression());
                finishForClause("expected ';' after for condition");
            }

            Optional<Expression> update = Optional.empty();
            if (!state.check(TokenKind.RPAREN)) {
                update = Optional.of(parseExpression());
            }
            while (!state.isAtEnd() && !state.check(TokenKind.RPAREN) && !state.check(TokenKind.LBRACE)) {
                state.skip();
            }
            state.expect(TokenKind.RPAREN, "expected ')' after for header");

            var body = parseBody();
            return new For(init, condition, update, body, keyword.location());
        });
    }

    private void finishForClause(String message) {
        if (state.expect(TokenKind.SEMICOLON, message)) {
            return;
        }
        while (!state.isAtEnd() && !state.check(TokenKind.SEMICOLON) && !state.check(TokenKind.RPAREN)) {
            state.skip();
        }
        if (state.check(TokenKind.SEMICOLON)) {
            state.skip();
        }
    }

    private Statement parseReturn() {
        var keyword = state.advance();
        Optional<Expression> value = Optional.empty();
        if (!state.check(TokenKind.SEMICOLON) && !state.check(TokenKind.RBRACE) && !state.isAtEnd()) {
            value = Optional.of(parseExpression());
        }
        finishStatement("expected ';' after return");
        return new Return(value, keyword.location());
    }

    private Statement parseDelete() {
        var keyword = state.advance();
        var array = false;
        if (state.check(TokenKind.LBRACKET)) {
            state.advance();
            array = true;
            state.expect(TokenKind.RBRACKET, "expected ']' after 'delete['");
        }
        var target = parseExpression();
        finishStatement("expected ';' after delete");
        return new Delete(target, array, keyword.location());
    }

    private SourceLocation keywordStatement(String message) {
        var keyword = state.advance();
        finishStatement(message);
        return keyword.location();
    }

    private void finishStatement(String message) {
        if (!state.expect(TokenKind.SEMICOLON, message)) {
            state.skipToStatementEnd();
        }
    }

    private <T> T inScope(Supplier<T> body) {
        scopes.enterScope();
        try {
            return body.get();
        } finally {
            scopes.exitScope();
        }
    }

    // === Expressions ===

    private Expression parseExpression() {
        return parseAssignment();
    }

    private Expression parseAssignment() {
        var target = parseLogicalOr();
        if (!state.checkOperator("=")) {
            return target;
        }
        var operator = state.advance();
        var value = parseAssignment();

        if (target instanceof Identifier identifier) {
            scopes.lookup(identifier.name())
                  .ifPresent(entry -> checkAssignment(entry, value, operator.location()));
        }
        return new Assign(target, operator.lexeme(), value, target.location());
    }

    private void checkAssignment(Entry entry, Expression value, SourceLocation location) {
        if (entry.isConstant()) {
            state.error(location, "cannot assign to const variable '" + entry.name() + "'");
            return;
        }
        var targetType = entry.type();
        var valueType = types.inferType(value);
        if (!TypeChecker.areCompatible(targetType, valueType)) {
            state.error(location, "incompatible types in assignment to '" + entry.name() + "': "
                                  + targetType + " = " + valueType);
        }
        entry.markInitialized();
    }

    private Expression parseLogicalOr() {
        var left = parseLogicalAnd();
        while (state.checkOperator("||")) {
            var operator = state.advance();
            left = new Binary(operator.lexeme(), left, parseLogicalAnd(), left.location());
        }
        return left;
    }

    private Expression parseLogicalAnd() {
        var left = parseEquality();
        while (state.checkOperator("&&")) {
            var operator = state.advance();
            left = new Binary(operator.lexeme(), left, parseEquality(), left.location());
        }
        return left;
    }

    private Expression parseEquality() {
        var left = parseRelational();
        while (checkOperatorIn(EQUALITY_OPERATORS)) {
            var operator = state.advance();
            left = new Binary(operator.lexeme(), left, parseRelational(), left.location());
        }
        return left;
    }

    private Expression parseRelational() {
        var left = parseAdditive();
        while (checkOperatorIn(RELATIONAL_OPERATORS)) {
            var operator = state.advance();
            left = new Binary(operator.lexeme(), left, parseAdditive(), left.location());
        }
        return left;
    }

    private Expression parseAdditive() {
        var left = parseMultiplicative();
        while (checkOperatorIn(ADDITIVE_OPERATORS)) {
            var operator = state.advance();
            left = new Binary(operator.lexeme(), left, parseMultiplicative(), left.location());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        var left = parseUnary();
        while (checkOperatorIn(MULTIPLICATIVE_OPERATORS)) {
            var operator = state.advance();
            left = new Binary(operator.lexeme(), left, parseUnary(), left.location());
        }
        return left;
    }

    private Expression parseUnary() {
        if (checkOperatorIn(PREFIX_OPERATORS)) {
            var operator = state.advance();
            return new Unary(operator.lexeme(), parseUnary(), operator.location());
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        var expression = parsePrimary();
        while (state.checkOperator("++") || state.checkOperator("--")) {
            var operator = state.advance();
            if (expression instanceof Identifier identifier) {
                scopes.lookup(identifier.name())
                      .ifPresent(entry -> checkModification(entry, operator.location()));
            }
            expression = new Postfix(operator.lexeme(), expression, expression.location());
        }
        while (state.check(TokenKind.LBRACKET)) {
            state.advance();
            var index = parseExpression();
            state.expect(TokenKind.RBRACKET, "expected ']' after index");
            expression = new Index(expression, index, expression.location());
        }
        return expression;
    }

    private void checkModification(Entry entry, SourceLocation location) {
        if (entry.isConstant()) {
            state.error(location, "cannot modify const variable '" + entry.name() + "'");
            return;
        }
        entry.markInitialized();
    }

    private Expression parsePrimary() {
        var token = state.peek();

        if (token.isKeyword("new")) {
            return parseNew();
        }
        if (token.is(TokenKind.LPAREN)) {
            state.advance();
            var inner = parseExpression();
            state.expect(TokenKind.RPAREN, "expected ')' in expression");
            return inner;
        }
        if (token.is(TokenKind.LBRACE)) {
            return parseInitList();
        }
        if (token.is(TokenKind.IDENTIFIER)) {
            state.advance();
            scopes.require(token.lexeme(), token.location());
            return new Identifier(token.lexeme(), token.location());
        }
        var literalKind = literalKind(token.kind());
        if (literalKind.isPresent()) {
            state.advance();
            return new Literal(literalKind.get(), token.lexeme(), token.location());
        }

        state.errorOnce(token.location(), token.is(TokenKind.EOF)
                                          ? "expected expression, found end of input"
                                          : "expected expression, found '" + token.lexeme() + "'");
        // statement delimiters are left for resynchronization
        if (!token.is(TokenKind.SEMICOLON) && !token.is(TokenKind.RBRACE)) {
            state.skip();
        }
        return Literal.error(token.lexeme(), token.location());
    }

    private static Optional<Literal.Kind> literalKind(TokenKind kind) {
        return switch (kind) {
            case NUMBER -> Optional.of(Literal.Kind.NUMBER);
            case STRING_LITERAL -> Optional.of(Literal.Kind.STRING);
            case CHAR_LITERAL -> Optional.of(Literal.Kind.CHAR);
            case BOOL_LITERAL -> Optional.of(Literal.Kind.BOOL);
            default -> Optional.empty();
        };
    }

    private Expression parseNew() {
        var keyword = state.advance();
        if (!isTypeName(state.peek())) {
            state.error(state.location(), "expected type after 'new'");
            return Literal.error(keyword.lexeme(), keyword.location());
        }
        var type = state.advance().lexeme();
        Optional<Expression> size = Optional.empty();
        if (state.check(TokenKind.LBRACKET)) {
            state.advance();
            size = Optional.of(parseExpression());
            state.expect(TokenKind.RBRACKET, "expected ']' after array size");
        }
        return new New(type, size, keyword.location());
    }

    private Expression parseInitList() {
        var open = state.advance();
        var elements = new ArrayList<Expression>();
        while (!state.check(TokenKind.RBRACE) && !state.isAtEnd()) {
            elements.add(parseExpression());
            if (state.check(TokenKind.COMMA)) {
                state.advance();
            } else {
                break;
            }
        }
        state.expect(TokenKind.RBRACE, "expected '}' after initializer list");
        return new InitList(elements, open.location());
    }

    private boolean checkOperatorIn(Set<String> operators) {
        return state.check(TokenKind.OPERATOR) && operators.contains(state.peek().lexeme());
    }
}

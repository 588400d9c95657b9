package org.pragmatica.flowchart.tree;

import java.util.List;
import java.util.Optional;

/**
 * Abstract Syntax Tree node produced by the parser.
 *
 * <p>The tree is split into two closed families: {@link Statement} and {@link Expression}.
 * Consumers match on them exhaustively through {@link Statement.Visitor} and
 * {@link Expression.Visitor}.
 */
public sealed interface AstNode {

    /**
     * Position of the token that started this node.
     */
    SourceLocation location();

    // === Statements ===

    /**
     * Statement-level constructs, including declarations.
     */
    sealed interface Statement extends AstNode {
        <R> R accept(Visitor<R> visitor);

        interface Visitor<R> {
            R visitProgram(Program program);

            R visitBlock(Block block);

            R visitVarDecl(VarDecl decl);

            R visitFuncDef(FuncDef func);

            R visitIf(If stmt);

            R visitWhile(While stmt);

            R visitDoWhile(DoWhile stmt);

            R visitFor(For stmt);

            R visitReturn(Return stmt);

            R visitBreak(Break stmt);

            R visitContinue(Continue stmt);

            R visitDelete(Delete stmt);

            R visitExprStatement(ExprStatement stmt);
        }
    }

    /**
     * Root of a translation unit.
     */
    record Program(List<Statement> children, SourceLocation location) implements Statement {
        public Program {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    /**
     * Brace-delimited statement list, also used for implicit function bodies.
     */
    record Block(List<Statement> children, SourceLocation location) implements Statement {
        public Block {
            children = List.copyOf(children);
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * Variable declaration.
     *
     * @param type        base type with pointer markers, e.g. {@code int*}
     * @param name        declared name
     * @param arraySuffix one {@code []} per array dimension, empty for scalars
     * @param constant    whether the declaration carried {@code const}
     * @param initializer initializer expression, if any
     */
    record VarDecl(String type,
                   String name,
                   String arraySuffix,
                   boolean constant,
                   Optional<Expression> initializer,
                   SourceLocation location) implements Statement {
        public String declaredType() {
            return type + arraySuffix;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarDecl(this);
        }
    }

    /**
     * Function definition or prototype. Parameters are skipped by the parser and not represented.
     *
     * @param body         function body, empty for a prototype ending in {@code ;}
     * @param implicitBody true when the opening brace was missing and the body was inferred
     */
    record FuncDef(String returnType,
                   String name,
                   Optional<Block> body,
                   boolean implicitBody,
                   SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFuncDef(this);
        }
    }

    record If(Expression condition,
              Statement thenBranch,
              Optional<Statement> elseBranch,
              SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record While(Expression condition, Statement body, SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    record DoWhile(Statement body, Expression condition, SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDoWhile(this);
        }
    }

    /**
     * Counted loop; every header clause is optional.
     */
    record For(Optional<Statement> init,
               Optional<Expression> condition,
               Optional<Expression> update,
               Statement body,
               SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record Return(Optional<Expression> value, SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Break(SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue(SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    /**
     * {@code delete expr;} or {@code delete[] expr;}
     */
    record Delete(Expression target, boolean array, SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    record ExprStatement(Expression expression, SourceLocation location) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExprStatement(this);
        }
    }

    // === Expressions ===

    /**
     * Expression-level constructs.
     */
    sealed interface Expression extends AstNode {
        <R> R accept(Visitor<R> visitor);

        interface Visitor<R> {
            R visitBinary(Binary expr);

            R visitUnary(Unary expr);

            R visitPostfix(Postfix expr);

            R visitIndex(Index expr);

            R visitAssign(Assign expr);

            R visitLiteral(Literal expr);

            R visitIdentifier(Identifier expr);

            R visitInitList(InitList expr);

            R visitNew(New expr);
        }
    }

    record Binary(String operator, Expression left, Expression right, SourceLocation location) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /**
     * Prefix operator: {@code + - ! ++ --}.
     */
    record Unary(String operator, Expression operand, SourceLocation location) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * Trailing {@code ++} or {@code --}.
     */
    record Postfix(String operator, Expression operand, SourceLocation location) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPostfix(this);
        }
    }

    record Index(Expression target, Expression index, SourceLocation location) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    record Assign(Expression target, String operator, Expression value, SourceLocation location) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    record Literal(Kind kind, String value, SourceLocation location) implements Expression {
        /**
         * Literal categories. {@code ERROR} marks a placeholder for an unparsable token.
         */
        public enum Kind {
            NUMBER,
            STRING,
            CHAR,
            BOOL,
            ERROR
        }

        public static Literal error(String text, SourceLocation location) {
            return new Literal(Kind.ERROR, text, location);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record Identifier(String name, SourceLocation location) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * Brace-enclosed initializer list: {@code {1, 2, 3}}.
     */
    record InitList(List<Expression> elements, SourceLocation location) implements Expression {
        public InitList {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInitList(this);
        }
    }

    /**
     * {@code new T} or {@code new T[size]}.
     */
    record New(String type, Optional<Expression> size, SourceLocation location) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNew(this);
        }
    }
}

package org.pragmatica.flowchart.generator;

import org.pragmatica.flowchart.tree.AstNode.Assign;
import org.pragmatica.flowchart.tree.AstNode.Binary;
import org.pragmatica.flowchart.tree.AstNode.Expression;
import org.pragmatica.flowchart.tree.AstNode.Identifier;
import org.pragmatica.flowchart.tree.AstNode.Index;
import org.pragmatica.flowchart.tree.AstNode.InitList;
import org.pragmatica.flowchart.tree.AstNode.Literal;
import org.pragmatica.flowchart.tree.AstNode.New;
import org.pragmatica.flowchart.tree.AstNode.Postfix;
import org.pragmatica.flowchart.tree.AstNode.Unary;

import java.util.stream.Collectors;

/**
 * Renders an expression as infix text without parentheses.
 */
public final class LabelRenderer implements Expression.Visitor<String> {
    private static final LabelRenderer INSTANCE = new LabelRenderer();

    private LabelRenderer() {
    }

    public static String render(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitBinary(Binary expr) {
        return render(expr.left()) + " " + expr.operator() + " " + render(expr.right());
    }

    @Override
    public String visitUnary(Unary expr) {
        return expr.operator() + render(expr.operand());
    }

    @Override
    public String visitPostfix(Postfix expr) {
        return render(expr.operand()) + expr.operator();
    }

    @Override
    public String visitIndex(Index expr) {
        return render(expr.target()) + "[" + render(expr.index()) + "]";
    }

    @Override
    public String visitAssign(Assign expr) {
        return render(expr.target()) + " " + expr.operator() + " " + render(expr.value());
    }

    @Override
    public String visitLiteral(Literal expr) {
        return expr.value();
    }

    @Override
    public String visitIdentifier(Identifier expr) {
        return expr.name();
    }

    @Override
    public String visitInitList(InitList expr) {
        return expr.elements()
                   .stream()
                   .map(LabelRenderer::render)
                   .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String visitNew(New expr) {
        return "new " + expr.type() + expr.size()
                                          .map(size -> "[" + render(size) + "]")
                                          .orElse("");
    }
}

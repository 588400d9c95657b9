package org.pragmatica.flowchart.tree;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Indented textual rendering of an AST.
 *
 * <p>Example output:
 * <pre>
 * Program
 * ├─ VarDecl int x
 * │  └─ Literal NUMBER 5
 * └─ While
 *    ├─ condition
 *    │  └─ Binary &lt;
 * </pre>
 */
public final class TreePrinter {
    private static final Labeler LABELER = new Labeler();

    private TreePrinter() {}

    public static String print(AstNode node) {
        var sb = new StringBuilder();
        var root = describe(node);
        sb.append(root.label()).append("\n");
        appendChildren(sb, root, "");
        return sb.toString();
    }

    private static void appendChildren(StringBuilder sb, Line line, String prefix) {
        var children = line.children();
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            var last = i == children.size() - 1;
            sb.append(prefix).append(last ? "└─ " : "├─ ").append(child.label()).append("\n");
            appendChildren(sb, child, prefix + (last ? "   " : "│  "));
        }
    }

    private static Line describe(AstNode node) {
        if (node instanceof Statement statement) {
            return statement.accept(LABELER);
        }
        return ((Expression) node).accept(LABELER.expressions);
    }

    private record Line(String label, List<Line> children) {
        static Line leaf(String label) {
            return new Line(label, List.of());
        }

        static Line of(String label, AstNode... children) {
            var lines = new ArrayList<Line>();
            for (var child : children) {
                lines.add(describe(child));
            }
            return new Line(label, lines);
        }

        static Line section(String label, AstNode child) {
            return new Line(label, List.of(describe(child)));
        }
    }

    private static final class Labeler implements Statement.Visitor<Line> {
        private final ExpressionLabeler expressions = new ExpressionLabeler();

        @Override
        public Line visitProgram(Program program) {
            return Line.of("Program", program.children().toArray(AstNode[]::new));
        }

        @Override
        public Line visitBlock(Block block) {
            return Line.of("Block", block.children().toArray(AstNode[]::new));
        }

        @Override
        public Line visitVarDecl(VarDecl decl) {
            var label = "VarDecl " + (decl.constant() ? "const " : "") + decl.declaredType() + " " + decl.name();
            return decl.initializer()
                       .map(init -> Line.of(label, init))
                       .orElseGet(() -> Line.leaf(label));
        }

        @Override
        public Line visitFuncDef(FuncDef func) {
            var label = "FuncDef " + func.returnType() + " " + func.name() + "()"
                        + (func.implicitBody() ? " [implicit body]" : "");
            return func.body()
                       .map(body -> Line.of(label, body))
                       .orElseGet(() -> Line.leaf(label));
        }

        @Override
        public Line visitIf(If stmt) {
            var children = new ArrayList<Line>();
            children.add(Line.section("condition", stmt.condition()));
            children.add(Line.section("then", stmt.thenBranch()));
            stmt.elseBranch().ifPresent(branch -> children.add(Line.section("else", branch)));
            return new Line("If", children);
        }

        @Override
        public Line visitWhile(While stmt) {
            return new Line("While", List.of(Line.section("condition", stmt.condition()),
                                             Line.section("body", stmt.body())));
        }

        @Override
        public Line visitDoWhile(DoWhile stmt) {
            return new Line("DoWhile", List.of(Line.section("body", stmt.body()),
                                               Line.section("condition", stmt.condition())));
        }

        @Override
        public Line visitFor(For stmt) {
            var children = new ArrayList<Line>();
            stmt.init().ifPresent(init -> children.add(Line.section("init", init)));
            stmt.condition().ifPresent(condition -> children.add(Line.section("condition", condition)));
            stmt.update().ifPresent(update -> children.add(Line.section("update", update)));
            children.add(Line.section("body", stmt.body()));
            return new Line("For", children);
        }

        @Override
        public Line visitReturn(Return stmt) {
            return optionalChild("Return", stmt.value());
        }

        @Override
        public Line visitBreak(Break stmt) {
            return Line.leaf("Break");
        }

        @Override
        public Line visitContinue(Continue stmt) {
            return Line.leaf("Continue");
        }

        @Override
        public Line visitDelete(Delete stmt) {
            return Line.of(stmt.array() ? "Delete[]" : "Delete", stmt.target());
        }

        @Override
        public Line visitExprStatement(ExprStatement stmt) {
            return Line.of("ExprStatement", stmt.expression());
        }
    }

    private static final class ExpressionLabeler implements Expression.Visitor<Line> {
        @Override
        public Line visitBinary(Binary expr) {
            return Line.of("Binary " + expr.operator(), expr.left(), expr.right());
        }

        @Override
        public Line visitUnary(Unary expr) {
            return Line.of("Unary " + expr.operator(), expr.operand());
        }

        @Override
        public Line visitPostfix(Postfix expr) {
            return Line.of("Postfix " + expr.operator(), expr.operand());
        }

        @Override
        public Line visitIndex(Index expr) {
            return Line.of("Index", expr.target(), expr.index());
        }

        @Override
        public Line visitAssign(Assign expr) {
            return Line.of("Assign " + expr.operator(), expr.target(), expr.value());
        }

        @Override
        public Line visitLiteral(Literal expr) {
            return Line.leaf("Literal " + expr.kind() + " " + expr.value());
        }

        @Override
        public Line visitIdentifier(Identifier expr) {
            return Line.leaf("Identifier " + expr.name());
        }

        @Override
        public Line visitInitList(InitList expr) {
            return Line.of("InitList", expr.elements().toArray(AstNode[]::new));
        }

        @Override
        public Line visitNew(New expr) {
            return optionalChild("New " + expr.type(), expr.size());
        }
    }

    private static Line optionalChild(String label, Optional<? extends AstNode> child) {
        return child.<Line>map(node -> Line.of(label, node))
                    .orElseGet(() -> Line.leaf(label));
    }
}

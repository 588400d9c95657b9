package org.pragmatica.flowchart.types;

import org.pragmatica.flowchart.scope.Entry;
import org.pragmatica.flowchart.scope.ScopeManager;
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

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Lightweight primitive-type inference and a permissive compatibility heuristic.
 *
 * <p>This is not a sound type system. Inference is local: an expression's type depends only on
 * its children and on the declared types visible in the current scope.
 */
public final class TypeChecker implements Expression.Visitor<String> {
    public static final String UNKNOWN = "unknown";
    public static final String UNDECLARED = "undeclared";
    public static final String ARRAY = "array";

    private static final Set<String> INTEGER_FAMILY = Set.of("int", "short", "long");
    private static final Set<String> FLOATING = Set.of("double", "float");
    private static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "%", "<<", ">>");
    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", ">", "<=", ">=");

    private final ScopeManager scopes;

    public TypeChecker(ScopeManager scopes) {
        this.scopes = Objects.requireNonNull(scopes, "scopes");
    }

    /**
     * Infer the primitive type name of an expression.
     */
    public String inferType(Expression expression) {
        return expression.accept(this);
    }

    /**
     * Check whether a value of {@code rightType} may be stored into {@code leftType}.
     *
     * <p>The rules are asymmetric and evaluated in order: exact match, array declarator
     * accepting an initializer list, pointer to pointer, integer family, floating target
     * accepting any numeric value, {@code bool} only from {@code bool}, {@code string} and
     * {@code char} only from themselves.
     */
    public static boolean areCompatible(String leftType, String rightType) {
        var left = leftType.toLowerCase(Locale.ROOT);
        var right = rightType.toLowerCase(Locale.ROOT);

        if (left.equals(right)) {
            return true;
        }
        if (left.contains("[") && left.contains("]") && right.equals(ARRAY)) {
            return true;
        }
        if (left.contains("*") && right.contains("*")) {
            return true;
        }
        if (INTEGER_FAMILY.contains(left) && INTEGER_FAMILY.contains(right)) {
            return true;
        }
        if (FLOATING.contains(left)) {
            return INTEGER_FAMILY.contains(right) || FLOATING.contains(right);
        }
        if (left.equals("bool")) {
            return right.equals("bool");
        }
        if (left.equals("string") || left.equals("char")) {
            return right.equals(left);
        }
        return false;
    }

    // === Inference ===

    @Override
    public String visitBinary(Binary expr) {
        var op = expr.operator();
        if (ARITHMETIC_OPERATORS.contains(op)) {
            var left = inferType(expr.left());
            var right = inferType(expr.right());
            if (FLOATING.contains(left) || FLOATING.contains(right)) {
                return "double";
            }
            if (INTEGER_FAMILY.contains(left) || INTEGER_FAMILY.contains(right)) {
                return "int";
            }
            return UNKNOWN;
        }
        if (LOGICAL_OPERATORS.contains(op) || COMPARISON_OPERATORS.contains(op)) {
            return "bool";
        }
        return UNKNOWN;
    }

    @Override
    public String visitUnary(Unary expr) {
        return inferType(expr.operand());
    }

    @Override
    public String visitPostfix(Postfix expr) {
        return inferType(expr.operand());
    }

    @Override
    public String visitIndex(Index expr) {
        return "int";
    }

    @Override
    public String visitAssign(Assign expr) {
        return inferType(expr.target());
    }

    @Override
    public String visitLiteral(Literal expr) {
        return switch (expr.kind()) {
            case NUMBER -> isFloatLiteral(expr.value())
                           ? "double"
                           : "int";
            case BOOL -> "bool";
            case STRING -> "string";
            case CHAR -> "char";
            case ERROR -> UNKNOWN;
        };
    }

    @Override
    public String visitIdentifier(Identifier expr) {
        return scopes.lookup(expr.name())
                     .map(Entry::type)
                     .map(type -> type.toLowerCase(Locale.ROOT))
                     .orElse(UNDECLARED);
    }

    @Override
    public String visitInitList(InitList expr) {
        return ARRAY;
    }

    @Override
    public String visitNew(New expr) {
        return expr.type() + "*";
    }

    private static boolean isFloatLiteral(String text) {
        return text.contains(".") || text.contains("e") || text.contains("E");
    }
}

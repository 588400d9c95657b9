package org.pragmatica.flowchart.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.flowchart.lexer.Lexer;
import org.pragmatica.flowchart.parser.CppParser;

import static org.junit.jupiter.api.Assertions.*;

class TreePrinterTest {

    private static String printed(String source) {
        var program = CppParser.parse(Lexer.scan(source).tokens()).program().orElseThrow();
        return TreePrinter.print(program);
    }

    @Test
    void print_declaration_showsConnectors() {
        assertEquals("""
                     Program
                     └─ VarDecl int x
                        └─ Literal NUMBER 5
                     """, printed("int x = 5;"));
    }

    @Test
    void print_whileLoop_labelsSections() {
        assertEquals("""
                     Program
                     ├─ VarDecl int i
                     │  └─ Literal NUMBER 0
                     └─ While
                        ├─ condition
                        │  └─ Binary <
                        │     ├─ Identifier i
                        │     └─ Literal NUMBER 3
                        └─ body
                           └─ Block
                              └─ ExprStatement
                                 └─ Postfix ++
                                    └─ Identifier i
                     """, printed("int i = 0; while (i < 3) { i++; }"));
    }

    @Test
    void print_function_marksImplicitBody() {
        var text = printed("int main() return 0;");

        assertTrue(text.contains("FuncDef int main() [implicit body]"));
        assertTrue(text.contains("Return"));
    }

    @Test
    void print_expressionNode_isSupported() {
        var expr = new AstNode.Identifier("x", SourceLocation.START);

        assertEquals("Identifier x\n", TreePrinter.print(expr));
    }
}

package org.pragmatica.flowchart.scope;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pragmatica.flowchart.error.Diagnostic;
import org.pragmatica.flowchart.error.DiagnosticSink;
import org.pragmatica.flowchart.tree.SourceLocation;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeManagerTest {
    private static final SourceLocation HERE = SourceLocation.at(1, 1);

    private DiagnosticSink.Collecting sink;
    private ScopeManager scopes;

    @BeforeEach
    void setUp() {
        sink = DiagnosticSink.collecting();
        scopes = new ScopeManager(sink);
    }

    @Test
    void construction_declaresBuiltInsAtGlobalScope() {
        assertThat(scopes.currentDepth()).isZero();
        assertThat(scopes.lookup("cout")).hasValueSatisfying(entry -> {
            assertThat(entry.kind()).isEqualTo(SymbolKind.STD);
            assertThat(entry.type()).isEqualTo("ostream");
            assertThat(entry.isInitialized()).isTrue();
        });
        assertThat(scopes.lookup("vector")).isPresent();
        assertThat(scopes.lookup("endl")).isPresent();
        assertThat(sink.isEmpty()).isTrue();
    }

    @Test
    void require_builtIn_reportsNothing() {
        assertThat(scopes.require("cin", HERE)).isPresent();
        assertThat(sink.isEmpty()).isTrue();
    }

    @Test
    void declare_sameNameTwice_reportsOnceAndKeepsFirstEntry() {
        var first = scopes.declare("x", SymbolKind.VAR, "int", false, SourceLocation.at(1, 5));
        var second = scopes.declare("x", SymbolKind.VAR, "double", true, SourceLocation.at(2, 8));

        assertThat(second).isSameAs(first);
        assertThat(first.type()).isEqualTo("int");
        assertThat(first.isConstant()).isFalse();
        assertThat(first.declaredAt()).isEqualTo(SourceLocation.at(1, 5));
        assertThat(sink.diagnostics())
            .extracting(Diagnostic::message)
            .containsExactly("redeclaration of 'x' in the same scope");
        assertThat(sink.diagnostics().get(0).location()).isEqualTo(SourceLocation.at(2, 8));
    }

    @Test
    void declare_inNestedScope_shadowsWithoutTouchingOuterEntry() {
        var outer = scopes.declare("x", SymbolKind.VAR, "int", false, HERE);

        scopes.enterScope();
        var inner = scopes.declare("x", SymbolKind.VAR, "double", false, HERE);

        assertThat(scopes.lookup("x")).containsSame(inner);
        assertThat(inner.shadowed()).containsSame(outer);
        assertThat(inner.scopeDepth()).isEqualTo(1);
        assertThat(outer.type()).isEqualTo("int");
        assertThat(sink.isEmpty()).isTrue();

        scopes.exitScope();
        assertThat(scopes.lookup("x")).containsSame(outer);
    }

    @Test
    void lookup_walksOutwardThroughParents() {
        scopes.declare("g", SymbolKind.VAR, "int", false, HERE);
        scopes.enterScope();
        scopes.enterScope();

        assertThat(scopes.currentDepth()).isEqualTo(2);
        assertThat(scopes.lookup("g")).isPresent();
        assertThat(scopes.lookup("missing")).isEmpty();
    }

    @Test
    void exitScope_atGlobal_isNoOp() {
        scopes.exitScope();
        scopes.exitScope();

        assertThat(scopes.currentDepth()).isZero();
        assertThat(scopes.lookup("cout")).isPresent();
        assertThat(scopes.current()).isSameAs(scopes.global());
    }

    @Test
    void exitScope_dropsInnerBindings() {
        scopes.enterScope();
        scopes.declare("tmp", SymbolKind.VAR, "int", false, HERE);
        scopes.exitScope();

        assertThat(scopes.lookup("tmp")).isEmpty();
    }

    @Test
    void require_undeclared_reportsError() {
        assertThat(scopes.require("y", SourceLocation.at(3, 4))).isEmpty();

        assertThat(sink.diagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo("use of undeclared identifier 'y'");
            assertThat(diagnostic.isError()).isTrue();
            assertThat(diagnostic.location()).isEqualTo(SourceLocation.at(3, 4));
        });
    }

    @Test
    void require_uninitializedVariable_warnsAndReturnsEntry() {
        var entry = scopes.declare("z", SymbolKind.VAR, "int", false, HERE);

        assertThat(scopes.require("z", HERE)).containsSame(entry);
        assertThat(sink.diagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.message()).isEqualTo("use of uninitialized variable 'z'");
            assertThat(diagnostic.severity()).isEqualTo(Diagnostic.Severity.WARNING);
        });
    }

    @Test
    void markInitialized_silencesUninitializedWarning() {
        scopes.declare("z", SymbolKind.VAR, "int", false, HERE);

        assertThat(scopes.markInitialized("z")).isTrue();
        assertThat(scopes.markInitialized("nope")).isFalse();
        scopes.require("z", HERE);

        assertThat(sink.isEmpty()).isTrue();
    }

    @Test
    void declare_typeKind_isInitializedImmediately() {
        var entry = scopes.declare("Point", SymbolKind.TYPE, "type", false, HERE);

        assertThat(entry.isInitialized()).isTrue();
    }
}

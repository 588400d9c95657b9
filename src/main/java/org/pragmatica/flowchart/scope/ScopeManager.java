package org.pragmatica.flowchart.scope;

import org.pragmatica.flowchart.error.Diagnostic;
import org.pragmatica.flowchart.error.DiagnosticSink;
import org.pragmatica.flowchart.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Block-scoped symbol table.
 *
 * <p>Scopes are pushed and popped in strict LIFO order. The global scope (depth 0) is created
 * on construction, holds the standard-library built-ins, and is never popped.
 */
public final class ScopeManager {
    private static final Logger LOG = LoggerFactory.getLogger(ScopeManager.class);

    private final Deque<Scope> stack = new ArrayDeque<>();
    private final DiagnosticSink sink;

    public ScopeManager(DiagnosticSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
        enterScope();
        declareBuiltIns();
    }

    private void declareBuiltIns() {
        declare("cout", SymbolKind.STD, "ostream", false, SourceLocation.UNKNOWN);
        declare("cin", SymbolKind.STD, "istream", false, SourceLocation.UNKNOWN);
        declare("cerr", SymbolKind.STD, "ostream", false, SourceLocation.UNKNOWN);
        declare("endl", SymbolKind.STD, "manipulator", false, SourceLocation.UNKNOWN);
        for (var container : new String[] {"string", "vector", "map", "set", "list"}) {
            declare(container, SymbolKind.STD, "type", false, SourceLocation.UNKNOWN);
        }
    }

    // === Scope stack ===

    public void enterScope() {
        var parent = stack.peek();
        var scope = new Scope(stack.size(), parent);
        stack.push(scope);
        LOG.trace("Entered scope at depth {}", scope.depth());
    }

    /**
     * Pop the innermost scope. Does nothing when only the global scope remains.
     */
    public void exitScope() {
        if (stack.size() > 1) {
            var scope = stack.pop();
            LOG.trace("Exited scope at depth {} with {} bindings", scope.depth(), scope.entries().size());
        }
    }

    public int currentDepth() {
        return current().depth();
    }

    public Scope current() {
        return stack.peek();
    }

    public Scope global() {
        return stack.peekLast();
    }

    // === Declarations and lookup ===

    /**
     * Declare a name in the innermost scope.
     *
     * <p>A name already bound in the innermost scope is reported and the existing entry is
     * returned unchanged.
     */
    public Entry declare(String name, SymbolKind kind, String type, boolean constant, SourceLocation location) {
        var scope = current();
        var existing = scope.local(name);
        if (existing.isPresent()) {
            sink.report(Diagnostic.syntax(location, "redeclaration of '" + name + "' in the same scope"));
            return existing.get();
        }
        var shadowed = lookup(name).orElse(null);
        var entry = new Entry(name, kind, type, scope.depth(), constant, location, shadowed);
        scope.bind(entry);
        return entry;
    }

    /**
     * Find the innermost binding of a name.
     */
    public Optional<Entry> lookup(String name) {
        var scope = Optional.of(current());
        while (scope.isPresent()) {
            var entry = scope.get().local(name);
            if (entry.isPresent()) {
                return entry;
            }
            scope = scope.get().parent();
        }
        return Optional.empty();
    }

    /**
     * Mark the innermost binding of a name as initialized.
     *
     * @return false when the name is not bound
     */
    public boolean markInitialized(String name) {
        var found = lookup(name);
        found.ifPresent(Entry::markInitialized);
        return found.isPresent();
    }

    /**
     * Look up a name that is being used, reporting undeclared names and reads of variables
     * that were never assigned.
     */
    public Optional<Entry> require(String name, SourceLocation location) {
        var found = lookup(name);
        if (found.isEmpty()) {
            sink.report(Diagnostic.syntax(location, "use of undeclared identifier '" + name + "'"));
            return found;
        }
        var entry = found.get();
        if (!entry.isInitialized() && !entry.kind().isBuiltIn()) {
            sink.report(Diagnostic.warning(Diagnostic.Phase.SYNTAX, location,
                                           "use of uninitialized variable '" + name + "'"));
        }
        return found;
    }
}

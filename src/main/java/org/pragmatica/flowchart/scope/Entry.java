package org.pragmatica.flowchart.scope;

import org.pragmatica.flowchart.tree.SourceLocation;

import java.util.Optional;

/**
 * Symbol table entry.
 *
 * <p>Only the {@code initialized} flag is mutable, and it only ever goes from false to true.
 * The shadowed entry belongs to an enclosing scope; it is kept for diagnostics and may outlive
 * that scope's presence on the stack.
 */
public final class Entry {
    private final String name;
    private final SymbolKind kind;
    private final String type;
    private final int scopeDepth;
    private final boolean constant;
    private final SourceLocation declaredAt;
    private final Entry shadowed;
    private boolean initialized;

    Entry(String name,
          SymbolKind kind,
          String type,
          int scopeDepth,
          boolean constant,
          SourceLocation declaredAt,
          Entry shadowed) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.scopeDepth = scopeDepth;
        this.constant = constant;
        this.declaredAt = declaredAt;
        this.shadowed = shadowed;
        this.initialized = kind.isBuiltIn();
    }

    public String name() {
        return name;
    }

    public SymbolKind kind() {
        return kind;
    }

    public String type() {
        return type;
    }

    public int scopeDepth() {
        return scopeDepth;
    }

    public boolean isConstant() {
        return constant;
    }

    public SourceLocation declaredAt() {
        return declaredAt;
    }

    public Optional<Entry> shadowed() {
        return Optional.ofNullable(shadowed);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void markInitialized() {
        initialized = true;
    }

    @Override
    public String toString() {
        return name + ":" + type + " (kind=" + kind + ", depth=" + scopeDepth
               + ", const=" + constant + ", init=" + initialized + ")";
    }
}

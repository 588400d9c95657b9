package org.pragmatica.flowchart.scope;

/**
 * Kinds of symbol table entries.
 */
public enum SymbolKind {
    VAR,
    FUNC,
    /**
     * Reserved for function parameters, which the parser does not bind.
     */
    PARAM,
    TYPE,
    STD;

    /**
     * Built-in kinds are always considered initialized.
     */
    public boolean isBuiltIn() {
        return this == TYPE || this == STD;
    }
}

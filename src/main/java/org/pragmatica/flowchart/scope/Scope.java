package org.pragmatica.flowchart.scope;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One lexical scope: its bindings and a link to the enclosing scope.
 */
public final class Scope {
    private final int depth;
    private final Scope parent;
    private final Map<String, Entry> bindings = new HashMap<>();

    Scope(int depth, Scope parent) {
        this.depth = depth;
        this.parent = parent;
    }

    public int depth() {
        return depth;
    }

    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    public Optional<Entry> local(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    void bind(Entry entry) {
        bindings.put(entry.name(), entry);
    }
}

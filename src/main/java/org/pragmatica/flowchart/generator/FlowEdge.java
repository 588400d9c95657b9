package org.pragmatica.flowchart.generator;

import java.util.Optional;

/**
 * Directed edge between two nodes, optionally labeled ("yes" / "no" out of decisions).
 */
public record FlowEdge(String from, String to, Optional<String> label) {

    public static FlowEdge between(String from, String to) {
        return new FlowEdge(from, to, Optional.empty());
    }

    public static FlowEdge labeled(String from, String to, String label) {
        return new FlowEdge(from, to, Optional.of(label));
    }
}

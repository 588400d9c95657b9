package org.pragmatica.flowchart.generator;

/**
 * A flowchart node.
 *
 * @param id    unique identifier within the graph, {@code n0}, {@code n1}, ...
 * @param shape flowchart symbol
 * @param label text shown in the node
 */
public record FlowNode(String id, NodeShape shape, String label) {
}

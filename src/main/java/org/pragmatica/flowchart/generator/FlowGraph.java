package org.pragmatica.flowchart.generator;

import java.util.List;
import java.util.Optional;

/**
 * Immutable flowchart graph. Nodes and edges are kept in emission order, which is the order
 * renderers write them in.
 */
public record FlowGraph(String name, List<FlowNode> nodes, List<FlowEdge> edges) {
    public FlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<FlowNode> node(String id) {
        return nodes.stream()
                    .filter(node -> node.id().equals(id))
                    .findFirst();
    }

    public List<FlowNode> nodesOf(NodeShape shape) {
        return nodes.stream()
                    .filter(node -> node.shape() == shape)
                    .toList();
    }

    public List<FlowEdge> outgoing(String id) {
        return edges.stream()
                    .filter(edge -> edge.from().equals(id))
                    .toList();
    }

    public List<FlowEdge> incoming(String id) {
        return edges.stream()
                    .filter(edge -> edge.to().equals(id))
                    .toList();
    }
}

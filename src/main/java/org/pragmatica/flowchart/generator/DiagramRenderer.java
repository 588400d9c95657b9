package org.pragmatica.flowchart.generator;

/**
 * Serializes a {@link FlowGraph} into diagram text. Implementations are stateless.
 */
public interface DiagramRenderer {
    String render(FlowGraph graph);
}

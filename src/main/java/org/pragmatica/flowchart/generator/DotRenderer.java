package org.pragmatica.flowchart.generator;

/**
 * Renders a flowchart as a Graphviz DOT digraph.
 *
 * <p>Edge labels are attached to the tail of the edge so that "yes"/"no" sit next to the
 * decision node they leave.
 */
public final class DotRenderer implements DiagramRenderer {
    private static final String INDENT = "    ";

    @Override
    public String render(FlowGraph graph) {
        var sb = new StringBuilder();
        sb.append("digraph \"").append(escape(graph.name())).append("\" {\n");
        sb.append(INDENT).append("graph [rankdir=TB, nodesep=0.5, ranksep=0.5];\n");
        sb.append(INDENT).append("node [fontname=\"Helvetica\", fontsize=10];\n");
        sb.append(INDENT).append("edge [fontname=\"Helvetica\", fontsize=9, arrowhead=normal];\n");
        sb.append("\n");

        for (var node : graph.nodes()) {
            sb.append(INDENT)
              .append(node.id())
              .append(" [label=\"").append(escape(node.label())).append("\", ")
              .append(shapeAttributes(node.shape()))
              .append("];\n");
        }
        if (!graph.edges().isEmpty()) {
            sb.append("\n");
        }
        for (var edge : graph.edges()) {
            sb.append(INDENT).append(edge.from()).append(" -> ").append(edge.to());
            edge.label().ifPresent(label -> sb.append(" [taillabel=\"")
                                              .append(escape(label))
                                              .append("\", labeldistance=2.0, labelangle=30]"));
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String shapeAttributes(NodeShape shape) {
        return switch (shape) {
            case TERMINATOR -> "shape=ellipse";
            case PROCESS -> "shape=box";
            case IO -> "shape=parallelogram";
            case DECISION -> "shape=diamond";
            case LOOP_PREP -> "shape=hexagon";
            case CALL -> "shape=box, peripheries=2";
        };
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\")
                   .replace("\"", "\\\"")
                   .replace("\n", "\\n");
    }
}

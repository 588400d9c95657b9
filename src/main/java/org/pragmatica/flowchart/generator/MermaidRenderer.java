package org.pragmatica.flowchart.generator;

/**
 * Renders a flowchart as Mermaid {@code flowchart TD} markup.
 */
public final class MermaidRenderer implements DiagramRenderer {
    private static final String INDENT = "    ";

    @Override
    public String render(FlowGraph graph) {
        var sb = new StringBuilder();
        sb.append("---\n");
        sb.append("title: ").append(graph.name().replace('\n', ' ')).append("\n");
        sb.append("---\n");
        sb.append("flowchart TD\n");

        for (var node : graph.nodes()) {
            sb.append(INDENT).append(node.id()).append(shaped(node.shape(), quote(node.label()))).append("\n");
        }
        for (var edge : graph.edges()) {
            sb.append(INDENT).append(edge.from()).append(" -->");
            edge.label().ifPresent(label -> sb.append("|").append(quote(label)).append("|"));
            sb.append(" ").append(edge.to()).append("\n");
        }
        return sb.toString();
    }

    static String shaped(NodeShape shape, String text) {
        return switch (shape) {
            case TERMINATOR -> "([" + text + "])";
            case PROCESS -> "[" + text + "]";
            case IO -> "[/" + text + "/]";
            case DECISION -> "{" + text + "}";
            case LOOP_PREP -> "{{" + text + "}}";
            case CALL -> "[[" + text + "]]";
        };
    }

    static String quote(String text) {
        return "\"" + text.replace("\"", "#quot;").replace("\n", " ") + "\"";
    }
}

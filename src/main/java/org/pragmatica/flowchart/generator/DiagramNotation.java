package org.pragmatica.flowchart.generator;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Output notation for flowcharts.
 */
public enum DiagramNotation {
    /**
     * Graphviz DOT with per-node shape attributes.
     */
    DOT("dot", new DotRenderer()),
    /**
     * Mermaid flowchart markup.
     */
    MERMAID("mermaid", new MermaidRenderer());

    private final String displayName;
    private final DiagramRenderer renderer;

    DiagramNotation(String displayName, DiagramRenderer renderer) {
        this.displayName = displayName;
        this.renderer = renderer;
    }

    public String displayName() {
        return displayName;
    }

    public DiagramRenderer renderer() {
        return renderer;
    }

    public static Optional<DiagramNotation> fromName(String name) {
        var normalized = name.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                     .filter(notation -> notation.displayName.equals(normalized))
                     .findFirst();
    }
}

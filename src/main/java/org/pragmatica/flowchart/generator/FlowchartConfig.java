package org.pragmatica.flowchart.generator;

/**
 * Flowchart synthesis options.
 *
 * @param startLabel label of the entry terminator
 * @param endLabel   label of the exit terminator
 * @param yesLabel   label of the first edge out of a decision
 * @param noLabel    label of the second edge out of a decision
 */
public record FlowchartConfig(
    String startLabel,
    String endLabel,
    String yesLabel,
    String noLabel
) {
    public static final FlowchartConfig DEFAULT = new FlowchartConfig(
        "Start",
        "End",
        "yes",
        "no"
    );
}

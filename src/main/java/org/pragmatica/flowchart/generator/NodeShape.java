package org.pragmatica.flowchart.generator;

/**
 * Flowchart symbol of a node, after GOST 19.701 / ISO 5807.
 */
public enum NodeShape {
    /**
     * Start or end of the program.
     */
    TERMINATOR,
    /**
     * Computation or assignment.
     */
    PROCESS,
    /**
     * Statement that reads or writes data.
     */
    IO,
    /**
     * Branch point with "yes" and "no" exits.
     */
    DECISION,
    /**
     * Loop initialization or update.
     */
    LOOP_PREP,
    /**
     * Predefined process: entry into a function.
     */
    CALL
}

package org.pragmatica.flowchart.error;

import org.pragmatica.flowchart.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic produced by one of the analysis phases.
 *
 * <p>Example output of {@link #format(String, String)}:
 * <pre>
 * error: cannot assign to const variable 'c'
 *   --> main.cpp:3:7
 *    |
 *  3 |     c = 10;
 *    |       ^
 *    |
 * </pre>
 *
 * @param severity Severity level
 * @param phase    Phase that reported the diagnostic
 * @param location Source position, or {@link SourceLocation#UNKNOWN}
 * @param message  Primary message
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    Phase phase,
    SourceLocation location,
    String message,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * Analysis phase that produced a diagnostic.
     */
    public enum Phase {
        LEXICAL("lexical"),
        SYNTAX("syntax");

        private final String display;

        Phase(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(Phase phase, SourceLocation location, String message) {
        return new Diagnostic(Severity.ERROR, phase, location, message, List.of());
    }

    public static Diagnostic warning(Phase phase, SourceLocation location, String message) {
        return new Diagnostic(Severity.WARNING, phase, location, message, List.of());
    }

    public static Diagnostic lexical(SourceLocation location, String message) {
        return error(Phase.LEXICAL, location, message);
    }

    public static Diagnostic syntax(SourceLocation location, String message) {
        return error(Phase.SYNTAX, location, message);
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, phase, location, message, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public int line() {
        return location.line();
    }

    public int column() {
        return location.column();
    }

    /**
     * Format this diagnostic with a source excerpt and a caret under the reported column.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        sb.append(severity.display()).append(": ").append(message).append("\n");

        if (!location.isKnown()) {
            appendNotes(sb, 1);
            return sb.toString();
        }

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(location.line()).append(":").append(location.column()).append("\n");

        var lines = source.split("\n", -1);
        int gutterWidth = String.valueOf(location.line()).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (location.line() <= lines.length) {
            var lineContent = lines[location.line() - 1];
            var lineNumStr = String.format("%" + gutterWidth + "d", location.line());
            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(Math.max(0, location.column() - 1)))
              .append("^\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        appendNotes(sb, gutterWidth);
        return sb.toString();
    }

    private void appendNotes(StringBuilder sb, int gutterWidth) {
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
    }

    /**
     * Single-line format, e.g. {@code syntax error at 3:7 - cannot assign to const variable 'c'}.
     */
    public String formatSimple() {
        return String.format("%s %s at %s - %s", phase.display(), severity.display(), location, message);
    }
}

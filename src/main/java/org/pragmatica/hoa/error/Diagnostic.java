package org.pragmatica.hoa.error;

import org.pragmatica.hoa.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Rich rendering of a {@link ParseError} against the source it came from.
 *
 * <p>Example output:
 * <pre>
 * error[E0002]: Necessary token --END-- is missing in end of automaton at line 9, column 1
 *   --> automaton.hoa:9:1
 *    |
 *  9 | State: 1 [t] 1
 *    | ^
 *    |
 *    = help: every automaton body is closed by --END--
 * </pre>
 *
 * @param code     Error code of the underlying error
 * @param message  Primary error message
 * @param location Location the caret points at
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(String code, String message, SourceLocation location, List<String> notes) {

    /**
     * Create a diagnostic from a parse error.
     */
    public static Diagnostic of(ParseError error) {
        return new Diagnostic(error.code(), error.message(), error.location(), List.of());
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, location, List.copyOf(newNotes));
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic with the offending source line.
     *
     * @param source   The source text
     * @param filename Optional filename for display, may be {@code null}
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        int lineNumber = location.line() + 1;
        int columnNumber = location.column() + 1;

        sb.append("error[").append(code).append("]: ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(lineNumber).append(":").append(columnNumber).append("\n");

        int gutterWidth = String.valueOf(lineNumber).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        if (location.line() < lines.length) {
            var lineContent = stripCarriageReturn(lines[location.line()]);
            sb.append(String.format("%" + gutterWidth + "d", lineNumber))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(" ".repeat(location.column()))
              .append("^\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return String.format("%s:%d:%d: error[%s]: %s",
                             "input", location.line() + 1, location.column() + 1, code, message);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}

package org.sasslite.sass;

/**
 * Exception thrown when an indented style sheet cannot be parsed.
 *
 * Errors raised deep inside the parser usually know only their line (and, for
 * script errors, their column). {@link SassEngine} is the single place that adds
 * the filename, a fallback line number and the full template before rethrowing.
 */
public class SassSyntaxException extends RuntimeException {

    private final String rawMessage;
    private final int line;
    private final int column;
    private final String filename;
    private final String template;
    private final int firstLine;

    public SassSyntaxException(String message) {
        this(message, -1, -1, null, null, 1);
    }

    public SassSyntaxException(String message, int line) {
        this(message, line, -1, null, null, 1);
    }

    public SassSyntaxException(String message, int line, int column) {
        this(message, line, column, null, null, 1);
    }

    private SassSyntaxException(String message, int line, int column, String filename, String template,
            int firstLine) {
        super(format(message, line, column, filename));
        this.rawMessage = message;
        this.line = line;
        this.column = column;
        this.filename = filename;
        this.template = template;
        this.firstLine = firstLine;
    }

    private static String format(String message, int line, int column, String filename) {
        if (line < 0) {
            return filename == null ? message : filename + ": " + message;
        }
        StringBuilder sb = new StringBuilder("line ").append(line);
        if (column >= 0) {
            sb.append(':').append(column);
        }
        if (filename != null) {
            sb.append(" of ").append(filename);
        }
        return sb.append(": ").append(message).toString();
    }

    /**
     * Returns a copy of this exception carrying the given context. A line number
     * already known to this exception is kept; {@code fallbackLine} is used only
     * when the error was raised without one.
     */
    public SassSyntaxException withContext(String filename, int fallbackLine, String template) {
        return withContext(filename, fallbackLine, template, 1);
    }

    /**
     * @param firstLine Line number of the first template line, as given by
     *                  {@link SassOptions#line()}
     */
    public SassSyntaxException withContext(String filename, int fallbackLine, String template, int firstLine) {
        SassSyntaxException enriched = new SassSyntaxException(
                rawMessage,
                hasLine() ? line : fallbackLine,
                column,
                filename != null ? filename : this.filename,
                template,
                firstLine);
        enriched.setStackTrace(getStackTrace());
        return enriched;
    }

    /**
     * The message without location information.
     */
    public String getRawMessage() {
        return rawMessage;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getFilename() {
        return filename;
    }

    public String getTemplate() {
        return template;
    }

    public boolean hasLine() {
        return line >= 0;
    }

    /**
     * Renders the template lines around the error, marking the offending line
     * with {@code >}. Line numbers are the ones reported by the parser, so the
     * first template line is numbered with the starting line given to
     * {@link #withContext(String, int, String, int)}.
     *
     * @param radius Number of lines to show on each side of the error line
     * @return The context snippet, or an empty string when no template or line is known
     */
    public String sourceContext(int radius) {
        if (template == null || !hasLine()) {
            return "";
        }
        String[] lines = template.split("\r\n|\r|\n", -1);
        int errorIndex = line - firstLine;
        if (errorIndex < 0 || errorIndex >= lines.length) {
            return "";
        }
        int from = Math.max(0, errorIndex - radius);
        int to = Math.min(lines.length - 1, errorIndex + radius);
        int width = String.valueOf(to + firstLine).length();

        StringBuilder sb = new StringBuilder();
        for (int i = from; i <= to; i++) {
            sb.append(i == errorIndex ? "> " : "  ")
                    .append(String.format("%" + width + "d", i + firstLine))
                    .append(": ")
                    .append(lines[i])
                    .append('\n');
        }
        return sb.toString();
    }
}

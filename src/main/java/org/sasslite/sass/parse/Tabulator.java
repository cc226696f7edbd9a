package org.sasslite.sass.parse;

import org.sasslite.sass.SassOptions;
import org.sasslite.sass.SassSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a template into a flat list of {@link Line}s with their depth.
 *
 * <p>The indentation unit is taken from the first indented line. Every later
 * indentation must be a whole number of units. Lines following a comment that
 * are indented below it are folded into the comment's text instead of becoming
 * lines of their own; blank lines inside a comment are kept as empty comment
 * lines.
 */
public final class Tabulator {

    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^[ \\t\\f\\u000B]*");
    private static final Pattern BLANK = Pattern.compile("^[ \\t\\f\\u000B]*$");

    private final String filename;
    private final int firstLine;

    public Tabulator(SassOptions options) {
        this.filename = options.filename();
        this.firstLine = options.line();
    }

    /**
     * Tabulates the entire template.
     *
     * @return Lines in source order, all without children
     * @throws SassSyntaxException on inconsistent indentation
     */
    public List<Line> tabulate(String template) {
        List<PendingLine> lines = new ArrayList<>();
        String indentUnit = null;
        String commentIndent = null;
        boolean first = true;

        String[] rawLines = template.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        for (int i = 0; i < rawLines.length; i++) {
            String raw = rawLines[i];
            int index = firstLine + i;
            PendingLine last = lines.isEmpty() ? null : lines.get(lines.size() - 1);

            if (BLANK.matcher(raw).matches()) {
                if (last != null && last.isComment()) {
                    last.append("");
                }
                continue;
            }

            String lineIndent = leadingWhitespace(raw);
            if (!lineIndent.isEmpty()) {
                if (indentUnit == null) {
                    // No unit yet: any indentation below a comment continues it
                    if (commentIndent == null) {
                        commentIndent = lineIndent;
                    }
                    if (tryComment(raw, last, "", commentIndent, index)) {
                        continue;
                    }
                    commentIndent = null;
                    indentUnit = lineIndent;
                }

                if (first) {
                    throw new SassSyntaxException("Indenting at the beginning of the document is illegal.", index);
                }
                if (indentUnit.indexOf(' ') >= 0 && indentUnit.indexOf('\t') >= 0) {
                    throw new SassSyntaxException("Indentation can't use both tabs and spaces.", index);
                }
            }
            first = false;

            if (indentUnit == null) {
                commentIndent = null;
                lines.add(new PendingLine(content(raw, lineIndent, index), 0, index, 0));
                continue;
            }

            if (commentIndent == null) {
                commentIndent = lineIndent;
            }
            String expected = last == null ? "" : indentUnit.repeat(last.depth + 1);
            if (tryComment(raw, last, expected, commentIndent, index)) {
                continue;
            }
            commentIndent = null;

            int depth = countUnits(lineIndent, indentUnit);
            if (!indentUnit.repeat(depth).equals(lineIndent)) {
                throw new SassSyntaxException("Inconsistent indentation: "
                        + Indentation.describe(lineIndent, true) + " used for indentation, "
                        + "but the rest of the document was indented using "
                        + Indentation.describe(indentUnit) + ".", index);
            }

            lines.add(new PendingLine(content(raw, lineIndent, index), depth, index, lineIndent.length()));
        }

        List<Line> result = new ArrayList<>(lines.size());
        for (PendingLine pending : lines) {
            result.add(pending.toLine(filename));
        }
        return result;
    }

    /**
     * Folds {@code raw} into the previous line if that line is a comment and
     * {@code raw} is indented at least {@code expected}. All continuation lines of
     * one comment must share the indentation of the first one.
     */
    private static boolean tryComment(String raw, PendingLine last, String expected, String commentIndent,
            int index) {
        if (last == null || !last.isComment()) {
            return false;
        }
        if (!raw.startsWith(expected)) {
            return false;
        }
        if (!raw.startsWith(commentIndent)) {
            throw new SassSyntaxException("Inconsistent indentation: "
                    + "previous line was indented by " + Indentation.describe(commentIndent)
                    + ", but this line was indented by " + Indentation.describe(leadingWhitespace(raw)) + ".",
                    index);
        }
        last.append(raw.substring(commentIndent.length()));
        return true;
    }

    /**
     * The line without its indentation and trailing whitespace. Indentation is
     * spaces and tabs only; any other whitespace before the text is an error.
     */
    private static String content(String raw, String lineIndent, int index) {
        String text = raw.substring(lineIndent.length());
        char first = text.charAt(0);
        if (Character.isWhitespace(first) || Character.isSpaceChar(first)) {
            throw new SassSyntaxException(String.format(
                    "Invalid indentation character U+%04X: indent with spaces or tabs.", (int) first), index);
        }
        return text.stripTrailing();
    }

    private static String leadingWhitespace(String raw) {
        Matcher m = LEADING_WHITESPACE.matcher(raw);
        return m.find() ? m.group() : "";
    }

    private static int countUnits(String indentation, String unit) {
        int count = 0;
        int from = 0;
        int found;
        while ((found = indentation.indexOf(unit, from)) >= 0) {
            count++;
            from = found + unit.length();
        }
        return count;
    }

    /**
     * Line under construction; only comments grow after being added.
     */
    private static final class PendingLine {
        private final StringBuilder text;
        private final int depth;
        private final int sourceLine;
        private final int indentWidth;

        PendingLine(String text, int depth, int sourceLine, int indentWidth) {
            this.text = new StringBuilder(text);
            this.depth = depth;
            this.sourceLine = sourceLine;
            this.indentWidth = indentWidth;
        }

        boolean isComment() {
            return Line.isComment(text);
        }

        void append(String continuation) {
            text.append('\n').append(continuation);
        }

        Line toLine(String filename) {
            return new Line(text.toString(), depth, sourceLine, indentWidth, filename);
        }
    }
}

package org.sasslite.sass.parse;

import java.util.List;
import java.util.Objects;

/**
 * One logical line of an indented style sheet.
 *
 * @param text        The line without leading/trailing whitespace. A multi-line
 *                    comment carries its continuation lines joined with {@code \n}.
 * @param depth       Nesting level, counted in indentation units
 * @param sourceLine  Line number in the template
 * @param indentWidth Number of leading whitespace characters before {@code text}
 * @param filename    Source file name, may be null
 * @param children    Lines nested directly below this one
 */
public record Line(String text, int depth, int sourceLine, int indentWidth, String filename, List<Line> children) {

    public Line {
        Objects.requireNonNull(text, "Line text cannot be null");
        if (depth < 0) {
            throw new IllegalArgumentException("Depth cannot be negative: " + depth);
        }
        children = List.copyOf(children);
    }

    public Line(String text, int depth, int sourceLine, int indentWidth, String filename) {
        this(text, depth, sourceLine, indentWidth, filename, List.of());
    }

    public Line withChildren(List<Line> children) {
        return new Line(text, depth, sourceLine, indentWidth, filename, children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * @return true when the text opens a silent ({@code //}) or loud ({@code /*}) comment
     */
    public boolean isComment() {
        return isComment(text);
    }

    static boolean isComment(CharSequence text) {
        return text.length() > 1
                && text.charAt(0) == LineClassifier.COMMENT_CHAR
                && (text.charAt(1) == LineClassifier.SILENT_COMMENT_CHAR
                        || text.charAt(1) == LineClassifier.LOUD_COMMENT_CHAR);
    }
}

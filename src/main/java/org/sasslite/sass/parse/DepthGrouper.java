package org.sasslite.sass.parse;

import org.sasslite.sass.SassSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Nests a flat list of tabulated lines by depth: the children of a line are the
 * run of following lines exactly one level deeper, grouped the same way.
 */
public final class DepthGrouper {

    /**
     * Deepest nesting level accepted. Keeps grouping and tree assembly, which
     * both recurse once per level, well inside the default thread stack.
     */
    public static final int MAX_DEPTH = 256;

    private final List<Line> lines;
    private int position;

    public DepthGrouper(List<Line> lines) {
        this.lines = lines;
    }

    /**
     * @return The top-level lines with their children attached
     * @throws SassSyntaxException if a line is indented more than one level
     *                             deeper than its parent
     */
    public List<Line> group() {
        position = 0;
        if (lines.isEmpty()) {
            return List.of();
        }
        return groupRun();
    }

    private List<Line> groupRun() {
        int base = lines.get(position).depth();
        List<Line> nodes = new ArrayList<>();

        while (position < lines.size()) {
            Line line = lines.get(position);
            if (line.depth() < base) {
                break;
            }

            if (line.depth() > base) {
                if (line.depth() > base + 1) {
                    throw new SassSyntaxException("The line was indented " + (line.depth() - base)
                            + " levels deeper than the previous line.", line.sourceLine());
                }
                if (line.depth() > MAX_DEPTH) {
                    throw new SassSyntaxException("Nesting is too deep: more than " + MAX_DEPTH + " levels.",
                            line.sourceLine());
                }
                Line parent = nodes.remove(nodes.size() - 1);
                nodes.add(parent.withChildren(groupRun()));
            } else {
                nodes.add(line);
                position++;
            }
        }
        return nodes;
    }
}

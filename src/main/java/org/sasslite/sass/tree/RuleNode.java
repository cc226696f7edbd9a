package org.sasslite.sass.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A selector block.
 *
 * <p>{@code rules} holds the selector lines as written. A header split over
 * several lines with trailing commas
 *
 * <pre>
 * a,
 * b
 *   color: red
 * </pre>
 *
 * becomes one node with rules {@code ["a,", "b"]}; {@link #selectors()} gives
 * the individual selectors {@code ["a", "b"]}.
 */
public record RuleNode(List<String> rules, List<SassNode> children, int line, String filename)
        implements SassNode {

    public RuleNode {
        Objects.requireNonNull(rules, "Rules cannot be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("A rule needs at least one selector line");
        }
        rules = List.copyOf(rules);
        children = List.copyOf(children);
    }

    public RuleNode(String rule, List<SassNode> children, int line, String filename) {
        this(List.of(rule), children, line, filename);
    }

    /**
     * @return true when the last selector line ends in a comma, i.e. the
     *         selector list continues on the next line
     */
    public boolean continued() {
        return rules.get(rules.size() - 1).endsWith(",");
    }

    /**
     * @return The comma-separated selectors of all rule lines, trimmed. Commas
     *         inside parentheses, brackets or quotes, as in {@code a:not(.b, .c)},
     *         do not separate selectors.
     */
    public List<String> selectors() {
        List<String> selectors = new ArrayList<>();
        for (String rule : rules) {
            splitSelectors(rule, selectors);
        }
        return selectors;
    }

    private static void splitSelectors(String rule, List<String> out) {
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < rule.length(); i++) {
            char c = rule.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (c == ',' && depth == 0) {
                addSelector(rule.substring(start, i), out);
                start = i + 1;
            }
        }
        addSelector(rule.substring(start), out);
    }

    private static void addSelector(String selector, List<String> out) {
        String trimmed = selector.trim();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }

    /**
     * Joins a following rule onto this continued one. The result keeps this
     * node's position and takes the other node's children.
     */
    public RuleNode merge(RuleNode next) {
        List<String> merged = new ArrayList<>(rules);
        merged.addAll(next.rules);
        return new RuleNode(merged, next.children, line, filename);
    }
}

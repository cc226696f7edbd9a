package org.sasslite.sass.parse;

import org.sasslite.sass.SassOptions;
import org.sasslite.sass.SassSyntaxException;
import org.sasslite.sass.SassWarning;
import org.sasslite.sass.WarningHandler;
import org.sasslite.sass.script.ScriptParser;
import org.sasslite.sass.tree.ImportNode;
import org.sasslite.sass.tree.MixinDefinitionNode;
import org.sasslite.sass.tree.RootNode;
import org.sasslite.sass.tree.RuleNode;
import org.sasslite.sass.tree.SassNode;

import java.util.List;

/**
 * Builds the syntax tree from grouped lines, top-down.
 *
 * <p>Besides parsing each line, the assembler joins selector lists continued
 * over several lines with trailing commas, rejects mixin definitions and
 * imports below the document root, and warns about rules with an empty body.
 */
public final class TreeAssembler {

    private final SassOptions options;
    private final WarningHandler warnings;
    private final LineParser lineParser;
    private int currentLine = -1;

    public TreeAssembler(SassOptions options, ScriptParser scriptParser, WarningHandler warnings) {
        this.options = options;
        this.warnings = warnings;
        this.lineParser = new LineParser(options, scriptParser, this);
    }

    /**
     * @param topLevel The grouped lines at depth 0
     * @param template The source the lines came from
     */
    public RootNode assemble(List<Line> topLevel, String template) {
        return new RootNode(template, appendChildren(topLevel, true), options);
    }

    /**
     * @return The line being parsed when assembly stopped, or -1 before the first line
     */
    public int currentLine() {
        return currentLine;
    }

    List<SassNode> assembleChildren(List<Line> lines) {
        return appendChildren(lines, false);
    }

    private List<SassNode> appendChildren(List<Line> lines, boolean root) {
        Siblings siblings = new Siblings();
        RuleNode continuedRule = null;

        for (Line line : lines) {
            currentLine = line.sourceLine();
            List<SassNode> nodes = lineParser.parse(line, siblings);
            SassNode child = nodes.size() == 1 ? nodes.get(0) : null;

            if (child instanceof RuleNode rule && rule.continued()) {
                if (!rule.children().isEmpty()) {
                    throw new SassSyntaxException("Rules can't end in commas.", rule.line());
                }
                continuedRule = continuedRule == null ? rule : continuedRule.merge(rule);
                continue;
            }

            if (continuedRule != null) {
                if (!(child instanceof RuleNode last)) {
                    throw new SassSyntaxException("Rules can't end in commas.", continuedRule.line());
                }
                nodes = List.of(continuedRule.merge(last));
                continuedRule = null;
            }

            for (SassNode node : nodes) {
                checkForNoChildren(node);
                validateAndAppend(siblings, node, line, root);
            }
        }

        if (continuedRule != null) {
            throw new SassSyntaxException("Rules can't end in commas.", continuedRule.line());
        }
        return siblings.toList();
    }

    private static void validateAndAppend(Siblings siblings, SassNode node, Line line, boolean root) {
        if (!root) {
            if (node instanceof MixinDefinitionNode) {
                throw new SassSyntaxException("Mixins may only be defined at the root of a document.",
                        line.sourceLine());
            }
            if (node instanceof ImportNode) {
                throw new SassSyntaxException("Import directives may only be used at the root of a document.",
                        line.sourceLine());
            }
        }
        siblings.add(node);
    }

    private void checkForNoChildren(SassNode node) {
        if (!(node instanceof RuleNode rule) || !rule.children().isEmpty()) {
            return;
        }
        String message;
        if (rule.rules().size() == 1) {
            message = "Selector \"" + rule.rules().get(0) + "\" doesn't have any properties and will not be rendered.";
        } else {
            message = "Selector\n  " + String.join("\n  ", rule.rules())
                    + "\ndoesn't have any properties and will not be rendered.";
        }
        warnings.warn(new SassWarning(message, rule.line(), rule.filename()));
    }
}

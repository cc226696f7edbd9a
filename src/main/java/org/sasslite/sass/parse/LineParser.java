package org.sasslite.sass.parse;

import org.sasslite.sass.SassOptions;
import org.sasslite.sass.SassOptions.PropertySyntax;
import org.sasslite.sass.SassSyntaxException;
import org.sasslite.sass.script.MixinParameter;
import org.sasslite.sass.script.SassExpression;
import org.sasslite.sass.script.ScriptParser;
import org.sasslite.sass.tree.CommentNode;
import org.sasslite.sass.tree.MixinDefinitionNode;
import org.sasslite.sass.tree.MixinNode;
import org.sasslite.sass.tree.PropertyNode;
import org.sasslite.sass.tree.PropertyValue;
import org.sasslite.sass.tree.RuleNode;
import org.sasslite.sass.tree.SassNode;
import org.sasslite.sass.tree.VariableNode;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one classified line, with its nested lines, into syntax nodes.
 * Directives are handed to {@link DirectiveParser}; nested lines are assembled
 * through the owning {@link TreeAssembler}.
 */
final class LineParser {

    private static final Pattern VARIABLE = Pattern.compile(
            "^\\$([a-zA-Z_][\\w-]*)\\s*((?:\\|\\|)?=|:)\\s*(.+?)(\\s+!default)?$");
    private static final Pattern MIXIN_DEFINITION = Pattern.compile("^=\\s*([^(]+)(.*)$");
    private static final Pattern MIXIN_INCLUDE = Pattern.compile("^\\+\\s*([^(]+)(.*)$");

    private final SassOptions options;
    private final ScriptParser scriptParser;
    private final TreeAssembler assembler;
    private final LineClassifier classifier;
    private final DirectiveParser directiveParser;

    LineParser(SassOptions options, ScriptParser scriptParser, TreeAssembler assembler) {
        this.options = options;
        this.scriptParser = scriptParser;
        this.assembler = assembler;
        this.classifier = new LineClassifier(options.propertySyntax());
        this.directiveParser = new DirectiveParser(options, scriptParser, assembler);
    }

    /**
     * @param siblings Nodes already assembled under the same parent
     * @return The nodes for this line; empty when the line only extends an
     *         earlier node (an {@code @else} branch)
     */
    List<SassNode> parse(Line line, Siblings siblings) {
        String text = line.text();
        return switch (classifier.classify(text)) {
            case OLD_PROPERTY -> List.of(parseProperty(line, LineClassifier.PROPERTY_OLD, PropertyNode.Syntax.OLD));
            case NEW_PROPERTY -> List.of(parseProperty(line, LineClassifier.PROPERTY_NEW, PropertyNode.Syntax.NEW));
            case VARIABLE -> List.of(parseVariable(line));
            case COMMENT -> List.of(parseComment(line));
            case DIRECTIVE -> directiveParser.parse(line, siblings);
            case ESCAPED_RULE -> List.of(rule(line, text.substring(1)));
            case MIXIN_DEFINITION -> List.of(parseMixinDefinition(line));
            case MIXIN_INCLUDE -> List.of(parseMixinInclude(line));
            case RULE -> List.of(rule(line, text));
        };
    }

    private RuleNode rule(Line line, String selector) {
        return new RuleNode(selector, assembler.assembleChildren(line.children()), line.sourceLine(),
                line.filename());
    }

    private PropertyNode parseProperty(Line line, Pattern pattern, PropertyNode.Syntax syntax) {
        Matcher m = pattern.matcher(line.text());
        if (!m.find()) {
            throw new SassSyntaxException("Invalid property: \"" + line.text() + "\".", line.sourceLine());
        }
        checkPropertySyntax(line, syntax);

        String name = m.group(1);
        String marker = m.group(2).strip();
        String value = m.group(3);

        PropertyValue parsed;
        if (!marker.isEmpty() && marker.charAt(0) == LineClassifier.SCRIPT_CHAR) {
            parsed = new PropertyValue.Script(
                    parseScript(value, line, line.indentWidth() + m.start(3)));
        } else {
            parsed = new PropertyValue.Literal(value);
        }
        return new PropertyNode(name, parsed, syntax, assembler.assembleChildren(line.children()),
                line.sourceLine(), line.filename());
    }

    private void checkPropertySyntax(Line line, PropertyNode.Syntax syntax) {
        PropertySyntax required = options.propertySyntax();
        if (required == null || required.name().equals(syntax.name())) {
            return;
        }
        throw new SassSyntaxException("Illegal property syntax: can't use "
                + syntax.name().toLowerCase() + " syntax when property_syntax is "
                + required.name().toLowerCase() + ".", line.sourceLine());
    }

    private VariableNode parseVariable(Line line) {
        if (line.hasChildren()) {
            throw illegalNesting("variable declarations", line);
        }
        Matcher m = VARIABLE.matcher(line.text());
        if (!m.find()) {
            throw new SassSyntaxException("Invalid variable: \"" + line.text() + "\".", line.sourceLine());
        }

        boolean guarded = "||=".equals(m.group(2)) || m.group(4) != null;
        SassExpression value = parseScript(m.group(3), line, line.indentWidth() + m.start(3));
        return new VariableNode(m.group(1), value, guarded, line.sourceLine(), line.filename());
    }

    private CommentNode parseComment(Line line) {
        StringBuilder text = new StringBuilder(line.text());
        appendNestedText(text, line.children());
        // Blank lines after the last comment line separate it from what follows
        while (text.length() > 0 && text.charAt(text.length() - 1) == '\n') {
            text.setLength(text.length() - 1);
        }
        boolean silent = line.text().charAt(1) == LineClassifier.SILENT_COMMENT_CHAR;
        return new CommentNode(text.toString(), silent, line.sourceLine(), line.filename());
    }

    private static void appendNestedText(StringBuilder text, List<Line> lines) {
        for (Line nested : lines) {
            text.append('\n').append(nested.text());
            appendNestedText(text, nested.children());
        }
    }

    private MixinDefinitionNode parseMixinDefinition(Line line) {
        Matcher m = MIXIN_DEFINITION.matcher(line.text());
        if (!m.find() || m.group(1).isBlank()) {
            throw new SassSyntaxException("Invalid mixin \"" + line.text().substring(1) + "\".", line.sourceLine());
        }

        String argString = m.group(2).strip();
        int offset = line.indentWidth() + m.start(2) + m.group(2).indexOf(argString);
        List<MixinParameter> parameters = scriptParser.parseMixinDefinitionArgList(
                argString, line.sourceLine(), offset, options);
        return new MixinDefinitionNode(m.group(1).strip(), parameters,
                assembler.assembleChildren(line.children()), line.sourceLine(), line.filename());
    }

    private MixinNode parseMixinInclude(Line line) {
        Matcher m = MIXIN_INCLUDE.matcher(line.text());
        if (!m.find() || m.group(1).isBlank()) {
            throw new SassSyntaxException("Invalid mixin include \"" + line.text() + "\".", line.sourceLine());
        }

        String argString = m.group(2).strip();
        int offset = line.indentWidth() + m.start(2) + m.group(2).indexOf(argString);
        List<SassExpression> arguments = scriptParser.parseMixinIncludeArgList(
                argString, line.sourceLine(), offset, options);
        if (line.hasChildren()) {
            throw illegalNesting("mixin directives", line);
        }
        return new MixinNode(m.group(1).strip(), arguments, line.sourceLine(), line.filename());
    }

    private SassExpression parseScript(String script, Line line, int offset) {
        return scriptParser.parseExpression(script, line.sourceLine(), offset, options);
    }

    /**
     * Error for content nested under a construct that takes none, reported on
     * the first nested line.
     */
    static SassSyntaxException illegalNesting(String construct, Line line) {
        return new SassSyntaxException("Illegal nesting: Nothing may be nested beneath " + construct + ".",
                line.children().get(0).sourceLine());
    }
}

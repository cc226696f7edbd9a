package org.sasslite.sass.parse;

import org.sasslite.sass.SassOptions;
import org.sasslite.sass.SassSyntaxException;
import org.sasslite.sass.script.SassExpression;
import org.sasslite.sass.script.ScriptParser;
import org.sasslite.sass.tree.DebugNode;
import org.sasslite.sass.tree.DirectiveNode;
import org.sasslite.sass.tree.ForNode;
import org.sasslite.sass.tree.IfNode;
import org.sasslite.sass.tree.ImportNode;
import org.sasslite.sass.tree.SassNode;
import org.sasslite.sass.tree.WhileNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code @} lines: {@code @import}, {@code @for}, {@code @else},
 * {@code @while}, {@code @if} and {@code @debug}. Any other directive is kept
 * as a {@link DirectiveNode} for the renderer.
 */
final class DirectiveParser {

    private static final Pattern CSS_IMPORT = Pattern.compile("^(url\\(|\"|')");
    private static final Pattern IMPORT_SEPARATOR = Pattern.compile(",\\s*");
    private static final Pattern FOR = Pattern.compile("^(\\S+)\\s+from\\s+(.+)\\s+(to|through)\\s+(.+)$");
    private static final Pattern FOR_VARIABLE = Pattern.compile("^\\S+");
    private static final Pattern FOR_FROM = Pattern.compile("^\\S+\\s+from\\s+.+");
    private static final Pattern ELSE_IF = Pattern.compile("^if\\s+(.+)");

    private final SassOptions options;
    private final ScriptParser scriptParser;
    private final TreeAssembler assembler;

    DirectiveParser(SassOptions options, ScriptParser scriptParser, TreeAssembler assembler) {
        this.options = options;
        this.scriptParser = scriptParser;
        this.assembler = assembler;
    }

    List<SassNode> parse(Line line, Siblings siblings) {
        Directive directive = Directive.split(line);

        return switch (directive.keyword()) {
            case "import" -> directive.value() != null && CSS_IMPORT.matcher(directive.value()).find()
                    ? List.of(passThrough(line))
                    : parseImport(line, directive);
            case "for" -> List.of(parseFor(line, directive));
            case "else" -> {
                parseElse(line, directive, siblings);
                yield List.of();
            }
            case "while" -> List.of(new WhileNode(requireExpression(line, directive),
                    assembler.assembleChildren(line.children()), line.sourceLine(), line.filename()));
            case "if" -> List.of(new IfNode(requireExpression(line, directive),
                    assembler.assembleChildren(line.children()), null, line.sourceLine(), line.filename()));
            case "debug" -> List.of(parseDebug(line, directive));
            default -> List.of(passThrough(line));
        };
    }

    private DirectiveNode passThrough(Line line) {
        return new DirectiveNode(line.text(), assembler.assembleChildren(line.children()), line.sourceLine(),
                line.filename());
    }

    private List<SassNode> parseImport(Line line, Directive directive) {
        if (line.hasChildren()) {
            throw LineParser.illegalNesting("import directives", line);
        }
        if (directive.value() == null) {
            throw new SassSyntaxException("Invalid import directive '@import': expected file name.",
                    line.sourceLine());
        }

        List<SassNode> imports = new ArrayList<>();
        for (String path : IMPORT_SEPARATOR.split(directive.value())) {
            if (!path.isBlank()) {
                imports.add(new ImportNode(path.strip(), line.sourceLine(), line.filename()));
            }
        }
        return imports;
    }

    private ForNode parseFor(Line line, Directive directive) {
        String text = directive.value() == null ? "" : directive.value();
        Matcher m = FOR.matcher(text);
        if (!m.find()) {
            String expected;
            if (!FOR_VARIABLE.matcher(text).find()) {
                expected = "variable name";
            } else if (!FOR_FROM.matcher(text).find()) {
                expected = "'from <expr>'";
            } else {
                expected = "'to <expr>' or 'through <expr>'";
            }
            throw new SassSyntaxException("Invalid for directive '" + directive.source() + "': expected "
                    + expected + ".", line.sourceLine());
        }

        String variable = m.group(1);
        if (!scriptParser.isVariableName(variable)) {
            throw new SassSyntaxException("Invalid variable \"" + variable + "\".", line.sourceLine());
        }

        SassExpression from = parseScript(m.group(2), line, directive.valueOffset() + m.start(2));
        SassExpression to = parseScript(m.group(4), line, directive.valueOffset() + m.start(4));
        boolean inclusive = "through".equals(m.group(3));
        return new ForNode(variable.substring(1), from, to, inclusive,
                assembler.assembleChildren(line.children()), line.sourceLine(), line.filename());
    }

    /**
     * Attaches an {@code @else} or {@code @else if} branch to the {@code @if}
     * immediately before it. Produces no node of its own.
     */
    private void parseElse(Line line, Directive directive, Siblings siblings) {
        if (!(siblings.last() instanceof IfNode previous)) {
            throw new SassSyntaxException("@else must come after @if.", line.sourceLine());
        }

        SassExpression condition = null;
        if (directive.value() != null) {
            Matcher m = ELSE_IF.matcher(directive.value());
            if (!m.find()) {
                throw new SassSyntaxException("Invalid else directive '" + directive.source()
                        + "': expected 'if <expr>'.", line.sourceLine());
            }
            condition = parseScript(m.group(1), line, directive.valueOffset() + m.start(1));
        }

        IfNode branch = new IfNode(condition, assembler.assembleChildren(line.children()), null,
                line.sourceLine(), line.filename());
        siblings.replaceLast(previous.withElse(branch));
    }

    private DebugNode parseDebug(Line line, Directive directive) {
        SassExpression expression = requireExpression(line, directive);
        if (line.hasChildren()) {
            throw LineParser.illegalNesting("debug directives", line);
        }
        return new DebugNode(expression, line.sourceLine(), line.filename());
    }

    private SassExpression requireExpression(Line line, Directive directive) {
        if (directive.value() == null) {
            throw new SassSyntaxException("Invalid " + directive.keyword() + " directive '@" + directive.keyword()
                    + "': expected expression.", line.sourceLine());
        }
        return parseScript(directive.value(), line, directive.valueOffset());
    }

    private SassExpression parseScript(String script, Line line, int offset) {
        return scriptParser.parseExpression(script, line.sourceLine(), offset, options);
    }

    /**
     * A directive line split into keyword and value: {@code @keyword value}.
     *
     * @param valueOffset Column of the value in the source line
     */
    private record Directive(String keyword, String value, int valueOffset) {

        static Directive split(Line line) {
            String body = line.text().substring(1);
            int end = 0;
            while (end < body.length() && !Character.isWhitespace(body.charAt(end))) {
                end++;
            }
            String keyword = body.substring(0, end);

            int start = end;
            while (start < body.length() && Character.isWhitespace(body.charAt(start))) {
                start++;
            }
            String value = start < body.length() ? body.substring(start) : null;
            return new Directive(keyword, value, line.indentWidth() + 1 + start);
        }

        String source() {
            return "@" + keyword + (value == null ? "" : " " + value);
        }
    }
}

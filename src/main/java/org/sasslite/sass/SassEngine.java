package org.sasslite.sass;

import org.sasslite.sass.parse.DepthGrouper;
import org.sasslite.sass.parse.Line;
import org.sasslite.sass.parse.Tabulator;
import org.sasslite.sass.parse.TreeAssembler;
import org.sasslite.sass.script.AntlrScriptParser;
import org.sasslite.sass.script.ScriptParser;
import org.sasslite.sass.tree.RootNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Parses an indented style sheet into its syntax tree.
 *
 * <pre>
 * RootNode root = SassEngine.parse(template, SassOptions.defaults().withFilename("main.sass"));
 * </pre>
 *
 * The pipeline is: {@link Tabulator} (text to lines with depth) →
 * {@link DepthGrouper} (nesting) → {@link TreeAssembler} (lines to nodes).
 * Parse errors from any stage are rethrown from here with the filename, line
 * and template attached.
 */
public class SassEngine {

    private static final Logger log = LoggerFactory.getLogger(SassEngine.class);

    private static final ScriptParser DEFAULT_SCRIPT_PARSER = new AntlrScriptParser();

    private final String template;
    private final SassOptions options;
    private final ScriptParser scriptParser;
    private final WarningHandler warningHandler;

    public SassEngine(String template) {
        this(template, SassOptions.defaults());
    }

    public SassEngine(String template, SassOptions options) {
        this(template, options, DEFAULT_SCRIPT_PARSER, new LoggingWarningHandler());
    }

    public SassEngine(String template, SassOptions options, ScriptParser scriptParser,
            WarningHandler warningHandler) {
        this.template = Objects.requireNonNull(template, "Template cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.scriptParser = Objects.requireNonNull(scriptParser, "Script parser cannot be null");
        this.warningHandler = Objects.requireNonNull(warningHandler, "Warning handler cannot be null");
    }

    /**
     * Parses a template with the default script parser and logged warnings.
     *
     * @throws SassSyntaxException if the document is malformed
     */
    public static RootNode parse(String template, SassOptions options) {
        return new SassEngine(template, options).toTree();
    }

    /**
     * Like {@link #parse}, but reports a syntax error as a {@link ParseResult.Failure}.
     */
    public static ParseResult tryParse(String template, SassOptions options) {
        return new SassEngine(template, options).tryToTree();
    }

    /**
     * Parses the document into its syntax tree.
     *
     * @return The root of the tree
     * @throws SassSyntaxException if the document is malformed
     */
    public RootNode toTree() {
        TreeAssembler assembler = new TreeAssembler(options, scriptParser, warningHandler);
        try {
            List<Line> lines = new Tabulator(options).tabulate(template);
            List<Line> topLevel = new DepthGrouper(lines).group();
            log.debug("Tabulated {} lines into {} top-level lines for {}", lines.size(), topLevel.size(),
                    options.filename() != null ? options.filename() : "<string>");
            return assembler.assemble(topLevel, template);
        } catch (SassSyntaxException e) {
            throw e.withContext(options.filename(), assembler.currentLine(), template, options.line());
        }
    }

    public ParseResult tryToTree() {
        try {
            return new ParseResult.Success(toTree());
        } catch (SassSyntaxException e) {
            return new ParseResult.Failure(e);
        }
    }

    public SassOptions options() {
        return options;
    }
}

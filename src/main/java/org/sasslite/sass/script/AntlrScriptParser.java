package org.sasslite.sass.script;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.sasslite.sass.SassOptions;
import org.sasslite.sass.SassSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ScriptParser} backed by the ANTLR-generated SassScript grammar.
 *
 * Stateless; one instance may be shared by any number of engines.
 */
public final class AntlrScriptParser implements ScriptParser {

    @Override
    public SassExpression parseExpression(String text, int line, int offset, SassOptions options) {
        SassScriptParser parser = newParser(text, line, offset);
        SassScriptParser.SingleExpressionContext tree = parser.singleExpression();
        return new ScriptAstBuilder().visit(tree.expression());
    }

    @Override
    public List<MixinParameter> parseMixinDefinitionArgList(String text, int line, int offset,
            SassOptions options) {
        if (text.isBlank()) {
            return List.of();
        }
        SassScriptParser parser = newParser(text, line, offset);
        SassScriptParser.MixinDefinitionArgsContext tree = parser.mixinDefinitionArgs();

        ScriptAstBuilder builder = new ScriptAstBuilder();
        List<MixinParameter> parameters = new ArrayList<>();
        for (SassScriptParser.MixinParameterContext paramCtx : tree.mixinParameter()) {
            String name = paramCtx.VARIABLE().getText().substring(1);
            SassExpression defaultValue = paramCtx.spaceList() != null
                    ? builder.visit(paramCtx.spaceList())
                    : null;
            parameters.add(new MixinParameter(name, defaultValue));
        }
        return parameters;
    }

    @Override
    public List<SassExpression> parseMixinIncludeArgList(String text, int line, int offset,
            SassOptions options) {
        if (text.isBlank()) {
            return List.of();
        }
        SassScriptParser parser = newParser(text, line, offset);
        SassScriptParser.MixinIncludeArgsContext tree = parser.mixinIncludeArgs();

        ScriptAstBuilder builder = new ScriptAstBuilder();
        List<SassExpression> arguments = new ArrayList<>();
        for (SassScriptParser.SpaceListContext argCtx : tree.spaceList()) {
            arguments.add(builder.visit(argCtx));
        }
        return arguments;
    }

    private static SassScriptParser newParser(String text, int line, int offset) {
        ErrorListener errorListener = new ErrorListener(text, line, offset);

        SassScriptLexer lexer = new SassScriptLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        SassScriptParser parser = new SassScriptParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        return parser;
    }

    /**
     * Error listener that converts ANTLR errors to SassSyntaxException, shifting
     * the fragment-relative column by the fragment's offset in the source line.
     */
    private static class ErrorListener extends BaseErrorListener {

        private final String text;
        private final int line;
        private final int offset;

        ErrorListener(String text, int line, int offset) {
            this.text = text;
            this.line = line;
            this.offset = offset;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int fragmentLine, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new SassSyntaxException(
                    "Invalid script \"" + text + "\": " + msg,
                    line, offset + charPositionInLine);
        }
    }
}

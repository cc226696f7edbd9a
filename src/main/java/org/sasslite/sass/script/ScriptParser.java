package org.sasslite.sass.script;

import org.sasslite.sass.SassOptions;
import org.sasslite.sass.SassSyntaxException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for script fragments embedded in style-sheet lines: scripted property
 * values, variable assignments, directive conditions and mixin argument lists.
 *
 * <p>Every method receives the fragment together with its source line and the
 * absolute column at which the fragment starts, so errors point at the right
 * place in the template. Implementations must be free of side effects.
 */
public interface ScriptParser {

    Pattern VARIABLE_NAME = Pattern.compile("^\\$[a-zA-Z_][\\w-]*$");

    /**
     * Parses a single expression.
     *
     * @throws SassSyntaxException if the fragment is not a valid expression
     */
    SassExpression parseExpression(String text, int line, int offset, SassOptions options);

    /**
     * Parses the parenthesized parameter list of a mixin definition, e.g.
     * {@code ($color, $width = 1px)}. An empty string yields no parameters.
     *
     * @throws SassSyntaxException if the list is malformed
     */
    List<MixinParameter> parseMixinDefinitionArgList(String text, int line, int offset, SassOptions options);

    /**
     * Parses the parenthesized argument list of a mixin include, e.g.
     * {@code (red, 2px)}. An empty string yields no arguments.
     *
     * @throws SassSyntaxException if the list is malformed
     */
    List<SassExpression> parseMixinIncludeArgList(String text, int line, int offset, SassOptions options);

    /**
     * Whether {@code text} is a variable name including its introducer, e.g. {@code $i}.
     */
    default boolean isVariableName(String text) {
        return VARIABLE_NAME.matcher(text).matches();
    }
}

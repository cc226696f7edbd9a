package org.sasslite.sass.parse;

import org.sasslite.sass.SassOptions.PropertySyntax;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which syntactic form a line is, from its first character and, for
 * the ambiguous cases, the property patterns.
 */
public final class LineClassifier {

    /** Begins an old-style property. */
    public static final char PROPERTY_CHAR = ':';

    /** Marks a property value as a script expression. */
    public static final char SCRIPT_CHAR = '=';

    /** Begins a comment; the next character says which kind. */
    public static final char COMMENT_CHAR = '/';

    /** Follows {@link #COMMENT_CHAR} in a comment left out of the output. */
    public static final char SILENT_COMMENT_CHAR = '/';

    /** Follows {@link #COMMENT_CHAR} in a comment kept in the output. */
    public static final char LOUD_COMMENT_CHAR = '*';

    public static final char DIRECTIVE_CHAR = '@';

    /** Forces the rest of the line to be taken as a selector. */
    public static final char ESCAPE_CHAR = '\\';

    public static final char MIXIN_DEFINITION_CHAR = '=';

    public static final char MIXIN_INCLUDE_CHAR = '+';

    public static final char VARIABLE_CHAR = '$';

    /** Lines of the form {@code name: value}. */
    static final Pattern PROPERTY_NEW_MATCHER = Pattern.compile("^[^\\s:\"\\[]+\\s*[=:](\\s|$)");

    /** Extracts name, marker and value from {@code name: value}. */
    static final Pattern PROPERTY_NEW = Pattern.compile("^([^\\s=:\"]+)(\\s*=|:)(?:\\s+|$)(.*)");

    /** Extracts name, marker and value from {@code :name value}. */
    static final Pattern PROPERTY_OLD = Pattern.compile("^:([^\\s=:\"]+)\\s*(=?)(?:\\s+|$)(.*)");

    private final PropertySyntax propertySyntax;

    public LineClassifier(PropertySyntax propertySyntax) {
        this.propertySyntax = propertySyntax;
    }

    public LineKind classify(String text) {
        if (text.isEmpty()) {
            return LineKind.RULE;
        }
        char second = text.length() > 1 ? text.charAt(1) : 0;

        switch (text.charAt(0)) {
            case PROPERTY_CHAR:
                // "::selection", or ":hover" when old properties are not allowed
                if (second == PROPERTY_CHAR || (propertySyntax == PropertySyntax.NEW && hasEmptyOldValue(text))) {
                    return LineKind.RULE;
                }
                return LineKind.OLD_PROPERTY;
            case VARIABLE_CHAR:
                return LineKind.VARIABLE;
            case COMMENT_CHAR:
                return second == SILENT_COMMENT_CHAR || second == LOUD_COMMENT_CHAR
                        ? LineKind.COMMENT
                        : LineKind.RULE;
            case DIRECTIVE_CHAR:
                return LineKind.DIRECTIVE;
            case ESCAPE_CHAR:
                return LineKind.ESCAPED_RULE;
            case MIXIN_DEFINITION_CHAR:
                return LineKind.MIXIN_DEFINITION;
            case MIXIN_INCLUDE_CHAR:
                // A lone "+" starts a sibling selector such as "+ p"
                return second == 0 || Character.isWhitespace(second)
                        ? LineKind.RULE
                        : LineKind.MIXIN_INCLUDE;
            default:
                return PROPERTY_NEW_MATCHER.matcher(text).find() ? LineKind.NEW_PROPERTY : LineKind.RULE;
        }
    }

    private static boolean hasEmptyOldValue(String text) {
        Matcher m = PROPERTY_OLD.matcher(text);
        return m.find() && m.group(3).isEmpty();
    }
}

package org.sasslite.sass.parse;

/**
 * The syntactic form of a line, as decided by {@link LineClassifier}.
 */
public enum LineKind {
    /** {@code :name value} */
    OLD_PROPERTY,
    /** {@code name: value} */
    NEW_PROPERTY,
    /** {@code $name = expr} */
    VARIABLE,
    /** {@code // ...} or {@code /* ...} */
    COMMENT,
    /** {@code @keyword ...} */
    DIRECTIVE,
    /** {@code \selector}, a rule taken verbatim */
    ESCAPED_RULE,
    /** {@code =name(params)} */
    MIXIN_DEFINITION,
    /** {@code +name(args)} */
    MIXIN_INCLUDE,
    /** Any other line: a selector */
    RULE
}

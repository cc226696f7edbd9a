package org.sasslite.sass;

import org.sasslite.sass.tree.RootNode;

import java.util.Objects;

/**
 * Outcome of {@link SassEngine#tryParse}: either the tree or the error that
 * stopped the parse. A failed parse never yields a partial tree.
 */
public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {

    record Success(RootNode root) implements ParseResult {
        public Success {
            Objects.requireNonNull(root, "Root cannot be null");
        }
    }

    record Failure(SassSyntaxException error) implements ParseResult {
        public Failure {
            Objects.requireNonNull(error, "Error cannot be null");
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @return The tree of a successful parse
     * @throws SassSyntaxException the parse error, for a failed parse
     */
    default RootNode orElseThrow() {
        if (this instanceof Success success) {
            return success.root();
        }
        throw ((Failure) this).error();
    }
}

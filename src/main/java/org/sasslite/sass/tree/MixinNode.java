package org.sasslite.sass.tree;

import org.sasslite.sass.script.SassExpression;

import java.util.List;
import java.util.Objects;

/**
 * {@code +name(args)}: includes a mixin.
 */
public record MixinNode(String name, List<SassExpression> arguments, int line, String filename)
        implements SassNode {

    public MixinNode {
        Objects.requireNonNull(name, "Mixin name cannot be null");
        arguments = List.copyOf(arguments);
    }
}

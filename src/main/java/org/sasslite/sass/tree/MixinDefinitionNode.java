package org.sasslite.sass.tree;

import org.sasslite.sass.script.MixinParameter;

import java.util.List;
import java.util.Objects;

/**
 * {@code =name(params)}: defines a mixin whose body is this node's children.
 * Only legal at the document root.
 */
public record MixinDefinitionNode(
        String name,
        List<MixinParameter> parameters,
        List<SassNode> children,
        int line,
        String filename) implements SassNode {

    public MixinDefinitionNode {
        Objects.requireNonNull(name, "Mixin name cannot be null");
        parameters = List.copyOf(parameters);
        children = List.copyOf(children);
    }

    public Mixin toMixin() {
        return new Mixin(name, parameters, children);
    }
}

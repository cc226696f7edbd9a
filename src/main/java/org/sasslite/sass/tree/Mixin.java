package org.sasslite.sass.tree;

import org.sasslite.sass.script.MixinParameter;

import java.util.List;
import java.util.Objects;

/**
 * A mixin as handed to the evaluation stage, which adds the defining scope.
 *
 * @param name       The mixin name
 * @param parameters Parameters in declaration order, with optional defaults
 * @param body       The nodes the mixin expands to
 */
public record Mixin(String name, List<MixinParameter> parameters, List<SassNode> body) {

    public Mixin {
        Objects.requireNonNull(name, "Mixin name cannot be null");
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    public List<String> parameterNames() {
        return parameters.stream().map(MixinParameter::name).toList();
    }
}

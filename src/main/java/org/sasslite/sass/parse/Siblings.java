package org.sasslite.sass.parse;

import org.sasslite.sass.tree.SassNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The children of one parent while they are being assembled. {@code @else}
 * looks back at the last node here and replaces it with the extended
 * {@code @if}.
 */
final class Siblings {

    private final List<SassNode> nodes = new ArrayList<>();

    SassNode last() {
        return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
    }

    void add(SassNode node) {
        nodes.add(node);
    }

    void replaceLast(SassNode node) {
        if (nodes.isEmpty()) {
            throw new IllegalStateException("No node to replace");
        }
        nodes.set(nodes.size() - 1, node);
    }

    List<SassNode> toList() {
        return List.copyOf(nodes);
    }
}

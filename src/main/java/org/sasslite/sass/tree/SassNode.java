package org.sasslite.sass.tree;

import java.util.List;

/**
 * Sealed interface representing nodes of the style-sheet syntax tree.
 *
 * Type hierarchy:
 * SassNode
 * ├── RootNode (the document)
 * ├── RuleNode (selector block)
 * ├── PropertyNode (:name value / name: value)
 * ├── VariableNode ($name = expr)                   leaf
 * ├── CommentNode (// silent, /* loud)
 * ├── directives: ImportNode (leaf), ForNode, WhileNode, IfNode,
 * │               DebugNode (leaf), DirectiveNode (pass-through)
 * └── mixins: MixinDefinitionNode (=name), MixinNode (+name, leaf)
 *
 * Leaf variants have no children component at all; the parser rejects source
 * that nests lines beneath them.
 */
public sealed interface SassNode
        permits RootNode, RuleNode, PropertyNode, VariableNode, CommentNode,
        ImportNode, ForNode, WhileNode, IfNode, DebugNode, DirectiveNode,
        MixinDefinitionNode, MixinNode {

    /**
     * @return The line this node was parsed from
     */
    int line();

    /**
     * @return The source file name, or null when parsing an anonymous string
     */
    String filename();

    /**
     * @return The nested nodes, in source order. Empty for leaf variants.
     */
    default List<SassNode> children() {
        return List.of();
    }
}

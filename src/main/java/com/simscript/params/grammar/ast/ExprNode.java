package com.simscript.params.grammar.ast;

/**
 * Base type of the expression syntax tree.
 */
public interface ExprNode {

    /**
     * Offset of the node's first token in the parsed text.
     */
    int getPosition();

    <T> T accept(ExprNodeVisitor<T> visitor);
}

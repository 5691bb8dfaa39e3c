package org.javai.lambda.tree;

/**
 * Visitor interface for traversing parse trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ParseNodeVisitor<R> {

	R visitSequence(ParseNode.Sequence sequence);

	R visitGroup(ParseNode.Group group);

	R visitBinder(ParseNode.Binder binder);

	R visitLeaf(ParseNode.Leaf leaf);
}

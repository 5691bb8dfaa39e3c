package org.javai.lambda.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parse tree with a single {@link ParseNode.Sequence} root.
 */
public record ParseTree(ParseNode.Sequence root) {

	public ParseTree {
		Objects.requireNonNull(root, "root must not be null");
	}

	/**
	 * Names bound by abstractions, in the order they appear.
	 */
	public List<String> boundVariables() {
		List<String> names = new ArrayList<>();
		ParseNodeWalker.walkPreOrder(root, new ParseNodeVisitor<Void>() {
			@Override
			public Void visitSequence(ParseNode.Sequence sequence) {
				return null;
			}

			@Override
			public Void visitGroup(ParseNode.Group group) {
				return null;
			}

			@Override
			public Void visitBinder(ParseNode.Binder binder) {
				names.add(binder.variable());
				return null;
			}

			@Override
			public Void visitLeaf(ParseNode.Leaf leaf) {
				return null;
			}
		});
		return names;
	}

	/**
	 * Renders the tree with {@link ParseTreePrinter}'s default indent marker.
	 */
	@Override
	public String toString() {
		return ParseTreePrinter.print(this);
	}
}

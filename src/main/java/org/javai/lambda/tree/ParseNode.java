package org.javai.lambda.tree;

import java.util.List;
import java.util.Objects;
import org.javai.lambda.syntax.LambdaToken;

/**
 * A node of a lambda parse tree.
 * <p>
 * The tree mirrors the token sequence: brackets become {@link Group} nodes,
 * {@code \x} becomes a single {@link Binder}, identifiers become {@link Leaf}
 * nodes, and the contents of the whole input or of a bracket pair form a
 * {@link Sequence}.
 */
public sealed interface ParseNode {

	/**
	 * Display lines for this node. Binders have two (the marker and the variable).
	 */
	List<String> labelLines();

	/**
	 * Ordered child nodes; empty for leaves and binders.
	 */
	List<ParseNode> children();

	<R> R accept(ParseNodeVisitor<R> visitor);

	/**
	 * The contents of a token window. The tree root is always a sequence.
	 *
	 * @param summary the window's tokens joined for display
	 * @param children the direct children, in token order
	 */
	record Sequence(String summary, List<ParseNode> children) implements ParseNode {

		public Sequence {
			Objects.requireNonNull(summary, "summary must not be null");
			children = children != null ? List.copyOf(children) : List.of();
		}

		@Override
		public List<String> labelLines() {
			return List.of(summary);
		}

		@Override
		public <R> R accept(ParseNodeVisitor<R> visitor) {
			return visitor.visitSequence(this);
		}
	}

	/**
	 * A bracket pair. Its children are always the open-bracket leaf, the interior
	 * sequence and the close-bracket leaf, in that order.
	 *
	 * @param summary the group's tokens, brackets included, joined for display
	 * @param interior the tokens strictly between the brackets
	 */
	record Group(String summary, Sequence interior) implements ParseNode {

		public Group {
			Objects.requireNonNull(summary, "summary must not be null");
			Objects.requireNonNull(interior, "interior must not be null");
		}

		@Override
		public List<String> labelLines() {
			return List.of(summary);
		}

		@Override
		public List<ParseNode> children() {
			return List.of(new Leaf(LambdaToken.OPEN_PAREN), interior, new Leaf(LambdaToken.CLOSE_PAREN));
		}

		@Override
		public <R> R accept(ParseNodeVisitor<R> visitor) {
			return visitor.visitGroup(this);
		}
	}

	/**
	 * An abstraction binder: the {@code \} marker together with its variable.
	 */
	record Binder(String variable) implements ParseNode {

		public Binder {
			Objects.requireNonNull(variable, "variable must not be null");
		}

		@Override
		public List<String> labelLines() {
			return List.of(LambdaToken.LAMBDA.text(), variable);
		}

		@Override
		public List<ParseNode> children() {
			return List.of();
		}

		@Override
		public <R> R accept(ParseNodeVisitor<R> visitor) {
			return visitor.visitBinder(this);
		}
	}

	/**
	 * A single token: an identifier or one bracket.
	 */
	record Leaf(LambdaToken token) implements ParseNode {

		public Leaf {
			Objects.requireNonNull(token, "token must not be null");
		}

		@Override
		public List<String> labelLines() {
			return List.of(token.text());
		}

		@Override
		public List<ParseNode> children() {
			return List.of();
		}

		@Override
		public <R> R accept(ParseNodeVisitor<R> visitor) {
			return visitor.visitLeaf(this);
		}
	}
}

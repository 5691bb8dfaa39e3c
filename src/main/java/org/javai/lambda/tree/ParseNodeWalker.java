package org.javai.lambda.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.ObjIntConsumer;

/**
 * Utility class for walking parse trees. Walks keep their own work stack, so the
 * depth of a tree is not limited by the call stack.
 */
public final class ParseNodeWalker {

	private ParseNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks a tree in pre-order (node before children), visiting each node.
	 *
	 * @return the result of visiting {@code node}
	 */
	public static <R> R walkPreOrder(ParseNode node, ParseNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}
		R result = node.accept(visitor);
		for (ParseNode child : node.children()) {
			walkWithDepth(child, 1, (current, level) -> current.accept(visitor));
		}
		return result;
	}

	/**
	 * Walks a tree in pre-order, passing each node with its depth (the start node is at {@code level}).
	 */
	public static void walkWithDepth(ParseNode node, int level, ObjIntConsumer<ParseNode> consumer) {
		if (node == null) {
			return;
		}
		Deque<Pending> pending = new ArrayDeque<>();
		pending.push(new Pending(node, level));
		while (!pending.isEmpty()) {
			Pending current = pending.pop();
			consumer.accept(current.node(), current.level());
			List<ParseNode> children = current.node().children();
			for (int i = children.size() - 1; i >= 0; i--) {
				pending.push(new Pending(children.get(i), current.level() + 1));
			}
		}
	}

	private record Pending(ParseNode node, int level) {
	}
}

package org.javai.lambda.tree;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Emits a parse tree as JSON, one object per node:
 * {@code {"kind": "group", "label": "(_y_)", "children": [...]}}.
 * Binders carry a {@code variable} field, leaves a {@code token} type.
 */
public final class ParseTreeJsonEmitter {

	// every tree level is four JSON levels; tree depth is already bounded by ParseTreeBuilder
	private static final ObjectMapper mapper = new ObjectMapper(JsonFactory.builder()
			.streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
			.build());

	private ParseTreeJsonEmitter() {}

	public static ObjectNode emit(ParseTree tree) {
		return emit(tree.root());
	}

	public static ObjectNode emit(ParseNode node) {
		JsonNodeVisitor visitor = new JsonNodeVisitor();
		ObjectNode root = node.accept(visitor);
		Deque<Pending> pending = new ArrayDeque<>();
		pending.push(new Pending(node, root));
		while (!pending.isEmpty()) {
			Pending current = pending.pop();
			JsonNode children = current.json().get("children");
			if (children == null) {
				continue;
			}
			for (ParseNode child : current.node().children()) {
				ObjectNode json = child.accept(visitor);
				((ArrayNode) children).add(json);
				pending.push(new Pending(child, json));
			}
		}
		return root;
	}

	public static String emitString(ParseTree tree) {
		try {
			return mapper.writeValueAsString(emit(tree));
		} catch (JsonProcessingException e) {
			throw new UncheckedIOException("Failed to write parse tree as JSON", e);
		}
	}

	private record Pending(ParseNode node, ObjectNode json) {
	}

	/**
	 * Creates the object for a single node; children are filled in by {@link #emit(ParseNode)}.
	 */
	private static final class JsonNodeVisitor implements ParseNodeVisitor<ObjectNode> {

		@Override
		public ObjectNode visitSequence(ParseNode.Sequence sequence) {
			return withChildren(base("sequence", sequence));
		}

		@Override
		public ObjectNode visitGroup(ParseNode.Group group) {
			return withChildren(base("group", group));
		}

		@Override
		public ObjectNode visitBinder(ParseNode.Binder binder) {
			ObjectNode node = base("binder", binder);
			node.put("variable", binder.variable());
			return node;
		}

		@Override
		public ObjectNode visitLeaf(ParseNode.Leaf leaf) {
			ObjectNode node = base("leaf", leaf);
			node.put("token", leaf.token().type().name().toLowerCase(Locale.ROOT));
			return node;
		}

		private ObjectNode base(String kind, ParseNode source) {
			ObjectNode node = mapper.createObjectNode();
			node.put("kind", kind);
			node.put("label", String.join(" ", source.labelLines()));
			return node;
		}

		private ObjectNode withChildren(ObjectNode node) {
			node.putArray("children");
			return node;
		}
	}
}

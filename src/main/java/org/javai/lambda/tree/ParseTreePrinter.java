package org.javai.lambda.tree;

import java.util.Objects;

/**
 * Renders a parse tree as indented text. Each label line is prefixed by the
 * indent marker repeated once per level; children follow their parent at the
 * next level.
 * <pre>
 * \_x_(_y_)
 * ----\
 * ----x
 * ----(_y_)
 * --------(
 * --------y
 * ------------y
 * --------)
 * </pre>
 */
public class ParseTreePrinter {

	public static final String DEFAULT_INDENT_MARKER = "----";

	private final String indentMarker;

	public ParseTreePrinter() {
		this(DEFAULT_INDENT_MARKER);
	}

	public ParseTreePrinter(String indentMarker) {
		this.indentMarker = Objects.requireNonNull(indentMarker, "indentMarker must not be null");
	}

	public String render(ParseTree tree) {
		return render(tree.root(), 0);
	}

	public String render(ParseNode node, int level) {
		StringBuilder output = new StringBuilder();
		ParseNodeWalker.walkWithDepth(node, level, (current, depth) -> {
			String indent = indentMarker.repeat(depth);
			for (String line : current.labelLines()) {
				output.append(indent).append(line).append('\n');
			}
		});
		return output.toString();
	}

	/**
	 * Static convenience method using the default indent marker.
	 */
	public static String print(ParseTree tree) {
		return new ParseTreePrinter().render(tree);
	}
}

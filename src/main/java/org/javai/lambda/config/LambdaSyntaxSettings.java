package org.javai.lambda.config;

import org.javai.lambda.syntax.AssociationMode;
import org.javai.lambda.syntax.LambdaTokenizer;
import org.javai.lambda.syntax.LambdaTokens;
import org.javai.lambda.tree.ParseTreePrinter;

/**
 * Settings for tokenizing and displaying lambda expressions.
 *
 * @param associationMode name of the grouping mode ({@code none}, {@code left}, {@code right});
 *                        unknown names fall back to {@code none} with a warning
 * @param maxNestingDepth deepest allowed nesting of brackets and abstraction bodies
 * @param tokenSeparator separator used when joining tokens for display
 * @param indentMarker marker repeated once per tree level when printing
 */
public record LambdaSyntaxSettings(
		String associationMode,
		int maxNestingDepth,
		String tokenSeparator,
		String indentMarker) {

	public LambdaSyntaxSettings {
		associationMode = associationMode != null ? associationMode : "none";
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
		}
		tokenSeparator = tokenSeparator != null ? tokenSeparator : LambdaTokens.DEFAULT_SEPARATOR;
		indentMarker = indentMarker != null ? indentMarker : ParseTreePrinter.DEFAULT_INDENT_MARKER;
	}

	public static LambdaSyntaxSettings defaults() {
		return new LambdaSyntaxSettings("none", LambdaTokenizer.DEFAULT_MAX_NESTING_DEPTH,
				LambdaTokens.DEFAULT_SEPARATOR, ParseTreePrinter.DEFAULT_INDENT_MARKER);
	}

	/**
	 * Resolves the configured mode, logging a warning for unknown names.
	 */
	public AssociationMode resolvedAssociationMode() {
		return AssociationMode.parse(associationMode);
	}

	public LambdaSyntaxSettings withAssociationMode(String mode) {
		return new LambdaSyntaxSettings(mode, maxNestingDepth, tokenSeparator, indentMarker);
	}
}

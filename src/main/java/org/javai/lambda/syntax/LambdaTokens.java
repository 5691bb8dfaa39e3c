package org.javai.lambda.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for token sequences.
 */
public final class LambdaTokens {

	public static final String DEFAULT_SEPARATOR = "_";

	private LambdaTokens() {
		// Utility class - no instantiation
	}

	/**
	 * Builds a token list from display strings, e.g. {@code of("\\", "x", "(", "y", ")")}.
	 */
	public static List<LambdaToken> of(String... texts) {
		return Arrays.stream(texts).map(LambdaToken::of).collect(Collectors.toList());
	}

	/**
	 * Joins token texts with a separator, e.g. {@code \_x_(_y_)}.
	 */
	public static String join(List<LambdaToken> tokens, String separator) {
		return tokens.stream().map(LambdaToken::text).collect(Collectors.joining(separator));
	}

	public static String join(List<LambdaToken> tokens) {
		return join(tokens, DEFAULT_SEPARATOR);
	}

	public static List<String> texts(List<LambdaToken> tokens) {
		List<String> texts = new ArrayList<>(tokens.size());
		for (LambdaToken token : tokens) {
			texts.add(token.text());
		}
		return texts;
	}

	/**
	 * Renders tokens back into surface text that tokenizes to the same sequence.
	 * A binder is glued to its variable and brackets hug their contents:
	 * {@code \x (y z)}.
	 */
	public static String render(List<LambdaToken> tokens) {
		StringBuilder sb = new StringBuilder();
		LambdaToken previous = null;
		for (LambdaToken token : tokens) {
			if (previous != null && needsSpace(previous, token)) {
				sb.append(Alphabet.SPACE);
			}
			sb.append(token.text());
			previous = token;
		}
		return sb.toString();
	}

	private static boolean needsSpace(LambdaToken previous, LambdaToken next) {
		if (previous.isType(LambdaToken.TokenType.LAMBDA) || previous.isType(LambdaToken.TokenType.OPEN_PAREN)) {
			return false;
		}
		return !next.isType(LambdaToken.TokenType.CLOSE_PAREN);
	}

	/**
	 * Returns true if the sequence starts with {@code (} and its matching {@code )}
	 * is the last token.
	 */
	public static boolean isWrappedByOuterBrackets(List<LambdaToken> tokens) {
		if (tokens.isEmpty() || !tokens.get(0).isType(LambdaToken.TokenType.OPEN_PAREN)) {
			return false;
		}
		int depth = 1;
		int index = 1;
		while (index < tokens.size()) {
			LambdaToken token = tokens.get(index);
			if (token.isType(LambdaToken.TokenType.OPEN_PAREN)) {
				depth++;
			} else if (token.isType(LambdaToken.TokenType.CLOSE_PAREN)) {
				depth--;
			}
			if (depth == 0) {
				break;
			}
			index++;
		}
		return index == tokens.size() - 1;
	}
}

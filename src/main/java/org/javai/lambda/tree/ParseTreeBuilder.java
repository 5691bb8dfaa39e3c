package org.javai.lambda.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.lambda.syntax.LambdaSyntaxException;
import org.javai.lambda.syntax.LambdaToken;
import org.javai.lambda.syntax.LambdaTokenizer;
import org.javai.lambda.syntax.LambdaTokens;
import org.javai.lambda.syntax.SyntaxErrorKind;

/**
 * Builds a {@link ParseTree} from a token sequence produced by
 * {@link org.javai.lambda.syntax.LambdaTokenizer}.
 * <p>
 * The builder scans left to right: a bracket pair becomes a {@link ParseNode.Group}
 * whose interior is built recursively, {@code \} together with the following name
 * becomes a {@link ParseNode.Binder}, and every other token becomes a
 * {@link ParseNode.Leaf}. Sequences that could not have come from the tokenizer
 * are rejected with {@link SyntaxErrorKind#MALFORMED_TOKEN_SEQUENCE}; positions in
 * those errors are 1-based token indexes.
 * <p>
 * Bracket pairs may nest at most {@code maxNestingDepth} deep, the same limit the
 * tokenizer applies, so every sequence the tokenizer accepts under a given limit
 * also builds under it. Deeper input fails with {@link SyntaxErrorKind#NESTING_TOO_DEEP}.
 */
public class ParseTreeBuilder {

	private final String separator;
	private final int maxNestingDepth;

	public ParseTreeBuilder() {
		this(LambdaTokens.DEFAULT_SEPARATOR);
	}

	/**
	 * @param separator joins tokens in the summary labels of sequences and groups
	 */
	public ParseTreeBuilder(String separator) {
		this(separator, LambdaTokenizer.DEFAULT_MAX_NESTING_DEPTH);
	}

	public ParseTreeBuilder(String separator, int maxNestingDepth) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
		}
		this.separator = Objects.requireNonNull(separator, "separator must not be null");
		this.maxNestingDepth = maxNestingDepth;
	}

	/**
	 * @throws LambdaSyntaxException if the tokens are not a well-formed sequence
	 */
	public ParseTree build(List<LambdaToken> tokens) {
		Objects.requireNonNull(tokens, "tokens must not be null");
		return new ParseTree(buildSequence(tokens, 0, tokens.size(), 0));
	}

	private ParseNode.Sequence buildSequence(List<LambdaToken> tokens, int from, int to, int depth) {
		List<ParseNode> children = new ArrayList<>();
		int index = from;
		while (index < to) {
			LambdaToken token = tokens.get(index);
			switch (token.type()) {
				case OPEN_PAREN -> {
					if (depth >= maxNestingDepth) {
						throw new LambdaSyntaxException(SyntaxErrorKind.NESTING_TOO_DEEP,
								"Maximum nesting depth of " + maxNestingDepth + " exceeded", index + 1);
					}
					int close = findClosingParenthesis(tokens, index, to);
					String summary = LambdaTokens.join(tokens.subList(index, close + 1), separator);
					children.add(new ParseNode.Group(summary, buildSequence(tokens, index + 1, close, depth + 1)));
					index = close + 1;
				}
				case LAMBDA -> {
					if (index + 1 >= to || !tokens.get(index + 1).isIdentifier()) {
						throw malformed("Expected a variable name after '\\'", index + 1);
					}
					children.add(new ParseNode.Binder(tokens.get(index + 1).text()));
					index += 2;
				}
				case CLOSE_PAREN -> throw malformed("Unmatched ')'", index + 1);
				case IDENTIFIER -> {
					children.add(new ParseNode.Leaf(token));
					index++;
				}
			}
		}
		return new ParseNode.Sequence(LambdaTokens.join(tokens.subList(from, to), separator), children);
	}

	private int findClosingParenthesis(List<LambdaToken> tokens, int open, int to) {
		int depth = 0;
		for (int index = open; index < to; index++) {
			LambdaToken token = tokens.get(index);
			if (token.isType(LambdaToken.TokenType.OPEN_PAREN)) {
				depth++;
			} else if (token.isType(LambdaToken.TokenType.CLOSE_PAREN)) {
				depth--;
				if (depth == 0) {
					return index;
				}
			}
		}
		throw malformed("Unmatched '('", open + 1);
	}

	private static LambdaSyntaxException malformed(String message, int position) {
		return new LambdaSyntaxException(SyntaxErrorKind.MALFORMED_TOKEN_SEQUENCE, message, position);
	}
}

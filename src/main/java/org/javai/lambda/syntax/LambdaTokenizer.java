package org.javai.lambda.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent validator and tokenizer for lambda expressions.
 * <p>
 * Recognised grammar (dots are sugar and never emitted as tokens):
 * <pre>
 * Expr     := Ws* ( Lambda | Bracket | AppChain | empty )
 * Lambda   := '\' Ident '.'? Expr
 * Bracket  := '(' Expr ')' Expr?
 * AppChain := Ident (Ws+ Ident)* Expr?
 * </pre>
 * The parser walks a window {@code [start, end)} of the original input, so every
 * error position is a 1-based offset into the untrimmed line.
 * <p>
 * A body introduced by a dot is wrapped in brackets unless it is already fully
 * enclosed by a single bracket pair. With {@link AssociationMode#LEFT} or
 * {@link AssociationMode#RIGHT}, application chains and bracket groups followed
 * by more input receive explicit grouping.
 */
public class LambdaTokenizer {

	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	private final String input;
	private final AssociationMode mode;
	private final int maxNestingDepth;

	public LambdaTokenizer(String input) {
		this(input, AssociationMode.NONE);
	}

	public LambdaTokenizer(String input, AssociationMode mode) {
		this(input, mode, DEFAULT_MAX_NESTING_DEPTH);
	}

	public LambdaTokenizer(String input, AssociationMode mode, int maxNestingDepth) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
		}
		this.input = input != null ? input : "";
		this.mode = Objects.requireNonNull(mode, "mode must not be null");
		this.maxNestingDepth = maxNestingDepth;
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return the token sequence; empty for blank input
	 * @throws LambdaSyntaxException if the input is not a valid expression
	 */
	public List<LambdaToken> tokenize() {
		return parseExpression(0, input.length(), 0);
	}

	/**
	 * Tokenizes the entire input, reporting failure as a value instead of an exception.
	 */
	public TokenizeResult tryTokenize() {
		try {
			return TokenizeResult.success(tokenize());
		} catch (LambdaSyntaxException e) {
			return TokenizeResult.failure(e.getError());
		}
	}

	private List<LambdaToken> parseExpression(int start, int end, int depth) {
		if (depth > maxNestingDepth) {
			throw error(SyntaxErrorKind.NESTING_TOO_DEEP,
				"Maximum nesting depth of " + maxNestingDepth + " exceeded", start + 1);
		}
		int from = skipWhitespace(start, end);
		int to = trimEnd(from, end);
		List<LambdaToken> tokens = new ArrayList<>();

		while (true) {
			from = skipWhitespace(from, to);
			if (from >= to) {
				return tokens;
			}

			char c = input.charAt(from);
			if (c == Alphabet.LAMBDA) {
				// the body of an abstraction extends to the end of the window
				tokens.addAll(parseAbstraction(from, to, depth));
				return tokens;
			}
			if (c == Alphabet.OPEN_PAREN) {
				int close = findClosingParenthesis(from, to);
				int next = close + 1;
				// a continuation wraps the group in one more bracket pair
				boolean continued = mode != AssociationMode.NONE && skipWhitespace(next, to) < to;
				List<LambdaToken> group = parseGroup(from, close, continued ? depth + 1 : depth);
				if (continued) {
					tokens.add(LambdaToken.OPEN_PAREN);
					tokens.addAll(group);
					tokens.addAll(parseExpression(next, to, depth + 1));
					tokens.add(LambdaToken.CLOSE_PAREN);
					return tokens;
				}
				tokens.addAll(group);
				from = next;
				continue;
			}
			if (Alphabet.isIdentChar(c)) {
				if (!Alphabet.isLetter(c)) {
					throw error(SyntaxErrorKind.INVALID_IDENTIFIER_START, "Name must start with a character", from + 1);
				}
				int runEnd = from;
				while (runEnd < to && (Alphabet.isIdentChar(input.charAt(runEnd)) || input.charAt(runEnd) == Alphabet.SPACE)) {
					runEnd++;
				}
				tokens.addAll(parseApplicationChain(from, runEnd, depth));
				from = runEnd;
				continue;
			}
			throw error(SyntaxErrorKind.UNEXPECTED_CHARACTER, "Unexpected token '" + c + "'", from + 1);
		}
	}

	private List<LambdaToken> parseAbstraction(int backslash, int end, int depth) {
		int nameStart = backslash + 1;
		int nameEnd = nameStart;
		while (nameEnd < end && Alphabet.isIdentChar(input.charAt(nameEnd))) {
			nameEnd++;
		}
		int reported = backslash + 2;
		if (nameEnd == nameStart) {
			throw error(SyntaxErrorKind.MALFORMED_VARIABLE, "No valid variable name found", reported);
		}
		if (!Alphabet.isLetter(input.charAt(nameStart))) {
			throw error(SyntaxErrorKind.MALFORMED_VARIABLE, "Variable must start with a character", reported);
		}

		int bodyStart = skipWhitespace(nameEnd, end);
		boolean dotted = bodyStart < end && input.charAt(bodyStart) == Alphabet.DOT;
		if (dotted && bodyStart > nameEnd) {
			// reported at the whitespace just before the dot
			throw error(SyntaxErrorKind.ILLEGAL_DOT_SPACING, "No spaces allowed between variable and dot", bodyStart);
		}
		if (end - bodyStart < 2) {
			throw error(SyntaxErrorKind.MALFORMED_VARIABLE, "No expression found after variable", reported);
		}
		if (dotted) {
			bodyStart++;
		}

		List<LambdaToken> body = parseExpression(bodyStart, end, depth + 1);
		if (body.isEmpty()) {
			throw error(SyntaxErrorKind.MALFORMED_VARIABLE, "No expression found after variable", reported);
		}

		List<LambdaToken> tokens = new ArrayList<>(body.size() + 4);
		tokens.add(LambdaToken.LAMBDA);
		tokens.add(LambdaToken.identifier(input.substring(nameStart, nameEnd)));
		boolean wrap = dotted && !LambdaTokens.isWrappedByOuterBrackets(body);
		if (wrap) {
			tokens.add(LambdaToken.OPEN_PAREN);
		}
		tokens.addAll(body);
		if (wrap) {
			tokens.add(LambdaToken.CLOSE_PAREN);
		}
		return tokens;
	}

	/**
	 * @return index of the {@code )} matching the {@code (} at {@code open}
	 */
	private int findClosingParenthesis(int open, int end) {
		int depth = 1;
		int index = open + 1;
		while (index < end && depth != 0) {
			char c = input.charAt(index);
			if (c == Alphabet.OPEN_PAREN) {
				depth++;
			} else if (c == Alphabet.CLOSE_PAREN) {
				depth--;
			}
			index++;
		}
		if (depth > 0) {
			throw error(SyntaxErrorKind.UNBALANCED_PARENTHESIS, "Expected closing parenthesis, found EOL", index);
		}
		return index - 1;
	}

	private List<LambdaToken> parseGroup(int open, int close, int depth) {
		if (close - open <= 1) {
			throw error(SyntaxErrorKind.EMPTY_GROUP, "Missing tokens between brackets", open + 1);
		}
		List<LambdaToken> interior = parseExpression(open + 1, close, depth + 1);
		if (interior.isEmpty()) {
			throw error(SyntaxErrorKind.EMPTY_GROUP, "Missing tokens between brackets", open + 1);
		}
		List<LambdaToken> tokens = new ArrayList<>(interior.size() + 2);
		tokens.add(LambdaToken.OPEN_PAREN);
		tokens.addAll(interior);
		tokens.add(LambdaToken.CLOSE_PAREN);
		return tokens;
	}

	/**
	 * Under {@code left} or {@code right} a chain of n names nests n-1 bracket pairs deep,
	 * and those levels count towards the nesting limit.
	 */
	private List<LambdaToken> parseApplicationChain(int start, int end, int depth) {
		List<LambdaToken> names = new ArrayList<>();
		int index = start;
		while (index < end) {
			if (input.charAt(index) == Alphabet.SPACE) {
				index++;
				continue;
			}
			int nameStart = index;
			while (index < end && input.charAt(index) != Alphabet.SPACE) {
				index++;
			}
			if (!Alphabet.isLetter(input.charAt(nameStart))) {
				throw error(SyntaxErrorKind.INVALID_IDENTIFIER_START, "Name must start with a character", nameStart + 1);
			}
			names.add(LambdaToken.identifier(input.substring(nameStart, index)));
		}
		if (mode != AssociationMode.NONE && depth + names.size() - 1 > maxNestingDepth) {
			throw error(SyntaxErrorKind.NESTING_TOO_DEEP,
				"Maximum nesting depth of " + maxNestingDepth + " exceeded", start + 1);
		}
		return Associativity.associate(names, mode);
	}

	private int skipWhitespace(int from, int end) {
		while (from < end && Alphabet.isWhitespace(input.charAt(from))) {
			from++;
		}
		return from;
	}

	private int trimEnd(int from, int end) {
		while (end > from && Alphabet.isWhitespace(input.charAt(end - 1))) {
			end--;
		}
		return end;
	}

	private static LambdaSyntaxException error(SyntaxErrorKind kind, String message, int position) {
		return new LambdaSyntaxException(kind, message, position);
	}
}

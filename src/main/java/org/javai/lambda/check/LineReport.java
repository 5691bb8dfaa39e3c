package org.javai.lambda.check;

import java.util.List;
import org.javai.lambda.syntax.LambdaToken;
import org.javai.lambda.syntax.LambdaTokens;
import org.javai.lambda.syntax.SyntaxError;
import org.javai.lambda.syntax.TokenizeResult;

/**
 * The outcome of checking one input line.
 *
 * @param lineNumber 1-based line number within the checked input
 * @param input the line as checked
 * @param result tokens or syntax error
 */
public record LineReport(int lineNumber, String input, TokenizeResult result) {

	public boolean isValid() {
		return result.isValid();
	}

	public List<LambdaToken> tokens() {
		return result.tokens();
	}

	public SyntaxError error() {
		return result.error();
	}

	/**
	 * One-line display of the outcome: the joined tokens or the diagnostic.
	 */
	public String describe(String separator) {
		if (isValid()) {
			return "The tokenized string for input string " + input + " is "
					+ LambdaTokens.join(result.tokens(), separator);
		}
		return result.error().describe(input);
	}
}

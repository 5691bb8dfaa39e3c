package org.javai.lambda.syntax;

/**
 * Exception thrown when lambda input fails validation.
 */
public class LambdaSyntaxException extends RuntimeException {

	private final SyntaxError error;

	public LambdaSyntaxException(SyntaxError error) {
		super(error.toString());
		this.error = error;
	}

	public LambdaSyntaxException(SyntaxErrorKind kind, String message, int position) {
		this(new SyntaxError(kind, message, position));
	}

	public SyntaxError getError() {
		return error;
	}

	public SyntaxErrorKind getKind() {
		return error.kind();
	}

	public int getPosition() {
		return error.position();
	}
}

package org.javai.lambda.syntax;

/**
 * Exception thrown when tokenizing or parsing a lambda expression fails.
 * Carries the character offset of the offending input.
 */
public class LambdaSyntaxException extends RuntimeException {

	private final int position;

	public LambdaSyntaxException(String message, int position) {
		super(message);
		this.position = position;
	}

	/**
	 * Zero-based character offset into the expression.
	 */
	public int position() {
		return position;
	}
}

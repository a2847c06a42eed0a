package org.javai.lambda.combinator;

/**
 * Exception thrown when a combinator table cannot be loaded.
 */
public class CombinatorTableException extends RuntimeException {

	public CombinatorTableException(String message) {
		super(message);
	}

	public CombinatorTableException(String message, Throwable cause) {
		super(message, cause);
	}
}

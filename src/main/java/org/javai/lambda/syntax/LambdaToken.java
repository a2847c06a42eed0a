package org.javai.lambda.syntax;

/**
 * A token of the lambda expression syntax.
 *
 * @param type the token type
 * @param value the token text
 * @param position the character position in the input string
 */
public record LambdaToken(TokenType type, String value, int position) {

	public enum TokenType {
		LAMBDA,        // \ or λ
		DOT,           // .
		LPAREN,        // (
		RPAREN,        // )
		IDENT,         // maximal run of letters
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case IDENT -> "IDENT(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	/**
	 * Human-readable description used in error messages.
	 */
	public String describe() {
		return switch (type) {
			case IDENT -> "identifier '" + value + "'";
			case EOF -> "end of input";
			default -> "'" + value + "'";
		};
	}
}

package org.javai.lambda.syntax;

import java.util.ArrayList;
import java.util.List;
import org.javai.lambda.term.Identifiers;

/**
 * Converts a lambda expression into a stream of tokens.
 * <p>
 * Identifiers are maximal runs of letters, so {@code "xx"} is one identifier and
 * {@code "x x"} is two. Whitespace and the structural characters are the only
 * separators.
 */
public class LambdaTokenizer {

	private final String input;
	private int pos = 0;

	public LambdaTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws LambdaSyntaxException if an unrecognized character is encountered
	 */
	public List<LambdaToken> tokenize() {
		List<LambdaToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new LambdaToken(LambdaToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private LambdaToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '\\', Identifiers.LAMBDA -> {
				advance();
				yield new LambdaToken(LambdaToken.TokenType.LAMBDA, String.valueOf(c), start);
			}
			case '.' -> {
				advance();
				yield new LambdaToken(LambdaToken.TokenType.DOT, ".", start);
			}
			case '(' -> {
				advance();
				yield new LambdaToken(LambdaToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new LambdaToken(LambdaToken.TokenType.RPAREN, ")", start);
			}
			default -> {
				if (Identifiers.isIdentifierChar(c)) {
					yield scanIdentifier();
				}
				throw new LambdaSyntaxException("Unexpected character '" + c + "' at position " + pos, pos);
			}
		};
	}

	private LambdaToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && Identifiers.isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		return new LambdaToken(LambdaToken.TokenType.IDENT, value, start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}
}

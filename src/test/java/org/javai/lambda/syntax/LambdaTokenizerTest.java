package org.javai.lambda.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.javai.lambda.syntax.LambdaToken.TokenType;
import org.junit.jupiter.api.Test;

class LambdaTokenizerTest {

	private List<TokenType> types(String input) {
		return new LambdaTokenizer(input).tokenize().stream().map(LambdaToken::type).toList();
	}

	@Test
	void emptyInputYieldsOnlyEof() {
		assertThat(types("")).containsExactly(TokenType.EOF);
		assertThat(types("   \t\n")).containsExactly(TokenType.EOF);
	}

	@Test
	void whitespaceSeparatesIdentifiers() {
		List<LambdaToken> tokens = new LambdaTokenizer("x x").tokenize();

		assertThat(tokens).extracting(LambdaToken::type)
				.containsExactly(TokenType.IDENT, TokenType.IDENT, TokenType.EOF);
		assertThat(tokens.get(0).value()).isEqualTo("x");
		assertThat(tokens.get(1).value()).isEqualTo("x");
	}

	@Test
	void adjacentLettersFormOneIdentifier() {
		List<LambdaToken> tokens = new LambdaTokenizer("xx").tokenize();

		assertThat(tokens).hasSize(2);
		assertThat(tokens.get(0).type()).isEqualTo(TokenType.IDENT);
		assertThat(tokens.get(0).value()).isEqualTo("xx");
	}

	@Test
	void parenthesesSeparateIdentifiers() {
		List<LambdaToken> tokens = new LambdaTokenizer("f(g)h").tokenize();

		assertThat(tokens).extracting(LambdaToken::type).containsExactly(
				TokenType.IDENT, TokenType.LPAREN, TokenType.IDENT, TokenType.RPAREN, TokenType.IDENT, TokenType.EOF);
		assertThat(tokens).extracting(LambdaToken::value).containsExactly("f", "(", "g", ")", "h", "");
	}

	@Test
	void backslashAndLambdaAreBothBinderMarkers() {
		assertThat(types("\\x.x")).containsExactly(
				TokenType.LAMBDA, TokenType.IDENT, TokenType.DOT, TokenType.IDENT, TokenType.EOF);
		assertThat(types("λx.x")).containsExactly(
				TokenType.LAMBDA, TokenType.IDENT, TokenType.DOT, TokenType.IDENT, TokenType.EOF);
	}

	@Test
	void lambdaMarkerEndsAnIdentifier() {
		List<LambdaToken> tokens = new LambdaTokenizer("fλx.x").tokenize();

		assertThat(tokens.get(0).value()).isEqualTo("f");
		assertThat(tokens.get(1).type()).isEqualTo(TokenType.LAMBDA);
	}

	@Test
	void tokensRecordTheirPositions() {
		List<LambdaToken> tokens = new LambdaTokenizer("(\\xy. xy)").tokenize();

		assertThat(tokens).extracting(LambdaToken::position).containsExactly(0, 1, 2, 4, 6, 8, 9);
	}

	@Test
	void unicodeLettersAreIdentifierCharacters() {
		List<LambdaToken> tokens = new LambdaTokenizer("αβ γ").tokenize();

		assertThat(tokens).extracting(LambdaToken::value).containsExactly("αβ", "γ", "");
	}

	@Test
	void digitIsRejectedWithItsPosition() {
		assertThatThrownBy(() -> new LambdaTokenizer("x1").tokenize())
				.isInstanceOf(LambdaSyntaxException.class)
				.hasMessageContaining("'1'")
				.hasMessageContaining("position 1")
				.extracting(e -> ((LambdaSyntaxException) e).position())
				.isEqualTo(1);
	}

	@Test
	void operatorCharacterIsRejected() {
		assertThatThrownBy(() -> new LambdaTokenizer("x + y").tokenize())
				.isInstanceOf(LambdaSyntaxException.class)
				.hasMessageContaining("Unexpected character '+' at position 2");
	}
}

package org.javai.lambda.syntax;

import java.util.List;
import org.javai.lambda.term.Term;

/**
 * Recursive-descent parser for untyped lambda expressions.
 * <p>
 * Grammar:
 *
 * <pre>
 * Term        := Abstraction | Application
 * Abstraction := LAMBDA IDENT DOT Term
 * Application := Atom Atom*
 * Atom        := IDENT | LPAREN Term RPAREN | Abstraction
 * </pre>
 *
 * Application is left-associative and binds tighter than abstraction; an
 * abstraction body extends as far right as possible. The whole token stream must
 * be consumed. Input nested more than {@link #MAX_DEPTH} levels deep is rejected.
 *
 * <pre>
 * List&lt;LambdaToken&gt; tokens = new LambdaTokenizer("(\\x.x) y").tokenize();
 * Term term = new LambdaParser(tokens).parse();
 * </pre>
 */
public class LambdaParser {

	/**
	 * Deepest nesting accepted, counting both the term's own depth and the
	 * parentheses and lambdas opened while reading it.
	 */
	public static final int MAX_DEPTH = 500;

	private final List<LambdaToken> tokens;

	public LambdaParser(List<LambdaToken> tokens) {
		this.tokens = tokens != null ? tokens : List.of();
	}

	/**
	 * Tokenizes and parses an expression in one go.
	 *
	 * @throws LambdaSyntaxException if the expression is not well formed
	 */
	public static Term parse(String expression) {
		return new LambdaParser(new LambdaTokenizer(expression).tokenize()).parse();
	}

	/**
	 * Parses the tokens into exactly one term.
	 *
	 * @return the parsed term
	 * @throws LambdaSyntaxException on the first syntax error; no partial term is returned
	 */
	public Term parse() {
		ParserState state = new ParserState(tokens);
		if (state.isAtEnd()) {
			throw new LambdaSyntaxException("Empty expression", state.getCurrentPosition());
		}

		Term term = parseTerm(state).term();

		if (!state.isAtEnd()) {
			LambdaToken trailing = state.peek();
			if (trailing.isType(LambdaToken.TokenType.RPAREN)) {
				throw new LambdaSyntaxException(
						"Unexpected ')' at position " + trailing.position() + ": no matching opening parenthesis",
						trailing.position());
			}
			throw new LambdaSyntaxException(
					"Unexpected " + trailing.describe() + " at position " + trailing.position(), trailing.position());
		}
		return term;
	}

	private Parsed parseTerm(ParserState state) {
		return parseApplication(state);
	}

	private Parsed parseApplication(ParserState state) {
		Parsed result = parseAtom(state);
		while (startsAtom(state)) {
			LambdaToken start = state.peek();
			Parsed argument = parseAtom(state);
			result = new Parsed(new Term.Application(result.term(), argument.term()),
					1 + Math.max(result.depth(), argument.depth()));
			checkDepth(result.depth(), start);
		}
		return result;
	}

	private boolean startsAtom(ParserState state) {
		return state.check(LambdaToken.TokenType.IDENT)
				|| state.check(LambdaToken.TokenType.LPAREN)
				|| state.check(LambdaToken.TokenType.LAMBDA);
	}

	private Parsed parseAtom(ParserState state) {
		LambdaToken token = state.peek();

		return switch (token.type()) {
			case IDENT -> {
				state.advance();
				yield new Parsed(new Term.Variable(token.value()), 1);
			}
			case LPAREN -> parseParenthesized(state);
			case LAMBDA -> parseAbstraction(state);
			case RPAREN -> throw new LambdaSyntaxException(
					"Expected expression at position " + token.position() + ", found ')'", token.position());
			case DOT -> throw new LambdaSyntaxException(
					"Unexpected '.' at position " + token.position() + ": '.' may only follow a lambda parameter",
					token.position());
			case EOF -> throw new LambdaSyntaxException(
					"Expected expression at position " + token.position() + ", found end of input", token.position());
		};
	}

	private Parsed parseAbstraction(ParserState state) {
		LambdaToken lambda = state.advance();
		state.enter(lambda);

		LambdaToken param = state.peek();
		if (!param.isType(LambdaToken.TokenType.IDENT)) {
			throw new LambdaSyntaxException(
					"Expected parameter name after lambda at position " + lambda.position() + ", found "
							+ param.describe(), param.position());
		}
		state.advance();

		LambdaToken dot = state.peek();
		if (!dot.isType(LambdaToken.TokenType.DOT)) {
			throw new LambdaSyntaxException(
					"Expected '.' after lambda parameter '" + param.value() + "' at position " + dot.position()
							+ ", found " + dot.describe(), dot.position());
		}
		state.advance();

		Parsed body = parseTerm(state);
		state.leave();
		Parsed abstraction = new Parsed(new Term.Abstraction(param.value(), body.term()), 1 + body.depth());
		checkDepth(abstraction.depth(), lambda);
		return abstraction;
	}

	private Parsed parseParenthesized(ParserState state) {
		LambdaToken open = state.advance();
		state.enter(open);

		if (state.check(LambdaToken.TokenType.RPAREN)) {
			throw new LambdaSyntaxException(
					"Empty expression at position " + open.position() + ": parentheses must contain a term",
					open.position());
		}
		if (state.isAtEnd()) {
			throw new LambdaSyntaxException(
					"Unmatched '(' at position " + open.position() + ": reached end of input", open.position());
		}

		Parsed inner = parseTerm(state);

		if (state.isAtEnd()) {
			throw new LambdaSyntaxException(
					"Unmatched '(' at position " + open.position() + ": reached end of input", open.position());
		}
		if (!state.check(LambdaToken.TokenType.RPAREN)) {
			LambdaToken unexpected = state.peek();
			throw new LambdaSyntaxException(
					"Mismatched parentheses: expected ')' to close '(' at position " + open.position()
							+ ", but found " + unexpected.describe() + " at position " + unexpected.position(),
					unexpected.position());
		}
		state.advance();
		state.leave();
		return inner;
	}

	private static void checkDepth(int depth, LambdaToken at) {
		if (depth > MAX_DEPTH) {
			throw tooDeep(at);
		}
	}

	private static LambdaSyntaxException tooDeep(LambdaToken at) {
		return new LambdaSyntaxException("Expression nested too deeply at position " + at.position()
				+ ": more than " + MAX_DEPTH + " levels", at.position());
	}

	private record Parsed(Term term, int depth) {
	}

	/**
	 * Cursor over the token list.
	 */
	static final class ParserState {
		private final List<LambdaToken> tokens;
		private int current = 0;
		private int nesting = 0;

		ParserState(List<LambdaToken> tokens) {
			this.tokens = tokens;
		}

		LambdaToken peek() {
			if (current >= tokens.size()) {
				int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).position();
				return new LambdaToken(LambdaToken.TokenType.EOF, "", end);
			}
			return tokens.get(current);
		}

		LambdaToken advance() {
			LambdaToken token = peek();
			if (!isAtEnd()) {
				current++;
			}
			return token;
		}

		boolean check(LambdaToken.TokenType type) {
			if (isAtEnd()) return false;
			return peek().type() == type;
		}

		boolean isAtEnd() {
			return current >= tokens.size() || tokens.get(current).type() == LambdaToken.TokenType.EOF;
		}

		void enter(LambdaToken opening) {
			if (++nesting > MAX_DEPTH) {
				throw tooDeep(opening);
			}
		}

		void leave() {
			nesting--;
		}

		int getCurrentPosition() {
			return peek().position();
		}
	}
}

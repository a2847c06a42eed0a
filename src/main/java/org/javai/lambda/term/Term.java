package org.javai.lambda.term;

import java.util.Objects;

/**
 * An immutable lambda-calculus term.
 * <p>
 * The three shapes are a closed set. Consumers handle them exhaustively through
 * {@link TermVisitor}; a term is never mutated, every rewrite builds a new tree.
 */
public sealed interface Term {

	/**
	 * Dispatches to the visitor method for this shape.
	 *
	 * @param <R> the visitor result type
	 * @param visitor the visitor to accept
	 * @return the visitor result
	 */
	<R> R accept(TermVisitor<R> visitor);

	static Variable var(String name) {
		return new Variable(name);
	}

	static Abstraction lambda(String param, Term body) {
		return new Abstraction(param, body);
	}

	static Application apply(Term function, Term argument) {
		return new Application(function, argument);
	}

	/**
	 * Left-folds the given terms into a chain of applications: {@code apply(f, a, b)} is {@code (f a) b}.
	 */
	static Term apply(Term function, Term... arguments) {
		Term result = function;
		for (Term argument : arguments) {
			result = new Application(result, argument);
		}
		return result;
	}

	record Variable(String name) implements Term {

		public Variable {
			Identifiers.requireValid(name);
		}

		@Override
		public <R> R accept(TermVisitor<R> visitor) {
			return visitor.visitVariable(this);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	record Abstraction(String param, Term body) implements Term {

		public Abstraction {
			Identifiers.requireValid(param);
			Objects.requireNonNull(body, "body must not be null");
		}

		@Override
		public <R> R accept(TermVisitor<R> visitor) {
			return visitor.visitAbstraction(this);
		}

		@Override
		public String toString() {
			return TermPrinter.print(this);
		}
	}

	record Application(Term function, Term argument) implements Term {

		public Application {
			Objects.requireNonNull(function, "function must not be null");
			Objects.requireNonNull(argument, "argument must not be null");
		}

		/**
		 * A redex is an application whose function is an abstraction.
		 */
		public boolean isRedex() {
			return function instanceof Abstraction;
		}

		@Override
		public <R> R accept(TermVisitor<R> visitor) {
			return visitor.visitApplication(this);
		}

		@Override
		public String toString() {
			return TermPrinter.print(this);
		}
	}
}

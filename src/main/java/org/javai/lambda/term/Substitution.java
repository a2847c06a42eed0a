package org.javai.lambda.term;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Capture-avoiding substitution {@code term[target := replacement]}.
 * <p>
 * Only free occurrences of {@code target} are replaced. When an abstraction on
 * the way down binds a name that is free in the replacement, its parameter is
 * first renamed to a fresh identifier so the replacement's free variables stay
 * free. The input terms are never modified.
 */
public final class Substitution {

	private Substitution() {
	}

	/**
	 * Replaces the free occurrences of {@code target} in {@code term} with {@code replacement}.
	 *
	 * @param term the term to rewrite
	 * @param target the variable name to replace
	 * @param replacement the term to insert
	 * @return the rewritten term, or {@code term} itself when {@code target} is not free in it
	 */
	public static Term substitute(Term term, String target, Term replacement) {
		Objects.requireNonNull(term, "term must not be null");
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(replacement, "replacement must not be null");
		return term.accept(new Substituter(target, replacement, Variables.freeVariables(replacement)));
	}

	/**
	 * Renames the parameter of {@code abstraction} to {@code newParam}, rewriting
	 * the occurrences it binds. {@code newParam} must not occur free in the body.
	 */
	public static Term.Abstraction rename(Term.Abstraction abstraction, String newParam) {
		if (abstraction.param().equals(newParam)) {
			return abstraction;
		}
		if (Variables.isFreeIn(newParam, abstraction.body())) {
			throw new IllegalArgumentException(
					"Cannot rename '" + abstraction.param() + "' to '" + newParam + "': name is free in the body");
		}
		Term body = substitute(abstraction.body(), abstraction.param(), new Term.Variable(newParam));
		return new Term.Abstraction(newParam, body);
	}

	private static final class Substituter implements TermVisitor<Term> {

		private final String target;
		private final Term replacement;
		// computed once per substitution; the replacement never changes during the walk
		private final Set<String> replacementFree;

		private Substituter(String target, Term replacement, Set<String> replacementFree) {
			this.target = target;
			this.replacement = replacement;
			this.replacementFree = replacementFree;
		}

		@Override
		public Term visitVariable(Term.Variable variable) {
			return variable.name().equals(target) ? replacement : variable;
		}

		@Override
		public Term visitAbstraction(Term.Abstraction abstraction) {
			String param = abstraction.param();
			Term body = abstraction.body();
			if (param.equals(target) || !Variables.isFreeIn(target, body)) {
				return abstraction;
			}
			if (!replacementFree.contains(param)) {
				return new Term.Abstraction(param, body.accept(this));
			}
			Set<String> avoid = new HashSet<>(Variables.allNames(body));
			avoid.addAll(replacementFree);
			avoid.add(target);
			String freshParam = FreshNames.fresh(param, avoid);
			Term renamedBody = substitute(body, param, new Term.Variable(freshParam));
			return new Term.Abstraction(freshParam, renamedBody.accept(this));
		}

		@Override
		public Term visitApplication(Term.Application application) {
			Term function = application.function().accept(this);
			Term argument = application.argument().accept(this);
			if (function == application.function() && argument == application.argument()) {
				return application;
			}
			return new Term.Application(function, argument);
		}
	}
}

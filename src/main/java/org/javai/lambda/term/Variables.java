package org.javai.lambda.term;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Free and bound variable analysis.
 * <p>
 * A variable is free unless it sits under an abstraction binding the same name;
 * an abstraction binds its parameter within its body. Each query is one walk
 * over the term. Results are sorted so that anything derived from them is
 * deterministic.
 */
public final class Variables {

	private Variables() {
	}

	/**
	 * Names occurring free in {@code term}.
	 */
	public static SortedSet<String> freeVariables(Term term) {
		SortedSet<String> free = new TreeSet<>();
		collectFree(term, new HashMap<>(), free);
		return Collections.unmodifiableSortedSet(free);
	}

	/**
	 * Names bound by some abstraction inside {@code term}.
	 */
	public static SortedSet<String> boundVariables(Term term) {
		SortedSet<String> bound = new TreeSet<>();
		collectBound(term, bound);
		return Collections.unmodifiableSortedSet(bound);
	}

	/**
	 * Every identifier that appears in {@code term}, free, bound or as a binder.
	 */
	public static SortedSet<String> allNames(Term term) {
		SortedSet<String> names = new TreeSet<>();
		collectNames(term, names);
		return Collections.unmodifiableSortedSet(names);
	}

	public static boolean isFreeIn(String name, Term term) {
		return term.accept(new TermVisitor<Boolean>() {
			@Override
			public Boolean visitVariable(Term.Variable variable) {
				return variable.name().equals(name);
			}

			@Override
			public Boolean visitAbstraction(Term.Abstraction abstraction) {
				return !abstraction.param().equals(name) && abstraction.body().accept(this);
			}

			@Override
			public Boolean visitApplication(Term.Application application) {
				return application.function().accept(this) || application.argument().accept(this);
			}
		});
	}

	/**
	 * A closed term has no free variables.
	 */
	public static boolean isClosed(Term term) {
		return freeVariables(term).isEmpty();
	}

	private static void collectFree(Term term, Map<String, Integer> binders, Set<String> out) {
		term.accept(new TermVisitor<Void>() {
			@Override
			public Void visitVariable(Term.Variable variable) {
				if (!binders.containsKey(variable.name())) {
					out.add(variable.name());
				}
				return null;
			}

			@Override
			public Void visitAbstraction(Term.Abstraction abstraction) {
				String param = abstraction.param();
				binders.merge(param, 1, Integer::sum);
				abstraction.body().accept(this);
				binders.computeIfPresent(param, (name, count) -> count == 1 ? null : count - 1);
				return null;
			}

			@Override
			public Void visitApplication(Term.Application application) {
				application.function().accept(this);
				application.argument().accept(this);
				return null;
			}
		});
	}

	private static void collectBound(Term term, Set<String> out) {
		term.accept(new TermVisitor<Void>() {
			@Override
			public Void visitVariable(Term.Variable variable) {
				return null;
			}

			@Override
			public Void visitAbstraction(Term.Abstraction abstraction) {
				out.add(abstraction.param());
				return abstraction.body().accept(this);
			}

			@Override
			public Void visitApplication(Term.Application application) {
				application.function().accept(this);
				return application.argument().accept(this);
			}
		});
	}

	private static void collectNames(Term term, Set<String> out) {
		term.accept(new TermVisitor<Void>() {
			@Override
			public Void visitVariable(Term.Variable variable) {
				out.add(variable.name());
				return null;
			}

			@Override
			public Void visitAbstraction(Term.Abstraction abstraction) {
				out.add(abstraction.param());
				return abstraction.body().accept(this);
			}

			@Override
			public Void visitApplication(Term.Application application) {
				application.function().accept(this);
				return application.argument().accept(this);
			}
		});
	}
}

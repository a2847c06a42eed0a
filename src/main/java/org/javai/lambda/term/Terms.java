package org.javai.lambda.term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.UnaryOperator;

/**
 * Structural helpers over terms: navigation by {@link TermPath}, rebuilding
 * along a path, and size metrics.
 */
public final class Terms {

	private Terms() {
	}

	/**
	 * Returns the subterm found by following {@code path} from {@code term}.
	 *
	 * @throws IllegalArgumentException if a step does not match the shape found
	 */
	public static Term subtermAt(Term term, TermPath path) {
		Term current = term;
		for (TermPath.Step step : path.steps()) {
			current = child(current, step, path);
		}
		return current;
	}

	/**
	 * Rebuilds {@code term} with the subterm at {@code path} replaced by
	 * {@code rewrite} applied to it. Nodes off the path are shared, not copied.
	 */
	public static Term replaceAt(Term term, TermPath path, UnaryOperator<Term> rewrite) {
		return replaceAt(term, path, 0, rewrite);
	}

	private static Term replaceAt(Term term, TermPath path, int depth, UnaryOperator<Term> rewrite) {
		if (depth == path.steps().size()) {
			return rewrite.apply(term);
		}
		TermPath.Step step = path.steps().get(depth);
		Term child = child(term, step, path);
		Term rewritten = replaceAt(child, path, depth + 1, rewrite);
		return switch (step) {
			case FUNCTION -> new Term.Application(rewritten, ((Term.Application) term).argument());
			case ARGUMENT -> new Term.Application(((Term.Application) term).function(), rewritten);
			case BODY -> new Term.Abstraction(((Term.Abstraction) term).param(), rewritten);
		};
	}

	private static Term child(Term term, TermPath.Step step, TermPath path) {
		if (step == TermPath.Step.BODY && term instanceof Term.Abstraction abstraction) {
			return abstraction.body();
		}
		if (term instanceof Term.Application application) {
			if (step == TermPath.Step.FUNCTION) {
				return application.function();
			}
			if (step == TermPath.Step.ARGUMENT) {
				return application.argument();
			}
		}
		throw new IllegalArgumentException("Path " + path + " does not match term " + term);
	}

	/**
	 * Number of nodes in the term. Iterative, so safe on terms of any depth.
	 */
	public static int size(Term term) {
		int size = 0;
		Deque<Term> pending = new ArrayDeque<>();
		pending.push(term);
		while (!pending.isEmpty()) {
			Term current = pending.pop();
			size++;
			if (current instanceof Term.Abstraction abstraction) {
				pending.push(abstraction.body());
			} else if (current instanceof Term.Application application) {
				pending.push(application.argument());
				pending.push(application.function());
			}
		}
		return size;
	}

	/**
	 * Length of the longest root-to-leaf path; a variable has depth 1.
	 * Iterative, so safe on terms of any depth.
	 */
	public static int depth(Term term) {
		int deepest = 0;
		Deque<Level> pending = new ArrayDeque<>();
		pending.push(new Level(term, 1));
		while (!pending.isEmpty()) {
			Level level = pending.pop();
			deepest = Math.max(deepest, level.depth());
			if (level.term() instanceof Term.Abstraction abstraction) {
				pending.push(new Level(abstraction.body(), level.depth() + 1));
			} else if (level.term() instanceof Term.Application application) {
				pending.push(new Level(application.argument(), level.depth() + 1));
				pending.push(new Level(application.function(), level.depth() + 1));
			}
		}
		return deepest;
	}

	private record Level(Term term, int depth) {
	}

	public static int abstractionCount(Term term) {
		return term.accept(new TermVisitor<Integer>() {
			@Override
			public Integer visitVariable(Term.Variable variable) {
				return 0;
			}

			@Override
			public Integer visitAbstraction(Term.Abstraction abstraction) {
				return 1 + abstraction.body().accept(this);
			}

			@Override
			public Integer visitApplication(Term.Application application) {
				return application.function().accept(this) + application.argument().accept(this);
			}
		});
	}
}

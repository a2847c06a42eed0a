package org.javai.lambda.reduce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.TermPath;
import org.javai.lambda.term.TermPath.Step;

/**
 * The four redex walks. Each returns the first redex in its traversal order, or
 * {@code null} when the term has none that the strategy may contract.
 * <p>
 * Walks append the step taken at each level only while unwinding from a hit, so
 * the trail holds the path innermost first and is reversed once at the end.
 */
final class RedexSearch {

	private RedexSearch() {
	}

	static Redex leftmostOutermost(Term term) {
		List<Step> trail = new ArrayList<>();
		return located(leftmostOutermost(term, trail), trail);
	}

	static Redex leftmostInnermost(Term term) {
		List<Step> trail = new ArrayList<>();
		return located(leftmostInnermost(term, trail), trail);
	}

	static Redex weakHead(Term term) {
		List<Step> trail = new ArrayList<>();
		return located(weakHead(term, trail), trail);
	}

	static Redex weakByValue(Term term) {
		List<Step> trail = new ArrayList<>();
		return located(weakByValue(term, trail), trail);
	}

	private static Redex located(Term.Application application, List<Step> trail) {
		if (application == null) {
			return null;
		}
		Collections.reverse(trail);
		return new Redex(new TermPath(trail), application);
	}

	private static Term.Application leftmostOutermost(Term term, List<Step> trail) {
		if (term instanceof Term.Application application) {
			if (application.isRedex()) {
				return application;
			}
			Term.Application found = leftmostOutermost(application.function(), trail);
			if (found != null) {
				trail.add(Step.FUNCTION);
				return found;
			}
			found = leftmostOutermost(application.argument(), trail);
			if (found != null) {
				trail.add(Step.ARGUMENT);
			}
			return found;
		}
		if (term instanceof Term.Abstraction abstraction) {
			Term.Application found = leftmostOutermost(abstraction.body(), trail);
			if (found != null) {
				trail.add(Step.BODY);
			}
			return found;
		}
		return null;
	}

	private static Term.Application leftmostInnermost(Term term, List<Step> trail) {
		if (term instanceof Term.Application application) {
			Term.Application found = leftmostInnermost(application.function(), trail);
			if (found != null) {
				trail.add(Step.FUNCTION);
				return found;
			}
			found = leftmostInnermost(application.argument(), trail);
			if (found != null) {
				trail.add(Step.ARGUMENT);
				return found;
			}
			return application.isRedex() ? application : null;
		}
		if (term instanceof Term.Abstraction abstraction) {
			Term.Application found = leftmostInnermost(abstraction.body(), trail);
			if (found != null) {
				trail.add(Step.BODY);
			}
			return found;
		}
		return null;
	}

	// only the function position is followed: arguments and bodies stay unevaluated
	private static Term.Application weakHead(Term term, List<Step> trail) {
		if (term instanceof Term.Application application) {
			if (application.isRedex()) {
				return application;
			}
			Term.Application found = weakHead(application.function(), trail);
			if (found != null) {
				trail.add(Step.FUNCTION);
			}
			return found;
		}
		return null;
	}

	private static Term.Application weakByValue(Term term, List<Step> trail) {
		if (term instanceof Term.Application application) {
			Term.Application found = weakByValue(application.function(), trail);
			if (found != null) {
				trail.add(Step.FUNCTION);
				return found;
			}
			found = weakByValue(application.argument(), trail);
			if (found != null) {
				trail.add(Step.ARGUMENT);
				return found;
			}
			if (application.isRedex() && isValue(application.argument())) {
				return application;
			}
		}
		return null;
	}

	static boolean isValue(Term term) {
		return term instanceof Term.Variable || term instanceof Term.Abstraction;
	}
}

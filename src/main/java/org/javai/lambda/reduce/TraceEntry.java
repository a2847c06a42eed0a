package org.javai.lambda.reduce;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.TermPrinter;
import org.javai.lambda.term.Variables;

/**
 * One entry of a reduction trace.
 *
 * @param step 0 for the initial term, then 1, 2, ... per contraction
 * @param term the term after this step
 * @param action what produced the term
 * @param freeVariables sorted free variables of {@code term}
 * @param boundVariables sorted bound variables of {@code term}
 * @param redex the contracted redex, located in the previous term; null for the initial entry
 */
public record TraceEntry(
		int step,
		Term term,
		Action action,
		List<String> freeVariables,
		List<String> boundVariables,
		Redex redex
) {

	public enum Action {
		INITIAL,
		BETA;

		public String wireName() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	public TraceEntry {
		Objects.requireNonNull(term, "term must not be null");
		Objects.requireNonNull(action, "action must not be null");
		freeVariables = List.copyOf(freeVariables);
		boundVariables = List.copyOf(boundVariables);
	}

	static TraceEntry initial(Term term) {
		return new TraceEntry(0, term, Action.INITIAL,
				List.copyOf(Variables.freeVariables(term)), List.copyOf(Variables.boundVariables(term)), null);
	}

	static TraceEntry beta(int step, Term term, Redex redex) {
		return new TraceEntry(step, term, Action.BETA,
				List.copyOf(Variables.freeVariables(term)), List.copyOf(Variables.boundVariables(term)), redex);
	}

	/**
	 * Canonical rendering of {@link #term()}.
	 */
	public String rendered() {
		return TermPrinter.print(term);
	}
}

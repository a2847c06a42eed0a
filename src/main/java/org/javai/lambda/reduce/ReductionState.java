package org.javai.lambda.reduce;

import org.javai.lambda.term.Term;

/**
 * State of a {@link Reduction}. {@code Running} is the only non-terminal state.
 */
public sealed interface ReductionState {

	Term term();

	int stepsTaken();

	default boolean isTerminal() {
		return !(this instanceof Running);
	}

	record Running(Term term, int stepsTaken) implements ReductionState {
	}

	record NormalForm(Term term, int stepsTaken) implements ReductionState {
	}

	/**
	 * Budget spent, either steps or term size.
	 */
	record Exhausted(Term term, int stepsTaken, StopReason reason) implements ReductionState {
	}

	record Cancelled(Term term, int stepsTaken) implements ReductionState {
	}
}

package org.javai.lambda.reduce;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.TermPrinter;

/**
 * Outcome of a reduction, including the full trace.
 *
 * @param originalTerm the input term
 * @param finalTerm the last term reached; feed it back to continue with a larger budget
 * @param normalForm whether no redex remains under the chosen strategy
 * @param stepsTaken number of beta steps performed
 * @param maxStepsReached whether the step budget or the term size guard stopped the reduction
 * @param strategy the strategy used
 * @param stopReason why the reduction ended
 * @param originalCombinator the named combinator the input matches, or null
 * @param combinator the named combinator the final term matches, or null
 * @param trace every step, starting with the initial entry
 * @param analysis shape summary of the final term
 */
public record ReductionResult(
		Term originalTerm,
		Term finalTerm,
		boolean normalForm,
		int stepsTaken,
		boolean maxStepsReached,
		ReductionStrategy strategy,
		StopReason stopReason,
		String originalCombinator,
		String combinator,
		List<TraceEntry> trace,
		TermAnalysis analysis
) {

	public ReductionResult {
		Objects.requireNonNull(originalTerm, "originalTerm must not be null");
		Objects.requireNonNull(finalTerm, "finalTerm must not be null");
		Objects.requireNonNull(strategy, "strategy must not be null");
		Objects.requireNonNull(stopReason, "stopReason must not be null");
		trace = List.copyOf(trace);
	}

	public String renderedOriginal() {
		return TermPrinter.print(originalTerm);
	}

	public String renderedFinal() {
		return TermPrinter.print(finalTerm);
	}

	public Optional<String> combinatorName() {
		return Optional.ofNullable(combinator);
	}
}

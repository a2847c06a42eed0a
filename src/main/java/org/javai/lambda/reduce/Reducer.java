package org.javai.lambda.reduce;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.javai.lambda.combinator.CombinatorRecognizer;
import org.javai.lambda.term.Term;

/**
 * Entry point for beta reduction.
 * <p>
 * A reducer is immutable and may be shared between threads; all per-reduction
 * state lives in the {@link Reduction} it starts.
 *
 * <pre>
 * Reducer reducer = Reducer.create();
 * ReductionResult result = reducer.reduce(term, ReductionOptions.of(ReductionStrategy.NORMAL_ORDER, 100));
 * </pre>
 */
public final class Reducer {

	private final CombinatorRecognizer recognizer;

	public Reducer(CombinatorRecognizer recognizer) {
		this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
	}

	/**
	 * A reducer that annotates results against the default combinator table.
	 */
	public static Reducer create() {
		return new Reducer(CombinatorRecognizer.defaults());
	}

	/**
	 * Starts a step-by-step reduction. The initial trace entry is recorded immediately.
	 *
	 * @throws IllegalArgumentException if the term is already deeper than {@code options.maxTermDepth()}
	 */
	public Reduction start(Term term, ReductionOptions options) {
		return start(term, options, ReductionListener.NONE);
	}

	public Reduction start(Term term, ReductionOptions options, ReductionListener listener) {
		return new Reduction(term, options, recognizer, listener);
	}

	/**
	 * Reduces until a normal form is reached or the budget is spent.
	 */
	public ReductionResult reduce(Term term, ReductionOptions options) {
		return start(term, options).run();
	}

	/**
	 * Reduces, checking {@code cancellation} before every step.
	 */
	public ReductionResult reduce(Term term, ReductionOptions options, BooleanSupplier cancellation) {
		return reduce(term, options, cancellation, ReductionListener.NONE);
	}

	public ReductionResult reduce(Term term, ReductionOptions options, BooleanSupplier cancellation,
			ReductionListener listener) {
		Objects.requireNonNull(cancellation, "cancellation must not be null");
		Reduction reduction = start(term, options, listener);
		while (!reduction.isFinished()) {
			if (cancellation.getAsBoolean()) {
				reduction.cancel();
				break;
			}
			reduction.step();
		}
		return reduction.result();
	}
}

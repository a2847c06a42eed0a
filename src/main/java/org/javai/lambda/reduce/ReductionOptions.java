package org.javai.lambda.reduce;

import java.util.Objects;

/**
 * Options for a single reduction.
 *
 * @param strategy which redex to contract next
 * @param maxSteps beta steps allowed before giving up; zero only records the initial term
 * @param maxTermSize node count above which a term is treated as diverging
 * @param maxTermDepth nesting depth above which a term is treated as diverging
 */
public record ReductionOptions(
		ReductionStrategy strategy,
		int maxSteps,
		int maxTermSize,
		int maxTermDepth
) {

	public static final int DEFAULT_MAX_STEPS = 1000;
	public static final int DEFAULT_MAX_TERM_SIZE = 10_000;
	public static final int DEFAULT_MAX_TERM_DEPTH = 500;

	public ReductionOptions {
		Objects.requireNonNull(strategy, "strategy must not be null");
		if (maxSteps < 0) {
			throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
		}
		if (maxTermSize < 1) {
			throw new IllegalArgumentException("maxTermSize must be positive: " + maxTermSize);
		}
		if (maxTermDepth < 1) {
			throw new IllegalArgumentException("maxTermDepth must be positive: " + maxTermDepth);
		}
	}

	public static ReductionOptions defaults() {
		return new ReductionOptions(ReductionStrategy.NORMAL_ORDER, DEFAULT_MAX_STEPS, DEFAULT_MAX_TERM_SIZE,
				DEFAULT_MAX_TERM_DEPTH);
	}

	public static ReductionOptions of(ReductionStrategy strategy, int maxSteps) {
		return new ReductionOptions(strategy, maxSteps, DEFAULT_MAX_TERM_SIZE, DEFAULT_MAX_TERM_DEPTH);
	}

	public ReductionOptions withStrategy(ReductionStrategy strategy) {
		return new ReductionOptions(strategy, maxSteps, maxTermSize, maxTermDepth);
	}

	public ReductionOptions withMaxSteps(int maxSteps) {
		return new ReductionOptions(strategy, maxSteps, maxTermSize, maxTermDepth);
	}

	public ReductionOptions withMaxTermSize(int maxTermSize) {
		return new ReductionOptions(strategy, maxSteps, maxTermSize, maxTermDepth);
	}

	public ReductionOptions withMaxTermDepth(int maxTermDepth) {
		return new ReductionOptions(strategy, maxSteps, maxTermSize, maxTermDepth);
	}
}

package org.javai.lambda.reduce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.lambda.combinator.CombinatorRecognizer;
import org.javai.lambda.term.AlphaEquivalence;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.Terms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A reduction in progress, driven one beta step at a time.
 * <p>
 * Each call to {@link #step()} either contracts the next redex chosen by the
 * strategy or moves the reduction to a terminal state. Callers that need a wall
 * clock limit check their own signal between steps and call {@link #cancel()}.
 * Instances are confined to one thread; independent reductions share nothing.
 */
public final class Reduction {

	private static final Logger logger = LoggerFactory.getLogger(Reduction.class);

	private final Term originalTerm;
	private final ReductionOptions options;
	private final CombinatorRecognizer recognizer;
	private final ReductionListener listener;
	private final List<TraceEntry> trace = new ArrayList<>();

	private ReductionState state;
	private boolean cycleDetected;
	private ReductionResult result;

	Reduction(Term originalTerm, ReductionOptions options, CombinatorRecognizer recognizer,
			ReductionListener listener) {
		this.originalTerm = Objects.requireNonNull(originalTerm, "term must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
		this.listener = listener != null ? listener : ReductionListener.NONE;
		int depth = Terms.depth(originalTerm);
		if (depth > options.maxTermDepth()) {
			throw new IllegalArgumentException(
					"Term depth " + depth + " exceeds the limit of " + options.maxTermDepth());
		}
		this.state = new ReductionState.Running(originalTerm, 0);
		record(TraceEntry.initial(originalTerm));
	}

	/**
	 * Performs at most one beta step.
	 *
	 * @return the trace entry for the contraction, or empty if the reduction is
	 *         now (or already was) in a terminal state
	 */
	public Optional<TraceEntry> step() {
		if (state.isTerminal()) {
			return Optional.empty();
		}
		Term current = state.term();
		int stepsTaken = state.stepsTaken();

		Optional<Redex> redex = options.strategy().findRedex(current);
		if (redex.isEmpty()) {
			finish(new ReductionState.NormalForm(current, stepsTaken));
			return Optional.empty();
		}
		if (stepsTaken >= options.maxSteps()) {
			finish(new ReductionState.Exhausted(current, stepsTaken, StopReason.STEP_LIMIT));
			return Optional.empty();
		}

		Redex contracted = redex.get();
		Term next = Terms.replaceAt(current, contracted.path(), ignored -> contracted.contract());
		int step = stepsTaken + 1;
		TraceEntry entry = TraceEntry.beta(step, next, contracted);
		record(entry);

		if (!cycleDetected && AlphaEquivalence.equivalent(current, next)) {
			cycleDetected = true;
			logger.warn("Step {} reproduced the previous term {}; reduction under {} does not terminate",
					step, entry.rendered(), options.strategy().wireName());
		}

		int size = Terms.size(next);
		int depth = Terms.depth(next);
		if (size > options.maxTermSize()) {
			logger.warn("Term grew to {} nodes after step {} (limit {}); stopping as divergent",
					size, step, options.maxTermSize());
			finish(new ReductionState.Exhausted(next, step, StopReason.TERM_SIZE_LIMIT));
		} else if (depth > options.maxTermDepth()) {
			logger.warn("Term nested {} levels deep after step {} (limit {}); stopping as divergent",
					depth, step, options.maxTermDepth());
			finish(new ReductionState.Exhausted(next, step, StopReason.TERM_DEPTH_LIMIT));
		} else {
			state = new ReductionState.Running(next, step);
		}
		return Optional.of(entry);
	}

	/**
	 * Steps until a terminal state is reached.
	 */
	public ReductionResult run() {
		while (!isFinished()) {
			step();
		}
		return result();
	}

	/**
	 * Stops a running reduction, keeping the trace accumulated so far.
	 * Has no effect once the reduction is finished.
	 */
	public void cancel() {
		if (!state.isTerminal()) {
			logger.debug("Reduction cancelled after {} steps", state.stepsTaken());
			finish(new ReductionState.Cancelled(state.term(), state.stepsTaken()));
		}
	}

	public boolean isFinished() {
		return state.isTerminal();
	}

	public ReductionState state() {
		return state;
	}

	public Term currentTerm() {
		return state.term();
	}

	public int stepsTaken() {
		return state.stepsTaken();
	}

	public List<TraceEntry> trace() {
		return Collections.unmodifiableList(trace);
	}

	/**
	 * The result of a finished reduction.
	 *
	 * @throws IllegalStateException while the reduction is still running
	 */
	public ReductionResult result() {
		if (result == null) {
			throw new IllegalStateException("Reduction is still running after " + state.stepsTaken() + " steps");
		}
		return result;
	}

	private void record(TraceEntry entry) {
		trace.add(entry);
		if (logger.isDebugEnabled()) {
			logger.debug("[{}] step {} {}: {}", options.strategy().wireName(), entry.step(),
					entry.action().wireName(), entry.rendered());
		}
		try {
			listener.onStep(entry);
		} catch (RuntimeException e) {
			logger.warn("Reduction listener failed on step {}; continuing", entry.step(), e);
		}
	}

	private void finish(ReductionState terminal) {
		state = terminal;
		StopReason reason;
		if (terminal instanceof ReductionState.NormalForm) {
			reason = StopReason.NORMAL_FORM;
		} else if (terminal instanceof ReductionState.Exhausted exhausted) {
			reason = exhausted.reason();
		} else if (terminal instanceof ReductionState.Cancelled) {
			reason = StopReason.CANCELLED;
		} else {
			throw new IllegalStateException("Not a terminal state: " + terminal);
		}
		Term finalTerm = terminal.term();
		result = new ReductionResult(
				originalTerm,
				finalTerm,
				reason == StopReason.NORMAL_FORM,
				terminal.stepsTaken(),
				reason.budgetExhausted(),
				options.strategy(),
				reason,
				recognizer.identify(originalTerm).orElse(null),
				recognizer.identify(finalTerm).orElse(null),
				trace,
				TermAnalysis.of(finalTerm, cycleDetected));
		logger.info("Reduction under {} finished: {} after {} steps", options.strategy().wireName(),
				reason.wireName(), terminal.stepsTaken());
		try {
			listener.onFinished(result);
		} catch (RuntimeException e) {
			logger.warn("Reduction listener failed on completion", e);
		}
	}
}

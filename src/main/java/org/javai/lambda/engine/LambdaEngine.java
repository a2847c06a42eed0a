package org.javai.lambda.engine;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.javai.lambda.reduce.Reducer;
import org.javai.lambda.reduce.ReductionListener;
import org.javai.lambda.reduce.ReductionOptions;
import org.javai.lambda.reduce.ReductionResult;
import org.javai.lambda.reduce.ReductionStrategy;
import org.javai.lambda.syntax.LambdaParser;
import org.javai.lambda.syntax.LambdaSyntaxException;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.TermPrinter;
import org.javai.lambda.term.Terms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses an expression and reduces it, packaging everything an outer layer
 * (HTTP, job queue, push channel) needs into an {@link EvaluationResult}.
 * <p>
 * Evaluation never throws for bad input: syntax errors, unknown strategies,
 * invalid budgets and over-deep terms come back as failed results. The engine
 * holds no per-call state and may be shared between threads.
 */
public final class LambdaEngine {

	private static final Logger logger = LoggerFactory.getLogger(LambdaEngine.class);

	private final Reducer reducer;

	public LambdaEngine(Reducer reducer) {
		this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
	}

	public static LambdaEngine create() {
		return new LambdaEngine(Reducer.create());
	}

	/**
	 * Evaluates with normal order and the default step budget.
	 */
	public EvaluationResult evaluate(String expression) {
		return evaluate(expression, ReductionOptions.defaults());
	}

	/**
	 * Evaluates with wire-level parameters.
	 *
	 * @param expression the lambda expression
	 * @param strategyName one of {@code normal_order}, {@code applicative_order},
	 *        {@code call_by_name}, {@code call_by_value}; null selects normal order
	 * @param maxSteps a positive step budget
	 */
	public EvaluationResult evaluate(String expression, String strategyName, int maxSteps) {
		ReductionStrategy strategy;
		try {
			strategy = strategyName == null ? ReductionStrategy.NORMAL_ORDER : ReductionStrategy.fromWireName(strategyName);
		} catch (IllegalArgumentException e) {
			return EvaluationResult.failure(expression, e.getMessage());
		}
		if (maxSteps < 1) {
			return EvaluationResult.failure(expression, "max_steps must be a positive integer, got " + maxSteps);
		}
		return evaluate(expression, ReductionOptions.defaults().withStrategy(strategy).withMaxSteps(maxSteps));
	}

	public EvaluationResult evaluate(String expression, ReductionOptions options) {
		return evaluate(expression, options, () -> false, ReductionListener.NONE);
	}

	/**
	 * Evaluates with a cancellation signal checked between steps and a listener
	 * receiving each trace entry as it is produced.
	 */
	public EvaluationResult evaluate(String expression, ReductionOptions options, BooleanSupplier cancellation,
			ReductionListener listener) {
		Objects.requireNonNull(options, "options must not be null");
		Term term;
		try {
			term = parse(expression);
		} catch (LambdaSyntaxException e) {
			logger.debug("Rejected expression '{}': {}", expression, e.getMessage());
			return EvaluationResult.failure(expression, "Syntax error: " + e.getMessage());
		}
		int depth = Terms.depth(term);
		if (depth > options.maxTermDepth()) {
			logger.debug("Rejected expression '{}': depth {} over {}", expression, depth, options.maxTermDepth());
			return EvaluationResult.failure(expression,
					"Term depth " + depth + " exceeds the limit of " + options.maxTermDepth());
		}
		ReductionResult reduction = reducer.reduce(term, options, cancellation, listener);
		return EvaluationResult.success(expression, TermPrinter.print(term), reduction);
	}

	/**
	 * Parses without reducing.
	 *
	 * @throws LambdaSyntaxException if the expression is not well formed
	 */
	public Term parse(String expression) {
		if (expression == null) {
			throw new LambdaSyntaxException("Empty expression", 0);
		}
		return LambdaParser.parse(expression);
	}
}

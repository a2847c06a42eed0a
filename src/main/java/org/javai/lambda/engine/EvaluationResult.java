package org.javai.lambda.engine;

import java.util.Optional;
import org.javai.lambda.reduce.ReductionResult;

/**
 * Structured outcome of evaluating one expression: either a parsed term with
 * its reduction, or an error message.
 *
 * @param success whether the expression parsed and was reduced
 * @param expression the input, echoed back
 * @param parsedTerm canonical rendering of the parsed term; null when parsing failed
 * @param reduction the reduction; null on failure
 * @param error the failure message; null on success
 */
public record EvaluationResult(
		boolean success,
		String expression,
		String parsedTerm,
		ReductionResult reduction,
		String error
) {

	public static EvaluationResult success(String expression, String parsedTerm, ReductionResult reduction) {
		return new EvaluationResult(true, expression, parsedTerm, reduction, null);
	}

	public static EvaluationResult failure(String expression, String error) {
		return new EvaluationResult(false, expression, null, null, error);
	}

	public Optional<ReductionResult> reductionResult() {
		return Optional.ofNullable(reduction);
	}
}

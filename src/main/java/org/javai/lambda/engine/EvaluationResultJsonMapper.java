package org.javai.lambda.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.lambda.reduce.Redex;
import org.javai.lambda.reduce.ReductionResult;
import org.javai.lambda.reduce.TermAnalysis;
import org.javai.lambda.reduce.TraceEntry;
import org.javai.lambda.term.TermPrinter;

/**
 * Converts {@link EvaluationResult} into the JSON document consumed by the API,
 * persistence and push layers.
 */
public final class EvaluationResultJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private EvaluationResultJsonMapper() {
	}

	public static ObjectNode toJson(EvaluationResult result) {
		ObjectNode node = mapper.createObjectNode();
		node.put("success", result.success());
		node.put("expression", result.expression());
		node.put("parsed_term", result.parsedTerm());
		if (result.reduction() != null) {
			node.set("beta_reduction", toJson(result.reduction()));
		} else {
			node.putNull("beta_reduction");
		}
		node.put("error", result.error());
		return node;
	}

	public static ObjectNode toJson(ReductionResult reduction) {
		ObjectNode node = mapper.createObjectNode();
		node.put("original_term", reduction.renderedOriginal());
		node.put("final_term", reduction.renderedFinal());
		node.put("is_normal_form", reduction.normalForm());
		node.put("steps_taken", reduction.stepsTaken());
		node.put("max_steps_reached", reduction.maxStepsReached());
		node.put("strategy", reduction.strategy().wireName());
		node.put("stop_reason", reduction.stopReason().wireName());
		node.put("original_combinator", reduction.originalCombinator());
		node.put("combinator", reduction.combinator());
		ArrayNode steps = node.putArray("reduction_steps");
		for (TraceEntry entry : reduction.trace()) {
			steps.add(toJson(entry));
		}
		node.set("analysis", toJson(reduction.analysis()));
		return node;
	}

	public static ObjectNode toJson(TraceEntry entry) {
		ObjectNode node = mapper.createObjectNode();
		node.put("step", entry.step());
		node.put("term", entry.rendered());
		node.put("action", entry.action().wireName());
		node.set("free_variables", stringArray(entry.freeVariables()));
		node.set("bound_variables", stringArray(entry.boundVariables()));
		Redex redex = entry.redex();
		if (redex == null) {
			node.putNull("redex");
		} else {
			ObjectNode redexNode = node.putObject("redex");
			redexNode.set("path", stringArray(redex.path().wireNames()));
			redexNode.put("parameter", redex.parameter());
			redexNode.put("function", TermPrinter.print(redex.function()));
			redexNode.put("argument", TermPrinter.print(redex.argument()));
		}
		return node;
	}

	public static ObjectNode toJson(TermAnalysis analysis) {
		ObjectNode node = mapper.createObjectNode();
		node.put("term_type", analysis.termType().wireName());
		node.put("abstraction_count", analysis.abstractionCount());
		node.put("is_closed", analysis.closed());
		node.put("size", analysis.size());
		node.put("depth", analysis.depth());
		node.put("cycle_detected", analysis.cycleDetected());
		return node;
	}

	/**
	 * Serializes a result to a compact JSON string.
	 */
	public static String toJsonString(EvaluationResult result) {
		try {
			return mapper.writeValueAsString(toJson(result));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize evaluation result", e);
		}
	}

	private static ArrayNode stringArray(List<String> values) {
		ArrayNode array = mapper.createArrayNode();
		values.forEach(array::add);
		return array;
	}
}

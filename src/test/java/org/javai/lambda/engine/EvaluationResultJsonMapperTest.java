package org.javai.lambda.engine;

import static org.assertj.core.api.Assertions.assertThat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EvaluationResultJsonMapperTest {

	private final LambdaEngine engine = LambdaEngine.create();

	@Test
	@DisplayName("Successful result carries the full reduction document")
	void successDocument() {
		ObjectNode json = EvaluationResultJsonMapper.toJson(engine.evaluate("(\\x.\\y.x) a b", "normal_order", 10));

		assertThat(json.get("success").asBoolean()).isTrue();
		assertThat(json.get("expression").asText()).isEqualTo("(\\x.\\y.x) a b");
		assertThat(json.get("parsed_term").asText()).isEqualTo("(λx.λy.x) a b");
		assertThat(json.get("error").isNull()).isTrue();

		JsonNode reduction = json.get("beta_reduction");
		assertThat(reduction.get("original_term").asText()).isEqualTo("(λx.λy.x) a b");
		assertThat(reduction.get("final_term").asText()).isEqualTo("a");
		assertThat(reduction.get("is_normal_form").asBoolean()).isTrue();
		assertThat(reduction.get("steps_taken").asInt()).isEqualTo(2);
		assertThat(reduction.get("max_steps_reached").asBoolean()).isFalse();
		assertThat(reduction.get("strategy").asText()).isEqualTo("normal_order");
		assertThat(reduction.get("stop_reason").asText()).isEqualTo("normal_form");
		assertThat(reduction.get("original_combinator").isNull()).isTrue();
		assertThat(reduction.get("combinator").isNull()).isTrue();
		assertThat(reduction.get("reduction_steps")).hasSize(3);
	}

	@Test
	@DisplayName("Trace entries list their variables and the contracted redex")
	void traceEntries() {
		JsonNode steps = EvaluationResultJsonMapper.toJson(engine.evaluate("(\\x.\\y.x) a b"))
				.get("beta_reduction").get("reduction_steps");

		JsonNode initial = steps.get(0);
		assertThat(initial.get("step").asInt()).isZero();
		assertThat(initial.get("action").asText()).isEqualTo("initial");
		assertThat(initial.get("term").asText()).isEqualTo("(λx.λy.x) a b");
		assertThat(initial.get("free_variables").toString()).isEqualTo("[\"a\",\"b\"]");
		assertThat(initial.get("bound_variables").toString()).isEqualTo("[\"x\",\"y\"]");
		assertThat(initial.get("redex").isNull()).isTrue();

		JsonNode first = steps.get(1);
		assertThat(first.get("action").asText()).isEqualTo("beta");
		assertThat(first.get("term").asText()).isEqualTo("(λy.a) b");
		JsonNode redex = first.get("redex");
		assertThat(redex.get("path").toString()).isEqualTo("[\"function\"]");
		assertThat(redex.get("parameter").asText()).isEqualTo("x");
		assertThat(redex.get("function").asText()).isEqualTo("λx.λy.x");
		assertThat(redex.get("argument").asText()).isEqualTo("a");

		assertThat(steps.get(2).get("redex").get("path")).isEmpty();
	}

	@Test
	@DisplayName("Analysis describes the final term")
	void analysis() {
		JsonNode analysis = EvaluationResultJsonMapper.toJson(engine.evaluate("\\x.\\y.x"))
				.get("beta_reduction").get("analysis");

		assertThat(analysis.get("term_type").asText()).isEqualTo("closed_abstraction");
		assertThat(analysis.get("abstraction_count").asInt()).isEqualTo(2);
		assertThat(analysis.get("is_closed").asBoolean()).isTrue();
		assertThat(analysis.get("size").asInt()).isEqualTo(3);
		assertThat(analysis.get("depth").asInt()).isEqualTo(3);
		assertThat(analysis.get("cycle_detected").asBoolean()).isFalse();
	}

	@Test
	@DisplayName("Combinator names appear for recognized terms")
	void combinatorNames() {
		JsonNode reduction = EvaluationResultJsonMapper.toJson(engine.evaluate("(\\x.x) (\\a.\\b.a)"))
				.get("beta_reduction");

		assertThat(reduction.get("original_combinator").isNull()).isTrue();
		assertThat(reduction.get("combinator").asText()).isEqualTo("K");
	}

	@Test
	@DisplayName("Failure document has nulls for the missing parts")
	void failureDocument() throws Exception {
		String text = EvaluationResultJsonMapper.toJsonString(engine.evaluate("x)"));

		JsonNode json = new ObjectMapper().readTree(text);
		assertThat(json.get("success").asBoolean()).isFalse();
		assertThat(json.get("parsed_term").isNull()).isTrue();
		assertThat(json.get("beta_reduction").isNull()).isTrue();
		assertThat(json.get("error").asText()).startsWith("Syntax error: Unexpected ')'");
	}
}

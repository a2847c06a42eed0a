package org.javai.lambda.term;

import static org.assertj.core.api.Assertions.assertThat;
import org.javai.lambda.syntax.LambdaParser;
import org.junit.jupiter.api.Test;

class VariablesTest {

	@Test
	void variableIsFreeInItself() {
		Term term = LambdaParser.parse("x");

		assertThat(Variables.freeVariables(term)).containsExactly("x");
		assertThat(Variables.boundVariables(term)).isEmpty();
	}

	@Test
	void abstractionBindsItsParameter() {
		Term term = LambdaParser.parse("\\x.x y");

		assertThat(Variables.freeVariables(term)).containsExactly("y");
		assertThat(Variables.boundVariables(term)).containsExactly("x");
	}

	@Test
	void sameNameCanBeFreeAndBound() {
		Term term = LambdaParser.parse("x (\\x.x)");

		assertThat(Variables.freeVariables(term)).containsExactly("x");
		assertThat(Variables.boundVariables(term)).containsExactly("x");
	}

	@Test
	void shadowedBinderStaysBoundAfterInnerScopeCloses() {
		Term term = LambdaParser.parse("\\x.(\\x.x) x");

		assertThat(Variables.freeVariables(term)).isEmpty();
		assertThat(Variables.isClosed(term)).isTrue();
	}

	@Test
	void unusedBinderIsStillReportedAsBound() {
		Term term = LambdaParser.parse("\\x.\\y.z");

		assertThat(Variables.freeVariables(term)).containsExactly("z");
		assertThat(Variables.boundVariables(term)).containsExactly("x", "y");
	}

	@Test
	void resultsAreSorted() {
		Term term = LambdaParser.parse("z y x (\\c.\\b.\\a.a)");

		assertThat(Variables.freeVariables(term)).containsExactly("x", "y", "z");
		assertThat(Variables.boundVariables(term)).containsExactly("a", "b", "c");
	}

	@Test
	void allNamesIncludesBindersAndOccurrences() {
		Term term = LambdaParser.parse("\\x.\\y.z");

		assertThat(Variables.allNames(term)).containsExactly("x", "y", "z");
	}

	@Test
	void isFreeInRespectsShadowing() {
		Term term = LambdaParser.parse("(\\x.x) y");

		assertThat(Variables.isFreeIn("x", term)).isFalse();
		assertThat(Variables.isFreeIn("y", term)).isTrue();
		assertThat(Variables.isFreeIn("z", term)).isFalse();
	}
}

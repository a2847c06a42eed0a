package org.javai.lambda.term;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.lambda.term.Term.apply;
import static org.javai.lambda.term.Term.lambda;
import static org.javai.lambda.term.Term.var;
import org.javai.lambda.syntax.LambdaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Capture-avoiding substitution")
class SubstitutionTest {

	@Nested
	@DisplayName("Basic cases")
	class BasicTests {

		@Test
		@DisplayName("Matching variable is replaced")
		void matchingVariable() {
			assertThat(Substitution.substitute(var("x"), "x", var("z"))).isEqualTo(var("z"));
		}

		@Test
		@DisplayName("Other variable is returned unchanged")
		void otherVariable() {
			Term y = var("y");

			assertThat(Substitution.substitute(y, "x", var("z"))).isSameAs(y);
		}

		@Test
		@DisplayName("Application substitutes into both sides")
		void application() {
			Term term = LambdaParser.parse("x (f x)");

			assertThat(Substitution.substitute(term, "x", var("a")))
					.isEqualTo(LambdaParser.parse("a (f a)"));
		}

		@Test
		@DisplayName("Binder with the target name shadows it")
		void shadowing() {
			Term term = LambdaParser.parse("\\x.x");

			assertThat(Substitution.substitute(term, "x", var("z"))).isSameAs(term);
		}

		@Test
		@DisplayName("Only free occurrences are replaced")
		void onlyFreeOccurrences() {
			Term term = LambdaParser.parse("x (\\x.x)");

			assertThat(Substitution.substitute(term, "x", var("a")))
					.isEqualTo(LambdaParser.parse("a (\\x.x)"));
		}
	}

	@Nested
	@DisplayName("Variable capture")
	class CaptureTests {

		@Test
		@DisplayName("Replacement without the binder's name passes straight through")
		void noCaptureRisk() {
			Term term = LambdaParser.parse("\\y.x");

			Term result = Substitution.substitute(term, "x", apply(var("a"), var("b")));

			assertThat(result).isEqualTo(lambda("y", apply(var("a"), var("b"))));
		}

		@Test
		@DisplayName("Binder is renamed when the replacement mentions it free")
		void captureIsAvoided() {
			Term term = LambdaParser.parse("\\y.x");

			Term result = Substitution.substitute(term, "x", var("y"));

			assertThat(result).isEqualTo(lambda("ya", var("y")));
			assertThat(Variables.freeVariables(result)).containsExactly("y");
		}

		@Test
		@DisplayName("Renamed binder keeps its own occurrences bound")
		void renamedBinderOccurrences() {
			Term term = LambdaParser.parse("\\y.x y");

			Term result = Substitution.substitute(term, "x", var("y"));

			assertThat(AlphaEquivalence.equivalent(result, LambdaParser.parse("\\q.y q"))).isTrue();
			assertThat(Variables.freeVariables(result)).containsExactly("y");
		}

		@Test
		@DisplayName("Fresh name avoids names already used inside the body")
		void freshNameAvoidsInnerBinders() {
			Term term = LambdaParser.parse("\\y.\\ya.x y ya");

			Term result = Substitution.substitute(term, "x", var("y"));

			assertThat(result).isInstanceOf(Term.Abstraction.class);
			assertThat(((Term.Abstraction) result).param()).isEqualTo("yb");
			assertThat(AlphaEquivalence.equivalent(result, LambdaParser.parse("\\p.\\q.y p q"))).isTrue();
		}

		@Test
		@DisplayName("No renaming when the target does not occur under the binder")
		void noRenamingWithoutOccurrence() {
			Term term = LambdaParser.parse("\\y.z");

			assertThat(Substitution.substitute(term, "x", var("y"))).isSameAs(term);
		}

		@Test
		@DisplayName("Inputs are left untouched")
		void inputsAreImmutable() {
			Term term = LambdaParser.parse("\\y.x y");
			Term replacement = var("y");
			String before = TermPrinter.print(term);

			Substitution.substitute(term, "x", replacement);

			assertThat(TermPrinter.print(term)).isEqualTo(before);
			assertThat(replacement).isEqualTo(var("y"));
		}
	}

	@Nested
	@DisplayName("Renaming")
	class RenameTests {

		@Test
		@DisplayName("Rename rewrites bound occurrences only")
		void renameParameter() {
			Term.Abstraction abstraction = (Term.Abstraction) LambdaParser.parse("\\x.x y");

			assertThat(Substitution.rename(abstraction, "z")).isEqualTo(LambdaParser.parse("\\z.z y"));
		}

		@Test
		@DisplayName("Rename to a free name of the body is refused")
		void renameToFreeName() {
			Term.Abstraction abstraction = (Term.Abstraction) LambdaParser.parse("\\x.x y");

			assertThatThrownBy(() -> Substitution.rename(abstraction, "y"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("free in the body");
		}
	}
}

package org.javai.lambda.term;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FreshNamesTest {

	@Test
	void suffixIsBijectiveBase26() {
		assertThat(FreshNames.suffix(1)).isEqualTo("a");
		assertThat(FreshNames.suffix(26)).isEqualTo("z");
		assertThat(FreshNames.suffix(27)).isEqualTo("aa");
		assertThat(FreshNames.suffix(28)).isEqualTo("ab");
		assertThat(FreshNames.suffix(702)).isEqualTo("zz");
		assertThat(FreshNames.suffix(703)).isEqualTo("aaa");
	}

	@Test
	void firstCandidateOutsideAvoidedSetWins() {
		assertThat(FreshNames.fresh("x", Set.of())).isEqualTo("xa");
		assertThat(FreshNames.fresh("x", Set.of("xa", "xb"))).isEqualTo("xc");
	}

	@Test
	void generatedNamesAreValidIdentifiers() {
		String name = FreshNames.fresh("y", Set.of("ya"));

		assertThat(Identifiers.isValid(name)).isTrue();
	}

	@Test
	void sameInputsGiveSameName() {
		Set<String> avoid = Set.of("xa", "xc");

		assertThat(FreshNames.fresh("x", avoid)).isEqualTo(FreshNames.fresh("x", avoid)).isEqualTo("xb");
	}

	@Test
	void invalidBaseIsRejected() {
		assertThatThrownBy(() -> FreshNames.fresh("x1", Set.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}

package org.javai.lambda.combinator;

import java.util.Objects;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.Variables;

/**
 * A named closed term.
 *
 * @param name display name, e.g. {@code K}
 * @param term the defining term
 */
public record Combinator(String name, Term term) {

	public Combinator {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Combinator name must not be blank");
		}
		Objects.requireNonNull(term, "term must not be null");
		if (!Variables.isClosed(term)) {
			throw new IllegalArgumentException(
					"Combinator '" + name + "' is not closed; free variables: " + Variables.freeVariables(term));
		}
	}
}

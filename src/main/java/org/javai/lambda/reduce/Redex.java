package org.javai.lambda.reduce;

import java.util.Objects;
import org.javai.lambda.term.Substitution;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.TermPath;

/**
 * A located redex {@code (λx.body) argument}.
 *
 * @param path where the redex sits in the enclosing term
 * @param application the redex itself
 */
public record Redex(TermPath path, Term.Application application) {

	public Redex {
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(application, "application must not be null");
		if (!application.isRedex()) {
			throw new IllegalArgumentException("Not a redex: " + application);
		}
	}

	public Term.Abstraction function() {
		return (Term.Abstraction) application.function();
	}

	public Term argument() {
		return application.argument();
	}

	public String parameter() {
		return function().param();
	}

	/**
	 * Beta-contracts this redex: {@code body[x := argument]}.
	 */
	public Term contract() {
		return Substitution.substitute(function().body(), parameter(), argument());
	}
}

package org.javai.lambda.reduce;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import org.javai.lambda.term.Term;

/**
 * Evaluation strategies. They differ only in which redex is contracted next;
 * each one maps to a fixed walk in {@link RedexSearch}.
 */
public enum ReductionStrategy {

	/** Leftmost-outermost, reducing under abstractions. Finds a normal form whenever one exists. */
	NORMAL_ORDER,

	/** Leftmost-innermost: both sides of an application are reduced before the application itself. */
	APPLICATIVE_ORDER,

	/** Weak head reduction along the spine; arguments and abstraction bodies are left alone. */
	CALL_BY_NAME,

	/** Weak, innermost reduction; a redex is contracted only once its argument is a value. */
	CALL_BY_VALUE;

	/**
	 * Name used on the wire, e.g. {@code normal_order}.
	 */
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Resolves a wire name, ignoring case.
	 *
	 * @throws IllegalArgumentException for an unknown name
	 */
	public static ReductionStrategy fromWireName(String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Strategy name must not be blank");
		}
		String normalized = name.trim().toUpperCase(Locale.ROOT);
		return Arrays.stream(values())
				.filter(s -> s.name().equals(normalized))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown reduction strategy '" + name
						+ "'; expected one of normal_order, applicative_order, call_by_name, call_by_value"));
	}

	/**
	 * Locates the redex this strategy contracts next, if any.
	 */
	public Optional<Redex> findRedex(Term term) {
		return Optional.ofNullable(switch (this) {
			case NORMAL_ORDER -> RedexSearch.leftmostOutermost(term);
			case APPLICATIVE_ORDER -> RedexSearch.leftmostInnermost(term);
			case CALL_BY_NAME -> RedexSearch.weakHead(term);
			case CALL_BY_VALUE -> RedexSearch.weakByValue(term);
		});
	}
}

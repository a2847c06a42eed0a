package org.javai.lambda.combinator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.javai.lambda.term.AlphaEquivalence;
import org.javai.lambda.term.Term;

/**
 * Names a term when it is alpha-equivalent to an entry of a {@link CombinatorTable}.
 * <p>
 * The named entries are consulted first, in table order; otherwise Church
 * numerals {@code λf.λx.f (f ... (f x))} are recognized by counting the
 * applications of {@code f}. Immutable and safe to share.
 */
public final class CombinatorRecognizer {

	private static final String CHURCH_NUMERAL_PREFIX = "Church numeral ";

	private final Map<String, String> namesByKey = new LinkedHashMap<>();
	private final int maxChurchNumeral;

	public CombinatorRecognizer(CombinatorTable table) {
		Objects.requireNonNull(table, "table must not be null");
		for (Combinator combinator : table.combinators()) {
			namesByKey.putIfAbsent(AlphaEquivalence.canonicalKey(combinator.term()), combinator.name());
		}
		this.maxChurchNumeral = table.maxChurchNumeral();
	}

	/**
	 * Recognizer backed by the table shipped on the classpath.
	 */
	public static CombinatorRecognizer defaults() {
		return DefaultHolder.INSTANCE;
	}

	/**
	 * Returns the name of the first table entry matching {@code term}, if any.
	 */
	public Optional<String> identify(Term term) {
		Objects.requireNonNull(term, "term must not be null");
		String named = namesByKey.get(AlphaEquivalence.canonicalKey(term));
		if (named != null) {
			return Optional.of(named);
		}
		OptionalInt numeral = churchNumeral(term);
		if (numeral.isPresent() && numeral.getAsInt() <= maxChurchNumeral) {
			return Optional.of(CHURCH_NUMERAL_PREFIX + numeral.getAsInt());
		}
		return Optional.empty();
	}

	/**
	 * Decodes {@code λf.λx.f (f ... (f x))} to the number of applications of {@code f}.
	 */
	public static OptionalInt churchNumeral(Term term) {
		if (!(term instanceof Term.Abstraction outer) || !(outer.body() instanceof Term.Abstraction inner)) {
			return OptionalInt.empty();
		}
		String f = outer.param();
		String x = inner.param();
		if (f.equals(x)) {
			return OptionalInt.empty();
		}
		int count = 0;
		Term current = inner.body();
		while (current instanceof Term.Application application
				&& application.function() instanceof Term.Variable function
				&& function.name().equals(f)) {
			count++;
			current = application.argument();
		}
		if (current instanceof Term.Variable base && base.name().equals(x)) {
			return OptionalInt.of(count);
		}
		return OptionalInt.empty();
	}

	private static final class DefaultHolder {
		private static final CombinatorRecognizer INSTANCE = new CombinatorRecognizer(CombinatorTable.defaults());
	}
}

package org.javai.lambda.combinator;

import java.util.List;

/**
 * Ordered table of named combinators plus the range of Church numerals to
 * recognize structurally.
 *
 * @param combinators named entries, consulted in order
 * @param maxChurchNumeral largest numeral reported; negative disables numeral recognition
 */
public record CombinatorTable(List<Combinator> combinators, int maxChurchNumeral) {

	public static final String DEFAULT_RESOURCE = "META-INF/lambda-combinators.yml";
	public static final int DEFAULT_MAX_CHURCH_NUMERAL = 64;

	public CombinatorTable {
		combinators = List.copyOf(combinators);
	}

	/**
	 * Loads the table shipped on the classpath.
	 *
	 * @throws CombinatorTableException if the resource is missing or malformed
	 */
	public static CombinatorTable defaults() {
		return new CombinatorTableParser().parseResource(DEFAULT_RESOURCE, CombinatorTable.class.getClassLoader());
	}
}

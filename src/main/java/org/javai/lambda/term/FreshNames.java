package org.javai.lambda.term;

import java.util.Set;

/**
 * Deterministic fresh identifier generation.
 * <p>
 * Candidates are the base name followed by a letter suffix ({@code x} yields
 * {@code xa}, {@code xb}, ..., {@code xz}, {@code xaa}, ...) and the first one
 * outside the avoided set wins. The choice depends only on the arguments, so
 * concurrent reductions cannot interfere with each other.
 */
public final class FreshNames {

	private FreshNames() {
	}

	/**
	 * Returns an identifier derived from {@code base} that is not contained in {@code avoid}.
	 */
	public static String fresh(String base, Set<String> avoid) {
		Identifiers.requireValid(base);
		for (long k = 1; ; k++) {
			String candidate = base + suffix(k);
			if (!avoid.contains(candidate)) {
				return candidate;
			}
		}
	}

	/**
	 * Bijective base-26 rendering: 1 is "a", 26 is "z", 27 is "aa".
	 */
	static String suffix(long k) {
		StringBuilder sb = new StringBuilder();
		long n = k;
		while (n > 0) {
			n--;
			sb.append((char) ('a' + (n % 26)));
			n /= 26;
		}
		return sb.reverse().toString();
	}
}

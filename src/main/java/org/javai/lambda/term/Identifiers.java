package org.javai.lambda.term;

/**
 * Rules for identifier text. An identifier is a non-empty run of letters; the
 * lambda marker {@code λ} is a letter in Unicode but never part of an identifier.
 */
public final class Identifiers {

	public static final char LAMBDA = 'λ';

	private Identifiers() {
	}

	public static boolean isIdentifierChar(char c) {
		return c != LAMBDA && Character.isLetter(c);
	}

	public static boolean isValid(String name) {
		if (name == null || name.isEmpty()) {
			return false;
		}
		for (int i = 0; i < name.length(); i++) {
			if (!isIdentifierChar(name.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	static String requireValid(String name) {
		if (name == null) {
			throw new NullPointerException("identifier must not be null");
		}
		if (!isValid(name)) {
			throw new IllegalArgumentException("Invalid identifier '" + name + "': identifiers are runs of letters");
		}
		return name;
	}
}

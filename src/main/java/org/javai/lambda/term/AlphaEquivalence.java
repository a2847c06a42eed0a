package org.javai.lambda.term;

import java.util.Objects;

/**
 * Alpha-equivalence: two terms are equivalent when they are identical after a
 * consistent renaming of bound variables.
 * <p>
 * Comparison works on binder depth (de Bruijn indices): a bound occurrence is
 * identified by how many abstractions lie between it and its binder, a free
 * occurrence by its name.
 */
public final class AlphaEquivalence {

	private AlphaEquivalence() {
	}

	public static boolean equivalent(Term left, Term right) {
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(right, "right must not be null");
		return equivalent(left, null, right, null);
	}

	/**
	 * Renders a term in a nameless form where bound occurrences become their de
	 * Bruijn index. Alpha-equivalent terms, and only those, share a key.
	 */
	public static String canonicalKey(Term term) {
		StringBuilder sb = new StringBuilder();
		appendKey(term, null, sb);
		return sb.toString();
	}

	private static boolean equivalent(Term left, Scope leftScope, Term right, Scope rightScope) {
		if (left instanceof Term.Variable l && right instanceof Term.Variable r) {
			int li = Scope.indexOf(leftScope, l.name());
			int ri = Scope.indexOf(rightScope, r.name());
			if (li < 0 && ri < 0) {
				return l.name().equals(r.name());
			}
			return li == ri;
		}
		if (left instanceof Term.Abstraction l && right instanceof Term.Abstraction r) {
			return equivalent(l.body(), new Scope(l.param(), leftScope), r.body(), new Scope(r.param(), rightScope));
		}
		if (left instanceof Term.Application l && right instanceof Term.Application r) {
			return equivalent(l.function(), leftScope, r.function(), rightScope)
					&& equivalent(l.argument(), leftScope, r.argument(), rightScope);
		}
		return false;
	}

	private static void appendKey(Term term, Scope scope, StringBuilder sb) {
		term.accept(new TermVisitor<Void>() {
			@Override
			public Void visitVariable(Term.Variable variable) {
				int index = Scope.indexOf(scope, variable.name());
				if (index < 0) {
					sb.append(variable.name());
				} else {
					sb.append('#').append(index);
				}
				return null;
			}

			@Override
			public Void visitAbstraction(Term.Abstraction abstraction) {
				sb.append("(λ ");
				appendKey(abstraction.body(), new Scope(abstraction.param(), scope), sb);
				sb.append(')');
				return null;
			}

			@Override
			public Void visitApplication(Term.Application application) {
				sb.append('(');
				appendKey(application.function(), scope, sb);
				sb.append(' ');
				appendKey(application.argument(), scope, sb);
				sb.append(')');
				return null;
			}
		});
	}

	/**
	 * Binder stack, innermost first.
	 */
	private record Scope(String name, Scope outer) {

		static int indexOf(Scope scope, String name) {
			int index = 0;
			for (Scope s = scope; s != null; s = s.outer) {
				if (s.name.equals(name)) {
					return index;
				}
				index++;
			}
			return -1;
		}
	}
}

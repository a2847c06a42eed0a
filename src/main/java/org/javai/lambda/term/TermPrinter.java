package org.javai.lambda.term;

/**
 * Renders a {@link Term} back to the concrete syntax accepted by the parser.
 * <p>
 * Output uses the fewest parentheses that still parse back to the same tree:
 * application is left-associative and juxtaposed with a single space, an
 * abstraction is bracketed whenever it is the function or the argument of an
 * application, and an application is bracketed in argument position.
 */
public class TermPrinter implements TermVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private final char lambdaMarker;

	public TermPrinter() {
		this(Identifiers.LAMBDA);
	}

	public TermPrinter(char lambdaMarker) {
		this.lambdaMarker = lambdaMarker;
	}

	@Override
	public Void visitVariable(Term.Variable variable) {
		output.append(variable.name());
		return null;
	}

	@Override
	public Void visitAbstraction(Term.Abstraction abstraction) {
		output.append(lambdaMarker).append(abstraction.param()).append('.');
		abstraction.body().accept(this);
		return null;
	}

	@Override
	public Void visitApplication(Term.Application application) {
		Term function = application.function();
		if (function instanceof Term.Abstraction) {
			bracketed(function);
		} else {
			function.accept(this);
		}
		output.append(' ');
		Term argument = application.argument();
		if (argument instanceof Term.Variable) {
			argument.accept(this);
		} else {
			bracketed(argument);
		}
		return null;
	}

	private void bracketed(Term term) {
		output.append('(');
		term.accept(this);
		output.append(')');
	}

	/**
	 * Returns the rendered output as a string.
	 */
	public String toString() {
		return output.toString();
	}

	/**
	 * Renders a term with the {@code λ} marker.
	 */
	public static String print(Term term) {
		TermPrinter printer = new TermPrinter();
		term.accept(printer);
		return printer.toString();
	}

	/**
	 * Renders a term with the backslash marker, for ASCII-only consumers.
	 */
	public static String printAscii(Term term) {
		TermPrinter printer = new TermPrinter('\\');
		term.accept(printer);
		return printer.toString();
	}
}

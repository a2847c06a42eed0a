package org.javai.lambda.term;

/**
 * Visitor over the three term shapes.
 * <p>
 * Every operation on terms (rendering, substitution, variable analysis) is a
 * visitor, so each one handles all shapes or fails to compile.
 *
 * @param <R> the return type of the visitor operations
 */
public interface TermVisitor<R> {

	R visitVariable(Term.Variable variable);

	R visitAbstraction(Term.Abstraction abstraction);

	R visitApplication(Term.Application application);
}

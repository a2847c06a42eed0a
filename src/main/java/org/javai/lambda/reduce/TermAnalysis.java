package org.javai.lambda.reduce;

import java.util.Locale;
import org.javai.lambda.term.Term;
import org.javai.lambda.term.Terms;
import org.javai.lambda.term.Variables;

/**
 * Shape summary of a term, reported for the final term of a reduction.
 *
 * @param termType the outermost shape, distinguishing closed from open abstractions
 * @param abstractionCount number of abstractions in the term
 * @param closed whether the term has no free variables
 * @param size node count
 * @param depth longest root-to-leaf path
 * @param cycleDetected whether some step reproduced its predecessor up to alpha-equivalence
 */
public record TermAnalysis(
		TermType termType,
		int abstractionCount,
		boolean closed,
		int size,
		int depth,
		boolean cycleDetected
) {

	public enum TermType {
		VARIABLE,
		CLOSED_ABSTRACTION,
		OPEN_ABSTRACTION,
		APPLICATION;

		public String wireName() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	public static TermAnalysis of(Term term, boolean cycleDetected) {
		boolean closed = Variables.isClosed(term);
		TermType type;
		if (term instanceof Term.Variable) {
			type = TermType.VARIABLE;
		} else if (term instanceof Term.Abstraction) {
			type = closed ? TermType.CLOSED_ABSTRACTION : TermType.OPEN_ABSTRACTION;
		} else {
			type = TermType.APPLICATION;
		}
		return new TermAnalysis(type, Terms.abstractionCount(term), closed, Terms.size(term), Terms.depth(term),
				cycleDetected);
	}
}

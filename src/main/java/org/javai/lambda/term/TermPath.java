package org.javai.lambda.term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Location of a subterm, as the sequence of child steps taken from the root.
 *
 * @param steps the steps from the root, outermost first
 */
public record TermPath(List<Step> steps) {

	public enum Step {
		FUNCTION,
		ARGUMENT,
		BODY;

		public String wireName() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private static final TermPath ROOT = new TermPath(List.of());

	public TermPath {
		steps = List.copyOf(steps);
	}

	public static TermPath root() {
		return ROOT;
	}

	public TermPath then(Step step) {
		List<Step> extended = new ArrayList<>(steps.size() + 1);
		extended.addAll(steps);
		extended.add(step);
		return new TermPath(extended);
	}

	public boolean isRoot() {
		return steps.isEmpty();
	}

	public List<String> wireNames() {
		if (steps.isEmpty()) {
			return Collections.emptyList();
		}
		return steps.stream().map(Step::wireName).toList();
	}

	@Override
	public String toString() {
		return isRoot() ? "<root>" : String.join(".", wireNames());
	}
}

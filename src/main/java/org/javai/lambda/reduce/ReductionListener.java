package org.javai.lambda.reduce;

/**
 * Observer of a running reduction. Callbacks run on the reducing thread, in
 * trace order. An exception thrown from a callback is logged and does not stop
 * the reduction.
 */
public interface ReductionListener {

	ReductionListener NONE = new ReductionListener() {
	};

	/**
	 * Called for every trace entry, including the initial one.
	 */
	default void onStep(TraceEntry entry) {
	}

	/**
	 * Called once, after the reduction reached a terminal state.
	 */
	default void onFinished(ReductionResult result) {
	}
}

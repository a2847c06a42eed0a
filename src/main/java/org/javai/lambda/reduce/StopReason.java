package org.javai.lambda.reduce;

import java.util.Locale;

/**
 * Why a reduction ended.
 */
public enum StopReason {
	NORMAL_FORM,
	STEP_LIMIT,
	TERM_SIZE_LIMIT,
	TERM_DEPTH_LIMIT,
	CANCELLED;

	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * True when the reduction ran out of budget rather than finishing or being cancelled.
	 */
	public boolean budgetExhausted() {
		return this == STEP_LIMIT || this == TERM_SIZE_LIMIT || this == TERM_DEPTH_LIMIT;
	}
}

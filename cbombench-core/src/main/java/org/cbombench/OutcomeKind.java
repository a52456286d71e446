package org.cbombench;

/**
 * Kind of a {@link RunOutcome}, used where only the category matters.
 */
public enum OutcomeKind {

	SUCCESS,

	TIMEOUT,

	TOOL_ERROR,

	MALFORMED_OUTPUT;

	/**
	 * Timeouts and tool errors count against a tool's reliability.
	 */
	public boolean isFailure() {
		return this == TIMEOUT || this == TOOL_ERROR;
	}

}

package org.cbombench;

/**
 * Failure signalled by a {@link CbomAdapter}.
 *
 * <p>
 * The {@link Kind} lets the orchestrator record a timeout, a tool-level error and unusable
 * output as different outcomes.
 */
public class CbomAdapterException extends RuntimeException {

	/**
	 * Distinguishable adapter failure kinds.
	 */
	public enum Kind {

		/** The tool did not finish in the time it was given. */
		TIMEOUT,

		/** The tool reported a failure or could not be run. */
		TOOL_ERROR,

		/** The tool finished but what it returned cannot be used as a document. */
		UNPARSABLE_OUTPUT

	}

	private final Kind kind;

	public CbomAdapterException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public CbomAdapterException(Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public static CbomAdapterException timeout(String message) {
		return new CbomAdapterException(Kind.TIMEOUT, message);
	}

	public static CbomAdapterException toolError(String message) {
		return new CbomAdapterException(Kind.TOOL_ERROR, message);
	}

	public static CbomAdapterException toolError(String message, Throwable cause) {
		return new CbomAdapterException(Kind.TOOL_ERROR, message, cause);
	}

	public static CbomAdapterException unparsableOutput(String message) {
		return new CbomAdapterException(Kind.UNPARSABLE_OUTPUT, message);
	}

	public Kind getKind() {
		return kind;
	}

}

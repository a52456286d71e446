package org.cbombench;

/**
 * Thrown when run records cannot be written or read. Losing run records would silently
 * drop evidence, so this failure is not recovered locally.
 */
public class RunRecordStoreException extends RuntimeException {

	public RunRecordStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}

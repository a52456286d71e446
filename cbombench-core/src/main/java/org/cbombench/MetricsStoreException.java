package org.cbombench;

/**
 * Thrown when comparison or metric records cannot be appended or listed.
 */
public class MetricsStoreException extends RuntimeException {

	public MetricsStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}

package org.cbombench;

/**
 * Thrown when a repository URL cannot be turned into a repository id. This is the one
 * structural failure that aborts a benchmark run, before any adapter is invoked.
 */
public class InvalidRepositoryException extends RuntimeException {

	private final String url;

	public InvalidRepositoryException(String url, String reason) {
		super("Unusable repository identifier '" + url + "': " + reason);
		this.url = url;
	}

	public String getUrl() {
		return url;
	}

}

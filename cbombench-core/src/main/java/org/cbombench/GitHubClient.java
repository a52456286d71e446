package org.cbombench;

/**
 * Interface for the GitHub REST calls needed to sample repositories and resolve default
 * branches.
 *
 * <p>
 * Keeps {@link GitHubRepositorySource} independent of the HTTP transport so it can be
 * tested with canned responses.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString already encoded query string (without leading ?)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	default String getWithQuery(String path, String queryString) {
		return get(queryString.isEmpty() ? path : path + "?" + queryString);
	}

}

package org.cbombench;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link GitHubClient} on top of the JDK {@link HttpClient}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final String GITHUB_API_BASE = "https://api.github.com";

	private final HttpClient httpClient;

	private final String token;

	public GitHubHttpClient(String token) {
		this.token = token;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public String get(String path) {
		String url = path.startsWith("http") ? path : GITHUB_API_BASE + path;
		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github.v3+json")
			.header("User-Agent", "cbombench")
			.timeout(Duration.ofSeconds(60))
			.GET()
			.build();

		String response = execute(request);
		logger.debug("GET {} completed in {}ms ({} bytes)", url, System.currentTimeMillis() - start,
				response.length());
		return response;
	}

	private String execute(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			String remaining = response.headers().firstValue("X-RateLimit-Remaining").orElse(null);
			if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.", statusCode,
						response.body());
			}
			if ((statusCode == 403 && "0".equals(remaining)) || statusCode == 429) {
				String reset = response.headers().firstValue("X-RateLimit-Reset").orElse("unknown");
				throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
						response.body());
			}
			if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body());
			}
			throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body());
		}
		catch (IOException e) {
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		@Nullable
		private final String responseBody;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		@Nullable
		public String getResponseBody() {
			return responseBody;
		}

	}

}

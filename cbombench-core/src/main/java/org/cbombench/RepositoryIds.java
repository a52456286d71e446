package org.cbombench;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Derives stable repository ids from clone URLs.
 *
 * <p>
 * GitHub HTTPS and SSH URLs map to {@code owner/repo}; other hosts map to
 * {@code host/path}. A trailing {@code .git} is always stripped.
 */
public final class RepositoryIds {

	private static final String GITHUB_HOST = "github.com";

	private static final String GITHUB_SSH_PREFIX = "git@github.com:";

	private RepositoryIds() {
	}

	/**
	 * @param url clone URL
	 * @return the repository id
	 * @throws InvalidRepositoryException if the URL does not identify a repository
	 */
	public static String fromUrl(String url) {
		String trimmed = url.trim();
		if (trimmed.isEmpty()) {
			throw new InvalidRepositoryException(url, "URL is empty");
		}

		if (trimmed.startsWith(GITHUB_SSH_PREFIX)) {
			return ownerAndRepo(url, trimmed.substring(GITHUB_SSH_PREFIX.length()));
		}

		URI uri;
		try {
			uri = new URI(trimmed);
		}
		catch (URISyntaxException e) {
			throw new InvalidRepositoryException(url, "not a valid URI: " + e.getMessage());
		}

		String host = uri.getHost();
		if (host == null || uri.getPath() == null) {
			throw new InvalidRepositoryException(url, "URL has no host or path");
		}
		host = host.toLowerCase(Locale.ROOT);

		if (host.equals(GITHUB_HOST) || host.equals("www." + GITHUB_HOST)) {
			return ownerAndRepo(url, uri.getPath());
		}

		String path = stripGitSuffix(trimSlashes(uri.getPath()));
		if (path.isEmpty()) {
			throw new InvalidRepositoryException(url, "URL has no repository path");
		}
		return host + "/" + path;
	}

	/**
	 * Check whether a URL yields a repository id.
	 */
	public static boolean isValid(String url) {
		try {
			fromUrl(url);
			return true;
		}
		catch (InvalidRepositoryException e) {
			return false;
		}
	}

	/**
	 * File-system friendly form of a repository id ({@code owner/repo} becomes
	 * {@code owner__repo}).
	 */
	public static String toPathSegment(String repositoryId) {
		return repositoryId.replace("/", "__").replaceAll("[^A-Za-z0-9._-]", "_");
	}

	private static String ownerAndRepo(String url, String path) {
		String[] parts = trimSlashes(path).split("/");
		if (parts.length < 2 || parts[0].isBlank() || stripGitSuffix(parts[1]).isBlank()) {
			throw new InvalidRepositoryException(url, "expected a GitHub URL of the form owner/repo");
		}
		return parts[0] + "/" + stripGitSuffix(parts[1]);
	}

	private static String trimSlashes(String path) {
		String result = path;
		while (result.startsWith("/")) {
			result = result.substring(1);
		}
		while (result.endsWith("/")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

	private static String stripGitSuffix(String name) {
		return name.endsWith(".git") ? name.substring(0, name.length() - 4) : name;
	}

}

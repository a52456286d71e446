package org.cbombench;

import org.jspecify.annotations.Nullable;

/**
 * A repository to benchmark, as supplied by a {@link RepositorySource} or the user.
 *
 * @param url clone URL
 * @param branch branch to scan, or {@code null} to use the repository's default branch
 * @param sizeKb repository size in KB when the source already knows it
 */
public record RepositoryTarget(String url, @Nullable String branch, @Nullable Integer sizeKb) {

	public RepositoryTarget(String url, @Nullable String branch) {
		this(url, branch, null);
	}

	public static RepositoryTarget of(String url) {
		return new RepositoryTarget(url, null, null);
	}

	/**
	 * Repository id derived from the URL.
	 * @throws InvalidRepositoryException if no id can be derived
	 */
	public String repositoryId() {
		return RepositoryIds.fromUrl(url);
	}

}

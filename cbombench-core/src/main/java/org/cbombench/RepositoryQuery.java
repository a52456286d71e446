package org.cbombench;

import org.jspecify.annotations.Nullable;

/**
 * Filters for sampling repositories from a {@link RepositorySource}.
 *
 * @param language primary language, e.g. {@code java}
 * @param minSizeKb minimum repository size in KB
 * @param maxSizeKb maximum repository size in KB, or {@code null} for no upper bound
 * @param sampleSize number of repositories to return
 */
public record RepositoryQuery(String language, int minSizeKb, @Nullable Integer maxSizeKb, int sampleSize) {

	public RepositoryQuery {
		if (minSizeKb < 0) {
			throw new IllegalArgumentException("Minimum size must not be negative: " + minSizeKb);
		}
		if (maxSizeKb != null && maxSizeKb < minSizeKb) {
			throw new IllegalArgumentException("Maximum size " + maxSizeKb + " is below minimum size " + minSizeKb);
		}
		if (sampleSize <= 0) {
			throw new IllegalArgumentException("Sample size must be positive: " + sampleSize);
		}
	}

}

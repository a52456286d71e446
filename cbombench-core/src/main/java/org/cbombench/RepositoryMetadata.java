package org.cbombench;

import org.jspecify.annotations.Nullable;

/**
 * What a {@link BranchResolver} could find out about a repository. Every field is
 * optional: a failed lookup leaves it {@code null}.
 *
 * @param defaultBranch default branch
 * @param sizeKb total repository size in KB, as reported by the hosting service
 * @param languageSizeKb size of the code in the benchmarked language, in KB;
 * {@code null} when the repository has none
 */
public record RepositoryMetadata(@Nullable String defaultBranch, @Nullable Integer sizeKb,
		@Nullable Integer languageSizeKb) {

	public static final RepositoryMetadata UNKNOWN = new RepositoryMetadata(null, null, null);

}

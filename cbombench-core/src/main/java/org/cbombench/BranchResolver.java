package org.cbombench;

import java.util.Optional;

/**
 * Resolves the default branch of a repository when none was given, and optionally its
 * size.
 */
@FunctionalInterface
public interface BranchResolver {

	/**
	 * @param repositoryUrl clone URL of the repository
	 * @return the default branch, or empty if it could not be determined
	 */
	Optional<String> resolveDefaultBranch(String repositoryUrl);

	/**
	 * Look up the default branch and the sizes of a repository in one go. Resolvers that
	 * know nothing about sizes only report the branch.
	 * @param repositoryUrl clone URL of the repository
	 * @return what could be determined, never {@code null}
	 */
	default RepositoryMetadata describe(String repositoryUrl) {
		return new RepositoryMetadata(resolveDefaultBranch(repositoryUrl).orElse(null), null, null);
	}

}

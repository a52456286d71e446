package org.cbombench;

import java.util.List;

/**
 * Supplies the repositories a benchmark runs on. The core treats the result as an opaque
 * ordered sequence.
 */
public interface RepositorySource {

	/**
	 * Find repositories matching the query.
	 * @param query language, size and sample-size filters
	 * @return repositories in benchmark order, possibly fewer than requested
	 */
	List<RepositoryTarget> findRepositories(RepositoryQuery query);

}

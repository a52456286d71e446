package org.cbombench;

import org.jspecify.annotations.Nullable;

/**
 * Uniform contract for invoking one external CBOM generation tool.
 *
 * <p>
 * Implementations are stateless between calls and never resolve branches themselves: the
 * orchestrator always passes the branch to scan. Failures must be signalled with a
 * {@link CbomAdapterException} of the matching {@link CbomAdapterException.Kind} rather
 * than by returning a half-valid document. An implementation must stop its work and
 * release external resources (processes, sockets) when its thread is interrupted.
 */
@FunctionalInterface
public interface CbomAdapter {

	/**
	 * Generate a CBOM for a repository.
	 * @param repositoryUrl clone URL of the repository
	 * @param branch branch to scan, already resolved by the caller
	 * @return the raw document text and the tool's generation time
	 * @throws CbomAdapterException if the tool timed out, failed, or produced no usable
	 * output
	 */
	GeneratedCbom generate(String repositoryUrl, @Nullable String branch);

}

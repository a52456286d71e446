package org.cbombench;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One attempt to generate a CBOM for a (tool, repository) pair. Immutable once created
 * and persisted before any normalization happens.
 *
 * @param toolId id of the tool that ran
 * @param toolFamily family of the tool, selects the extraction strategy on reload
 * @param repositoryId repository id, {@code owner/repo} for GitHub repositories
 * @param repositoryUrl URL the tool was pointed at
 * @param branch branch that was scanned
 * @param sampleId benchmark sample this run belongs to
 * @param startedAt when the invocation started
 * @param durationSeconds tool-reported generation time on success, wall-clock time
 * otherwise
 * @param outcome what the invocation produced
 * @param repositorySizeKb total repository size in KB, if known
 * @param languageSizeKb size of the code in the benchmarked language in KB, if known
 */
public record RunRecord(String toolId, ToolFamily toolFamily, String repositoryId, String repositoryUrl, String branch,
		String sampleId, Instant startedAt, double durationSeconds, RunOutcome outcome,
		@Nullable Integer repositorySizeKb, @Nullable Integer languageSizeKb) {

	public RunRecord {
		if (durationSeconds < 0 || !Double.isFinite(durationSeconds)) {
			throw new IllegalArgumentException("Duration must be a non-negative number of seconds: " + durationSeconds);
		}
	}

	public OutcomeKind outcomeKind() {
		return outcome.kind();
	}

}

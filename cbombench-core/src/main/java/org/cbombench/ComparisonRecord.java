package org.cbombench;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Cross-tool comparison of the asset sets produced for one repository in one sample.
 *
 * @param sampleId benchmark sample
 * @param repositoryId compared repository
 * @param computedAt when the comparison was computed
 * @param basis always {@link MetricBasis#CROSS_TOOL_AGREEMENT}
 * @param emptyUnion {@code true} when no contributing tool found any asset
 * @param union every canonical key found, with the tools that found it
 * @param tools per-tool results for contributing tools, in input order
 * @param pairs overlap of every unordered pair of contributing tools
 * @param excluded tools whose run failed, with the reason
 * @param repositorySizeKb total repository size in KB, if known
 * @param languageSizeKb size of the code in the benchmarked language in KB, if known
 * @param runs duration and outcome of every compared run, contributing or not
 */
public record ComparisonRecord(String sampleId, String repositoryId, Instant computedAt, MetricBasis basis,
		boolean emptyUnion, List<UnionEntry> union, List<ToolResult> tools, List<PairOverlap> pairs,
		List<ExcludedTool> excluded, @Nullable Integer repositorySizeKb, @Nullable Integer languageSizeKb,
		List<RunTiming> runs) {

	public ComparisonRecord {
		union = List.copyOf(union);
		tools = List.copyOf(tools);
		pairs = List.copyOf(pairs);
		excluded = List.copyOf(excluded);
		// missing from lines stored without run timings
		runs = runs == null ? List.of() : List.copyOf(runs);
	}

	public int unionSize() {
		return union.size();
	}

	/**
	 * @param key canonical asset key
	 * @param foundBy ids of the tools whose asset set contains the key
	 */
	public record UnionEntry(AssetKey key, List<String> foundBy) {

		public UnionEntry {
			foundBy = List.copyOf(foundBy);
		}

	}

	/**
	 * Agreement figures of one contributing tool.
	 *
	 * @param toolId tool
	 * @param assetCount assets in the tool's set
	 * @param coverage share of the union found by the tool, 0 for an empty union
	 * @param uniqueFindCount keys found by this tool and no other
	 * @param uniqueFindRatio unique finds divided by the union size, 0 for an empty union
	 * @param unrecognizedCount assets whose name was not in the alias table
	 * @param unrecognizedUniqueCount unrecognized assets among the unique finds
	 * @param droppedEntries entries lost to required-field failures
	 * @param ignoredEntries non-cryptographic entries skipped
	 * @param duplicatesMerged entries merged during de-duplication
	 */
	public record ToolResult(String toolId, int assetCount, double coverage, int uniqueFindCount,
			double uniqueFindRatio, int unrecognizedCount, int unrecognizedUniqueCount, int droppedEntries,
			int ignoredEntries, int duplicatesMerged) {
	}

	/**
	 * Jaccard overlap of two tools' key sets.
	 */
	public record PairOverlap(String firstTool, String secondTool, int intersection, int union, double jaccard) {
	}

	/**
	 * A tool left out of the comparison because its run failed.
	 */
	public record ExcludedTool(String toolId, OutcomeKind reason, String message) {
	}

	/**
	 * How long one tool ran on the repository, so duration can be related to size.
	 */
	public record RunTiming(String toolId, OutcomeKind outcome, double durationSeconds) {
	}

}

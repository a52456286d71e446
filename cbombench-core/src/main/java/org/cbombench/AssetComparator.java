package org.cbombench;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Compares the asset sets of one repository across tools.
 *
 * <p>
 * The union of canonical keys found by any contributing tool stands in for a reference
 * set. Only {@link NormalizationResult.AssetSet}s contribute; failed runs are listed as
 * excluded and never enter a denominator.
 */
public class AssetComparator {

	private static final Logger logger = LoggerFactory.getLogger(AssetComparator.class);

	/**
	 * @param context benchmark context
	 * @param repositoryId repository all results belong to
	 * @param resultsByTool normalization result per tool id, in reporting order
	 * @return the comparison record, without sizes or run timings
	 */
	public ComparisonRecord compare(BenchmarkContext context, String repositoryId,
			Map<String, NormalizationResult> resultsByTool) {
		return compare(context, repositoryId, resultsByTool, List.of());
	}

	/**
	 * Compare and attach the repository size and the duration of each run.
	 * @param runs run records the results were normalized from
	 */
	public ComparisonRecord compare(BenchmarkContext context, String repositoryId,
			Map<String, NormalizationResult> resultsByTool, List<RunRecord> runs) {
		Map<String, NormalizationResult.AssetSet> contributing = new LinkedHashMap<>();
		List<ComparisonRecord.ExcludedTool> excluded = new ArrayList<>();
		for (Map.Entry<String, NormalizationResult> entry : resultsByTool.entrySet()) {
			if (!entry.getValue().repositoryId().equals(repositoryId)) {
				throw new IllegalArgumentException("Result of " + entry.getKey() + " belongs to "
						+ entry.getValue().repositoryId() + ", not " + repositoryId);
			}
			if (entry.getValue() instanceof NormalizationResult.AssetSet assetSet) {
				contributing.put(entry.getKey(), assetSet);
			}
			else if (entry.getValue() instanceof NormalizationResult.AbsentAssetSet absent) {
				excluded.add(new ComparisonRecord.ExcludedTool(entry.getKey(), absent.reason(), absent.message()));
			}
		}

		Map<String, Set<AssetKey>> keysByTool = new LinkedHashMap<>();
		Map<AssetKey, List<String>> foundBy = new TreeMap<>();
		for (Map.Entry<String, NormalizationResult.AssetSet> entry : contributing.entrySet()) {
			Set<AssetKey> keys = new HashSet<>(entry.getValue().keys());
			keysByTool.put(entry.getKey(), keys);
			for (AssetKey key : keys) {
				foundBy.computeIfAbsent(key, k -> new ArrayList<>()).add(entry.getKey());
			}
		}
		int unionSize = foundBy.size();

		List<ComparisonRecord.ToolResult> tools = new ArrayList<>();
		for (Map.Entry<String, NormalizationResult.AssetSet> entry : contributing.entrySet()) {
			String toolId = entry.getKey();
			NormalizationResult.AssetSet assetSet = entry.getValue();
			Set<AssetKey> keys = keysByTool.get(toolId);

			int uniqueFinds = 0;
			int unrecognizedUnique = 0;
			for (Asset asset : assetSet.assets()) {
				if (foundBy.get(asset.key()).size() == 1) {
					uniqueFinds++;
					if (!asset.recognized()) {
						unrecognizedUnique++;
					}
				}
			}
			NormalizationReport report = assetSet.report();
			tools.add(new ComparisonRecord.ToolResult(toolId, keys.size(), ratio(keys.size(), unionSize), uniqueFinds,
					ratio(uniqueFinds, unionSize), (int) assetSet.unrecognizedCount(), unrecognizedUnique,
					report.dropped(), report.ignored(), report.duplicatesMerged()));
		}

		List<ComparisonRecord.PairOverlap> pairs = new ArrayList<>();
		List<String> toolIds = new ArrayList<>(keysByTool.keySet());
		for (int i = 0; i < toolIds.size(); i++) {
			for (int j = i + 1; j < toolIds.size(); j++) {
				pairs.add(overlap(toolIds.get(i), keysByTool.get(toolIds.get(i)), toolIds.get(j),
						keysByTool.get(toolIds.get(j))));
			}
		}

		List<ComparisonRecord.UnionEntry> union = new ArrayList<>();
		foundBy.forEach((key, finders) -> union.add(new ComparisonRecord.UnionEntry(key, finders)));

		if (unionSize == 0) {
			logger.info("[{}] No tool found any asset in {}", context.sampleId(), repositoryId);
		}
		logger.debug("[{}] Compared {} tools for {}: union of {} keys, {} excluded", context.sampleId(),
				contributing.size(), repositoryId, unionSize, excluded.size());

		Integer sizeKb = null;
		Integer languageSizeKb = null;
		List<ComparisonRecord.RunTiming> timings = new ArrayList<>();
		for (RunRecord run : runs) {
			if (!run.repositoryId().equals(repositoryId)) {
				throw new IllegalArgumentException(
						"Run of " + run.toolId() + " belongs to " + run.repositoryId() + ", not " + repositoryId);
			}
			if (sizeKb == null) {
				sizeKb = run.repositorySizeKb();
			}
			if (languageSizeKb == null) {
				languageSizeKb = run.languageSizeKb();
			}
			timings.add(new ComparisonRecord.RunTiming(run.toolId(), run.outcomeKind(), run.durationSeconds()));
		}

		return new ComparisonRecord(context.sampleId(), repositoryId, context.now(), MetricBasis.CROSS_TOOL_AGREEMENT,
				unionSize == 0, union, tools, pairs, excluded, sizeKb, languageSizeKb, timings);
	}

	static ComparisonRecord.PairOverlap overlap(String firstTool, Set<AssetKey> first, String secondTool,
			Set<AssetKey> second) {
		Set<AssetKey> intersection = new HashSet<>(first);
		intersection.retainAll(second);
		Set<AssetKey> union = new HashSet<>(first);
		union.addAll(second);
		double jaccard;
		if (first.isEmpty() && second.isEmpty()) {
			jaccard = 1.0;
		}
		else {
			jaccard = (double) intersection.size() / union.size();
		}
		return new ComparisonRecord.PairOverlap(firstTool, secondTool, intersection.size(), union.size(), jaccard);
	}

	private static double ratio(int count, int total) {
		return total == 0 ? 0.0 : (double) count / total;
	}

}

package org.cbombench;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Aggregates per-repository comparisons and run records into per-tool and per-pair
 * {@link MetricRecord}s for one sample.
 */
public class MetricsAggregator {

	private static final Logger logger = LoggerFactory.getLogger(MetricsAggregator.class);

	public List<MetricRecord> aggregate(BenchmarkContext context, List<ComparisonRecord> comparisons,
			List<RunRecord> runs) {
		Instant computedAt = context.now();

		Set<String> toolIds = new LinkedHashSet<>();
		runs.forEach(run -> toolIds.add(run.toolId()));
		comparisons.forEach(comparison -> comparison.tools().forEach(tool -> toolIds.add(tool.toolId())));

		List<MetricRecord> records = new ArrayList<>();
		for (String toolId : toolIds) {
			records.add(toolMetrics(context, computedAt, toolId, comparisons, runs));
		}
		records.addAll(pairMetrics(context, computedAt, comparisons));

		logger.info("[{}] Aggregated {} metric records over {} comparisons and {} runs", context.sampleId(),
				records.size(), comparisons.size(), runs.size());
		return records;
	}

	private MetricRecord.ToolMetrics toolMetrics(BenchmarkContext context, Instant computedAt, String toolId,
			List<ComparisonRecord> comparisons, List<RunRecord> runs) {
		int attempts = 0;
		int successes = 0;
		int timeouts = 0;
		int toolErrors = 0;
		int malformed = 0;
		List<Double> durations = new ArrayList<>();
		for (RunRecord run : runs) {
			if (!run.toolId().equals(toolId)) {
				continue;
			}
			attempts++;
			switch (run.outcomeKind()) {
				case SUCCESS -> {
					successes++;
					durations.add(run.durationSeconds());
				}
				case TIMEOUT -> timeouts++;
				case TOOL_ERROR -> toolErrors++;
				case MALFORMED_OUTPUT -> malformed++;
			}
		}

		List<Double> coverages = new ArrayList<>();
		List<Double> uniqueRatios = new ArrayList<>();
		List<Double> assetCounts = new ArrayList<>();
		int emptyResults = 0;
		long unrecognized = 0;
		long dropped = 0;
		Map<String, Long> primitives = new TreeMap<>();
		for (ComparisonRecord comparison : comparisons) {
			for (ComparisonRecord.ToolResult result : comparison.tools()) {
				if (!result.toolId().equals(toolId)) {
					continue;
				}
				coverages.add(result.coverage());
				uniqueRatios.add(result.uniqueFindRatio());
				assetCounts.add((double) result.assetCount());
				if (result.assetCount() == 0) {
					emptyResults++;
				}
				unrecognized += result.unrecognizedCount();
				dropped += result.droppedEntries();
			}
			for (ComparisonRecord.UnionEntry entry : comparison.union()) {
				if (entry.foundBy().contains(toolId)) {
					primitives.merge(entry.key().primitiveKind(), 1L, Long::sum);
				}
			}
		}
		int contributed = coverages.size();

		return new MetricRecord.ToolMetrics(toolId, context.sampleId(), computedAt, MetricBasis.CROSS_TOOL_AGREEMENT,
				attempts, successes, timeouts, toolErrors, malformed, rate(successes, attempts),
				rate(timeouts + toolErrors, attempts), rate(timeouts, attempts), rate(malformed, attempts),
				Statistics.mean(durations), Statistics.median(durations), Statistics.standardDeviation(durations),
				contributed, Statistics.mean(coverages), Statistics.mean(uniqueRatios), Statistics.mean(assetCounts),
				contributed == 0 ? null : (double) emptyResults / contributed, unrecognized, dropped, primitives);
	}

	private List<MetricRecord.PairMetrics> pairMetrics(BenchmarkContext context, Instant computedAt,
			List<ComparisonRecord> comparisons) {
		Map<List<String>, List<ComparisonRecord.PairOverlap>> byPair = new LinkedHashMap<>();
		for (ComparisonRecord comparison : comparisons) {
			for (ComparisonRecord.PairOverlap pair : comparison.pairs()) {
				byPair.computeIfAbsent(List.of(pair.firstTool(), pair.secondTool()), k -> new ArrayList<>()).add(pair);
			}
		}

		List<MetricRecord.PairMetrics> records = new ArrayList<>();
		for (List<ComparisonRecord.PairOverlap> overlaps : byPair.values()) {
			List<Double> values = overlaps.stream().map(ComparisonRecord.PairOverlap::jaccard).toList();
			ComparisonRecord.PairOverlap first = overlaps.get(0);
			records.add(new MetricRecord.PairMetrics(first.firstTool(), first.secondTool(), context.sampleId(),
					computedAt, MetricBasis.CROSS_TOOL_AGREEMENT, values.size(), Statistics.mean(values),
					values.stream().mapToDouble(Double::doubleValue).min().orElse(0),
					values.stream().mapToDouble(Double::doubleValue).max().orElse(0)));
		}
		return records;
	}

	private static double rate(int count, int attempts) {
		return attempts == 0 ? 0.0 : (double) count / attempts;
	}

}

package org.cbombench;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Entry point for benchmarking and analysis.
 *
 * <p>
 * A benchmark runs every pair through the {@link RunOrchestrator} and then analyses the
 * new sample. An analysis works only on stored run records, so it can be repeated after
 * the normalization rules change without running any tool again.
 */
public class BenchmarkService {

	private static final Logger logger = LoggerFactory.getLogger(BenchmarkService.class);

	private final RunOrchestrator orchestrator;

	private final RunRecordRepository runRecordRepository;

	private final AssetNormalizer normalizer;

	private final AssetComparator comparator;

	private final MetricsAggregator aggregator;

	private final MetricsStore metricsStore;

	private final Clock clock;

	public BenchmarkService(RunOrchestrator orchestrator, RunRecordRepository runRecordRepository,
			AssetNormalizer normalizer, AssetComparator comparator, MetricsAggregator aggregator,
			MetricsStore metricsStore, Clock clock) {
		this.orchestrator = orchestrator;
		this.runRecordRepository = runRecordRepository;
		this.normalizer = normalizer;
		this.comparator = comparator;
		this.aggregator = aggregator;
		this.metricsStore = metricsStore;
		this.clock = clock;
	}

	/**
	 * Run every tool against every repository and analyse the resulting sample.
	 * @param tools tools to benchmark
	 * @param repositories repositories to scan
	 * @return the run records and the analysis of the new sample
	 */
	public BenchmarkReport benchmark(List<BenchmarkTool> tools, List<RepositoryTarget> repositories) {
		BenchmarkContext context = BenchmarkContext.newSample(clock);
		logger.info("Starting benchmark sample {}", context.sampleId());

		List<RunRecord> runs = orchestrator.runAll(context, tools, repositories);
		AnalysisReport analysis = analyze(context.sampleId(), runs);

		BenchmarkReport report = new BenchmarkReport(context.sampleId(), runs, analysis);
		logger.info("Benchmark sample {} finished: {} runs, {} failed", context.sampleId(), runs.size(),
				report.failedRuns());
		return report;
	}

	/**
	 * Re-analyse stored run records.
	 * @param sampleId sample to analyse, or {@code null} for the latest record of every
	 * pair across all samples
	 * @return the analysis, stored under the sample id or under
	 * {@link BenchmarkContext#ALL_SAMPLES}
	 */
	public AnalysisReport analyze(@Nullable String sampleId) {
		if (sampleId == null || sampleId.equals(BenchmarkContext.ALL_SAMPLES)) {
			return analyze(BenchmarkContext.ALL_SAMPLES, runRecordRepository.latestPerPair());
		}
		return analyze(sampleId, runRecordRepository.loadBySample(sampleId));
	}

	/**
	 * Load the most recent stored analysis of a sample.
	 * @param sampleId sample id
	 * @return the records of the latest analysis, empty if the sample was never analysed
	 */
	public AnalysisReport loadAnalysis(String sampleId) {
		List<ComparisonRecord> comparisons = latest(metricsStore.loadComparisons(sampleId),
				ComparisonRecord::computedAt);
		List<MetricRecord> metrics = latest(metricsStore.loadMetrics(sampleId), MetricRecord::computedAt);
		return new AnalysisReport(sampleId, comparisons, metrics);
	}

	public List<String> listSamples() {
		return metricsStore.listSamples();
	}

	private AnalysisReport analyze(String sampleId, List<RunRecord> runs) {
		if (runs.isEmpty()) {
			logger.warn("No run records found for sample {}", sampleId);
			return AnalysisReport.empty(sampleId);
		}

		// one instant for every record of this analysis so it can be reloaded as a unit
		Instant computedAt = clock.instant();
		BenchmarkContext context = new BenchmarkContext(sampleId, computedAt, Clock.fixed(computedAt, ZoneOffset.UTC));

		Map<String, Map<String, RunRecord>> runsByRepository = new LinkedHashMap<>();
		for (RunRecord run : runs) {
			runsByRepository.computeIfAbsent(run.repositoryId(), k -> new TreeMap<>())
				.merge(run.toolId(), run, (current, candidate) -> candidate.startedAt().isBefore(current.startedAt())
						? current : candidate);
		}

		List<ComparisonRecord> comparisons = new ArrayList<>();
		List<RunRecord> analysed = new ArrayList<>();
		for (Map.Entry<String, Map<String, RunRecord>> entry : runsByRepository.entrySet()) {
			Map<String, NormalizationResult> results = new LinkedHashMap<>();
			List<RunRecord> repositoryRuns = new ArrayList<>(entry.getValue().values());
			for (RunRecord run : repositoryRuns) {
				results.put(run.toolId(), normalizer.normalize(context, run));
			}
			analysed.addAll(repositoryRuns);
			ComparisonRecord comparison = comparator.compare(context, entry.getKey(), results, repositoryRuns);
			metricsStore.appendComparison(comparison);
			comparisons.add(comparison);
		}

		List<MetricRecord> metrics = aggregator.aggregate(context, comparisons, analysed);
		metricsStore.appendMetrics(metrics);
		logger.info("Analysed sample {}: {} repositories, {} metric records", sampleId, comparisons.size(),
				metrics.size());
		return new AnalysisReport(sampleId, comparisons, metrics);
	}

	private static <T> List<T> latest(List<T> records, Function<T, Instant> computedAt) {
		Optional<Instant> newest = records.stream().map(computedAt).max(Comparator.naturalOrder());
		if (newest.isEmpty()) {
			return List.of();
		}
		return records.stream().filter(record -> computedAt.apply(record).equals(newest.get())).toList();
	}

}

package org.cbombench;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MetricsAggregator Tests")
class MetricsAggregatorTest {

	private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

	private static final AssetKey RSA_2048 = new AssetKey("rsa", "pke", 2048);

	private static final AssetKey AES_128 = new AssetKey("aes", "block-cipher", 128);

	private static final AssetKey SHA_256 = new AssetKey("sha-256", "hash", null);

	private MetricsAggregator aggregator;

	private AssetComparator comparator;

	private BenchmarkContext context;

	@BeforeEach
	void setUp() {
		aggregator = new MetricsAggregator();
		comparator = new AssetComparator();
		context = BenchmarkContext.forSample("s1", Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private static RunRecord run(String toolId, String repositoryId, double duration, RunOutcome outcome) {
		return new RunRecord(toolId, ToolFamily.CDXGEN, repositoryId, "https://github.com/" + repositoryId, "main",
				"s1", NOW, duration, outcome, null, null);
	}

	private static RunOutcome success() {
		return new RunOutcome.Success(JsonNodeFactory.instance.objectNode());
	}

	private static NormalizationResult.AssetSet assetSet(String toolId, String repositoryId, AssetKey... keys) {
		List<Asset> assets = Arrays.stream(keys)
			.sorted()
			.map(key -> new Asset(key.algorithmFamily(), key.primitiveKind(), key.keySize(), null, null, toolId,
					repositoryId, key.toString(), true))
			.toList();
		return new NormalizationResult.AssetSet(toolId, repositoryId, assets,
				new NormalizationReport(keys.length + 1, keys.length, 1, 0, 0, true));
	}

	private ComparisonRecord compare(String repositoryId, NormalizationResult... results) {
		Map<String, NormalizationResult> byTool = new LinkedHashMap<>();
		for (NormalizationResult result : results) {
			byTool.put(result.toolId(), result);
		}
		return comparator.compare(context, repositoryId, byTool);
	}

	private static MetricRecord.ToolMetrics toolMetrics(List<MetricRecord> records, String toolId) {
		return records.stream()
			.filter(MetricRecord.ToolMetrics.class::isInstance)
			.map(MetricRecord.ToolMetrics.class::cast)
			.filter(metrics -> metrics.toolId().equals(toolId))
			.findFirst()
			.orElseThrow();
	}

	private static List<MetricRecord.PairMetrics> pairMetrics(List<MetricRecord> records) {
		return records.stream()
			.filter(MetricRecord.PairMetrics.class::isInstance)
			.map(MetricRecord.PairMetrics.class::cast)
			.toList();
	}

	@Nested
	@DisplayName("Reliability")
	class ReliabilityTest {

		@Test
		@DisplayName("Should compute outcome rates over attempts")
		void shouldComputeRates() {
			List<RunRecord> runs = List.of(run("a", "o/r1", 10, success()), run("a", "o/r2", 600,
					new RunOutcome.Timeout(600)), run("a", "o/r3", 2, new RunOutcome.ToolError("exit 1")),
					run("a", "o/r4", 3, new RunOutcome.MalformedOutput("not json", "oops")));

			MetricRecord.ToolMetrics metrics = toolMetrics(aggregator.aggregate(context, List.of(), runs), "a");

			assertThat(metrics.attempts()).isEqualTo(4);
			assertThat(metrics.successes()).isEqualTo(1);
			assertThat(metrics.successRate()).isEqualTo(0.25);
			assertThat(metrics.timeoutRate()).isEqualTo(0.25);
			assertThat(metrics.failureRate()).isEqualTo(0.5);
			assertThat(metrics.malformedRate()).isEqualTo(0.25);
			assertThat(metrics.basis()).isEqualTo(MetricBasis.CROSS_TOOL_AGREEMENT);
			assertThat(metrics.computedAt()).isEqualTo(NOW);
		}

		@Test
		@DisplayName("Should only use successful runs for duration statistics")
		void shouldUseSuccessfulDurationsOnly() {
			List<RunRecord> runs = List.of(run("a", "o/r1", 10, success()), run("a", "o/r2", 20, success()),
					run("a", "o/r3", 30, success()), run("a", "o/r4", 600, new RunOutcome.Timeout(600)));

			MetricRecord.ToolMetrics metrics = toolMetrics(aggregator.aggregate(context, List.of(), runs), "a");

			assertThat(metrics.durationMean()).isEqualTo(20.0);
			assertThat(metrics.durationMedian()).isEqualTo(20.0);
			assertThat(metrics.durationStdDev()).isCloseTo(10.0, within(1e-9));
		}

		@Test
		@DisplayName("Should leave statistics undefined when no run succeeded")
		void shouldLeaveStatisticsUndefined() {
			List<RunRecord> runs = List.of(run("a", "o/r1", 600, new RunOutcome.Timeout(600)));

			MetricRecord.ToolMetrics metrics = toolMetrics(aggregator.aggregate(context, List.of(), runs), "a");

			assertThat(metrics.successRate()).isZero();
			assertThat(metrics.durationMean()).isNull();
			assertThat(metrics.durationMedian()).isNull();
			assertThat(metrics.durationStdDev()).isNull();
			assertThat(metrics.meanCoverage()).isNull();
			assertThat(metrics.emptyResultRate()).isNull();
			assertThat(metrics.repositoriesContributed()).isZero();
		}

	}

	@Nested
	@DisplayName("Agreement")
	class AgreementTest {

		@Test
		@DisplayName("Should average coverage over repositories the tool contributed to")
		void shouldAverageCoverage() {
			ComparisonRecord first = compare("o/r1", assetSet("a", "o/r1", RSA_2048),
					assetSet("b", "o/r1", RSA_2048, AES_128));
			ComparisonRecord second = compare("o/r2", assetSet("a", "o/r2", SHA_256), assetSet("b", "o/r2"));

			List<MetricRecord> records = aggregator.aggregate(context, List.of(first, second), List.of());

			MetricRecord.ToolMetrics a = toolMetrics(records, "a");
			assertThat(a.repositoriesContributed()).isEqualTo(2);
			assertThat(a.meanCoverage()).isEqualTo(0.75);
			assertThat(a.meanAssetCount()).isEqualTo(1.0);
			assertThat(a.droppedTotal()).isEqualTo(2);
			assertThat(a.primitiveDistribution()).containsExactly(entry("hash", 1L), entry("pke", 1L));

			MetricRecord.ToolMetrics b = toolMetrics(records, "b");
			assertThat(b.emptyResultRate()).isEqualTo(0.5);
			assertThat(b.meanCoverage()).isEqualTo(0.5);
		}

		@Test
		@DisplayName("Should summarize pair overlap across repositories")
		void shouldSummarizePairs() {
			ComparisonRecord first = compare("o/r1", assetSet("a", "o/r1", RSA_2048),
					assetSet("b", "o/r1", RSA_2048, AES_128));
			ComparisonRecord second = compare("o/r2", assetSet("a", "o/r2", SHA_256), assetSet("b", "o/r2", SHA_256));

			List<MetricRecord.PairMetrics> pairs = pairMetrics(
					aggregator.aggregate(context, List.of(first, second), List.of()));

			assertThat(pairs).singleElement().satisfies(pair -> {
				assertThat(pair.subject()).isEqualTo("a+b");
				assertThat(pair.repositoriesCompared()).isEqualTo(2);
				assertThat(pair.meanOverlap()).isEqualTo(0.75);
				assertThat(pair.minOverlap()).isEqualTo(0.5);
				assertThat(pair.maxOverlap()).isEqualTo(1.0);
			});
		}

		@Test
		@DisplayName("Should keep pairs apart when tool ids contain the subject separator")
		void shouldNotMergePairsWithSimilarSubjects() {
			ComparisonRecord first = compare("o/r1", assetSet("a+b", "o/r1", RSA_2048),
					assetSet("c", "o/r1", RSA_2048));
			ComparisonRecord second = compare("o/r2", assetSet("a", "o/r2", RSA_2048), assetSet("b+c", "o/r2"));

			List<MetricRecord.PairMetrics> pairs = pairMetrics(
					aggregator.aggregate(context, List.of(first, second), List.of()));

			assertThat(pairs)
				.extracting(MetricRecord.PairMetrics::firstTool, MetricRecord.PairMetrics::secondTool,
						MetricRecord.PairMetrics::repositoriesCompared, MetricRecord.PairMetrics::meanOverlap)
				.containsExactly(tuple("a+b", "c", 1, 1.0), tuple("a", "b+c", 1, 0.0));
		}

		@Test
		@DisplayName("Should keep a failing tool out of the other tools' agreement metrics")
		void shouldIsolateFailures() {
			ComparisonRecord withFailure = compare("o/r1", assetSet("a", "o/r1", RSA_2048),
					assetSet("b", "o/r1", RSA_2048),
					new NormalizationResult.AbsentAssetSet("c", "o/r1", OutcomeKind.TIMEOUT, "Timed out"));
			List<RunRecord> runs = List.of(run("a", "o/r1", 1, success()), run("b", "o/r1", 1, success()),
					run("c", "o/r1", 600, new RunOutcome.Timeout(600)));

			List<MetricRecord> records = aggregator.aggregate(context, List.of(withFailure), runs);

			assertThat(toolMetrics(records, "a").meanCoverage()).isEqualTo(1.0);
			assertThat(toolMetrics(records, "b").meanCoverage()).isEqualTo(1.0);
			assertThat(toolMetrics(records, "c").timeoutRate()).isEqualTo(1.0);
			assertThat(toolMetrics(records, "c").meanCoverage()).isNull();
			assertThat(pairMetrics(records)).extracting(MetricRecord::subject).containsExactly("a+b");
		}

	}

	@Test
	@DisplayName("Should produce no records for an empty sample")
	void shouldProduceNothingForEmptySample() {
		assertThat(aggregator.aggregate(context, List.of(), List.of())).isEmpty();
	}

}

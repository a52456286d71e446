package org.cbombench;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileSystemMetricsStore Tests")
class FileSystemMetricsStoreTest {

	private static final Instant COMPUTED_AT = Instant.parse("2025-03-01T10:00:00Z");

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private FileSystemMetricsStore store;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		store = new FileSystemMetricsStore(tempDir, objectMapper);
	}

	private static ComparisonRecord comparison(String sampleId, String repositoryId) {
		AssetKey rsa = new AssetKey("rsa", "pke", 2048);
		return new ComparisonRecord(sampleId, repositoryId, COMPUTED_AT, MetricBasis.CROSS_TOOL_AGREEMENT, false,
				List.of(new ComparisonRecord.UnionEntry(rsa, List.of("cbomkit", "cdxgen"))),
				List.of(new ComparisonRecord.ToolResult("cbomkit", 1, 1.0, 0, 0.0, 0, 0, 0, 2, 0),
						new ComparisonRecord.ToolResult("cdxgen", 1, 1.0, 0, 0.0, 0, 0, 1, 0, 3)),
				List.of(new ComparisonRecord.PairOverlap("cbomkit", "cdxgen", 1, 1, 1.0)),
				List.of(new ComparisonRecord.ExcludedTool("deepseek", OutcomeKind.TIMEOUT, "Timed out")), 5120, 4096,
				List.of(new ComparisonRecord.RunTiming("cbomkit", OutcomeKind.SUCCESS, 12.5),
						new ComparisonRecord.RunTiming("cdxgen", OutcomeKind.SUCCESS, 30.0),
						new ComparisonRecord.RunTiming("deepseek", OutcomeKind.TIMEOUT, 1800.0)));
	}

	private static MetricRecord.ToolMetrics toolMetrics(String sampleId) {
		return new MetricRecord.ToolMetrics("cdxgen", sampleId, COMPUTED_AT, MetricBasis.CROSS_TOOL_AGREEMENT, 2, 1,
				1, 0, 0, 0.5, 0.5, 0.5, 0.0, 12.0, 12.0, null, 1, 1.0, 0.0, 1.0, 0.0, 0, 1, Map.of("pke", 1L));
	}

	private static MetricRecord.PairMetrics pairMetrics(String sampleId) {
		return new MetricRecord.PairMetrics("cbomkit", "cdxgen", sampleId, COMPUTED_AT,
				MetricBasis.CROSS_TOOL_AGREEMENT, 1, 1.0, 1.0, 1.0);
	}

	@Test
	@DisplayName("Should read back appended comparisons")
	void shouldRoundTripComparisons() {
		ComparisonRecord first = comparison("s1", "acme/a");
		ComparisonRecord second = comparison("s1", "acme/b");

		store.appendComparison(first);
		store.appendComparison(second);

		assertThat(store.loadComparisons("s1")).containsExactly(first, second);
	}

	@Test
	@DisplayName("Should read back both metric record types")
	void shouldRoundTripMetrics() {
		List<MetricRecord> records = List.of(toolMetrics("s1"), pairMetrics("s1"));

		store.appendMetrics(records);

		assertThat(store.loadMetrics("s1")).containsExactlyElementsOf(records);
	}

	@Test
	@DisplayName("Should append instead of overwriting")
	void shouldBeAppendOnly() {
		store.appendMetrics(List.of(toolMetrics("s1")));
		store.appendMetrics(List.of(toolMetrics("s1")));

		assertThat(store.loadMetrics("s1")).hasSize(2);
	}

	@Test
	@DisplayName("Should write each metric record under its own sample")
	void shouldGroupMetricsBySample() {
		store.appendMetrics(List.of(toolMetrics("s1"), toolMetrics("s2")));

		assertThat(store.loadMetrics("s1")).hasSize(1);
		assertThat(store.loadMetrics("s2")).hasSize(1);
		assertThat(store.listSamples()).containsExactly("s1", "s2");
	}

	@Test
	@DisplayName("Should skip unreadable lines")
	void shouldSkipUnreadableLines() throws Exception {
		store.appendComparison(comparison("s1", "acme/a"));
		Files.writeString(tempDir.resolve("s1").resolve(FileSystemMetricsStore.COMPARISONS_FILE), "{ broken\n\n",
				StandardOpenOption.APPEND);
		store.appendComparison(comparison("s1", "acme/b"));

		assertThat(store.loadComparisons("s1")).extracting(ComparisonRecord::repositoryId)
			.containsExactly("acme/a", "acme/b");
	}

	@Test
	@DisplayName("Should list only directories holding records")
	void shouldListSamples() throws Exception {
		Files.createDirectories(tempDir.resolve("empty"));
		store.appendComparison(comparison("s2", "acme/a"));
		store.appendMetrics(List.of(pairMetrics("s1")));

		assertThat(store.listSamples()).containsExactly("s1", "s2");
		assertThat(store.loadComparisons("missing")).isEmpty();
	}

	@Test
	@DisplayName("Should not interleave concurrent appends")
	void shouldSerializeConcurrentAppends() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(4);
		for (int i = 0; i < 40; i++) {
			String repositoryId = "acme/r" + i;
			executor.submit(() -> store.appendComparison(comparison("s1", repositoryId)));
		}
		executor.shutdown();
		assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

		assertThat(store.loadComparisons("s1")).hasSize(40);
	}

}

package org.cbombench;

import java.util.List;

/**
 * Comparison and metric records of one analysis of a sample.
 *
 * @param sampleId analysed sample, or {@link BenchmarkContext#ALL_SAMPLES}
 * @param comparisons one comparison per repository
 * @param metrics per-tool and per-pair metrics
 */
public record AnalysisReport(String sampleId, List<ComparisonRecord> comparisons, List<MetricRecord> metrics) {

	public AnalysisReport {
		comparisons = List.copyOf(comparisons);
		metrics = List.copyOf(metrics);
	}

	public static AnalysisReport empty(String sampleId) {
		return new AnalysisReport(sampleId, List.of(), List.of());
	}

	public List<MetricRecord.ToolMetrics> toolMetrics() {
		return metrics.stream()
			.filter(MetricRecord.ToolMetrics.class::isInstance)
			.map(MetricRecord.ToolMetrics.class::cast)
			.toList();
	}

	public List<MetricRecord.PairMetrics> pairMetrics() {
		return metrics.stream()
			.filter(MetricRecord.PairMetrics.class::isInstance)
			.map(MetricRecord.PairMetrics.class::cast)
			.toList();
	}

}

package org.cbombench;

import java.util.List;

/**
 * Append-only store for comparison and metric records, grouped by sample.
 */
public interface MetricsStore {

	void appendComparison(ComparisonRecord record);

	void appendMetrics(List<MetricRecord> records);

	List<ComparisonRecord> loadComparisons(String sampleId);

	List<MetricRecord> loadMetrics(String sampleId);

	/**
	 * Ids of every sample with stored records, oldest first.
	 */
	List<String> listSamples();

}

package org.cbombench;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate statistics over one sample, for one tool or one tool pair. Metric records
 * are append-only and identified by (subject, sample id, computed at).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({ @JsonSubTypes.Type(value = MetricRecord.ToolMetrics.class, name = "tool"),
		@JsonSubTypes.Type(value = MetricRecord.PairMetrics.class, name = "pair") })
public sealed interface MetricRecord permits MetricRecord.ToolMetrics, MetricRecord.PairMetrics {

	String sampleId();

	Instant computedAt();

	MetricBasis basis();

	/**
	 * Subject of the record: a tool id, or {@code first+second} for a pair.
	 */
	String subject();

	/**
	 * Reliability, performance and agreement of one tool.
	 *
	 * <p>
	 * Rates are over attempts. Duration statistics cover successful runs only. The
	 * agreement means are {@code null} when the tool never contributed an asset set.
	 */
	record ToolMetrics(String toolId, String sampleId, Instant computedAt, MetricBasis basis, int attempts,
			int successes, int timeouts, int toolErrors, int malformedOutputs, double successRate, double failureRate,
			double timeoutRate, double malformedRate, @Nullable Double durationMean, @Nullable Double durationMedian,
			@Nullable Double durationStdDev, int repositoriesContributed, @Nullable Double meanCoverage,
			@Nullable Double meanUniqueFindRatio, @Nullable Double meanAssetCount, @Nullable Double emptyResultRate,
			long unrecognizedTotal, long droppedTotal, Map<String, Long> primitiveDistribution) implements MetricRecord {

		public ToolMetrics {
			primitiveDistribution = Collections.unmodifiableMap(new TreeMap<>(primitiveDistribution));
		}

		@Override
		public String subject() {
			return toolId;
		}

	}

	/**
	 * Overlap of one ordered tool pair across the repositories where both contributed.
	 */
	record PairMetrics(String firstTool, String secondTool, String sampleId, Instant computedAt, MetricBasis basis,
			int repositoriesCompared, double meanOverlap, double minOverlap, double maxOverlap) implements MetricRecord {

		@Override
		public String subject() {
			return firstTool + "+" + secondTool;
		}

	}

}

package org.cbombench;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Explicit context of one benchmark or analysis invocation, passed from the orchestrator
 * through normalization to comparison and aggregation.
 *
 * @param sampleId id of the repository sample the invocation works on
 * @param startedAt when the invocation started
 * @param clock clock used for every timestamp written during the invocation
 */
public record BenchmarkContext(String sampleId, Instant startedAt, Clock clock) {

	/**
	 * Sample id used when an analysis spans every stored run.
	 */
	public static final String ALL_SAMPLES = "all";

	private static final DateTimeFormatter SAMPLE_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
		.withZone(ZoneOffset.UTC);

	public BenchmarkContext {
		if (sampleId.isBlank() || sampleId.contains("/") || sampleId.contains("\\")) {
			throw new IllegalArgumentException("Invalid sample id: '" + sampleId + "'");
		}
	}

	/**
	 * Start a new benchmark sample whose id is derived from the current time.
	 */
	public static BenchmarkContext newSample(Clock clock) {
		Instant now = clock.instant();
		return new BenchmarkContext(SAMPLE_ID_FORMAT.format(now), now, clock);
	}

	/**
	 * Context for re-analysing an existing sample.
	 */
	public static BenchmarkContext forSample(String sampleId, Clock clock) {
		return new BenchmarkContext(sampleId, clock.instant(), clock);
	}

	public Instant now() {
		return clock.instant();
	}

}

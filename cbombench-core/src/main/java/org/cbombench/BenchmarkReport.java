package org.cbombench;

import java.util.List;

/**
 * Everything one benchmark invocation produced: a run record for every pair, including
 * failed ones, and the analysis of the sample.
 */
public record BenchmarkReport(String sampleId, List<RunRecord> runs, AnalysisReport analysis) {

	public BenchmarkReport {
		runs = List.copyOf(runs);
	}

	public long failedRuns() {
		return runs.stream().filter(run -> run.outcomeKind() != OutcomeKind.SUCCESS).count();
	}

}

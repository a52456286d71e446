package org.cbombench;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistence for {@link RunRecord}s, logically keyed by (tool id, repository id,
 * start time).
 *
 * <p>
 * Raw documents are kept verbatim so stored runs can be normalized again when the
 * mapping rules change. Implementations must accept concurrent {@link #save} calls for
 * different pairs.
 */
public interface RunRecordRepository {

	/**
	 * Persist a run record. Returns only once the record is durable.
	 * @param record the record to store
	 * @throws RunRecordStoreException if the record cannot be written
	 */
	void save(RunRecord record);

	/**
	 * Load every stored run record.
	 * @return records ordered by start time
	 */
	List<RunRecord> loadAll();

	/**
	 * Load the run records of one benchmark sample.
	 * @param sampleId sample id
	 * @return records ordered by start time
	 */
	default List<RunRecord> loadBySample(String sampleId) {
		return loadAll().stream().filter(record -> record.sampleId().equals(sampleId)).toList();
	}

	/**
	 * Load the most recent run record of every (tool, repository) pair across all samples.
	 * @return one record per pair, ordered by start time
	 */
	default List<RunRecord> latestPerPair() {
		Map<String, RunRecord> latest = new LinkedHashMap<>();
		for (RunRecord record : loadAll()) {
			latest.merge(record.toolId() + "|" + record.repositoryId(), record,
					(current, candidate) -> candidate.startedAt().isBefore(current.startedAt()) ? current : candidate);
		}
		List<RunRecord> records = new ArrayList<>(latest.values());
		records.sort((a, b) -> a.startedAt().compareTo(b.startedAt()));
		return records;
	}

}

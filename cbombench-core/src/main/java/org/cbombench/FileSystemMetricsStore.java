package org.cbombench;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;

/**
 * JSON-lines implementation of {@link MetricsStore}.
 *
 * <p>
 * Layout: {@code <root>/<sample-id>/comparisons.jsonl} and
 * {@code <root>/<sample-id>/metrics.jsonl}, one record per line. Lines are only ever
 * appended; appends to the same file are serialized through a per-file lock.
 */
public class FileSystemMetricsStore implements MetricsStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemMetricsStore.class);

	static final String COMPARISONS_FILE = "comparisons.jsonl";

	static final String METRICS_FILE = "metrics.jsonl";

	private final Path root;

	private final ObjectMapper objectMapper;

	private final ConcurrentMap<Path, Object> locks = new ConcurrentHashMap<>();

	public FileSystemMetricsStore(Path root, ObjectMapper objectMapper) {
		this.root = root;
		this.objectMapper = objectMapper;
	}

	@Override
	public void appendComparison(ComparisonRecord record) {
		append(root.resolve(record.sampleId()).resolve(COMPARISONS_FILE), List.of(record));
	}

	@Override
	public void appendMetrics(List<MetricRecord> records) {
		Map<String, List<MetricRecord>> bySample = new LinkedHashMap<>();
		records.forEach(record -> bySample.computeIfAbsent(record.sampleId(), k -> new ArrayList<>()).add(record));
		bySample.forEach((sampleId, sampleRecords) -> append(root.resolve(sampleId).resolve(METRICS_FILE), sampleRecords));
	}

	@Override
	public List<ComparisonRecord> loadComparisons(String sampleId) {
		return load(root.resolve(sampleId).resolve(COMPARISONS_FILE), ComparisonRecord.class);
	}

	@Override
	public List<MetricRecord> loadMetrics(String sampleId) {
		return load(root.resolve(sampleId).resolve(METRICS_FILE), MetricRecord.class);
	}

	@Override
	public List<String> listSamples() {
		if (!Files.isDirectory(root)) {
			return List.of();
		}
		try (Stream<Path> entries = Files.list(root)) {
			return entries.filter(Files::isDirectory)
				.filter(dir -> Files.exists(dir.resolve(COMPARISONS_FILE)) || Files.exists(dir.resolve(METRICS_FILE)))
				.map(dir -> dir.getFileName().toString())
				.sorted()
				.toList();
		}
		catch (IOException e) {
			throw new MetricsStoreException("Failed to list samples in " + root, e);
		}
	}

	private void append(Path file, List<?> records) {
		StringBuilder lines = new StringBuilder();
		for (Object record : records) {
			try {
				lines.append(objectMapper.writeValueAsString(record)).append('\n');
			}
			catch (JsonProcessingException e) {
				throw new MetricsStoreException("Failed to serialize " + record.getClass().getSimpleName(), e);
			}
		}

		Object lock = locks.computeIfAbsent(file.toAbsolutePath().normalize(), k -> new Object());
		synchronized (lock) {
			try {
				Files.createDirectories(file.getParent());
				Files.writeString(file, lines, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
						StandardOpenOption.APPEND);
			}
			catch (IOException e) {
				throw new MetricsStoreException("Failed to append to " + file, e);
			}
		}
	}

	private <T> List<T> load(Path file, Class<T> type) {
		if (!Files.exists(file)) {
			return List.of();
		}
		List<String> lines;
		try {
			lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new MetricsStoreException("Failed to read " + file, e);
		}

		List<T> records = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (line.isBlank()) {
				continue;
			}
			try {
				records.add(objectMapper.readValue(line, type));
			}
			catch (JsonProcessingException e) {
				logger.warn("Skipping unreadable line {} of {}: {}", i + 1, file, e.getOriginalMessage());
			}
		}
		return records;
	}

}

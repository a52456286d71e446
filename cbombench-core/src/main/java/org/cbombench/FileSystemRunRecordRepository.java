package org.cbombench;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File system implementation of {@link RunRecordRepository}.
 *
 * <p>
 * Layout: {@code <root>/<tool-id>/<owner>__<repo>/<epoch-millis>_<sample-id>.json}, one
 * pretty-printed JSON file per record. Files are written to a temporary name and then
 * renamed into place, so a crash never leaves a half-written record behind. A stored
 * record is never overwritten: when the name is taken, a numbered suffix is added
 * ({@code <epoch-millis>_<sample-id>-1.json}).
 */
public class FileSystemRunRecordRepository implements RunRecordRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemRunRecordRepository.class);

	private static final int MAX_NAME_ATTEMPTS = 1000;

	private final Path root;

	private final ObjectMapper objectMapper;

	public FileSystemRunRecordRepository(Path root, ObjectMapper objectMapper) {
		this.root = root;
		this.objectMapper = objectMapper;
	}

	@Override
	public void save(RunRecord record) {
		Path target = pathFor(record);
		try {
			Files.createDirectories(target.getParent());
			Path temp = Files.createTempFile(target.getParent(), ".run-", ".tmp");
			Path stored;
			try {
				objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), record);
				stored = moveToFreeName(temp, target);
			}
			finally {
				Files.deleteIfExists(temp);
			}
			logger.debug("Saved {} run record for {} to {}", record.toolId(), record.repositoryId(), stored);
		}
		catch (IOException e) {
			throw new RunRecordStoreException("Failed to save run record to " + target, e);
		}
	}

	@Override
	public List<RunRecord> loadAll() {
		if (!Files.isDirectory(root)) {
			return List.of();
		}
		List<RunRecord> records = new ArrayList<>();
		try (Stream<Path> paths = Files.walk(root)) {
			List<Path> files = paths.filter(Files::isRegularFile)
				.filter(path -> path.getFileName().toString().endsWith(".json"))
				.sorted()
				.toList();
			for (Path file : files) {
				try {
					records.add(objectMapper.readValue(file.toFile(), RunRecord.class));
				}
				catch (IOException e) {
					logger.warn("Skipping unreadable run record {}: {}", file, e.getMessage());
				}
			}
		}
		catch (IOException e) {
			throw new RunRecordStoreException("Failed to list run records in " + root, e);
		}
		records.sort(Comparator.comparing(RunRecord::startedAt)
			.thenComparing(RunRecord::toolId)
			.thenComparing(RunRecord::repositoryId));
		return records;
	}

	private static Path moveToFreeName(Path temp, Path target) throws IOException {
		String baseName = target.getFileName().toString().replaceFirst("\\.json$", "");
		for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
			Path candidate = attempt == 0 ? target : target.resolveSibling(baseName + "-" + attempt + ".json");
			try {
				// no REPLACE_EXISTING: an existing record must fail the move
				return Files.move(temp, candidate);
			}
			catch (FileAlreadyExistsException e) {
				logger.debug("{} already exists, trying the next name", candidate.getFileName());
			}
		}
		throw new FileAlreadyExistsException(target.toString(), null,
				"No free file name after " + MAX_NAME_ATTEMPTS + " attempts");
	}

	Path pathFor(RunRecord record) {
		String fileName = record.startedAt().toEpochMilli() + "_" + record.sampleId() + ".json";
		return root.resolve(RepositoryIds.toPathSegment(record.toolId()))
			.resolve(RepositoryIds.toPathSegment(record.repositoryId()))
			.resolve(fileName);
	}

}

package org.cbombench;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileSystemRunRecordRepository Tests")
class FileSystemRunRecordRepositoryTest {

	@TempDir
	Path tempDir;

	private ObjectMapper objectMapper;

	private FileSystemRunRecordRepository repository;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		repository = new FileSystemRunRecordRepository(tempDir.resolve("runs"), objectMapper);
	}

	private RunRecord record(String toolId, String repositoryId, String sampleId, String startedAt,
			RunOutcome outcome) {
		return new RunRecord(toolId, ToolFamily.CBOMKIT, repositoryId, "https://github.com/" + repositoryId, "main",
				sampleId, Instant.parse(startedAt), 4.2, outcome, 2048, 1536);
	}

	private RunOutcome success(String json) throws Exception {
		return new RunOutcome.Success(objectMapper.readTree(json));
	}

	@Nested
	@DisplayName("Save and Load")
	class SaveAndLoadTest {

		@Test
		@DisplayName("Should keep every outcome kind intact")
		void shouldRoundTripOutcomes() throws Exception {
			List<RunRecord> records = List.of(
					record("cbomkit", "acme/a", "s1", "2025-03-01T10:00:00Z",
							success("[{\"bom\":{\"components\":[{\"name\":\"AES\"}]}}]")),
					record("cbomkit", "acme/b", "s1", "2025-03-01T10:01:00Z", new RunOutcome.Timeout(1800)),
					record("cbomkit", "acme/c", "s1", "2025-03-01T10:02:00Z", new RunOutcome.ToolError("exit 2")),
					record("cbomkit", "acme/d", "s1", "2025-03-01T10:03:00Z",
							new RunOutcome.MalformedOutput("not JSON", "<html>")));
			records.forEach(repository::save);

			assertThat(repository.loadAll()).containsExactlyElementsOf(records);
		}

		@Test
		@DisplayName("Should lay records out by tool and repository")
		void shouldUseDirectoryLayout() throws Exception {
			RunRecord record = record("cdxgen", "acme/widgets", "s1", "2025-03-01T10:00:00Z", success("{}"));

			repository.save(record);

			Path expected = tempDir.resolve("runs")
				.resolve("cdxgen")
				.resolve("acme__widgets")
				.resolve(Instant.parse("2025-03-01T10:00:00Z").toEpochMilli() + "_s1.json");
			assertThat(expected).exists();
			assertThat(repository.pathFor(record)).isEqualTo(expected);
			try (Stream<Path> files = Files.list(expected.getParent())) {
				assertThat(files).as("no temporary files left behind").containsExactly(expected);
			}
		}

		@Test
		@DisplayName("Should never overwrite a stored record that maps to the same file name")
		void shouldNotOverwriteOnNameCollision() throws Exception {
			RunRecord first = record("cdxgen", "acme/widgets", "s1", "2025-03-01T10:00:00Z", success("{}"));
			RunRecord second = record("cdxgen", "acme/widgets", "s1", "2025-03-01T10:00:00Z",
					new RunOutcome.ToolError("exit 1"));

			repository.save(first);
			String firstContent = Files.readString(repository.pathFor(first));
			repository.save(second);

			assertThat(Files.readString(repository.pathFor(first))).isEqualTo(firstContent);
			assertThat(repository.pathFor(first).resolveSibling(
					Instant.parse("2025-03-01T10:00:00Z").toEpochMilli() + "_s1-1.json"))
				.exists();
			assertThat(repository.loadAll()).extracting(RunRecord::outcomeKind)
				.containsExactlyInAnyOrder(OutcomeKind.SUCCESS, OutcomeKind.TOOL_ERROR);
		}

		@Test
		@DisplayName("Should return an empty list when nothing was stored")
		void shouldHandleMissingRoot() {
			assertThat(repository.loadAll()).isEmpty();
		}

		@Test
		@DisplayName("Should skip unreadable files")
		void shouldSkipUnreadableFiles() throws Exception {
			repository.save(record("cdxgen", "acme/widgets", "s1", "2025-03-01T10:00:00Z", success("{}")));
			Path broken = tempDir.resolve("runs").resolve("cdxgen").resolve("acme__other").resolve("1_s1.json");
			Files.createDirectories(broken.getParent());
			Files.writeString(broken, "{ truncated");

			assertThat(repository.loadAll()).extracting(RunRecord::repositoryId).containsExactly("acme/widgets");
		}

	}

	@Nested
	@DisplayName("Queries")
	class QueriesTest {

		@Test
		@DisplayName("Should filter by sample")
		void shouldLoadBySample() throws Exception {
			repository.save(record("cdxgen", "acme/a", "s1", "2025-03-01T10:00:00Z", success("{}")));
			repository.save(record("cdxgen", "acme/a", "s2", "2025-03-02T10:00:00Z", success("{}")));

			assertThat(repository.loadBySample("s2")).extracting(RunRecord::sampleId).containsExactly("s2");
			assertThat(repository.loadBySample("s3")).isEmpty();
		}

		@Test
		@DisplayName("Should keep only the latest run of each pair")
		void shouldLoadLatestPerPair() throws Exception {
			repository.save(record("cdxgen", "acme/a", "s2", "2025-03-02T10:00:00Z", new RunOutcome.Timeout(10)));
			repository.save(record("cdxgen", "acme/a", "s1", "2025-03-01T10:00:00Z", success("{}")));
			repository.save(record("cbomkit", "acme/a", "s1", "2025-03-01T10:05:00Z", success("{}")));

			assertThat(repository.latestPerPair()).extracting(RunRecord::toolId, RunRecord::sampleId)
				.containsExactly(tuple("cbomkit", "s1"), tuple("cdxgen", "s2"));
		}

	}

}

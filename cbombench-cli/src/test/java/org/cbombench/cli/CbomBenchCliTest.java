package org.cbombench.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import org.cbombench.*;

/**
 * Tests for the command-line entry point. Every external dependency is replaced through
 * the builder: no GitHub access, no tool is installed or started.
 */
@DisplayName("CbomBenchCli Tests")
class CbomBenchCliTest {

	private static final String CBOM = """
			{"bomFormat": "CycloneDX", "components": [
			  {"name": "SHA-256", "type": "cryptographic-asset", "cryptoProperties": {"assetType": "algorithm"}}
			]}
			""";

	@TempDir
	Path tempDir;

	private Path dataDir;

	private ProcessExecutor mockExecutor;

	private CbomBenchBuilder builder;

	@BeforeEach
	void setUp() throws Exception {
		dataDir = tempDir.resolve("data");
		mockExecutor = mock(ProcessExecutor.class);
		when(mockExecutor.run(anyList(), any(Path.class))).thenAnswer(invocation -> {
			List<String> command = invocation.getArgument(0);
			int output = command.indexOf("-o");
			if (output >= 0) {
				Files.writeString(Path.of(command.get(output + 1)), CBOM);
			}
			return new ProcessExecutor.ProcessResult(0, "");
		});
		builder = CbomBenchBuilder.create()
			.processExecutor(mockExecutor)
			.branchResolver(url -> Optional.of("main"));
	}

	private int run(String... args) {
		return CbomBenchCli.run(args, builder);
	}

	private long countFiles(Path directory) throws Exception {
		if (!Files.exists(directory)) {
			return 0;
		}
		try (Stream<Path> paths = Files.walk(directory)) {
			return paths.filter(Files::isRegularFile).count();
		}
	}

	@Nested
	@DisplayName("Exit Codes")
	class ExitCodeTest {

		@Test
		@DisplayName("Should exit with 0 for help")
		void shouldSucceedForHelp() {
			assertThat(run("--help")).isEqualTo(CbomBenchCli.EXIT_OK);
		}

		@Test
		@DisplayName("Should exit with 2 for invalid arguments")
		void shouldRejectInvalidArguments() {
			assertThat(run()).isEqualTo(CbomBenchCli.EXIT_USAGE);
			assertThat(run("benchmark", "syft")).isEqualTo(CbomBenchCli.EXIT_USAGE);
			assertThat(run("test", "cdxgen", "https://github.com/acme")).isEqualTo(CbomBenchCli.EXIT_USAGE);
			assertThat(run("analyze", "--timeout", "soon")).isEqualTo(CbomBenchCli.EXIT_USAGE);
		}

		@Test
		@DisplayName("Should exit with 1 when sampling without GitHub credentials")
		void shouldFailWithoutToken() {
			assertThat(run("get-repos", "--data-dir", dataDir.toString())).isEqualTo(CbomBenchCli.EXIT_FATAL);
		}

	}

	@Nested
	@DisplayName("Commands")
	class CommandTest {

		@Test
		@DisplayName("Should run a single-repository test and store its run record")
		void shouldRunTest() throws Exception {
			int exitCode = run("test", "cdxgen", "https://github.com/acme/widgets", "--data-dir", dataDir.toString());

			assertThat(exitCode).isEqualTo(CbomBenchCli.EXIT_OK);
			assertThat(countFiles(dataDir.resolve("runs").resolve("cdxgen").resolve("acme__widgets"))).isEqualTo(1);
			verify(mockExecutor, times(2)).run(anyList(), any(Path.class));
		}

		@Test
		@DisplayName("Should analyse and reload stored runs")
		void shouldAnalyseStoredRuns() throws Exception {
			run("test", "cdxgen", "https://github.com/acme/widgets", "--data-dir", dataDir.toString());

			assertThat(run("analyze", "--data-dir", dataDir.toString())).isEqualTo(CbomBenchCli.EXIT_OK);
			assertThat(run("load-analysis", "--data-dir", dataDir.toString())).isEqualTo(CbomBenchCli.EXIT_OK);
			assertThat(run("load-analysis", "all", "--data-dir", dataDir.toString())).isEqualTo(CbomBenchCli.EXIT_OK);
			assertThat(dataDir.resolve("metrics").resolve(BenchmarkContext.ALL_SAMPLES)).isDirectory();
		}

		@Test
		@DisplayName("Should analyse an empty data directory without failing")
		void shouldAnalyseEmptyDataDirectory() {
			assertThat(run("analyze", "--data-dir", dataDir.toString())).isEqualTo(CbomBenchCli.EXIT_OK);
		}

		@Test
		@DisplayName("Should delete the data directory")
		void shouldDeleteData() throws Exception {
			run("test", "cdxgen", "https://github.com/acme/widgets", "--data-dir", dataDir.toString());
			assertThat(countFiles(dataDir)).isPositive();

			assertThat(run("delete-data", "--data-dir", dataDir.toString())).isEqualTo(CbomBenchCli.EXIT_OK);

			assertThat(dataDir).doesNotExist();
			assertThat(run("delete-data", "--data-dir", dataDir.toString())).isEqualTo(CbomBenchCli.EXIT_OK);
		}

	}

}

package org.cbombench;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("CdxgenAdapter Tests")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CdxgenAdapterTest {

	private static final String CBOM = "{\"bomFormat\":\"CycloneDX\",\"components\":[]}";

	@Mock
	private ProcessExecutor mockExecutor;

	private CdxgenAdapter adapter;

	private final List<List<String>> commands = new ArrayList<>();

	private final List<Path> workDirectories = new ArrayList<>();

	@BeforeEach
	void setUp() {
		adapter = new CdxgenAdapter(mockExecutor, new BenchmarkProperties());
	}

	@SuppressWarnings("unchecked")
	private void givenCommands(ProcessExecutor.ProcessResult clone, ProcessExecutor.ProcessResult generate,
			boolean writeOutput) throws Exception {
		when(mockExecutor.run(anyList(), any(Path.class))).thenAnswer(invocation -> {
			List<String> command = invocation.getArgument(0, List.class);
			commands.add(command);
			workDirectories.add(invocation.getArgument(1, Path.class));
			if (command.get(0).equals("git")) {
				return clone;
			}
			if (writeOutput) {
				Files.writeString(Path.of(command.get(command.indexOf("-o") + 1)), CBOM);
			}
			return generate;
		});
	}

	@Test
	@DisplayName("Should clone the branch and return the generated document")
	void shouldGenerateDocument() throws Exception {
		givenCommands(new ProcessExecutor.ProcessResult(0, ""), new ProcessExecutor.ProcessResult(0, "done"), true);

		GeneratedCbom generated = adapter.generate("https://github.com/acme/widgets.git", "develop");

		assertThat(generated.document()).isEqualTo(CBOM);
		assertThat(generated.durationSeconds()).isGreaterThanOrEqualTo(0);
		assertThat(commands).hasSize(2);
		assertThat(commands.get(0)).containsSequence("git", "clone", "--depth", "1", "-b", "develop",
				"https://github.com/acme/widgets.git");
		assertThat(commands.get(1)).startsWith("cbom", "-t", "java", "-o");
		assertThat(workDirectories.get(0)).doesNotExist();
	}

	@Test
	@DisplayName("Should report a failed clone as a tool error")
	void shouldFailOnCloneError() throws Exception {
		givenCommands(new ProcessExecutor.ProcessResult(128, "fatal: repository not found"),
				new ProcessExecutor.ProcessResult(0, ""), true);

		assertThatThrownBy(() -> adapter.generate("https://github.com/acme/gone", "main"))
			.isInstanceOfSatisfying(CbomAdapterException.class,
					e -> assertThat(e.getKind()).isEqualTo(CbomAdapterException.Kind.TOOL_ERROR))
			.hasMessageContaining("git clone failed with code 128")
			.hasMessageContaining("repository not found");
		assertThat(commands).hasSize(1);
	}

	@Test
	@DisplayName("Should report a non-zero generator exit as a tool error")
	void shouldFailOnGeneratorError() throws Exception {
		givenCommands(new ProcessExecutor.ProcessResult(0, ""), new ProcessExecutor.ProcessResult(1, "boom"), false);

		assertThatThrownBy(() -> adapter.generate("https://github.com/acme/widgets", "main"))
			.isInstanceOf(CbomAdapterException.class)
			.hasMessageContaining("exited with code 1: boom");
		assertThat(workDirectories.get(0)).doesNotExist();
	}

	@Test
	@DisplayName("Should report a missing output file as a tool error")
	void shouldFailWithoutOutputFile() throws Exception {
		givenCommands(new ProcessExecutor.ProcessResult(0, ""), new ProcessExecutor.ProcessResult(0, ""), false);

		assertThatThrownBy(() -> adapter.generate("https://github.com/acme/widgets", "main"))
			.isInstanceOf(CbomAdapterException.class)
			.hasMessageContaining("without writing cbom.json");
	}

	@Test
	@DisplayName("Should report a command that cannot be started as a tool error")
	void shouldFailWhenCommandMissing() throws Exception {
		when(mockExecutor.run(anyList(), any(Path.class))).thenThrow(new IOException("No such file"));

		assertThatThrownBy(() -> adapter.generate("https://github.com/acme/widgets", "main"))
			.isInstanceOfSatisfying(CbomAdapterException.class,
					e -> assertThat(e.getKind()).isEqualTo(CbomAdapterException.Kind.TOOL_ERROR))
			.hasMessageContaining("Could not start git");
	}

	@Test
	@DisplayName("Should report interruption as a timeout and keep the interrupt flag")
	void shouldReportInterruption() throws Exception {
		when(mockExecutor.run(anyList(), any(Path.class))).thenThrow(new InterruptedException());

		try {
			assertThatThrownBy(() -> adapter.generate("https://github.com/acme/widgets", "main"))
				.isInstanceOfSatisfying(CbomAdapterException.class,
						e -> assertThat(e.getKind()).isEqualTo(CbomAdapterException.Kind.TIMEOUT));
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		}
		finally {
			Thread.interrupted();
		}
	}

	@Test
	@DisplayName("Should keep only the end of long output")
	void shouldTailLongOutput() {
		String output = "x".repeat(1000) + "the end";

		String tail = CdxgenAdapter.tail(output);

		assertThat(tail).startsWith("...").endsWith("the end").hasSize(503);
		assertThat(CdxgenAdapter.tail("  short \n")).isEqualTo("short");
	}

}

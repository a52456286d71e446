package org.cbombench;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Adapter for the cdxgen command-line CBOM generator.
 *
 * <p>
 * Clones the branch into a temporary directory, runs {@code cbom -t <type> -o <file>}
 * against it and returns the generated file. Only the generator run is timed, not the
 * clone. The temporary directory is always removed.
 */
public class CdxgenAdapter implements CbomAdapter {

	private static final Logger logger = LoggerFactory.getLogger(CdxgenAdapter.class);

	private static final String OUTPUT_FILE = "cbom.json";

	private final ProcessExecutor processExecutor;

	private final String gitCommand;

	private final String cbomCommand;

	private final String projectType;

	public CdxgenAdapter(ProcessExecutor processExecutor, BenchmarkProperties properties) {
		this.processExecutor = processExecutor;
		this.gitCommand = properties.getGitCommand();
		this.cbomCommand = properties.getCdxgenCommand();
		this.projectType = properties.getCdxgenProjectType();
	}

	@Override
	public GeneratedCbom generate(String repositoryUrl, @Nullable String branch) {
		Path workDir = createWorkDirectory();
		try {
			Path checkout = workDir.resolve("repo");
			cloneRepository(repositoryUrl, branch, workDir, checkout);

			Path outputFile = workDir.resolve(OUTPUT_FILE);
			List<String> command = List.of(cbomCommand, "-t", projectType, "-o", outputFile.toString(),
					checkout.toString());
			logger.info("Generating CBOM for {} with {}", repositoryUrl, cbomCommand);

			long start = System.nanoTime();
			ProcessExecutor.ProcessResult result = run(command, workDir);
			double duration = (System.nanoTime() - start) / 1_000_000_000.0;

			if (!result.succeeded()) {
				throw CbomAdapterException
					.toolError(cbomCommand + " exited with code " + result.exitCode() + ": " + tail(result.output()));
			}
			if (!Files.isRegularFile(outputFile)) {
				throw CbomAdapterException.toolError(cbomCommand + " finished without writing " + OUTPUT_FILE);
			}

			String document = Files.readString(outputFile, StandardCharsets.UTF_8);
			logger.info("CBOM generated for {} in {}s", repositoryUrl, String.format("%.2f", duration));
			return new GeneratedCbom(document, duration);
		}
		catch (IOException e) {
			throw CbomAdapterException.toolError("cdxgen run failed: " + e.getMessage(), e);
		}
		finally {
			deleteRecursively(workDir);
		}
	}

	private void cloneRepository(String repositoryUrl, @Nullable String branch, Path workDir, Path checkout) {
		List<String> command = new ArrayList<>(List.of(gitCommand, "clone", "--depth", "1"));
		if (branch != null) {
			command.add("-b");
			command.add(branch);
		}
		command.add(repositoryUrl);
		command.add(checkout.toString());

		logger.info("Cloning {} (branch: {})", repositoryUrl, branch != null ? branch : "default");
		ProcessExecutor.ProcessResult result = run(command, workDir);
		if (!result.succeeded()) {
			throw CbomAdapterException
				.toolError("git clone failed with code " + result.exitCode() + ": " + tail(result.output()));
		}
	}

	private ProcessExecutor.ProcessResult run(List<String> command, Path workDir) {
		try {
			return processExecutor.run(command, workDir);
		}
		catch (IOException e) {
			throw CbomAdapterException.toolError("Could not start " + command.get(0) + ": " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw CbomAdapterException.timeout(command.get(0) + " was interrupted");
		}
	}

	private static Path createWorkDirectory() {
		try {
			return Files.createTempDirectory("cbombench-cdxgen-");
		}
		catch (IOException e) {
			throw CbomAdapterException.toolError("Could not create working directory: " + e.getMessage(), e);
		}
	}

	private static void deleteRecursively(Path directory) {
		if (!Files.exists(directory)) {
			return;
		}
		try (Stream<Path> paths = Files.walk(directory)) {
			paths.sorted(Comparator.reverseOrder()).forEach(path -> {
				try {
					Files.delete(path);
				}
				catch (IOException e) {
					logger.warn("Failed to delete: {}", path);
				}
			});
		}
		catch (IOException e) {
			logger.warn("Failed to clean working directory {}: {}", directory, e.getMessage());
		}
	}

	static String tail(String output) {
		String trimmed = output.strip();
		return trimmed.length() <= 500 ? trimmed : "..." + trimmed.substring(trimmed.length() - 500);
	}

}

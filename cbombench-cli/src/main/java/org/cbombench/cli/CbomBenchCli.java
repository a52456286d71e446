package org.cbombench.cli;

import ch.qos.logback.classic.Level;
import org.cbombench.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * cbombench CLI Application
 *
 * Plain Java command-line application that benchmarks CBOM generation tools against
 * GitHub repositories and compares what they find. Uses CbomBenchBuilder for service
 * wiring.
 *
 * Usage: java -jar cbombench-cli.jar &lt;command&gt; [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub token for repository sampling;
 * DEEPSEEK_API_KEY - API key for the deepseek tool
 *
 * Exit codes: 0 when the command completed (even if some tool runs failed), 1 on fatal
 * errors, 2 on invalid arguments.
 */
public class CbomBenchCli {

	private static final Logger logger = LoggerFactory.getLogger(CbomBenchCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FATAL = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		int exitCode = run(args);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args) {
		return run(args, CbomBenchBuilder.create().tokenFromEnv());
	}

	static int run(String[] args, CbomBenchBuilder builder) {
		BenchmarkProperties properties = new BenchmarkProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_USAGE;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}
		logConfiguration(config);
		builder.properties(config.applyTo(properties));

		try {
			return execute(config, builder, properties);
		}
		catch (InvalidRepositoryException e) {
			logger.error("Invalid repository {}: {}", e.getUrl(), e.getMessage());
			return EXIT_FATAL;
		}
		catch (RuntimeException e) {
			logger.error("{} failed: {}", config.command != null ? config.command.commandName() : "command",
					e.getMessage());
			logger.debug("Failure details", e);
			return EXIT_FATAL;
		}
	}

	private static int execute(ParsedConfiguration config, CbomBenchBuilder builder, BenchmarkProperties properties) {
		if (config.command == null) {
			throw new IllegalStateException("No command to run");
		}
		switch (config.command) {
			case GET_REPOS: {
				List<RepositoryTarget> repositories = builder.buildRepositorySource()
					.findRepositories(config.toRepositoryQuery());
				logger.info("Found {} repositories", repositories.size());
				repositories.forEach(repository -> System.out.println(repository.url()));
				return EXIT_OK;
			}
			case BENCHMARK: {
				List<RepositoryTarget> repositories = builder.buildRepositorySource()
					.findRepositories(config.toRepositoryQuery());
				if (repositories.isEmpty()) {
					logger.warn("No repositories matched the query, nothing to benchmark");
					return EXIT_OK;
				}
				List<BenchmarkTool> tools = builder.buildTools(config.tools);
				logReport(builder.buildBenchmarkService().benchmark(tools, repositories));
				return EXIT_OK;
			}
			case TEST: {
				List<BenchmarkTool> tools = builder.buildTools(config.tools);
				RepositoryTarget target = new RepositoryTarget(requireValue(config.repositoryUrl), config.branch);
				logReport(builder.buildBenchmarkService().benchmark(tools, List.of(target)));
				return EXIT_OK;
			}
			case ANALYZE: {
				logAnalysis(builder.buildBenchmarkService().analyze(config.sampleId));
				return EXIT_OK;
			}
			case LOAD_ANALYSIS: {
				BenchmarkService service = builder.buildBenchmarkService();
				if (config.sampleId == null) {
					List<String> samples = service.listSamples();
					logger.info("{} stored samples", samples.size());
					samples.forEach(System.out::println);
					return EXIT_OK;
				}
				AnalysisReport analysis = service.loadAnalysis(config.sampleId);
				if (analysis.comparisons().isEmpty() && analysis.metrics().isEmpty()) {
					logger.warn("No stored analysis for sample {}", config.sampleId);
				}
				logAnalysis(analysis);
				return EXIT_OK;
			}
			case DELETE_DATA: {
				deleteDataDirectory(Path.of(properties.getDataDirectory()));
				return EXIT_OK;
			}
			default:
				throw new IllegalStateException("Unhandled command: " + config.command);
		}
	}

	private static String requireValue(@Nullable String value) {
		if (value == null) {
			throw new IllegalStateException("Repository URL is required");
		}
		return value;
	}

	static void deleteDataDirectory(Path dataDirectory) {
		if (!Files.exists(dataDirectory)) {
			logger.info("Data directory {} does not exist, nothing to delete", dataDirectory);
			return;
		}
		try (Stream<Path> paths = Files.walk(dataDirectory)) {
			for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.delete(path);
			}
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to delete " + dataDirectory + ": " + e.getMessage(), e);
		}
		logger.info("Deleted data directory {}", dataDirectory);
	}

	private static void enableVerboseLogging() {
		Logger projectLogger = LoggerFactory.getLogger("org.cbombench");
		if (projectLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.debug("Configuration:");
		logger.debug("  Command: {}", config.command);
		logger.debug("  Tools: {}", config.tools);
		logger.debug("  Repository: {}", config.repositoryUrl != null ? config.repositoryUrl : "(sampled)");
		logger.debug("  Branch: {}", config.branch != null ? config.branch : "(default)");
		logger.debug("  Sample: {}", config.sampleId != null ? config.sampleId : "(all)");
		logger.debug("  Language: {}", config.language);
		logger.debug("  Size: {}..{} KB", config.minSizeKb, config.maxSizeKb);
		logger.debug("  Sample size: {}", config.sampleSize);
		logger.debug("  Timeout: {}s", config.timeoutSeconds);
		logger.debug("  Max in flight: {}", config.maxInFlight);
		logger.debug("  Data directory: {}", config.dataDirectory);
	}

	private static void logReport(BenchmarkReport report) {
		logger.info("Benchmark sample {} completed", report.sampleId());
		logger.info("Runs: {} ({} failed)", report.runs().size(), report.failedRuns());
		for (RunRecord run : report.runs()) {
			logger.info("  {} on {}: {} ({}s)", run.toolId(), run.repositoryId(), run.outcomeKind(),
					String.format("%.1f", run.durationSeconds()));
		}
		logAnalysis(report.analysis());
	}

	private static void logAnalysis(AnalysisReport analysis) {
		logger.info("Analysis of sample {} (cross-tool agreement, no ground truth)", analysis.sampleId());
		for (ComparisonRecord comparison : analysis.comparisons()) {
			logger.info("  {}: {} distinct assets{}", comparison.repositoryId(), comparison.unionSize(),
					comparison.emptyUnion() ? " (no tool found any)" : "");
			for (ComparisonRecord.ToolResult tool : comparison.tools()) {
				logger.info("    {}: {} assets, coverage {}, {} unique, {} unrecognized, {} dropped", tool.toolId(),
						tool.assetCount(), format(tool.coverage()), tool.uniqueFindCount(), tool.unrecognizedCount(),
						tool.droppedEntries());
			}
			for (ComparisonRecord.ExcludedTool excluded : comparison.excluded()) {
				logger.info("    {}: excluded ({})", excluded.toolId(), excluded.reason());
			}
		}
		for (MetricRecord.ToolMetrics metrics : analysis.toolMetrics()) {
			logger.info("  {}: {}/{} succeeded, {} timeouts, {} errors, {} malformed, mean duration {}s", metrics.toolId(),
					metrics.successes(), metrics.attempts(), metrics.timeouts(), metrics.toolErrors(),
					metrics.malformedOutputs(), format(metrics.durationMean()));
			logger.info("    mean coverage {}, mean unique-find ratio {}, mean assets {}, primitives {}",
					format(metrics.meanCoverage()), format(metrics.meanUniqueFindRatio()),
					format(metrics.meanAssetCount()), metrics.primitiveDistribution());
		}
		for (MetricRecord.PairMetrics metrics : analysis.pairMetrics()) {
			logger.info("  {}: mean overlap {} over {} repositories (min {}, max {})", metrics.subject(),
					format(metrics.meanOverlap()), metrics.repositoriesCompared(), format(metrics.minOverlap()),
					format(metrics.maxOverlap()));
		}
	}

	private static String format(@Nullable Double value) {
		return value == null ? "n/a" : String.format("%.2f", value);
	}

}

package org.cbombench;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command-line argument parser for the benchmark. Pure Java implementation with no
 * framework dependencies.
 *
 * <p>
 * The first non-option argument is the command; the remaining non-option arguments are
 * the command's positional arguments (tool names, a repository URL or a sample id).
 */
public class ArgumentParser {

	private final BenchmarkProperties defaultProperties;

	public ArgumentParser(BenchmarkProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> positionals = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-l", "--language":
					config.language = getRequiredValue(args, i, "language").toLowerCase();
					i++;
					break;

				case "-s", "--min-size":
					config.minSizeKb = parseInt(getRequiredValue(args, i, "min-size"), "minimum size", true);
					i++;
					break;

				case "-m", "--max-size":
					config.maxSizeKb = parseInt(getRequiredValue(args, i, "max-size"), "maximum size", true);
					i++;
					break;

				case "-n", "--sample-size":
					config.sampleSize = parseInt(getRequiredValue(args, i, "sample-size"), "sample size", false);
					i++;
					break;

				case "--timeout":
					config.timeoutSeconds = parseInt(getRequiredValue(args, i, "timeout"), "timeout", false);
					i++;
					break;

				case "--max-in-flight":
					config.maxInFlight = parseInt(getRequiredValue(args, i, "max-in-flight"), "max in-flight", false);
					i++;
					break;

				case "-b", "--branch":
					config.branch = getRequiredValue(args, i, "branch");
					i++;
					break;

				case "--sample":
					config.sampleId = getRequiredValue(args, i, "sample");
					i++;
					break;

				case "--data-dir":
					config.dataDirectory = getRequiredValue(args, i, "data-dir");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positionals.add(arg);
					break;
			}
		}

		if (config.helpRequested) {
			return config;
		}

		if (positionals.isEmpty()) {
			throw new IllegalArgumentException("A command is required: " + commandNames());
		}
		String commandName = positionals.remove(0);
		ParsedConfiguration.Command command = ParsedConfiguration.Command.fromName(commandName)
			.orElseThrow(() -> new IllegalArgumentException(
					"Unknown command '" + commandName + "': must be one of " + commandNames()));
		config.command = command;

		bindPositionals(config, command, positionals);
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: cbombench <command> [OPTIONS]\n");
		help.append("\n");
		help.append("Benchmark CBOM generation tools against GitHub repositories and compare their findings.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    get-repos                       Sample repositories from GitHub and print them\n");
		help.append("    benchmark <tools...>            Sample repositories and run the given tools against them\n");
		help.append("    test <tools...> <url>           Run the given tools against a single repository\n");
		help.append("    analyze                         Re-analyse stored run records\n");
		help.append("    load-analysis [sample-id]       Show a stored analysis, or list samples\n");
		help.append("    delete-data                     Delete the data directory\n");
		help.append("\n");
		help.append("TOOLS:\n");
		help.append("    ").append(toolNames()).append("\n");
		help.append("\n");
		help.append("REPOSITORY SAMPLING OPTIONS:\n");
		help.append("    -l, --language <lang>           Primary language (default: ")
			.append(defaultProperties.getLanguage())
			.append(")\n");
		help.append("    -s, --min-size <kb>             Minimum repository size in KB (default: ")
			.append(defaultProperties.getMinSizeKb())
			.append(")\n");
		help.append("    -m, --max-size <kb>             Maximum repository size in KB (default: ")
			.append(defaultProperties.getMaxSizeKb())
			.append(")\n");
		help.append("    -n, --sample-size <count>       Number of repositories (default: ")
			.append(defaultProperties.getSampleSize())
			.append(")\n");
		help.append("\n");
		help.append("EXECUTION OPTIONS:\n");
		help.append("    --timeout <seconds>             Timeout per tool invocation (default: ")
			.append(defaultProperties.getTimeoutSeconds())
			.append(")\n");
		help.append("    --max-in-flight <count>         Concurrent tool invocations (default: ")
			.append(defaultProperties.getMaxInFlight())
			.append(")\n");
		help.append("    -b, --branch <branch>           Branch to scan (test only, default: repository default)\n");
		help.append("    --sample <id>                   Sample to analyse (analyze only, default: all samples)\n");
		help.append("    --data-dir <dir>                Data directory (default: ")
			.append(defaultProperties.getDataDirectory())
			.append(")\n");
		help.append("    -v, --verbose                   Enable verbose logging\n");
		help.append("    -h, --help                      Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN                    GitHub token (required for get-repos and benchmark)\n");
		help.append("    DEEPSEEK_API_KEY                DeepSeek API key (required for the deepseek tool)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    cbombench get-repos -l java -n 5\n");
		help.append("    cbombench benchmark cbomkit cdxgen deepseek -n 10 --timeout 900\n");
		help.append("    cbombench test cdxgen https://github.com/apache/commons-crypto --branch master\n");
		help.append("    cbombench analyze --sample 20250101-120000\n");
		help.append("    cbombench load-analysis\n");
		help.append("\n");

		return help.toString();
	}

	private void bindPositionals(ParsedConfiguration config, ParsedConfiguration.Command command,
			List<String> positionals) {
		switch (command) {
			case BENCHMARK:
				config.tools = parseTools(positionals);
				break;

			case TEST:
				if (positionals.size() < 2) {
					throw new IllegalArgumentException("test requires at least one tool and a repository URL");
				}
				config.repositoryUrl = positionals.remove(positionals.size() - 1);
				config.tools = parseTools(positionals);
				break;

			case LOAD_ANALYSIS:
				if (positionals.size() > 1) {
					throw new IllegalArgumentException("load-analysis takes at most one sample id");
				}
				if (!positionals.isEmpty()) {
					config.sampleId = positionals.get(0);
				}
				break;

			default:
				if (!positionals.isEmpty()) {
					throw new IllegalArgumentException(
							"Unexpected arguments for " + command.commandName() + ": " + positionals);
				}
				break;
		}
	}

	private List<ToolFamily> parseTools(List<String> names) {
		if (names.isEmpty()) {
			throw new IllegalArgumentException("At least one tool is required: " + toolNames());
		}
		List<ToolFamily> tools = new ArrayList<>();
		for (String name : names) {
			ToolFamily family = ToolFamily.fromName(name)
				.orElseThrow(() -> new IllegalArgumentException(
						"Unknown tool '" + name + "': must be one of " + toolNames()));
			if (!tools.contains(family)) {
				tools.add(family);
			}
		}
		return tools;
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseInt(String value, String name, boolean zeroAllowed) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be an integer");
		}
		if (parsed < 0 || (parsed == 0 && !zeroAllowed)) {
			throw new IllegalArgumentException(
					"Invalid " + name + " '" + value + "': must be " + (zeroAllowed ? "non-negative" : "positive"));
		}
		return parsed;
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.minSizeKb > config.maxSizeKb) {
			errors.add("Minimum size " + config.minSizeKb + " is above maximum size " + config.maxSizeKb);
		}
		if (config.branch != null && config.command != ParsedConfiguration.Command.TEST) {
			errors.add("--branch only applies to the test command");
		}
		if (config.sampleId != null && config.command != ParsedConfiguration.Command.ANALYZE
				&& config.command != ParsedConfiguration.Command.LOAD_ANALYSIS) {
			errors.add("A sample id only applies to the analyze and load-analysis commands");
		}
		if (config.sampleId != null && (config.sampleId.isBlank() || config.sampleId.contains("/"))) {
			errors.add("Invalid sample id: '" + config.sampleId + "'");
		}
		if (config.repositoryUrl != null && !RepositoryIds.isValid(config.repositoryUrl)) {
			errors.add("Not a repository URL: " + config.repositoryUrl);
		}
		if (config.dataDirectory.isBlank()) {
			errors.add("Data directory cannot be empty");
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration validation failed: " + String.join(", ", errors));
		}
	}

	private static String commandNames() {
		return Arrays.stream(ParsedConfiguration.Command.values())
			.map(ParsedConfiguration.Command::commandName)
			.collect(Collectors.joining(", "));
	}

	private static String toolNames() {
		return Arrays.stream(ToolFamily.values()).map(ToolFamily::defaultToolId).collect(Collectors.joining(", "));
	}

}

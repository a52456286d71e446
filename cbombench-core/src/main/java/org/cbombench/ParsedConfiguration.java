package org.cbombench;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	/**
	 * Commands understood by the command-line interface.
	 */
	public enum Command {

		GET_REPOS,

		BENCHMARK,

		TEST,

		ANALYZE,

		LOAD_ANALYSIS,

		DELETE_DATA;

		public String commandName() {
			return name().toLowerCase(Locale.ROOT).replace('_', '-');
		}

		public static Optional<Command> fromName(String name) {
			for (Command command : values()) {
				if (command.commandName().equals(name)) {
					return Optional.of(command);
				}
			}
			return Optional.empty();
		}

	}

	public @Nullable Command command; // null only when help was requested

	// Tools and target
	public List<ToolFamily> tools = new ArrayList<>();

	public @Nullable String repositoryUrl; // test command only

	public @Nullable String branch; // null = default branch of the repository

	public @Nullable String sampleId; // analyze / load-analysis, null = all samples

	// Repository sampling
	public String language;

	public int minSizeKb;

	public int maxSizeKb;

	public int sampleSize;

	// Execution
	public int timeoutSeconds;

	public int maxInFlight;

	public String dataDirectory;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(BenchmarkProperties defaultProperties) {
		this.language = defaultProperties.getLanguage();
		this.minSizeKb = defaultProperties.getMinSizeKb();
		this.maxSizeKb = defaultProperties.getMaxSizeKb();
		this.sampleSize = defaultProperties.getSampleSize();
		this.timeoutSeconds = defaultProperties.getTimeoutSeconds();
		this.maxInFlight = defaultProperties.getMaxInFlight();
		this.dataDirectory = defaultProperties.getDataDirectory();
	}

	/**
	 * Copy the parsed values onto a properties instance.
	 * @param properties properties to update
	 * @return the updated properties
	 */
	public BenchmarkProperties applyTo(BenchmarkProperties properties) {
		properties.setLanguage(language);
		properties.setMinSizeKb(minSizeKb);
		properties.setMaxSizeKb(maxSizeKb);
		properties.setSampleSize(sampleSize);
		properties.setTimeoutSeconds(timeoutSeconds);
		properties.setMaxInFlight(maxInFlight);
		properties.setDataDirectory(dataDirectory);
		return properties;
	}

	public RepositoryQuery toRepositoryQuery() {
		return new RepositoryQuery(language, minSizeKb, maxSizeKb, sampleSize);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command=" + command + ", tools=" + tools + ", repositoryUrl='" + repositoryUrl
				+ '\'' + ", branch='" + branch + '\'' + ", sampleId='" + sampleId + '\'' + ", language='" + language
				+ '\'' + ", minSizeKb=" + minSizeKb + ", maxSizeKb=" + maxSizeKb + ", sampleSize=" + sampleSize
				+ ", timeoutSeconds=" + timeoutSeconds + ", maxInFlight=" + maxInFlight + ", dataDirectory='"
				+ dataDirectory + '\'' + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}

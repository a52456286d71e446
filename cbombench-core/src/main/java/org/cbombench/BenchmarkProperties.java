package org.cbombench;

/**
 * Configuration properties for benchmark runs and analyses.
 *
 * <p>
 * Defaults match a local setup: a CBOMkit server on port 8081, the {@code cbom} and
 * {@code git} executables on the {@code PATH}, and data written below
 * {@code CBOMdata} in the working directory. Command-line arguments override these
 * values.
 */
public class BenchmarkProperties {

	/**
	 * Directory holding run records and metric records.
	 */
	private String dataDirectory = "CBOMdata";

	/**
	 * Wall-clock budget for a single adapter invocation, in seconds.
	 */
	private int timeoutSeconds = 1800;

	/**
	 * Maximum number of adapter invocations running at the same time.
	 */
	private int maxInFlight = 3;

	/**
	 * Maximum number of CBOMkit scans running at the same time. A CBOMkit server only
	 * hands out its most recent CBOM, so scans against one server must not overlap.
	 */
	private int cbomkitMaxInFlight = 1;

	/**
	 * Branch used when the default branch of a repository cannot be resolved.
	 */
	private String fallbackBranch = "main";

	/**
	 * Default language filter for repository sampling.
	 */
	private String language = "java";

	/**
	 * Default minimum repository size in KB.
	 */
	private int minSizeKb = 1000;

	/**
	 * Default maximum repository size in KB.
	 */
	private int maxSizeKb = 1000000;

	/**
	 * Default number of repositories per benchmark.
	 */
	private int sampleSize = 1;

	/**
	 * Scan endpoint; every scan connects under its own client id below it.
	 */
	private String cbomkitWebSocketUrl = "ws://localhost:8081/v1/scan";

	private String cbomkitApiUrl = "http://localhost:8081/api/v1/cbom/last/1";

	private String cdxgenCommand = "cbom";

	/**
	 * Project type passed to cdxgen with {@code -t}.
	 */
	private String cdxgenProjectType = "java";

	private String gitCommand = "git";

	private String deepseekBaseUrl = "https://api.deepseek.com";

	private String deepseekModel = "deepseek-chat";

	public String getDataDirectory() {
		return dataDirectory;
	}

	public void setDataDirectory(String dataDirectory) {
		this.dataDirectory = dataDirectory;
	}

	public int getTimeoutSeconds() {
		return timeoutSeconds;
	}

	public void setTimeoutSeconds(int timeoutSeconds) {
		if (timeoutSeconds <= 0) {
			throw new IllegalArgumentException("Timeout must be positive: " + timeoutSeconds);
		}
		this.timeoutSeconds = timeoutSeconds;
	}

	public int getMaxInFlight() {
		return maxInFlight;
	}

	public void setMaxInFlight(int maxInFlight) {
		if (maxInFlight <= 0) {
			throw new IllegalArgumentException("Max in-flight count must be positive: " + maxInFlight);
		}
		this.maxInFlight = maxInFlight;
	}

	public int getCbomkitMaxInFlight() {
		return cbomkitMaxInFlight;
	}

	public void setCbomkitMaxInFlight(int cbomkitMaxInFlight) {
		if (cbomkitMaxInFlight <= 0) {
			throw new IllegalArgumentException("CBOMkit in-flight count must be positive: " + cbomkitMaxInFlight);
		}
		this.cbomkitMaxInFlight = cbomkitMaxInFlight;
	}

	/**
	 * Concurrent invocations allowed for one tool family, never more than
	 * {@link #getMaxInFlight()}.
	 */
	public int maxInFlightFor(ToolFamily family) {
		if (family == ToolFamily.CBOMKIT) {
			return Math.min(cbomkitMaxInFlight, maxInFlight);
		}
		return maxInFlight;
	}

	public String getFallbackBranch() {
		return fallbackBranch;
	}

	public void setFallbackBranch(String fallbackBranch) {
		this.fallbackBranch = fallbackBranch;
	}

	public String getLanguage() {
		return language;
	}

	public void setLanguage(String language) {
		this.language = language;
	}

	public int getMinSizeKb() {
		return minSizeKb;
	}

	public void setMinSizeKb(int minSizeKb) {
		this.minSizeKb = minSizeKb;
	}

	public int getMaxSizeKb() {
		return maxSizeKb;
	}

	public void setMaxSizeKb(int maxSizeKb) {
		this.maxSizeKb = maxSizeKb;
	}

	public int getSampleSize() {
		return sampleSize;
	}

	public void setSampleSize(int sampleSize) {
		this.sampleSize = sampleSize;
	}

	public String getCbomkitWebSocketUrl() {
		return cbomkitWebSocketUrl;
	}

	public void setCbomkitWebSocketUrl(String cbomkitWebSocketUrl) {
		this.cbomkitWebSocketUrl = cbomkitWebSocketUrl;
	}

	public String getCbomkitApiUrl() {
		return cbomkitApiUrl;
	}

	public void setCbomkitApiUrl(String cbomkitApiUrl) {
		this.cbomkitApiUrl = cbomkitApiUrl;
	}

	public String getCdxgenCommand() {
		return cdxgenCommand;
	}

	public void setCdxgenCommand(String cdxgenCommand) {
		this.cdxgenCommand = cdxgenCommand;
	}

	public String getCdxgenProjectType() {
		return cdxgenProjectType;
	}

	public void setCdxgenProjectType(String cdxgenProjectType) {
		this.cdxgenProjectType = cdxgenProjectType;
	}

	public String getGitCommand() {
		return gitCommand;
	}

	public void setGitCommand(String gitCommand) {
		this.gitCommand = gitCommand;
	}

	public String getDeepseekBaseUrl() {
		return deepseekBaseUrl;
	}

	public void setDeepseekBaseUrl(String deepseekBaseUrl) {
		this.deepseekBaseUrl = deepseekBaseUrl;
	}

	public String getDeepseekModel() {
		return deepseekModel;
	}

	public void setDeepseekModel(String deepseekModel) {
		this.deepseekModel = deepseekModel;
	}

}

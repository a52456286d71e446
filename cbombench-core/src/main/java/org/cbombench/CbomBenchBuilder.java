package org.cbombench;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Builder wiring the benchmark components.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * BenchmarkProperties props = new BenchmarkProperties();
 * props.setTimeoutSeconds(600);
 *
 * CbomBenchBuilder builder = CbomBenchBuilder.create()
 *     .properties(props)
 *     .tokenFromEnv();
 *
 * BenchmarkService service = builder.buildBenchmarkService();
 * List<BenchmarkTool> tools = builder.buildTools(List.of(ToolFamily.CBOMKIT, ToolFamily.CDXGEN));
 * BenchmarkReport report = service.benchmark(tools,
 *     List.of(RepositoryTarget.of("https://github.com/apache/commons-crypto")));
 *
 * // For testing with a mock GitHub client and in-memory stores
 * BenchmarkService testService = CbomBenchBuilder.create()
 *     .gitHubClient(mockClient)
 *     .runRecordRepository(records)
 *     .metricsStore(store)
 *     .buildBenchmarkService();
 * }
 * </pre>
 */
public class CbomBenchBuilder {

	private BenchmarkProperties properties;

	private @Nullable String githubToken;

	private @Nullable String deepseekApiKey;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient gitHubClient;

	private @Nullable HttpClient httpClient;

	private @Nullable ProcessExecutor processExecutor;

	private @Nullable RunRecordRepository runRecordRepository;

	private @Nullable MetricsStore metricsStore;

	private @Nullable BranchResolver branchResolver;

	private Clock clock = Clock.systemUTC();

	private CbomBenchBuilder() {
		this.properties = new BenchmarkProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new CbomBenchBuilder
	 */
	public static CbomBenchBuilder create() {
		return new CbomBenchBuilder();
	}

	/**
	 * Set benchmark properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public CbomBenchBuilder properties(@Nullable BenchmarkProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public CbomBenchBuilder token(String token) {
		this.githubToken = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN}, if it is set. Repository sampling
	 * requires it; branch resolution falls back to the configured branch without it.
	 * @return this builder
	 */
	public CbomBenchBuilder tokenFromEnv() {
		this.githubToken = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		return this;
	}

	/**
	 * Set the DeepSeek API key directly instead of reading {@code DEEPSEEK_API_KEY}.
	 * @param apiKey API key
	 * @return this builder
	 */
	public CbomBenchBuilder deepseekApiKey(String apiKey) {
		this.deepseekApiKey = apiKey;
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public CbomBenchBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. When a custom client is provided, the
	 * token is not required.
	 * @param gitHubClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public CbomBenchBuilder gitHubClient(@Nullable GitHubClient gitHubClient) {
		this.gitHubClient = gitHubClient;
		return this;
	}

	/**
	 * Set the HTTP client used by the CBOMkit and DeepSeek adapters.
	 * @param httpClient HTTP client (null to use default)
	 * @return this builder
	 */
	public CbomBenchBuilder httpClient(@Nullable HttpClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the process executor used by the cdxgen adapter.
	 * @param processExecutor process executor (null to use default)
	 * @return this builder
	 */
	public CbomBenchBuilder processExecutor(@Nullable ProcessExecutor processExecutor) {
		this.processExecutor = processExecutor;
		return this;
	}

	/**
	 * Set a custom RunRecordRepository implementation.
	 * @param runRecordRepository repository (null to store under the data directory)
	 * @return this builder
	 */
	public CbomBenchBuilder runRecordRepository(@Nullable RunRecordRepository runRecordRepository) {
		this.runRecordRepository = runRecordRepository;
		return this;
	}

	/**
	 * Set a custom MetricsStore implementation.
	 * @param metricsStore store (null to store under the data directory)
	 * @return this builder
	 */
	public CbomBenchBuilder metricsStore(@Nullable MetricsStore metricsStore) {
		this.metricsStore = metricsStore;
		return this;
	}

	/**
	 * Set a custom BranchResolver.
	 * @param branchResolver resolver (null to use GitHub when a token or client is
	 * available)
	 * @return this builder
	 */
	public CbomBenchBuilder branchResolver(@Nullable BranchResolver branchResolver) {
		this.branchResolver = branchResolver;
		return this;
	}

	public CbomBenchBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the GitHub repository source used to sample repositories.
	 * @return configured repository source
	 * @throws IllegalStateException if neither a token nor a custom client is available
	 */
	public GitHubRepositorySource buildRepositorySource() {
		return gitHubSource().orElseThrow(() -> new IllegalStateException(
				"GitHub token is required to sample repositories. Set GITHUB_TOKEN or call token() first."));
	}

	/**
	 * Build one benchmark tool per family, recorded under the family's default id.
	 * @param families tool families
	 * @return the tools, in the given order
	 * @throws IllegalStateException if a tool's credentials are missing
	 */
	public List<BenchmarkTool> buildTools(List<ToolFamily> families) {
		return families.stream().map(family -> BenchmarkTool.of(family, buildAdapter(family))).toList();
	}

	/**
	 * Build the adapter of a tool family.
	 * @param family tool family
	 * @return configured adapter
	 */
	public CbomAdapter buildAdapter(ToolFamily family) {
		ObjectMapper mapper = mapper();
		return switch (family) {
			case CBOMKIT -> new CbomkitAdapter(httpClient(), mapper, properties);
			case CDXGEN -> new CdxgenAdapter(processExecutor != null ? processExecutor : new ProcessExecutor(),
					properties);
			case DEEPSEEK -> new DeepSeekAdapter(httpClient(), mapper, properties,
					deepseekApiKey != null ? deepseekApiKey
							: EnvironmentSupport.require(EnvironmentSupport.DEEPSEEK_API_KEY, "to run DeepSeek"));
		};
	}

	/**
	 * Build the benchmark service with its orchestrator, normalizer and stores.
	 * @return configured BenchmarkService
	 */
	public BenchmarkService buildBenchmarkService() {
		ObjectMapper mapper = mapper();
		Path dataDirectory = Path.of(properties.getDataDirectory());
		RunRecordRepository records = this.runRecordRepository != null ? this.runRecordRepository
				: new FileSystemRunRecordRepository(dataDirectory.resolve("runs"), mapper);
		MetricsStore store = this.metricsStore != null ? this.metricsStore
				: new FileSystemMetricsStore(dataDirectory.resolve("metrics"), mapper);
		BranchResolver resolver = this.branchResolver != null ? this.branchResolver
				: gitHubSource().<BranchResolver>map(source -> source).orElse(url -> Optional.empty());

		RunOrchestrator orchestrator = new RunOrchestrator(records, resolver, mapper, properties);
		return new BenchmarkService(orchestrator, records, AssetNormalizer.withDefaultExtractors(new JsonNodeUtils()),
				new AssetComparator(), new MetricsAggregator(), store, clock);
	}

	private Optional<GitHubRepositorySource> gitHubSource() {
		GitHubClient client = this.gitHubClient;
		if (client == null) {
			if (githubToken == null || githubToken.isBlank()) {
				return Optional.empty();
			}
			client = new GitHubHttpClient(githubToken);
		}
		return Optional.of(new GitHubRepositorySource(client, mapper(), clock, new Random(), properties.getLanguage()));
	}

	private ObjectMapper mapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

	private HttpClient httpClient() {
		if (httpClient == null) {
			httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
		}
		return httpClient;
	}

}

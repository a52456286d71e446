package org.cbombench;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Samples repositories through the GitHub search API and resolves default branches and
 * sizes through the repository API.
 *
 * <p>
 * Search results are restricted to repositories pushed within the last year and sorted
 * by stars; the requested number of repositories is then drawn at random from the first
 * page. The language size is the byte count GitHub reports for the configured language
 * under {@code /repos/{owner}/{repo}/languages}, in KB.
 */
public class GitHubRepositorySource implements RepositorySource, BranchResolver {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRepositorySource.class);

	static final int PAGE_SIZE = 50;

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final JsonNodeUtils jsonUtils = new JsonNodeUtils();

	private final Clock clock;

	private final Random random;

	private final String language;

	public GitHubRepositorySource(GitHubClient client, ObjectMapper objectMapper, Clock clock, Random random,
			String language) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.random = random;
		this.language = language;
	}

	@Override
	public List<RepositoryTarget> findRepositories(RepositoryQuery query) {
		String searchQuery = buildSearchQuery(query);
		String queryString = "q=" + URLEncoder.encode(searchQuery, StandardCharsets.UTF_8)
				+ "&sort=stars&order=desc&per_page=" + PAGE_SIZE;
		logger.info("Searching repositories: {}", searchQuery);

		JsonNode result = readTree(client.getWithQuery("/search/repositories", queryString));
		List<RepositoryTarget> candidates = new ArrayList<>();
		for (JsonNode item : jsonUtils.getArray(result, "items")) {
			Optional<String> cloneUrl = jsonUtils.getText(item, "clone_url");
			if (cloneUrl.isEmpty()) {
				logger.debug("Skipping search result without clone_url: {}", jsonUtils.getText(item, "full_name"));
				continue;
			}
			candidates.add(new RepositoryTarget(cloneUrl.get(), jsonUtils.getText(item, "default_branch").orElse(null),
					jsonUtils.getLenientInt(item, "size").orElse(null)));
		}

		if (candidates.size() <= query.sampleSize()) {
			if (candidates.size() < query.sampleSize()) {
				logger.warn("Not enough repositories found matching the filters: requested {}, found {}",
						query.sampleSize(), candidates.size());
			}
			return candidates;
		}

		List<RepositoryTarget> shuffled = new ArrayList<>(candidates);
		Collections.shuffle(shuffled, random);
		return List.copyOf(shuffled.subList(0, query.sampleSize()));
	}

	@Override
	public Optional<String> resolveDefaultBranch(String repositoryUrl) {
		return gitHubRepositoryId(repositoryUrl).flatMap(this::fetchRepository)
			.flatMap(repository -> jsonUtils.getText(repository, "default_branch"));
	}

	@Override
	public RepositoryMetadata describe(String repositoryUrl) {
		Optional<String> repositoryId = gitHubRepositoryId(repositoryUrl);
		Optional<JsonNode> repository = repositoryId.flatMap(this::fetchRepository);
		if (repository.isEmpty()) {
			return RepositoryMetadata.UNKNOWN;
		}

		Integer languageSizeKb;
		try {
			languageSizeKb = languageSizeKb(readTree(client.get("/repos/" + repositoryId.get() + "/languages")));
		}
		catch (RuntimeException e) {
			logger.warn("Failed to fetch languages for {}: {}", repositoryId.get(), e.getMessage());
			languageSizeKb = null;
		}
		return new RepositoryMetadata(jsonUtils.getText(repository.get(), "default_branch").orElse(null),
				jsonUtils.getLenientInt(repository.get(), "size").orElse(null), languageSizeKb);
	}

	/**
	 * KB of code in the configured language, {@code null} when there is none.
	 */
	@Nullable
	Integer languageSizeKb(JsonNode languages) {
		for (Iterator<Map.Entry<String, JsonNode>> fields = languages.fields(); fields.hasNext();) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (field.getKey().equalsIgnoreCase(language)) {
				long bytes = field.getValue().asLong();
				return bytes > 0 ? (int) (bytes / 1024) : null;
			}
		}
		return null;
	}

	private Optional<String> gitHubRepositoryId(String repositoryUrl) {
		String repositoryId;
		try {
			repositoryId = RepositoryIds.fromUrl(repositoryUrl);
		}
		catch (InvalidRepositoryException e) {
			logger.warn("Cannot look up repository: {}", e.getMessage());
			return Optional.empty();
		}
		if (repositoryId.split("/").length != 2) {
			logger.warn("Not a GitHub repository, cannot look it up: {}", repositoryUrl);
			return Optional.empty();
		}
		return Optional.of(repositoryId);
	}

	private Optional<JsonNode> fetchRepository(String repositoryId) {
		try {
			return Optional.of(readTree(client.get("/repos/" + repositoryId)));
		}
		catch (RuntimeException e) {
			logger.warn("Failed to fetch repository information for {}: {}", repositoryId, e.getMessage());
			return Optional.empty();
		}
	}

	String buildSearchQuery(RepositoryQuery query) {
		LocalDate oneYearAgo = LocalDate.now(clock).minusDays(365);
		StringBuilder q = new StringBuilder();
		q.append("language:").append(query.language());
		q.append(" pushed:>").append(oneYearAgo);
		if (query.maxSizeKb() == null) {
			q.append(" size:>").append(query.minSizeKb());
		}
		else {
			q.append(" size:").append(query.minSizeKb()).append("..").append(query.maxSizeKb());
		}
		return q.toString();
	}

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Unparsable GitHub API response: " + e.getOriginalMessage(),
					e);
		}
	}

}

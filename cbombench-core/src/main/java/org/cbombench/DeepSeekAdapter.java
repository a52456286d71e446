package org.cbombench;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Adapter asking a DeepSeek chat model (OpenAI-compatible chat-completions API) to write
 * a CycloneDX CBOM for a repository.
 *
 * <p>
 * The model's answer is unwrapped from Markdown code fences. When it parses as JSON, a
 * bare component array is wrapped into a CycloneDX object and missing {@code bomFormat}
 * and {@code specVersion} fields are filled in. Text that does not parse is returned as
 * is and recorded as malformed output by the orchestrator.
 */
public class DeepSeekAdapter implements CbomAdapter {

	private static final Logger logger = LoggerFactory.getLogger(DeepSeekAdapter.class);

	static final String SYSTEM_PROMPT = """
			You analyze software projects for cryptography. Produce a Cryptographic Bill of \
			Materials (CBOM) for the given GitHub project in CycloneDX JSON format \
			(bomFormat "CycloneDX", specVersion "1.6").

			Report every cryptographic asset you can identify: algorithms (for example AES, \
			RSA, SHA-256), key management, hashing, digital signatures, certificates and \
			TLS usage, random number generation. Use component type "cryptographic-asset" \
			and fill cryptoProperties (assetType, algorithmProperties.primitive, key sizes \
			or parameterSetIdentifier) for each component.

			Answer with the JSON document only, without Markdown or explanations. If nothing \
			is found, answer with an empty CBOM.""";

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final URI completionsEndpoint;

	private final String model;

	private final String apiKey;

	private final Duration requestTimeout;

	public DeepSeekAdapter(HttpClient httpClient, ObjectMapper objectMapper, BenchmarkProperties properties,
			String apiKey) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.completionsEndpoint = URI.create(stripTrailingSlash(properties.getDeepseekBaseUrl()) + "/chat/completions");
		this.model = properties.getDeepseekModel();
		this.apiKey = apiKey;
		this.requestTimeout = Duration.ofSeconds(properties.getTimeoutSeconds());
	}

	@Override
	public GeneratedCbom generate(String repositoryUrl, @Nullable String branch) {
		logger.info("Requesting CBOM for {} from {}", repositoryUrl, model);
		long start = System.nanoTime();

		HttpRequest request = HttpRequest.newBuilder(completionsEndpoint)
			.header("Authorization", "Bearer " + apiKey)
			.header("Content-Type", "application/json")
			.timeout(requestTimeout)
			.POST(HttpRequest.BodyPublishers.ofString(requestBody(repositoryUrl, branch)))
			.build();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (HttpTimeoutException e) {
			throw CbomAdapterException.timeout("DeepSeek request timed out after " + requestTimeout.toSeconds() + "s");
		}
		catch (IOException e) {
			throw CbomAdapterException.toolError("DeepSeek request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw CbomAdapterException.timeout("DeepSeek request was interrupted");
		}

		if (response.statusCode() < 200 || response.statusCode() >= 300) {
			throw CbomAdapterException
				.toolError("DeepSeek API error: " + response.statusCode() + " " + CdxgenAdapter.tail(response.body()));
		}

		String content = extractContent(response.body());
		double duration = (System.nanoTime() - start) / 1_000_000_000.0;
		return new GeneratedCbom(completeDocument(stripCodeFence(content)), duration);
	}

	String requestBody(String repositoryUrl, @Nullable String branch) {
		ObjectNode body = objectMapper.createObjectNode();
		body.put("model", model);
		body.put("stream", false);
		ArrayNode messages = body.putArray("messages");
		messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
		messages.addObject()
			.put("role", "user")
			.put("content", "Generate a CycloneDX CBOM JSON document for this project.\nProject: " + repositoryUrl
					+ "\nBranch: " + (branch != null ? branch : "default") + "\nReturn only the JSON.");
		try {
			return objectMapper.writeValueAsString(body);
		}
		catch (JsonProcessingException e) {
			throw CbomAdapterException.toolError("Could not encode DeepSeek request", e);
		}
	}

	String extractContent(String responseBody) {
		JsonNode envelope;
		try {
			envelope = objectMapper.readTree(responseBody);
		}
		catch (JsonProcessingException e) {
			throw CbomAdapterException.unparsableOutput("DeepSeek response is not JSON: " + e.getOriginalMessage());
		}
		JsonNode content = envelope.path("choices").path(0).path("message").path("content");
		if (!content.isTextual()) {
			throw CbomAdapterException.unparsableOutput("DeepSeek response has no message content");
		}
		return content.asText();
	}

	static String stripCodeFence(String content) {
		String text = content.strip();
		int fence = text.indexOf("```");
		if (fence < 0) {
			return text;
		}
		int bodyStart = text.indexOf('\n', fence);
		if (bodyStart < 0) {
			return text;
		}
		int fenceEnd = text.indexOf("```", bodyStart);
		return (fenceEnd < 0 ? text.substring(bodyStart + 1) : text.substring(bodyStart + 1, fenceEnd)).strip();
	}

	String completeDocument(String json) {
		JsonNode parsed;
		try {
			parsed = objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			logger.warn("DeepSeek answer is not valid JSON: {}", e.getOriginalMessage());
			return json;
		}

		ObjectNode document;
		if (parsed instanceof ObjectNode object) {
			document = object;
		}
		else if (parsed instanceof ArrayNode array) {
			document = objectMapper.createObjectNode();
			document.set("components", array);
		}
		else {
			return json;
		}
		if (!document.has("bomFormat")) {
			document.put("bomFormat", "CycloneDX");
		}
		if (!document.has("specVersion")) {
			document.put("specVersion", "1.6");
		}
		try {
			return objectMapper.writeValueAsString(document);
		}
		catch (JsonProcessingException e) {
			throw CbomAdapterException.toolError("Could not re-encode DeepSeek document", e);
		}
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

}

package org.cbombench;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Adapter for a CBOMkit server.
 *
 * <p>
 * A scan request is sent over the server's WebSocket endpoint under a client id of its
 * own; progress messages are logged until the server reports {@code Finished}. The CBOM
 * comes from the scan's own {@code CBOM} message when the server sends one, otherwise the
 * most recent CBOM is fetched from the REST API. The latter is only safe while scans run
 * one at a time, which {@link BenchmarkProperties#getCbomkitMaxInFlight()} enforces by
 * default. Timing starts once the server has checked out the repository, so the measured
 * duration covers the scan and the retrieval but not the clone.
 */
public class CbomkitAdapter implements CbomAdapter {

	private static final Logger logger = LoggerFactory.getLogger(CbomkitAdapter.class);

	static final String CHECKOUT_DONE_MESSAGE = "Cloning git repository: Checking out files done";

	static final String FINISHED_MESSAGE = "Finished";

	static final String CLIENT_ID_PREFIX = "cbombench-";

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final String scanBase;

	private final URI cbomEndpoint;

	public CbomkitAdapter(HttpClient httpClient, ObjectMapper objectMapper, BenchmarkProperties properties) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.scanBase = stripTrailingSlash(properties.getCbomkitWebSocketUrl());
		this.cbomEndpoint = URI.create(properties.getCbomkitApiUrl());
	}

	@Override
	public GeneratedCbom generate(String repositoryUrl, @Nullable String branch) {
		URI scanEndpoint = scanEndpoint(UUID.randomUUID().toString());
		ScanProgress progress = new ScanProgress(objectMapper);
		WebSocket webSocket = connect(scanEndpoint, progress);

		try {
			webSocket.sendText(scanRequest(repositoryUrl, branch), true).get();
			progress.markRequestSent();
			logger.info("Scan request for {} sent to {}, waiting for CBOM...", repositoryUrl, scanEndpoint);
			progress.finished().get();
		}
		catch (InterruptedException e) {
			webSocket.abort();
			Thread.currentThread().interrupt();
			throw interrupted(repositoryUrl);
		}
		catch (ExecutionException e) {
			webSocket.abort();
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			if (cause instanceof CbomAdapterException adapterException) {
				throw adapterException;
			}
			throw CbomAdapterException.toolError("CBOMkit scan failed: " + cause.getMessage(), cause);
		}

		webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "done");
		String document = progress.cbom();
		if (document == null) {
			logger.debug("No CBOM message for {}, fetching the latest from {}", repositoryUrl, cbomEndpoint);
			document = fetchLastCbom();
		}
		double duration = progress.elapsedSeconds();
		logger.info("CBOM retrieved for {}, duration: {}s", repositoryUrl, String.format("%.2f", duration));
		return new GeneratedCbom(document, duration);
	}

	URI scanEndpoint(String scanId) {
		return URI.create(scanBase + "/" + CLIENT_ID_PREFIX + scanId);
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	private WebSocket connect(URI scanEndpoint, ScanProgress progress) {
		try {
			return httpClient.newWebSocketBuilder()
				.connectTimeout(Duration.ofSeconds(30))
				.buildAsync(scanEndpoint, progress)
				.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw interrupted(scanEndpoint.toString());
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			throw CbomAdapterException.toolError("Could not connect to CBOMkit at " + scanEndpoint + ": "
					+ cause.getMessage(), cause);
		}
	}

	private String scanRequest(String repositoryUrl, @Nullable String branch) {
		Map<String, String> request = new LinkedHashMap<>();
		request.put("scanUrl", repositoryUrl);
		if (branch != null) {
			request.put("branch", branch);
		}
		try {
			return objectMapper.writeValueAsString(request);
		}
		catch (JsonProcessingException e) {
			throw CbomAdapterException.toolError("Could not encode scan request", e);
		}
	}

	private String fetchLastCbom() {
		HttpRequest request = HttpRequest.newBuilder(cbomEndpoint)
			.header("Accept", "application/json")
			.timeout(Duration.ofSeconds(60))
			.GET()
			.build();
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			if (response.statusCode() < 200 || response.statusCode() >= 300) {
				throw CbomAdapterException
					.toolError("CBOMkit returned HTTP " + response.statusCode() + " for " + cbomEndpoint);
			}
			return response.body();
		}
		catch (IOException e) {
			throw CbomAdapterException.toolError("HTTP error retrieving CBOM: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw interrupted(cbomEndpoint.toString());
		}
	}

	private static CbomAdapterException interrupted(String target) {
		return CbomAdapterException.timeout("CBOMkit call to " + target + " was interrupted");
	}

	/**
	 * WebSocket listener tracking one scan: assembles fragmented text frames, logs
	 * distinct progress labels, records when checkout completed, keeps the document of a
	 * {@code CBOM} message and completes {@link #finished()} when the server reports the end
	 * of the scan.
	 */
	static final class ScanProgress implements WebSocket.Listener {

		private final ObjectMapper objectMapper;

		private final CompletableFuture<Void> finished = new CompletableFuture<>();

		private final StringBuilder frame = new StringBuilder();

		private volatile long requestSentNanos = System.nanoTime();

		private volatile long checkoutDoneNanos = -1;

		@Nullable
		private String lastLabel;

		@Nullable
		private volatile String cbom;

		ScanProgress(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
		}

		CompletableFuture<Void> finished() {
			return finished;
		}

		void markRequestSent() {
			this.requestSentNanos = System.nanoTime();
		}

		double elapsedSeconds() {
			long start = checkoutDoneNanos >= 0 ? checkoutDoneNanos : requestSentNanos;
			long end = System.nanoTime();
			return Math.max(0, end - start) / 1_000_000_000.0;
		}

		@Nullable
		String cbom() {
			return cbom;
		}

		boolean checkoutObserved() {
			return checkoutDoneNanos >= 0;
		}

		@Override
		public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
			frame.append(data);
			if (last) {
				String message = frame.toString();
				frame.setLength(0);
				handleMessage(message);
			}
			webSocket.request(1);
			return null;
		}

		@Override
		public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
			if (!finished.isDone()) {
				finished.completeExceptionally(CbomAdapterException
					.toolError("CBOMkit closed the connection before the scan finished (" + statusCode + " " + reason
							+ ")"));
			}
			return null;
		}

		@Override
		public void onError(WebSocket webSocket, Throwable error) {
			finished.completeExceptionally(
					CbomAdapterException.toolError("WebSocket error: " + error.getMessage(), error));
		}

		void handleMessage(String raw) {
			JsonNode message;
			try {
				message = objectMapper.readTree(raw);
			}
			catch (JsonProcessingException e) {
				finished.completeExceptionally(
						CbomAdapterException.unparsableOutput("Undecodable CBOMkit message: " + e.getOriginalMessage()));
				return;
			}

			String type = message.path("type").asText("");
			String text = message.path("message").asText("");

			if ("ERROR".equalsIgnoreCase(type)) {
				finished.completeExceptionally(CbomAdapterException.toolError("CBOMkit reported an error: " + text));
				return;
			}
			if ("CBOM".equalsIgnoreCase(type)) {
				cbom = cbomDocument(message);
				return;
			}
			if ("LABEL".equalsIgnoreCase(type) && !text.equals(lastLabel)) {
				lastLabel = text;
				logger.debug("CBOMkit: {}", text);
			}
			if (CHECKOUT_DONE_MESSAGE.equals(text)) {
				checkoutDoneNanos = System.nanoTime();
				logger.debug("Repository checked out, timing started");
			}
			else if (FINISHED_MESSAGE.equals(text)) {
				finished.complete(null);
			}
		}

		// the document arrives either as JSON text or as an embedded object
		@Nullable
		private String cbomDocument(JsonNode message) {
			JsonNode document = message.path("message");
			if (document.isTextual()) {
				return document.asText().isBlank() ? null : document.asText();
			}
			if (document.isContainerNode()) {
				return document.toString();
			}
			return null;
		}

	}

}

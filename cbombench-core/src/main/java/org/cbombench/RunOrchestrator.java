package org.cbombench;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every benchmark tool against every repository and persists one {@link RunRecord}
 * per (tool, repository) pair.
 *
 * <p>
 * Pairs run on a bounded worker pool, and each tool family may be limited further (see
 * {@link BenchmarkProperties#maxInFlightFor(ToolFamily)}). Each adapter call runs on its
 * own invocation thread under a wall-clock timeout that starts once the pair may run; on
 * timeout only that invocation is interrupted. A failing pair never affects the others:
 * adapter failures, including results that cannot be read, become {@link RunOutcome}s,
 * while unusable repository identifiers and persistence failures abort the whole run.
 * Pairs still running when a run is abandoned are not persisted.
 */
public class RunOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(RunOrchestrator.class);

	private final RunRecordRepository repository;

	private final BranchResolver branchResolver;

	private final ObjectMapper objectMapper;

	private final BenchmarkProperties properties;

	public RunOrchestrator(RunRecordRepository repository, BranchResolver branchResolver, ObjectMapper objectMapper,
			BenchmarkProperties properties) {
		this.repository = repository;
		this.branchResolver = branchResolver;
		this.objectMapper = objectMapper;
		this.properties = properties;
	}

	/**
	 * Run all (tool, repository) pairs.
	 * @param context benchmark context
	 * @param tools tools to run
	 * @param repositories repositories to scan
	 * @return one persisted record per pair, in repository order then tool order
	 * @throws InvalidRepositoryException if a repository URL yields no repository id
	 * @throws RunRecordStoreException if a run record cannot be persisted
	 */
	public List<RunRecord> runAll(BenchmarkContext context, List<BenchmarkTool> tools,
			List<RepositoryTarget> repositories) {
		List<ResolvedRepository> resolved = resolve(repositories);
		List<Pair> pairs = new ArrayList<>();
		for (ResolvedRepository repository : resolved) {
			for (BenchmarkTool tool : tools) {
				pairs.add(new Pair(pairs.size(), tool, repository));
			}
		}
		if (pairs.isEmpty()) {
			logger.info("[{}] Nothing to run", context.sampleId());
			return List.of();
		}

		int workers = Math.min(properties.getMaxInFlight(), pairs.size());
		logger.info("[{}] Running {} tools against {} repositories ({} pairs, {} in flight, {}s timeout)",
				context.sampleId(), tools.size(), resolved.size(), pairs.size(), workers,
				properties.getTimeoutSeconds());

		Map<ToolFamily, Semaphore> familyPermits = new EnumMap<>(ToolFamily.class);
		for (ToolFamily family : ToolFamily.values()) {
			familyPermits.put(family, new Semaphore(properties.maxInFlightFor(family)));
		}
		ExecutorService workerPool = Executors.newFixedThreadPool(workers, threadFactory("cbombench-worker"));
		ExecutorService invocationPool = Executors.newCachedThreadPool(threadFactory("cbombench-invocation"));
		RunState run = new RunState(context, invocationPool, familyPermits, new AtomicBoolean());
		try {
			CompletionService<IndexedRecord> completion = new ExecutorCompletionService<>(workerPool);
			for (Pair pair : pairs) {
				completion.submit(() -> new IndexedRecord(pair.index(), runPair(run, pair)));
			}

			RunRecord[] records = new RunRecord[pairs.size()];
			for (int i = 0; i < pairs.size(); i++) {
				IndexedRecord completed = completion.take().get();
				records[completed.index()] = completed.record();
			}
			return Arrays.asList(records);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Benchmark run " + context.sampleId() + " was interrupted", e);
		}
		catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException runtime) {
				throw runtime;
			}
			throw new IllegalStateException("Benchmark task failed", e.getCause());
		}
		finally {
			// set before interrupting, so interrupted tasks see that their run is over
			run.ended().set(true);
			workerPool.shutdownNow();
			invocationPool.shutdownNow();
		}
	}

	private List<ResolvedRepository> resolve(List<RepositoryTarget> repositories) {
		Map<String, RepositoryTarget> unique = new LinkedHashMap<>();
		for (RepositoryTarget target : repositories) {
			String repositoryId = target.repositoryId();
			if (unique.putIfAbsent(repositoryId, target) != null) {
				logger.warn("Skipping duplicate repository {}", target.url());
			}
		}

		List<ResolvedRepository> resolved = new ArrayList<>();
		for (Map.Entry<String, RepositoryTarget> entry : unique.entrySet()) {
			RepositoryTarget target = entry.getValue();
			RepositoryMetadata metadata = describe(entry.getKey(), target.url());
			String branch = target.branch();
			if (branch == null || branch.isBlank()) {
				branch = metadata.defaultBranch();
				if (branch == null) {
					logger.warn("Could not determine the default branch of {}, using '{}'", entry.getKey(),
							properties.getFallbackBranch());
					branch = properties.getFallbackBranch();
				}
			}
			Integer sizeKb = target.sizeKb() != null ? target.sizeKb() : metadata.sizeKb();
			resolved.add(new ResolvedRepository(entry.getKey(), target.url(), branch, sizeKb,
					metadata.languageSizeKb()));
		}
		return resolved;
	}

	private RepositoryMetadata describe(String repositoryId, String url) {
		try {
			return branchResolver.describe(url);
		}
		catch (RuntimeException e) {
			logger.warn("Could not look up {}: {}", repositoryId, e.getMessage());
			return RepositoryMetadata.UNKNOWN;
		}
	}

	private RunRecord runPair(RunState run, Pair pair) {
		Semaphore permits = run.familyPermits().get(pair.tool().family());
		try {
			permits.acquire();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting to run " + pair.tool().toolId() + " on "
					+ pair.repository().id(), e);
		}
		try {
			return invoke(run, pair);
		}
		finally {
			permits.release();
		}
	}

	private RunRecord invoke(RunState run, Pair pair) {
		BenchmarkContext context = run.context();
		BenchmarkTool tool = pair.tool();
		ResolvedRepository target = pair.repository();
		Instant startedAt = context.now();
		long startNanos = System.nanoTime();
		logger.info("[{}] Running {} on {} ({})", context.sampleId(), tool.toolId(), target.id(), target.branch());

		Future<GeneratedCbom> invocation = run.invocationPool()
			.submit(() -> tool.adapter().generate(target.url(), target.branch()));

		RunOutcome outcome;
		@Nullable Double reportedDuration = null;
		try {
			GeneratedCbom generated = invocation.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
			if (generated == null) {
				outcome = new RunOutcome.MalformedOutput("Adapter returned no result", null);
			}
			else {
				outcome = parseDocument(generated.document());
				reportedDuration = generated.durationSeconds();
			}
		}
		catch (TimeoutException e) {
			invocation.cancel(true);
			outcome = new RunOutcome.Timeout(properties.getTimeoutSeconds());
		}
		catch (ExecutionException e) {
			outcome = classify(e.getCause());
		}
		catch (InterruptedException e) {
			invocation.cancel(true);
			Thread.currentThread().interrupt();
			outcome = new RunOutcome.ToolError("Invocation was interrupted");
		}

		double elapsed = (System.nanoTime() - startNanos) / 1_000_000_000.0;
		double duration = elapsed;
		if (outcome instanceof RunOutcome.Success && reportedDuration != null) {
			if (reportedDuration >= 0 && Double.isFinite(reportedDuration)) {
				duration = reportedDuration;
			}
			else {
				logger.warn("[{}] {} reported an invalid duration ({}) for {}, using wall-clock time",
						context.sampleId(), tool.toolId(), reportedDuration, target.id());
			}
		}

		RunRecord record = new RunRecord(tool.toolId(), tool.family(), target.id(), target.url(), target.branch(),
				context.sampleId(), startedAt, duration, outcome, target.sizeKb(), target.languageSizeKb());
		if (run.ended().get()) {
			logger.debug("[{}] Run was abandoned, not saving {} on {}", context.sampleId(), tool.toolId(),
					target.id());
			return record;
		}
		repository.save(record);
		log(context, record);
		return record;
	}

	private RunOutcome parseDocument(@Nullable String text) {
		if (text == null) {
			return new RunOutcome.MalformedOutput("Adapter returned no document", null);
		}
		try {
			JsonNode document = objectMapper.readTree(text);
			if (document == null || !document.isContainerNode()) {
				return new RunOutcome.MalformedOutput("Output is not a JSON object or array", text);
			}
			return new RunOutcome.Success(document);
		}
		catch (JsonProcessingException e) {
			return new RunOutcome.MalformedOutput("Output is not valid JSON: " + e.getOriginalMessage(), text);
		}
		catch (RuntimeException e) {
			return new RunOutcome.MalformedOutput("Output could not be read: " + e.getMessage(), text);
		}
	}

	private RunOutcome classify(@Nullable Throwable failure) {
		if (failure == null) {
			return new RunOutcome.ToolError("Adapter failed without a cause");
		}
		if (failure instanceof CbomAdapterException adapterFailure) {
			String message = Objects.requireNonNullElse(adapterFailure.getMessage(), adapterFailure.getKind().name());
			return switch (adapterFailure.getKind()) {
				case TIMEOUT -> new RunOutcome.Timeout(properties.getTimeoutSeconds());
				case TOOL_ERROR -> new RunOutcome.ToolError(message);
				case UNPARSABLE_OUTPUT -> new RunOutcome.MalformedOutput(message, null);
			};
		}
		if (failure instanceof Error error) {
			throw error;
		}
		return new RunOutcome.ToolError(failure.getClass().getSimpleName()
				+ (failure.getMessage() != null ? ": " + failure.getMessage() : ""));
	}

	private static void log(BenchmarkContext context, RunRecord record) {
		RunOutcome outcome = record.outcome();
		if (outcome instanceof RunOutcome.Success) {
			logger.info("[{}] {} on {} succeeded in {}s", context.sampleId(), record.toolId(), record.repositoryId(),
					String.format("%.1f", record.durationSeconds()));
		}
		else {
			logger.warn("[{}] {} on {} ended with {}: {}", context.sampleId(), record.toolId(), record.repositoryId(),
					outcome.kind(), describe(outcome));
		}
	}

	private static String describe(RunOutcome outcome) {
		if (outcome instanceof RunOutcome.Timeout timeout) {
			return "no result within " + timeout.timeoutSeconds() + "s";
		}
		if (outcome instanceof RunOutcome.ToolError error) {
			return error.message();
		}
		if (outcome instanceof RunOutcome.MalformedOutput malformed) {
			return malformed.message();
		}
		return outcome.kind().name();
	}

	private static ThreadFactory threadFactory(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private record ResolvedRepository(String id, String url, String branch, @Nullable Integer sizeKb,
			@Nullable Integer languageSizeKb) {
	}

	/**
	 * Shared state of one {@link #runAll} call. {@code ended} is set once the call has
	 * returned or thrown.
	 */
	private record RunState(BenchmarkContext context, ExecutorService invocationPool,
			Map<ToolFamily, Semaphore> familyPermits, AtomicBoolean ended) {
	}

	private record Pair(int index, BenchmarkTool tool, ResolvedRepository repository) {
	}

	private record IndexedRecord(int index, RunRecord record) {
	}

}

package org.cbombench;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns stored {@link RunRecord}s into canonical {@link NormalizationResult}s.
 *
 * <p>
 * Normalization is deterministic: the same record always yields the same asset set, in
 * canonical key order. Only successful runs produce an {@link NormalizationResult.AssetSet};
 * every other outcome produces an {@link NormalizationResult.AbsentAssetSet} carrying the
 * failure reason.
 */
public class AssetNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(AssetNormalizer.class);

	private final Map<ToolFamily, AssetExtractor> extractors;

	public AssetNormalizer(List<AssetExtractor> extractors) {
		this.extractors = new EnumMap<>(ToolFamily.class);
		for (AssetExtractor extractor : extractors) {
			this.extractors.put(extractor.family(), extractor);
		}
		for (ToolFamily family : ToolFamily.values()) {
			if (!this.extractors.containsKey(family)) {
				throw new IllegalArgumentException("No asset extractor registered for " + family);
			}
		}
	}

	/**
	 * Normalizer with the built-in extractor of every tool family.
	 */
	public static AssetNormalizer withDefaultExtractors(JsonNodeUtils jsonNodeUtils) {
		return new AssetNormalizer(List.of(new CbomkitAssetExtractor(jsonNodeUtils),
				new CdxgenAssetExtractor(jsonNodeUtils), new DeepSeekAssetExtractor(jsonNodeUtils)));
	}

	public NormalizationResult normalize(BenchmarkContext context, RunRecord record) {
		RunOutcome outcome = record.outcome();
		if (outcome instanceof RunOutcome.Success success) {
			return normalizeDocument(context, record, success);
		}
		return new NormalizationResult.AbsentAssetSet(record.toolId(), record.repositoryId(), outcome.kind(),
				describe(outcome));
	}

	private NormalizationResult.AssetSet normalizeDocument(BenchmarkContext context, RunRecord record,
			RunOutcome.Success success) {
		AssetExtractor extractor = extractors.get(record.toolFamily());
		AssetExtractor.Extraction extraction = extractor.extract(success.document());

		Map<AssetKey, Asset> assets = new TreeMap<>();
		int dropped = extraction.dropped();
		int extracted = 0;
		int merged = 0;
		for (AssetExtractor.Candidate candidate : extraction.candidates()) {
			Asset asset;
			AssetKey key;
			try {
				asset = toAsset(candidate, record);
				key = asset.key();
			}
			catch (IllegalArgumentException e) {
				logger.debug("Dropping '{}' from {} for {}: {}", candidate.name(), record.toolId(),
						record.repositoryId(), e.getMessage());
				dropped++;
				continue;
			}
			extracted++;
			Asset existing = assets.get(key);
			if (existing == null) {
				assets.put(key, asset);
			}
			else {
				merged++;
				if (isMoreConfident(asset, existing)) {
					assets.put(key, asset);
				}
			}
		}

		NormalizationReport report = new NormalizationReport(extraction.entriesSeen(), extracted, dropped,
				extraction.ignored(), merged, extraction.containerFound());
		if (!extraction.containerFound()) {
			logger.warn("[{}] {} document for {} has no recognizable asset container", context.sampleId(),
					record.toolId(), record.repositoryId());
		}
		if (dropped > 0) {
			logger.info("[{}] Dropped {} unreadable entries from {} document for {}", context.sampleId(), dropped,
					record.toolId(), record.repositoryId());
		}
		logger.debug("[{}] Normalized {} for {}: {}", context.sampleId(), record.toolId(), record.repositoryId(),
				report);
		return new NormalizationResult.AssetSet(record.toolId(), record.repositoryId(), new ArrayList<>(assets.values()),
				report);
	}

	private static Asset toAsset(AssetExtractor.Candidate candidate, RunRecord record) {
		AlgorithmAliases.Resolution resolution = AlgorithmAliases.resolve(candidate.name());
		if (resolution.algorithmFamily().isBlank()) {
			throw new IllegalArgumentException("algorithm name is blank");
		}
		Integer keySize = candidate.keySize() != null ? candidate.keySize() : resolution.keySize();
		return new Asset(resolution.algorithmFamily(), primitiveOf(candidate.primitive(), resolution), keySize,
				candidate.location(), candidate.confidence(), record.toolId(), record.repositoryId(), candidate.name(),
				resolution.recognized());
	}

	private static String primitiveOf(@Nullable String toolPrimitive, AlgorithmAliases.Resolution resolution) {
		if (toolPrimitive != null) {
			String canonical = AlgorithmAliases.canonicalPrimitive(toolPrimitive);
			if (!canonical.isBlank() && !canonical.equals(AlgorithmAliases.UNKNOWN_PRIMITIVE)) {
				return canonical;
			}
		}
		return resolution.defaultPrimitive() != null ? resolution.defaultPrimitive()
				: AlgorithmAliases.UNKNOWN_PRIMITIVE;
	}

	private static boolean isMoreConfident(Asset candidate, Asset existing) {
		if (candidate.confidence() == null) {
			return false;
		}
		return existing.confidence() == null || candidate.confidence() > existing.confidence();
	}

	private static String describe(RunOutcome outcome) {
		if (outcome instanceof RunOutcome.Timeout timeout) {
			return "Timed out after " + timeout.timeoutSeconds() + " seconds";
		}
		if (outcome instanceof RunOutcome.ToolError error) {
			return error.message();
		}
		if (outcome instanceof RunOutcome.MalformedOutput malformed) {
			return malformed.message();
		}
		return outcome.kind().name();
	}

}

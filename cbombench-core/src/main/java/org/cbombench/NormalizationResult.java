package org.cbombench;

import java.util.List;

/**
 * Outcome of normalizing one {@link RunRecord}: an {@link AssetSet} for successful runs,
 * an {@link AbsentAssetSet} for every other outcome. An empty asset set and an absent one
 * are never the same thing.
 */
public sealed interface NormalizationResult permits NormalizationResult.AssetSet, NormalizationResult.AbsentAssetSet {

	String toolId();

	String repositoryId();

	/**
	 * Assets of one (tool, repository) pair, sorted by canonical key and unique per key.
	 */
	record AssetSet(String toolId, String repositoryId, List<Asset> assets,
			NormalizationReport report) implements NormalizationResult {

		public AssetSet {
			assets = List.copyOf(assets);
		}

		public int size() {
			return assets.size();
		}

		public List<AssetKey> keys() {
			return assets.stream().map(Asset::key).toList();
		}

		public long unrecognizedCount() {
			return assets.stream().filter(asset -> !asset.recognized()).count();
		}

	}

	/**
	 * Marker for a pair whose run did not produce a usable document.
	 *
	 * @param reason outcome of the run
	 * @param message human readable failure description
	 */
	record AbsentAssetSet(String toolId, String repositoryId, OutcomeKind reason,
			String message) implements NormalizationResult {

	}

}

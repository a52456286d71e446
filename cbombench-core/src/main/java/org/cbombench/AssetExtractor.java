package org.cbombench;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Locates cryptographic-asset entries in the document shape of one {@link ToolFamily} and
 * reads their raw fields. Alias resolution and de-duplication happen later, in
 * {@link AssetNormalizer}.
 *
 * <p>
 * Implementations must not throw for malformed entries; an entry that cannot be read is
 * counted as dropped.
 */
public interface AssetExtractor {

	ToolFamily family();

	Extraction extract(JsonNode document);

	/**
	 * Raw fields of one cryptographic entry.
	 *
	 * @param name algorithm name as written by the tool
	 * @param primitive tool-supplied primitive, if any
	 * @param keySize key size read from a dedicated field, if any
	 * @param location location hint, if any
	 * @param confidence tool-reported confidence, if any
	 */
	record Candidate(String name, @Nullable String primitive, @Nullable Integer keySize, @Nullable String location,
			@Nullable Double confidence) {
	}

	/**
	 * Everything an extractor found in one document.
	 *
	 * @param candidates entries that yielded a name, in document order
	 * @param entriesSeen entries in the asset container
	 * @param dropped cryptographic entries without a usable name
	 * @param ignored non-cryptographic entries
	 * @param containerFound whether an asset container was present
	 */
	record Extraction(List<Candidate> candidates, int entriesSeen, int dropped, int ignored, boolean containerFound) {

		public Extraction {
			candidates = List.copyOf(candidates);
		}

		public static Extraction noContainer() {
			return new Extraction(List.of(), 0, 0, 0, false);
		}

	}

}

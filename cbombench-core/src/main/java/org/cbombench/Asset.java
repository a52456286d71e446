package org.cbombench;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A canonical cryptographic finding derived from one tool's raw document.
 *
 * <p>
 * Equality is defined by the canonical {@link #key()} together with the source tool and
 * repository. Location, confidence and the original name are descriptive only.
 *
 * @param algorithmFamily canonical algorithm family
 * @param primitiveKind canonical primitive kind
 * @param keySize key size in bits, if known
 * @param locationHint where the tool saw the asset, free text
 * @param confidence tool-reported confidence
 * @param sourceTool id of the tool that reported the asset
 * @param sourceRepository id of the scanned repository
 * @param originalName the algorithm name as the tool wrote it
 * @param recognized {@code false} when the name was not found in the alias table
 */
public record Asset(String algorithmFamily, String primitiveKind, @Nullable Integer keySize,
		@Nullable String locationHint, @Nullable Double confidence, String sourceTool, String sourceRepository,
		String originalName, boolean recognized) {

	public AssetKey key() {
		return new AssetKey(algorithmFamily, primitiveKind, keySize);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Asset other)) {
			return false;
		}
		return algorithmFamily.equals(other.algorithmFamily) && primitiveKind.equals(other.primitiveKind)
				&& Objects.equals(keySize, other.keySize) && sourceTool.equals(other.sourceTool)
				&& sourceRepository.equals(other.sourceRepository);
	}

	@Override
	public int hashCode() {
		return Objects.hash(algorithmFamily, primitiveKind, keySize, sourceTool, sourceRepository);
	}

}

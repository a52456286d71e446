package org.cbombench;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Extracts assets from CBOMkit's API response: an array of scan entries whose first
 * element carries the CBOM under {@code bom}. Plain CycloneDX objects are accepted too.
 */
public class CbomkitAssetExtractor extends CycloneDxAssetExtractor {

	public CbomkitAssetExtractor(JsonNodeUtils jsonNodeUtils) {
		super(jsonNodeUtils);
	}

	@Override
	public ToolFamily family() {
		return ToolFamily.CBOMKIT;
	}

	@Override
	protected Optional<List<JsonNode>> locateComponents(JsonNode document) {
		if (document.isArray()) {
			if (document.isEmpty()) {
				return Optional.empty();
			}
			return components(document.get(0).path("bom"));
		}
		return components(document).or(() -> components(document.path("bom")));
	}

	private Optional<List<JsonNode>> components(JsonNode node) {
		return node.path("components").isArray() ? Optional.of(jsonNodeUtils.getArray(node, "components"))
				: Optional.empty();
	}

}

package org.cbombench;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Extracts assets from a cdxgen CBOM. Library and file components share the component
 * list with cryptographic assets and are counted as ignored.
 */
public class CdxgenAssetExtractor extends CycloneDxAssetExtractor {

	public CdxgenAssetExtractor(JsonNodeUtils jsonNodeUtils) {
		super(jsonNodeUtils);
	}

	@Override
	public ToolFamily family() {
		return ToolFamily.CDXGEN;
	}

	@Override
	protected Optional<List<JsonNode>> locateComponents(JsonNode document) {
		if (!document.path("components").isArray()) {
			return Optional.empty();
		}
		return Optional.of(jsonNodeUtils.getArray(document, "components"));
	}

}
